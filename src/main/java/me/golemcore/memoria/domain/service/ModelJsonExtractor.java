package me.golemcore.memoria.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.memoria.domain.exception.ModelResponseParseException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes JSON embedded in free-form model output.
 *
 * <p>
 * Candidates are tried in order: the body of a fenced code block, the whole
 * trimmed text, then the outermost object or array found in the text. The
 * first candidate that decodes into the requested type wins.
 */
@Component
@RequiredArgsConstructor
public class ModelJsonExtractor {

    private static final Pattern FENCED_PATTERN = Pattern.compile("```(?:json|JSON)?\\s*(.*?)\\s*```",
            Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public <T> T readObject(String response, Class<T> type) {
        return read(response, objectMapper.constructType(type), '{', '}');
    }

    public <T> List<T> readList(String response, Class<T> elementType) {
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        return read(response, listType, '[', ']');
    }

    private <T> T read(String response, JavaType type, char open, char close) {
        if (response == null || response.isBlank()) {
            throw new ModelResponseParseException("Model response is empty");
        }

        JsonProcessingException lastError = null;
        for (String candidate : candidates(response, open, close)) {
            try {
                T value = objectMapper.readValue(candidate, type);
                if (value != null) {
                    return value;
                }
            } catch (JsonProcessingException e) {
                lastError = e;
            }
        }
        throw new ModelResponseParseException("Model response is not valid JSON for "
                + type.getRawClass().getSimpleName(), lastError);
    }

    private List<String> candidates(String response, char open, char close) {
        List<String> candidates = new ArrayList<>();
        Matcher matcher = FENCED_PATTERN.matcher(response);
        if (matcher.find()) {
            candidates.add(matcher.group(1));
        }
        candidates.add(response.trim());

        int start = response.indexOf(open);
        int end = response.lastIndexOf(close);
        if (start >= 0 && end > start) {
            candidates.add(response.substring(start, end + 1));
        }
        return candidates;
    }
}
