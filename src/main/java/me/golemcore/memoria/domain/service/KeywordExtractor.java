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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.exception.LlmCallException;
import me.golemcore.memoria.domain.exception.ModelResponseParseException;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.domain.model.ScoredKeyword;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Asks the keyword model which known topics an utterance touches, plus a few
 * new candidate topics, each scored for its weight in the utterance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KeywordExtractor {

    static final int MAX_EXISTING_TOPICS = 3;
    static final int MAX_NEW_TOPICS = 2;

    static final String DEFAULT_PROMPT = """
            The user's current message is: "{userPrompt}"
            The message is addressed to the character "{personaName}".
            The knowledge base already contains these topics:
            {existingTopics}

            Tasks:
            1. Select up to %d existing topics from the list above that are most relevant to the message.
            2. If the existing topics are not enough, or an important concept of the message is not covered, \
            propose up to %d new keywords. New keywords must not duplicate existing topics.
            3. Score every selected topic or new keyword from 0 to 100 for its relative importance in this message.

            Answer with a JSON array of objects holding the topic or keyword ("keyword") and its score ("score"), e.g.
            [
              { "keyword": "Existing topic A", "score": 90 },
              { "keyword": "New keyword X", "score": 75 }
            ]

            If nothing fits, answer with an empty array [].
            Return only the JSON, no other text.
            """.formatted(MAX_EXISTING_TOPICS, MAX_NEW_TOPICS);

    private final LlmCallSupport llmCallSupport;
    private final ModelJsonExtractor jsonExtractor;
    private final MemoriaProperties properties;

    /**
     * Extracts scored keywords. Never throws; any model or parse failure yields
     * an empty list.
     */
    public List<ScoredKeyword> extract(String userPrompt, String personaName, Collection<String> knownTopics) {
        if (userPrompt == null || userPrompt.isBlank()) {
            return List.of();
        }

        String prompt = buildPrompt(userPrompt, personaName, knownTopics);
        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().resolveKeywordModel())
                .temperature(0.0)
                .purpose("keywords")
                .build();
        request.addMessage(Message.user(prompt));

        String response;
        try {
            response = llmCallSupport.call(request, properties.getRetrieval().getLlmCallTimeoutMs());
        } catch (LlmCallException e) {
            log.warn("[KeywordExtractor] Model call failed: {}", e.getMessage());
            return List.of();
        }
        log.debug("[KeywordExtractor] Raw response: {}", response);

        List<KeywordCandidate> candidates;
        try {
            candidates = jsonExtractor.readList(response, KeywordCandidate.class);
        } catch (ModelResponseParseException e) {
            log.warn("[KeywordExtractor] Unparsable response, assuming no keywords: {}", e.getMessage());
            return List.of();
        }

        List<ScoredKeyword> keywords = new ArrayList<>();
        for (KeywordCandidate candidate : candidates) {
            if (candidate == null || candidate.getKeyword() == null || candidate.getKeyword().isBlank()) {
                continue;
            }
            double score = Math.max(0, Math.min(100, candidate.getScore()));
            keywords.add(new ScoredKeyword(candidate.getKeyword().trim(), score));
        }
        log.info("[KeywordExtractor] Extracted {} keyword(s)", keywords.size());
        return keywords;
    }

    String buildPrompt(String userPrompt, String personaName, Collection<String> knownTopics) {
        String template = properties.getPrompts().getKeywordExtraction();
        if (template == null || template.isBlank()) {
            template = DEFAULT_PROMPT;
        }
        String topics = knownTopics == null || knownTopics.isEmpty() ? "none" : String.join(", ", knownTopics);
        return MemoryNoteSupport.fillTemplate(template, Map.of(
                "userPrompt", Objects.toString(userPrompt, ""),
                "personaName", Objects.toString(personaName, ""),
                "existingTopics", topics));
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeywordCandidate {
        private String keyword;
        private double score;
    }
}
