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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.model.SummaryRecord;
import me.golemcore.memoria.domain.model.SummaryRecordHeader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes conversation summary documents.
 */
@Component
@Slf4j
public class SummaryRecordCodec {

    public static final String SECTION_SUMMARY = "Summary";

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper yamlMapper;

    public SummaryRecordCodec() {
        YAMLFactory yamlFactory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        this.yamlMapper = new ObjectMapper(yamlFactory)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Parses a summary document.
     *
     * @param name
     *            document name, with or without {@code .md}
     * @return the record, or {@code null} when the metadata block is missing or
     *         unreadable
     */
    public SummaryRecord parse(String name, String content) {
        MemoryNoteSupport.NoteParts parts = MemoryNoteSupport.split(content);
        if (parts.frontmatter() == null) {
            return null;
        }

        SummaryRecordHeader header;
        try {
            header = yamlMapper.readValue(parts.frontmatter(), SummaryRecordHeader.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Summary] Unreadable metadata block in {}: {}", name, e.getMessage());
            return null;
        }
        if (header == null) {
            return null;
        }

        return SummaryRecord.builder()
                .name(MemoryNoteSupport.cleanReference(name))
                .title(header.getTitle())
                .date(header.getDate())
                .participants(copy(header.getParticipants()))
                .topics(copy(header.getTags()))
                .fullTranscriptRef(header.getFullLog())
                .mood(header.getMood())
                .keyTakeaways(copy(header.getKeyTakeaways()))
                .actionItems(copy(header.getActionItems()))
                .body(parts.body())
                .rawText(content)
                .build();
    }

    public String render(SummaryRecord record) {
        SummaryRecordHeader header = SummaryRecordHeader.builder()
                .title(record.getTitle())
                .date(record.getDate())
                .participants(copy(record.getParticipants()))
                .tags(copy(record.getTopics()))
                .fullLog(record.getFullTranscriptRef())
                .mood(record.getMood())
                .keyTakeaways(copy(record.getKeyTakeaways()))
                .actionItems(copy(record.getActionItems()))
                .build();

        String frontmatter;
        try {
            frontmatter = yamlMapper.writeValueAsString(header);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize summary header for " + record.getName(), e);
        }

        String body = record.getBody() != null ? record.getBody().strip() : "";
        return "---\n" + frontmatter.stripTrailing() + "\n---\n\n" + body + "\n";
    }

    /**
     * Records the summary title and a link to the summary record in the
     * metadata block of a transcript, creating the block when absent. Other
     * metadata keys are kept.
     */
    public String linkTranscript(String transcriptContent, String title, String summaryReference) {
        MemoryNoteSupport.NoteParts parts = MemoryNoteSupport.split(transcriptContent);
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (parts.frontmatter() != null) {
            try {
                Map<String, Object> existing = yamlMapper.readValue(parts.frontmatter(), METADATA_TYPE);
                if (existing != null) {
                    metadata.putAll(existing);
                }
            } catch (JsonProcessingException e) {
                log.warn("[Summary] Transcript metadata is unreadable, replacing it: {}", e.getOriginalMessage());
            }
        }
        metadata.put("title", title);
        metadata.put("summary_note", summaryReference);

        try {
            String frontmatter = yamlMapper.writeValueAsString(metadata);
            return "---\n" + frontmatter.stripTrailing() + "\n---\n" + parts.body();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transcript metadata", e);
        }
    }

    /**
     * Short excerpt of the summary: the {@code ## Summary} section when present,
     * otherwise the first paragraph of the body.
     */
    public String excerpt(SummaryRecord record, int maxChars) {
        String body = record.getBody() != null ? record.getBody() : "";
        String section = MemoryNoteSupport.extractSection(body, SECTION_SUMMARY);
        if (!section.isEmpty()) {
            return MemoryNoteSupport.truncate(section, maxChars, "...");
        }
        return MemoryNoteSupport.truncate(firstParagraph(body), maxChars, "...");
    }

    private static String firstParagraph(String body) {
        for (String block : body.strip().split("\\n\\s*\\n")) {
            String trimmed = block.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return trimmed;
            }
        }
        return "";
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
