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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.model.HistoryEntry;
import me.golemcore.memoria.domain.model.TopicProfile;
import me.golemcore.memoria.domain.model.TopicProfileHeader;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes topic profile documents: a YAML metadata block followed by
 * a Markdown body with Overview, Prior Contexts, User Opinions and Other Notes
 * sections.
 *
 * <p>
 * History lists are written twice: structurally under {@code context_history}
 * and {@code opinion_history} in the metadata block, and as bullet lines in the
 * body for human readers. Parsing prefers the structured copy and falls back to
 * the bullet lines for documents written by hand or by older versions.
 */
@Component
@Slf4j
public class TopicProfileCodec {

    public static final String SECTION_OVERVIEW = "Overview";
    public static final String SECTION_CONTEXTS = "Prior Contexts";
    public static final String SECTION_OPINIONS = "User Opinions";
    public static final String SECTION_OTHER_NOTES = "Other Notes";
    public static final String UNKNOWN_DATE = "Unknown Date";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter ENTRY_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    // - **2024/05/01 [[SN-x.md]]**: text   or   - **[[SN-x.md]]**: text
    private static final Pattern BOLD_ENTRY = Pattern.compile("^\\s*[-*]\\s+\\*\\*(?:[^\\[*]*?\\s)?(\\[\\[[^\\]]+\\]\\])\\*\\*:\\s?(.*)$");
    // - [[SN-x.md]]: text
    private static final Pattern PLAIN_ENTRY = Pattern.compile("^\\s*[-*]\\s+(?:[^\\[]*?\\s)?(\\[\\[[^\\]]+\\]\\]):\\s?(.*)$");

    private final ObjectMapper yamlMapper;

    public TopicProfileCodec() {
        YAMLFactory yamlFactory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        this.yamlMapper = new ObjectMapper(yamlFactory)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String render(TopicProfile profile) {
        TopicProfileHeader header = TopicProfileHeader.builder()
                .tagName(profile.getTopic())
                .aliases(copy(profile.getAliases()))
                .createdDate(formatTimestamp(profile.getCreatedAt()))
                .updatedDate(formatTimestamp(profile.getUpdatedAt()))
                .keyThemes(copy(profile.getKeyThemes()))
                .userSentiment(new TopicProfileHeader.Sentiment(
                        profile.getSentimentOverall(), copy(profile.getSentimentDetails())))
                .significance(profile.getSignificance())
                .relatedTags(copy(profile.getRelatedTopics()))
                .summaryNotes(copy(profile.getSummaryRefs()))
                .lastMentionedIn(profile.getLastReferencedRecord())
                .mentionFrequency(profile.getMentionCount() > 0 ? profile.getMentionCount() : null)
                .contextHistory(copyEntries(profile.getContexts()))
                .opinionHistory(copyEntries(profile.getOpinions()))
                .build();

        String frontmatter;
        try {
            frontmatter = yamlMapper.writeValueAsString(header);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize profile header for " + profile.getTopic(), e);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("---\n").append(frontmatter.stripTrailing()).append("\n---\n\n");
        sb.append(renderBody(profile));
        return sb.toString();
    }

    public String renderBody(TopicProfile profile) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(profile.getTopic()).append("\n\n");

        sb.append("## ").append(SECTION_OVERVIEW).append("\n\n");
        appendParagraph(sb, profile.getOverview());

        sb.append("## ").append(SECTION_CONTEXTS).append("\n\n");
        sb.append(renderContextLines(profile.getContexts()));
        sb.append("\n");

        sb.append("## ").append(SECTION_OPINIONS).append("\n\n");
        sb.append(renderOpinionLines(profile.getOpinions()));
        sb.append("\n");

        sb.append("## ").append(SECTION_OTHER_NOTES).append("\n\n");
        appendParagraph(sb, profile.getOtherNotes());
        return sb.toString();
    }

    public String renderContextLines(List<HistoryEntry> entries) {
        StringBuilder sb = new StringBuilder();
        if (entries == null) {
            return "";
        }
        for (HistoryEntry entry : entries) {
            sb.append("- **").append(entryDate(entry.getReference())).append(' ')
                    .append(entry.getReference()).append("**: ")
                    .append(MemoryNoteSupport.singleLine(entry.getText())).append('\n');
        }
        return sb.toString();
    }

    public String renderOpinionLines(List<HistoryEntry> entries) {
        StringBuilder sb = new StringBuilder();
        if (entries == null) {
            return "";
        }
        for (HistoryEntry entry : entries) {
            sb.append("- **").append(entry.getReference()).append("**: ")
                    .append(MemoryNoteSupport.singleLine(entry.getText())).append('\n');
        }
        return sb.toString();
    }

    /**
     * Parses a profile document.
     *
     * @return the profile, or {@code null} when the metadata block is missing
     *         or unreadable
     */
    public TopicProfile parse(String content) {
        MemoryNoteSupport.NoteParts parts = MemoryNoteSupport.split(content);
        if (parts.frontmatter() == null) {
            return null;
        }

        TopicProfileHeader header;
        try {
            header = yamlMapper.readValue(parts.frontmatter(), TopicProfileHeader.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Profile] Unreadable metadata block: {}", e.getMessage());
            return null;
        }
        if (header == null) {
            return null;
        }

        String body = parts.body();
        TopicProfileHeader.Sentiment sentiment = header.getUserSentiment();
        List<HistoryEntry> contexts = header.getContextHistory() != null
                ? copyEntries(header.getContextHistory())
                : parseHistoryLines(MemoryNoteSupport.extractSection(body, SECTION_CONTEXTS));
        List<HistoryEntry> opinions = header.getOpinionHistory() != null
                ? copyEntries(header.getOpinionHistory())
                : parseHistoryLines(MemoryNoteSupport.extractSection(body, SECTION_OPINIONS));

        return TopicProfile.builder()
                .topic(header.getTagName())
                .aliases(copy(header.getAliases()))
                .keyThemes(copy(header.getKeyThemes()))
                .sentimentOverall(sentiment != null ? sentiment.getOverall() : null)
                .sentimentDetails(sentiment != null ? copy(sentiment.getDetails()) : new ArrayList<>())
                .significance(header.getSignificance())
                .relatedTopics(copy(header.getRelatedTags()))
                .summaryRefs(copy(header.getSummaryNotes()))
                .overview(MemoryNoteSupport.extractSection(body, SECTION_OVERVIEW))
                .contexts(contexts)
                .opinions(opinions)
                .otherNotes(MemoryNoteSupport.extractSection(body, SECTION_OTHER_NOTES))
                .createdAt(parseTimestamp(header.getCreatedDate()))
                .updatedAt(parseTimestamp(header.getUpdatedDate()))
                .lastReferencedRecord(header.getLastMentionedIn())
                .mentionCount(header.getMentionFrequency() != null ? header.getMentionFrequency() : 0)
                .build();
    }

    /**
     * Recovers {@code (reference, text)} pairs from rendered bullet lines. Lines
     * without a {@code [[link]]} are skipped.
     */
    public List<HistoryEntry> parseHistoryLines(String section) {
        List<HistoryEntry> entries = new ArrayList<>();
        if (section == null || section.isBlank()) {
            return entries;
        }
        for (String line : section.split("\\R")) {
            Matcher matcher = BOLD_ENTRY.matcher(line);
            if (!matcher.matches()) {
                matcher = PLAIN_ENTRY.matcher(line);
                if (!matcher.matches()) {
                    continue;
                }
            }
            entries.add(new HistoryEntry(matcher.group(1).trim(), matcher.group(2).trim()));
        }
        return entries;
    }

    private String entryDate(String reference) {
        LocalDate date = MemoryNoteSupport.dateFromName(reference);
        return date != null ? date.format(ENTRY_DATE_FORMAT) : UNKNOWN_DATE;
    }

    private void appendParagraph(StringBuilder sb, String text) {
        if (text != null && !text.isBlank()) {
            sb.append(text.strip()).append('\n');
        }
        sb.append('\n');
    }

    private static String formatTimestamp(LocalDateTime timestamp) {
        return timestamp != null ? timestamp.format(TIMESTAMP_FORMAT) : null;
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value.trim()).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static List<HistoryEntry> copyEntries(List<HistoryEntry> entries) {
        List<HistoryEntry> result = new ArrayList<>();
        if (entries == null) {
            return result;
        }
        for (HistoryEntry entry : entries) {
            if (entry != null && entry.getReference() != null) {
                result.add(new HistoryEntry(entry.getReference(),
                        entry.getText() != null ? entry.getText() : ""));
            }
        }
        return result;
    }
}
