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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.model.RankedTopic;
import me.golemcore.memoria.domain.model.RetrievedContextItem;
import me.golemcore.memoria.domain.model.SourceTier;
import me.golemcore.memoria.domain.model.SummaryRecord;
import me.golemcore.memoria.domain.model.TopicProfile;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import me.golemcore.memoria.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Loads memory documents of the three tiers and renders them into bounded
 * context items. All reads are side-effect free; missing or unreadable
 * documents are skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TieredContextFetcher {

    static final String PROFILE_TRUNCATED_MARKER = "... (profile truncated)";
    static final String NO_RELATED_INFORMATION = "No related information";
    static final int SUMMARY_EXCERPT_CHARS = 500;

    private static final DateTimeFormatter ITEM_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final StoragePort storagePort;
    private final MemoriaProperties properties;
    private final TopicProfileCodec profileCodec;
    private final SummaryRecordCodec summaryCodec;

    // ==================== TIER 1 ====================

    /**
     * Renders the profiles of the first {@code maxTopics} ranked topics.
     */
    public List<RetrievedContextItem> fetchProfiles(List<RankedTopic> rankedTopics) {
        List<RetrievedContextItem> items = new ArrayList<>();
        if (rankedTopics == null || rankedTopics.isEmpty()) {
            return items;
        }

        MemoriaProperties.RetrievalProperties retrieval = properties.getRetrieval();
        int maxTopics = Math.max(1, retrieval.getMaxTopics());
        int snippetBudget = Math.max(0,
                retrieval.getMaxContextLength() / maxTopics - retrieval.getProfileSnippetOverhead());

        for (RankedTopic rankedTopic : rankedTopics.subList(0, Math.min(maxTopics, rankedTopics.size()))) {
            String fileName = MemoryNoteSupport.profileFileName(rankedTopic.topic());
            String content = read(properties.getStorage().getDirectories().getProfiles(), fileName);
            if (content == null) {
                log.debug("[Fetcher] No profile for topic '{}'", rankedTopic.topic());
                continue;
            }
            TopicProfile profile = profileCodec.parse(content);
            if (profile == null) {
                log.warn("[Fetcher] Profile {} has no readable metadata, skipping", fileName);
                continue;
            }

            String snippet = MemoryNoteSupport.truncate(renderProfile(rankedTopic.topic(), profile).trim(),
                    snippetBudget, PROFILE_TRUNCATED_MARKER);
            String sourceName = fileName.substring(0, fileName.length() - MemoryNoteSupport.NOTE_EXTENSION.length());
            items.add(RetrievedContextItem.builder()
                    .tier(SourceTier.PROFILE)
                    .sourceName(sourceName)
                    .title("Topic profile: " + rankedTopic.topic())
                    .date(profileDate(profile))
                    .snippet(snippet.isBlank() ? NO_RELATED_INFORMATION : snippet)
                    .relevance(rankedTopic.score())
                    .build());
        }
        log.info("[Fetcher] Loaded {} profile(s) for {} ranked topic(s)", items.size(), rankedTopics.size());
        return items;
    }

    String renderProfile(String topic, TopicProfile profile) {
        StringBuilder sb = new StringBuilder();
        if (hasText(profile.getSignificance())) {
            sb.append("Overall significance of '").append(topic).append("': ")
                    .append(profile.getSignificance()).append('\n');
        }
        if (!profile.getKeyThemes().isEmpty()) {
            sb.append("Key themes: ").append(String.join(", ", profile.getKeyThemes())).append('\n');
        }
        if (hasText(profile.getSentimentOverall())) {
            sb.append("User sentiment: ").append(profile.getSentimentOverall()).append('\n');
        }
        if (!profile.getAliases().isEmpty()) {
            sb.append("Aliases: ").append(String.join(", ", profile.getAliases())).append('\n');
        }
        appendSection(sb, TopicProfileCodec.SECTION_OVERVIEW, profile.getOverview());
        appendSection(sb, TopicProfileCodec.SECTION_CONTEXTS, profileCodec.renderContextLines(profile.getContexts()));
        appendSection(sb, TopicProfileCodec.SECTION_OPINIONS, profileCodec.renderOpinionLines(profile.getOpinions()));
        appendSection(sb, TopicProfileCodec.SECTION_OTHER_NOTES, profile.getOtherNotes());
        return sb.toString();
    }

    // ==================== TIER 2 ====================

    /**
     * Renders summary records. Identifiers may carry link brackets or the
     * document extension; duplicates are fetched once.
     */
    public List<RetrievedContextItem> fetchSummaries(Collection<String> summaryRefs) {
        List<RetrievedContextItem> items = new ArrayList<>();
        if (summaryRefs == null) {
            return items;
        }

        Set<String> names = new LinkedHashSet<>();
        for (String ref : summaryRefs) {
            String name = MemoryNoteSupport.cleanReference(ref);
            if (!name.isEmpty()) {
                names.add(name);
            }
        }

        for (String name : names) {
            Optional<SummaryRecord> summary = loadSummary(name);
            if (summary.isEmpty()) {
                continue;
            }
            SummaryRecord record = summary.get();

            StringBuilder sb = new StringBuilder();
            String excerpt = summaryCodec.excerpt(record, SUMMARY_EXCERPT_CHARS);
            if (!excerpt.isEmpty()) {
                sb.append(excerpt.endsWith("...") ? excerpt : excerpt + "...").append('\n');
            }
            if (!record.getKeyTakeaways().isEmpty()) {
                sb.append("Key takeaways: ").append(String.join("; ", record.getKeyTakeaways())).append('\n');
            }
            String snippet = MemoryNoteSupport.truncate(sb.toString().trim(),
                    properties.getRetrieval().getSummarySnippetMaxChars(), "...");

            items.add(RetrievedContextItem.builder()
                    .tier(SourceTier.SUMMARY)
                    .sourceName(name)
                    .title(record.getTitle())
                    .date(record.getDate())
                    .snippet(snippet.isBlank() ? NO_RELATED_INFORMATION : snippet)
                    .build());
        }
        log.info("[Fetcher] Loaded {} of {} requested summary record(s)", items.size(), names.size());
        return items;
    }

    // ==================== TIER 3 ====================

    /**
     * Renders an excerpt of the transcript linked from a summary record.
     * Returns empty when the record or its link is missing.
     */
    public Optional<RetrievedContextItem> fetchTranscript(String summaryRef) {
        String summaryName = MemoryNoteSupport.cleanReference(summaryRef);
        if (summaryName.isEmpty()) {
            return Optional.empty();
        }
        Optional<SummaryRecord> summary = loadSummary(summaryName);
        if (summary.isEmpty()) {
            return Optional.empty();
        }
        SummaryRecord record = summary.get();
        if (!hasText(record.getFullTranscriptRef())) {
            log.debug("[Fetcher] Summary {} links no transcript", summaryName);
            return Optional.empty();
        }

        String transcriptName = MemoryNoteSupport.cleanReference(record.getFullTranscriptRef());
        String content = read(properties.getStorage().getDirectories().getTranscripts(),
                transcriptName + MemoryNoteSupport.NOTE_EXTENSION);
        if (content == null) {
            log.warn("[Fetcher] Transcript {} linked from {} is missing", transcriptName, summaryName);
            return Optional.empty();
        }

        String body = MemoryNoteSupport.split(content).body().trim();
        String excerpt = body.isEmpty()
                ? "Transcript excerpt unavailable"
                : MemoryNoteSupport.truncate(body, properties.getRetrieval().getTranscriptExcerptChars(), "") + "...";
        String title = hasText(record.getTitle()) ? record.getTitle() : transcriptName;

        return Optional.of(RetrievedContextItem.builder()
                .tier(SourceTier.FULL_TRANSCRIPT)
                .sourceName(transcriptName)
                .title("Conversation log: " + title)
                .date(record.getDate())
                .snippet(excerpt)
                .build());
    }

    Optional<SummaryRecord> loadSummary(String name) {
        String content = read(properties.getStorage().getDirectories().getSummaries(),
                name + MemoryNoteSupport.NOTE_EXTENSION);
        if (content == null) {
            log.warn("[Fetcher] Summary record {} not found", name);
            return Optional.empty();
        }
        SummaryRecord record = summaryCodec.parse(name, content);
        if (record == null) {
            log.warn("[Fetcher] Summary record {} has no readable metadata, skipping", name);
            return Optional.empty();
        }
        return Optional.of(record);
    }

    private String read(String directory, String fileName) {
        try {
            return storagePort.getText(directory, fileName).join();
        } catch (RuntimeException e) {
            log.warn("[Fetcher] Failed to read {}/{}: {}", directory, fileName, e.getMessage());
            return null;
        }
    }

    private static void appendSection(StringBuilder sb, String heading, String content) {
        if (hasText(content)) {
            sb.append("\n## ").append(heading).append('\n').append(content.trim()).append('\n');
        }
    }

    private static String profileDate(TopicProfile profile) {
        if (profile.getUpdatedAt() != null) {
            return profile.getUpdatedAt().format(ITEM_DATE_FORMAT);
        }
        return profile.getCreatedAt() != null ? profile.getCreatedAt().format(ITEM_DATE_FORMAT) : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
