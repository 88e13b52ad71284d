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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.exception.LlmCallException;
import me.golemcore.memoria.domain.exception.ModelResponseParseException;
import me.golemcore.memoria.domain.model.ConsolidationReport;
import me.golemcore.memoria.domain.model.ConsolidationReport.Status;
import me.golemcore.memoria.domain.model.ConsolidationReport.TopicResult;
import me.golemcore.memoria.domain.model.HistoryEntry;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.domain.model.NoteLanguage;
import me.golemcore.memoria.domain.model.ProfileAnalysis;
import me.golemcore.memoria.domain.model.SummaryRecord;
import me.golemcore.memoria.domain.model.TopicProfile;
import me.golemcore.memoria.domain.model.TopicScore;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import me.golemcore.memoria.port.outbound.NotificationPort;
import me.golemcore.memoria.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Folds a concluded conversation into the profile of every topic it carries.
 *
 * <p>
 * Topics are processed in parallel, one worker per topic. Each worker loads
 * the profile, asks the model for an updated analysis, merges the history
 * lists, bumps the topic's score record and rewrites the profile. A failure
 * only affects its own topic. Score store writes are serialized by
 * {@link TopicScoreStore#update}. Each profile file is held under its own lock
 * from load to write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicProfileConsolidator {

    private static final DateTimeFormatter PROMPT_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    static final String PROMPT_TEMPLATE = """
            You are {personaName}. Fully adopt the following character and act as this persona.

            Your character:
            ---
            {character}
            ---

            Your task is to analyse the topic "{topic}" and update its topic profile, or create it if it does not exist.
            A topic profile records what this topic means to the user and how it has appeared in your conversations.
            Write from your character's point of view, including subjective evaluation.
            Write every text value in {language}.

            Current date: {today}

            Input:

            1. The new conversation summary record {currentReference}, in full:
            ```markdown
            {summaryText}
            ```

            2. The existing profile of "{topic}":
            {existingProfile}

            3. History lists recovered from the existing profile:
            body_contexts:
            ```json
            {existingContexts}
            ```
            body_user_opinions:
            ```json
            {existingOpinions}
            ```

            Answer with one JSON object of this shape:
            ```json
            {
              "tag_name": "{topic}",
              "aliases": ["<aliases and related words, existing and new merged>"],
              "key_themes": ["<main themes of this topic, existing and new merged>"],
              "user_sentiment_overall": "<the user's overall feeling about this topic>",
              "user_sentiment_details": ["<concrete examples of that feeling, may mention {currentReference}>"],
              "master_significance": "<what this topic means to the user, in your own interpretation>",
              "related_tags": ["<names of related topics, without the TPN- prefix>"],
              "body_overview": "<how this topic is treated in your conversations with the user>",
              "body_contexts": [
                { "summary_note_link": "{currentReference}", "context_summary": "<how the topic appeared in the new record>" }
              ],
              "body_user_opinions": [
                { "summary_note_link": "{currentReference}", "user_opinion": "<the user's opinion or reaction in the new record>" }
              ],
              "body_other_notes": "<other observations and open questions>",
              "new_base_importance": <integer 0-100, the topic's current importance to the user>
            }
            ```

            Rules:
            - body_contexts and body_user_opinions are the complete updated lists. Put the entries for {currentReference} first, \
            then keep every recovered entry whose summary_note_link differs. Never invent entries for other records.
            - Write summary_note_link values as links like [[Name.md]] and do not add dates.
            - Merge new information into master_significance, key_themes and body_overview instead of replacing history.
            Return only the JSON object.
            """;

    private final StoragePort storagePort;
    private final MemoriaProperties properties;
    private final TopicScoreStore scoreStore;
    private final TopicProfileCodec profileCodec;
    private final SummaryRecordCodec summaryCodec;
    private final LlmCallSupport llmCallSupport;
    private final ModelJsonExtractor jsonExtractor;
    private final NotificationPort notificationPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> profileLocks = new ConcurrentHashMap<>();

    /**
     * Loads a summary record by name and consolidates it.
     *
     * @throws IllegalArgumentException
     *             when the record does not exist or cannot be read
     */
    public ConsolidationReport consolidate(String summaryName) {
        String name = MemoryNoteSupport.cleanReference(summaryName);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Summary record name is required");
        }
        String directory = properties.getStorage().getDirectories().getSummaries();
        String content = storagePort.getText(directory, name + MemoryNoteSupport.NOTE_EXTENSION).join();
        if (content == null) {
            throw new IllegalArgumentException("Summary record not found: " + name);
        }
        SummaryRecord summary = summaryCodec.parse(name, content);
        if (summary == null) {
            throw new IllegalArgumentException("Summary record has no readable metadata: " + name);
        }
        return consolidate(summary);
    }

    public ConsolidationReport consolidate(SummaryRecord summary) {
        ConsolidationReport report = ConsolidationReport.builder().summaryName(summary.getName()).build();
        if (!properties.getConsolidation().isEnabled()) {
            log.info("[Consolidator] Consolidation is disabled, skipping {}", summary.getName());
            return report;
        }

        List<String> topics = distinctTopics(summary.getTopics());
        if (topics.isEmpty()) {
            log.info("[Consolidator] {} carries no topics", summary.getName());
            return report;
        }
        if (!llmCallSupport.isAvailable()) {
            notificationPort.notify("Topic profiling is unavailable: no language model is configured.");
            for (String topic : topics) {
                report.getTopics().add(new TopicResult(topic, Status.FAILED, "model unavailable"));
            }
            return report;
        }

        String summaryText = summary.getRawText() != null ? summary.getRawText() : summaryCodec.render(summary);
        NoteLanguage language = NoteLanguage.detect(summary.getTitle(), summaryText);
        log.info("[Consolidator] Consolidating {} topic(s) from {} ({})", topics.size(), summary.getName(),
                language.getDisplayName());

        ExecutorService executor = Executors.newFixedThreadPool(topics.size());
        try {
            List<CompletableFuture<TopicResult>> futures = new ArrayList<>();
            for (String topic : topics) {
                futures.add(CompletableFuture
                        .supplyAsync(() -> consolidateTopic(topic, summary, summaryText, language), executor)
                        .exceptionally(e -> {
                            log.warn("[Consolidator] Topic '{}' failed: {}", topic, e.getMessage());
                            return new TopicResult(topic, Status.FAILED, e.getMessage());
                        }));
            }
            for (CompletableFuture<TopicResult> future : futures) {
                report.getTopics().add(future.join());
            }
        } finally {
            executor.shutdown();
        }

        log.info("[Consolidator] {}: {} created, {} updated, {} failed", summary.getName(),
                report.countByStatus(Status.CREATED), report.countByStatus(Status.UPDATED),
                report.countByStatus(Status.FAILED));
        if (report.countByStatus(Status.FAILED) > 0) {
            notificationPort.notify("Topic profiling finished with " + report.countByStatus(Status.FAILED)
                    + " failed topic(s) for " + summary.getName());
        }
        return report;
    }

    TopicResult consolidateTopic(String topic, SummaryRecord summary, String summaryText, NoteLanguage language) {
        String fileName = MemoryNoteSupport.profileFileName(topic);
        ReentrantLock lock = profileLocks.computeIfAbsent(fileName, key -> new ReentrantLock());
        lock.lock();
        try {
            return consolidateTopicLocked(topic, fileName, summary, summaryText, language);
        } finally {
            lock.unlock();
        }
    }

    private TopicResult consolidateTopicLocked(String topic, String fileName, SummaryRecord summary,
            String summaryText, NoteLanguage language) {
        String directory = properties.getStorage().getDirectories().getProfiles();
        LocalDateTime now = LocalDateTime.now(clock);

        String existingContent = storagePort.getText(directory, fileName).join();
        TopicProfile existing = existingContent != null ? profileCodec.parse(existingContent) : null;
        if (existingContent != null && existing == null) {
            log.warn("[Consolidator] Profile {} is unreadable, rebuilding it", fileName);
        }
        boolean created = existing == null;
        TopicProfile base = created ? initialProfile(topic, now) : existing;

        ProfileAnalysis analysis;
        try {
            String prompt = buildPrompt(topic, summary, summaryText, created ? null : existingContent, base,
                    language, now);
            LlmRequest request = LlmRequest.builder()
                    .model(properties.getLlm().getModel())
                    .temperature(properties.getLlm().getTemperature())
                    .purpose("consolidation")
                    .build();
            request.addMessage(Message.user(prompt));
            String response = llmCallSupport.call(request, properties.getConsolidation().getLlmCallTimeoutMs());
            log.debug("[Consolidator] Raw response for '{}': {}", topic, response);
            analysis = jsonExtractor.readObject(response, ProfileAnalysis.class);
        } catch (LlmCallException | ModelResponseParseException e) {
            log.warn("[Consolidator] Topic '{}' skipped: {}", topic, e.getMessage());
            return new TopicResult(topic, Status.FAILED, e.getMessage());
        }

        String reference = summary.reference();
        Integer suggestedImportance = analysis.suggestedImportance();
        TopicScore score = scoreStore.update(topic, current -> {
            TopicScore next = current != null
                    ? current
                    : new TopicScore(properties.getConsolidation().getDefaultImportance(), null, 0);
            next.setMentionCount(next.getMentionCount() + 1);
            next.setLastReferencedRecord(reference);
            if (suggestedImportance != null) {
                next.setBaseImportance(TopicScore.clampImportance(suggestedImportance));
            }
            return next;
        });

        TopicProfile merged = merge(base, analysis, summary, language, now);
        merged.setMentionCount(score.getMentionCount());
        merged.setLastReferencedRecord(score.getLastReferencedRecord());

        storagePort.putTextAtomic(directory, fileName, profileCodec.render(merged), false).join();
        log.info("[Consolidator] {} profile {} (importance {}, mentions {})", created ? "Created" : "Updated",
                fileName, score.getBaseImportance(), score.getMentionCount());
        return new TopicResult(topic, created ? Status.CREATED : Status.UPDATED, fileName);
    }

    TopicProfile merge(TopicProfile base, ProfileAnalysis analysis, SummaryRecord summary, NoteLanguage language,
            LocalDateTime now) {
        String reference = summary.reference();

        List<HistoryEntry> modelContexts = new ArrayList<>();
        if (analysis.getContexts() != null) {
            for (ProfileAnalysis.ContextEntry entry : analysis.getContexts()) {
                if (entry != null) {
                    modelContexts.add(new HistoryEntry(entry.getReference(), entry.getSummary()));
                }
            }
        }
        List<HistoryEntry> modelOpinions = new ArrayList<>();
        if (analysis.getOpinions() != null) {
            for (ProfileAnalysis.OpinionEntry entry : analysis.getOpinions()) {
                if (entry != null) {
                    modelOpinions.add(new HistoryEntry(entry.getReference(), entry.getOpinion()));
                }
            }
        }
        String fallbackContext = hasText(summary.getTitle()) ? summary.getTitle() : language.getFallbackContext();

        List<String> summaryRefs = new ArrayList<>();
        summaryRefs.add(reference);
        for (String ref : base.getSummaryRefs()) {
            if (!MemoryNoteSupport.sameReference(ref, reference)) {
                summaryRefs.add(ref);
            }
        }

        return TopicProfile.builder()
                .topic(base.getTopic())
                .aliases(nonNull(analysis.getAliases()))
                .keyThemes(nonNull(analysis.getKeyThemes()))
                .sentimentOverall(orDefault(analysis.getSentimentOverall(), language.getUnknownSentiment()))
                .sentimentDetails(nonNull(analysis.getSentimentDetails()))
                .significance(orDefault(analysis.getSignificance(), language.getUnspecifiedSignificance()))
                .relatedTopics(relatedLinks(analysis.getRelatedTopics()))
                .summaryRefs(summaryRefs)
                .overview(orDefault(analysis.getOverview(), language.getMissingOverview()))
                .contexts(mergeHistory(reference, modelContexts, base.getContexts(), fallbackContext))
                .opinions(mergeHistory(reference, modelOpinions, base.getOpinions(), language.getFallbackOpinion()))
                .otherNotes(orDefault(analysis.getOtherNotes(), language.getMissingOtherNotes()))
                .createdAt(base.getCreatedAt() != null ? base.getCreatedAt() : now)
                .updatedAt(now)
                .lastReferencedRecord(base.getLastReferencedRecord())
                .mentionCount(base.getMentionCount())
                .build();
    }

    /**
     * Entry for the current record first (the model's, or a synthesized
     * fallback), then the model's other entries, then prior entries for records
     * not yet listed. One entry per record reference.
     */
    static List<HistoryEntry> mergeHistory(String currentReference, List<HistoryEntry> fromModel,
            List<HistoryEntry> prior, String fallbackText) {
        List<HistoryEntry> merged = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        HistoryEntry current = null;
        for (HistoryEntry entry : fromModel) {
            if (isUsable(entry) && MemoryNoteSupport.sameReference(entry.getReference(), currentReference)) {
                current = entry;
                break;
            }
        }
        String currentText = current != null ? current.getText() : fallbackText;
        merged.add(new HistoryEntry(currentReference, MemoryNoteSupport.singleLine(currentText)));
        seen.add(MemoryNoteSupport.cleanReference(currentReference));

        for (HistoryEntry entry : fromModel) {
            addIfNew(merged, seen, entry);
        }
        if (prior != null) {
            for (HistoryEntry entry : prior) {
                addIfNew(merged, seen, entry);
            }
        }
        return merged;
    }

    private static void addIfNew(List<HistoryEntry> merged, Set<String> seen, HistoryEntry entry) {
        if (!isUsable(entry)) {
            return;
        }
        String key = MemoryNoteSupport.cleanReference(entry.getReference());
        if (seen.add(key)) {
            merged.add(new HistoryEntry(MemoryNoteSupport.toReference(key),
                    MemoryNoteSupport.singleLine(entry.getText())));
        }
    }

    private static boolean isUsable(HistoryEntry entry) {
        return entry != null && !MemoryNoteSupport.cleanReference(entry.getReference()).isEmpty()
                && hasText(entry.getText());
    }

    String buildPrompt(String topic, SummaryRecord summary, String summaryText, String existingContent,
            TopicProfile base, NoteLanguage language, LocalDateTime now) {
        String existingProfile = existingContent != null
                ? "```markdown\n" + existingContent.strip() + "\n```"
                : "none, this is a new profile. Initial metadata:\n```markdown\n" + profileCodec.render(base).strip()
                        + "\n```";
        Map<String, String> values = new HashMap<>();
        values.put("personaName", Objects.toString(properties.getPersona().getName(), ""));
        values.put("character", orDefault(properties.getPersona().getCharacter(), "(none)"));
        values.put("language", language.getDisplayName());
        values.put("today", now.format(PROMPT_DATE_FORMAT));
        values.put("currentReference", summary.reference());
        values.put("existingContexts", toJson(contextEntries(base.getContexts())));
        values.put("existingOpinions", toJson(opinionEntries(base.getOpinions())));
        values.put("existingProfile", existingProfile);
        values.put("topic", topic);
        values.put("summaryText", Objects.toString(summaryText, ""));
        return MemoryNoteSupport.fillTemplate(PROMPT_TEMPLATE, values);
    }

    private TopicProfile initialProfile(String topic, LocalDateTime now) {
        return TopicProfile.builder()
                .topic(topic)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static List<String> relatedLinks(List<String> related) {
        Set<String> links = new LinkedHashSet<>();
        if (related == null) {
            return new ArrayList<>();
        }
        for (String name : related) {
            String cleaned = MemoryNoteSupport.cleanReference(name);
            if (cleaned.startsWith(MemoryNoteSupport.PROFILE_PREFIX)) {
                cleaned = cleaned.substring(MemoryNoteSupport.PROFILE_PREFIX.length());
            }
            if (!cleaned.isBlank()) {
                links.add("[[" + MemoryNoteSupport.PROFILE_PREFIX + MemoryNoteSupport.sanitizeName(cleaned) + "]]");
            }
        }
        return new ArrayList<>(links);
    }

    private static List<ProfileAnalysis.ContextEntry> contextEntries(List<HistoryEntry> entries) {
        List<ProfileAnalysis.ContextEntry> result = new ArrayList<>();
        for (HistoryEntry entry : entries) {
            result.add(new ProfileAnalysis.ContextEntry(entry.getReference(), entry.getText()));
        }
        return result;
    }

    private static List<ProfileAnalysis.OpinionEntry> opinionEntries(List<HistoryEntry> entries) {
        List<ProfileAnalysis.OpinionEntry> result = new ArrayList<>();
        for (HistoryEntry entry : entries) {
            result.add(new ProfileAnalysis.OpinionEntry(entry.getReference(), entry.getText()));
        }
        return result;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[Consolidator] Failed to serialize history: {}", e.getOriginalMessage());
            return "[]";
        }
    }

    private static List<String> distinctTopics(List<String> topics) {
        Set<String> distinct = new LinkedHashSet<>();
        if (topics != null) {
            for (String topic : topics) {
                if (hasText(topic)) {
                    distinct.add(topic.trim());
                }
            }
        }
        return new ArrayList<>(distinct);
    }

    private static List<String> nonNull(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (hasText(value)) {
                    result.add(value.trim());
                }
            }
        }
        return result;
    }

    private static String orDefault(String value, String fallback) {
        return hasText(value) ? value.trim() : fallback;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
