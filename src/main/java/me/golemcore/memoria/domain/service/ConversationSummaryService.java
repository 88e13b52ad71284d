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
import me.golemcore.memoria.domain.exception.ModelResponseParseException;
import me.golemcore.memoria.domain.model.ConsolidationReport;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.domain.model.SummaryDraft;
import me.golemcore.memoria.domain.model.SummaryGenerationResult;
import me.golemcore.memoria.domain.model.SummaryRecord;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import me.golemcore.memoria.port.outbound.NotificationPort;
import me.golemcore.memoria.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a concluded conversation transcript into a summary record and hands
 * the record to the topic consolidator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationSummaryService {

    private static final Pattern TRANSCRIPT_STAMP = Pattern.compile("^(\\d{12})\\d{2}$");
    private static final DateTimeFormatter NAME_STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmm");
    private static final DateTimeFormatter RECORD_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final String PROMPT_TEMPLATE = """
            You are an assistant that summarizes a conversation log of a chat application.
            The conversation is between "User" and "{personaName}".
            The full conversation log follows:
            ---
            {transcript}
            ---

            Based on this conversation:
            1. Determine the primary language of the conversation log.
            2. Write every text value below in that primary language.
            3. Answer with valid JSON only, no other text.

            {
              "conversationTitle": "<concise, descriptive title, at most 10 words>",
              "tags": ["<topic>", "<topic>"],
              "mood": "<Positive, Negative, Neutral or Mixed>",
              "keyTakeaways": ["<key conclusion or decision>"],
              "actionItems": ["User: <action>", "{personaName}: <action>"],
              "mainTopics": ["<main topic discussed>"],
              "summaryBody": "<narrative summary of the main points>",
              "userInsights": {
                "mainStatements": ["<user's key statement>"],
                "observedEmotions": ["<emotion the user showed>"]
              },
              "llmInsights": {
                "mainResponses": ["<{personaName}'s key response>"],
                "rolePlayed": "<role {personaName} played>"
              },
              "relatedInformation": ["<related document, link or topic mentioned; [] if none>"]
            }
            """;

    private final StoragePort storagePort;
    private final MemoriaProperties properties;
    private final SummaryRecordCodec summaryCodec;
    private final TopicProfileConsolidator consolidator;
    private final LlmCallSupport llmCallSupport;
    private final ModelJsonExtractor jsonExtractor;
    private final NotificationPort notificationPort;
    private final Clock clock;

    /**
     * Summarizes the transcript, stores the record and consolidates its topics.
     * An existing record of the same name is left untouched and not
     * consolidated again.
     *
     * @throws IllegalArgumentException
     *             when the transcript does not exist
     */
    public SummaryGenerationResult summarize(String transcriptName) {
        String name = MemoryNoteSupport.cleanReference(transcriptName);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Transcript name is required");
        }
        MemoriaProperties.DirectoriesProperties directories = properties.getStorage().getDirectories();
        String transcriptFile = name + MemoryNoteSupport.NOTE_EXTENSION;
        String transcript = storagePort.getText(directories.getTranscripts(), transcriptFile).join();
        if (transcript == null) {
            throw new IllegalArgumentException("Transcript not found: " + name);
        }

        SummaryDraft draft = draft(MemoryNoteSupport.split(transcript).body().trim());
        String title = draft.getConversationTitle().trim();
        LocalDateTime now = LocalDateTime.now(clock);
        String summaryName = MemoryNoteSupport.SUMMARY_PREFIX + nameStamp(name, now) + "-"
                + MemoryNoteSupport.titleForFileName(title);
        String summaryFile = summaryName + MemoryNoteSupport.NOTE_EXTENSION;

        if (Boolean.TRUE.equals(storagePort.exists(directories.getSummaries(), summaryFile).join())) {
            log.warn("[Summary] {} already exists, leaving it untouched", summaryFile);
            notificationPort.notify("Summary record already exists: " + summaryFile);
            return SummaryGenerationResult.builder()
                    .summaryName(summaryName)
                    .created(false)
                    .consolidation(ConsolidationReport.builder().summaryName(summaryName).build())
                    .build();
        }

        SummaryRecord record = SummaryRecord.builder()
                .name(summaryName)
                .title(title)
                .date(now.format(RECORD_DATE_FORMAT))
                .participants(new ArrayList<>(List.of("User", properties.getPersona().getName())))
                .topics(nonBlank(draft.getTags()))
                .fullTranscriptRef(MemoryNoteSupport.toReference(name))
                .mood(draft.getMood() != null && !draft.getMood().isBlank() ? draft.getMood() : "Neutral")
                .keyTakeaways(nonBlank(draft.getKeyTakeaways()))
                .actionItems(nonBlank(draft.getActionItems()))
                .body(renderBody(draft, title, now))
                .build();
        String content = summaryCodec.render(record);
        storagePort.putTextAtomic(directories.getSummaries(), summaryFile, content, false).join();
        record.setRawText(content);
        log.info("[Summary] Created {} with {} topic(s)", summaryFile, record.getTopics().size());

        String linked = summaryCodec.linkTranscript(transcript, title, record.reference());
        storagePort.putTextAtomic(directories.getTranscripts(), transcriptFile, linked, false).join();

        ConsolidationReport report = consolidator.consolidate(record);
        return SummaryGenerationResult.builder()
                .summaryName(summaryName)
                .created(true)
                .consolidation(report)
                .build();
    }

    private SummaryDraft draft(String conversation) {
        String prompt = MemoryNoteSupport.fillTemplate(PROMPT_TEMPLATE, Map.of(
                "personaName", Objects.toString(properties.getPersona().getName(), ""),
                "transcript", Objects.toString(conversation, "")));
        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .temperature(properties.getLlm().getTemperature())
                .purpose("summary")
                .build();
        request.addMessage(Message.user(prompt));

        String response = llmCallSupport.call(request, properties.getConsolidation().getLlmCallTimeoutMs());
        log.debug("[Summary] Raw response: {}", response);
        SummaryDraft draft = jsonExtractor.readObject(response, SummaryDraft.class);
        if (draft.getConversationTitle() == null || draft.getConversationTitle().isBlank()) {
            throw new ModelResponseParseException("Summary response has no conversation title");
        }
        return draft;
    }

    static String nameStamp(String transcriptName, LocalDateTime now) {
        Matcher matcher = TRANSCRIPT_STAMP.matcher(transcriptName);
        if (matcher.matches()) {
            try {
                LocalDateTime.parse(transcriptName, DateTimeFormatter.ofPattern("yyyyMMddHHmmss"));
                return matcher.group(1);
            } catch (DateTimeParseException e) {
                log.debug("[Summary] Transcript name {} is not a valid timestamp", transcriptName);
            }
        }
        return now.format(NAME_STAMP_FORMAT);
    }

    private String renderBody(SummaryDraft draft, String title, LocalDateTime now) {
        String persona = properties.getPersona().getName();
        StringBuilder sb = new StringBuilder();
        sb.append("# Conversation summary: ").append(title).append("\n\n");
        sb.append("**Date**: ").append(now.format(RECORD_DATE_FORMAT)).append('\n');
        sb.append("**Participants**: User, ").append(persona).append("\n\n");

        sb.append("## Main Topics\n");
        appendBullets(sb, draft.getMainTopics(), "", "");
        sb.append('\n');

        sb.append("## ").append(SummaryRecordCodec.SECTION_SUMMARY).append('\n');
        sb.append(draft.getSummaryBody() != null && !draft.getSummaryBody().isBlank()
                ? draft.getSummaryBody().trim()
                : "No summary available.").append("\n\n");

        sb.append("## User Statements and Emotions\n");
        if (draft.getUserInsights() != null) {
            appendBullets(sb, draft.getUserInsights().getMainStatements(), "\"", "\"");
            appendBullets(sb, draft.getUserInsights().getObservedEmotions(), "", "");
        } else {
            sb.append("N/A\n");
        }
        sb.append('\n');

        sb.append("## ").append(persona).append(" Responses and Role\n");
        if (draft.getLlmInsights() != null) {
            appendBullets(sb, draft.getLlmInsights().getMainResponses(), "", "");
            String role = draft.getLlmInsights().getRolePlayed();
            sb.append("- Role: ").append(role != null && !role.isBlank() ? role : "N/A").append('\n');
        } else {
            sb.append("N/A\n");
        }

        List<String> related = nonBlank(draft.getRelatedInformation());
        if (!related.isEmpty()) {
            sb.append("\n## Related Information\n");
            appendBullets(sb, related, "", "");
        }
        return sb.toString();
    }

    private static void appendBullets(StringBuilder sb, List<String> values, String prefix, String suffix) {
        for (String value : nonBlank(values)) {
            sb.append("- ").append(prefix).append(value).append(suffix).append('\n');
        }
    }

    private static List<String> nonBlank(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    result.add(value.trim());
                }
            }
        }
        return result;
    }
}
