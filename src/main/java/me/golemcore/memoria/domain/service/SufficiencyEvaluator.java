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
import me.golemcore.memoria.domain.exception.LlmCallException;
import me.golemcore.memoria.domain.exception.ModelResponseParseException;
import me.golemcore.memoria.domain.model.EvaluationOutcome;
import me.golemcore.memoria.domain.model.EvaluationOutcome.Stage;
import me.golemcore.memoria.domain.model.EvaluationOutcome.StopReason;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.domain.model.RetrievedContextItem;
import me.golemcore.memoria.domain.model.SufficiencyVerdict;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded escalation loop: asks the judge model whether the collected memory
 * answers the query and, if not, pulls in the summaries (first round) or the
 * transcript (second round) it asks for.
 *
 * <p>
 * The loop runs at most {@link #MAX_ROUNDS} judge calls and stops early when
 * the judge is satisfied, when a round brings no new item, or when a judge
 * call or its answer fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SufficiencyEvaluator {

    public static final int MAX_ROUNDS = 2;

    static final String PROFILE_LEVEL_HINT = "Topic profiles rarely hold concrete conversation details. "
            + "Request the related summary records whenever they look relevant.";
    static final String SUMMARY_LEVEL_HINT = "Summary records give the outline. Request the full log of one "
            + "summary record only when exact wording or nuance of that conversation is needed.";

    static final String DEFAULT_PROMPT = """
            You assist the memory of the character "{personaName}".
            The user's current question is: "{userPrompt}"
            The following reference information has been collected so far:
            ---
            {context}
            ---
            Judge whether this information is sufficient to answer the user's current question.
            Answer strictly in this JSON format:
            ```json
            {
              "sufficient_for_response": <true or false>,
              "reasoning": "<short reason>",
              "next_summary_notes_to_fetch": ["<summary record names to read next, e.g. 'SN-YYYYMMDDHHMM-Topic'; [] if none>"],
              "requires_full_log_for_summary_note": "<summary record name whose full log is needed, or null>"
            }
            ```
            Considerations:
            - The current evaluation level is "{level}".
            - {levelHint}
            - Request only information that the question really needs.
            - "next_summary_notes_to_fetch" and "requires_full_log_for_summary_note" matter only when \
            "sufficient_for_response" is false.
            - Request a full log only for a summary record that has already been read.
            Return only the JSON object, no other text.
            """;

    private final LlmCallSupport llmCallSupport;
    private final ModelJsonExtractor jsonExtractor;
    private final ContextFormatter contextFormatter;
    private final TieredContextFetcher contextFetcher;
    private final MemoriaProperties properties;

    public EvaluationOutcome evaluate(String query, List<Message> history, List<RetrievedContextItem> initialItems) {
        List<RetrievedContextItem> items = new ArrayList<>(initialItems != null ? initialItems : List.of());
        EvaluationOutcome outcome = EvaluationOutcome.builder().items(items).build();
        int maxRounds = Math.max(0, Math.min(MAX_ROUNDS, properties.getRetrieval().getMaxEvaluationRounds()));

        Stage stage = Stage.INIT;
        int round = 0;
        while (round < maxRounds) {
            if (items.isEmpty() && round == 0) {
                log.info("[Evaluator] Nothing to judge, skipping evaluation");
                outcome.setStopReason(StopReason.NOTHING_TO_JUDGE);
                return outcome;
            }

            stage = round == 0 ? Stage.PROFILE_EVAL : Stage.SUMMARY_EVAL;
            SufficiencyVerdict verdict;
            try {
                String response = judge(query, history, items, stage);
                outcome.setRawResponse(response);
                outcome.setRounds(round + 1);
                verdict = jsonExtractor.readObject(response, SufficiencyVerdict.class);
            } catch (LlmCallException | ModelResponseParseException e) {
                log.warn("[Evaluator] Round {} failed, keeping {} item(s): {}", round + 1, items.size(),
                        e.getMessage());
                outcome.setStopReason(StopReason.EVALUATION_FAILED);
                return outcome;
            }

            if (verdict.isSufficient()) {
                log.info("[Evaluator] Context judged sufficient after {} round(s)", round + 1);
                outcome.setSufficient(true);
                outcome.setStopReason(StopReason.SUFFICIENT);
                return outcome;
            }

            boolean fetchedNew = false;
            if (stage == Stage.PROFILE_EVAL && verdict.hasSummaryRequests()) {
                outcome.setSummaryRefsRequested(new ArrayList<>(verdict.getSummaryRecordsToFetch()));
                log.info("[Evaluator] Judge requested summaries: {}", verdict.getSummaryRecordsToFetch());
                List<RetrievedContextItem> summaries = contextFetcher.fetchSummaries(verdict.getSummaryRecordsToFetch());
                items.addAll(summaries);
                fetchedNew = !summaries.isEmpty();
            } else if (stage == Stage.SUMMARY_EVAL && verdict.hasTranscriptRequest()) {
                outcome.setTranscriptRefRequested(verdict.getTranscriptForSummary().trim());
                log.info("[Evaluator] Judge requested the transcript of {}", verdict.getTranscriptForSummary());
                Optional<RetrievedContextItem> transcript = contextFetcher
                        .fetchTranscript(verdict.getTranscriptForSummary());
                transcript.ifPresent(items::add);
                fetchedNew = transcript.isPresent();
            }

            if (!fetchedNew) {
                log.info("[Evaluator] No new items after round {}, stopping", round + 1);
                outcome.setStopReason(StopReason.NO_NEW_ITEMS);
                return outcome;
            }
            round++;
        }

        log.debug("[Evaluator] Round limit reached at stage {}", stage);
        outcome.setStopReason(StopReason.ROUND_LIMIT);
        return outcome;
    }

    private String judge(String query, List<Message> history, List<RetrievedContextItem> items, Stage stage) {
        String context = contextFormatter.formatForEvaluation(items, query, history);
        String prompt = buildPrompt(query, context, stage);

        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .temperature(0.0)
                .purpose("evaluation")
                .build();
        request.addMessage(Message.user(prompt));
        log.debug("[Evaluator] Prompt ({}): {}", stage, prompt);

        String response = llmCallSupport.call(request, properties.getRetrieval().getLlmCallTimeoutMs());
        log.debug("[Evaluator] Raw response ({}): {}", stage, response);
        return response;
    }

    String buildPrompt(String query, String context, Stage stage) {
        String template = properties.getPrompts().getContextEvaluation();
        if (template == null || template.isBlank()) {
            template = DEFAULT_PROMPT;
        }
        boolean profileLevel = stage == Stage.PROFILE_EVAL;
        return MemoryNoteSupport.fillTemplate(template, Map.of(
                "personaName", Objects.toString(properties.getPersona().getName(), ""),
                "userPrompt", Objects.toString(query, ""),
                "context", Objects.toString(context, ""),
                "level", profileLevel ? "profiles" : "summaries",
                "levelHint", profileLevel ? PROFILE_LEVEL_HINT : SUMMARY_LEVEL_HINT));
    }
}
