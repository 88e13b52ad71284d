package me.golemcore.memoria.domain.service;

import me.golemcore.memoria.domain.exception.LlmCallException;
import me.golemcore.memoria.domain.model.EvaluationOutcome;
import me.golemcore.memoria.domain.model.EvaluationOutcome.StopReason;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.RetrievedContextItem;
import me.golemcore.memoria.domain.model.SourceTier;
import me.golemcore.memoria.infrastructure.config.AutoConfiguration;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SufficiencyEvaluatorTest {

    private static final String SUFFICIENT = "{\"sufficient_for_response\": true, \"reasoning\": \"ok\"}";
    private static final String NEED_SUMMARIES = """
            {"sufficient_for_response": false, "reasoning": "need details",
             "next_summary_notes_to_fetch": ["SN-202401151230-Coffee", "SN-202401161230-Beans"],
             "requires_full_log_for_summary_note": null}
            """;
    private static final String NEED_TRANSCRIPT = """
            {"sufficient_for_response": false, "reasoning": "need wording",
             "next_summary_notes_to_fetch": [],
             "requires_full_log_for_summary_note": "SN-202401151230-Coffee"}
            """;

    private LlmCallSupport llmCallSupport;
    private TieredContextFetcher fetcher;
    private MemoriaProperties properties;
    private SufficiencyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        llmCallSupport = mock(LlmCallSupport.class);
        fetcher = mock(TieredContextFetcher.class);
        properties = new MemoriaProperties();
        evaluator = new SufficiencyEvaluator(llmCallSupport,
                new ModelJsonExtractor(AutoConfiguration.objectMapper()),
                new ContextFormatter(properties), fetcher, properties);
    }

    private static RetrievedContextItem item(SourceTier tier, String name) {
        return RetrievedContextItem.builder().tier(tier).sourceName(name).title(name).snippet("text").build();
    }

    @Test
    void evaluate_skipsJudgeWhenNothingCollected() {
        EvaluationOutcome outcome = evaluator.evaluate("q", List.of(), List.of());

        assertEquals(StopReason.NOTHING_TO_JUDGE, outcome.getStopReason());
        assertEquals(0, outcome.getRounds());
        verify(llmCallSupport, never()).call(any(LlmRequest.class), anyLong());
    }

    @Test
    void evaluate_stopsAfterOneCallWhenSufficient() {
        when(llmCallSupport.call(any(LlmRequest.class), anyLong())).thenReturn(SUFFICIENT);

        EvaluationOutcome outcome = evaluator.evaluate("q", List.of(),
                List.of(item(SourceTier.PROFILE, "TPN-Coffee")));

        assertTrue(outcome.isSufficient());
        assertEquals(StopReason.SUFFICIENT, outcome.getStopReason());
        assertEquals(1, outcome.getRounds());
        assertEquals(1, outcome.getItems().size());
        verify(llmCallSupport, times(1)).call(any(LlmRequest.class), anyLong());
    }

    @Test
    void evaluate_walksDownToTranscriptInTwoRounds() {
        when(llmCallSupport.call(any(LlmRequest.class), anyLong()))
                .thenReturn(NEED_SUMMARIES)
                .thenReturn(NEED_TRANSCRIPT);
        when(fetcher.fetchSummaries(anyCollection())).thenReturn(List.of(
                item(SourceTier.SUMMARY, "SN-202401151230-Coffee"),
                item(SourceTier.SUMMARY, "SN-202401161230-Beans")));
        when(fetcher.fetchTranscript("SN-202401151230-Coffee"))
                .thenReturn(Optional.of(item(SourceTier.FULL_TRANSCRIPT, "20240115123000")));

        EvaluationOutcome outcome = evaluator.evaluate("q", List.of(),
                List.of(item(SourceTier.PROFILE, "TPN-Coffee")));

        assertEquals(2, outcome.getRounds());
        assertEquals(StopReason.ROUND_LIMIT, outcome.getStopReason());
        assertEquals(List.of(SourceTier.PROFILE, SourceTier.SUMMARY, SourceTier.SUMMARY, SourceTier.FULL_TRANSCRIPT),
                outcome.getItems().stream().map(RetrievedContextItem::getTier).toList());
        assertEquals(List.of("SN-202401151230-Coffee", "SN-202401161230-Beans"), outcome.getSummaryRefsRequested());
        assertEquals("SN-202401151230-Coffee", outcome.getTranscriptRefRequested());
        verify(llmCallSupport, times(2)).call(any(LlmRequest.class), anyLong());
    }

    @Test
    void evaluate_neverExceedsTwoRoundsWithAlwaysInsufficientJudge() {
        properties.getRetrieval().setMaxEvaluationRounds(10);
        when(llmCallSupport.call(any(LlmRequest.class), anyLong())).thenReturn(NEED_SUMMARIES);
        when(fetcher.fetchSummaries(anyCollection()))
                .thenReturn(List.of(item(SourceTier.SUMMARY, "SN-202401151230-Coffee")));

        EvaluationOutcome outcome = evaluator.evaluate("q", List.of(),
                List.of(item(SourceTier.PROFILE, "TPN-Coffee")));

        assertTrue(outcome.getRounds() <= SufficiencyEvaluator.MAX_ROUNDS);
        verify(llmCallSupport, times(2)).call(any(LlmRequest.class), anyLong());
        verify(fetcher, times(1)).fetchSummaries(anyCollection());
        verify(fetcher, never()).fetchTranscript(anyString());
    }

    @Test
    void evaluate_stopsWhenRequestedItemsAreMissing() {
        when(llmCallSupport.call(any(LlmRequest.class), anyLong())).thenReturn(NEED_SUMMARIES);
        when(fetcher.fetchSummaries(anyCollection())).thenReturn(List.of());

        EvaluationOutcome outcome = evaluator.evaluate("q", List.of(),
                List.of(item(SourceTier.PROFILE, "TPN-Coffee")));

        assertEquals(StopReason.NO_NEW_ITEMS, outcome.getStopReason());
        assertEquals(1, outcome.getRounds());
    }

    @Test
    void evaluate_keepsItemsWhenJudgeFails() {
        when(llmCallSupport.call(any(LlmRequest.class), anyLong())).thenThrow(new LlmCallException("boom"));

        EvaluationOutcome outcome = evaluator.evaluate("q", List.of(),
                List.of(item(SourceTier.PROFILE, "TPN-Coffee")));

        assertEquals(StopReason.EVALUATION_FAILED, outcome.getStopReason());
        assertEquals(1, outcome.getItems().size());
        assertFalse(outcome.isSufficient());
    }

    @Test
    void evaluate_treatsGarbageResponseAsFailure() {
        when(llmCallSupport.call(any(LlmRequest.class), anyLong())).thenReturn("sure, looks fine");

        EvaluationOutcome outcome = evaluator.evaluate("q", List.of(),
                List.of(item(SourceTier.PROFILE, "TPN-Coffee")));

        assertEquals(StopReason.EVALUATION_FAILED, outcome.getStopReason());
        assertEquals("sure, looks fine", outcome.getRawResponse());
    }

    @Test
    void buildPrompt_describesEvaluationLevel() {
        String prompt = evaluator.buildPrompt("What beans?", "CTX",
                EvaluationOutcome.Stage.SUMMARY_EVAL);

        assertTrue(prompt.contains("\"What beans?\""));
        assertTrue(prompt.contains("---\nCTX\n---"));
        assertTrue(prompt.contains("\"summaries\""));
        assertTrue(prompt.contains(SufficiencyEvaluator.SUMMARY_LEVEL_HINT));
    }

    @Test
    void buildPrompt_doesNotExpandPlaceholdersInsideQuery() {
        properties.getPrompts().setContextEvaluation("Q={userPrompt}|C={context}");

        assertEquals("Q=show {context} and {level}|C=CTX",
                evaluator.buildPrompt("show {context} and {level}", "CTX", EvaluationOutcome.Stage.PROFILE_EVAL));
    }
}
