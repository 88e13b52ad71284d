package me.golemcore.memoria.domain.service;

import me.golemcore.memoria.domain.model.EvaluationOutcome;
import me.golemcore.memoria.domain.model.RankedTopic;
import me.golemcore.memoria.domain.model.RetrievalResult;
import me.golemcore.memoria.domain.model.RetrievedContextItem;
import me.golemcore.memoria.domain.model.ScoredKeyword;
import me.golemcore.memoria.domain.model.SourceTier;
import me.golemcore.memoria.domain.model.TopicScore;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import me.golemcore.memoria.port.outbound.NotificationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ContextRetrievalServiceTest {

    private LlmCallSupport llmCallSupport;
    private TopicScoreStore scoreStore;
    private KeywordExtractor keywordExtractor;
    private TopicRanker topicRanker;
    private TieredContextFetcher fetcher;
    private SufficiencyEvaluator evaluator;
    private NotificationPort notificationPort;
    private ContextRetrievalService service;

    @BeforeEach
    void setUp() {
        llmCallSupport = mock(LlmCallSupport.class);
        scoreStore = mock(TopicScoreStore.class);
        keywordExtractor = mock(KeywordExtractor.class);
        topicRanker = new TopicRanker();
        fetcher = mock(TieredContextFetcher.class);
        evaluator = mock(SufficiencyEvaluator.class);
        notificationPort = mock(NotificationPort.class);
        MemoriaProperties properties = new MemoriaProperties();
        service = new ContextRetrievalService(llmCallSupport, scoreStore, keywordExtractor, topicRanker, fetcher,
                evaluator, new ContextFormatter(properties), notificationPort, properties);

        when(llmCallSupport.isAvailable()).thenReturn(true);
        when(scoreStore.load()).thenReturn(Map.of("Coffee", new TopicScore(70, "SN-1", 2)));
    }

    @Test
    void retrieve_notifiesAndReturnsSentinelWhenModelUnavailable() {
        when(llmCallSupport.isAvailable()).thenReturn(false);
        when(llmCallSupport.providerId()).thenReturn("none");

        RetrievalResult result = service.retrieve("Do you remember my coffee?", List.of());

        assertEquals(RetrievalResult.NO_MEMORY_FOUND, result.getFormattedContext());
        verify(notificationPort).notify(ContextRetrievalService.UNAVAILABLE_NOTICE);
        verifyNoInteractions(keywordExtractor, evaluator);
    }

    @Test
    void retrieve_returnsSentinelWhenNoKeywords() {
        when(keywordExtractor.extract(anyString(), anyString(), any())).thenReturn(List.of());
        when(evaluator.evaluate(anyString(), anyList(), anyList())).thenReturn(EvaluationOutcome.builder()
                .stopReason(EvaluationOutcome.StopReason.NOTHING_TO_JUDGE)
                .build());

        RetrievalResult result = service.retrieve("hello", List.of());

        assertEquals(RetrievalResult.NO_MEMORY_FOUND, result.getFormattedContext());
        assertTrue(result.getItems().isEmpty());
        verify(fetcher, never()).fetchProfiles(anyList());
    }

    @Test
    void retrieve_formatsItemsReturnedByEvaluator() {
        List<ScoredKeyword> keywords = List.of(new ScoredKeyword("Coffee", 80));
        RetrievedContextItem profile = RetrievedContextItem.builder()
                .tier(SourceTier.PROFILE).sourceName("TPN-Coffee").title("Topic profile: Coffee")
                .snippet("Morning drink").relevance(77.0).build();
        when(keywordExtractor.extract(eq("coffee?"), anyString(), any())).thenReturn(keywords);
        when(fetcher.fetchProfiles(List.of(new RankedTopic("Coffee", 0.7 * 80 + 0.3 * 70, "Coffee"))))
                .thenReturn(List.of(profile));
        when(evaluator.evaluate(eq("coffee?"), anyList(), eq(List.of(profile)))).thenReturn(EvaluationOutcome.builder()
                .items(List.of(profile))
                .rounds(1)
                .sufficient(true)
                .rawResponse("{\"sufficient_for_response\": true}")
                .stopReason(EvaluationOutcome.StopReason.SUFFICIENT)
                .build());

        RetrievalResult result = service.retrieve("coffee?", List.of());

        assertEquals(keywords, result.getKeywords());
        assertEquals(1, result.getEvaluationRounds());
        assertEquals(List.of(profile), result.getItems());
        assertTrue(result.getFormattedContext().contains("[Source: Profile - TPN-Coffee (unknown date)]"));
        assertEquals("{\"sufficient_for_response\": true}", result.getEvaluatorResponse());
    }
}
