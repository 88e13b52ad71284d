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
import me.golemcore.memoria.domain.model.EvaluationOutcome;
import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.domain.model.RankedTopic;
import me.golemcore.memoria.domain.model.RetrievalResult;
import me.golemcore.memoria.domain.model.RetrievedContextItem;
import me.golemcore.memoria.domain.model.ScoredKeyword;
import me.golemcore.memoria.domain.model.TopicScore;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import me.golemcore.memoria.port.outbound.NotificationPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Retrieval pipeline for one user turn: keyword extraction, topic ranking,
 * profile fetch, then the sufficiency loop, ending with the formatted context.
 *
 * <p>
 * Every stage degrades instead of failing, so the caller always receives a
 * result. When nothing relevant is found the formatted context is
 * {@link RetrievalResult#NO_MEMORY_FOUND}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextRetrievalService {

    static final String UNAVAILABLE_NOTICE = "Memory retrieval is unavailable: no language model is configured.";

    private final LlmCallSupport llmCallSupport;
    private final TopicScoreStore scoreStore;
    private final KeywordExtractor keywordExtractor;
    private final TopicRanker topicRanker;
    private final TieredContextFetcher contextFetcher;
    private final SufficiencyEvaluator sufficiencyEvaluator;
    private final ContextFormatter contextFormatter;
    private final NotificationPort notificationPort;
    private final MemoriaProperties properties;

    public RetrievalResult retrieve(String query, List<Message> history) {
        RetrievalResult result = RetrievalResult.builder().query(query).build();
        if (!llmCallSupport.isAvailable()) {
            log.warn("[Retrieval] Provider '{}' is not available", llmCallSupport.providerId());
            notificationPort.notify(UNAVAILABLE_NOTICE);
            return result;
        }

        long startMs = System.currentTimeMillis();
        Map<String, TopicScore> scores = scoreStore.load();
        List<ScoredKeyword> keywords = keywordExtractor.extract(query, properties.getPersona().getName(),
                scores.keySet());
        result.setKeywords(keywords);

        List<RetrievedContextItem> profileItems = new ArrayList<>();
        if (!keywords.isEmpty()) {
            List<RankedTopic> ranked = topicRanker.rank(keywords, scores);
            profileItems.addAll(contextFetcher.fetchProfiles(ranked));
        }

        EvaluationOutcome outcome = sufficiencyEvaluator.evaluate(query, history, profileItems);
        result.setItems(outcome.getItems());
        result.setEvaluationRounds(outcome.getRounds());
        result.setEvaluatorResponse(outcome.getRawResponse());
        result.setSummaryRefsToFetch(outcome.getSummaryRefsRequested());
        result.setTranscriptRefToFetch(outcome.getTranscriptRefRequested());
        if (!outcome.getItems().isEmpty()) {
            result.setFormattedContext(contextFormatter.formatForAnswer(outcome.getItems()));
        }

        log.info("[Retrieval] {} keyword(s), {} item(s), {} evaluation round(s), stop: {} ({}ms)",
                keywords.size(), outcome.getItems().size(), outcome.getRounds(), outcome.getStopReason(),
                System.currentTimeMillis() - startMs);
        return result;
    }
}
