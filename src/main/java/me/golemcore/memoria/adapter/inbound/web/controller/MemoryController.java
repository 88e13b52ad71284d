package me.golemcore.memoria.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.adapter.inbound.web.dto.ConsolidateRequest;
import me.golemcore.memoria.adapter.inbound.web.dto.RetrieveRequest;
import me.golemcore.memoria.adapter.inbound.web.dto.SummaryRequest;
import me.golemcore.memoria.domain.model.ConsolidationReport;
import me.golemcore.memoria.domain.model.RetrievalResult;
import me.golemcore.memoria.domain.model.SummaryGenerationResult;
import me.golemcore.memoria.domain.model.TopicScore;
import me.golemcore.memoria.domain.service.ContextRetrievalService;
import me.golemcore.memoria.domain.service.ConversationSummaryService;
import me.golemcore.memoria.domain.service.TopicProfileConsolidator;
import me.golemcore.memoria.domain.service.TopicScoreStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Memory retrieval and consolidation endpoints. Model calls block, so every
 * handler runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final ContextRetrievalService retrievalService;
    private final TopicProfileConsolidator consolidator;
    private final ConversationSummaryService summaryService;
    private final TopicScoreStore scoreStore;

    @PostMapping("/retrieve")
    public Mono<ResponseEntity<RetrievalResult>> retrieve(@RequestBody RetrieveRequest request) {
        return Mono.fromCallable(() -> {
            if (request.getQuery() == null || request.getQuery().isBlank()) {
                throw new IllegalArgumentException("'query' is required");
            }
            RetrievalResult result = retrievalService.retrieve(request.getQuery(),
                    request.getHistory() != null ? request.getHistory() : List.of());
            return ResponseEntity.ok(result);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/consolidate")
    public Mono<ResponseEntity<ConsolidationReport>> consolidate(@RequestBody ConsolidateRequest request) {
        return Mono.fromCallable(() -> {
            if (request.getSummaryName() == null || request.getSummaryName().isBlank()) {
                throw new IllegalArgumentException("'summaryName' is required");
            }
            log.info("[API] Consolidation requested for {}", request.getSummaryName());
            return ResponseEntity.ok(consolidator.consolidate(request.getSummaryName()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/summaries")
    public Mono<ResponseEntity<SummaryGenerationResult>> summarize(@RequestBody SummaryRequest request) {
        return Mono.fromCallable(() -> {
            if (request.getTranscriptName() == null || request.getTranscriptName().isBlank()) {
                throw new IllegalArgumentException("'transcriptName' is required");
            }
            log.info("[API] Summary requested for transcript {}", request.getTranscriptName());
            return ResponseEntity.ok(summaryService.summarize(request.getTranscriptName()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/topics")
    public Mono<ResponseEntity<Map<String, TopicScore>>> topics() {
        return Mono.fromCallable(() -> ResponseEntity.ok(scoreStore.load()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
