package me.golemcore.memoria.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.LlmResponse;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Provider used when no model is configured. Reports itself unavailable, so
 * retrieval answers with the no-memory result and consolidation is skipped.
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] chat() called for '{}' but no LLM is configured", request.getPurpose());
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content("")
                .model("none")
                .finishReason("stop")
                .build());
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
