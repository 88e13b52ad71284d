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
import me.golemcore.memoria.domain.exception.LlmTimeoutException;
import me.golemcore.memoria.domain.exception.LlmUnavailableException;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.LlmResponse;
import me.golemcore.memoria.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invokes the language model with a deadline.
 *
 * <p>
 * Every failure mode (provider unavailable, timeout, provider error, empty
 * response) is converted into an {@link LlmCallException} subtype so that the
 * calling stage can fall back to its default result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmCallSupport {

    private final LlmPort llmPort;

    public boolean isAvailable() {
        return llmPort.isAvailable();
    }

    public String providerId() {
        return llmPort.getProviderId();
    }

    /**
     * Sends the request and waits at most {@code timeoutMs} for the answer.
     *
     * @return non-blank response text
     * @throws LlmCallException
     *             on any failure
     */
    public String call(LlmRequest request, long timeoutMs) {
        String purpose = request.getPurpose() != null ? request.getPurpose() : "chat";
        if (!llmPort.isAvailable()) {
            throw new LlmUnavailableException(llmPort.getProviderId());
        }

        long startMs = System.currentTimeMillis();
        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        LlmResponse response;
        try {
            response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmTimeoutException(purpose, timeoutMs, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmCallException("LLM call '" + purpose + "' interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LlmCallException("LLM call '" + purpose + "' failed: " + cause.getMessage(), cause);
        }

        log.debug("[LLM] '{}' responded in {}ms", purpose, System.currentTimeMillis() - startMs);
        if (response == null || response.getContent() == null || response.getContent().isBlank()) {
            throw new LlmCallException("LLM call '" + purpose + "' returned an empty response");
        }
        return response.getContent();
    }
}
