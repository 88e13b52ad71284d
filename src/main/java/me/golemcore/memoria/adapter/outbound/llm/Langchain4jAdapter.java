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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.LlmResponse;
import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Models are addressed as {@code provider/model} (e.g.
 * {@code openai/gpt-4o-mini}, {@code anthropic/claude-3-5-haiku-latest}). The
 * prefix selects the credentials under {@code memoria.llm.providers.<id>};
 * {@code anthropic} uses the Anthropic client, every other provider the
 * OpenAI-compatible client.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Per-request model and temperature, clients cached per combination
 * <li>Automatic retry with exponential backoff for rate limits
 * </ul>
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    /**
     * Max retry attempts for rate limit / transient errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int ANTHROPIC_MAX_TOKENS = 4096;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    // Unbounded: every consolidation worker may hold one blocking call at a time.
    private static final ExecutorService LLM_EXECUTOR = Executors.newCachedThreadPool(
            r -> {
                Thread t = new Thread(r, "memoria-llm");
                t.setDaemon(true);
                return t;
            });
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final MemoriaProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    static String providerOf(String model) {
        return model != null && model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private MemoriaProperties.ProviderProperties getProviderConfig(String providerName) {
        MemoriaProperties.ProviderProperties config = properties.getLlm().getProviders().get(providerName);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add memoria.llm.providers." + providerName + ".api-key");
        }
        return config;
    }

    ChatModel modelFor(String model, double temperature, Integer maxTokens) {
        String key = model + "|" + temperature + "|" + maxTokens;
        return models.computeIfAbsent(key, ignored -> createModel(model, temperature, maxTokens));
    }

    private ChatModel createModel(String model, double temperature, Integer maxTokens) {
        String provider = providerOf(model);
        MemoriaProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
        log.debug("[LLM] Creating {} client for model {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(maxTokens != null ? maxTokens : ANTHROPIC_MAX_TOKENS)
                    .temperature(temperature)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .temperature(temperature)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (maxTokens != null) {
            builder.maxTokens(maxTokens);
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null && !request.getModel().isBlank()
                    ? request.getModel()
                    : properties.getLlm().getModel();
            ChatModel chatModel = modelFor(model, request.getTemperature(), request.getMaxTokens());
            List<ChatMessage> messages = convertMessages(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    return convertResponse(response, model);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long exponentialBackoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        long resetSeconds = extractResetSeconds(e);
                        long backoffMs = resetSeconds > 0
                                ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                                : exponentialBackoffMs;
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms{}...",
                                attempt + 1, MAX_RETRIES, backoffMs,
                                resetSeconds > 0 ? " (server requested " + resetSeconds + "s)" : "");
                        try {
                            Thread.sleep(backoffMs);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
                        }
                    } else {
                        log.error("[LLM] Chat failed for '{}'", request.getPurpose(), e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        }, LLM_EXECUTOR);
    }

    boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("cooling down"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extract reset_seconds from a rate limit error body. Returns -1 if not
     * found.
     */
    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            String role = msg.getRole() != null ? msg.getRole() : "user";
            switch (role) {
            case "assistant" -> messages.add(AiMessage.from(msg.getContent()));
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", role);
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }
}
