package me.golemcore.memoria.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.LlmResponse;
import me.golemcore.memoria.domain.model.Message;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String MODEL = "openai/gpt-4o-mini";

    private MemoriaProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MemoriaProperties();
        properties.getLlm().setModel(MODEL);
        adapter = new Langchain4jAdapter(properties);
    }

    @SuppressWarnings("unchecked")
    private void registerModel(String key, ChatModel chatModel) {
        Map<String, ChatModel> models = (Map<String, ChatModel>) ReflectionTestUtils.getField(adapter, "models");
        models.put(key, chatModel);
    }

    @Test
    void shouldSplitProviderPrefix() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-sonnet"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o"));
        assertEquals("claude-sonnet", Langchain4jAdapter.stripProviderPrefix("anthropic/claude-sonnet"));
        assertEquals("gpt-4o", Langchain4jAdapter.stripProviderPrefix("gpt-4o"));
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());

        MemoriaProperties.ProviderProperties openai = new MemoriaProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put("openai", openai);

        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldConvertMessagesByRole() {
        LlmRequest request = LlmRequest.builder().systemPrompt("be brief").build();
        request.addMessage(Message.user("hi"));
        request.addMessage(Message.assistant("hello"));
        request.addMessage(Message.builder().role("narrator").content("aside").build());

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        assertInstanceOf(AiMessage.class, messages.get(2));
        assertInstanceOf(UserMessage.class, messages.get(3));
    }

    @Test
    void shouldReturnModelAnswer() throws Exception {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("[]"))
                .finishReason(FinishReason.STOP)
                .build());
        registerModel(MODEL + "|0.0|null", chatModel);

        LlmRequest request = LlmRequest.builder().temperature(0.0).purpose("keywords").build();
        request.addMessage(Message.user("extract"));
        LlmResponse response = adapter.chat(request).get();

        assertEquals("[]", response.getContent());
        assertEquals(MODEL, response.getModel());
        assertEquals("STOP", response.getFinishReason());
    }

    @Test
    void shouldRunConcurrentCallsOnDedicatedThreads() throws Exception {
        int calls = 8;
        CountDownLatch allInFlight = new CountDownLatch(calls);
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenAnswer(invocation -> {
            allInFlight.countDown();
            boolean together = allInFlight.await(5, TimeUnit.SECONDS);
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from(together + "|" + Thread.currentThread().getName()))
                    .build();
        });
        registerModel(MODEL + "|0.0|null", chatModel);

        List<CompletableFuture<LlmResponse>> futures = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            LlmRequest request = LlmRequest.builder().temperature(0.0).purpose("consolidation").build();
            request.addMessage(Message.user("topic " + i));
            futures.add(adapter.chat(request));
        }

        for (CompletableFuture<LlmResponse> future : futures) {
            assertEquals("true|memoria-llm", future.get(10, TimeUnit.SECONDS).getContent());
        }
    }

    @Test
    void shouldFailWithoutRetryOnOrdinaryError() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenThrow(new IllegalArgumentException("bad request"));
        registerModel(MODEL + "|0.3|null", chatModel);

        LlmRequest request = LlmRequest.builder().purpose("summary").build();
        request.addMessage(Message.user("summarize"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> adapter.chat(request).get());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldRecognizeRateLimitMessages() {
        assertTrue(adapter.isRateLimitError(new RuntimeException("HTTP 429 Too Many Requests")));
        assertTrue(adapter.isRateLimitError(new RuntimeException("wrapper", new RuntimeException("rate_limit"))));
        assertFalse(adapter.isRateLimitError(new RuntimeException("connection reset")));
    }

    @Test
    void shouldRejectUnconfiguredProvider() {
        assertThrows(IllegalStateException.class, () -> adapter.modelFor("anthropic/claude", 0.0, null));
    }
}
