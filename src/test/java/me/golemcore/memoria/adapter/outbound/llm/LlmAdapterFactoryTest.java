package me.golemcore.memoria.adapter.outbound.llm;

import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.LlmResponse;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private MemoriaProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MemoriaProperties();
    }

    private static LlmProviderAdapter createMockAdapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        when(adapter.getCurrentModel()).thenReturn(providerId + "-model");
        return adapter;
    }

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertEquals("langchain4j", factory.getProviderId());
        assertSame(langchain4j, factory.getActiveAdapter());
        assertTrue(factory.isAvailable());
        assertEquals("langchain4j-model", factory.getCurrentModel());
    }

    @Test
    void shouldFallbackToNoopWhenProviderNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter custom = createMockAdapter("custom", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(custom, noop));
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldFallbackToFirstAdapterWhenNoopNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter custom = createMockAdapter("custom", true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(custom));
        factory.init();

        assertEquals("custom", factory.getProviderId());
    }

    @Test
    void shouldReportUnavailableWithoutAdapters() throws InterruptedException {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
        CompletableFuture<LlmResponse> future = factory.chat(LlmRequest.builder().build());
        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldDelegateChatToActiveAdapter() throws Exception {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmRequest request = LlmRequest.builder().purpose("keywords").build();
        LlmResponse response = LlmResponse.builder().content("[]").build();
        when(langchain4j.chat(request)).thenReturn(CompletableFuture.completedFuture(response));

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j));
        factory.init();

        assertSame(response, factory.chat(request).get());
        verify(langchain4j).chat(request);
    }
}
