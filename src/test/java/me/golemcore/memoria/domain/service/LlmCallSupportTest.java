package me.golemcore.memoria.domain.service;

import me.golemcore.memoria.domain.exception.LlmCallException;
import me.golemcore.memoria.domain.exception.LlmTimeoutException;
import me.golemcore.memoria.domain.exception.LlmUnavailableException;
import me.golemcore.memoria.domain.model.LlmRequest;
import me.golemcore.memoria.domain.model.LlmResponse;
import me.golemcore.memoria.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmCallSupportTest {

    private LlmPort llmPort;
    private LlmCallSupport support;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.getProviderId()).thenReturn("langchain4j");
        support = new LlmCallSupport(llmPort);
    }

    private static LlmRequest request() {
        return LlmRequest.builder().purpose("keywords").build();
    }

    @Test
    void shouldReturnResponseText() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.builder().content("[]").build()));

        assertEquals("[]", support.call(request(), 1000));
    }

    @Test
    void shouldTimeOutAndCancelSlowCall() {
        CompletableFuture<LlmResponse> never = new CompletableFuture<>();
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(never);

        LlmTimeoutException error = assertThrows(LlmTimeoutException.class, () -> support.call(request(), 50));

        assertTrue(error.getMessage().contains("'keywords' timed out after 50ms"));
        assertTrue(never.isCancelled());
    }

    @Test
    void shouldRejectCallWhenUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        assertThrows(LlmUnavailableException.class, () -> support.call(request(), 1000));
        verify(llmPort, never()).chat(any(LlmRequest.class));
    }

    @Test
    void shouldWrapProviderFailure() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota")));

        LlmCallException error = assertThrows(LlmCallException.class, () -> support.call(request(), 1000));

        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldRejectBlankResponse() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.builder().content("  ").build()));

        assertThrows(LlmCallException.class, () -> support.call(request(), 1000));
    }
}
