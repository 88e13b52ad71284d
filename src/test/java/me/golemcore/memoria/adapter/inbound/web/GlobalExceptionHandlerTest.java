package me.golemcore.memoria.adapter.inbound.web;

import me.golemcore.memoria.adapter.inbound.web.dto.ApiErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Transcript not found: x")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertEquals(400, body.getStatus());
                    assertEquals("Transcript not found: x", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldKeepResponseStatus() {
        StepVerifier.create(handler.handleResponseStatus(new ResponseStatusException(HttpStatus.NOT_FOUND, "gone")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("gone", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrors() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
