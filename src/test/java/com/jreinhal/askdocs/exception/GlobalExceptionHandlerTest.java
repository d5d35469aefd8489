package com.jreinhal.askdocs.exception;

import static org.junit.jupiter.api.Assertions.*;

import com.jreinhal.askdocs.pipeline.DeadlineExceededException;
import com.jreinhal.askdocs.retrieval.RetrievalUnavailableException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void plainValidationMessagesPassThrough() {
        assertEquals("k must be between 1 and 50", GlobalExceptionHandler.sanitizeExceptionMessage("k must be between 1 and 50"));
    }

    @Test
    void internalDetailsAreHidden() {
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage(null));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("failed reading /var/data/corpus.jsonl"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("java.lang.IllegalStateException: boom"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("x".repeat(201)));
    }

    @Test
    void backendOutagesBecomeGenericServiceUnavailable() {
        ResponseEntity<Map<String, Object>> response = this.handler.handleUnavailable(
                new RetrievalUnavailableException(null, "redis://10.1.2.3 refused connection"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("ERR-503", response.getBody().get("errorCode"));
        assertFalse(response.getBody().get("error").toString().contains("10.1.2.3"));
        assertFalse(response.getBody().containsKey("answer"));
    }

    @Test
    void deadlineHasItsOwnMessage() {
        ResponseEntity<Map<String, Object>> response = this.handler.handleUnavailable(new DeadlineExceededException("rerank"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertTrue(response.getBody().get("error").toString().contains("took too long"));
    }

    @Test
    void unhandledErrorsAreOpaque() {
        ResponseEntity<Map<String, Object>> response = this.handler.handleUnhandled(new IllegalStateException("secret detail"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().get("error"));
    }
}
