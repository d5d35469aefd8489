package com.jreinhal.askdocs.exception;

import com.jreinhal.askdocs.generation.GenerationUnavailableException;
import com.jreinhal.askdocs.ingest.DocumentOwnershipException;
import com.jreinhal.askdocs.pipeline.DeadlineExceededException;
import com.jreinhal.askdocs.retrieval.RetrievalUnavailableException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "ERR-400", sanitizeExceptionMessage(ex.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleMalformed(Exception ex) {
        if (log.isDebugEnabled()) {
            log.debug("Malformed request: {}", ex.getMessage());
        }
        return error(HttpStatus.BAD_REQUEST, "ERR-400", "Malformed request");
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoSuchElementException ex) {
        return error(HttpStatus.NOT_FOUND, "ERR-404", sanitizeExceptionMessage(ex.getMessage()));
    }

    @ExceptionHandler(DocumentOwnershipException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(DocumentOwnershipException ex) {
        return error(HttpStatus.CONFLICT, "ERR-409", sanitizeExceptionMessage(ex.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "ERR-413", "Upload exceeds the maximum allowed size");
    }

    @ExceptionHandler({RetrievalUnavailableException.class, GenerationUnavailableException.class, DeadlineExceededException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(RuntimeException ex) {
        log.warn("Query could not be answered: {}", ex.getMessage());
        String message = ex instanceof DeadlineExceededException
                ? "The request took too long to answer. Please try again."
                : "The answering service is temporarily unavailable. Please try again later.";
        return error(HttpStatus.SERVICE_UNAVAILABLE, "ERR-503", message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "ERR-500", "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("errorCode", errorCode);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }

    static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        // Strip file paths, class names and stack-trace-like content
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }
}
