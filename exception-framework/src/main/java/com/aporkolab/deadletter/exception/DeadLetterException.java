package com.aporkolab.deadletter.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all dead-letter routing exceptions.
 * 
 * Provides:
 * - Error code, stable across releases, for log filtering and metrics tags
 * - Structured context for debugging
 * - Timestamp for correlation
 */
public abstract class DeadLetterException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected DeadLetterException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new LinkedHashMap<>();
        this.timestamp = Instant.now();
    }

    protected DeadLetterException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new LinkedHashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining.
     */
    public DeadLetterException with(String key, Object value) {
        if (value != null) {
            this.context.put(key, value);
        }
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
