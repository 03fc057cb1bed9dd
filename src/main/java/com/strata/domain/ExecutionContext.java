package com.strata.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Correlation data passed to every provider call.
 * Used for tracing and logging only, never for control flow.
 */
public final class ExecutionContext {
    
    private final String requestId;
    private final Instant timestamp;
    private final Map<String, Object> metadata;
    
    public ExecutionContext(String requestId, Instant timestamp, Map<String, Object> metadata) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new HashMap<>(metadata))
            : Map.of();
    }
    
    /**
     * Context with a random request id and the current time
     */
    public static ExecutionContext create() {
        return new ExecutionContext(UUID.randomUUID().toString(), Instant.now(), Map.of());
    }
    
    public static ExecutionContext of(String requestId) {
        return new ExecutionContext(requestId, Instant.now(), Map.of());
    }
    
    /**
     * Child context for a sub-operation. The id becomes {@code <parent>:<suffix>},
     * timestamp and metadata are inherited.
     */
    public ExecutionContext derive(String suffix) {
        return new ExecutionContext(requestId + ":" + suffix, timestamp, metadata);
    }
    
    public String getRequestId() {
        return requestId;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public Map<String, Object> getMetadata() {
        return metadata;
    }
    
    @Override
    public String toString() {
        return "ExecutionContext{requestId=" + requestId + ", timestamp=" + timestamp
            + ", metadata=" + metadata + '}';
    }
}
