package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one tier move. Built once, never updated.
 */
public final class TieringResult {
    
    @JsonProperty("operation_id")
    private final String operationId;
    
    @JsonProperty("success")
    private final boolean success;
    
    @JsonProperty("message")
    private final String message;
    
    @JsonProperty("records_processed")
    private final long recordsProcessed;
    
    @JsonProperty("execution_time_ms")
    private final long executionTimeMs;
    
    @JsonProperty("source_provider")
    private final String sourceProvider;
    
    @JsonProperty("target_provider")
    private final String targetProvider;
    
    public TieringResult(String operationId, boolean success, String message, long recordsProcessed,
                         long executionTimeMs, String sourceProvider, String targetProvider) {
        this.operationId = operationId;
        this.success = success;
        this.message = message;
        this.recordsProcessed = recordsProcessed;
        this.executionTimeMs = executionTimeMs;
        this.sourceProvider = sourceProvider;
        this.targetProvider = targetProvider;
    }
    
    public static TieringResult failure(String operationId, String message, long recordsProcessed,
                                        long executionTimeMs) {
        return new TieringResult(operationId, false, message, recordsProcessed, executionTimeMs, null, null);
    }
    
    public String getOperationId() {
        return operationId;
    }
    
    public boolean isSuccess() {
        return success;
    }
    
    public String getMessage() {
        return message;
    }
    
    public long getRecordsProcessed() {
        return recordsProcessed;
    }
    
    public long getExecutionTimeMs() {
        return executionTimeMs;
    }
    
    public String getSourceProvider() {
        return sourceProvider;
    }
    
    public String getTargetProvider() {
        return targetProvider;
    }
    
    @Override
    public String toString() {
        return "TieringResult{operationId=" + operationId + ", success=" + success + ", message=" + message
            + ", recordsProcessed=" + recordsProcessed + ", executionTimeMs=" + executionTimeMs + '}';
    }
}
