package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Outcome of one archival run. On failure {@code recordsArchived} still
 * reports the records written to the archive before the error.
 */
public final class ArchivalResult {
    
    @JsonProperty("operation_id")
    private final String operationId;
    
    @JsonProperty("success")
    private final boolean success;
    
    @JsonProperty("records_archived")
    private final long recordsArchived;
    
    @JsonProperty("records_removed")
    private final long recordsRemoved;
    
    @JsonProperty("execution_time_ms")
    private final long executionTimeMs;
    
    @JsonProperty("archive_location")
    private final String archiveLocation;
    
    @JsonProperty("error")
    private final String error;
    
    public ArchivalResult(String operationId, boolean success, long recordsArchived, long recordsRemoved,
                          long executionTimeMs, String archiveLocation, String error) {
        this.operationId = operationId;
        this.success = success;
        this.recordsArchived = recordsArchived;
        this.recordsRemoved = recordsRemoved;
        this.executionTimeMs = executionTimeMs;
        this.archiveLocation = archiveLocation;
        this.error = error;
    }
    
    public static ArchivalResult success(String operationId, long recordsArchived, long recordsRemoved,
                                         long executionTimeMs, String archiveLocation) {
        return new ArchivalResult(operationId, true, recordsArchived, recordsRemoved, executionTimeMs,
            archiveLocation, null);
    }
    
    public static ArchivalResult failure(String operationId, long recordsArchived, long executionTimeMs,
                                         String error) {
        return new ArchivalResult(operationId, false, recordsArchived, 0, executionTimeMs, null, error);
    }
    
    public String getOperationId() {
        return operationId;
    }
    
    public boolean isSuccess() {
        return success;
    }
    
    public long getRecordsArchived() {
        return recordsArchived;
    }
    
    /**
     * Records deleted from the source after archival, 0 unless removal was requested.
     */
    public long getRecordsRemoved() {
        return recordsRemoved;
    }
    
    public long getExecutionTimeMs() {
        return executionTimeMs;
    }
    
    public Optional<String> getArchiveLocation() {
        return Optional.ofNullable(archiveLocation);
    }
    
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }
    
    @Override
    public String toString() {
        return "ArchivalResult{operationId=" + operationId + ", success=" + success
            + ", recordsArchived=" + recordsArchived + ", recordsRemoved=" + recordsRemoved
            + ", archiveLocation=" + archiveLocation + ", error=" + error + '}';
    }
}
