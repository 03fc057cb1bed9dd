package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Retention outcome for one (policy, table) pair.
 */
public final class TableRetentionResult {
    
    @JsonProperty("table_name")
    private final String tableName;
    
    @JsonProperty("policy_name")
    private final String policyName;
    
    @JsonProperty("success")
    private final boolean success;
    
    @JsonProperty("records_deleted")
    private final long recordsDeleted;
    
    @JsonProperty("error")
    private final String error;
    
    public TableRetentionResult(String tableName, String policyName, boolean success, long recordsDeleted,
                                String error) {
        this.tableName = tableName;
        this.policyName = policyName;
        this.success = success;
        this.recordsDeleted = recordsDeleted;
        this.error = error;
    }
    
    public static TableRetentionResult success(String tableName, String policyName, long recordsDeleted) {
        return new TableRetentionResult(tableName, policyName, true, recordsDeleted, null);
    }
    
    public static TableRetentionResult failure(String tableName, String policyName, long recordsDeleted,
                                               String error) {
        return new TableRetentionResult(tableName, policyName, false, recordsDeleted, error);
    }
    
    public String getTableName() {
        return tableName;
    }
    
    public String getPolicyName() {
        return policyName;
    }
    
    public boolean isSuccess() {
        return success;
    }
    
    public long getRecordsDeleted() {
        return recordsDeleted;
    }
    
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }
    
    @Override
    public String toString() {
        return "TableRetentionResult{table=" + tableName + ", policy=" + policyName + ", success=" + success
            + ", recordsDeleted=" + recordsDeleted + ", error=" + error + '}';
    }
}
