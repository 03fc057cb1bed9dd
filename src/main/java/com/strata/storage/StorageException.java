package com.strata.storage;

/**
 * Thrown when a storage provider call fails.
 * Carries the provider and table involved to help diagnose the failure.
 */
public class StorageException extends RuntimeException {
    
    private final String providerName;
    private final String tableName;
    
    public StorageException(String message, String providerName, String tableName) {
        super(message);
        this.providerName = providerName;
        this.tableName = tableName;
    }
    
    public StorageException(String message, String providerName, String tableName, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.tableName = tableName;
    }
    
    public String getProviderName() {
        return providerName;
    }
    
    public String getTableName() {
        return tableName;
    }
    
    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (providerName != null) {
            sb.append(" [Provider: ").append(providerName).append("]");
        }
        if (tableName != null) {
            sb.append(" [Table: ").append(tableName).append("]");
        }
        return sb.toString();
    }
}
