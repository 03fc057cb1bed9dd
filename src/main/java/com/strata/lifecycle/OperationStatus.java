package com.strata.lifecycle;

/**
 * Status of a tracked lifecycle operation
 */
public enum OperationStatus {
    RUNNING,
    CANCELLED,
    COMPLETED,
    FAILED;
    
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
