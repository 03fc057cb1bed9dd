package com.strata.lifecycle;

/**
 * Thrown inside an operation body when its cancellation token was flipped.
 * Observed between batches, never in the middle of a provider call.
 */
public class OperationCancelledException extends RuntimeException {
    
    private final String operationId;
    
    public OperationCancelledException(String operationId) {
        super("Operation cancelled: " + operationId);
        this.operationId = operationId;
    }
    
    public String getOperationId() {
        return operationId;
    }
}
