package com.strata.lifecycle;

import java.time.Instant;
import java.util.Objects;

/**
 * A lifecycle operation in flight.
 *
 * The status doubles as the cancellation token: {@link #cancel()} moves a
 * running operation to {@link OperationStatus#CANCELLED} and the operation
 * body observes it through {@link #checkNotCancelled()} between batches.
 */
public class LifecycleOperation {
    
    private final String operationId;
    private final LifecycleOperationType type;
    private final String tableName;
    private final Instant startTime;
    private volatile OperationStatus status = OperationStatus.RUNNING;
    
    public LifecycleOperation(String operationId, LifecycleOperationType type, String tableName, Instant startTime) {
        this.operationId = Objects.requireNonNull(operationId, "operationId");
        this.type = Objects.requireNonNull(type, "type");
        this.tableName = tableName;
        this.startTime = Objects.requireNonNull(startTime, "startTime");
    }
    
    public String getOperationId() {
        return operationId;
    }
    
    public LifecycleOperationType getType() {
        return type;
    }
    
    public String getTableName() {
        return tableName;
    }
    
    public Instant getStartTime() {
        return startTime;
    }
    
    public OperationStatus getStatus() {
        return status;
    }
    
    /**
     * Requests cancellation. Has no effect once the operation finished.
     *
     * @return true if the operation was running
     */
    public synchronized boolean cancel() {
        if (status != OperationStatus.RUNNING) {
            return false;
        }
        status = OperationStatus.CANCELLED;
        return true;
    }
    
    public boolean isCancelled() {
        return status == OperationStatus.CANCELLED;
    }
    
    /**
     * @throws OperationCancelledException if cancellation was requested
     */
    public void checkNotCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException(operationId);
        }
    }
    
    synchronized void complete() {
        if (status == OperationStatus.RUNNING) {
            status = OperationStatus.COMPLETED;
        }
    }
    
    synchronized void fail() {
        if (status == OperationStatus.RUNNING) {
            status = OperationStatus.FAILED;
        }
    }
    
    @Override
    public String toString() {
        return "LifecycleOperation{id=" + operationId + ", type=" + type + ", table=" + tableName
            + ", startTime=" + startTime + ", status=" + status + '}';
    }
}
