package com.strata.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of in-flight lifecycle operations keyed by operation id.
 * Operations are registered when they begin and removed when they end,
 * whatever the outcome.
 */
public class LifecycleOperationTracker {
    
    private static final Logger logger = LoggerFactory.getLogger(LifecycleOperationTracker.class);
    
    private final ConcurrentMap<String, LifecycleOperation> operations = new ConcurrentHashMap<>();
    
    /**
     * Registers a new running operation
     *
     * @throws IllegalStateException if an operation with the same id is still active
     */
    public LifecycleOperation begin(String operationId, LifecycleOperationType type, String tableName,
                                    Instant startTime) {
        LifecycleOperation operation = new LifecycleOperation(operationId, type, tableName, startTime);
        LifecycleOperation existing = operations.putIfAbsent(operationId, operation);
        if (existing != null) {
            throw new IllegalStateException("Operation already active: " + operationId);
        }
        logger.debug("Tracking {}", operation);
        return operation;
    }
    
    /**
     * Marks the operation completed (unless cancelled) and stops tracking it
     */
    public void complete(LifecycleOperation operation) {
        operation.complete();
        remove(operation);
    }
    
    /**
     * Marks the operation failed (unless cancelled) and stops tracking it
     */
    public void fail(LifecycleOperation operation) {
        operation.fail();
        remove(operation);
    }
    
    public Optional<LifecycleOperation> get(String operationId) {
        return Optional.ofNullable(operations.get(operationId));
    }
    
    /**
     * Requests cancellation of one operation
     *
     * @return true if a running operation with that id was found
     */
    public boolean cancel(String operationId) {
        LifecycleOperation operation = operations.get(operationId);
        return operation != null && operation.cancel();
    }
    
    /**
     * Requests cancellation of every tracked operation
     *
     * @return number of operations that were running
     */
    public int cancelAll() {
        int cancelled = 0;
        for (LifecycleOperation operation : operations.values()) {
            if (operation.cancel()) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            logger.info("Cancelled {} active lifecycle operations", cancelled);
        }
        return cancelled;
    }
    
    public void clear() {
        operations.clear();
    }
    
    public List<LifecycleOperation> getActiveOperations() {
        return List.copyOf(operations.values());
    }
    
    public int size() {
        return operations.size();
    }
    
    private void remove(LifecycleOperation operation) {
        // Only remove our own entry; clear() may have raced with a new registration
        operations.remove(operation.getOperationId(), operation);
    }
}
