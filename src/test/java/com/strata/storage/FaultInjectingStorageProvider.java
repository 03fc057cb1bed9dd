package com.strata.storage;

import com.strata.domain.ExecutionContext;
import com.strata.domain.QueryCriteria;
import com.strata.domain.TechnologyType;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider that fails or runs a hook on chosen calls
 */
public class FaultInjectingStorageProvider extends InMemoryStorageProvider {
    
    private final AtomicInteger insertCalls = new AtomicInteger();
    private final AtomicInteger insertBatchCalls = new AtomicInteger();
    private final AtomicInteger deleteCalls = new AtomicInteger();
    
    private volatile int failOnInsert = -1;
    private volatile int failOnInsertBatch = -1;
    private volatile boolean failDeletes;
    private volatile Runnable beforeInsertBatch = () -> { };
    
    public FaultInjectingStorageProvider(String name, TechnologyType technologyType) {
        super(name, technologyType);
    }
    
    /**
     * The nth single insert (1-based) and every later one throw
     */
    public FaultInjectingStorageProvider failOnInsert(int n) {
        this.failOnInsert = n;
        return this;
    }
    
    /**
     * The nth batch insert (1-based) and every later one throw
     */
    public FaultInjectingStorageProvider failOnInsertBatch(int n) {
        this.failOnInsertBatch = n;
        return this;
    }
    
    public FaultInjectingStorageProvider failDeletes() {
        this.failDeletes = true;
        return this;
    }
    
    public FaultInjectingStorageProvider beforeInsertBatch(Runnable hook) {
        this.beforeInsertBatch = hook;
        return this;
    }
    
    @Override
    public void insert(String tableName, Map<String, Object> record, ExecutionContext context) {
        int call = insertCalls.incrementAndGet();
        if (failOnInsert > 0 && call >= failOnInsert) {
            throw new StorageException("Injected insert failure", getName(), tableName);
        }
        super.insert(tableName, record, context);
    }
    
    @Override
    public void insertBatch(String tableName, List<Map<String, Object>> records, ExecutionContext context) {
        int call = insertBatchCalls.incrementAndGet();
        beforeInsertBatch.run();
        if (failOnInsertBatch > 0 && call >= failOnInsertBatch) {
            throw new StorageException("Injected batch failure", getName(), tableName);
        }
        super.insertBatch(tableName, records, context);
    }
    
    @Override
    public long delete(String tableName, QueryCriteria criteria, ExecutionContext context) {
        deleteCalls.incrementAndGet();
        if (failDeletes) {
            throw new StorageException("Injected delete failure", getName(), tableName);
        }
        return super.delete(tableName, criteria, context);
    }
    
    public int getInsertBatchCalls() {
        return insertBatchCalls.get();
    }
    
    public int getDeleteCalls() {
        return deleteCalls.get();
    }
}
