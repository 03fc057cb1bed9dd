package com.strata.storage;

import com.strata.domain.ExecutionContext;
import com.strata.domain.QueryCriteria;
import com.strata.domain.QuerySpec;
import com.strata.domain.TechnologyType;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Contract each storage technology implements to take part in data lifecycle
 * management. Implementations must be safe for concurrent use by several
 * lifecycle operations at once.
 *
 * Failures are reported as unchecked exceptions, {@link StorageException}
 * wherever the provider can attribute them to a call.
 */
public interface StorageProvider {
    
    /**
     * Unique provider name, used for per-table assignment and logging
     */
    String getName();
    
    TechnologyType getTechnologyType();
    
    /**
     * Insert a single record
     *
     * @param tableName target table
     * @param record column name to value
     * @param context execution context
     */
    void insert(String tableName, Map<String, Object> record, ExecutionContext context);
    
    /**
     * Insert records as one batch. Either the whole batch is written or a
     * {@link StorageException} is thrown.
     *
     * @param tableName target table
     * @param records records to insert
     * @param context execution context
     */
    void insertBatch(String tableName, List<Map<String, Object>> records, ExecutionContext context);
    
    /**
     * Execute a query and stream the matching records.
     *
     * The stream is lazy, finite and single-use. Callers must close it;
     * re-reading requires a fresh query.
     *
     * @param query table, criteria and fetch size
     * @param context execution context
     * @return matching records
     */
    Stream<Map<String, Object>> executeQuery(QuerySpec query, ExecutionContext context);
    
    /**
     * Delete records matching criteria
     *
     * @param tableName target table
     * @param criteria delete criteria
     * @param context execution context
     * @return number of deleted records
     */
    long delete(String tableName, QueryCriteria criteria, ExecutionContext context);
}
