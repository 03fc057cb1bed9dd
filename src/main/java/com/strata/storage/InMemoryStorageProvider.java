package com.strata.storage;

import com.strata.domain.ExecutionContext;
import com.strata.domain.QueryCriteria;
import com.strata.domain.QuerySpec;
import com.strata.domain.TechnologyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of StorageProvider for development and testing.
 * Records are kept as copied maps per table; data is lost when the process stops.
 */
public class InMemoryStorageProvider implements StorageProvider {
    
    private static final Logger logger = LoggerFactory.getLogger(InMemoryStorageProvider.class);
    
    private final String name;
    private final TechnologyType technologyType;
    
    // Table name to rows; each row list is guarded by its own monitor
    private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();
    
    public InMemoryStorageProvider(String name, TechnologyType technologyType) {
        this.name = name;
        this.technologyType = technologyType;
    }
    
    @Override
    public String getName() {
        return name;
    }
    
    @Override
    public TechnologyType getTechnologyType() {
        return technologyType;
    }
    
    @Override
    public void insert(String tableName, Map<String, Object> record, ExecutionContext context) {
        List<Map<String, Object>> rows = rows(tableName);
        synchronized (rows) {
            rows.add(new HashMap<>(record));
        }
        logger.debug("Inserted record into {}.{} [{}]", name, tableName, context.getRequestId());
    }
    
    @Override
    public void insertBatch(String tableName, List<Map<String, Object>> records, ExecutionContext context) {
        List<Map<String, Object>> copies = records.stream()
            .map(HashMap::new)
            .collect(Collectors.toList());
        List<Map<String, Object>> rows = rows(tableName);
        synchronized (rows) {
            rows.addAll(copies);
        }
        logger.debug("Inserted batch of {} records into {}.{} [{}]",
            copies.size(), name, tableName, context.getRequestId());
    }
    
    @Override
    public Stream<Map<String, Object>> executeQuery(QuerySpec query, ExecutionContext context) {
        Predicate<Map<String, Object>> predicate =
            RecordPredicateTranslator.toPredicate(query.getCriteria().orElse(null));
        List<Map<String, Object>> snapshot;
        List<Map<String, Object>> rows = tables.get(query.getTableName());
        if (rows == null) {
            snapshot = List.of();
        } else {
            synchronized (rows) {
                snapshot = new ArrayList<>(rows);
            }
        }
        logger.debug("Query {} on {} scanning {} records [{}]",
            query, name, snapshot.size(), context.getRequestId());
        return snapshot.stream()
            .filter(predicate)
            .map(HashMap::new);
    }
    
    @Override
    public long delete(String tableName, QueryCriteria criteria, ExecutionContext context) {
        List<Map<String, Object>> rows = tables.get(tableName);
        if (rows == null) {
            return 0;
        }
        Predicate<Map<String, Object>> predicate = RecordPredicateTranslator.toPredicate(criteria);
        long deleted;
        synchronized (rows) {
            int before = rows.size();
            rows.removeIf(predicate);
            deleted = before - rows.size();
        }
        logger.debug("Deleted {} records from {}.{} where {} [{}]",
            deleted, name, tableName, criteria, context.getRequestId());
        return deleted;
    }
    
    /**
     * Number of records currently stored in a table
     */
    public int count(String tableName) {
        List<Map<String, Object>> rows = tables.get(tableName);
        if (rows == null) {
            return 0;
        }
        synchronized (rows) {
            return rows.size();
        }
    }
    
    /**
     * Copy of all records in a table, in insertion order
     */
    public List<Map<String, Object>> records(String tableName) {
        List<Map<String, Object>> rows = tables.get(tableName);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return rows.stream().map(HashMap::new).collect(Collectors.toList());
        }
    }
    
    /**
     * Clears all tables. Useful for testing.
     */
    public void clear() {
        logger.info("Clearing all tables of provider {}", name);
        tables.clear();
    }
    
    private List<Map<String, Object>> rows(String tableName) {
        return tables.computeIfAbsent(tableName, key -> new ArrayList<>());
    }
    
    @Override
    public String toString() {
        return "InMemoryStorageProvider{name=" + name + ", technology=" + technologyType + '}';
    }
}
