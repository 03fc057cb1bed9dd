package com.strata.storage.hot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.domain.ExecutionContext;
import com.strata.domain.QueryCriteria;
import com.strata.domain.QuerySpec;
import com.strata.domain.TechnologyType;
import com.strata.storage.RecordPredicateTranslator;
import com.strata.storage.StorageException;
import com.strata.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Hot tier storage provider backed by Redis.
 *
 * Each table is a Redis hash {@code <prefix><table>} whose fields are the
 * record keys and whose values are the records encoded as JSON. Redis has no
 * secondary indexes, so criteria are evaluated client side after reading the
 * hash.
 */
public class RedisStorageProvider implements StorageProvider {
    
    private static final Logger logger = LoggerFactory.getLogger(RedisStorageProvider.class);
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};
    
    private final String name;
    private final RedisTemplate<String, String> redis;
    private final ObjectMapper objectMapper;
    private final String keyField;
    private final String keyPrefix;
    
    public RedisStorageProvider(String name, RedisTemplate<String, String> redis, ObjectMapper objectMapper,
                                String keyField, String keyPrefix) {
        this.name = name;
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.keyField = keyField;
        this.keyPrefix = keyPrefix;
    }
    
    @Override
    public String getName() {
        return name;
    }
    
    @Override
    public TechnologyType getTechnologyType() {
        return TechnologyType.CACHE;
    }
    
    @Override
    public void insert(String tableName, Map<String, Object> record, ExecutionContext context) {
        String hashKey = hashKey(tableName);
        try {
            hash().put(hashKey, recordKey(tableName, record), encode(tableName, record));
            logger.debug("Inserted record into {}:{} [{}]", name, hashKey, context.getRequestId());
        } catch (DataAccessException e) {
            logger.error("Failed to insert record into {}:{}", name, hashKey, e);
            throw new StorageException("Insert failed", name, tableName, e);
        }
    }
    
    @Override
    public void insertBatch(String tableName, List<Map<String, Object>> records, ExecutionContext context) {
        if (records.isEmpty()) {
            return;
        }
        String hashKey = hashKey(tableName);
        Map<String, String> entries = new LinkedHashMap<>();
        for (Map<String, Object> record : records) {
            entries.put(recordKey(tableName, record), encode(tableName, record));
        }
        try {
            // HSET with several fields is applied atomically by Redis
            hash().putAll(hashKey, entries);
            logger.debug("Batch inserted {} records into {}:{} [{}]",
                entries.size(), name, hashKey, context.getRequestId());
        } catch (DataAccessException e) {
            logger.error("Failed to batch insert {} records into {}:{}", entries.size(), name, hashKey, e);
            throw new StorageException("Batch insert failed", name, tableName, e);
        }
    }
    
    @Override
    public Stream<Map<String, Object>> executeQuery(QuerySpec query, ExecutionContext context) {
        Predicate<Map<String, Object>> predicate =
            RecordPredicateTranslator.toPredicate(query.getCriteria().orElse(null));
        Map<String, String> entries = entries(query.getTableName());
        logger.debug("Query {} on {} scanning {} records [{}]",
            query, name, entries.size(), context.getRequestId());
        return entries.values().stream()
            .map(json -> decode(query.getTableName(), json))
            .filter(predicate);
    }
    
    @Override
    public long delete(String tableName, QueryCriteria criteria, ExecutionContext context) {
        Predicate<Map<String, Object>> predicate = RecordPredicateTranslator.toPredicate(criteria);
        Object[] matchingKeys = entries(tableName).entrySet().stream()
            .filter(entry -> predicate.test(decode(tableName, entry.getValue())))
            .map(Map.Entry::getKey)
            .toArray();
        if (matchingKeys.length == 0) {
            return 0;
        }
        String hashKey = hashKey(tableName);
        try {
            Long deleted = hash().delete(hashKey, matchingKeys);
            logger.debug("Deleted {} records from {}:{} where {} [{}]",
                deleted, name, hashKey, criteria, context.getRequestId());
            return deleted != null ? deleted : 0;
        } catch (DataAccessException e) {
            logger.error("Failed to delete from {}:{} where {}", name, hashKey, criteria, e);
            throw new StorageException("Delete failed", name, tableName, e);
        }
    }
    
    private Map<String, String> entries(String tableName) {
        String hashKey = hashKey(tableName);
        try {
            Map<String, String> entries = hash().entries(hashKey);
            return entries != null ? entries : Map.of();
        } catch (DataAccessException e) {
            logger.error("Failed to read {}:{}", name, hashKey, e);
            throw new StorageException("Query failed", name, tableName, e);
        }
    }
    
    private HashOperations<String, String, String> hash() {
        return redis.opsForHash();
    }
    
    private String hashKey(String tableName) {
        return keyPrefix + tableName;
    }
    
    private String recordKey(String tableName, Map<String, Object> record) {
        Object key = record.get(keyField);
        if (key == null) {
            throw new StorageException("Record has no '" + keyField + "' field", name, tableName);
        }
        return key.toString();
    }
    
    private String encode(String tableName, Map<String, Object> record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode record", name, tableName, e);
        }
    }
    
    private Map<String, Object> decode(String tableName, String json) {
        try {
            return objectMapper.readValue(json, RECORD_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to decode record", name, tableName, e);
        }
    }
    
    @Override
    public String toString() {
        return "RedisStorageProvider{name=" + name + ", keyPrefix=" + keyPrefix + '}';
    }
}
