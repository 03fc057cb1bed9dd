package com.strata.storage.hot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.strata.domain.ExecutionContext;
import com.strata.domain.QueryCriteria;
import com.strata.domain.QuerySpec;
import com.strata.domain.TechnologyType;
import com.strata.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisStorageProvider Tests")
class RedisStorageProviderTest {
    
    private static final ExecutionContext CONTEXT = ExecutionContext.of("test");
    private static final String HASH_KEY = "strata:sessions";
    
    @Mock
    private RedisTemplate<String, String> redisTemplate;
    
    @Mock
    private HashOperations<String, String, String> hashOperations;
    
    @Captor
    private ArgumentCaptor<Map<String, String>> entriesCaptor;
    
    private ObjectMapper objectMapper;
    private RedisStorageProvider provider;
    
    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        
        lenient().when(redisTemplate.<String, String>opsForHash()).thenReturn(hashOperations);
        
        provider = new RedisStorageProvider("sessions-cache", redisTemplate, objectMapper, "id", "strata:");
    }
    
    private static Map<String, Object> session(String id, String lastAccessed) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", id);
        record.put("last_accessed", Instant.parse(lastAccessed));
        return record;
    }
    
    @SafeVarargs
    private Map<String, String> stored(Map<String, Object>... records) throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        for (Map<String, Object> record : records) {
            entries.put(record.get("id").toString(), objectMapper.writeValueAsString(record));
        }
        return entries;
    }
    
    @Test
    @DisplayName("Should report the cache technology")
    void shouldBeCacheProvider() {
        assertThat(provider.getTechnologyType()).isEqualTo(TechnologyType.CACHE);
        assertThat(provider.getName()).isEqualTo("sessions-cache");
    }
    
    @Test
    @DisplayName("Should store a record as JSON under its key field")
    void shouldInsertRecordAsJson() throws Exception {
        // Given
        Map<String, Object> record = session("s-1", "2024-05-01T00:00:00Z");
        
        // When
        provider.insert("sessions", record, CONTEXT);
        
        // Then
        verify(hashOperations).put(HASH_KEY, "s-1", objectMapper.writeValueAsString(record));
    }
    
    @Test
    @DisplayName("Should write a batch with a single hash update")
    void shouldInsertBatch() {
        provider.insertBatch("sessions", List.of(
            session("s-1", "2024-05-01T00:00:00Z"),
            session("s-2", "2024-05-02T00:00:00Z")), CONTEXT);
        
        verify(hashOperations).putAll(eq(HASH_KEY), entriesCaptor.capture());
        assertThat(entriesCaptor.getValue()).containsOnlyKeys("s-1", "s-2");
        assertThat(entriesCaptor.getValue().get("s-2")).contains("2024-05-02T00:00:00Z");
    }
    
    @Test
    @DisplayName("Should reject records without the key field")
    void shouldRejectRecordWithoutKey() {
        Map<String, Object> record = Map.of("last_accessed", "2024-05-01T00:00:00Z");
        
        assertThatThrownBy(() -> provider.insertBatch("sessions", List.of(record), CONTEXT))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("Record has no 'id' field");
        verify(hashOperations, never()).putAll(anyString(), anyMap());
    }
    
    @Test
    @DisplayName("Should filter decoded records client side")
    void shouldFilterOnQuery() throws Exception {
        // Given
        when(hashOperations.entries(HASH_KEY)).thenReturn(stored(
            session("s-1", "2024-04-01T00:00:00Z"),
            session("s-2", "2024-05-20T00:00:00Z")));
        
        // When
        List<Object> ids;
        try (Stream<Map<String, Object>> records = provider.executeQuery(QuerySpec.of("sessions",
            QueryCriteria.lessThan("last_accessed", Instant.parse("2024-05-01T00:00:00Z")), 100), CONTEXT)) {
            ids = records.map(record -> record.get("id")).collect(Collectors.toList());
        }
        
        // Then
        assertThat(ids).containsExactly("s-1");
    }
    
    @Test
    @DisplayName("Should delete only the matching hash fields")
    void shouldDeleteMatchingFields() throws Exception {
        when(hashOperations.entries(HASH_KEY)).thenReturn(stored(
            session("s-1", "2024-04-01T00:00:00Z"),
            session("s-2", "2024-04-02T00:00:00Z"),
            session("s-3", "2024-05-20T00:00:00Z")));
        when(hashOperations.delete(HASH_KEY, "s-1", "s-2")).thenReturn(2L);
        
        long deleted = provider.delete("sessions",
            QueryCriteria.lessThan("last_accessed", Instant.parse("2024-05-01T00:00:00Z")), CONTEXT);
        
        assertThat(deleted).isEqualTo(2);
    }
    
    @Test
    @DisplayName("Should not issue a delete when nothing matches")
    void shouldSkipDeleteWithoutMatches() throws Exception {
        when(hashOperations.entries(HASH_KEY)).thenReturn(stored(session("s-1", "2024-05-20T00:00:00Z")));
        
        long deleted = provider.delete("sessions", QueryCriteria.eq("id", "s-9"), CONTEXT);
        
        assertThat(deleted).isZero();
        verify(hashOperations).entries(HASH_KEY);
        verifyNoMoreInteractions(hashOperations);
    }
    
    @Test
    @DisplayName("Should wrap Redis failures")
    void shouldWrapRedisFailures() {
        when(hashOperations.entries(HASH_KEY)).thenThrow(new QueryTimeoutException("Redis command timed out"));
        
        assertThatThrownBy(() -> provider.executeQuery(QuerySpec.of("sessions", null, 100), CONTEXT))
            .isInstanceOf(StorageException.class)
            .hasMessage("Query failed [Provider: sessions-cache] [Table: sessions]");
    }
}
