package com.strata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.domain.TechnologyType;
import com.strata.storage.InMemoryStorageProvider;
import com.strata.storage.ProviderRegistry;
import com.strata.storage.StorageProvider;
import com.strata.storage.hot.RedisStorageProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
@DisplayName("StorageProviderFactory Tests")
class StorageProviderFactoryTest {
    
    @Mock
    private RedisTemplate<String, String> redisTemplate;
    
    private StorageProviderFactory factory;
    
    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }
    
    private static StorageProperties.Provider provider(String name, StorageProperties.Kind kind,
                                                       TechnologyType technology) {
        StorageProperties.Provider provider = new StorageProperties.Provider();
        provider.setName(name);
        provider.setKind(kind);
        provider.setTechnology(technology);
        return provider;
    }
    
    @Test
    @DisplayName("Should build a registry with table assignments and a default provider")
    void shouldCreateRegistry() {
        // Given
        factory = new StorageProviderFactory(() -> redisTemplate, new ObjectMapper());
        StorageProperties storage = new StorageProperties();
        storage.setProviders(List.of(
            provider("sessions-cache", StorageProperties.Kind.REDIS, null),
            provider("orders-db", StorageProperties.Kind.IN_MEMORY, TechnologyType.NEWSQL),
            provider("lake", StorageProperties.Kind.IN_MEMORY, TechnologyType.OLAP_WAREHOUSE)));
        LifecycleProperties lifecycle = new LifecycleProperties();
        lifecycle.setTables(Map.of("sessions", "sessions-cache"));
        lifecycle.setDefaultProvider("orders-db");
        
        // When
        ProviderRegistry registry = factory.createRegistry(storage, lifecycle);
        
        // Then
        assertThat(registry.getAllProviders()).extracting(StorageProvider::getName)
            .containsExactly("sessions-cache", "orders-db", "lake");
        assertThat(registry.providerForTable("sessions")).isInstanceOf(RedisStorageProvider.class);
        assertThat(registry.providerForTable("events")).isInstanceOf(InMemoryStorageProvider.class);
        assertThat(registry.getProvidersByType(TechnologyType.CACHE)).hasSize(1);
    }
    
    @Test
    @DisplayName("Should fail on a Redis provider without a Redis connection")
    void shouldRequireRedisConnection() {
        factory = new StorageProviderFactory(() -> null, new ObjectMapper());
        
        assertThatThrownBy(() -> factory.create(provider("cache", StorageProperties.Kind.REDIS, null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no Redis connection");
    }
    
    @Test
    @DisplayName("Should reject Redis providers declared for another technology")
    void shouldRejectRedisOutsideCacheTier() {
        factory = new StorageProviderFactory(() -> redisTemplate, new ObjectMapper());
        
        assertThatThrownBy(() -> factory.create(
            provider("cache", StorageProperties.Kind.REDIS, TechnologyType.OLAP_WAREHOUSE)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("only supports technology CACHE");
    }
    
    @Test
    @DisplayName("Should reject incomplete provider definitions")
    void shouldRejectIncompleteDefinitions() {
        factory = new StorageProviderFactory(() -> redisTemplate, new ObjectMapper());
        
        assertThatThrownBy(() -> factory.create(provider(" ", StorageProperties.Kind.IN_MEMORY, TechnologyType.NEWSQL)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("without a name");
        assertThatThrownBy(() -> factory.create(provider("orders-db", StorageProperties.Kind.IN_MEMORY, null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Storage provider orders-db needs a technology");
        assertThatThrownBy(() -> factory.create(provider("lake", StorageProperties.Kind.JDBC,
            TechnologyType.OLAP_WAREHOUSE)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("JDBC provider lake needs a jdbc-url");
    }
}
