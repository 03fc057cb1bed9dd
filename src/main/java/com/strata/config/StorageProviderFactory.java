package com.strata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.domain.TechnologyType;
import com.strata.storage.InMemoryStorageProvider;
import com.strata.storage.ProviderRegistry;
import com.strata.storage.StorageProvider;
import com.strata.storage.hot.RedisStorageProvider;
import com.strata.storage.warm.JdbcStorageProvider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Creates storage providers from configuration and owns the connection
 * pools it opens for them.
 */
public class StorageProviderFactory implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(StorageProviderFactory.class);
    
    private final Supplier<RedisTemplate<String, String>> redisTemplate;
    private final ObjectMapper objectMapper;
    private final List<HikariDataSource> dataSources = new ArrayList<>();
    
    public StorageProviderFactory(Supplier<RedisTemplate<String, String>> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }
    
    /**
     * Registry with every configured provider, the table assignments and the default provider
     *
     * @throws IllegalArgumentException on an invalid provider definition
     */
    public ProviderRegistry createRegistry(StorageProperties storage, LifecycleProperties lifecycle) {
        ProviderRegistry registry = new ProviderRegistry();
        for (StorageProperties.Provider provider : storage.getProviders()) {
            registry.register(create(provider));
        }
        for (Map.Entry<String, String> assignment : lifecycle.getTables().entrySet()) {
            registry.assignTable(assignment.getKey(), assignment.getValue());
        }
        registry.setDefaultProvider(lifecycle.getDefaultProvider());
        logger.info("Provider registry ready: {} providers, {} table assignments, default provider {}",
            registry.getAllProviders().size(), registry.getTableAssignments().size(),
            lifecycle.getDefaultProvider());
        return registry;
    }
    
    public StorageProvider create(StorageProperties.Provider provider) {
        if (provider.getName() == null || provider.getName().isBlank()) {
            throw new IllegalArgumentException("Storage provider without a name: " + provider);
        }
        switch (provider.getKind()) {
            case IN_MEMORY:
                return new InMemoryStorageProvider(provider.getName(), requireTechnology(provider));
            case JDBC:
                return createJdbcProvider(provider);
            case REDIS:
                return createRedisProvider(provider);
            default:
                throw new IllegalArgumentException("Unsupported provider kind: " + provider.getKind());
        }
    }
    
    private StorageProvider createJdbcProvider(StorageProperties.Provider provider) {
        TechnologyType technology = requireTechnology(provider);
        if (provider.getJdbcUrl() == null) {
            throw new IllegalArgumentException("JDBC provider " + provider.getName() + " needs a jdbc-url");
        }
        
        HikariConfig config = new HikariConfig();
        config.setPoolName("strata-" + provider.getName());
        config.setJdbcUrl(provider.getJdbcUrl());
        config.setUsername(provider.getUsername());
        config.setPassword(provider.getPassword());
        if (provider.getDriverClassName() != null) {
            config.setDriverClassName(provider.getDriverClassName());
        }
        
        // Connection pool settings
        config.setMaximumPoolSize(provider.getPoolSize());
        config.setMinimumIdle(Math.min(2, provider.getPoolSize()));
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        // Connect lazily so a database that is down does not prevent startup
        config.setInitializationFailTimeout(-1);
        
        HikariDataSource dataSource = new HikariDataSource(config);
        dataSources.add(dataSource);
        logger.info("JDBC DataSource initialized for provider {}: {}", provider.getName(), provider.getJdbcUrl());
        
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        return new JdbcStorageProvider(provider.getName(), technology, jdbcTemplate, transactionTemplate);
    }
    
    private StorageProvider createRedisProvider(StorageProperties.Provider provider) {
        RedisTemplate<String, String> template = redisTemplate.get();
        if (template == null) {
            throw new IllegalArgumentException("Redis provider " + provider.getName()
                + " configured but no Redis connection is available");
        }
        if (provider.getTechnology() != null && provider.getTechnology() != TechnologyType.CACHE) {
            throw new IllegalArgumentException("Redis provider " + provider.getName()
                + " only supports technology CACHE, got " + provider.getTechnology());
        }
        return new RedisStorageProvider(provider.getName(), template, objectMapper,
            provider.getKeyField(), provider.getKeyPrefix());
    }
    
    private static TechnologyType requireTechnology(StorageProperties.Provider provider) {
        if (provider.getTechnology() == null) {
            throw new IllegalArgumentException("Storage provider " + provider.getName() + " needs a technology");
        }
        return provider.getTechnology();
    }
    
    /**
     * Closes the connection pools opened for JDBC providers
     */
    @Override
    public void close() {
        for (HikariDataSource dataSource : dataSources) {
            logger.info("Closing DataSource {}", dataSource.getPoolName());
            dataSource.close();
        }
        dataSources.clear();
    }
}
