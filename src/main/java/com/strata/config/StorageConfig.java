package com.strata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.strata.storage.ProviderRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Configuration for storage providers and the provider registry
 */
@Configuration
@EnableConfigurationProperties({StorageProperties.class, LifecycleProperties.class})
public class StorageConfig {
    
    /**
     * Mapper encoding records stored in Redis; instants are written as ISO-8601 strings
     */
    @Bean(name = "recordObjectMapper")
    public ObjectMapper recordObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
    
    @Bean(destroyMethod = "close")
    public StorageProviderFactory storageProviderFactory(ObjectProvider<StringRedisTemplate> redisTemplate,
                                                         ObjectMapper recordObjectMapper) {
        return new StorageProviderFactory(redisTemplate::getIfAvailable, recordObjectMapper);
    }
    
    @Bean
    public ProviderRegistry providerRegistry(StorageProviderFactory storageProviderFactory,
                                             StorageProperties storageProperties,
                                             LifecycleProperties lifecycleProperties) {
        return storageProviderFactory.createRegistry(storageProperties, lifecycleProperties);
    }
}
