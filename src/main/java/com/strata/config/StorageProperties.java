package com.strata.config;

import com.strata.domain.TechnologyType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Storage providers, bound from {@code strata.providers[*]}
 */
@ConfigurationProperties(prefix = "strata")
public class StorageProperties {
    
    private List<Provider> providers = new ArrayList<>();
    
    public List<Provider> getProviders() {
        return providers;
    }
    
    public void setProviders(List<Provider> providers) {
        this.providers = providers;
    }
    
    public enum Kind {
        IN_MEMORY,
        JDBC,
        REDIS
    }
    
    public static class Provider {
        private String name;
        private Kind kind = Kind.IN_MEMORY;
        private TechnologyType technology;
        
        // jdbc
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName;
        private int poolSize = 10;
        
        // redis
        private String keyField = "id";
        private String keyPrefix = "strata:";
        
        public String getName() {
            return name;
        }
        
        public void setName(String name) {
            this.name = name;
        }
        
        public Kind getKind() {
            return kind;
        }
        
        public void setKind(Kind kind) {
            this.kind = kind;
        }
        
        public TechnologyType getTechnology() {
            return technology;
        }
        
        public void setTechnology(TechnologyType technology) {
            this.technology = technology;
        }
        
        public String getJdbcUrl() {
            return jdbcUrl;
        }
        
        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }
        
        public String getUsername() {
            return username;
        }
        
        public void setUsername(String username) {
            this.username = username;
        }
        
        public String getPassword() {
            return password;
        }
        
        public void setPassword(String password) {
            this.password = password;
        }
        
        public String getDriverClassName() {
            return driverClassName;
        }
        
        public void setDriverClassName(String driverClassName) {
            this.driverClassName = driverClassName;
        }
        
        public int getPoolSize() {
            return poolSize;
        }
        
        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
        
        public String getKeyField() {
            return keyField;
        }
        
        public void setKeyField(String keyField) {
            this.keyField = keyField;
        }
        
        public String getKeyPrefix() {
            return keyPrefix;
        }
        
        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
        
        @Override
        public String toString() {
            return "Provider{name=" + name + ", kind=" + kind + ", technology=" + technology + '}';
        }
    }
}
