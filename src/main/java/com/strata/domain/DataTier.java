package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Storage tiers a logical table can live in.
 * Each tier is served by one or more technology classes; the order of
 * {@link #getTechnologies()} decides which provider is picked first.
 */
public enum DataTier {
    
    /**
     * Hot tier: frequently accessed data, key/value cache
     */
    HOT("hot", TechnologyType.CACHE),
    
    /**
     * Warm tier: occasionally accessed data, relational or document store
     */
    WARM("warm", TechnologyType.NEWSQL, TechnologyType.NOSQL_DOCUMENT),
    
    /**
     * Cold tier: rarely accessed data, analytical warehouse / data lake
     */
    COLD("cold", TechnologyType.OLAP_WAREHOUSE);
    
    private final String value;
    private final List<TechnologyType> technologies;
    
    DataTier(String value, TechnologyType... technologies) {
        this.value = value;
        this.technologies = List.of(technologies);
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public List<TechnologyType> getTechnologies() {
        return technologies;
    }
    
    /**
     * Parse a string value to DataTier
     */
    public static DataTier fromValue(String value) {
        return Arrays.stream(values())
            .filter(tier -> tier.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown DataTier value: " + value));
    }
}
