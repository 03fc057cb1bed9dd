package com.strata.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Read request against one table of a storage provider.
 * A missing criteria selects every record.
 */
public final class QuerySpec {
    
    private final String tableName;
    private final QueryCriteria criteria;
    private final int fetchSize;
    
    public QuerySpec(String tableName, QueryCriteria criteria, int fetchSize) {
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.criteria = criteria;
        if (fetchSize <= 0) {
            throw new IllegalArgumentException("fetchSize must be positive: " + fetchSize);
        }
        this.fetchSize = fetchSize;
    }
    
    public static QuerySpec of(String tableName, QueryCriteria criteria, int fetchSize) {
        return new QuerySpec(tableName, criteria, fetchSize);
    }
    
    public String getTableName() {
        return tableName;
    }
    
    public Optional<QueryCriteria> getCriteria() {
        return Optional.ofNullable(criteria);
    }
    
    /**
     * Number of rows a provider should pull per round trip. A hint only;
     * it never limits the total number of records returned.
     */
    public int getFetchSize() {
        return fetchSize;
    }
    
    @Override
    public String toString() {
        return "QuerySpec{table=" + tableName + ", criteria=" + criteria + ", fetchSize=" + fetchSize + '}';
    }
}
