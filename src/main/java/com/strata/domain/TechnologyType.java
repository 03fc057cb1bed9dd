package com.strata.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Technology classes a storage provider can belong to.
 */
public enum TechnologyType {
    CACHE,
    NEWSQL,
    NOSQL_DOCUMENT,
    VECTOR_DATABASE,
    SEARCH_ANALYTICS,
    WIDE_COLUMN,
    GRAPH,
    OLAP_WAREHOUSE;
    
    /**
     * Tier served by this technology class, empty for technologies that
     * take no part in tiering (vector, search, graph...).
     */
    public Optional<DataTier> getTier() {
        return Arrays.stream(DataTier.values())
            .filter(tier -> tier.getTechnologies().contains(this))
            .findFirst();
    }
}
