package com.strata.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Selects the records of a table that should change tier.
 * An age threshold wins over an access threshold when both are set.
 */
public final class DataTieringCriteria {
    
    private final Instant ageThreshold;
    private final Instant accessThreshold;
    private final boolean removeFromSource;
    
    public DataTieringCriteria(Instant ageThreshold, Instant accessThreshold, boolean removeFromSource) {
        this.ageThreshold = ageThreshold;
        this.accessThreshold = accessThreshold;
        this.removeFromSource = removeFromSource;
    }
    
    public static DataTieringCriteria olderThan(Instant ageThreshold, boolean removeFromSource) {
        return new DataTieringCriteria(ageThreshold, null, removeFromSource);
    }
    
    public static DataTieringCriteria notAccessedSince(Instant accessThreshold, boolean removeFromSource) {
        return new DataTieringCriteria(null, accessThreshold, removeFromSource);
    }
    
    public Optional<Instant> getAgeThreshold() {
        return Optional.ofNullable(ageThreshold);
    }
    
    public Optional<Instant> getAccessThreshold() {
        return Optional.ofNullable(accessThreshold);
    }
    
    public boolean isRemoveFromSource() {
        return removeFromSource;
    }
    
    @Override
    public String toString() {
        return "DataTieringCriteria{ageThreshold=" + ageThreshold + ", accessThreshold=" + accessThreshold
            + ", removeFromSource=" + removeFromSource + '}';
    }
}
