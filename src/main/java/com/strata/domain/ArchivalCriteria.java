package com.strata.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Selects records created before {@code ageThreshold} for archival.
 */
public final class ArchivalCriteria {
    
    private final Instant ageThreshold;
    private final boolean removeAfterArchive;
    
    public ArchivalCriteria(Instant ageThreshold, boolean removeAfterArchive) {
        this.ageThreshold = Objects.requireNonNull(ageThreshold, "ageThreshold");
        this.removeAfterArchive = removeAfterArchive;
    }
    
    public Instant getAgeThreshold() {
        return ageThreshold;
    }
    
    public boolean isRemoveAfterArchive() {
        return removeAfterArchive;
    }
    
    @Override
    public String toString() {
        return "ArchivalCriteria{ageThreshold=" + ageThreshold + ", removeAfterArchive=" + removeAfterArchive + '}';
    }
}
