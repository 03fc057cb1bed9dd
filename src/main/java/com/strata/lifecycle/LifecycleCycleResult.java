package com.strata.lifecycle;

import com.strata.domain.RetentionResult;
import com.strata.domain.TieringResult;

import java.util.List;

/**
 * What one automatic lifecycle cycle did: the retention sweep, then every
 * tier move triggered by a {@code move_to_*} rule.
 */
public final class LifecycleCycleResult {
    
    private final String cycleId;
    private final RetentionResult retention;
    private final List<TieringResult> tiering;
    
    public LifecycleCycleResult(String cycleId, RetentionResult retention, List<TieringResult> tiering) {
        this.cycleId = cycleId;
        this.retention = retention;
        this.tiering = List.copyOf(tiering);
    }
    
    public String getCycleId() {
        return cycleId;
    }
    
    public RetentionResult getRetention() {
        return retention;
    }
    
    public List<TieringResult> getTiering() {
        return tiering;
    }
    
    public long getFailedTieringOperations() {
        return tiering.stream().filter(result -> !result.isSuccess()).count();
    }
    
    @Override
    public String toString() {
        return "LifecycleCycleResult{cycleId=" + cycleId + ", retention=" + retention
            + ", tieringOperations=" + tiering.size() + ", failedTiering=" + getFailedTieringOperations() + '}';
    }
}
