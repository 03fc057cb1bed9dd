package com.strata.lifecycle;

import com.strata.domain.DataTier;

/**
 * Kinds of long-running lifecycle operations
 */
public enum LifecycleOperationType {
    MOVE_TO_HOT,
    MOVE_TO_WARM,
    MOVE_TO_COLD,
    ARCHIVE,
    DELETE,
    RETENTION_SWEEP;
    
    /**
     * Move operation targeting the given tier
     */
    public static LifecycleOperationType moveTo(DataTier tier) {
        switch (tier) {
            case HOT:
                return MOVE_TO_HOT;
            case WARM:
                return MOVE_TO_WARM;
            case COLD:
                return MOVE_TO_COLD;
            default:
                throw new IllegalArgumentException("Unsupported tier: " + tier);
        }
    }
}
