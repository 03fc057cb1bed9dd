package com.strata.lifecycle.policy;

import com.fasterxml.jackson.annotation.JsonValue;
import com.strata.domain.DataTier;

import java.util.Arrays;
import java.util.Optional;

/**
 * Action a lifecycle rule applies to the records it selects
 */
public enum LifecycleAction {
    
    MOVE_TO_HOT_STORAGE("move_to_hot_storage", DataTier.HOT),
    MOVE_TO_WARM_STORAGE("move_to_warm_storage", DataTier.WARM),
    MOVE_TO_COLD_STORAGE("move_to_cold_storage", DataTier.COLD),
    
    /**
     * Copy to the archive provider, then remove from the source
     */
    ARCHIVE("archive", null),
    
    DELETE("delete", null);
    
    private final String value;
    private final DataTier targetTier;
    
    LifecycleAction(String value, DataTier targetTier) {
        this.value = value;
        this.targetTier = targetTier;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Tier the action moves data to, empty for archive and delete
     */
    public Optional<DataTier> getTargetTier() {
        return Optional.ofNullable(targetTier);
    }
    
    public boolean isTiering() {
        return targetTier != null;
    }
    
    /**
     * Parse a configuration value such as {@code move_to_cold_storage}
     */
    public static LifecycleAction fromValue(String value) {
        return Arrays.stream(values())
            .filter(action -> action.value.equalsIgnoreCase(value == null ? "" : value.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown lifecycle action: " + value));
    }
}
