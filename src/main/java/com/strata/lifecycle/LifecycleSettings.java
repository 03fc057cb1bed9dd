package com.strata.lifecycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable runtime settings of a {@link DataLifecycleManager}
 */
public final class LifecycleSettings {
    
    public static final int DEFAULT_BATCH_SIZE = 10_000;
    
    private final int batchSize;
    private final Duration interval;
    private final Duration errorBackoff;
    private final Duration shutdownTimeout;
    private final boolean automationEnabled;
    private final boolean removeFromSourceOnTiering;
    private final String archiveProvider;
    private final String createdAtField;
    private final String lastAccessedField;
    private final String recordKeyField;
    private final String managerName;
    
    private LifecycleSettings(Builder builder) {
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + builder.batchSize);
        }
        this.batchSize = builder.batchSize;
        this.interval = requirePositive(builder.interval, "interval");
        this.errorBackoff = requirePositive(builder.errorBackoff, "errorBackoff");
        this.shutdownTimeout = Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout");
        this.automationEnabled = builder.automationEnabled;
        this.removeFromSourceOnTiering = builder.removeFromSourceOnTiering;
        this.archiveProvider = builder.archiveProvider;
        this.createdAtField = Objects.requireNonNull(builder.createdAtField, "createdAtField");
        this.lastAccessedField = Objects.requireNonNull(builder.lastAccessedField, "lastAccessedField");
        this.recordKeyField = Objects.requireNonNull(builder.recordKeyField, "recordKeyField");
        this.managerName = builder.managerName;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static LifecycleSettings defaults() {
        return builder().build();
    }
    
    public int getBatchSize() {
        return batchSize;
    }
    
    /**
     * Wait between two automatic cycles
     */
    public Duration getInterval() {
        return interval;
    }
    
    /**
     * Wait before the next cycle after a cycle failed
     */
    public Duration getErrorBackoff() {
        return errorBackoff;
    }
    
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }
    
    public boolean isAutomationEnabled() {
        return automationEnabled;
    }
    
    public boolean isRemoveFromSourceOnTiering() {
        return removeFromSourceOnTiering;
    }
    
    /**
     * Name of the provider receiving archives, null to use the first cold tier provider
     */
    public String getArchiveProvider() {
        return archiveProvider;
    }
    
    public String getCreatedAtField() {
        return createdAtField;
    }
    
    public String getLastAccessedField() {
        return lastAccessedField;
    }
    
    /**
     * Field identifying a record, used to skip records a move target already holds
     */
    public String getRecordKeyField() {
        return recordKeyField;
    }
    
    /**
     * Value of the {@code manager} tag on the lifecycle meters, null to generate one per manager
     */
    public String getManagerName() {
        return managerName;
    }
    
    private static Duration requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
        return duration;
    }
    
    @Override
    public String toString() {
        return "LifecycleSettings{managerName=" + managerName + ", batchSize=" + batchSize + ", interval=" + interval
            + ", errorBackoff=" + errorBackoff + ", automationEnabled=" + automationEnabled
            + ", archiveProvider=" + archiveProvider + '}';
    }
    
    public static final class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration interval = ScheduleParser.DAILY;
        private Duration errorBackoff = Duration.ofMinutes(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private boolean automationEnabled = true;
        private boolean removeFromSourceOnTiering = true;
        private String archiveProvider;
        private String createdAtField = "created_at";
        private String lastAccessedField = "last_accessed";
        private String recordKeyField = "id";
        private String managerName;
        
        private Builder() {
        }
        
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }
        
        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }
        
        public Builder errorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
            return this;
        }
        
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }
        
        public Builder automationEnabled(boolean automationEnabled) {
            this.automationEnabled = automationEnabled;
            return this;
        }
        
        public Builder removeFromSourceOnTiering(boolean removeFromSourceOnTiering) {
            this.removeFromSourceOnTiering = removeFromSourceOnTiering;
            return this;
        }
        
        public Builder archiveProvider(String archiveProvider) {
            this.archiveProvider = archiveProvider;
            return this;
        }
        
        public Builder createdAtField(String createdAtField) {
            this.createdAtField = createdAtField;
            return this;
        }
        
        public Builder lastAccessedField(String lastAccessedField) {
            this.lastAccessedField = lastAccessedField;
            return this;
        }
        
        public Builder recordKeyField(String recordKeyField) {
            this.recordKeyField = recordKeyField;
            return this;
        }
        
        public Builder managerName(String managerName) {
            this.managerName = managerName;
            return this;
        }
        
        public LifecycleSettings build() {
            return new LifecycleSettings(this);
        }
    }
}
