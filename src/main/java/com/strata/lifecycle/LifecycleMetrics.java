package com.strata.lifecycle;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Metrics collector for one data lifecycle manager.
 * Tracks scheduler cycles and errors, records moved, archived and deleted,
 * cycle duration and the number of operations in flight.
 *
 * Every meter carries a {@code manager} tag, so managers sharing a registry
 * keep separate counts. A manager name can be registered once per registry.
 */
public class LifecycleMetrics {
    
    public static final String MANAGER_TAG = "manager";
    
    private final String managerName;
    private final Counter lifecycleCycles;
    private final Counter lifecycleErrors;
    private final Counter recordsArchived;
    private final Counter recordsDeleted;
    private final Counter recordsMoved;
    private final Timer cycleDuration;
    
    /**
     * @throws IllegalStateException if the registry already holds meters for this manager name
     */
    public LifecycleMetrics(MeterRegistry meterRegistry, String managerName, LifecycleOperationTracker tracker) {
        if (meterRegistry.find("strata.lifecycle.cycles").tag(MANAGER_TAG, managerName).counter() != null) {
            throw new IllegalStateException("Lifecycle metrics already registered for manager " + managerName);
        }
        this.managerName = managerName;
        Tags tags = Tags.of(MANAGER_TAG, managerName);
        
        lifecycleCycles = Counter.builder("strata.lifecycle.cycles")
            .description("Total number of completed automatic lifecycle cycles")
            .tags(tags)
            .register(meterRegistry);
        
        lifecycleErrors = Counter.builder("strata.lifecycle.errors")
            .description("Total number of automatic lifecycle cycles that failed")
            .tags(tags)
            .register(meterRegistry);
        
        recordsArchived = Counter.builder("strata.lifecycle.records.archived")
            .description("Total number of records written to the archive")
            .baseUnit("records")
            .tags(tags)
            .register(meterRegistry);
        
        recordsDeleted = Counter.builder("strata.lifecycle.records.deleted")
            .description("Total number of records deleted by retention rules")
            .baseUnit("records")
            .tags(tags)
            .register(meterRegistry);
        
        recordsMoved = Counter.builder("strata.lifecycle.records.moved")
            .description("Total number of records moved between tiers")
            .baseUnit("records")
            .tags(tags)
            .register(meterRegistry);
        
        cycleDuration = Timer.builder("strata.lifecycle.cycle.duration")
            .description("Duration of automatic lifecycle cycles")
            .tags(tags)
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofHours(6))
            .register(meterRegistry);
        
        Gauge.builder("strata.lifecycle.operations.active", tracker, LifecycleOperationTracker::size)
            .description("Number of lifecycle operations in flight")
            .tags(tags)
            .register(meterRegistry);
    }
    
    public void recordCycle(Duration duration) {
        lifecycleCycles.increment();
        cycleDuration.record(duration);
    }
    
    public void recordCycleError() {
        lifecycleErrors.increment();
    }
    
    public void recordArchived(long records) {
        recordsArchived.increment(records);
    }
    
    public void recordDeleted(long records) {
        recordsDeleted.increment(records);
    }
    
    public void recordMoved(long records) {
        recordsMoved.increment(records);
    }
    
    public String getManagerName() {
        return managerName;
    }
    
    public long getLifecycleCycles() {
        return (long) lifecycleCycles.count();
    }
    
    public long getLifecycleErrors() {
        return (long) lifecycleErrors.count();
    }
    
    public long getRecordsArchived() {
        return (long) recordsArchived.count();
    }
    
    public long getRecordsDeleted() {
        return (long) recordsDeleted.count();
    }
    
    public long getRecordsMoved() {
        return (long) recordsMoved.count();
    }
    
    public Timer getCycleDuration() {
        return cycleDuration;
    }
    
    @Override
    public String toString() {
        return "LifecycleMetrics{manager=" + managerName + ", cycles=" + getLifecycleCycles() + ", errors=" + getLifecycleErrors()
            + ", archived=" + getRecordsArchived() + ", deleted=" + getRecordsDeleted()
            + ", moved=" + getRecordsMoved() + '}';
    }
}
