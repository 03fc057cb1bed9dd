package com.strata.lifecycle.policy;

import com.strata.domain.ArchivalCriteria;
import com.strata.domain.DataTieringCriteria;
import com.strata.domain.QueryCriteria;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns rules and tiering/archival criteria into query criteria.
 * Ages are resolved against the clock on every call.
 */
public class PolicyCriteriaBuilder {
    
    static final String DEFAULT_TIERING_AGE = "30_days";
    static final String DEFAULT_ARCHIVE_AGE = "1_year";
    static final Duration DEFAULT_ACCESS_WINDOW = Duration.ofDays(30);
    
    private final Clock clock;
    private final String createdAtField;
    private final String lastAccessedField;
    
    public PolicyCriteriaBuilder(Clock clock, String createdAtField, String lastAccessedField) {
        this.clock = clock;
        this.createdAtField = createdAtField;
        this.lastAccessedField = lastAccessedField;
    }
    
    /**
     * Criteria selecting the records a rule acts on
     */
    public QueryCriteria forRule(LifecycleRule rule) {
        if (rule.getAge().isPresent()) {
            return QueryCriteria.lessThan(createdAtField, AgeThresholds.resolve(rule.getAge().get(), clock));
        }
        if (rule.getCondition().isPresent()) {
            return ConditionParser.parse(rule.getCondition().get());
        }
        throw new IllegalArgumentException("Rule has neither age nor condition: " + rule);
    }
    
    public QueryCriteria forTiering(DataTieringCriteria criteria) {
        if (criteria.getAgeThreshold().isPresent()) {
            return QueryCriteria.lessThan(createdAtField, criteria.getAgeThreshold().get());
        }
        Instant accessThreshold = criteria.getAccessThreshold()
            .orElseGet(() -> clock.instant().minus(DEFAULT_ACCESS_WINDOW));
        return QueryCriteria.lessThan(lastAccessedField, accessThreshold);
    }
    
    public QueryCriteria forArchival(ArchivalCriteria criteria) {
        return QueryCriteria.lessThan(createdAtField, criteria.getAgeThreshold());
    }
    
    /**
     * Tiering criteria for a {@code move_to_*} rule, 30 days when the rule has no age
     */
    public DataTieringCriteria tieringCriteria(LifecycleRule rule, boolean removeFromSource) {
        String age = rule.getAge().orElse(DEFAULT_TIERING_AGE);
        return DataTieringCriteria.olderThan(AgeThresholds.resolve(age, clock), removeFromSource);
    }
    
    /**
     * Archival criteria for an {@code archive} rule, one year when the rule has no age
     */
    public ArchivalCriteria archivalCriteria(LifecycleRule rule) {
        String age = rule.getAge().orElse(DEFAULT_ARCHIVE_AGE);
        return new ArchivalCriteria(AgeThresholds.resolve(age, clock), true);
    }
    
    public Clock getClock() {
        return clock;
    }
}
