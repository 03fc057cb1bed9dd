package com.strata.lifecycle.policy;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named set of ordered rules governing a list of tables.
 * Rules run in declaration order, each as its own unit of work.
 */
public final class LifecyclePolicy {
    
    private final String name;
    private final List<String> appliesTo;
    private final List<LifecycleRule> rules;
    private final String compliance;
    
    public LifecyclePolicy(String name, List<String> appliesTo, List<LifecycleRule> rules, String compliance) {
        this.name = Objects.requireNonNull(name, "name");
        this.appliesTo = List.copyOf(appliesTo);
        this.rules = List.copyOf(rules);
        this.compliance = compliance;
    }
    
    public LifecyclePolicy(String name, List<String> appliesTo, List<LifecycleRule> rules) {
        this(name, appliesTo, rules, null);
    }
    
    public String getName() {
        return name;
    }
    
    public List<String> getAppliesTo() {
        return appliesTo;
    }
    
    public List<LifecycleRule> getRules() {
        return rules;
    }
    
    /**
     * Free-form compliance label (GDPR, SOX...), informational only
     */
    public Optional<String> getCompliance() {
        return Optional.ofNullable(compliance);
    }
    
    /**
     * @throws IllegalArgumentException if the policy has no tables or an invalid rule
     */
    public void validate() {
        if (appliesTo.isEmpty()) {
            throw new IllegalArgumentException("Policy '" + name + "' applies to no table");
        }
        for (LifecycleRule rule : rules) {
            try {
                rule.validate();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid rule in policy '" + name + "': " + e.getMessage(), e);
            }
        }
    }
    
    @Override
    public String toString() {
        return "LifecyclePolicy{name=" + name + ", appliesTo=" + appliesTo + ", rules=" + rules + '}';
    }
}
