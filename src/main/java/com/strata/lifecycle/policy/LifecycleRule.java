package com.strata.lifecycle.policy;

import java.util.Objects;
import java.util.Optional;

/**
 * One step of a lifecycle policy: an action applied to the records selected
 * either by age or by a condition. When both are present the age wins.
 */
public final class LifecycleRule {
    
    private final LifecycleAction action;
    private final String age;
    private final String condition;
    
    public LifecycleRule(LifecycleAction action, String age, String condition) {
        this.action = Objects.requireNonNull(action, "action");
        this.age = blankToNull(age);
        this.condition = blankToNull(condition);
    }
    
    public static LifecycleRule ofAge(LifecycleAction action, String age) {
        return new LifecycleRule(action, age, null);
    }
    
    public static LifecycleRule ofCondition(LifecycleAction action, String condition) {
        return new LifecycleRule(action, null, condition);
    }
    
    public LifecycleAction getAction() {
        return action;
    }
    
    public Optional<String> getAge() {
        return Optional.ofNullable(age);
    }
    
    public Optional<String> getCondition() {
        return Optional.ofNullable(condition);
    }
    
    /**
     * Checks the rule can be turned into criteria
     *
     * @throws IllegalArgumentException on a malformed age or condition, or when both are missing
     */
    public void validate() {
        if (age == null && condition == null) {
            throw new IllegalArgumentException("Rule '" + action.getValue() + "' needs an age or a condition");
        }
        if (age != null) {
            AgeThresholds.parse(age);
        } else {
            ConditionParser.parse(condition);
        }
    }
    
    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LifecycleRule)) return false;
        LifecycleRule other = (LifecycleRule) o;
        return action == other.action && Objects.equals(age, other.age) && Objects.equals(condition, other.condition);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(action, age, condition);
    }
    
    @Override
    public String toString() {
        return "LifecycleRule{action=" + action.getValue()
            + (age != null ? ", age=" + age : "")
            + (condition != null ? ", condition=" + condition : "") + '}';
    }
}
