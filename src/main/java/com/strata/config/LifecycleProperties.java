package com.strata.config;

import com.strata.lifecycle.LifecycleSettings;
import com.strata.lifecycle.ScheduleParser;
import com.strata.lifecycle.policy.LifecycleAction;
import com.strata.lifecycle.policy.LifecyclePolicy;
import com.strata.lifecycle.policy.LifecycleRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle policies, automation schedule and table placement,
 * bound from {@code strata.lifecycle.*}.
 */
@ConfigurationProperties(prefix = "strata.lifecycle")
public class LifecycleProperties {
    
    /**
     * Policies by name, in declaration order
     */
    private Map<String, Policy> policies = new LinkedHashMap<>();
    
    private Automation automation = new Automation();
    
    /**
     * Table name to the name of the provider holding it
     */
    private Map<String, String> tables = new LinkedHashMap<>();
    
    /**
     * Provider for tables missing from {@link #tables}
     */
    private String defaultProvider;
    
    /**
     * Provider receiving archives; the first cold tier provider when unset
     */
    private String archiveProvider;
    
    private String createdAtField = "created_at";
    
    private String lastAccessedField = "last_accessed";
    
    private String recordKeyField = "id";
    
    /**
     * Tag distinguishing this manager's meters in a shared registry
     */
    private String managerName = "strata-lifecycle";
    
    /**
     * Builds the policies in declaration order
     *
     * @throws IllegalArgumentException if a policy or rule is invalid
     */
    public List<LifecyclePolicy> toPolicies() {
        List<LifecyclePolicy> result = new ArrayList<>();
        policies.forEach((name, policy) -> {
            List<LifecycleRule> rules = new ArrayList<>();
            for (Rule rule : policy.getRules()) {
                LifecycleAction action;
                try {
                    action = LifecycleAction.fromValue(rule.getAction());
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid rule in policy '" + name + "': " + e.getMessage(), e);
                }
                rules.add(new LifecycleRule(action, rule.getAge(), rule.getCondition()));
            }
            LifecyclePolicy lifecyclePolicy =
                new LifecyclePolicy(name, policy.getAppliesTo(), rules, policy.getCompliance());
            lifecyclePolicy.validate();
            result.add(lifecyclePolicy);
        });
        return result;
    }
    
    public LifecycleSettings toSettings() {
        return LifecycleSettings.builder()
            .batchSize(automation.getBatchSize())
            .interval(ScheduleParser.interval(automation.getSchedule()))
            .errorBackoff(automation.getErrorBackoff())
            .shutdownTimeout(automation.getShutdownTimeout())
            .automationEnabled(automation.isEnabled())
            .removeFromSourceOnTiering(automation.isRemoveFromSource())
            .archiveProvider(archiveProvider)
            .createdAtField(createdAtField)
            .lastAccessedField(lastAccessedField)
            .recordKeyField(recordKeyField)
            .managerName(managerName)
            .build();
    }
    
    public Map<String, Policy> getPolicies() {
        return policies;
    }
    
    public void setPolicies(Map<String, Policy> policies) {
        this.policies = policies;
    }
    
    public Automation getAutomation() {
        return automation;
    }
    
    public void setAutomation(Automation automation) {
        this.automation = automation;
    }
    
    public Map<String, String> getTables() {
        return tables;
    }
    
    public void setTables(Map<String, String> tables) {
        this.tables = tables;
    }
    
    public String getDefaultProvider() {
        return defaultProvider;
    }
    
    public void setDefaultProvider(String defaultProvider) {
        this.defaultProvider = defaultProvider;
    }
    
    public String getArchiveProvider() {
        return archiveProvider;
    }
    
    public void setArchiveProvider(String archiveProvider) {
        this.archiveProvider = archiveProvider;
    }
    
    public String getCreatedAtField() {
        return createdAtField;
    }
    
    public void setCreatedAtField(String createdAtField) {
        this.createdAtField = createdAtField;
    }
    
    public String getLastAccessedField() {
        return lastAccessedField;
    }
    
    public void setLastAccessedField(String lastAccessedField) {
        this.lastAccessedField = lastAccessedField;
    }
    
    public String getRecordKeyField() {
        return recordKeyField;
    }
    
    public void setRecordKeyField(String recordKeyField) {
        this.recordKeyField = recordKeyField;
    }
    
    public String getManagerName() {
        return managerName;
    }
    
    public void setManagerName(String managerName) {
        this.managerName = managerName;
    }
    
    public static class Policy {
        private List<String> appliesTo = new ArrayList<>();
        private List<Rule> rules = new ArrayList<>();
        private String compliance;
        
        public List<String> getAppliesTo() {
            return appliesTo;
        }
        
        public void setAppliesTo(List<String> appliesTo) {
            this.appliesTo = appliesTo;
        }
        
        public List<Rule> getRules() {
            return rules;
        }
        
        public void setRules(List<Rule> rules) {
            this.rules = rules;
        }
        
        public String getCompliance() {
            return compliance;
        }
        
        public void setCompliance(String compliance) {
            this.compliance = compliance;
        }
    }
    
    public static class Rule {
        private String action;
        private String age;
        private String condition;
        
        public String getAction() {
            return action;
        }
        
        public void setAction(String action) {
            this.action = action;
        }
        
        public String getAge() {
            return age;
        }
        
        public void setAge(String age) {
            this.age = age;
        }
        
        public String getCondition() {
            return condition;
        }
        
        public void setCondition(String condition) {
            this.condition = condition;
        }
    }
    
    public static class Automation {
        /**
         * {@code daily...} or {@code hourly...}; anything else runs daily
         */
        private String schedule = "daily";
        private int batchSize = LifecycleSettings.DEFAULT_BATCH_SIZE;
        private Duration errorBackoff = Duration.ofMinutes(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private boolean enabled = true;
        private boolean removeFromSource = true;
        
        public String getSchedule() {
            return schedule;
        }
        
        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }
        
        public int getBatchSize() {
            return batchSize;
        }
        
        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
        
        public Duration getErrorBackoff() {
            return errorBackoff;
        }
        
        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }
        
        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }
        
        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
        
        public boolean isEnabled() {
            return enabled;
        }
        
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
        
        public boolean isRemoveFromSource() {
            return removeFromSource;
        }
        
        public void setRemoveFromSource(boolean removeFromSource) {
            this.removeFromSource = removeFromSource;
        }
    }
}
