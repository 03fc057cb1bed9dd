package com.strata.lifecycle;

import com.strata.domain.ArchivalCriteria;
import com.strata.domain.ArchivalResult;
import com.strata.domain.DataTier;
import com.strata.domain.DataTieringCriteria;
import com.strata.domain.ExecutionContext;
import com.strata.domain.QueryCriteria;
import com.strata.domain.QuerySpec;
import com.strata.domain.RetentionResult;
import com.strata.domain.TableRetentionResult;
import com.strata.domain.TieringResult;
import com.strata.lifecycle.policy.LifecycleAction;
import com.strata.lifecycle.policy.LifecyclePolicy;
import com.strata.lifecycle.policy.LifecycleRule;
import com.strata.lifecycle.policy.PolicyCriteriaBuilder;
import com.strata.storage.ProviderRegistry;
import com.strata.storage.ProviderResolutionException;
import com.strata.storage.StorageProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Data lifecycle manager: hot/warm/cold tiering, archival and retention
 * across the providers of a {@link ProviderRegistry}, driven on demand or by
 * the periodic {@link LifecycleScheduler}.
 *
 * Operation methods never throw. Failures are logged and reported through
 * the {@code success} flag and partial counts of the returned results.
 * Every operation is registered in the tracker for its whole duration and
 * can be cancelled between batches. Once {@link #stop()} is called, running
 * operations are cancelled, a running cycle starts no further operation and
 * operations begun afterwards are cancelled as soon as they are registered.
 */
public class DataLifecycleManager {
    
    private static final Logger logger = LoggerFactory.getLogger(DataLifecycleManager.class);
    
    static final String ARCHIVE_TABLE_SUFFIX = "_archive";
    
    private static final AtomicInteger MANAGER_SEQUENCE = new AtomicInteger();
    
    private final ProviderRegistry providerRegistry;
    private final List<LifecyclePolicy> policies;
    private final LifecycleSettings settings;
    private final Clock clock;
    private final LifecycleOperationTracker tracker;
    private final LifecycleMetrics metrics;
    private final PolicyCriteriaBuilder criteriaBuilder;
    private final DataMover dataMover;
    private final LifecycleScheduler scheduler;
    
    private volatile boolean stopping;
    
    public DataLifecycleManager(ProviderRegistry providerRegistry, List<LifecyclePolicy> policies,
                                LifecycleSettings settings, MeterRegistry meterRegistry, Clock clock,
                                Scheduler reactorScheduler) {
        this.providerRegistry = providerRegistry;
        this.policies = List.copyOf(policies);
        this.settings = settings;
        this.clock = clock;
        this.policies.forEach(LifecyclePolicy::validate);
        
        this.tracker = new LifecycleOperationTracker();
        String managerName = settings.getManagerName() != null
            ? settings.getManagerName()
            : "lifecycle-manager-" + MANAGER_SEQUENCE.incrementAndGet();
        this.metrics = new LifecycleMetrics(meterRegistry, managerName, tracker);
        this.criteriaBuilder = new PolicyCriteriaBuilder(clock, settings.getCreatedAtField(),
            settings.getLastAccessedField());
        this.dataMover = new DataMover(settings.getBatchSize(), settings.getRecordKeyField(), metrics);
        this.scheduler = new LifecycleScheduler(this::runLifecycleCycle, settings.getInterval(),
            settings.getErrorBackoff(), settings.getShutdownTimeout(), reactorScheduler);
    }
    
    /**
     * Manager with its own meter registry, the UTC system clock and the shared single Reactor scheduler
     */
    public DataLifecycleManager(ProviderRegistry providerRegistry, List<LifecyclePolicy> policies,
                                LifecycleSettings settings) {
        this(providerRegistry, policies, settings, new SimpleMeterRegistry(), Clock.systemUTC(),
            Schedulers.single());
    }
    
    // ==========================================================================
    // Lifecycle
    // ==========================================================================
    
    /**
     * Starts the periodic scheduler, unless automation is disabled
     */
    public void start() {
        logger.info("Starting data lifecycle manager: {} policies, {}", policies.size(), settings);
        if (settings.isAutomationEnabled()) {
            scheduler.start();
        } else {
            logger.info("Lifecycle automation disabled, operations run on demand only");
        }
    }
    
    /**
     * Cancels every tracked operation, stops the scheduler and waits for a
     * running cycle to wind down, at most the shutdown timeout
     */
    public void stop() {
        logger.info("Stopping data lifecycle manager");
        stopping = true;
        int cancelled = tracker.cancelAll();
        scheduler.stop();
        cancelled += tracker.cancelAll();
        tracker.clear();
        logger.info("Data lifecycle manager stopped ({} operations cancelled)", cancelled);
    }
    
    public boolean isStopping() {
        return stopping;
    }
    
    // ==========================================================================
    // Tiering
    // ==========================================================================
    
    public TieringResult moveToHotTier(String tableName, DataTieringCriteria criteria, ExecutionContext context) {
        return moveToTier(DataTier.HOT, tableName, criteria, context);
    }
    
    public TieringResult moveToWarmTier(String tableName, DataTieringCriteria criteria, ExecutionContext context) {
        return moveToTier(DataTier.WARM, tableName, criteria, context);
    }
    
    public TieringResult moveToColdTier(String tableName, DataTieringCriteria criteria, ExecutionContext context) {
        return moveToTier(DataTier.COLD, tableName, criteria, context);
    }
    
    /**
     * Moves the records of a table matching the criteria to the first provider
     * of a tier. A table whose current provider already serves the tier is left
     * alone and reported as a successful move of 0 records.
     */
    public TieringResult moveToTier(DataTier tier, String tableName, DataTieringCriteria criteria,
                                    ExecutionContext context) {
        String operationId = context.getRequestId();
        LifecycleOperation operation;
        try {
            operation = beginOperation(operationId, LifecycleOperationType.moveTo(tier), tableName, clock.instant());
        } catch (IllegalStateException e) {
            logger.warn("Rejected move of {} to {} tier: {}", tableName, tier.getValue(), e.getMessage());
            return TieringResult.failure(operationId, e.getMessage(), 0, 0);
        }
        
        logger.info("Moving {} to {} tier [{}]", tableName, tier.getValue(), operationId);
        long start = System.nanoTime();
        try {
            List<StorageProvider> tierProviders = providerRegistry.providersForTier(tier);
            StorageProvider source = providerRegistry.providerForTable(tableName);
            
            if (tierProviders.contains(source)) {
                tracker.complete(operation);
                logger.info("{} already in {} tier on {} [{}]", tableName, tier.getValue(), source.getName(),
                    operationId);
                return new TieringResult(operationId, true, "Data already in " + tier.getValue() + " tier",
                    0, 0, source.getName(), source.getName());
            }
            
            StorageProvider target = tierProviders.get(0);
            QueryCriteria queryCriteria = criteriaBuilder.forTiering(criteria);
            DataMover.MoveOutcome outcome = dataMover.move(source, target, tableName, queryCriteria,
                criteria.isRemoveFromSource(), operation, context);
            
            tracker.complete(operation);
            return new TieringResult(operationId, true, "Data moved successfully", outcome.getRecordsRead(),
                elapsedMillis(start), source.getName(), target.getName());
            
        } catch (DataMoveException e) {
            tracker.fail(operation);
            logger.error("Failed to move {} to {} tier [{}]", tableName, tier.getValue(), operationId, e);
            return TieringResult.failure(operationId, "Failed to move data: " + e.getMessage(),
                e.getRecordsRead(), elapsedMillis(start));
        } catch (RuntimeException e) {
            tracker.fail(operation);
            logger.error("Failed to move {} to {} tier [{}]", tableName, tier.getValue(), operationId, e);
            return TieringResult.failure(operationId, "Failed to move data: " + e.getMessage(), 0,
                elapsedMillis(start));
        }
    }
    
    // ==========================================================================
    // Archival
    // ==========================================================================
    
    /**
     * Copies the records created before the criteria threshold into
     * {@code <table>_archive} on the archive provider. The source delete, when
     * requested, is issued only after every matching record was archived.
     */
    public ArchivalResult archive(String tableName, ArchivalCriteria criteria, ExecutionContext context) {
        String operationId = context.getRequestId();
        LifecycleOperation operation;
        try {
            operation = beginOperation(operationId, LifecycleOperationType.ARCHIVE, tableName, clock.instant());
        } catch (IllegalStateException e) {
            logger.warn("Rejected archival of {}: {}", tableName, e.getMessage());
            return ArchivalResult.failure(operationId, 0, 0, e.getMessage());
        }
        
        logger.info("Archiving {} records created before {} [{}]", tableName, criteria.getAgeThreshold(),
            operationId);
        long start = System.nanoTime();
        long recordsArchived = 0;
        try {
            StorageProvider source = providerRegistry.providerForTable(tableName);
            StorageProvider archiveProvider = resolveArchiveProvider();
            String archiveTable = tableName + ARCHIVE_TABLE_SUFFIX;
            QueryCriteria queryCriteria = criteriaBuilder.forArchival(criteria);
            int batchSize = settings.getBatchSize();
            
            try (Stream<Map<String, Object>> records =
                     source.executeQuery(QuerySpec.of(tableName, queryCriteria, batchSize), context)) {
                Iterator<Map<String, Object>> iterator = records.iterator();
                while (iterator.hasNext()) {
                    if (recordsArchived % batchSize == 0) {
                        operation.checkNotCancelled();
                    }
                    archiveProvider.insert(archiveTable, iterator.next(), context);
                    recordsArchived++;
                    metrics.recordArchived(1);
                }
            }
            
            long recordsRemoved = 0;
            if (criteria.isRemoveAfterArchive()) {
                operation.checkNotCancelled();
                recordsRemoved = source.delete(tableName, queryCriteria, context);
                logger.info("Removed {} archived records from {} [{}]", recordsRemoved, tableName, operationId);
            }
            
            tracker.complete(operation);
            String location = archiveProvider.getName() + "/" + archiveTable;
            logger.info("Archived {} records of {} to {} [{}]", recordsArchived, tableName, location, operationId);
            return ArchivalResult.success(operationId, recordsArchived, recordsRemoved, elapsedMillis(start),
                location);
            
        } catch (RuntimeException e) {
            tracker.fail(operation);
            logger.error("Failed to archive {} after {} records [{}]", tableName, recordsArchived, operationId, e);
            return ArchivalResult.failure(operationId, recordsArchived, elapsedMillis(start), e.getMessage());
        }
    }
    
    // ==========================================================================
    // Retention
    // ==========================================================================
    
    /**
     * Applies every policy to every table it governs, in configuration order.
     * A failing (policy, table) pair is reported and the sweep moves on.
     */
    public RetentionResult applyRetentionPolicies(ExecutionContext context) {
        return sweep(policies, context);
    }
    
    /**
     * Applies a single policy
     *
     * @throws IllegalArgumentException if no policy has that name
     */
    public RetentionResult applyRetentionPolicy(String policyName, ExecutionContext context) {
        LifecyclePolicy policy = getPolicy(policyName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown lifecycle policy: " + policyName));
        return sweep(List.of(policy), context);
    }
    
    private RetentionResult sweep(List<LifecyclePolicy> sweepPolicies, ExecutionContext context) {
        String operationId = context.getRequestId();
        List<TableRetentionResult> results = new ArrayList<>();
        LifecycleOperation operation;
        try {
            operation = beginOperation(operationId, LifecycleOperationType.RETENTION_SWEEP, null, clock.instant());
        } catch (IllegalStateException e) {
            logger.warn("Rejected retention sweep: {}", e.getMessage());
            for (LifecyclePolicy policy : sweepPolicies) {
                for (String tableName : policy.getAppliesTo()) {
                    results.add(TableRetentionResult.failure(tableName, policy.getName(), 0,
                        "Retention sweep rejected: " + e.getMessage()));
                }
            }
            return new RetentionResult(results);
        }
        
        logger.info("Applying {} retention policies [{}]", sweepPolicies.size(), operationId);
        try {
            for (LifecyclePolicy policy : sweepPolicies) {
                for (String tableName : policy.getAppliesTo()) {
                    if (stopping) {
                        operation.cancel();
                    }
                    operation.checkNotCancelled();
                    results.add(applyPolicyToTable(policy, tableName, context));
                }
            }
            tracker.complete(operation);
        } catch (OperationCancelledException e) {
            tracker.fail(operation);
            logger.warn("Retention sweep cancelled after {} tables [{}]", results.size(), operationId);
        }
        
        RetentionResult result = new RetentionResult(results);
        logger.info("Retention completed: {} [{}]", result, operationId);
        return result;
    }
    
    private TableRetentionResult applyPolicyToTable(LifecyclePolicy policy, String tableName,
                                                    ExecutionContext context) {
        long recordsDeleted = 0;
        List<LifecycleRule> rules = policy.getRules();
        try {
            for (int i = 0; i < rules.size(); i++) {
                LifecycleRule rule = rules.get(i);
                ExecutionContext ruleContext =
                    context.derive(rule.getAction().getValue() + ":" + policy.getName() + ":" + tableName + ":" + i);
                switch (rule.getAction()) {
                    case DELETE:
                        recordsDeleted += deleteByRule(tableName, rule, ruleContext);
                        break;
                    case ARCHIVE:
                        ArchivalResult archival = archive(tableName, criteriaBuilder.archivalCriteria(rule), ruleContext);
                        if (!archival.isSuccess()) {
                            return TableRetentionResult.failure(tableName, policy.getName(), recordsDeleted,
                                "Archival failed: " + archival.getError().orElse("unknown error"));
                        }
                        recordsDeleted += archival.getRecordsRemoved();
                        break;
                    default:
                        logger.debug("Skipping tiering rule {} of policy {} during retention",
                            rule, policy.getName());
                }
            }
            return TableRetentionResult.success(tableName, policy.getName(), recordsDeleted);
            
        } catch (RuntimeException e) {
            logger.error("Failed to apply retention policy {} to table {} [{}]",
                policy.getName(), tableName, context.getRequestId(), e);
            return TableRetentionResult.failure(tableName, policy.getName(), recordsDeleted, e.getMessage());
        }
    }
    
    private long deleteByRule(String tableName, LifecycleRule rule, ExecutionContext context) {
        LifecycleOperation operation = beginOperation(context.getRequestId(), LifecycleOperationType.DELETE,
            tableName, clock.instant());
        try {
            QueryCriteria criteria = criteriaBuilder.forRule(rule);
            StorageProvider provider = providerRegistry.providerForTable(tableName);
            operation.checkNotCancelled();
            long deleted = provider.delete(tableName, criteria, context);
            metrics.recordDeleted(deleted);
            tracker.complete(operation);
            logger.info("Deleted {} records from {} where {} [{}]", deleted, tableName, criteria,
                context.getRequestId());
            return deleted;
        } catch (RuntimeException e) {
            tracker.fail(operation);
            throw e;
        }
    }
    
    // ==========================================================================
    // Automatic lifecycle
    // ==========================================================================
    
    /**
     * One automatic cycle: the retention sweep, then every tiering rule
     * applied to the tables of its policy, sequentially.
     */
    public LifecycleCycleResult processAutomaticLifecycle(ExecutionContext context) {
        logger.info("Processing automatic lifecycle [{}]", context.getRequestId());
        RetentionResult retention = applyRetentionPolicies(context.derive("retention"));
        List<TieringResult> tiering = stopping ? List.of() : processDataTiering(context);
        LifecycleCycleResult result = new LifecycleCycleResult(context.getRequestId(), retention, tiering);
        logger.info("Automatic lifecycle completed: {}", result);
        return result;
    }
    
    /**
     * Triggers one cycle now, outside the schedule
     *
     * @return true if the cycle completed without error
     */
    public boolean runOnce() {
        return scheduler.runOnce();
    }
    
    private List<TieringResult> processDataTiering(ExecutionContext context) {
        List<TieringResult> results = new ArrayList<>();
        for (LifecyclePolicy policy : policies) {
            for (LifecycleRule rule : policy.getRules()) {
                LifecycleAction action = rule.getAction();
                if (!action.isTiering()) {
                    continue;
                }
                DataTier tier = action.getTargetTier().orElseThrow();
                for (String tableName : policy.getAppliesTo()) {
                    if (stopping) {
                        logger.info("Lifecycle manager stopping, tiering skipped after {} moves [{}]",
                            results.size(), context.getRequestId());
                        return results;
                    }
                    ExecutionContext moveContext =
                        context.derive(action.getValue() + ":" + policy.getName() + ":" + tableName);
                    TieringResult result = applyTieringRule(rule, tier, tableName, moveContext);
                    if (!result.isSuccess()) {
                        logger.warn("Tiering of {} by policy {} failed: {}", tableName, policy.getName(),
                            result.getMessage());
                    }
                    results.add(result);
                }
            }
        }
        return results;
    }
    
    private TieringResult applyTieringRule(LifecycleRule rule, DataTier tier, String tableName,
                                           ExecutionContext context) {
        DataTieringCriteria criteria;
        try {
            criteria = criteriaBuilder.tieringCriteria(rule, settings.isRemoveFromSourceOnTiering());
        } catch (RuntimeException e) {
            logger.error("Cannot resolve tiering rule {} for {} [{}]", rule, tableName, context.getRequestId(), e);
            return TieringResult.failure(context.getRequestId(), "Invalid tiering rule: " + e.getMessage(), 0, 0);
        }
        return moveToTier(tier, tableName, criteria, context);
    }
    
    void runLifecycleCycle() {
        long start = System.nanoTime();
        try {
            Instant now = clock.instant();
            ExecutionContext context = new ExecutionContext("lifecycle-" + now.toEpochMilli(), now,
                Map.of("source", "automatic_lifecycle"));
            processAutomaticLifecycle(context);
            metrics.recordCycle(Duration.ofNanos(System.nanoTime() - start));
        } catch (RuntimeException e) {
            metrics.recordCycleError();
            throw e;
        }
    }
    
    // ==========================================================================
    // Monitoring
    // ==========================================================================
    
    public LifecycleMetrics getMetrics() {
        return metrics;
    }
    
    public List<LifecycleOperation> getActiveOperations() {
        return tracker.getActiveOperations();
    }
    
    /**
     * Requests cancellation of an operation in flight
     *
     * @return true if a running operation with that id was found
     */
    public boolean cancelOperation(String operationId) {
        return tracker.cancel(operationId);
    }
    
    public SchedulerState getSchedulerState() {
        return scheduler.getState();
    }
    
    public List<LifecyclePolicy> getPolicies() {
        return policies;
    }
    
    public Optional<LifecyclePolicy> getPolicy(String policyName) {
        return policies.stream()
            .filter(policy -> policy.getName().equals(policyName))
            .findFirst();
    }
    
    private LifecycleOperation beginOperation(String operationId, LifecycleOperationType type, String tableName,
                                              Instant startTime) {
        LifecycleOperation operation = tracker.begin(operationId, type, tableName, startTime);
        if (stopping) {
            operation.cancel();
            logger.warn("Lifecycle manager stopping, {} cancelled on start", operationId);
        }
        return operation;
    }
    
    private StorageProvider resolveArchiveProvider() {
        String archiveProviderName = settings.getArchiveProvider();
        if (archiveProviderName != null) {
            return providerRegistry.getProvider(archiveProviderName)
                .orElseThrow(() -> new ProviderResolutionException("Unknown archive provider: " + archiveProviderName));
        }
        return providerRegistry.providersForTier(DataTier.COLD).get(0);
    }
    
    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
