package com.strata.lifecycle;

import com.strata.domain.ArchivalCriteria;
import com.strata.domain.ArchivalResult;
import com.strata.domain.ExecutionContext;
import com.strata.domain.TechnologyType;
import com.strata.storage.FaultInjectingStorageProvider;
import com.strata.storage.InMemoryStorageProvider;
import com.strata.storage.ProviderRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.strata.lifecycle.LifecycleFixtures.CLOCK;
import static com.strata.lifecycle.LifecycleFixtures.NOW;
import static com.strata.lifecycle.LifecycleFixtures.seed;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DataLifecycleManager Archival Tests")
class DataLifecycleManagerArchivalTest {
    
    private static final String TABLE = "audit_log";
    private static final String ARCHIVE_TABLE = "audit_log_archive";
    private static final ArchivalCriteria OLDER_THAN_30_DAYS =
        new ArchivalCriteria(NOW.minus(Duration.ofDays(30)), true);
    
    private FaultInjectingStorageProvider orders;
    private FaultInjectingStorageProvider lake;
    private ProviderRegistry registry;
    
    @BeforeEach
    void setUp() {
        orders = new FaultInjectingStorageProvider("orders-db", TechnologyType.NEWSQL);
        lake = new FaultInjectingStorageProvider("lake", TechnologyType.OLAP_WAREHOUSE);
        
        registry = new ProviderRegistry();
        registry.register(orders);
        registry.register(lake);
        registry.assignTable(TABLE, "orders-db");
        
        seed(orders, TABLE, 10, 5);
    }
    
    private DataLifecycleManager newManager(LifecycleSettings settings) {
        return new DataLifecycleManager(registry, List.of(), settings, new SimpleMeterRegistry(), CLOCK,
            VirtualTimeScheduler.create());
    }
    
    private DataLifecycleManager newManager() {
        return newManager(LifecycleSettings.builder().batchSize(3).build());
    }
    
    @Test
    @DisplayName("Should archive old records and remove them from the source")
    void shouldArchiveAndRemove() {
        // Given
        DataLifecycleManager manager = newManager();
        
        // When
        ArchivalResult result = manager.archive(TABLE, OLDER_THAN_30_DAYS, ExecutionContext.of("archive-1"));
        
        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOperationId()).isEqualTo("archive-1");
        assertThat(result.getRecordsArchived()).isEqualTo(10);
        assertThat(result.getRecordsRemoved()).isEqualTo(10);
        assertThat(result.getArchiveLocation()).contains("lake/audit_log_archive");
        assertThat(result.getError()).isEmpty();
        assertThat(lake.count(ARCHIVE_TABLE)).isEqualTo(10);
        assertThat(orders.count(TABLE)).isEqualTo(5);
        assertThat(manager.getMetrics().getRecordsArchived()).isEqualTo(10);
        assertThat(manager.getActiveOperations()).isEmpty();
    }
    
    @Test
    @DisplayName("Should leave the source untouched when removal is not requested")
    void shouldArchiveWithoutRemoval() {
        DataLifecycleManager manager = newManager();
        
        ArchivalResult result = manager.archive(TABLE,
            new ArchivalCriteria(NOW.minus(Duration.ofDays(30)), false), ExecutionContext.of("archive-1"));
        
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRecordsRemoved()).isZero();
        assertThat(lake.count(ARCHIVE_TABLE)).isEqualTo(10);
        assertThat(orders.count(TABLE)).isEqualTo(15);
        assertThat(orders.getDeleteCalls()).isZero();
    }
    
    @Test
    @DisplayName("Should keep the source intact when the delete after archival fails")
    void shouldKeepSourceWhenDeleteFails() {
        // Given
        orders.failDeletes();
        DataLifecycleManager manager = newManager();
        
        // When
        ArchivalResult result = manager.archive(TABLE, OLDER_THAN_30_DAYS, ExecutionContext.of("archive-1"));
        
        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRecordsArchived()).isEqualTo(10);
        assertThat(result.getError()).hasValueSatisfying(error -> assertThat(error).contains("Injected delete failure"));
        assertThat(lake.count(ARCHIVE_TABLE)).isEqualTo(10);
        assertThat(orders.count(TABLE)).isEqualTo(15);
    }
    
    @Test
    @DisplayName("Should report partial progress and skip the delete when an archive write fails")
    void shouldReportPartialProgressOnWriteFailure() {
        // Given - the third archived record fails
        lake.failOnInsert(3);
        DataLifecycleManager manager = newManager();
        
        // When
        ArchivalResult result = manager.archive(TABLE, OLDER_THAN_30_DAYS, ExecutionContext.of("archive-1"));
        
        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRecordsArchived()).isEqualTo(2);
        assertThat(result.getArchiveLocation()).isEmpty();
        assertThat(orders.count(TABLE)).isEqualTo(15);
        assertThat(orders.getDeleteCalls()).isZero();
    }
    
    @Test
    @DisplayName("Should use the configured archive provider")
    void shouldUseConfiguredArchiveProvider() {
        // Given
        InMemoryStorageProvider vault = new InMemoryStorageProvider("vault", TechnologyType.OLAP_WAREHOUSE);
        registry.register(vault);
        DataLifecycleManager manager = newManager(LifecycleSettings.builder().archiveProvider("vault").build());
        
        // When
        ArchivalResult result = manager.archive(TABLE, OLDER_THAN_30_DAYS, ExecutionContext.of("archive-1"));
        
        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getArchiveLocation()).contains("vault/audit_log_archive");
        assertThat(vault.count(ARCHIVE_TABLE)).isEqualTo(10);
        assertThat(lake.count(ARCHIVE_TABLE)).isZero();
    }
    
    @Test
    @DisplayName("Should fail when no archive provider can be resolved")
    void shouldFailWithoutArchiveProvider() {
        registry = new ProviderRegistry();
        registry.register(orders);
        registry.assignTable(TABLE, "orders-db");
        DataLifecycleManager manager = newManager();
        
        ArchivalResult result = manager.archive(TABLE, OLDER_THAN_30_DAYS, ExecutionContext.of("archive-1"));
        
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRecordsArchived()).isZero();
        assertThat(result.getError()).hasValueSatisfying(error -> assertThat(error).contains("tier COLD"));
        assertThat(orders.count(TABLE)).isEqualTo(15);
    }
    
    @Test
    @DisplayName("Should stop archiving between batches once cancelled")
    void shouldStopArchivingWhenCancelled() {
        // Given - an archive provider that cancels the operation on its first write
        DataLifecycleManager[] holder = new DataLifecycleManager[1];
        InMemoryStorageProvider cancelling = new InMemoryStorageProvider("cancelling", TechnologyType.OLAP_WAREHOUSE) {
            @Override
            public void insert(String tableName, Map<String, Object> record, ExecutionContext context) {
                holder[0].cancelOperation("archive-1");
                super.insert(tableName, record, context);
            }
        };
        registry.register(cancelling);
        holder[0] = newManager(LifecycleSettings.builder().batchSize(3).archiveProvider("cancelling").build());
        
        // When
        ArchivalResult result = holder[0].archive(TABLE, OLDER_THAN_30_DAYS, ExecutionContext.of("archive-1"));
        
        // Then - the first batch of 3 completes, the next one is never started
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRecordsArchived()).isEqualTo(3);
        assertThat(result.getError()).hasValueSatisfying(error -> assertThat(error).contains("cancelled"));
        assertThat(orders.count(TABLE)).isEqualTo(15);
    }
}
