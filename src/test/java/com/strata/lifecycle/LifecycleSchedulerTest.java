package com.strata.lifecycle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LifecycleScheduler Tests")
class LifecycleSchedulerTest {
    
    private static final Duration INTERVAL = Duration.ofHours(1);
    private static final Duration BACKOFF = Duration.ofMinutes(1);
    
    private VirtualTimeScheduler virtualTime;
    private AtomicInteger runs;
    
    @BeforeEach
    void setUp() {
        virtualTime = VirtualTimeScheduler.create();
        runs = new AtomicInteger();
    }
    
    @AfterEach
    void tearDown() {
        virtualTime.dispose();
    }
    
    private LifecycleScheduler scheduler(Runnable cycle) {
        return new LifecycleScheduler(cycle, INTERVAL, BACKOFF, Duration.ofSeconds(1), virtualTime);
    }
    
    @Test
    @DisplayName("Should run a cycle once per interval")
    void shouldRunOncePerInterval() {
        // Given
        LifecycleScheduler scheduler = scheduler(runs::incrementAndGet);
        
        // When
        scheduler.start();
        
        // Then
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.WAITING);
        virtualTime.advanceTimeBy(INTERVAL.minusSeconds(1));
        assertThat(runs).hasValue(0);
        
        virtualTime.advanceTimeBy(Duration.ofSeconds(1));
        assertThat(runs).hasValue(1);
        
        virtualTime.advanceTimeBy(INTERVAL.multipliedBy(2));
        assertThat(runs).hasValue(3);
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.WAITING);
    }
    
    @Test
    @DisplayName("Should retry after the backoff when a cycle fails")
    void shouldBackOffAfterFailure() {
        // Given - the first cycle throws
        LifecycleScheduler scheduler = scheduler(() -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("provider unreachable");
            }
        });
        scheduler.start();
        
        // When
        virtualTime.advanceTimeBy(INTERVAL);
        assertThat(runs).hasValue(1);
        
        // Then - the next attempt comes after the backoff, not a full interval
        virtualTime.advanceTimeBy(BACKOFF);
        assertThat(runs).hasValue(2);
        
        virtualTime.advanceTimeBy(BACKOFF);
        assertThat(runs).hasValue(2);
        
        virtualTime.advanceTimeBy(INTERVAL);
        assertThat(runs).hasValue(3);
    }
    
    @Test
    @DisplayName("Should not run cycles after stop")
    void shouldNotRunAfterStop() {
        LifecycleScheduler scheduler = scheduler(runs::incrementAndGet);
        scheduler.start();
        
        scheduler.stop();
        virtualTime.advanceTimeBy(INTERVAL.multipliedBy(10));
        
        assertThat(runs).hasValue(0);
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.STOPPED);
    }
    
    @Test
    @DisplayName("Should report RUNNING while a cycle executes")
    void shouldReportRunningState() {
        LifecycleScheduler[] holder = new LifecycleScheduler[1];
        SchedulerState[] observed = new SchedulerState[1];
        holder[0] = scheduler(() -> observed[0] = holder[0].getState());
        holder[0].start();
        
        virtualTime.advanceTimeBy(INTERVAL);
        
        assertThat(observed[0]).isEqualTo(SchedulerState.RUNNING);
        assertThat(holder[0].getState()).isEqualTo(SchedulerState.WAITING);
    }
    
    @Test
    @DisplayName("Should reject a second start")
    void shouldRejectSecondStart() {
        LifecycleScheduler scheduler = scheduler(runs::incrementAndGet);
        scheduler.start();
        
        assertThatThrownBy(scheduler::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }
    
    @Test
    @DisplayName("Should run a cycle on demand")
    void shouldRunOnDemand() {
        LifecycleScheduler scheduler = scheduler(runs::incrementAndGet);
        LifecycleScheduler failing = scheduler(() -> {
            throw new IllegalStateException("boom");
        });
        
        assertThat(scheduler.runOnce()).isTrue();
        assertThat(runs).hasValue(1);
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.IDLE);
        assertThat(failing.runOnce()).isFalse();
    }
    
    @Test
    @DisplayName("Should skip on-demand cycles once stopped")
    void shouldSkipOnDemandAfterStop() {
        LifecycleScheduler scheduler = scheduler(runs::incrementAndGet);
        scheduler.stop();
        
        assertThat(scheduler.runOnce()).isFalse();
        assertThat(runs).hasValue(0);
    }
}
