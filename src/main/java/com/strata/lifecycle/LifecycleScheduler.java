package com.strata.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the lifecycle cycle periodically on a Reactor scheduler.
 *
 * The wait between cycles is a {@link Mono#delay} that {@link #stop()}
 * disposes. A cycle that throws is logged and the next wait uses the error
 * backoff instead of the interval; the loop itself never dies.
 */
public class LifecycleScheduler {
    
    private static final Logger logger = LoggerFactory.getLogger(LifecycleScheduler.class);
    
    private final Runnable cycle;
    private final Duration interval;
    private final Duration errorBackoff;
    private final Duration shutdownTimeout;
    private final Scheduler scheduler;
    
    // Held for the whole duration of a cycle
    private final ReentrantLock cycleLock = new ReentrantLock();
    
    private SchedulerState state = SchedulerState.IDLE;
    private Disposable pendingDelay;
    
    public LifecycleScheduler(Runnable cycle, Duration interval, Duration errorBackoff,
                              Duration shutdownTimeout, Scheduler scheduler) {
        this.cycle = Objects.requireNonNull(cycle, "cycle");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.errorBackoff = Objects.requireNonNull(errorBackoff, "errorBackoff");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }
    
    /**
     * Schedules the first cycle one interval from now
     *
     * @throws IllegalStateException if the scheduler was already started
     */
    public synchronized void start() {
        if (state != SchedulerState.IDLE) {
            throw new IllegalStateException("Lifecycle scheduler already started (" + state + ")");
        }
        logger.info("Starting lifecycle scheduler: interval {}, error backoff {}", interval, errorBackoff);
        scheduleNext(interval);
    }
    
    /**
     * Runs one cycle in the calling thread, outside the periodic schedule.
     * Waits for a scheduled cycle in progress to finish first.
     *
     * @return true if the cycle completed without error
     */
    public boolean runOnce() {
        cycleLock.lock();
        try {
            if (getState() == SchedulerState.STOPPED) {
                logger.warn("Lifecycle scheduler stopped, on-demand cycle skipped");
                return false;
            }
            return runCycle();
        } finally {
            cycleLock.unlock();
        }
    }
    
    /**
     * Cancels the pending wait and waits for a running cycle to finish,
     * at most the shutdown timeout.
     */
    public void stop() {
        synchronized (this) {
            if (state == SchedulerState.STOPPED) {
                return;
            }
            logger.info("Stopping lifecycle scheduler ({})", state);
            state = SchedulerState.STOPPED;
            if (pendingDelay != null) {
                pendingDelay.dispose();
                pendingDelay = null;
            }
        }
        
        try {
            if (cycleLock.tryLock(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                cycleLock.unlock();
            } else {
                logger.warn("Lifecycle cycle still running after {}, continuing shutdown", shutdownTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the running lifecycle cycle");
        }
    }
    
    public synchronized SchedulerState getState() {
        return state;
    }
    
    private synchronized void scheduleNext(Duration delay) {
        if (state == SchedulerState.STOPPED) {
            return;
        }
        state = SchedulerState.WAITING;
        logger.debug("Next lifecycle cycle in {}", delay);
        pendingDelay = Mono.delay(delay, scheduler)
            .subscribe(
                tick -> runScheduledCycle(),
                error -> logger.error("Lifecycle scheduler delay failed", error));
    }
    
    private void runScheduledCycle() {
        boolean success;
        cycleLock.lock();
        try {
            if (!enterRunning()) {
                return;
            }
            success = runCycle();
        } finally {
            cycleLock.unlock();
        }
        scheduleNext(success ? interval : errorBackoff);
    }
    
    private boolean runCycle() {
        try {
            cycle.run();
            return true;
        } catch (RuntimeException e) {
            logger.error("Lifecycle cycle failed, next attempt in {}", errorBackoff, e);
            return false;
        }
    }
    
    private synchronized boolean enterRunning() {
        if (state == SchedulerState.STOPPED) {
            return false;
        }
        state = SchedulerState.RUNNING;
        return true;
    }
}
