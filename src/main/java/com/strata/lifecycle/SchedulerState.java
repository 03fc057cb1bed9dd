package com.strata.lifecycle;

/**
 * States of the lifecycle scheduler: IDLE until started, then alternating
 * between WAITING and RUNNING until STOPPED.
 */
public enum SchedulerState {
    IDLE,
    WAITING,
    RUNNING,
    STOPPED
}
