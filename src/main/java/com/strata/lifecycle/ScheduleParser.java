package com.strata.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Maps schedule strings to the interval between lifecycle cycles.
 * Strings starting with {@code daily} run every 24 hours, with {@code hourly}
 * every hour. Anything else falls back to daily.
 */
public final class ScheduleParser {
    
    private static final Logger logger = LoggerFactory.getLogger(ScheduleParser.class);
    
    public static final Duration DAILY = Duration.ofHours(24);
    public static final Duration HOURLY = Duration.ofHours(1);
    
    private ScheduleParser() {
    }
    
    public static Duration interval(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            return DAILY;
        }
        String normalized = schedule.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("daily")) {
            return DAILY;
        }
        if (normalized.startsWith("hourly")) {
            return HOURLY;
        }
        logger.warn("Unrecognised lifecycle schedule '{}', running daily", schedule);
        return DAILY;
    }
}
