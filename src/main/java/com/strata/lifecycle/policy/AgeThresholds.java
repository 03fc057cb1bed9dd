package com.strata.lifecycle.policy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses rule ages such as {@code 30_days}, {@code 1_month} or {@code 7 years}.
 * A month counts as 30 days and a year as 365 days.
 */
public final class AgeThresholds {
    
    private static final Pattern AGE_PATTERN =
        Pattern.compile("^\\s*(\\d+)[_ ]+(day|days|month|months|year|years)\\s*$", Pattern.CASE_INSENSITIVE);
    
    /**
     * Longest accepted age, ten thousand years of 365 days
     */
    public static final long MAX_AGE_DAYS = 365L * 10_000;
    
    private AgeThresholds() {
    }
    
    /**
     * @throws IllegalArgumentException if the age is not {@code <amount>_<unit>} or exceeds {@link #MAX_AGE_DAYS}
     */
    public static Duration parse(String age) {
        if (age == null) {
            throw new IllegalArgumentException("Age must not be null");
        }
        Matcher matcher = AGE_PATTERN.matcher(age);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid age '" + age
                + "', expected <amount>_<days|months|years>");
        }
        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        long daysPerUnit = unit.startsWith("day") ? 1 : unit.startsWith("month") ? 30 : 365;
        long days;
        try {
            days = Math.multiplyExact(Long.parseLong(matcher.group(1)), daysPerUnit);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Age '" + age + "' is too large", e);
        }
        if (days > MAX_AGE_DAYS) {
            throw new IllegalArgumentException("Age '" + age + "' exceeds " + MAX_AGE_DAYS + " days");
        }
        return Duration.ofDays(days);
    }
    
    /**
     * Absolute threshold: now according to the clock minus the age
     */
    public static Instant resolve(String age, Clock clock) {
        return clock.instant().minus(parse(age));
    }
}
