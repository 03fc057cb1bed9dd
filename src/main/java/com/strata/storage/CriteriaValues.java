package com.strata.storage;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Comparison rules shared by providers that evaluate criteria themselves.
 * Temporal values (Instant, Date, Timestamp, OffsetDateTime, ISO-8601
 * strings) compare by instant, numbers by value, everything else by its
 * string form.
 */
public final class CriteriaValues {
    
    private CriteriaValues() {
    }
    
    /**
     * Compare a record value with a criteria operand
     *
     * @return negative, zero or positive like {@link Comparable#compareTo}
     * @throws IllegalArgumentException if either value is null
     */
    public static int compare(Object recordValue, Object operand) {
        if (recordValue == null || operand == null) {
            throw new IllegalArgumentException("Cannot compare null values");
        }
        Instant left = toInstant(recordValue);
        Instant right = toInstant(operand);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        if (recordValue instanceof Number && operand instanceof Number) {
            return Double.compare(((Number) recordValue).doubleValue(), ((Number) operand).doubleValue());
        }
        return recordValue.toString().compareTo(operand.toString());
    }
    
    public static boolean matchesEquals(Object recordValue, Object operand) {
        if (recordValue == null) {
            return false;
        }
        return compare(recordValue, operand) == 0;
    }
    
    /**
     * Converts temporal values to an Instant, null if the value is not temporal
     */
    public static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof String) {
            String text = (String) value;
            if (text.length() < 20 || !text.contains("T")) {
                return null;
            }
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }
}
