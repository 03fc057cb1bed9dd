package com.strata.lifecycle.policy;

import com.strata.domain.QueryCriteria;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses rule conditions into criteria.
 *
 * <pre>
 *   status = inactive           Equals
 *   score &lt; 10                  LessThan
 *   created_at between a and b  Range, lower bound inclusive
 * </pre>
 *
 * Operands that are ISO-8601 instants become {@link Instant}, integer
 * literals become {@link Long}, anything else a string with surrounding
 * quotes removed.
 */
public final class ConditionParser {
    
    private static final Pattern BETWEEN =
        Pattern.compile("^\\s*(\\w+)\\s+between\\s+(.+?)\\s+and\\s+(.+?)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LESS_THAN = Pattern.compile("^\\s*(\\w+)\\s*<\\s*(.+?)\\s*$");
    private static final Pattern EQUALS = Pattern.compile("^\\s*(\\w+)\\s*=\\s*(.+?)\\s*$");
    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    
    private ConditionParser() {
    }
    
    /**
     * @throws IllegalArgumentException if the condition matches none of the supported forms
     */
    public static QueryCriteria parse(String condition) {
        if (condition == null || condition.isBlank()) {
            throw new IllegalArgumentException("Condition must not be empty");
        }
        Matcher matcher = BETWEEN.matcher(condition);
        if (matcher.matches()) {
            return QueryCriteria.range(matcher.group(1), operand(matcher.group(2)), operand(matcher.group(3)));
        }
        matcher = LESS_THAN.matcher(condition);
        if (matcher.matches()) {
            return QueryCriteria.lessThan(matcher.group(1), operand(matcher.group(2)));
        }
        matcher = EQUALS.matcher(condition);
        if (matcher.matches()) {
            return QueryCriteria.eq(matcher.group(1), operand(matcher.group(2)));
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition);
    }
    
    static Object operand(String raw) {
        String text = raw.trim();
        if (text.length() >= 2
            && ((text.startsWith("'") && text.endsWith("'")) || (text.startsWith("\"") && text.endsWith("\"")))) {
            return text.substring(1, text.length() - 1);
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return text;
            }
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return text;
        }
    }
}
