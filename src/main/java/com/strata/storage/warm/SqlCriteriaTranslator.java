package com.strata.storage.warm;

import com.strata.domain.CriteriaVisitor;
import com.strata.domain.QueryCriteria;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Translates criteria into a parameterised SQL WHERE clause.
 * Field names are validated as plain identifiers; values are always bound
 * as statement parameters.
 */
public class SqlCriteriaTranslator implements CriteriaVisitor<SqlCriteriaTranslator.SqlFragment> {
    
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    
    /**
     * Validates a table or column name
     *
     * @throws IllegalArgumentException if the name is not a plain SQL identifier
     */
    public static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }
    
    /**
     * Converts values to types every JDBC driver binds natively
     */
    public static Object toSqlValue(Object value) {
        if (value instanceof Instant) {
            return Timestamp.from((Instant) value);
        }
        return value;
    }
    
    @Override
    public SqlFragment visitEquals(QueryCriteria.Equals criteria) {
        return new SqlFragment(identifier(criteria.getField()) + " = ?",
            List.of(toSqlValue(criteria.getValue())));
    }
    
    @Override
    public SqlFragment visitLessThan(QueryCriteria.LessThan criteria) {
        return new SqlFragment(identifier(criteria.getField()) + " < ?",
            List.of(toSqlValue(criteria.getValue())));
    }
    
    @Override
    public SqlFragment visitRange(QueryCriteria.Range criteria) {
        String field = identifier(criteria.getField());
        return new SqlFragment(field + " >= ? AND " + field + " < ?",
            List.of(toSqlValue(criteria.getFrom()), toSqlValue(criteria.getTo())));
    }
    
    /**
     * WHERE clause body with its positional arguments
     */
    public static final class SqlFragment {
        private final String clause;
        private final List<Object> arguments;
        
        public SqlFragment(String clause, List<Object> arguments) {
            this.clause = clause;
            this.arguments = List.copyOf(arguments);
        }
        
        public String getClause() {
            return clause;
        }
        
        public List<Object> getArguments() {
            return arguments;
        }
        
        @Override
        public String toString() {
            return clause + " " + arguments;
        }
    }
}
