package com.strata.domain;

import java.util.Objects;

/**
 * Predicate over the records of a table.
 *
 * The set of shapes is closed: {@link Equals}, {@link LessThan} and
 * {@link Range}. Instances are immutable. Each storage provider translates
 * them into its own query mechanism through a {@link CriteriaVisitor}.
 */
public interface QueryCriteria {
    
    <R> R accept(CriteriaVisitor<R> visitor);
    
    static QueryCriteria eq(String field, Object value) {
        return new Equals(field, value);
    }
    
    static QueryCriteria lessThan(String field, Object value) {
        return new LessThan(field, value);
    }
    
    static QueryCriteria range(String field, Object from, Object to) {
        return new Range(field, from, to);
    }
    
    /**
     * field = value
     */
    final class Equals implements QueryCriteria {
        private final String field;
        private final Object value;
        
        public Equals(String field, Object value) {
            this.field = Objects.requireNonNull(field, "field");
            this.value = Objects.requireNonNull(value, "value");
        }
        
        public String getField() {
            return field;
        }
        
        public Object getValue() {
            return value;
        }
        
        @Override
        public <R> R accept(CriteriaVisitor<R> visitor) {
            return visitor.visitEquals(this);
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Equals)) return false;
            Equals other = (Equals) o;
            return field.equals(other.field) && value.equals(other.value);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash("eq", field, value);
        }
        
        @Override
        public String toString() {
            return field + " = " + value;
        }
    }
    
    /**
     * field &lt; value
     */
    final class LessThan implements QueryCriteria {
        private final String field;
        private final Object value;
        
        public LessThan(String field, Object value) {
            this.field = Objects.requireNonNull(field, "field");
            this.value = Objects.requireNonNull(value, "value");
        }
        
        public String getField() {
            return field;
        }
        
        public Object getValue() {
            return value;
        }
        
        @Override
        public <R> R accept(CriteriaVisitor<R> visitor) {
            return visitor.visitLessThan(this);
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof LessThan)) return false;
            LessThan other = (LessThan) o;
            return field.equals(other.field) && value.equals(other.value);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash("lt", field, value);
        }
        
        @Override
        public String toString() {
            return field + " < " + value;
        }
    }
    
    /**
     * from &lt;= field &lt; to
     */
    final class Range implements QueryCriteria {
        private final String field;
        private final Object from;
        private final Object to;
        
        public Range(String field, Object from, Object to) {
            this.field = Objects.requireNonNull(field, "field");
            this.from = Objects.requireNonNull(from, "from");
            this.to = Objects.requireNonNull(to, "to");
        }
        
        public String getField() {
            return field;
        }
        
        public Object getFrom() {
            return from;
        }
        
        public Object getTo() {
            return to;
        }
        
        @Override
        public <R> R accept(CriteriaVisitor<R> visitor) {
            return visitor.visitRange(this);
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Range)) return false;
            Range other = (Range) o;
            return field.equals(other.field) && from.equals(other.from) && to.equals(other.to);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash("range", field, from, to);
        }
        
        @Override
        public String toString() {
            return field + " in [" + from + ", " + to + ")";
        }
    }
}
