package com.strata.storage;

import com.strata.domain.CriteriaVisitor;
import com.strata.domain.QueryCriteria;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Translates criteria into predicates over records held in memory.
 * A record without the criteria field never matches.
 */
public class RecordPredicateTranslator implements CriteriaVisitor<Predicate<Map<String, Object>>> {
    
    public static final RecordPredicateTranslator INSTANCE = new RecordPredicateTranslator();
    
    /**
     * Predicate for optional criteria; null criteria match every record
     */
    public static Predicate<Map<String, Object>> toPredicate(QueryCriteria criteria) {
        return criteria == null ? record -> true : criteria.accept(INSTANCE);
    }
    
    @Override
    public Predicate<Map<String, Object>> visitEquals(QueryCriteria.Equals criteria) {
        return record -> CriteriaValues.matchesEquals(record.get(criteria.getField()), criteria.getValue());
    }
    
    @Override
    public Predicate<Map<String, Object>> visitLessThan(QueryCriteria.LessThan criteria) {
        return record -> {
            Object value = record.get(criteria.getField());
            return value != null && CriteriaValues.compare(value, criteria.getValue()) < 0;
        };
    }
    
    @Override
    public Predicate<Map<String, Object>> visitRange(QueryCriteria.Range criteria) {
        return record -> {
            Object value = record.get(criteria.getField());
            return value != null
                && CriteriaValues.compare(value, criteria.getFrom()) >= 0
                && CriteriaValues.compare(value, criteria.getTo()) < 0;
        };
    }
}
