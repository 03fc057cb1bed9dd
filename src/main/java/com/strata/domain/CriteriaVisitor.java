package com.strata.domain;

/**
 * Translates {@link QueryCriteria} into a provider specific representation.
 *
 * @param <R> the provider's query type (SQL fragment, in-memory predicate...)
 */
public interface CriteriaVisitor<R> {
    
    R visitEquals(QueryCriteria.Equals criteria);
    
    R visitLessThan(QueryCriteria.LessThan criteria);
    
    R visitRange(QueryCriteria.Range criteria);
}
