package io.github.cyfko.batchagg.jpa.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;

import java.util.Collection;

/**
 * Builds the predicate restricting a grouped query to the parents of a batch.
 * <p>
 * Implementations can be swapped for database-specific forms (PostgreSQL
 * {@code ANY(array)}, temporary tables for very large batches, ...).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface IdPredicateBuilder {

    /**
     * Builds a predicate matching rows whose {@code groupKey} is one of {@code parentIds}.
     *
     * @param cb        JPA CriteriaBuilder
     * @param groupKey  expression of the parent identifier on the queried rows
     * @param parentIds identifiers of the batch
     * @return the restriction; never matches anything when {@code parentIds} is empty
     */
    Predicate buildIdPredicate(CriteriaBuilder cb, Expression<?> groupKey, Collection<?> parentIds);
}
