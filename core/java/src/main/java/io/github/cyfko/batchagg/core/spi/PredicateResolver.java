package io.github.cyfko.batchagg.core.spi;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Caller-supplied predicate block attached to a filter step.
 * <p>
 * {@code PredicateResolver} is a <strong>deferred predicate generator</strong>: it is
 * recorded on the relation proxy and only invoked when the relation is actually
 * materialized against a query root.
 * </p>
 *
 * <h2>Architectural Note</h2>
 * <p>
 * This interface lives in the core SPI package but uses JPA Criteria types. The JPA
 * Criteria API is the query abstraction the engine targets; other backends bridge
 * from it.
 * </p>
 *
 * <h2>Batching</h2>
 * <p>
 * Blocks cannot be compared, so a relation chain carrying one is never batched: each
 * aggregate on it is evaluated for its own parent only.
 * </p>
 *
 * <pre>{@code
 * long highScored = user.posts()
 *         .where((root, query, cb) -> cb.greaterThan(root.get("score"), 50))
 *         .count();
 * }</pre>
 *
 * @param <E> the target entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Resolves this block into a predicate over the target root.
     *
     * @param root  the target entity root
     * @param query the criteria query being built
     * @param cb    the criteria builder
     * @return the predicate to conjoin with the relation's other filters
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
