package io.github.cyfko.batchagg.core.spi;

import io.github.cyfko.batchagg.core.model.FilterStep;

/**
 * A base query scope that recorded {@link FilterStep}s can be replayed onto.
 * <p>
 * Implementations translate each operation into their query language (JPA Criteria
 * predicates, in-memory filters, ...). An operation the scope does not understand
 * must fail with an exception; it is never silently ignored.
 * </p>
 *
 * @param <S> the concrete scope type, returned by {@link #apply(FilterStep)}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface RelationScope<S extends RelationScope<S>> {

    /**
     * Applies one step and returns the resulting scope (which may be {@code this}).
     *
     * @param step the step to apply
     * @return the scope after applying {@code step}
     * @throws io.github.cyfko.batchagg.core.exception.ScopeMaterializationException if the
     *         operation is unknown or its arguments do not fit
     */
    S apply(FilterStep step);
}
