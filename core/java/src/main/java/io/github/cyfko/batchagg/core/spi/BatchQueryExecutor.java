package io.github.cyfko.batchagg.core.spi;

import io.github.cyfko.batchagg.core.model.AggregateFunction;
import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.ResolvedRelationPath;
import io.github.cyfko.batchagg.core.model.ResultMapping;

import java.util.Collection;

/**
 * Issues one grouped aggregate query for a whole batch of parents.
 * <p>
 * Instead of N+1 queries, an implementation executes a single query scoped to
 * {@code parentIds} through the grouping key, grouped by that key, with the
 * aggregate applied per group:
 * </p>
 * <pre>
 * SELECT groupKey, f(column) FROM target [JOIN ...]
 *  WHERE groupKey IN (:parentIds) AND &lt;relation scope&gt; AND &lt;chain&gt;
 *  GROUP BY groupKey
 * </pre>
 *
 * <p>
 * Failures of the underlying persistence layer propagate unchanged; implementations
 * neither retry nor mask them.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface BatchQueryExecutor {

    /**
     * Executes the grouped query.
     *
     * @param parentIds identifiers of every parent in the batch; an empty collection yields an
     *                  empty mapping without any query
     * @param resolved  resolved relation path (grouping, joins, deduplication)
     * @param chain     caller filter chain, applied after the relation's built-in scope
     * @param function  aggregate function
     * @param column    aggregated column, {@code "*"} for the whole row
     * @return the per-parent aggregate values
     */
    ResultMapping execute(Collection<?> parentIds,
                          ResolvedRelationPath resolved,
                          FilterChain chain,
                          AggregateFunction function,
                          String column);
}
