package io.github.cyfko.batchagg.jpa;

import io.github.cyfko.batchagg.core.api.AggregationLoader;
import io.github.cyfko.batchagg.core.api.AggregationProxy;

import java.util.List;
import java.util.Objects;

/**
 * Parents fetched together with the loader serving their aggregates.
 *
 * @param parents the fetched parents, in query order
 * @param loader  loader whose batch is exactly {@code parents}
 * @param <P>     parent entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AggregatedResult<P>(List<P> parents, AggregationLoader<P> loader) {

    public AggregatedResult {
        Objects.requireNonNull(loader, "loader cannot be null");
        parents = List.copyOf(parents);
    }

    public <T> AggregationProxy<T> proxyFor(P parent, String relationName) {
        return loader.proxyFor(parent, relationName);
    }

    public int size() {
        return parents.size();
    }

    public boolean isEmpty() {
        return parents.isEmpty();
    }
}
