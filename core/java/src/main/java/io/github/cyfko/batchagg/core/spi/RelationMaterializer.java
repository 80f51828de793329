package io.github.cyfko.batchagg.core.spi;

import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.ResolvedRelationPath;

import java.util.List;

/**
 * Loads the actual related rows of a single parent.
 * <p>
 * Used whenever the engine falls back to ordinary relation behaviour: enumeration of
 * the collection, and aggregates computed with a per-row block or over a chain that
 * carries predicate blocks.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface RelationMaterializer {

    /**
     * Loads the related rows of the parent identified by {@code parentId}, with the
     * relation's built-in scope and {@code chain} applied (ordering included).
     *
     * @param parentId parent identifier
     * @param resolved resolved relation path
     * @param chain    caller filter chain
     * @param <T>      target entity type
     * @return the related rows, each target at most once
     */
    <T> List<T> load(Object parentId, ResolvedRelationPath resolved, FilterChain chain);
}
