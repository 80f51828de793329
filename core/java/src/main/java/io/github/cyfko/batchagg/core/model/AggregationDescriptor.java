package io.github.cyfko.batchagg.core.model;

import java.util.Objects;

/**
 * Canonical identity of one pending or cached aggregation, used verbatim as a
 * {@link io.github.cyfko.batchagg.core.cache.ResultCache} key.
 * <p>
 * Two descriptors are equal when relation, filter chain, function and column are all
 * equal. The relation is identified by its owner type and name, so two relations
 * with the same target but different built-in scopes never share an entry.
 * </p>
 *
 * @param ownerType    parent entity type
 * @param relationName relation name on the parent
 * @param chain        caller filter chain
 * @param function     aggregate function
 * @param column       aggregated column, {@code "*"} for the whole row
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AggregationDescriptor(
        Class<?> ownerType,
        String relationName,
        FilterChain chain,
        AggregateFunction function,
        String column
) {

    public AggregationDescriptor {
        Objects.requireNonNull(ownerType, "ownerType cannot be null");
        Objects.requireNonNull(relationName, "relationName cannot be null");
        Objects.requireNonNull(chain, "chain cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        if (column == null || column.isBlank()) {
            column = AggregateFunction.ALL_COLUMNS;
        }
        if (chain.hasBlocks()) {
            throw new IllegalArgumentException("A filter chain carrying blocks cannot identify a cached aggregation: " + chain);
        }
    }

    public static AggregationDescriptor of(RelationPath path, FilterChain chain, AggregateFunction function, String column) {
        return new AggregationDescriptor(path.ownerType(), path.name(), chain, function, column);
    }

    @Override
    public String toString() {
        return ownerType.getSimpleName() + "." + relationName + chain.steps() + "." + function.operationName() + "(" + column + ")";
    }
}
