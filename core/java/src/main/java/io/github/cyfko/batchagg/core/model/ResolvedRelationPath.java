package io.github.cyfko.batchagg.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The pieces a grouped query needs, derived from a {@link RelationPath}.
 *
 * @param path               the relation this resolution was computed for
 * @param groupByEntity      entity type holding the grouping column
 * @param groupByColumn      attribute path of the grouping key, relative to the last
 *                           joined entity (or the target root when {@code joinPlan} is empty)
 * @param requiresDistinct   whether the join can yield duplicate target rows per parent
 * @param joinPlan           associations joined, in order, starting from the target root
 * @param targetIdAttribute  identifier attribute of the target entity
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ResolvedRelationPath(
        RelationPath path,
        Class<?> groupByEntity,
        String groupByColumn,
        boolean requiresDistinct,
        List<String> joinPlan,
        String targetIdAttribute
) {

    public ResolvedRelationPath {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(groupByEntity, "groupByEntity cannot be null");
        Objects.requireNonNull(groupByColumn, "groupByColumn cannot be null");
        Objects.requireNonNull(targetIdAttribute, "targetIdAttribute cannot be null");
        joinPlan = joinPlan == null ? List.of() : List.copyOf(joinPlan);
    }

    /**
     * Column actually aggregated for {@code function}: the wildcard becomes the target
     * identifier for COUNT when rows must be deduplicated, and is kept as-is otherwise.
     */
    public String effectiveColumn(AggregateFunction function, String column) {
        String requested = column == null ? AggregateFunction.ALL_COLUMNS : column;
        if (function == AggregateFunction.COUNT && requiresDistinct
                && AggregateFunction.ALL_COLUMNS.equals(requested)) {
            return targetIdAttribute;
        }
        return requested;
    }

    /**
     * Whether {@code function} must be computed over distinct rows.
     */
    public boolean distinctFor(AggregateFunction function) {
        return requiresDistinct && (function == AggregateFunction.COUNT || function == AggregateFunction.EXISTS);
    }
}
