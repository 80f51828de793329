package io.github.cyfko.batchagg.jpa.query;

import io.github.cyfko.batchagg.core.model.AggregateFunction;
import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.ResolvedRelationPath;
import io.github.cyfko.batchagg.core.model.ResultMapping;
import io.github.cyfko.batchagg.core.spi.BatchQueryExecutor;
import io.github.cyfko.batchagg.jpa.scope.JpaRelationScope;
import io.github.cyfko.batchagg.jpa.scope.ScopeRegistry;
import io.github.cyfko.batchagg.jpa.utils.AttributePaths;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link BatchQueryExecutor} issuing JPA Criteria tuple queries.
 * <p>
 * For a direct relation {@code User.posts} (foreign key {@code Post.user}) and
 * {@code count()}, the query is:
 * </p>
 * <pre>
 * SELECT p.user.id AS parentId, COUNT(p) AS aggregateValue
 *   FROM Post p
 *  WHERE p.user.id IN (:ids) AND &lt;scope&gt; AND &lt;chain&gt;
 *  GROUP BY p.user.id
 * </pre>
 * <p>
 * Through relations join from the target to the intermediate entity and group by the
 * intermediate's parent key. Every function then works on distinct targets, so a target
 * linked several times to the same parent is counted once: COUNT uses
 * {@code COUNT(DISTINCT ...)}, EXISTS selects the distinct parent keys only, and SUM and
 * AVERAGE select the distinct {@code (parent key, target id, column)} rows of the batch
 * and reduce them per parent. MAXIMUM and MINIMUM are not affected by duplicates.
 * </p>
 *
 * <p>
 * Ordering steps are ignored. {@code EntityManager} is not thread-safe, so queries sharing
 * one are serialized on it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaBatchQueryExecutor implements BatchQueryExecutor {

    private static final Logger logger = Logger.getLogger(JpaBatchQueryExecutor.class.getName());

    static final String PARENT_ID_ALIAS = "parentId";
    static final String AGGREGATE_VALUE_ALIAS = "aggregateValue";
    static final String TARGET_ID_ALIAS = "targetId";

    private final EntityManager em;
    private final ScopeRegistry scopes;
    private final IdPredicateBuilder idPredicateBuilder;

    public JpaBatchQueryExecutor(EntityManager em, ScopeRegistry scopes) {
        this(em, scopes, new DefaultIdPredicateBuilder());
    }

    public JpaBatchQueryExecutor(EntityManager em, ScopeRegistry scopes, IdPredicateBuilder idPredicateBuilder) {
        this.em = Objects.requireNonNull(em, "EntityManager cannot be null");
        this.scopes = Objects.requireNonNull(scopes, "scopes cannot be null");
        this.idPredicateBuilder = Objects.requireNonNull(idPredicateBuilder, "idPredicateBuilder cannot be null");
    }

    @Override
    public ResultMapping execute(Collection<?> parentIds,
                                 ResolvedRelationPath resolved,
                                 FilterChain chain,
                                 AggregateFunction function,
                                 String column) {
        Objects.requireNonNull(resolved, "resolved cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        if (parentIds == null || parentIds.isEmpty()) {
            return ResultMapping.empty();
        }
        FilterChain steps = chain == null ? FilterChain.empty() : chain;
        String requested = column == null || column.isBlank() ? AggregateFunction.ALL_COLUMNS : column;

        long startTime = System.nanoTime();
        ResultMapping mapping;
        synchronized (em) {
            mapping = executeGrouped(resolved.path().targetType(), parentIds, resolved, steps, function, requested);
        }
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.fine(() -> String.format("%s(%s) on %s for %d parents completed in %dms: %d groups",
                function.operationName(), requested, resolved.path().qualifiedName(),
                parentIds.size(), durationMs, mapping.size()));
        return mapping;
    }

    private <T> ResultMapping executeGrouped(Class<T> targetType,
                                             Collection<?> parentIds,
                                             ResolvedRelationPath resolved,
                                             FilterChain chain,
                                             AggregateFunction function,
                                             String column) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<T> root = query.from(targetType);

        Path<?> groupKey = groupKeyOf(root, resolved);

        JpaRelationScope<T> scope = resolved.path().scope().concat(chain)
                .materialize(new JpaRelationScope<>(root, query, cb, scopes));

        List<Predicate> restrictions = new ArrayList<>();
        restrictions.add(idPredicateBuilder.buildIdPredicate(cb, groupKey, parentIds));
        restrictions.addAll(scope.predicates());

        if (function == AggregateFunction.EXISTS) {
            query.multiselect(groupKey.alias(PARENT_ID_ALIAS)).distinct(true);
            query.where(restrictions.toArray(new Predicate[0]));

            List<Object> keys = new ArrayList<>();
            for (Tuple tuple : em.createQuery(query).getResultList()) {
                keys.add(tuple.get(PARENT_ID_ALIAS));
            }
            return ResultMapping.ofKeys(keys);
        }

        if (resolved.requiresDistinct()
                && (function == AggregateFunction.SUM || function == AggregateFunction.AVERAGE)) {
            Path<?> value = AttributePaths.resolve(root, requireColumn(resolved, function, column));
            query.multiselect(groupKey.alias(PARENT_ID_ALIAS),
                            root.get(resolved.targetIdAttribute()).alias(TARGET_ID_ALIAS),
                            value.alias(AGGREGATE_VALUE_ALIAS))
                    .distinct(true);
            query.where(restrictions.toArray(new Predicate[0]));

            Map<Object, List<Number>> perParent = new LinkedHashMap<>();
            for (Tuple tuple : em.createQuery(query).getResultList()) {
                perParent.computeIfAbsent(tuple.get(PARENT_ID_ALIAS), k -> new ArrayList<>())
                        .add((Number) tuple.get(AGGREGATE_VALUE_ALIAS));
            }
            Map<Object, Object> values = new LinkedHashMap<>();
            perParent.forEach((parentId, numbers) -> values.put(parentId,
                    function == AggregateFunction.SUM ? sumOf(numbers) : averageOf(numbers)));
            return ResultMapping.of(values);
        }

        Expression<?> aggregate = aggregateExpression(cb, root, resolved, function, column, restrictions);
        query.multiselect(groupKey.alias(PARENT_ID_ALIAS), aggregate.alias(AGGREGATE_VALUE_ALIAS));
        query.where(restrictions.toArray(new Predicate[0]));
        query.groupBy(groupKey);

        Map<Object, Object> values = new LinkedHashMap<>();
        for (Tuple tuple : em.createQuery(query).getResultList()) {
            values.put(tuple.get(PARENT_ID_ALIAS), tuple.get(AGGREGATE_VALUE_ALIAS));
        }
        return ResultMapping.of(values);
    }

    /**
     * Follows the join plan from the target root and resolves the grouping column on
     * the last joined entity.
     */
    static Path<?> groupKeyOf(Root<?> root, ResolvedRelationPath resolved) {
        From<?, ?> from = root;
        for (String association : resolved.joinPlan()) {
            from = from.join(association);
        }
        return AttributePaths.resolve(from, resolved.groupByColumn());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Expression<?> aggregateExpression(CriteriaBuilder cb,
                                                     Root<?> root,
                                                     ResolvedRelationPath resolved,
                                                     AggregateFunction function,
                                                     String column,
                                                     List<Predicate> restrictions) {
        String effective = resolved.effectiveColumn(function, column);

        if (function == AggregateFunction.COUNT) {
            if (AggregateFunction.ALL_COLUMNS.equals(effective)) {
                return cb.count(root);
            }
            Path<?> path = AttributePaths.resolve(root, effective);
            if (!resolved.distinctFor(function)) {
                return cb.count(path);
            }
            if (effective.equals(resolved.targetIdAttribute())) {
                return cb.countDistinct(path);
            }
            // Distinct targets having a value in the column
            restrictions.add(cb.isNotNull(path));
            return cb.countDistinct(root.get(resolved.targetIdAttribute()));
        }

        Path path = AttributePaths.resolve(root, requireColumn(resolved, function, effective));
        switch (function) {
            case SUM:
                return cb.sum(path);
            case AVERAGE:
                return cb.avg(path);
            case MAXIMUM:
                return cb.greatest(path);
            case MINIMUM:
                return cb.least(path);
            default:
                throw new IllegalArgumentException("Unsupported aggregate function: " + function);
        }
    }

    private static String requireColumn(ResolvedRelationPath resolved, AggregateFunction function, String column) {
        if (AggregateFunction.ALL_COLUMNS.equals(column)) {
            throw new IllegalArgumentException(function.operationName() + " on "
                    + resolved.path().qualifiedName() + " requires a column name");
        }
        return column;
    }

    /**
     * Sum with SQL typing: integral values give a {@code Long}, decimals a
     * {@code BigDecimal}, anything else a {@code Double}. {@code null} when every value is null.
     */
    static Number sumOf(List<Number> numbers) {
        boolean any = false;
        boolean exact = true;
        boolean decimal = false;
        for (Number n : numbers) {
            if (n == null) continue;
            any = true;
            if (n instanceof BigDecimal) {
                decimal = true;
            } else if (!(n instanceof Long || n instanceof Integer || n instanceof Short
                    || n instanceof Byte || n instanceof BigInteger)) {
                exact = false;
            }
        }
        if (!any) {
            return null;
        }
        if (decimal && exact) {
            BigDecimal total = BigDecimal.ZERO;
            for (Number n : numbers) {
                if (n != null) total = total.add(n instanceof BigDecimal d ? d : new BigDecimal(n.toString()));
            }
            return total;
        }
        if (exact) {
            long total = 0L;
            for (Number n : numbers) {
                if (n != null) total += n.longValue();
            }
            return total;
        }
        double total = 0.0;
        for (Number n : numbers) {
            if (n != null) total += n.doubleValue();
        }
        return total;
    }

    /**
     * Average of the non-null values, {@code null} when there is none.
     */
    static Double averageOf(List<Number> numbers) {
        double total = 0.0;
        int count = 0;
        for (Number n : numbers) {
            if (n == null) continue;
            total += n.doubleValue();
            count++;
        }
        return count == 0 ? null : total / count;
    }
}
