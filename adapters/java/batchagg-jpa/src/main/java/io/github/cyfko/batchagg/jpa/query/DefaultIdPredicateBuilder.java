package io.github.cyfko.batchagg.jpa.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Default implementation of {@link IdPredicateBuilder}.
 * <p>
 * Strategy:
 * <ul>
 * <li>one identifier: {@code key = ?}</li>
 * <li>up to {@code maxInClauseSize} identifiers: {@code key IN (...)}</li>
 * <li>more: {@code (key IN batch1) OR (key IN batch2) ...}</li>
 * </ul>
 * <p>
 * This implementation is database-agnostic and works with all JDBC-compliant
 * databases.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DefaultIdPredicateBuilder implements IdPredicateBuilder {

    /**
     * Oracle has a limit of 1000, most others are higher.
     * 500 is a safe default that works well with query planners.
     */
    public static final int DEFAULT_MAX_IN_CLAUSE_SIZE = 500;

    private final int maxInClauseSize;

    public DefaultIdPredicateBuilder() {
        this(DEFAULT_MAX_IN_CLAUSE_SIZE);
    }

    public DefaultIdPredicateBuilder(int maxInClauseSize) {
        if (maxInClauseSize <= 0) {
            throw new IllegalArgumentException("maxInClauseSize must be positive, got: " + maxInClauseSize);
        }
        this.maxInClauseSize = maxInClauseSize;
    }

    @Override
    public Predicate buildIdPredicate(CriteriaBuilder cb, Expression<?> groupKey, Collection<?> parentIds) {
        if (parentIds == null || parentIds.isEmpty()) {
            // No IDs = always false
            return cb.disjunction();
        }
        if (parentIds.size() == 1) {
            return cb.equal(groupKey, parentIds.iterator().next());
        }
        if (parentIds.size() <= maxInClauseSize) {
            return groupKey.in(parentIds);
        }
        return buildBatchedInPredicate(cb, groupKey, parentIds);
    }

    /**
     * Builds batched IN predicate: (key IN batch1) OR (key IN batch2) ...
     */
    private Predicate buildBatchedInPredicate(CriteriaBuilder cb, Expression<?> groupKey, Collection<?> parentIds) {
        List<?> idList = parentIds instanceof List<?> list ? list : new ArrayList<>(parentIds);
        List<Predicate> orPredicates = new ArrayList<>();

        for (int i = 0; i < idList.size(); i += maxInClauseSize) {
            int end = Math.min(i + maxInClauseSize, idList.size());
            orPredicates.add(groupKey.in(idList.subList(i, end)));
        }

        return cb.or(orPredicates.toArray(new Predicate[0]));
    }

    public int maxInClauseSize() {
        return maxInClauseSize;
    }
}
