package io.github.cyfko.batchagg.jpa.scope;

import io.github.cyfko.batchagg.core.exception.ScopeMaterializationException;
import io.github.cyfko.batchagg.core.model.FilterStep;
import io.github.cyfko.batchagg.core.spi.PredicateResolver;
import io.github.cyfko.batchagg.core.spi.RelationScope;
import io.github.cyfko.batchagg.jpa.utils.AttributePaths;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * JPA Criteria rendition of a relation scope.
 * <p>
 * Replays recorded {@link FilterStep}s onto a query rooted at the relation's target
 * entity, collecting predicates and orderings. Operations are resolved in this order:
 * </p>
 * <ol>
 *   <li>a step carrying a {@link PredicateResolver} block contributes the block's predicate</li>
 *   <li>built-in operations: {@code where}, {@code whereNot}, {@code whereIn},
 *       {@code whereNull}, {@code whereNotNull}, {@code greaterThan},
 *       {@code greaterThanOrEqual}, {@code lessThan}, {@code lessThanOrEqual},
 *       {@code between}, {@code like}, {@code orderBy}, {@code orderByDesc}</li>
 *   <li>a named scope registered for the target type in the {@link ScopeRegistry}</li>
 * </ol>
 * Anything else fails with a {@link ScopeMaterializationException}, as do steps whose
 * arguments are missing or of the wrong kind. Errors raised by the Criteria API itself
 * (an unknown attribute, an incompatible value) propagate unchanged.
 *
 * <p>
 * A scope is bound to a single query and is not thread-safe.
 * </p>
 *
 * @param <T> the target entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JpaRelationScope<T> implements RelationScope<JpaRelationScope<T>> {

    private final Root<T> root;
    private final CriteriaQuery<?> query;
    private final CriteriaBuilder cb;
    private final ScopeRegistry scopes;
    private final List<Predicate> predicates = new ArrayList<>();
    private final List<Order> orders = new ArrayList<>();

    public JpaRelationScope(Root<T> root, CriteriaQuery<?> query, CriteriaBuilder cb, ScopeRegistry scopes) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.query = Objects.requireNonNull(query, "query cannot be null");
        this.cb = Objects.requireNonNull(cb, "cb cannot be null");
        this.scopes = Objects.requireNonNull(scopes, "scopes cannot be null");
    }

    /**
     * Applies one step. Criteria errors raised by the persistence provider, such as an
     * unknown attribute, propagate unchanged.
     *
     * @throws ScopeMaterializationException if the operation is unknown or its arguments
     *                                       do not have the expected shape
     */
    @Override
    @SuppressWarnings("unchecked")
    public JpaRelationScope<T> apply(FilterStep step) {
        Objects.requireNonNull(step, "step cannot be null");
        if (step.hasBlock()) {
            PredicateResolver<T> block = (PredicateResolver<T>) step.block().orElseThrow();
            return add(block.resolve(root, query, cb));
        }
        return applyOperation(step);
    }

    private JpaRelationScope<T> applyOperation(FilterStep step) {
        switch (step.operation()) {
            case "where":
                return where(attribute(step), argument(step, 1));
            case "whereNot":
                return whereNot(attribute(step), argument(step, 1));
            case "whereIn":
                return whereIn(attribute(step), valuesOf(step));
            case "whereNull":
                return whereNull(attribute(step));
            case "whereNotNull":
                return whereNotNull(attribute(step));
            case "greaterThan":
                return greaterThan(attribute(step), comparable(step, 1));
            case "greaterThanOrEqual":
                return greaterThanOrEqual(attribute(step), comparable(step, 1));
            case "lessThan":
                return lessThan(attribute(step), comparable(step, 1));
            case "lessThanOrEqual":
                return lessThanOrEqual(attribute(step), comparable(step, 1));
            case "between":
                return between(attribute(step), comparable(step, 1), comparable(step, 2));
            case "like":
                return like(attribute(step), String.valueOf(argument(step, 1)));
            case "orderBy":
                return orderBy(attribute(step));
            case "orderByDesc":
                return orderByDesc(attribute(step));
            default:
                return applyNamedScope(step);
        }
    }

    @SuppressWarnings("unchecked")
    private JpaRelationScope<T> applyNamedScope(FilterStep step) {
        Class<T> targetType = (Class<T>) root.getJavaType();
        NamedScope<T> scope = scopes.find(targetType, step.operation())
                .orElseThrow(() -> new ScopeMaterializationException(String.format(
                        "Unknown operation '%s' on %s: not a built-in filter nor a registered scope",
                        step.operation(), root.getJavaType().getSimpleName())));
        scope.apply(this, step.arguments());
        return this;
    }

    // ==================== Built-in filters ====================

    /**
     * Equality; a {@code null} value matches missing values and a collection matches any
     * of its elements.
     */
    public JpaRelationScope<T> where(String attribute, Object value) {
        if (value == null) {
            return whereNull(attribute);
        }
        if (value instanceof Collection<?> values) {
            return whereIn(attribute, values);
        }
        return add(cb.equal(path(attribute), value));
    }

    public JpaRelationScope<T> whereNot(String attribute, Object value) {
        if (value == null) {
            return whereNotNull(attribute);
        }
        if (value instanceof Collection<?> values) {
            return values.isEmpty() ? this : add(cb.not(path(attribute).in(values)));
        }
        return add(cb.notEqual(path(attribute), value));
    }

    /**
     * Membership; an empty collection matches nothing.
     */
    public JpaRelationScope<T> whereIn(String attribute, Collection<?> values) {
        if (values.isEmpty()) {
            return add(cb.disjunction());
        }
        return add(path(attribute).in(values));
    }

    public JpaRelationScope<T> whereNull(String attribute) {
        return add(cb.isNull(path(attribute)));
    }

    public JpaRelationScope<T> whereNotNull(String attribute) {
        return add(cb.isNotNull(path(attribute)));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public JpaRelationScope<T> greaterThan(String attribute, Comparable value) {
        return add(cb.greaterThan((Expression<Comparable>) path(attribute), value));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public JpaRelationScope<T> greaterThanOrEqual(String attribute, Comparable value) {
        return add(cb.greaterThanOrEqualTo((Expression<Comparable>) path(attribute), value));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public JpaRelationScope<T> lessThan(String attribute, Comparable value) {
        return add(cb.lessThan((Expression<Comparable>) path(attribute), value));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public JpaRelationScope<T> lessThanOrEqual(String attribute, Comparable value) {
        return add(cb.lessThanOrEqualTo((Expression<Comparable>) path(attribute), value));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public JpaRelationScope<T> between(String attribute, Comparable lower, Comparable upper) {
        return add(cb.between((Expression<Comparable>) path(attribute), lower, upper));
    }

    public JpaRelationScope<T> like(String attribute, String pattern) {
        return add(cb.like(AttributePaths.resolveTyped(root, attribute), pattern));
    }

    /**
     * Ordering is only honoured when rows are loaded; grouped aggregate queries ignore it.
     */
    public JpaRelationScope<T> orderBy(String attribute) {
        orders.add(cb.asc(path(attribute)));
        return this;
    }

    public JpaRelationScope<T> orderByDesc(String attribute) {
        orders.add(cb.desc(path(attribute)));
        return this;
    }

    /**
     * Conjoins an arbitrary predicate.
     */
    public JpaRelationScope<T> add(Predicate predicate) {
        predicates.add(Objects.requireNonNull(predicate, "predicate cannot be null"));
        return this;
    }

    // ==================== Results ====================

    public List<Predicate> predicates() {
        return Collections.unmodifiableList(predicates);
    }

    public List<Order> orders() {
        return Collections.unmodifiableList(orders);
    }

    public Root<T> root() {
        return root;
    }

    public CriteriaQuery<?> query() {
        return query;
    }

    public CriteriaBuilder criteriaBuilder() {
        return cb;
    }

    // ==================== Helpers ====================

    private Path<?> path(String attribute) {
        return AttributePaths.resolve(root, attribute);
    }

    private static Object argument(FilterStep step, int index) {
        if (index >= step.arguments().size()) {
            throw new ScopeMaterializationException("Operation '" + step.operation() + "' expects at least "
                    + (index + 1) + " argument(s), got " + step.arguments().size());
        }
        return step.arguments().get(index);
    }

    private static String attribute(FilterStep step) {
        Object attribute = argument(step, 0);
        if (!(attribute instanceof String name)) {
            throw new ScopeMaterializationException("Operation '" + step.operation()
                    + "' expects an attribute name as first argument, got " + attribute);
        }
        return name;
    }

    private static Collection<?> valuesOf(FilterStep step) {
        List<Object> arguments = step.arguments();
        if (arguments.size() == 2 && arguments.get(1) instanceof Collection<?> values) {
            return values;
        }
        return arguments.subList(1, arguments.size());
    }

    @SuppressWarnings("rawtypes")
    private static Comparable comparable(FilterStep step, int index) {
        Object value = argument(step, index);
        if (!(value instanceof Comparable<?> comparable)) {
            throw new ScopeMaterializationException("Operation '" + step.operation()
                    + "' expects a comparable value at position " + index + ", got " + value);
        }
        return comparable;
    }
}
