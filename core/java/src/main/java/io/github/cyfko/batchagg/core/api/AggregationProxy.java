package io.github.cyfko.batchagg.core.api;

import io.github.cyfko.batchagg.core.model.AggregateFunction;
import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.FilterStep;
import io.github.cyfko.batchagg.core.model.RelationPath;
import io.github.cyfko.batchagg.core.spi.PredicateResolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.stream.Stream;

/**
 * Lazily evaluated handle on one parent's related collection, returned by
 * {@link AggregationLoader#proxyFor(Object, String)} in place of the live relation.
 * <p>
 * A proxy behaves in one of three ways:
 * </p>
 * <ol>
 *   <li><strong>Aggregate</strong> ({@link #count()}, {@link #sum(String)}, {@link #exists()}, ...):
 *       answered from one grouped query shared by every parent of the batch.</li>
 *   <li><strong>Aggregate with a per-row block</strong> ({@link #sum(ToDoubleFunction)}, ...):
 *       cannot be expressed as a grouped aggregate; the rows of this parent alone are
 *       loaded and reduced in memory.</li>
 *   <li><strong>Anything else</strong> ({@link #where(String, Object)}, {@link #scope(String, Object...)},
 *       {@link #orderBy(String)}, ...): recorded as a filter step on a new proxy, nothing runs.</li>
 * </ol>
 * <p>
 * Enumeration ({@link #toList()}, {@link #stream()}, iteration) always loads the real rows.
 * </p>
 *
 * <pre>{@code
 * AggregationLoader<User> loader = context.createLoader(User.class, users);
 * for (User user : users) {
 *     long evenPosts = loader.<Post>proxyFor(user, "posts").where("title", "Even").count();
 * }
 * // one grouped query for all users
 * }</pre>
 *
 * <p>
 * Proxies are immutable and never touch the parent entity.
 * </p>
 *
 * @param <T> target entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AggregationProxy<T> implements Iterable<T> {

    private final AggregationLoader<?> loader;
    private final Object parent;
    private final Object parentId;
    private final RelationPath relation;
    private final FilterChain chain;

    AggregationProxy(AggregationLoader<?> loader, Object parent, Object parentId, RelationPath relation, FilterChain chain) {
        this.loader = loader;
        this.parent = parent;
        this.parentId = parentId;
        this.relation = relation;
        this.chain = chain;
    }

    // ==================== Chain extension ====================

    /**
     * Appends an arbitrary operation. The operation must be understood by the target's
     * scope when the chain is materialized.
     */
    public AggregationProxy<T> chain(String operation, Object... arguments) {
        return extend(FilterStep.of(operation, arguments));
    }

    public AggregationProxy<T> where(String attribute, Object value) {
        return chain("where", attribute, value);
    }

    /**
     * Adds a Criteria predicate block. Aggregates on the resulting chain are not batched.
     */
    public AggregationProxy<T> where(PredicateResolver<T> block) {
        return extend(FilterStep.withBlock("where", block));
    }

    public AggregationProxy<T> whereNot(String attribute, Object value) {
        return chain("whereNot", attribute, value);
    }

    public AggregationProxy<T> whereIn(String attribute, Collection<?> values) {
        return chain("whereIn", attribute, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public AggregationProxy<T> whereNull(String attribute) {
        return chain("whereNull", attribute);
    }

    public AggregationProxy<T> whereNotNull(String attribute) {
        return chain("whereNotNull", attribute);
    }

    public AggregationProxy<T> greaterThan(String attribute, Comparable<?> value) {
        return chain("greaterThan", attribute, value);
    }

    public AggregationProxy<T> greaterThanOrEqual(String attribute, Comparable<?> value) {
        return chain("greaterThanOrEqual", attribute, value);
    }

    public AggregationProxy<T> lessThan(String attribute, Comparable<?> value) {
        return chain("lessThan", attribute, value);
    }

    public AggregationProxy<T> lessThanOrEqual(String attribute, Comparable<?> value) {
        return chain("lessThanOrEqual", attribute, value);
    }

    public AggregationProxy<T> between(String attribute, Comparable<?> lower, Comparable<?> upper) {
        return chain("between", attribute, lower, upper);
    }

    public AggregationProxy<T> like(String attribute, String pattern) {
        return chain("like", attribute, pattern);
    }

    public AggregationProxy<T> orderBy(String attribute) {
        return chain("orderBy", attribute);
    }

    public AggregationProxy<T> orderByDesc(String attribute) {
        return chain("orderByDesc", attribute);
    }

    /**
     * Applies a named scope registered for the target type.
     */
    public AggregationProxy<T> scope(String name, Object... arguments) {
        return chain(name, arguments);
    }

    // ==================== Batched aggregates ====================

    public long count() {
        return count(AggregateFunction.ALL_COLUMNS);
    }

    public long count(String column) {
        return ((Number) aggregate(AggregateFunction.COUNT, column)).longValue();
    }

    /**
     * Sum of {@code column}; {@code 0L} when the parent has no matching rows.
     */
    public Number sum(String column) {
        return (Number) aggregate(AggregateFunction.SUM, column);
    }

    public Optional<Double> average(String column) {
        Number value = (Number) aggregate(AggregateFunction.AVERAGE, column);
        return value == null ? Optional.empty() : Optional.of(value.doubleValue());
    }

    @SuppressWarnings("unchecked")
    public <V> Optional<V> maximum(String column) {
        return Optional.ofNullable((V) aggregate(AggregateFunction.MAXIMUM, column));
    }

    @SuppressWarnings("unchecked")
    public <V> Optional<V> minimum(String column) {
        return Optional.ofNullable((V) aggregate(AggregateFunction.MINIMUM, column));
    }

    public boolean exists() {
        return (Boolean) aggregate(AggregateFunction.EXISTS, AggregateFunction.ALL_COLUMNS);
    }

    // ==================== Deferred aggregates ====================

    public DeferredValue<Long> asyncCount() {
        return DeferredValue.of(this::count);
    }

    public DeferredValue<Long> asyncCount(String column) {
        return DeferredValue.of(() -> count(column));
    }

    public DeferredValue<Number> asyncSum(String column) {
        return DeferredValue.of(() -> sum(column));
    }

    public DeferredValue<Optional<Double>> asyncAverage(String column) {
        return DeferredValue.of(() -> average(column));
    }

    public <V> DeferredValue<Optional<V>> asyncMaximum(String column) {
        return DeferredValue.of(() -> maximum(column));
    }

    public <V> DeferredValue<Optional<V>> asyncMinimum(String column) {
        return DeferredValue.of(() -> minimum(column));
    }

    public DeferredValue<Boolean> asyncExists() {
        return DeferredValue.of(this::exists);
    }

    // ==================== Per-row blocks (not batched) ====================

    public long count(Predicate<? super T> condition) {
        Objects.requireNonNull(condition, "condition cannot be null");
        return toList().stream().filter(condition).count();
    }

    public double sum(ToDoubleFunction<? super T> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        return toList().stream().mapToDouble(mapper).sum();
    }

    public OptionalDouble average(ToDoubleFunction<? super T> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        return toList().stream().mapToDouble(mapper).average();
    }

    public <C extends Comparable<? super C>> Optional<C> maximum(Function<? super T, ? extends C> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        return toList().stream().<C>map(mapper).filter(Objects::nonNull).max(Comparator.naturalOrder());
    }

    public <C extends Comparable<? super C>> Optional<C> minimum(Function<? super T, ? extends C> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        return toList().stream().<C>map(mapper).filter(Objects::nonNull).min(Comparator.naturalOrder());
    }

    public boolean exists(Predicate<? super T> condition) {
        Objects.requireNonNull(condition, "condition cannot be null");
        return toList().stream().anyMatch(condition);
    }

    // ==================== Enumeration (not batched) ====================

    /**
     * Loads the related rows of this parent, with every recorded step applied.
     */
    public List<T> toList() {
        return loader.materialize(parentId, relation, chain);
    }

    public Stream<T> stream() {
        return toList().stream();
    }

    @Override
    public Iterator<T> iterator() {
        return toList().iterator();
    }

    // ==================== Dynamic dispatch ====================

    /**
     * Calls {@code name} classified through {@link ProxyCall#classify(String)}.
     * <p>
     * Aggregates accept an optional column name as first argument and return the raw
     * scalar ({@code null} when absent for AVERAGE, MAXIMUM and MINIMUM), deferred aggregates
     * return a {@link DeferredValue}, enumerations return a {@link List} and any other name
     * returns a new proxy.
     * </p>
     */
    public Object invoke(String name, Object... arguments) {
        ProxyCall call = ProxyCall.classify(name);
        if (call instanceof ProxyCall.AggregateDispatch dispatch) {
            String column = columnArgument(dispatch.function(), arguments);
            if (dispatch.deferred()) {
                return DeferredValue.of(() -> aggregate(dispatch.function(), column));
            }
            return aggregate(dispatch.function(), column);
        }
        if (call instanceof ProxyCall.FallbackMaterialize) {
            return toList();
        }
        return chain(name, arguments);
    }

    // ==================== Accessors ====================

    public Object parent() {
        return parent;
    }

    public Object parentId() {
        return parentId;
    }

    public RelationPath relation() {
        return relation;
    }

    public FilterChain filterChain() {
        return chain;
    }

    private AggregationProxy<T> extend(FilterStep step) {
        return new AggregationProxy<>(loader, parent, parentId, relation, chain.append(step));
    }

    private Object aggregate(AggregateFunction function, String column) {
        return loader.aggregate(parentId, relation, chain, function, column);
    }

    private static String columnArgument(AggregateFunction function, Object[] arguments) {
        if (arguments == null || arguments.length == 0 || arguments[0] == null) {
            return AggregateFunction.ALL_COLUMNS;
        }
        if (arguments[0] instanceof String column) {
            return column;
        }
        throw new IllegalArgumentException("Aggregate '" + function.operationName()
                + "' expects a column name, got " + arguments[0].getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return "AggregationProxy[" + relation.qualifiedName() + "#" + parentId + chain.steps() + "]";
    }
}
