package io.github.cyfko.batchagg.core.model;

import io.github.cyfko.batchagg.core.spi.RelationScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable sequence of {@link FilterStep}s recorded against a relation
 * without being evaluated.
 * <p>
 * Chains are only ever extended by producing a new chain ({@link #append}), so a
 * chain can be shared freely between proxies and threads. Two chains are equal
 * when their steps are equal in the same order: {@code where(a).where(b)} and
 * {@code where(b).where(a)} are different chains and never share a cached result.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * FilterChain chain = FilterChain.empty()
 *         .append(FilterStep.of("where", "title", "Even"))
 *         .append(FilterStep.of("published"));
 *
 * JpaRelationScope<Post> scope = chain.materialize(baseScope);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterChain {

    private static final FilterChain EMPTY = new FilterChain(List.of());

    private final List<FilterStep> steps;

    private FilterChain(List<FilterStep> steps) {
        this.steps = steps;
    }

    public static FilterChain empty() {
        return EMPTY;
    }

    public static FilterChain of(FilterStep... steps) {
        FilterChain chain = EMPTY;
        for (FilterStep step : steps) {
            chain = chain.append(step);
        }
        return chain;
    }

    /**
     * Returns a new chain with {@code step} appended; this chain is left untouched.
     */
    public FilterChain append(FilterStep step) {
        Objects.requireNonNull(step, "step cannot be null");
        List<FilterStep> extended = new ArrayList<>(steps.size() + 1);
        extended.addAll(steps);
        extended.add(step);
        return new FilterChain(Collections.unmodifiableList(extended));
    }

    /**
     * Convenience for {@code append(FilterStep.of(operation, arguments))}.
     */
    public FilterChain append(String operation, Object... arguments) {
        return append(FilterStep.of(operation, arguments));
    }

    /**
     * Returns a new chain made of this chain's steps followed by {@code other}'s.
     */
    public FilterChain concat(FilterChain other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<FilterStep> combined = new ArrayList<>(steps.size() + other.steps.size());
        combined.addAll(steps);
        combined.addAll(other.steps);
        return new FilterChain(Collections.unmodifiableList(combined));
    }

    /**
     * Replays every step, in order, against {@code baseScope}.
     * <p>
     * Errors raised by the scope (unknown operation, incompatible arguments) propagate
     * unchanged.
     * </p>
     *
     * @param baseScope the scope to start from
     * @param <S>       concrete scope type
     * @return the scope obtained after the last step
     */
    public <S extends RelationScope<S>> S materialize(S baseScope) {
        Objects.requireNonNull(baseScope, "baseScope cannot be null");
        S scope = baseScope;
        for (FilterStep step : steps) {
            scope = scope.apply(step);
        }
        return scope;
    }

    public List<FilterStep> steps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    /**
     * Whether any step carries a predicate block. Such chains cannot be identified
     * reliably and are evaluated per parent instead of being batched.
     */
    public boolean hasBlocks() {
        for (FilterStep step : steps) {
            if (step.hasBlock()) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterChain other)) return false;
        return steps.equals(other.steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return "FilterChain" + steps;
    }
}
