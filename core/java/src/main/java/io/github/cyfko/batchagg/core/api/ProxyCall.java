package io.github.cyfko.batchagg.core.api;

import io.github.cyfko.batchagg.core.model.AggregateFunction;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Classification of a call made on an {@link AggregationProxy} by name.
 * <p>
 * A proxy answers either as an aggregator or as a relation. Instead of accepting
 * anything at runtime, calls are classified against a static table:
 * </p>
 * <ol>
 *   <li>{@link AggregateDispatch}: a known aggregate name ({@code count}, {@code sum},
 *       {@code average}, {@code maximum}, {@code minimum}, {@code exists}), or its deferred
 *       spelling ({@code async_count} / {@code asyncCount})</li>
 *   <li>{@link FallbackMaterialize}: an enumeration of the underlying rows
 *       ({@code toList}, {@code stream}, ...)</li>
 *   <li>{@link ChainExtend}: anything else, recorded as a filter step</li>
 * </ol>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface ProxyCall permits ProxyCall.AggregateDispatch, ProxyCall.ChainExtend, ProxyCall.FallbackMaterialize {

    /**
     * Names that enumerate the related rows instead of aggregating them.
     */
    Set<String> ENUMERATION_OPERATIONS = Set.of("toList", "to_a", "stream", "iterator", "each", "forEach", "load");

    /**
     * Classifies {@code name}.
     *
     * @param name method name
     * @return the call variant
     * @throws IllegalArgumentException if {@code name} is null or blank
     */
    static ProxyCall classify(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Call name cannot be null or blank");
        }
        Optional<AggregateFunction> function = AggregateFunction.fromOperationName(name);
        if (function.isPresent()) {
            return new AggregateDispatch(function.get(), false);
        }
        Optional<AggregateFunction> deferred = AggregateFunction.fromAsyncName(name);
        if (deferred.isPresent()) {
            return new AggregateDispatch(deferred.get(), true);
        }
        if (ENUMERATION_OPERATIONS.contains(name)) {
            return new FallbackMaterialize(name);
        }
        return new ChainExtend(name);
    }

    /**
     * Aggregate computed through the batch cache.
     *
     * @param function aggregate function
     * @param deferred whether a {@link DeferredValue} is expected instead of a scalar
     */
    record AggregateDispatch(AggregateFunction function, boolean deferred) implements ProxyCall {
        public AggregateDispatch {
            Objects.requireNonNull(function, "function cannot be null");
        }
    }

    /**
     * Operation appended to the filter chain.
     */
    record ChainExtend(String operation) implements ProxyCall {
    }

    /**
     * Enumeration of the real relation for a single parent.
     */
    record FallbackMaterialize(String operation) implements ProxyCall {
    }
}
