package io.github.cyfko.batchagg.core.api;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A pending aggregate, resolved on first access to {@link #value()}.
 * <p>
 * Lets a caller describe several aggregates before any of them runs:
 * </p>
 * <pre>{@code
 * DeferredValue<Long> posts = user.posts().asyncCount();
 * DeferredValue<Long> comments = user.comments().asyncCount();
 * loader.resolveAll(posts, comments);
 * long total = posts.value() + comments.value();
 * }</pre>
 *
 * <p>
 * States are {@code pending} and {@code resolved}. The first {@link #value()} call
 * resolves and keeps the result; later calls return it without resolving again. If
 * resolution fails the value stays pending and the exception reaches the caller.
 * There is no cancellation and no timeout.
 * </p>
 *
 * @param <V> value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DeferredValue<V> {

    private final Supplier<V> resolver;
    private volatile boolean resolved;
    private V value;

    private DeferredValue(Supplier<V> resolver) {
        this.resolver = resolver;
    }

    public static <V> DeferredValue<V> of(Supplier<V> resolver) {
        return new DeferredValue<>(Objects.requireNonNull(resolver, "resolver cannot be null"));
    }

    /**
     * Returns the value, resolving it on the first call.
     */
    public V value() {
        if (resolved) {
            return value;
        }
        synchronized (this) {
            if (!resolved) {
                value = resolver.get();
                resolved = true;
            }
            return value;
        }
    }

    public boolean isResolved() {
        return resolved;
    }

    /**
     * Resolves every value, in iteration order.
     */
    public static void resolveAll(Iterable<? extends DeferredValue<?>> values) {
        for (DeferredValue<?> deferred : values) {
            deferred.value();
        }
    }

    @Override
    public String toString() {
        return resolved ? "DeferredValue[" + value + "]" : "DeferredValue[pending]";
    }
}
