package io.github.cyfko.batchagg.jpa.scope;

import java.util.List;

/**
 * Reusable, named filter on an entity type, applicable to any relation targeting it.
 *
 * <pre>{@code
 * scopes.register(Post.class, "published", (scope, args) -> scope.where("status", "PUBLISHED"));
 * scopes.register(Post.class, "scoredAbove", (scope, args) -> scope.greaterThan("score", (Integer) args.get(0)));
 * }</pre>
 *
 * @param <T> the target entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface NamedScope<T> {

    /**
     * Adds this scope's restrictions to {@code scope}.
     *
     * @param scope     the scope being materialized
     * @param arguments arguments recorded with the scope call, possibly empty
     */
    void apply(JpaRelationScope<T> scope, List<Object> arguments);
}
