package io.github.cyfko.batchagg.jpa.scope;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named scopes known to the JPA adapter, per entity type.
 * <p>
 * A scope registered for a type also applies to its subclasses. Registration is
 * expected at startup; lookups are thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ScopeRegistry {

    private final Map<Class<?>, Map<String, NamedScope<?>>> scopes = new ConcurrentHashMap<>();

    /**
     * Registers {@code scope} under {@code name} for {@code entityType}, replacing any
     * scope previously registered under that name.
     *
     * @return this registry
     */
    public <T> ScopeRegistry register(Class<T> entityType, String name, NamedScope<T> scope) {
        Objects.requireNonNull(entityType, "entityType cannot be null");
        Objects.requireNonNull(scope, "scope cannot be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Scope name cannot be null or blank");
        }
        scopes.computeIfAbsent(entityType, t -> new ConcurrentHashMap<>()).put(name, scope);
        return this;
    }

    /**
     * Finds the scope {@code name} registered for {@code entityType} or the closest of its
     * superclasses.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<NamedScope<T>> find(Class<T> entityType, String name) {
        Class<?> current = entityType;
        while (current != null && current != Object.class) {
            Map<String, NamedScope<?>> named = scopes.get(current);
            if (named != null && named.containsKey(name)) {
                return Optional.of((NamedScope<T>) named.get(name));
            }
            current = current.getSuperclass();
        }
        return Optional.empty();
    }

    public boolean contains(Class<?> entityType, String name) {
        return find(entityType, name).isPresent();
    }
}
