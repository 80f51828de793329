package io.github.cyfko.batchagg.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Static description of how a parent's related collection is reached.
 * <p>
 * A path is either <em>direct</em> (the target holds a foreign key attribute back to
 * the parent) or <em>through</em> (the target is reached via an intermediate
 * entity described by a {@link ThroughHop}). Paths are derived from relation
 * metadata, never from a particular query, and are immutable.
 * </p>
 *
 * @param ownerType  parent entity type declaring the relation
 * @param name       relation name on the owner (e.g. {@code "posts"})
 * @param targetType entity type of the related collection
 * @param foreignKey attribute of the target referencing the owner; {@code null} for through paths
 * @param through    through-hop descriptor; {@code null} for direct paths
 * @param scope      built-in filter chain of the relation, applied before any caller chain
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RelationPath(
        Class<?> ownerType,
        String name,
        Class<?> targetType,
        String foreignKey,
        ThroughHop through,
        FilterChain scope
) {

    public RelationPath {
        Objects.requireNonNull(ownerType, "ownerType cannot be null");
        Objects.requireNonNull(targetType, "targetType cannot be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("relation name cannot be null or blank");
        }
        if (through == null && (foreignKey == null || foreignKey.isBlank())) {
            throw new IllegalArgumentException("Direct relation '" + name + "' requires a foreign key attribute");
        }
        if (scope == null) {
            scope = FilterChain.empty();
        }
    }

    public static RelationPath direct(Class<?> ownerType, String name, Class<?> targetType, String foreignKey) {
        return new RelationPath(ownerType, name, targetType, foreignKey, null, FilterChain.empty());
    }

    public static RelationPath through(Class<?> ownerType, String name, Class<?> targetType, ThroughHop hop) {
        Objects.requireNonNull(hop, "hop cannot be null");
        return new RelationPath(ownerType, name, targetType, null, hop, FilterChain.empty());
    }

    /**
     * Returns a copy of this path with {@code scope} as its built-in filter chain.
     */
    public RelationPath withScope(FilterChain scope) {
        return new RelationPath(ownerType, name, targetType, foreignKey, through, scope);
    }

    public boolean isThrough() {
        return through != null;
    }

    public Optional<ThroughHop> throughHop() {
        return Optional.ofNullable(through);
    }

    /**
     * Short identity used in cache keys and log messages ({@code User.posts}).
     */
    public String qualifiedName() {
        return ownerType.getSimpleName() + "." + name;
    }

    /**
     * Intermediate step of a through relation.
     *
     * @param intermediateType entity joined between target and parent. May be the parent type
     *                         itself for plain many-to-many associations.
     * @param parentKey        attribute path, on the intermediate, that yields the parent
     *                         identifier (e.g. {@code "user.id"}, or {@code "id"} when the
     *                         intermediate is the parent)
     */
    public record ThroughHop(Class<?> intermediateType, String parentKey) {
        public ThroughHop {
            Objects.requireNonNull(intermediateType, "intermediateType cannot be null");
            if (parentKey == null || parentKey.isBlank()) {
                throw new IllegalArgumentException("parentKey cannot be null or blank");
            }
        }
    }
}
