package io.github.cyfko.batchagg.core.spi;

import io.github.cyfko.batchagg.core.model.RelationPath;

import java.util.List;
import java.util.Optional;

/**
 * Relation metadata provided by the persistence layer.
 * <p>
 * Describes, for an entity type, the one-to-many and through relations that can be
 * aggregated, and answers the questions {@link io.github.cyfko.batchagg.core.relation.RelationPathResolver}
 * asks while turning a relation into a grouped query.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface RelationRegistry {

    /**
     * Returns the relation {@code name} declared by {@code ownerType}.
     *
     * @throws IllegalArgumentException if the owner declares no aggregatable relation of that name
     */
    RelationPath relation(Class<?> ownerType, String name);

    /**
     * Returns every aggregatable relation declared by {@code ownerType}, in declaration order.
     */
    List<RelationPath> relations(Class<?> ownerType);

    /**
     * Finds a persistent association declared on {@code fromType} whose target (or
     * element) type is {@code toType}.
     *
     * @return the association name, or empty if {@code fromType} declares none
     */
    Optional<String> findAssociation(Class<?> fromType, Class<?> toType);

    /**
     * Returns the name of the identifier attribute of {@code entityType}.
     */
    String identifierAttribute(Class<?> entityType);
}
