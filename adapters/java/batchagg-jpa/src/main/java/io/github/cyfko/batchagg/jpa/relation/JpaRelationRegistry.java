package io.github.cyfko.batchagg.jpa.relation;

import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.FilterStep;
import io.github.cyfko.batchagg.core.model.RelationPath;
import io.github.cyfko.batchagg.core.spi.RelationRegistry;
import io.github.cyfko.batchagg.jpa.annotations.Scoped;
import io.github.cyfko.batchagg.jpa.annotations.Through;
import io.github.cyfko.batchagg.jpa.utils.ReflectionUtils;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Transient;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.Metamodel;
import jakarta.persistence.metamodel.SingularAttribute;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * {@link RelationRegistry} reading JPA mapping annotations.
 *
 * <h2>Recognized relations</h2>
 * <ul>
 *   <li>{@code @OneToMany(mappedBy = "x")}: direct relation, foreign key attribute {@code x}
 *       on the target</li>
 *   <li>{@code @ManyToMany}, or {@code @OneToMany} without {@code mappedBy}: through relation
 *       whose intermediate is the owner itself; the target's association back to the owner
 *       is joined</li>
 *   <li>{@link Through @Through(via = "...")} on a {@code @Transient} collection: through
 *       relation via the intermediate entity of another direct relation</li>
 * </ul>
 * <p>
 * {@link Scoped @Scoped} adds the relation's built-in named scopes.
 * </p>
 *
 * <p>
 * Relations are scanned once per owner type and kept for the registry's lifetime.
 * Field order follows declaration order, superclass fields first.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaRelationRegistry implements RelationRegistry {

    private static final Logger logger = Logger.getLogger(JpaRelationRegistry.class.getName());

    private final Metamodel metamodel;
    private final Map<Class<?>, Map<String, RelationPath>> relationsByOwner = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> idAttributes = new ConcurrentHashMap<>();

    public JpaRelationRegistry(Metamodel metamodel) {
        this.metamodel = Objects.requireNonNull(metamodel, "metamodel cannot be null");
    }

    @Override
    public RelationPath relation(Class<?> ownerType, String name) {
        Objects.requireNonNull(ownerType, "ownerType cannot be null");
        RelationPath relation = relationsOf(ownerType).get(name);
        if (relation == null) {
            throw new IllegalArgumentException("Entity " + ownerType.getSimpleName()
                    + " declares no aggregatable relation named '" + name + "'");
        }
        return relation;
    }

    @Override
    public List<RelationPath> relations(Class<?> ownerType) {
        Objects.requireNonNull(ownerType, "ownerType cannot be null");
        return List.copyOf(relationsOf(ownerType).values());
    }

    @Override
    public Optional<String> findAssociation(Class<?> fromType, Class<?> toType) {
        for (Field field : ReflectionUtils.declaredFieldsOf(fromType)) {
            if (isPersistentAssociation(field) && ReflectionUtils.elementTypeOf(field).equals(toType)) {
                return Optional.of(field.getName());
            }
        }
        return Optional.empty();
    }

    @Override
    public String identifierAttribute(Class<?> entityType) {
        return idAttributes.computeIfAbsent(entityType, this::lookupIdAttribute);
    }

    // ==================== Scanning ====================

    private Map<String, RelationPath> relationsOf(Class<?> ownerType) {
        return relationsByOwner.computeIfAbsent(ownerType, this::scan);
    }

    private Map<String, RelationPath> scan(Class<?> ownerType) {
        // Metamodel lookup fails fast for non-entities
        metamodel.entity(ownerType);

        Map<String, Field> fields = new LinkedHashMap<>();
        for (Field field : ReflectionUtils.declaredFieldsOf(ownerType)) {
            fields.put(field.getName(), field);
        }

        Map<String, RelationPath> relations = new LinkedHashMap<>();
        List<Field> throughFields = new ArrayList<>();

        for (Field field : fields.values()) {
            if (!Collection.class.isAssignableFrom(field.getType())) {
                continue;
            }
            if (field.isAnnotationPresent(Through.class)) {
                throughFields.add(field);
                continue;
            }
            RelationPath relation = describeMapped(ownerType, field);
            if (relation != null) {
                relations.put(field.getName(), withScope(relation, field));
            }
        }

        // Through relations reference direct ones, so they are described last
        for (Field field : throughFields) {
            RelationPath relation = describeThrough(ownerType, field, relations);
            relations.put(field.getName(), withScope(relation, field));
        }

        Map<String, RelationPath> ordered = new LinkedHashMap<>();
        for (String name : fields.keySet()) {
            if (relations.containsKey(name)) {
                ordered.put(name, relations.get(name));
            }
        }

        logger.fine(() -> String.format("Scanned %s: %d aggregatable relation(s) %s",
                ownerType.getSimpleName(), ordered.size(), ordered.keySet()));
        return Collections.unmodifiableMap(ordered);
    }

    private RelationPath describeMapped(Class<?> ownerType, Field field) {
        OneToMany oneToMany = field.getAnnotation(OneToMany.class);
        if (oneToMany != null) {
            Class<?> target = ReflectionUtils.elementTypeOf(field);
            if (!oneToMany.mappedBy().isEmpty()) {
                return RelationPath.direct(ownerType, field.getName(), target, oneToMany.mappedBy());
            }
            return RelationPath.through(ownerType, field.getName(), target,
                    new RelationPath.ThroughHop(ownerType, identifierAttribute(ownerType)));
        }
        if (field.isAnnotationPresent(ManyToMany.class)) {
            Class<?> target = ReflectionUtils.elementTypeOf(field);
            return RelationPath.through(ownerType, field.getName(), target,
                    new RelationPath.ThroughHop(ownerType, identifierAttribute(ownerType)));
        }
        return null;
    }

    private RelationPath describeThrough(Class<?> ownerType, Field field, Map<String, RelationPath> described) {
        String via = field.getAnnotation(Through.class).via();
        RelationPath viaRelation = described.get(via);
        if (viaRelation == null) {
            throw new IllegalArgumentException(String.format(
                    "Relation %s.%s goes through '%s', which is not a one-to-many relation of %s",
                    ownerType.getSimpleName(), field.getName(), via, ownerType.getSimpleName()));
        }
        if (viaRelation.isThrough()) {
            throw new IllegalArgumentException(String.format(
                    "Relation %s.%s goes through '%s', which is itself a through relation; only one hop is supported",
                    ownerType.getSimpleName(), field.getName(), via));
        }

        Class<?> target = ReflectionUtils.elementTypeOf(field);
        String parentKey = viaRelation.foreignKey() + "." + identifierAttribute(ownerType);
        return RelationPath.through(ownerType, field.getName(), target,
                new RelationPath.ThroughHop(viaRelation.targetType(), parentKey));
    }

    private static RelationPath withScope(RelationPath relation, Field field) {
        Scoped scoped = field.getAnnotation(Scoped.class);
        if (scoped == null || scoped.value().length == 0) {
            return relation;
        }
        FilterChain scope = FilterChain.empty();
        for (String name : scoped.value()) {
            scope = scope.append(FilterStep.of(name));
        }
        return relation.withScope(scope);
    }

    private static boolean isPersistentAssociation(Field field) {
        if (field.isAnnotationPresent(Transient.class)) {
            return false;
        }
        return field.isAnnotationPresent(OneToMany.class)
                || field.isAnnotationPresent(ManyToMany.class)
                || field.isAnnotationPresent(ManyToOne.class)
                || field.isAnnotationPresent(OneToOne.class);
    }

    private String lookupIdAttribute(Class<?> entityType) {
        EntityType<?> entity = metamodel.entity(entityType);
        List<String> ids = new ArrayList<>();
        for (SingularAttribute<?, ?> attribute : entity.getSingularAttributes()) {
            if (attribute.isId()) {
                ids.add(attribute.getName());
            }
        }
        if (ids.size() != 1) {
            throw new IllegalArgumentException("Entity " + entityType.getSimpleName()
                    + " must declare exactly one @Id attribute to be aggregated, found " + ids);
        }
        return ids.get(0);
    }
}
