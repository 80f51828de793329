package io.github.cyfko.batchagg.core.model;

import io.github.cyfko.batchagg.core.spi.IdentifierAccessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The parents processed together during one fetch or one page of a batch iteration.
 * <p>
 * Its identifiers scope every grouped query ({@code WHERE parent_id IN (...)}).
 * Immutable for its lifetime.
 * </p>
 *
 * @param parentType parent entity type
 * @param parents    parents in fetch order
 * @param ids        distinct parent identifiers in fetch order
 * @param <P>        parent type
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParentBatch<P>(Class<P> parentType, List<P> parents, List<Object> ids) {

    public ParentBatch {
        Objects.requireNonNull(parentType, "parentType cannot be null");
        parents = List.copyOf(parents);
        ids = List.copyOf(ids);
    }

    /**
     * Builds a batch, reading each parent's identifier through {@code accessor}.
     *
     * @throws IllegalArgumentException if a parent has no identifier yet
     */
    public static <P> ParentBatch<P> of(Class<P> parentType, List<? extends P> parents, IdentifierAccessor accessor) {
        Objects.requireNonNull(parents, "parents cannot be null");
        Objects.requireNonNull(accessor, "accessor cannot be null");

        Set<Object> ids = new LinkedHashSet<>();
        List<P> copy = new ArrayList<>(parents.size());
        for (P parent : parents) {
            Object id = accessor.identifierOf(parent);
            if (id == null) {
                throw new IllegalArgumentException("Parent " + parent + " of type " + parentType.getSimpleName()
                        + " has no identifier; only persisted entities can be batched");
            }
            ids.add(id);
            copy.add(parent);
        }
        return new ParentBatch<>(parentType, Collections.unmodifiableList(copy), new ArrayList<>(ids));
    }

    public boolean isEmpty() {
        return parents.isEmpty();
    }

    public int size() {
        return parents.size();
    }
}
