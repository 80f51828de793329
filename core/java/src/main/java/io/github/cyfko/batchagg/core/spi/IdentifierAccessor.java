package io.github.cyfko.batchagg.core.spi;

/**
 * Reads the primary identifier of an entity instance.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface IdentifierAccessor {

    /**
     * @param entity a persisted entity
     * @return its identifier, or {@code null} if it has none yet
     */
    Object identifierOf(Object entity);
}
