package io.github.cyfko.batchagg.jpa;

import io.github.cyfko.batchagg.core.spi.IdentifierAccessor;
import jakarta.persistence.PersistenceUnitUtil;

import java.util.Objects;

/**
 * {@link IdentifierAccessor} backed by the persistence unit's {@link PersistenceUnitUtil}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaIdentifierAccessor implements IdentifierAccessor {

    private final PersistenceUnitUtil persistenceUnitUtil;

    public JpaIdentifierAccessor(PersistenceUnitUtil persistenceUnitUtil) {
        this.persistenceUnitUtil = Objects.requireNonNull(persistenceUnitUtil, "persistenceUnitUtil cannot be null");
    }

    @Override
    public Object identifierOf(Object entity) {
        Objects.requireNonNull(entity, "entity cannot be null");
        return persistenceUnitUtil.getIdentifier(entity);
    }
}
