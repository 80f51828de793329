package io.github.cyfko.batchagg.jpa.query;

import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.ResolvedRelationPath;
import io.github.cyfko.batchagg.core.spi.RelationMaterializer;
import io.github.cyfko.batchagg.jpa.scope.JpaRelationScope;
import io.github.cyfko.batchagg.jpa.scope.ScopeRegistry;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link RelationMaterializer} loading the related entities of one parent with a
 * Criteria query.
 * <p>
 * The query uses the same join plan and grouping column as the batched aggregates,
 * restricted to a single parent, with the relation scope and the caller chain applied,
 * ordering steps included.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaRelationMaterializer implements RelationMaterializer {

    private static final Logger logger = Logger.getLogger(JpaRelationMaterializer.class.getName());

    private final EntityManager em;
    private final ScopeRegistry scopes;

    public JpaRelationMaterializer(EntityManager em, ScopeRegistry scopes) {
        this.em = Objects.requireNonNull(em, "EntityManager cannot be null");
        this.scopes = Objects.requireNonNull(scopes, "scopes cannot be null");
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<T> load(Object parentId, ResolvedRelationPath resolved, FilterChain chain) {
        Objects.requireNonNull(parentId, "parentId cannot be null");
        Objects.requireNonNull(resolved, "resolved cannot be null");
        FilterChain steps = chain == null ? FilterChain.empty() : chain;

        long startTime = System.nanoTime();
        List<T> rows;
        synchronized (em) {
            rows = (List<T>) loadRows(resolved.path().targetType(), parentId, resolved, steps);
        }
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.fine(() -> String.format("Loaded %d %s row(s) for parent %s in %dms",
                rows.size(), resolved.path().qualifiedName(), parentId, durationMs));
        return rows;
    }

    private <T> List<T> loadRows(Class<T> targetType, Object parentId, ResolvedRelationPath resolved, FilterChain chain) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<T> query = cb.createQuery(targetType);
        Root<T> root = query.from(targetType);

        Path<?> groupKey = JpaBatchQueryExecutor.groupKeyOf(root, resolved);

        JpaRelationScope<T> scope = resolved.path().scope().concat(chain)
                .materialize(new JpaRelationScope<>(root, query, cb, scopes));

        List<Predicate> restrictions = new ArrayList<>();
        restrictions.add(cb.equal(groupKey, parentId));
        restrictions.addAll(scope.predicates());

        query.select(root)
                .where(restrictions.toArray(new Predicate[0]))
                .distinct(resolved.requiresDistinct());
        if (!scope.orders().isEmpty()) {
            query.orderBy(scope.orders());
        }

        return em.createQuery(query).getResultList();
    }
}
