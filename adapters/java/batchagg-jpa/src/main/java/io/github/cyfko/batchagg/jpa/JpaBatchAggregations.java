package io.github.cyfko.batchagg.jpa;

import io.github.cyfko.batchagg.core.AggregationContext;
import io.github.cyfko.batchagg.core.config.BatchPolicy;
import io.github.cyfko.batchagg.jpa.query.DefaultIdPredicateBuilder;
import io.github.cyfko.batchagg.jpa.query.JpaBatchQueryExecutor;
import io.github.cyfko.batchagg.jpa.query.JpaRelationMaterializer;
import io.github.cyfko.batchagg.jpa.relation.JpaRelationRegistry;
import io.github.cyfko.batchagg.jpa.scope.ScopeRegistry;
import jakarta.persistence.EntityManager;

import java.util.Objects;

/**
 * Factory wiring the JPA implementations of the engine's collaborators around one
 * {@link EntityManager}.
 *
 * <pre>{@code
 * ScopeRegistry scopes = new ScopeRegistry()
 *         .register(Post.class, "published", (scope, args) -> scope.where("status", "PUBLISHED"));
 *
 * AggregationContext context = JpaBatchAggregations.create(em, scopes);
 * AggregationLoader<User> loader = context.createLoader(User.class, users);
 * long published = loader.proxyFor(user, "posts").scope("published").count();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JpaBatchAggregations {

    private JpaBatchAggregations() {
        throw new UnsupportedOperationException("JpaBatchAggregations is a factory class and cannot be instantiated");
    }

    public static AggregationContext create(EntityManager em) {
        return create(em, new ScopeRegistry(), BatchPolicy.defaults());
    }

    public static AggregationContext create(EntityManager em, ScopeRegistry scopes) {
        return create(em, scopes, BatchPolicy.defaults());
    }

    public static AggregationContext create(EntityManager em, ScopeRegistry scopes, BatchPolicy policy) {
        Objects.requireNonNull(em, "EntityManager cannot be null");
        Objects.requireNonNull(scopes, "scopes cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        return new AggregationContext(
                new JpaRelationRegistry(em.getMetamodel()),
                new JpaBatchQueryExecutor(em, scopes, new DefaultIdPredicateBuilder(policy.inClauseSize())),
                new JpaRelationMaterializer(em, scopes),
                new JpaIdentifierAccessor(em.getEntityManagerFactory().getPersistenceUnitUtil()),
                policy);
    }
}
