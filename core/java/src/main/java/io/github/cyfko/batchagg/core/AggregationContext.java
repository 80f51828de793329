package io.github.cyfko.batchagg.core;

import io.github.cyfko.batchagg.core.api.AggregationLoader;
import io.github.cyfko.batchagg.core.config.BatchPolicy;
import io.github.cyfko.batchagg.core.model.ParentBatch;
import io.github.cyfko.batchagg.core.relation.RelationPathResolver;
import io.github.cyfko.batchagg.core.spi.BatchQueryExecutor;
import io.github.cyfko.batchagg.core.spi.IdentifierAccessor;
import io.github.cyfko.batchagg.core.spi.RelationMaterializer;
import io.github.cyfko.batchagg.core.spi.RelationRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of the batched aggregation engine.
 * <p>
 * Holds the persistence collaborators (relation metadata, grouped-query executor,
 * fallback materializer, identifier accessor) and hands out one
 * {@link AggregationLoader} per fetch window. The context itself is stateless apart
 * from memoized relation resolutions and can be shared application-wide.
 * </p>
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li><strong>Fetch:</strong> the caller loads a page of parents</li>
 *   <li><strong>Load:</strong> {@link #createLoader(Class, List)} builds the batch and its cache</li>
 *   <li><strong>Aggregate:</strong> proxies obtained from the loader answer aggregates from
 *       one grouped query per descriptor</li>
 *   <li><strong>Discard:</strong> the loader is dropped at the end of the window</li>
 * </ol>
 *
 * <pre>{@code
 * AggregationContext context = new AggregationContext(registry, executor, materializer, accessor);
 * List<User> users = ...;
 * AggregationLoader<User> loader = context.createLoader(User.class, users);
 * users.forEach(u -> System.out.println(loader.proxyFor(u, "posts").count()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class AggregationContext {

    private final RelationRegistry registry;
    private final BatchQueryExecutor executor;
    private final RelationMaterializer materializer;
    private final IdentifierAccessor identifierAccessor;
    private final BatchPolicy policy;
    private final RelationPathResolver resolver;

    public AggregationContext(RelationRegistry registry,
                              BatchQueryExecutor executor,
                              RelationMaterializer materializer,
                              IdentifierAccessor identifierAccessor) {
        this(registry, executor, materializer, identifierAccessor, BatchPolicy.defaults());
    }

    public AggregationContext(RelationRegistry registry,
                              BatchQueryExecutor executor,
                              RelationMaterializer materializer,
                              IdentifierAccessor identifierAccessor,
                              BatchPolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.materializer = Objects.requireNonNull(materializer, "materializer cannot be null");
        this.identifierAccessor = Objects.requireNonNull(identifierAccessor, "identifierAccessor cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.resolver = new RelationPathResolver(registry);
    }

    /**
     * Creates the loader, and its cache, for one batch of parents.
     */
    public <P> AggregationLoader<P> createLoader(ParentBatch<P> batch) {
        return new AggregationLoader<>(batch, registry, resolver, executor, materializer, identifierAccessor);
    }

    /**
     * Builds the batch from {@code parents} and creates its loader.
     */
    public <P> AggregationLoader<P> createLoader(Class<P> parentType, List<? extends P> parents) {
        return createLoader(ParentBatch.of(parentType, parents, identifierAccessor));
    }

    public RelationRegistry registry() {
        return registry;
    }

    public RelationPathResolver resolver() {
        return resolver;
    }

    public IdentifierAccessor identifierAccessor() {
        return identifierAccessor;
    }

    public BatchPolicy policy() {
        return policy;
    }
}
