package io.github.cyfko.batchagg.core.api;

import io.github.cyfko.batchagg.core.cache.ResultCache;
import io.github.cyfko.batchagg.core.model.AggregateFunction;
import io.github.cyfko.batchagg.core.model.AggregationDescriptor;
import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.ParentBatch;
import io.github.cyfko.batchagg.core.model.RelationPath;
import io.github.cyfko.batchagg.core.model.ResolvedRelationPath;
import io.github.cyfko.batchagg.core.model.ResultMapping;
import io.github.cyfko.batchagg.core.relation.RelationPathResolver;
import io.github.cyfko.batchagg.core.spi.BatchQueryExecutor;
import io.github.cyfko.batchagg.core.spi.IdentifierAccessor;
import io.github.cyfko.batchagg.core.spi.RelationMaterializer;
import io.github.cyfko.batchagg.core.spi.RelationRegistry;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Serves aggregation proxies for the parents of one {@link ParentBatch} and owns the
 * {@link ResultCache} shared by all of them.
 * <p>
 * A loader is created at the start of a fetch (or of one page of a batch iteration)
 * and discarded at its end, together with its cache. For a given descriptor, the first
 * parent asking for an aggregate triggers one grouped query covering the whole batch;
 * every other parent reads its value from that result.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * A loader may be shared by several threads. Concurrent requests for the same
 * descriptor execute a single query; requests for different descriptors proceed
 * independently (subject to whatever serialization the backend applies).
 * </p>
 *
 * @param <P> parent entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AggregationLoader<P> {

    private static final Logger logger = Logger.getLogger(AggregationLoader.class.getName());

    private final ParentBatch<P> batch;
    private final Set<Object> batchIds;
    private final RelationRegistry registry;
    private final RelationPathResolver resolver;
    private final BatchQueryExecutor executor;
    private final RelationMaterializer materializer;
    private final IdentifierAccessor identifierAccessor;
    private final ResultCache cache = new ResultCache();

    public AggregationLoader(ParentBatch<P> batch,
                             RelationRegistry registry,
                             RelationPathResolver resolver,
                             BatchQueryExecutor executor,
                             RelationMaterializer materializer,
                             IdentifierAccessor identifierAccessor) {
        this.batch = Objects.requireNonNull(batch, "batch cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.materializer = Objects.requireNonNull(materializer, "materializer cannot be null");
        this.identifierAccessor = Objects.requireNonNull(identifierAccessor, "identifierAccessor cannot be null");
        this.batchIds = new HashSet<>(batch.ids());
    }

    /**
     * Returns the proxy standing for {@code parent}'s relation {@code relationName}.
     * Nothing is executed.
     *
     * @throws IllegalArgumentException if {@code parent} is not part of this batch or the
     *                                  relation is unknown
     */
    public <T> AggregationProxy<T> proxyFor(P parent, String relationName) {
        Objects.requireNonNull(parent, "parent cannot be null");
        Object parentId = requireMember(parent);
        RelationPath relation = registry.relation(batch.parentType(), relationName);
        return new AggregationProxy<>(this, parent, parentId, relation, FilterChain.empty());
    }

    /**
     * Typed variant of {@link #proxyFor(Object, String)}.
     *
     * @throws IllegalArgumentException if the relation does not target {@code targetType}
     */
    public <T> AggregationProxy<T> proxyFor(P parent, String relationName, Class<T> targetType) {
        AggregationProxy<T> proxy = proxyFor(parent, relationName);
        if (!targetType.isAssignableFrom(proxy.relation().targetType())) {
            throw new IllegalArgumentException("Relation " + proxy.relation().qualifiedName() + " targets "
                    + proxy.relation().targetType().getSimpleName() + ", not " + targetType.getSimpleName());
        }
        return proxy;
    }

    /**
     * Returns one proxy per aggregatable relation of the parent type, keyed by relation name.
     */
    public Map<String, AggregationProxy<?>> proxiesFor(P parent) {
        Objects.requireNonNull(parent, "parent cannot be null");
        Object parentId = requireMember(parent);
        Map<String, AggregationProxy<?>> proxies = new LinkedHashMap<>();
        for (RelationPath relation : registry.relations(batch.parentType())) {
            proxies.put(relation.name(), new AggregationProxy<>(this, parent, parentId, relation, FilterChain.empty()));
        }
        return proxies;
    }

    /**
     * Resolves the given deferred values, in order.
     */
    public void resolveAll(DeferredValue<?>... values) {
        DeferredValue.resolveAll(Arrays.asList(values));
    }

    public ParentBatch<P> batch() {
        return batch;
    }

    public ResultCache cache() {
        return cache;
    }

    /**
     * Number of grouped results cached so far, that is the number of batched queries this
     * loader has run.
     */
    public int cacheSize() {
        return cache.size();
    }

    // ==================== Proxy callbacks ====================

    Object aggregate(Object parentId, RelationPath relation, FilterChain chain, AggregateFunction function, String column) {
        String requestedColumn = column == null || column.isBlank() ? AggregateFunction.ALL_COLUMNS : column;
        ResolvedRelationPath resolved = resolver.resolve(relation);

        if (chain.hasBlocks()) {
            // Blocks are not comparable: evaluate for this parent only, uncached
            logger.fine(() -> String.format("Chain on %s carries a block; %s evaluated for parent %s only",
                    relation.qualifiedName(), function.operationName(), parentId));
            return executor.execute(List.of(parentId), resolved, chain, function, requestedColumn)
                    .valueFor(parentId, function);
        }

        AggregationDescriptor descriptor = AggregationDescriptor.of(relation, chain, function, requestedColumn);
        ResultMapping mapping = cache.getOrCompute(descriptor, () -> compute(descriptor, resolved));
        return mapping.valueFor(parentId, function);
    }

    <T> List<T> materialize(Object parentId, RelationPath relation, FilterChain chain) {
        ResolvedRelationPath resolved = resolver.resolve(relation);
        logger.fine(() -> String.format("Materializing %s for parent %s", relation.qualifiedName(), parentId));
        return materializer.load(parentId, resolved, chain);
    }

    private ResultMapping compute(AggregationDescriptor descriptor, ResolvedRelationPath resolved) {
        long startTime = System.nanoTime();
        ResultMapping mapping = executor.execute(batch.ids(), resolved, descriptor.chain(),
                descriptor.function(), descriptor.column());
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.fine(() -> String.format("Batched %s for %d parents in %dms: %d groups",
                descriptor, batch.ids().size(), durationMs, mapping.size()));
        return mapping;
    }

    private Object requireMember(P parent) {
        Object parentId = identifierAccessor.identifierOf(parent);
        if (parentId == null || !batchIds.contains(parentId)) {
            throw new IllegalArgumentException("Parent " + parent + " is not part of this batch");
        }
        return parentId;
    }
}
