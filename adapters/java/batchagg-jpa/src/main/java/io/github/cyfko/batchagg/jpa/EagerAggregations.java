package io.github.cyfko.batchagg.jpa;

import io.github.cyfko.batchagg.core.AggregationContext;
import io.github.cyfko.batchagg.core.api.AggregationLoader;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

/**
 * Runs parent queries with batched aggregation enabled.
 * <p>
 * Each fetch window gets its own {@link AggregationLoader}: the whole result for
 * {@link #fetch(CriteriaQuery)}, one page for {@link #forEachBatch(CriteriaQuery, BiConsumer)}.
 * A loader, and every aggregate it cached, is dropped when its window ends.
 * </p>
 *
 * <pre>{@code
 * EagerAggregations eager = new EagerAggregations(em, JpaBatchAggregations.create(em));
 *
 * AggregatedResult<User> users = eager.fetch(query);
 * for (User user : users.parents()) {
 *     long posts = users.proxyFor(user, "posts").count();   // one query for all users
 * }
 *
 * eager.forEachBatch(query, (user, loader) ->
 *         export(user, loader.proxyFor(user, "posts").exists()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EagerAggregations {

    private static final Logger logger = Logger.getLogger(EagerAggregations.class.getName());

    private final EntityManager em;
    private final AggregationContext context;

    public EagerAggregations(EntityManager em, AggregationContext context) {
        this.em = Objects.requireNonNull(em, "EntityManager cannot be null");
        this.context = Objects.requireNonNull(context, "context cannot be null");
    }

    /**
     * Executes {@code query} and creates the loader for its result.
     */
    public <P> AggregatedResult<P> fetch(CriteriaQuery<P> query) {
        Objects.requireNonNull(query, "query cannot be null");
        List<P> parents = em.createQuery(query).getResultList();
        logger.fine(() -> String.format("Fetched %d %s with batched aggregation",
                parents.size(), query.getResultType().getSimpleName()));
        return new AggregatedResult<>(parents, context.createLoader(query.getResultType(), parents));
    }

    /**
     * Pages through {@code query}, {@code iterationBatchSize} parents at a time, handing each
     * parent to {@code action} with the loader of its page.
     * <p>
     * Paging needs a stable order: a query without ordering is ordered by the parent
     * identifier (the query is modified in place).
     * </p>
     *
     * @return the number of parents processed
     */
    public <P> long forEachBatch(CriteriaQuery<P> query, BiConsumer<? super P, AggregationLoader<P>> action) {
        Objects.requireNonNull(query, "query cannot be null");
        Objects.requireNonNull(action, "action cannot be null");

        Class<P> parentType = query.getResultType();
        ensureOrdered(query, parentType);

        int pageSize = context.policy().iterationBatchSize();
        long processed = 0;
        int page = 0;
        while (true) {
            List<P> parents = em.createQuery(query)
                    .setFirstResult(page * pageSize)
                    .setMaxResults(pageSize)
                    .getResultList();
            if (parents.isEmpty()) {
                break;
            }

            AggregationLoader<P> loader = context.createLoader(parentType, parents);
            for (P parent : parents) {
                action.accept(parent, loader);
            }
            processed += parents.size();

            int pageNumber = page;
            logger.fine(() -> String.format("Processed page %d of %s: %d parents, %d aggregate queries",
                    pageNumber, parentType.getSimpleName(), parents.size(), loader.cacheSize()));

            if (parents.size() < pageSize) {
                break;
            }
            page++;
        }
        return processed;
    }

    private <P> void ensureOrdered(CriteriaQuery<P> query, Class<P> parentType) {
        if (!query.getOrderList().isEmpty()) {
            return;
        }
        Root<?> root = query.getRoots().stream()
                .filter(r -> r.getJavaType().equals(parentType))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Query must select from " + parentType.getSimpleName() + " to be iterated in batches"));
        String idAttribute = context.registry().identifierAttribute(parentType);
        CriteriaBuilder cb = em.getCriteriaBuilder();
        query.orderBy(cb.asc(root.get(idAttribute)));
    }
}
