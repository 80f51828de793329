package io.github.cyfko.batchagg.jpa;

import io.github.cyfko.batchagg.core.api.AggregationLoader;
import io.github.cyfko.batchagg.core.config.BatchPolicy;
import io.github.cyfko.batchagg.jpa.entities.User;
import io.github.cyfko.batchagg.jpa.scope.ScopeRegistry;
import io.github.cyfko.batchagg.jpa.support.BlogFixture;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import org.hibernate.stat.Statistics;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Eager aggregation over fetched parents")
class EagerAggregationsTest {

    private static EntityManagerFactory emf;

    private EntityManager em;
    private Statistics statistics;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
        BlogFixture.seed(emf);
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    @BeforeEach
    void openEntityManager() {
        em = emf.createEntityManager();
        statistics = BlogFixture.statistics(emf);
    }

    @AfterEach
    void closeEntityManager() {
        em.close();
    }

    private EagerAggregations eager(BatchPolicy policy) {
        return new EagerAggregations(em, JpaBatchAggregations.create(em, new ScopeRegistry(), policy));
    }

    @Test
    @DisplayName("fetch returns the parents with a loader covering exactly them")
    void fetch() {
        AggregatedResult<User> result = eager(BatchPolicy.defaults()).fetch(BlogFixture.usersQuery(em, "writer-"));

        assertEquals(BlogFixture.WRITERS, result.size());
        assertEquals(result.parents(), result.loader().batch().parents());

        statistics.clear();
        for (User writer : result.parents()) {
            assertEquals(BlogFixture.POSTS_PER_WRITER, result.proxyFor(writer, "posts").count());
        }
        assertEquals(1, statistics.getPrepareStatementCount());
    }

    @Test
    @DisplayName("fetch of an empty result creates an empty loader")
    void fetchEmpty() {
        AggregatedResult<User> result = eager(BatchPolicy.defaults()).fetch(BlogFixture.usersQuery(em, "nobody"));

        assertTrue(result.isEmpty());
        assertTrue(result.loader().batch().isEmpty());
    }

    @Test
    @DisplayName("forEachBatch gives every page its own loader")
    void forEachBatchPages() {
        EagerAggregations eager = eager(BatchPolicy.custom(500, 2));
        Map<String, Long> evens = new LinkedHashMap<>();
        Set<AggregationLoader<User>> loaders = new HashSet<>();

        long processed = eager.forEachBatch(BlogFixture.usersQuery(em, "writer-"), (user, loader) -> {
            loaders.add(loader);
            evens.put(user.getName(), loader.<Object>proxyFor(user, "posts").where("title", "Even").count());
        });

        assertEquals(BlogFixture.WRITERS, processed);
        // 5 writers in pages of 2
        assertEquals(3, loaders.size());
        assertEquals(BlogFixture.WRITERS, evens.size());
        evens.values().forEach(count -> assertEquals(3L, count.longValue()));
        for (AggregationLoader<User> loader : loaders) {
            assertEquals(1, loader.cacheSize());
        }
    }

    @Test
    @DisplayName("forEachBatch orders unordered queries by identifier")
    void forEachBatchOrdersById() {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<User> query = cb.createQuery(User.class);
        Root<User> root = query.from(User.class);
        query.select(root);

        List<Long> ids = new ArrayList<>();
        long processed = eager(BatchPolicy.custom(500, 3)).forEachBatch(query, (user, loader) -> ids.add(user.getId()));

        assertEquals(ids.size(), processed);
        List<Long> sorted = new ArrayList<>(ids);
        sorted.sort(null);
        assertEquals(sorted, ids);
        assertEquals(new HashSet<>(ids).size(), ids.size());
        assertFalse(query.getOrderList().isEmpty());
    }
}
