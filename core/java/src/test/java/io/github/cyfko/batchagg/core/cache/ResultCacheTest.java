package io.github.cyfko.batchagg.core.cache;

import io.github.cyfko.batchagg.core.model.AggregateFunction;
import io.github.cyfko.batchagg.core.model.AggregationDescriptor;
import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.RelationPath;
import io.github.cyfko.batchagg.core.model.ResultMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Memoization, failure and concurrency behaviour of {@link ResultCache}.
 */
@DisplayName("ResultCache")
class ResultCacheTest {

    static class Author {
    }

    static class Book {
    }

    private static final RelationPath BOOKS = RelationPath.direct(Author.class, "books", Book.class, "author");

    private ResultCache cache;
    private AggregationDescriptor countBooks;
    private AggregationDescriptor sumPages;

    @BeforeEach
    void setUp() {
        cache = new ResultCache();
        countBooks = AggregationDescriptor.of(BOOKS, FilterChain.empty(), AggregateFunction.COUNT, "*");
        sumPages = AggregationDescriptor.of(BOOKS, FilterChain.empty(), AggregateFunction.SUM, "pages");
    }

    @Test
    @DisplayName("Computes once per descriptor")
    void computesOnce() {
        AtomicInteger calls = new AtomicInteger();
        ResultMapping first = cache.getOrCompute(countBooks, () -> {
            calls.incrementAndGet();
            return ResultMapping.of(Map.of(1L, 2L));
        });
        ResultMapping second = cache.getOrCompute(countBooks, () -> {
            calls.incrementAndGet();
            return ResultMapping.empty();
        });

        assertSame(first, second);
        assertEquals(1, calls.get());
        assertEquals(1L, cache.computations());
        assertEquals(1L, cache.hits());
        assertTrue(cache.contains(countBooks));
        assertFalse(cache.contains(sumPages));
    }

    @Test
    @DisplayName("Equal descriptors built separately share the entry")
    void equalDescriptorsShare() {
        cache.getOrCompute(countBooks, () -> ResultMapping.of(Map.of(1L, 2L)));
        AggregationDescriptor same = AggregationDescriptor.of(BOOKS, FilterChain.empty(), AggregateFunction.COUNT, null);

        ResultMapping mapping = cache.getOrCompute(same, () -> {
            throw new AssertionError("should have been cached");
        });

        assertEquals(2L, mapping.valueFor(1L, AggregateFunction.COUNT));
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("A failed computation is not cached and runs again on the next request")
    void failureNotCached() {
        RuntimeException failure = new IllegalStateException("connection reset");
        RuntimeException thrown = assertThrows(IllegalStateException.class,
                () -> cache.getOrCompute(countBooks, () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertFalse(cache.contains(countBooks));
        assertEquals(0, cache.size());

        ResultMapping retried = cache.getOrCompute(countBooks, () -> ResultMapping.of(Map.of(1L, 4L)));
        assertEquals(4L, retried.valueFor(1L, AggregateFunction.COUNT));
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("A failure on one descriptor leaves the others intact")
    void failureIsolated() {
        cache.getOrCompute(sumPages, () -> ResultMapping.of(Map.of(1L, 300L)));

        assertThrows(IllegalStateException.class, () -> cache.getOrCompute(countBooks, () -> {
            throw new IllegalStateException("boom");
        }));

        assertTrue(cache.contains(sumPages));
        assertEquals(300L, cache.getOrCompute(sumPages, ResultMapping::empty).valueFor(1L, AggregateFunction.SUM));
    }

    @Test
    @DisplayName("A null result is rejected")
    void nullResult() {
        assertThrows(NullPointerException.class, () -> cache.getOrCompute(countBooks, () -> null));
        assertFalse(cache.contains(countBooks));
    }

    @Test
    @DisplayName("Concurrent requests for the same descriptor run one computation")
    void concurrentSingleComputation() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();

        try {
            List<Future<ResultMapping>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.getOrCompute(countBooks, () -> {
                        calls.incrementAndGet();
                        try {
                            Thread.sleep(50);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return ResultMapping.of(Map.of(1L, 7L));
                    });
                }));
            }
            start.countDown();

            ResultMapping expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<ResultMapping> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, calls.get());
        assertEquals(1L, cache.computations());
        assertEquals(threads - 1, cache.hits());
    }

    @Test
    @DisplayName("Different descriptors compute independently")
    void differentDescriptorsDoNotWait() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        try {
            Future<ResultMapping> slow = pool.submit(() -> cache.getOrCompute(countBooks, () -> {
                inside.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ResultMapping.empty();
            }));
            assertTrue(inside.await(5, TimeUnit.SECONDS));

            // countBooks is still being computed
            ResultMapping pages = cache.getOrCompute(sumPages, () -> ResultMapping.of(Map.of(1L, 10L)));
            assertEquals(10L, pages.valueFor(1L, AggregateFunction.SUM));

            release.countDown();
            slow.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(2, cache.size());
        assertTrue(cache.getStats().contains("size=2"));
    }
}
