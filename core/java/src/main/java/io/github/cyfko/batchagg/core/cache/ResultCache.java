package io.github.cyfko.batchagg.core.cache;

import io.github.cyfko.batchagg.core.model.AggregationDescriptor;
import io.github.cyfko.batchagg.core.model.ResultMapping;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Memoizes one {@link ResultMapping} per {@link AggregationDescriptor} for the
 * lifetime of a single parent batch.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Each descriptor owns a slot guarded by its own lock:
 * </p>
 * <ul>
 *   <li>The first caller for a descriptor computes the mapping while holding the slot lock</li>
 *   <li>Concurrent callers for the same descriptor block on that lock, then read the
 *       published mapping; the computation runs once</li>
 *   <li>Callers for different descriptors never wait on each other</li>
 *   <li>Once published, a mapping is read without locking</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * <p>
 * If the computation throws, nothing is published and the exception reaches the caller.
 * The next request for that descriptor computes again; other descriptors are unaffected.
 * </p>
 *
 * <p>
 * There is no eviction and no expiry: a cache lives exactly as long as the loader
 * that owns it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResultCache {

    private static final Logger logger = Logger.getLogger(ResultCache.class.getName());

    private final ConcurrentMap<AggregationDescriptor, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong computations = new AtomicLong();

    /**
     * Returns the mapping cached for {@code descriptor}, computing it with
     * {@code computeFn} if no mapping has been published yet.
     *
     * @param descriptor aggregation identity
     * @param computeFn  computation, invoked at most once per successful publication
     * @return the shared mapping
     * @throws NullPointerException if {@code computeFn} returns {@code null}
     */
    public ResultMapping getOrCompute(AggregationDescriptor descriptor, Supplier<ResultMapping> computeFn) {
        Objects.requireNonNull(descriptor, "descriptor cannot be null");
        Objects.requireNonNull(computeFn, "computeFn cannot be null");

        Slot slot = slots.computeIfAbsent(descriptor, d -> new Slot());

        ResultMapping published = slot.value;
        if (published != null) {
            hits.incrementAndGet();
            logger.finer(() -> "Cache hit for " + descriptor);
            return published;
        }

        slot.lock.lock();
        try {
            // Re-check: another thread may have published while we waited
            if (slot.value != null) {
                hits.incrementAndGet();
                return slot.value;
            }
            ResultMapping computed = Objects.requireNonNull(computeFn.get(),
                    () -> "Computation returned null for " + descriptor);
            computations.incrementAndGet();
            slot.value = computed;
            return computed;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Whether a mapping has been published for {@code descriptor}.
     */
    public boolean contains(AggregationDescriptor descriptor) {
        Slot slot = slots.get(descriptor);
        return slot != null && slot.value != null;
    }

    /**
     * Number of published mappings.
     */
    public int size() {
        int size = 0;
        for (Slot slot : slots.values()) {
            if (slot.value != null) size++;
        }
        return size;
    }

    /**
     * Number of successful computations since creation.
     */
    public long computations() {
        return computations.get();
    }

    /**
     * Number of requests answered from an already published mapping.
     */
    public long hits() {
        return hits.get();
    }

    /**
     * Returns cache statistics as a formatted string.
     *
     * @return statistics string
     */
    public String getStats() {
        return String.format("ResultCache[size=%d, computations=%d, hits=%d]", size(), computations.get(), hits.get());
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile ResultMapping value;
    }
}
