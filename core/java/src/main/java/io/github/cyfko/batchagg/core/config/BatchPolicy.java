package io.github.cyfko.batchagg.core.config;

/**
 * Configuration of batch sizes.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>inClauseSize</strong>: maximum number of parent identifiers in one
 *       {@code IN} list; larger batches are split into several {@code IN} lists joined
 *       by {@code OR} inside the same query (default: 500)</li>
 *   <li><strong>iterationBatchSize</strong>: number of parents fetched per page when
 *       iterating in batches; each page gets its own loader and cache (default: 1000)</li>
 * </ul>
 *
 * <pre>{@code
 * BatchPolicy policy = BatchPolicy.defaults();
 * BatchPolicy small = BatchPolicy.custom(100, 200);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BatchPolicy(
        int inClauseSize,
        int iterationBatchSize
) {

    public BatchPolicy {
        if (inClauseSize <= 0) {
            throw new IllegalArgumentException("inClauseSize must be positive, got: " + inClauseSize);
        }
        if (iterationBatchSize <= 0) {
            throw new IllegalArgumentException("iterationBatchSize must be positive, got: " + iterationBatchSize);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>IN clause size: 500 (Oracle caps lists at 1000)</li>
     *   <li>Iteration batch size: 1000</li>
     * </ul>
     *
     * @return default configuration
     */
    public static BatchPolicy defaults() {
        return new BatchPolicy(
                500,   // inClauseSize
                1000   // iterationBatchSize
        );
    }

    public static BatchPolicy custom(int inClauseSize, int iterationBatchSize) {
        return new BatchPolicy(inClauseSize, iterationBatchSize);
    }
}
