package io.github.cyfko.batchagg.core.exception;

/**
 * Exception thrown when a relation cannot be translated into a grouped query.
 * <p>
 * This is a configuration error, never retried. The typical cause is a through
 * relation whose target entity declares no persistent association back to the
 * intermediate entity, leaving no join to group on.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * // User reaches Label through comments, but Label declares no association to Comment
 * throw new RelationResolutionException(
 *     "Could not find association from Label to Comment required by relation User.labels");
 * }</pre>
 *
 * <p>
 * The exception is raised the first time an aggregate is requested on the relation,
 * never while a proxy is being built.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RelationResolutionException extends RuntimeException {

    /**
     * @param message explanation naming the relation and the missing association
     */
    public RelationResolutionException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause   underlying metadata error
     */
    public RelationResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
