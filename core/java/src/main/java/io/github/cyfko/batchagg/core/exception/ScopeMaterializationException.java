package io.github.cyfko.batchagg.core.exception;

/**
 * Exception thrown when a recorded filter step cannot be replayed onto a base scope.
 * <p>
 * Steps are recorded without evaluation, so an unknown operation or badly shaped
 * arguments only surface when the chain is materialized: at the first aggregate
 * request or at enumeration time.
 * </p>
 *
 * <p><strong>Common causes:</strong></p>
 * <ul>
 *   <li>No built-in operation nor named scope with that name for the target type</li>
 *   <li>Wrong number of arguments (e.g. {@code between} with a single bound)</li>
 *   <li>Argument of the wrong type (e.g. a non-collection for {@code whereIn})</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ScopeMaterializationException extends RuntimeException {

    public ScopeMaterializationException(String message) {
        super(message);
    }

    public ScopeMaterializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
