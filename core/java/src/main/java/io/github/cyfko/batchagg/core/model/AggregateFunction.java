package io.github.cyfko.batchagg.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aggregate functions that can be computed per parent over a related collection.
 * <p>
 * Each function carries its operation name, which is the name callers use when
 * dispatching dynamically (see {@link io.github.cyfko.batchagg.core.api.ProxyCall}),
 * and the policy applied when a parent has no matching group in a
 * {@link ResultMapping}.
 * </p>
 *
 * <table>
 *   <caption>Absence policy</caption>
 *   <tr><th>Function</th><th>Value when the parent has no matching rows</th></tr>
 *   <tr><td>COUNT, SUM</td><td>{@code 0L}</td></tr>
 *   <tr><td>AVERAGE, MAXIMUM, MINIMUM</td><td>no value ({@code null})</td></tr>
 *   <tr><td>EXISTS</td><td>{@code false}</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum AggregateFunction {

    COUNT("count"),
    SUM("sum"),
    AVERAGE("average"),
    MAXIMUM("maximum"),
    MINIMUM("minimum"),
    EXISTS("exists");

    /**
     * Prefix of the deferred spelling of every function ({@code async_count}).
     */
    public static final String ASYNC_PREFIX = "async_";

    /**
     * Wildcard column, meaning "the row itself" for COUNT.
     */
    public static final String ALL_COLUMNS = "*";

    private static final Map<String, AggregateFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(AggregateFunction::operationName, Function.identity()));

    private final String operationName;

    AggregateFunction(String operationName) {
        this.operationName = operationName;
    }

    public String operationName() {
        return operationName;
    }

    /**
     * Value reported for a parent that is absent from the result mapping.
     *
     * @return {@code 0L} for COUNT and SUM, {@code Boolean.FALSE} for EXISTS, {@code null} otherwise
     */
    public Object absentValue() {
        return switch (this) {
            case COUNT, SUM -> 0L;
            case EXISTS -> Boolean.FALSE;
            case AVERAGE, MAXIMUM, MINIMUM -> null;
        };
    }

    /**
     * Looks up a function by its synchronous operation name ({@code "count"}, {@code "sum"}, ...).
     */
    public static Optional<AggregateFunction> fromOperationName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /**
     * Looks up a function by its deferred name. Both {@code async_count} and
     * {@code asyncCount} are accepted.
     */
    public static Optional<AggregateFunction> fromAsyncName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        if (name.startsWith(ASYNC_PREFIX)) {
            return fromOperationName(name.substring(ASYNC_PREFIX.length()));
        }
        if (name.startsWith("async") && name.length() > "async".length()
                && Character.isUpperCase(name.charAt("async".length()))) {
            String rest = name.substring("async".length());
            return fromOperationName(rest.substring(0, 1).toLowerCase(Locale.ROOT) + rest.substring(1));
        }
        return Optional.empty();
    }
}
