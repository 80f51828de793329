package io.github.cyfko.batchagg.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-parent aggregate values produced by one grouped query.
 * <p>
 * Read-only once built. A parent missing from the mapping had no matching rows;
 * {@link #valueFor(Object, AggregateFunction)} turns that absence into the function's
 * default (see {@link AggregateFunction#absentValue()}).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResultMapping {

    private static final ResultMapping EMPTY = new ResultMapping(Map.of());

    private final Map<Object, Object> values;

    private ResultMapping(Map<Object, Object> values) {
        this.values = values;
    }

    public static ResultMapping empty() {
        return EMPTY;
    }

    /**
     * Wraps a copy of {@code values}. {@code null} values are kept: they mark a group
     * that exists but whose aggregate evaluated to SQL {@code NULL}.
     */
    public static ResultMapping of(Map<?, ?> values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.isEmpty()) return EMPTY;
        return new ResultMapping(Collections.unmodifiableMap(new HashMap<Object, Object>(values)));
    }

    /**
     * Builds the mapping of an existence query: every key maps to {@code true}.
     */
    public static ResultMapping ofKeys(Iterable<?> keys) {
        Map<Object, Object> values = new HashMap<>();
        for (Object key : keys) {
            values.put(key, Boolean.TRUE);
        }
        return of(values);
    }

    /**
     * Value of {@code function} for {@code parentId}, applying the absence policy.
     */
    public Object valueFor(Object parentId, AggregateFunction function) {
        if (function == AggregateFunction.EXISTS) {
            return values.containsKey(parentId);
        }
        Object value = values.get(parentId);
        return value != null ? value : function.absentValue();
    }

    public boolean containsKey(Object parentId) {
        return values.containsKey(parentId);
    }

    public Map<Object, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "ResultMapping" + values;
    }
}
