package io.github.cyfko.batchagg.jpa.utils;

import jakarta.persistence.criteria.Path;

/**
 * Resolves dotted attribute paths ({@code "author.id"}) against a Criteria path.
 * <p>
 * Single-valued segments are navigated with {@link Path#get(String)}, so the provider
 * adds implicit inner joins where needed.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AttributePaths {

    private AttributePaths() {
        throw new UnsupportedOperationException("AttributePaths is a utility class and cannot be instantiated");
    }

    /**
     * @throws IllegalArgumentException if the path is blank or a segment does not exist
     */
    public static Path<?> resolve(Path<?> from, String attributePath) {
        if (attributePath == null || attributePath.isBlank()) {
            throw new IllegalArgumentException("Attribute path cannot be null or blank");
        }
        Path<?> current = from;
        for (String segment : attributePath.split("\\.")) {
            current = current.get(segment);
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    public static <Y> Path<Y> resolveTyped(Path<?> from, String attributePath) {
        return (Path<Y>) resolve(from, attributePath);
    }
}
