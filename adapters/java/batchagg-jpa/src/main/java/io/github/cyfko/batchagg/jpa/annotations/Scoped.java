package io.github.cyfko.batchagg.jpa.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Attaches named scopes to a relation: they are applied, in order, before any filter
 * the caller adds.
 *
 * <pre>{@code
 * @OneToMany(mappedBy = "author")
 * @Scoped("published")
 * private List<Post> publishedPosts;
 * }</pre>
 *
 * Each name must be registered for the target type in the
 * {@link io.github.cyfko.batchagg.jpa.scope.ScopeRegistry} used by the adapter.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Scoped {

    String[] value();
}
