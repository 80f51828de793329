package io.github.cyfko.batchagg.jpa.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares an aggregatable relation reached through another relation of the same
 * entity, the way a join entity links two sides of a many-to-many association.
 * <p>
 * Place it on a {@code @Transient} collection whose element type is the target
 * entity. {@link #via()} names a direct one-to-many relation of the owner; its element
 * type is the intermediate entity. The target must declare a persistent association to
 * the intermediate entity, which is joined when grouping.
 * </p>
 *
 * <pre>{@code
 * @Entity
 * public class Post {
 *     @OneToMany(mappedBy = "post")
 *     private List<PostCategory> postCategories;
 *
 *     @Transient
 *     @Through(via = "postCategories")
 *     private List<Category> categories;
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Through {

    /**
     * Name of the owner's one-to-many relation leading to the intermediate entity.
     */
    String via();
}
