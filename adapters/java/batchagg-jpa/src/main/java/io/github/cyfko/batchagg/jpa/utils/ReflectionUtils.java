package io.github.cyfko.batchagg.jpa.utils;

import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reflection helpers for reading entity mapping declarations.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReflectionUtils {

    private ReflectionUtils() {
        throw new UnsupportedOperationException("ReflectionUtils is a utility class and cannot be instantiated");
    }

    /**
     * Returns the declared fields of {@code type} and of its superclasses, superclass
     * fields first, each class in declaration order.
     */
    public static List<Field> declaredFieldsOf(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        Class<?> current = type;
        while (current != null && current != Object.class) {
            hierarchy.add(0, current);
            current = current.getSuperclass();
        }

        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (!field.isSynthetic()) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    /**
     * Element type of a collection field ({@code List<Post>} gives {@code Post}), or the
     * field type itself for single-valued fields.
     *
     * @throws IllegalArgumentException if a collection field is raw or its element type is not a class
     */
    public static Class<?> elementTypeOf(Field field) {
        if (!Collection.class.isAssignableFrom(field.getType())) {
            return field.getType();
        }
        Type generic = field.getGenericType();
        if (generic instanceof ParameterizedType pt && pt.getActualTypeArguments()[0] instanceof Class<?> element) {
            return element;
        }
        throw new IllegalArgumentException("Cannot determine element type of collection field "
                + field.getDeclaringClass().getSimpleName() + "." + field.getName());
    }
}
