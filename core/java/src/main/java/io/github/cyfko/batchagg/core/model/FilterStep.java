package io.github.cyfko.batchagg.core.model;

import io.github.cyfko.batchagg.core.spi.PredicateResolver;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One recorded, unevaluated call on a relation: an operation name, its plain
 * arguments and an optional caller-supplied predicate block.
 * <p>
 * Identity ({@link #equals(Object)} / {@link #hashCode()}) is made of the
 * operation and its arguments only. The block is not comparable and takes no
 * part in it; chains containing a block are therefore never used as cache keys
 * (see {@link FilterChain#hasBlocks()}).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterStep {

    private final String operation;
    private final List<Object> arguments;
    private final PredicateResolver<?> block;

    private FilterStep(String operation, List<Object> arguments, PredicateResolver<?> block) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        this.operation = operation;
        this.arguments = arguments;
        this.block = block;
    }

    /**
     * Creates a step without block. Arguments may contain {@code null} elements; array
     * arguments are stored as lists so that equal contents give equal steps.
     */
    public static FilterStep of(String operation, Object... arguments) {
        return new FilterStep(operation, copyOf(arguments), null);
    }

    /**
     * Creates a step carrying a predicate block.
     */
    public static FilterStep withBlock(String operation, PredicateResolver<?> block, Object... arguments) {
        Objects.requireNonNull(block, "block cannot be null");
        return new FilterStep(operation, copyOf(arguments), block);
    }

    private static List<Object> copyOf(Object[] arguments) {
        if (arguments == null) {
            return Collections.emptyList();
        }
        List<Object> copy = new ArrayList<>(arguments.length);
        for (Object argument : arguments) {
            copy.add(argument != null && argument.getClass().isArray() ? arrayToList(argument) : argument);
        }
        return Collections.unmodifiableList(copy);
    }

    private static List<Object> arrayToList(Object array) {
        int length = Array.getLength(array);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            Object element = Array.get(array, i);
            elements.add(element != null && element.getClass().isArray() ? arrayToList(element) : element);
        }
        return Collections.unmodifiableList(elements);
    }

    public String operation() {
        return operation;
    }

    public List<Object> arguments() {
        return arguments;
    }

    public Optional<PredicateResolver<?>> block() {
        return Optional.ofNullable(block);
    }

    public boolean hasBlock() {
        return block != null;
    }

    /**
     * Returns the argument at {@code index}, failing with a message naming this step.
     */
    public Object argument(int index) {
        if (index < 0 || index >= arguments.size()) {
            throw new IllegalArgumentException("Operation '" + operation + "' expects at least "
                    + (index + 1) + " argument(s), got " + arguments.size());
        }
        return arguments.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterStep other)) return false;
        return operation.equals(other.operation) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, arguments);
    }

    @Override
    public String toString() {
        return operation + arguments + (block != null ? "{block}" : "");
    }
}
