package io.surfworks.loopweaver.ir;

import java.util.Objects;

/**
 * Declared signature of a graph input or output.
 *
 * <p>Does not own data; the name is resolved in the graph's scope.
 *
 * @param name the value name
 * @param elementType the element type
 * @param shape the static shape, possibly with unknown dimensions
 */
public record ValueInfo(String name, ElementType elementType, Shape shape) {

    public ValueInfo {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(elementType, "elementType cannot be null");
        Objects.requireNonNull(shape, "shape cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }

    public static ValueInfo of(String name, ElementType elementType, Shape shape) {
        return new ValueInfo(name, elementType, shape);
    }

    @Override
    public String toString() {
        return name + " : " + elementType.irName() + shape;
    }
}
