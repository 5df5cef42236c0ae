package io.surfworks.loopweaver.ir;

import java.util.Optional;

/**
 * Metadata and naming services of the program a rewrite runs in.
 *
 * <p>Rewrites only read type and shape information through this interface and
 * report inferred results back through the setters. The program itself is
 * owned by the caller.
 */
public interface GraphContext {

    /**
     * Returns the element type of a value.
     *
     * @param valueName the value name
     * @return the element type
     * @throws UnknownTypeException if the type was never inferred
     */
    ElementType getElementType(String valueName);

    /**
     * Returns the best-known static shape of a value, or empty if unknown.
     */
    Optional<Shape> getShape(String valueName);

    void setOutputShape(String valueName, Shape shape);

    void setOutputType(String valueName, ElementType type);

    /**
     * Returns a name unique across the whole program.
     */
    String freshName(String prefix);

    /**
     * Returns a node name unique across the whole program whose output names
     * {@code name:0 .. name:outputCount-1} are unique as well.
     */
    String freshNodeName(String prefix, int outputCount);

    /**
     * Marks a name already used by the program so {@link #freshName} never returns it.
     */
    void reserveName(String name);
}
