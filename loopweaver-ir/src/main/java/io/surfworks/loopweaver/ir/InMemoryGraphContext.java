package io.surfworks.loopweaver.ir;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link GraphContext}.
 *
 * <p>Seed it with {@link #declare} for every value the rewrite will query, or
 * with {@link #declareGraph} for a whole program.
 */
public final class InMemoryGraphContext implements GraphContext {

    private final Map<String, ElementType> types = new ConcurrentHashMap<>();
    private final Map<String, Shape> shapes = new ConcurrentHashMap<>();
    private final NameRegistry names;

    public InMemoryGraphContext() {
        this(new NameRegistry());
    }

    public InMemoryGraphContext(NameRegistry names) {
        this.names = Objects.requireNonNull(names, "names cannot be null");
    }

    /**
     * Records type and shape for a value. A null shape leaves the shape unknown.
     *
     * @return this context for chaining
     */
    public InMemoryGraphContext declare(String valueName, ElementType type, Shape shape) {
        types.put(valueName, type);
        if (shape != null) {
            shapes.put(valueName, shape);
        }
        return this;
    }

    /**
     * Records the declared inputs and outputs of a graph and reserves every
     * node and value name it already uses.
     */
    public InMemoryGraphContext declareGraph(Graph graph) {
        for (ValueInfo input : graph.inputs()) {
            declare(input.name(), input.elementType(), input.shape());
            names.reserveIfAbsent(input.name());
        }
        for (ValueInfo output : graph.outputs()) {
            declare(output.name(), output.elementType(), output.shape());
        }
        for (Node node : graph.allNodes()) {
            names.reserveIfAbsent(node.name());
            node.outputs().forEach(names::reserveIfAbsent);
        }
        return this;
    }

    @Override
    public ElementType getElementType(String valueName) {
        ElementType type = types.get(valueName);
        if (type == null) {
            throw new UnknownTypeException(valueName);
        }
        return type;
    }

    @Override
    public Optional<Shape> getShape(String valueName) {
        return Optional.ofNullable(shapes.get(valueName));
    }

    @Override
    public void setOutputShape(String valueName, Shape shape) {
        shapes.put(valueName, Objects.requireNonNull(shape, "shape cannot be null"));
    }

    @Override
    public void setOutputType(String valueName, ElementType type) {
        types.put(valueName, Objects.requireNonNull(type, "type cannot be null"));
    }

    @Override
    public String freshName(String prefix) {
        return names.freshName(prefix);
    }

    @Override
    public String freshNodeName(String prefix, int outputCount) {
        return names.freshNodeName(prefix, outputCount);
    }

    @Override
    public void reserveName(String name) {
        names.reserveIfAbsent(name);
    }

    public NameRegistry names() {
        return names;
    }

    @Override
    public String toString() {
        return String.format("InMemoryGraphContext[types=%d, shapes=%d, %s]", types.size(), shapes.size(), names);
    }
}
