package io.surfworks.loopweaver.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single operation record.
 *
 * <p>Inputs and outputs are value names. An empty input name marks an omitted
 * optional operand. Nodes are immutable; rewriting produces new nodes.
 *
 * @param opType the operator kind, see {@link Ops}
 * @param name the node name, unique across the program
 * @param inputs ordered input value names
 * @param outputs ordered output value names
 * @param attributes attribute name to value, in insertion order
 */
public record Node(
        String opType,
        String name,
        List<String> inputs,
        List<String> outputs,
        Map<String, AttributeValue> attributes
) {

    public Node {
        Objects.requireNonNull(opType, "opType cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Node of(String opType, String name, List<String> inputs, List<String> outputs) {
        return new Node(opType, name, inputs, outputs, Map.of());
    }

    public String input(int index) {
        return inputs.get(index);
    }

    public String output(int index) {
        return outputs.get(index);
    }

    public int inputCount() {
        return inputs.size();
    }

    public boolean is(String type) {
        return opType.equals(type);
    }

    public Optional<AttributeValue> attribute(String attrName) {
        return Optional.ofNullable(attributes.get(attrName));
    }

    /**
     * Returns the nested graph stored under {@code attrName}.
     *
     * @throws IllegalStateException if the attribute is missing or not a graph
     */
    public Graph graphAttribute(String attrName) {
        AttributeValue value = attributes.get(attrName);
        if (value instanceof AttributeValue.GraphAttr graphAttr) {
            return graphAttr.graph();
        }
        throw new IllegalStateException(opType + " node '" + name + "' has no graph attribute '" + attrName + "'");
    }

    /**
     * Returns the integer list stored under {@code attrName}.
     *
     * @throws IllegalStateException if the attribute is missing or not an integer list
     */
    public List<Long> intsAttribute(String attrName) {
        AttributeValue value = attributes.get(attrName);
        if (value instanceof AttributeValue.IntsAttr ints) {
            return ints.values();
        }
        throw new IllegalStateException(opType + " node '" + name + "' has no ints attribute '" + attrName + "'");
    }

    /**
     * Returns all graph-valued attributes (nested scopes) of this node.
     */
    public List<Graph> subgraphs() {
        return attributes.values().stream()
                .filter(a -> a instanceof AttributeValue.GraphAttr)
                .map(a -> ((AttributeValue.GraphAttr) a).graph())
                .toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(outputs).append(" = ").append(opType).append("[").append(name).append("]");
        sb.append(inputs);
        if (!attributes.isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (Map.Entry<String, AttributeValue> entry : attributes.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue().describe());
                first = false;
            }
            sb.append("}");
        }
        return sb.toString();
    }
}
