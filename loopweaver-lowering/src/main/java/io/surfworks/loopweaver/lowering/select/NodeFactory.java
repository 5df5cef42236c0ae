package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.AttributeValue;
import io.surfworks.loopweaver.ir.GraphContext;
import io.surfworks.loopweaver.ir.NameRegistry;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Ops;
import io.surfworks.loopweaver.ir.TensorValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles primitive nodes under program-wide unique names.
 *
 * <p>Node names come from the context's name service; output names are the
 * node name plus the output slot ({@code Gather__4:0}). A node name is only
 * handed out when all of its output names are free too.
 */
public final class NodeFactory {

    private final GraphContext ctx;

    public NodeFactory(GraphContext ctx) {
        this.ctx = ctx;
    }

    public String freshName(String prefix) {
        return ctx.freshName(prefix);
    }

    /**
     * Fresh node name with {@code outputCount} free output ports, all reserved.
     */
    public String freshNodeName(String prefix, int outputCount) {
        return ctx.freshNodeName(prefix, outputCount);
    }

    public static String outputPort(String nodeName, int index) {
        return NameRegistry.portName(nodeName, index);
    }

    public static String outputPort(String nodeName) {
        return NameRegistry.portName(nodeName, 0);
    }

    /**
     * Single-output node named after its operator kind.
     */
    public Node create(String opType, List<String> inputs) {
        return create(opType, opType, inputs, 1, Map.of());
    }

    public Node create(String opType, List<String> inputs, Map<String, AttributeValue> attributes) {
        return create(opType, opType, inputs, 1, attributes);
    }

    /**
     * Node with a fresh name from {@code prefix} and outputs {@code name:0 .. name:n-1}.
     */
    public Node create(String opType, String prefix, List<String> inputs, int outputCount,
                       Map<String, AttributeValue> attributes) {
        String name = freshNodeName(prefix, outputCount);
        List<String> outputs = new ArrayList<>(outputCount);
        for (int i = 0; i < outputCount; i++) {
            outputs.add(outputPort(name, i));
        }
        return new Node(opType, name, inputs, outputs, attributes);
    }

    /**
     * Constant whose node name doubles as its output name.
     */
    public Node constant(String prefix, TensorValue value) {
        String name = freshName(prefix);
        return new Node(Ops.CONSTANT, name, List.of(), List.of(name), Map.of(Ops.ATTR_VALUE, AttributeValue.of(value)));
    }

    /**
     * Identity that exposes {@code input} under a caller-chosen output name.
     */
    public Node identity(String input, String output) {
        return new Node(Ops.IDENTITY, freshName(Ops.IDENTITY), List.of(input), List.of(output), Map.of());
    }
}
