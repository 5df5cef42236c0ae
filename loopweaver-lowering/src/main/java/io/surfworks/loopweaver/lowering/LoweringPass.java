package io.surfworks.loopweaver.lowering;

import io.surfworks.loopweaver.ir.AttributeValue;
import io.surfworks.loopweaver.ir.Graph;
import io.surfworks.loopweaver.ir.GraphContext;
import io.surfworks.loopweaver.ir.GraphJsonWriter;
import io.surfworks.loopweaver.ir.GraphValidator;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.ValueInfo;
import io.surfworks.loopweaver.lowering.config.LoweringConfig;
import io.surfworks.loopweaver.lowering.select.SelectLowering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replaces operators the target IR lacks with equivalent primitive constructs.
 *
 * <p>LoweringPass walks a graph, including the nested graphs of control-flow
 * nodes, and hands every node whose kind has a registered {@link OpLowering}
 * to it. The returned nodes are spliced in place of the original, in the same
 * scope. Other nodes are kept as they are; graph inputs and outputs never change.
 *
 * <p>Example usage:
 * <pre>{@code
 * InMemoryGraphContext ctx = new InMemoryGraphContext().declareGraph(graph);
 * LoweringPass pass = LoweringPass.withStandardLowerings();
 *
 * Graph lowered = pass.apply(graph, ctx);
 * System.out.println("Nodes lowered: " + pass.lastLoweredCount());
 * }</pre>
 */
public final class LoweringPass {

    private static final Logger LOG = Logger.getLogger(LoweringPass.class.getName());

    private final LoweringConfig config;
    private final Map<String, OpLowering> lowerings;
    private final List<String> lastLowered;

    /**
     * Creates a LoweringPass with no lowerings and default configuration.
     *
     * <p>Use {@link #addLowering(OpLowering)} to register lowerings.
     */
    public LoweringPass() {
        this(LoweringConfig.defaults());
    }

    public LoweringPass(LoweringConfig config) {
        this.config = config;
        this.lowerings = new LinkedHashMap<>();
        this.lastLowered = new ArrayList<>();
    }

    /**
     * Registers a lowering.
     *
     * @param lowering the lowering to add
     * @return this pass for chaining
     * @throws IllegalArgumentException if a lowering for the same operator kind is registered
     */
    public LoweringPass addLowering(OpLowering lowering) {
        OpLowering previous = lowerings.putIfAbsent(lowering.opType(), lowering);
        if (previous != null) {
            throw new IllegalArgumentException("A lowering for " + lowering.opType() + " is already registered: "
                    + previous.description());
        }
        return this;
    }

    /**
     * Creates a LoweringPass with the standard lowerings and default configuration.
     *
     * <p>Includes: SelectLowering
     */
    public static LoweringPass withStandardLowerings() {
        return withStandardLowerings(LoweringConfig.defaults());
    }

    public static LoweringPass withStandardLowerings(LoweringConfig config) {
        return new LoweringPass(config)
                .addLowering(new SelectLowering(config));
    }

    /**
     * Lowers every registered operator in a graph and its nested graphs.
     *
     * <p>Every node and value name already in the graph is reserved with the
     * context first, so generated names never collide with them.
     *
     * @param graph the graph to lower
     * @param ctx   metadata and naming services for the graph
     * @return a new graph; the input graph is not modified
     * @throws LoweringException if a node cannot be lowered
     * @throws io.surfworks.loopweaver.ir.GraphValidationException if validation is enabled and the result is malformed
     */
    public Graph apply(Graph graph, GraphContext ctx) {
        lastLowered.clear();
        reserveExistingNames(graph, ctx);

        Graph lowered = lowerGraph(graph, ctx);

        if (config.validateResult()) {
            new GraphValidator().check(lowered);
        }
        if (config.dumpLoweredNodes() && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Lowered graph " + lowered.name() + ":\n" + GraphJsonWriter.toJson(lowered));
        }
        LOG.info(String.format("Lowered %d node(s) in graph '%s'", lastLowered.size(), graph.name()));
        return lowered;
    }

    private Graph lowerGraph(Graph graph, GraphContext ctx) {
        List<Node> newNodes = new ArrayList<>(graph.nodes().size());
        for (Node node : graph.nodes()) {
            OpLowering lowering = lowerings.get(node.opType());
            if (lowering != null) {
                newNodes.addAll(lowering.lower(node, ctx));
                lastLowered.add(node.name());
            } else if (!node.subgraphs().isEmpty()) {
                newNodes.add(lowerSubgraphs(node, ctx));
            } else {
                newNodes.add(node);
            }
        }
        return graph.withNodes(newNodes);
    }

    private Node lowerSubgraphs(Node node, GraphContext ctx) {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, AttributeValue> entry : node.attributes().entrySet()) {
            AttributeValue value = entry.getValue();
            if (value instanceof AttributeValue.GraphAttr graphAttr) {
                value = AttributeValue.of(lowerGraph(graphAttr.graph(), ctx));
            }
            attributes.put(entry.getKey(), value);
        }
        return new Node(node.opType(), node.name(), node.inputs(), node.outputs(), attributes);
    }

    private static void reserveExistingNames(Graph graph, GraphContext ctx) {
        for (ValueInfo input : graph.inputs()) {
            ctx.reserveName(input.name());
        }
        for (Node node : graph.allNodes()) {
            ctx.reserveName(node.name());
            node.outputs().forEach(ctx::reserveName);
        }
    }

    /**
     * Returns the number of nodes lowered in the last {@link #apply} call.
     */
    public int lastLoweredCount() {
        return lastLowered.size();
    }

    /**
     * Returns the names of the nodes lowered in the last {@link #apply} call.
     */
    public List<String> lastLoweredNodes() {
        return List.copyOf(lastLowered);
    }

    /**
     * Returns the registered lowerings.
     */
    public List<OpLowering> lowerings() {
        return List.copyOf(lowerings.values());
    }

    public LoweringConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return String.format("LoweringPass[lowerings=%s, lastLowered=%d]", lowerings.keySet(), lastLowered.size());
    }
}
