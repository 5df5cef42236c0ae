package io.surfworks.loopweaver.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered node list with declared input and output signatures.
 *
 * <p>A graph is a scope. Its nodes may read its declared inputs, outputs of
 * earlier nodes, and any name visible in an enclosing scope (lexical capture).
 * The enclosing scope is not stored here: a nested graph is only meaningful as
 * the attribute of its owning node, and resolution walks the scope chain at
 * use time (see {@code GraphValidator} and {@code Scope}).
 *
 * @param name the graph name
 * @param nodes nodes in execution order
 * @param inputs declared formal inputs
 * @param outputs declared outputs, each resolvable in this scope or an ancestor
 */
public record Graph(
        String name,
        List<Node> nodes,
        List<ValueInfo> inputs,
        List<ValueInfo> outputs
) {

    public Graph {
        Objects.requireNonNull(name, "name cannot be null");
        nodes = List.copyOf(nodes);
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    /**
     * Returns every node in this graph and its nested scopes, depth-first,
     * each owner before its subgraphs' nodes.
     */
    public List<Node> allNodes() {
        List<Node> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(Graph graph, List<Node> result) {
        for (Node node : graph.nodes) {
            result.add(node);
            for (Graph sub : node.subgraphs()) {
                collect(sub, result);
            }
        }
    }

    /**
     * Returns a copy of this graph with its nodes replaced.
     */
    public Graph withNodes(List<Node> newNodes) {
        return new Graph(name, newNodes, inputs, outputs);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("graph ").append(name).append(" ").append(inputs).append(" -> ").append(outputs).append(" {\n");
        for (Node node : nodes) {
            sb.append("  ").append(node).append("\n");
        }
        sb.append("}");
        return sb.toString();
    }
}
