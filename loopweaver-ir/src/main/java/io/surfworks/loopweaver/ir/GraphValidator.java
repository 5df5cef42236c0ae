package io.surfworks.loopweaver.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checker for graphs with nested scopes.
 *
 * Performs validation including:
 * - Name resolution: every node input and graph output resolves to a local
 *   definition or to a name visible in an enclosing scope
 * - Uniqueness: node names are unique across the program, value names are
 *   defined at most once per scope
 * - Loop signature: body arity matches the loop-carried and scan outputs
 * - If signature: both branches declare the same outputs
 */
public final class GraphValidator {

    private final List<String> errors = new ArrayList<>();
    private final Set<String> nodeNames = new HashSet<>();

    public GraphValidator() {}

    /**
     * Validates a top-level graph and returns a list of errors.
     * Returns an empty list if validation passes.
     */
    public List<String> validate(Graph graph) {
        return validate(graph, Set.of());
    }

    /**
     * Validates a graph whose nodes may capture {@code outerNames}.
     */
    public List<String> validate(Graph graph, Set<String> outerNames) {
        errors.clear();
        nodeNames.clear();
        validateScope(graph, outerNames);
        return new ArrayList<>(errors);
    }

    /**
     * Validates a graph and throws if any errors are found.
     *
     * @throws GraphValidationException listing every error found
     */
    public void check(Graph graph) {
        List<String> validationErrors = validate(graph);
        if (!validationErrors.isEmpty()) {
            throw new GraphValidationException(graph.name(), validationErrors);
        }
    }

    private void validateScope(Graph graph, Set<String> visible) {
        Set<String> local = new HashSet<>();
        for (ValueInfo input : graph.inputs()) {
            if (!local.add(input.name())) {
                error("Input '%s' declared twice in graph '%s'", input.name(), graph.name());
            }
        }

        for (Node node : graph.nodes()) {
            for (String input : node.inputs()) {
                // Empty name marks an omitted optional operand
                if (!input.isEmpty() && !local.contains(input) && !visible.contains(input)) {
                    error("Undefined value '%s' used by %s node '%s' in graph '%s'",
                            input, node.opType(), node.name(), graph.name());
                }
            }

            if (!nodeNames.add(node.name())) {
                error("Node name '%s' is used more than once", node.name());
            }

            if (node.is(Ops.LOOP)) {
                validateLoop(node);
            } else if (node.is(Ops.IF)) {
                validateIf(node);
            }

            if (!node.subgraphs().isEmpty()) {
                Set<String> inner = new HashSet<>(visible);
                inner.addAll(local);
                for (Graph sub : node.subgraphs()) {
                    validateScope(sub, inner);
                }
            }

            for (String output : node.outputs()) {
                if (!local.add(output)) {
                    error("Value '%s' defined more than once in graph '%s'", output, graph.name());
                }
            }
        }

        for (ValueInfo output : graph.outputs()) {
            if (!local.contains(output.name()) && !visible.contains(output.name())) {
                error("Output '%s' of graph '%s' is not produced in scope", output.name(), graph.name());
            }
        }
    }

    private void validateLoop(Node loop) {
        if (loop.inputCount() < 2) {
            error("Loop '%s' needs a trip count and a condition input, got %d inputs",
                    loop.name(), loop.inputCount());
            return;
        }
        if (!(loop.attribute(Ops.ATTR_BODY).orElse(null) instanceof AttributeValue.GraphAttr bodyAttr)) {
            error("Loop '%s' has no body graph", loop.name());
            return;
        }
        Graph body = bodyAttr.graph();
        int carried = loop.inputCount() - 2;
        int scans = loop.outputs().size() - carried;
        if (scans < 0) {
            error("Loop '%s' has %d loop-carried inputs but only %d outputs",
                    loop.name(), carried, loop.outputs().size());
            return;
        }
        if (body.inputs().size() != 2 + carried) {
            error("Loop '%s' body must declare %d inputs (iteration, condition, %d carried), got %d",
                    loop.name(), 2 + carried, carried, body.inputs().size());
        } else if (body.inputs().get(1).elementType() != ElementType.BOOL) {
            error("Loop '%s' body condition input must be bool, got %s",
                    loop.name(), body.inputs().get(1).elementType().irName());
        }
        if (body.outputs().size() != 1 + carried + scans) {
            error("Loop '%s' body must declare %d outputs (condition, %d carried, %d scan), got %d",
                    loop.name(), 1 + carried + scans, carried, scans, body.outputs().size());
        } else if (body.outputs().get(0).elementType() != ElementType.BOOL) {
            error("Loop '%s' body condition output must be bool, got %s",
                    loop.name(), body.outputs().get(0).elementType().irName());
        }
    }

    private void validateIf(Node ifNode) {
        if (ifNode.inputCount() != 1) {
            error("If '%s' takes exactly one predicate input, got %d", ifNode.name(), ifNode.inputCount());
        }
        AttributeValue thenAttr = ifNode.attribute(Ops.ATTR_THEN_BRANCH).orElse(null);
        AttributeValue elseAttr = ifNode.attribute(Ops.ATTR_ELSE_BRANCH).orElse(null);
        if (!(thenAttr instanceof AttributeValue.GraphAttr thenGraph)
                || !(elseAttr instanceof AttributeValue.GraphAttr elseGraph)) {
            error("If '%s' must define both then_branch and else_branch", ifNode.name());
            return;
        }
        List<ValueInfo> thenOutputs = thenGraph.graph().outputs();
        List<ValueInfo> elseOutputs = elseGraph.graph().outputs();
        if (!thenGraph.graph().inputs().isEmpty() || !elseGraph.graph().inputs().isEmpty()) {
            error("If '%s' branches must not declare inputs", ifNode.name());
        }
        if (thenOutputs.size() != elseOutputs.size()) {
            error("If '%s' branches declare %d and %d outputs",
                    ifNode.name(), thenOutputs.size(), elseOutputs.size());
            return;
        }
        if (thenOutputs.size() != ifNode.outputs().size()) {
            error("If '%s' has %d outputs but its branches declare %d",
                    ifNode.name(), ifNode.outputs().size(), thenOutputs.size());
        }
        for (int i = 0; i < thenOutputs.size(); i++) {
            ValueInfo t = thenOutputs.get(i);
            ValueInfo e = elseOutputs.get(i);
            if (t.elementType() != e.elementType()) {
                error("If '%s' output %d type mismatch: %s vs %s",
                        ifNode.name(), i, t.elementType().irName(), e.elementType().irName());
            }
            if (!t.shape().equals(e.shape())) {
                error("If '%s' output %d shape mismatch: %s vs %s", ifNode.name(), i, t.shape(), e.shape());
            }
        }
    }

    private void error(String format, Object... args) {
        errors.add(String.format(format, args));
    }
}
