package io.surfworks.loopweaver.ir;

import java.util.Objects;

/**
 * The two arms of an If construct as a tagged choice.
 *
 * <p>Both arms are always defined on the node; only the arm picked by the
 * runtime predicate executes.
 */
public sealed interface Branch permits Branch.WhenTrue, Branch.WhenFalse {

    Graph graph();

    /**
     * Picks the arm for a predicate value.
     */
    static Branch select(boolean predicate, Graph thenGraph, Graph elseGraph) {
        return predicate ? new WhenTrue(thenGraph) : new WhenFalse(elseGraph);
    }

    /**
     * Picks the arm of an If node for a predicate value.
     */
    static Branch select(boolean predicate, Node ifNode) {
        return select(predicate,
                ifNode.graphAttribute(Ops.ATTR_THEN_BRANCH),
                ifNode.graphAttribute(Ops.ATTR_ELSE_BRANCH));
    }

    record WhenTrue(Graph graph) implements Branch {
        public WhenTrue {
            Objects.requireNonNull(graph, "graph cannot be null");
        }
    }

    record WhenFalse(Graph graph) implements Branch {
        public WhenFalse {
            Objects.requireNonNull(graph, "graph cannot be null");
        }
    }
}
