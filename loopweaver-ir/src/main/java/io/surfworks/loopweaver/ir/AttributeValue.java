package io.surfworks.loopweaver.ir;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Value of a node attribute: an integer list, a constant tensor or a nested graph.
 */
public sealed interface AttributeValue permits
        AttributeValue.IntsAttr, AttributeValue.TensorAttr, AttributeValue.GraphAttr {

    /**
     * Short printable form, used by {@link Node#toString()}.
     */
    String describe();

    static IntsAttr ofInts(long... values) {
        return new IntsAttr(Arrays.stream(values).boxed().toList());
    }

    static TensorAttr of(TensorValue value) {
        return new TensorAttr(value);
    }

    static GraphAttr of(Graph graph) {
        return new GraphAttr(graph);
    }

    record IntsAttr(List<Long> values) implements AttributeValue {
        public IntsAttr {
            values = List.copyOf(values);
        }

        @Override
        public String describe() {
            return values.toString();
        }
    }

    /**
     * Constant tensor, e.g. the {@code value} of a Constant node.
     */
    record TensorAttr(TensorValue value) implements AttributeValue {
        public TensorAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String describe() {
            return value.toString();
        }
    }

    /**
     * Nested scope owned by a control-flow node (If branches, Loop body).
     */
    record GraphAttr(Graph graph) implements AttributeValue {
        public GraphAttr {
            Objects.requireNonNull(graph, "graph cannot be null");
        }

        @Override
        public String describe() {
            return "graph<" + graph.name() + ", " + graph.nodes().size() + " nodes>";
        }
    }
}
