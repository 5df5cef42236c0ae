package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.AttributeValue;
import io.surfworks.loopweaver.ir.ElementType;
import io.surfworks.loopweaver.ir.GraphContext;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Ops;
import io.surfworks.loopweaver.ir.Shape;
import io.surfworks.loopweaver.ir.TensorValue;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds the trip-count-bounded Loop that evaluates the Select row by row.
 *
 * <pre>
 * condition__N = Constant(true)
 * fake_var__N  = Constant(0.0f)
 * trip         = Unsqueeze(rowCount, axes=[0])
 * loop:0, loop:1 = Loop(trip, condition__N, fake_var__N) { body }
 * </pre>
 *
 * <p>{@code loop:0} is the final placeholder and is never read. {@code loop:1}
 * stacks one body output per iteration, so its leading dimension is the row count.
 */
public final class LoopNodeBuilder {

    private static final Logger LOG = Logger.getLogger(LoopNodeBuilder.class.getName());

    private final NodeFactory factory;
    private final LoopBodyBuilder bodyBuilder;
    private final GraphContext ctx;

    public LoopNodeBuilder(NodeFactory factory, LoopBodyBuilder bodyBuilder, GraphContext ctx) {
        this.factory = factory;
        this.bodyBuilder = bodyBuilder;
        this.ctx = ctx;
    }

    /**
     * The emitted nodes, Loop last, and its two outputs.
     */
    public record LoopConstruct(List<Node> nodes, String finalCarriedOutput, String scanOutput) {
        public LoopConstruct {
            nodes = List.copyOf(nodes);
        }

        public Node loopNode() {
            return nodes.get(nodes.size() - 1);
        }
    }

    /**
     * @param rowCount scalar int64 value holding the number of rows
     * @param operands the Select operands and row shape
     */
    public LoopConstruct build(String rowCount, SelectOperands operands) {
        Node initCond = factory.constant("condition", TensorValue.scalarBool(true));
        Node initCarried = factory.constant("fake_var", TensorValue.scalarFloat(0.0));
        Node tripCount = factory.create(Ops.UNSQUEEZE, "loop_gather_indices", List.of(rowCount), 1,
                Map.of(Ops.ATTR_AXES, AttributeValue.ofInts(0)));

        String loopName = factory.freshNodeName("loop", 2);
        String carriedOut = NodeFactory.outputPort(loopName, 0);
        String scanOut = NodeFactory.outputPort(loopName, 1);
        Node loop = new Node(Ops.LOOP, loopName,
                List.of(tripCount.output(0), initCond.output(0), initCarried.output(0)),
                List.of(carriedOut, scanOut),
                Map.of(Ops.ATTR_BODY, AttributeValue.of(bodyBuilder.build(operands))));

        ctx.setOutputType(initCond.output(0), ElementType.BOOL);
        ctx.setOutputShape(initCond.output(0), Shape.scalar());
        ctx.setOutputType(initCarried.output(0), ElementType.FLOAT);
        ctx.setOutputShape(initCarried.output(0), Shape.scalar());
        ctx.setOutputType(tripCount.output(0), ElementType.INT64);
        ctx.setOutputShape(tripCount.output(0), Shape.of(1));
        ctx.setOutputType(carriedOut, ElementType.FLOAT);
        ctx.setOutputShape(carriedOut, Shape.scalar());

        LOG.fine(() -> "Built " + loopName + " over " + operands.condition() + " with row shape " + operands.rowShape());
        return new LoopConstruct(List.of(initCond, initCarried, tripCount, loop), carriedOut, scanOut);
    }
}
