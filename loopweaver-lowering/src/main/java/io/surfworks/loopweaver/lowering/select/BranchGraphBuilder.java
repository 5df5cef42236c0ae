package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.AttributeValue;
import io.surfworks.loopweaver.ir.ElementType;
import io.surfworks.loopweaver.ir.Graph;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Ops;
import io.surfworks.loopweaver.ir.Shape;
import io.surfworks.loopweaver.ir.ValueInfo;

import java.util.List;
import java.util.Map;

/**
 * Builds one arm of the per-row If: a zero-input graph that yields row {@code i} of an operand.
 *
 * <pre>
 * Gather(operand, i)   -> [1] + rowShape     (i is captured from the loop body)
 * Squeeze(axes=[0])    -> rowShape
 * Identity             -> y
 * </pre>
 */
public final class BranchGraphBuilder {

    /** Output name declared by every branch graph. */
    public static final String BRANCH_OUTPUT = "y";

    private final NodeFactory factory;
    private final String graphName;

    public BranchGraphBuilder(NodeFactory factory, String graphName) {
        this.factory = factory;
        this.graphName = graphName;
    }

    /**
     * @param operand     the tensor to take a row from, resolved in an enclosing scope
     * @param elementType element type of the operand
     * @param rowShape    shape of one row; the gathered leading dimension must be 1
     */
    public Graph build(String operand, ElementType elementType, Shape rowShape) {
        Node gather = factory.create(Ops.GATHER, List.of(operand, LoopBodyBuilder.ITERATION_INPUT));
        Node squeeze = factory.create(Ops.SQUEEZE, List.of(gather.output(0)),
                Map.of(Ops.ATTR_AXES, AttributeValue.ofInts(0)));
        Node identity = factory.identity(squeeze.output(0), BRANCH_OUTPUT);

        return new Graph(
                graphName,
                List.of(gather, squeeze, identity),
                List.of(),
                List.of(ValueInfo.of(BRANCH_OUTPUT, elementType, rowShape))
        );
    }
}
