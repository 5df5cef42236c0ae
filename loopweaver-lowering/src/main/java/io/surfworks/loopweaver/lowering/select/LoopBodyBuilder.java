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
import java.util.Set;

/**
 * Builds the per-iteration body of the Select loop.
 *
 * <pre>
 * inputs:  i : int64[1], cond : bool[], fake_var : float[]
 *
 * Gather(condition, i) -> Squeeze(axes=[0])   current predicate
 * If(predicate) { row i of x } else { row i of y }
 * Identity(If)       -> output
 * Identity(cond)     -> cond_output
 * Identity(fake_var) -> fake_var_output
 *
 * outputs: cond_output : bool[], fake_var_output : float[], output : T rowShape
 * </pre>
 *
 * <p>The continuation flag and the placeholder are passed through unchanged;
 * they exist because a loop must declare a condition and at least one carried
 * value. Output order is fixed: condition, carried, scan.
 */
public final class LoopBodyBuilder {

    public static final String ITERATION_INPUT = "i";
    public static final String CONDITION_INPUT = "cond";
    public static final String CARRIED_INPUT = "fake_var";

    public static final String CONDITION_OUTPUT = "cond_output";
    public static final String CARRIED_OUTPUT = "fake_var_output";
    public static final String SCAN_OUTPUT = "output";

    /**
     * Names bound inside the body or its branches. An outer value with one of
     * these names cannot be captured directly.
     */
    public static final Set<String> LOCAL_NAMES = Set.of(
            ITERATION_INPUT, CONDITION_INPUT, CARRIED_INPUT,
            CONDITION_OUTPUT, CARRIED_OUTPUT, SCAN_OUTPUT,
            BranchGraphBuilder.BRANCH_OUTPUT);

    private final NodeFactory factory;
    private final IfNodeBuilder ifBuilder;
    private final String graphName;

    public LoopBodyBuilder(NodeFactory factory, IfNodeBuilder ifBuilder, String graphName) {
        this.factory = factory;
        this.ifBuilder = ifBuilder;
        this.graphName = graphName;
    }

    /**
     * @param operands the Select operands, all resolvable from the loop's enclosing scope
     */
    public Graph build(SelectOperands operands) {
        Node gather = factory.create(Ops.GATHER, List.of(operands.condition(), ITERATION_INPUT));
        Node squeeze = factory.create(Ops.SQUEEZE, List.of(gather.output(0)),
                Map.of(Ops.ATTR_AXES, AttributeValue.ofInts(0)));
        Node ifNode = ifBuilder.build(squeeze.output(0), operands);

        Node scanOut = factory.identity(ifNode.output(0), SCAN_OUTPUT);
        Node condOut = factory.identity(CONDITION_INPUT, CONDITION_OUTPUT);
        Node carriedOut = factory.identity(CARRIED_INPUT, CARRIED_OUTPUT);

        List<ValueInfo> inputs = List.of(
                ValueInfo.of(ITERATION_INPUT, ElementType.INT64, Shape.of(1)),
                ValueInfo.of(CONDITION_INPUT, ElementType.BOOL, Shape.scalar()),
                ValueInfo.of(CARRIED_INPUT, ElementType.FLOAT, Shape.scalar()));
        List<ValueInfo> outputs = List.of(
                ValueInfo.of(CONDITION_OUTPUT, ElementType.BOOL, Shape.scalar()),
                ValueInfo.of(CARRIED_OUTPUT, ElementType.FLOAT, Shape.scalar()),
                ValueInfo.of(SCAN_OUTPUT, operands.trueType(), operands.rowShape()));

        return new Graph(graphName, List.of(gather, squeeze, ifNode, scanOut, condOut, carriedOut), inputs, outputs);
    }
}
