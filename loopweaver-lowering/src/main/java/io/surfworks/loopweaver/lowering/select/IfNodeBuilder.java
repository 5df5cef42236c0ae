package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.AttributeValue;
import io.surfworks.loopweaver.ir.Graph;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Ops;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the If node choosing between the true and false operand rows.
 *
 * <p>Both branches are attached, only the one picked by the predicate runs.
 */
public final class IfNodeBuilder {

    private final NodeFactory factory;
    private final BranchGraphBuilder branches;

    public IfNodeBuilder(NodeFactory factory, BranchGraphBuilder branches) {
        this.factory = factory;
        this.branches = branches;
    }

    /**
     * @param predicate scalar bool value name
     * @param operands  the Select operands and row shape
     * @return a single-output If node
     */
    public Node build(String predicate, SelectOperands operands) {
        Graph thenBranch = branches.build(operands.whenTrue(), operands.trueType(), operands.rowShape());
        Graph elseBranch = branches.build(operands.whenFalse(), operands.falseType(), operands.rowShape());

        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        attributes.put(Ops.ATTR_THEN_BRANCH, AttributeValue.of(thenBranch));
        attributes.put(Ops.ATTR_ELSE_BRANCH, AttributeValue.of(elseBranch));
        return factory.create(Ops.IF, List.of(predicate), attributes);
    }
}
