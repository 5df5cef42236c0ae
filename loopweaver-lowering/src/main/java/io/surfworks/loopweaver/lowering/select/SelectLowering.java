package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.ElementType;
import io.surfworks.loopweaver.ir.GraphContext;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Ops;
import io.surfworks.loopweaver.ir.Shape;
import io.surfworks.loopweaver.lowering.LoweringException;
import io.surfworks.loopweaver.lowering.OpLowering;
import io.surfworks.loopweaver.lowering.UnsupportedArityException;
import io.surfworks.loopweaver.lowering.config.LoweringConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Lowers {@code Select(condition, x, y)} to a Loop over rows with an If per row.
 *
 * <p>Output row {@code r} is row {@code r} of x where {@code condition[r]} is
 * true, else row {@code r} of y. Emitted top-level nodes, in order:
 * <pre>
 * [Identity aliases]    only for operands whose names the loop body shadows
 * Size(condition)       row count
 * Constant, Constant, Unsqueeze, Loop   see {@link LoopNodeBuilder}
 * Identity(loop:1)      under the original node name and output name
 * </pre>
 *
 * <p>The loop body, and the two branch graphs inside it, read the condition
 * and operands from the enclosing scope rather than declaring them as inputs,
 * so the returned nodes must stay in the scope the Select came from.
 *
 * <p>All checks run before any name is allocated, so a rejected node emits nothing.
 */
public final class SelectLowering implements OpLowering {

    private static final Logger LOG = Logger.getLogger(SelectLowering.class.getName());

    private final LoweringConfig config;

    public SelectLowering() {
        this(LoweringConfig.defaults());
    }

    public SelectLowering(LoweringConfig config) {
        this.config = config;
    }

    @Override
    public String opType() {
        return Ops.SELECT;
    }

    @Override
    public String description() {
        return "Lowers Select to Loop over rows with If per row";
    }

    /**
     * @throws UnsupportedArityException if the node does not have condition, x and y
     * @throws LoweringException if the condition is not a bool vector or x and y differ in element type
     * @throws io.surfworks.loopweaver.lowering.ShapeUnavailableException if neither x nor y has a known shape
     * @throws io.surfworks.loopweaver.ir.UnknownTypeException if the condition, x or y has no inferred element type
     */
    @Override
    public List<Node> lower(Node node, GraphContext ctx) {
        if (!node.is(Ops.SELECT)) {
            throw new IllegalArgumentException("Expected a " + Ops.SELECT + " node, got " + node.opType());
        }
        long presentInputs = node.inputs().stream().filter(s -> !s.isEmpty()).count();
        if (node.inputCount() != 3 || presentInputs != 3) {
            throw new UnsupportedArityException(node.name(), Ops.SELECT, 3, (int) presentInputs);
        }
        if (node.outputs().size() != 1) {
            throw new LoweringException(node.name(), "Select must have exactly one output, got " + node.outputs().size());
        }

        String condition = node.input(0);
        String whenTrue = node.input(1);
        String whenFalse = node.input(2);

        Optional<Shape> conditionShape = ctx.getShape(condition);
        if (conditionShape.isPresent() && conditionShape.get().rank() != 1) {
            throw new LoweringException(node.name(),
                "condition must be a vector with one entry per row, got shape " + conditionShape.get());
        }
        ElementType conditionType = ctx.getElementType(condition);
        if (conditionType != ElementType.BOOL) {
            throw new LoweringException(node.name(), "condition must be bool, got " + conditionType.irName());
        }

        ElementType dataType = ctx.getElementType(whenTrue);
        ElementType falseType = ctx.getElementType(whenFalse);
        if (dataType != falseType) {
            throw new LoweringException(node.name(), "operands must share an element type, got "
                    + dataType.irName() + " and " + falseType.irName());
        }
        Shape dataShape = ShapeResolver.forSelect(node).resolve(ctx);
        Shape rowShape = dataShape.dropLeading();
        long rows = conditionShape
                .map(s -> s.dim(0))
                .filter(d -> d != Shape.UNKNOWN_DIM)
                .orElse(dataShape.dim(0));
        Shape outputShape = rowShape.withLeading(rows);

        List<Node> nodes = new ArrayList<>();
        SelectOperands operands = new SelectOperands(
                captureName(condition, nodes, ctx),
                captureName(whenTrue, nodes, ctx),
                captureName(whenFalse, nodes, ctx),
                dataType,
                falseType,
                rowShape);

        NodeFactory factory = new NodeFactory(ctx);
        Node size = factory.create(Ops.SIZE, List.of(condition));
        ctx.setOutputType(size.output(0), ElementType.INT64);
        ctx.setOutputShape(size.output(0), Shape.scalar());
        nodes.add(size);

        BranchGraphBuilder branches = new BranchGraphBuilder(factory, config.branchGraphName());
        LoopBodyBuilder body = new LoopBodyBuilder(factory, new IfNodeBuilder(factory, branches),
                config.loopBodyGraphName());
        LoopNodeBuilder.LoopConstruct loop = new LoopNodeBuilder(factory, body, ctx).build(size.output(0), operands);
        nodes.addAll(loop.nodes());

        String output = node.output(0);
        ctx.setOutputShape(loop.scanOutput(), outputShape);
        ctx.setOutputType(loop.scanOutput(), dataType);
        ctx.setOutputShape(output, outputShape);
        ctx.setOutputType(output, dataType);

        nodes.add(new Node(Ops.IDENTITY, node.name(), List.of(loop.scanOutput()), List.of(output), Map.of()));

        LOG.fine(() -> "Lowered " + node.name() + " to " + nodes.size() + " nodes, output " + output
                + " : " + dataType.irName() + outputShape);
        return List.copyOf(nodes);
    }

    /**
     * Returns the name nested graphs should use to read {@code name}.
     *
     * <p>A name the loop body binds locally would shadow the outer value, so
     * such a value is re-exposed under a fresh name first.
     */
    private static String captureName(String name, List<Node> nodes, GraphContext ctx) {
        if (!LoopBodyBuilder.LOCAL_NAMES.contains(name)) {
            return name;
        }
        for (Node existing : nodes) {
            if (existing.input(0).equals(name)) {
                return existing.output(0);
            }
        }
        ElementType type = ctx.getElementType(name);
        Node alias = new NodeFactory(ctx).create(Ops.IDENTITY, List.of(name));
        ctx.getShape(name).ifPresent(s -> ctx.setOutputShape(alias.output(0), s));
        ctx.setOutputType(alias.output(0), type);
        nodes.add(alias);
        LOG.fine(() -> "Aliased captured value '" + name + "' as " + alias.output(0));
        return alias.output(0);
    }
}
