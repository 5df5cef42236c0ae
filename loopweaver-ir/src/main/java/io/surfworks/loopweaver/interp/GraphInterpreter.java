package io.surfworks.loopweaver.interp;

import io.surfworks.loopweaver.ir.AttributeValue;
import io.surfworks.loopweaver.ir.Branch;
import io.surfworks.loopweaver.ir.ElementType;
import io.surfworks.loopweaver.ir.Graph;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Ops;
import io.surfworks.loopweaver.ir.Shape;
import io.surfworks.loopweaver.ir.TensorValue;
import io.surfworks.loopweaver.ir.ValueInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Reference executor for graphs built from the primitive operators in {@link Ops}.
 *
 * <p>Nodes run in list order. Control-flow nodes run their nested graphs in a
 * child {@link Scope}, so branch and body graphs can read names of every
 * enclosing invocation. {@code Select} is supported as well, which allows an
 * original graph and its lowered form to be compared on the same inputs.
 *
 * <p>Example usage:
 * <pre>{@code
 * GraphInterpreter interpreter = new GraphInterpreter();
 * Map<String, TensorValue> outputs = interpreter.execute(graph, Map.of(
 *         "cond", TensorValue.ofBooleans(new long[]{2}, true, false),
 *         "x", x,
 *         "y", y));
 * }</pre>
 */
public final class GraphInterpreter {

    private static final Logger LOG = Logger.getLogger(GraphInterpreter.class.getName());

    /**
     * Execute a top-level graph.
     *
     * @param graph  the graph to run
     * @param inputs a value for every declared graph input
     * @return the declared graph outputs, in declaration order
     * @throws InterpreterException if an input is missing or an operation fails
     */
    public Map<String, TensorValue> execute(Graph graph, Map<String, TensorValue> inputs) {
        List<TensorValue> formals = new ArrayList<>(graph.inputs().size());
        for (ValueInfo input : graph.inputs()) {
            TensorValue value = inputs.get(input.name());
            if (value == null) {
                throw new InterpreterException("Missing value for graph input '" + input.name() + "'");
            }
            formals.add(value);
        }

        List<TensorValue> results = run(graph, null, formals);

        Map<String, TensorValue> outputs = new LinkedHashMap<>();
        for (int i = 0; i < results.size(); i++) {
            outputs.put(graph.outputs().get(i).name(), results.get(i));
        }
        return outputs;
    }

    /**
     * Run a graph in a new scope chained to {@code parent}, or a root scope if parent is null.
     */
    private List<TensorValue> run(Graph graph, Scope parent, List<TensorValue> formals) {
        if (formals.size() != graph.inputs().size()) {
            throw new InterpreterException(
                "Graph '" + graph.name() + "' expects " + graph.inputs().size() + " inputs, got " + formals.size());
        }
        Scope scope = parent == null ? Scope.root() : parent.child();
        for (int i = 0; i < formals.size(); i++) {
            scope.bind(graph.inputs().get(i).name(), formals.get(i));
        }

        for (Node node : graph.nodes()) {
            List<TensorValue> results = executeNode(node, scope);
            if (results.size() != node.outputs().size()) {
                throw new InterpreterException(node.name(),
                    node.opType() + " produced " + results.size() + " values for " + node.outputs().size() + " outputs");
            }
            for (int i = 0; i < results.size(); i++) {
                scope.bind(node.output(i), results.get(i));
            }
        }

        List<TensorValue> outputs = new ArrayList<>(graph.outputs().size());
        for (ValueInfo output : graph.outputs()) {
            outputs.add(scope.lookup(output.name()));
        }
        return outputs;
    }

    private List<TensorValue> executeNode(Node node, Scope scope) {
        return switch (node.opType()) {
            case Ops.IDENTITY -> List.of(scope.lookup(node.input(0)));
            case Ops.CONSTANT -> List.of(constant(node));
            case Ops.SIZE -> List.of(TensorValue.scalarLong(scope.lookup(node.input(0)).elementCount()));
            case Ops.UNSQUEEZE -> List.of(unsqueeze(node, scope.lookup(node.input(0))));
            case Ops.SQUEEZE -> List.of(squeeze(node, scope.lookup(node.input(0))));
            case Ops.GATHER -> List.of(gather(node, scope.lookup(node.input(0)), scope.lookup(node.input(1))));
            case Ops.SELECT -> List.of(select(node,
                    scope.lookup(node.input(0)), scope.lookup(node.input(1)), scope.lookup(node.input(2))));
            case Ops.IF -> executeIf(node, scope);
            case Ops.LOOP -> executeLoop(node, scope);
            default -> throw new InterpreterException(node.name(), "Unsupported operator " + node.opType());
        };
    }

    private TensorValue constant(Node node) {
        if (node.attribute(Ops.ATTR_VALUE).orElse(null) instanceof AttributeValue.TensorAttr tensorAttr) {
            return tensorAttr.value();
        }
        throw new InterpreterException(node.name(), "Constant has no tensor value");
    }

    private TensorValue unsqueeze(Node node, TensorValue input) {
        int outRank = input.rank() + node.intsAttribute(Ops.ATTR_AXES).size();
        TreeSet<Integer> axes = normalizedAxes(node, outRank);
        long[] inShape = input.shape();
        long[] outShape = new long[outRank];
        int src = 0;
        for (int i = 0; i < outRank; i++) {
            outShape[i] = axes.contains(i) ? 1 : inShape[src++];
        }
        return input.reshape(outShape);
    }

    private TensorValue squeeze(Node node, TensorValue input) {
        long[] inShape = input.shape();
        TreeSet<Integer> axes;
        if (node.attribute(Ops.ATTR_AXES).isPresent()) {
            axes = normalizedAxes(node, inShape.length);
        } else {
            axes = new TreeSet<>();
            for (int i = 0; i < inShape.length; i++) {
                if (inShape[i] == 1) axes.add(i);
            }
        }
        List<Long> outShape = new ArrayList<>();
        for (int i = 0; i < inShape.length; i++) {
            if (axes.contains(i)) {
                if (inShape[i] != 1) {
                    throw new InterpreterException(node.name(),
                        "Cannot squeeze axis " + i + " of size " + inShape[i] + " in " + input.describe());
                }
            } else {
                outShape.add(inShape[i]);
            }
        }
        return input.reshape(outShape.stream().mapToLong(Long::longValue).toArray());
    }

    private TreeSet<Integer> normalizedAxes(Node node, int rank) {
        TreeSet<Integer> axes = new TreeSet<>();
        for (long axis : node.intsAttribute(Ops.ATTR_AXES)) {
            long normalized = axis < 0 ? axis + rank : axis;
            if (normalized < 0 || normalized >= rank) {
                throw new InterpreterException(node.name(), "Axis " + axis + " out of range for rank " + rank);
            }
            axes.add((int) normalized);
        }
        return axes;
    }

    /**
     * Gather along axis 0: output shape is indices.shape + data.shape[1:].
     */
    private TensorValue gather(Node node, TensorValue data, TensorValue indices) {
        if (!indices.elementType().isInteger()) {
            throw new InterpreterException(node.name(), "Gather indices must be integers, got " + indices.describe());
        }
        if (data.rank() == 0) {
            throw new InterpreterException(node.name(), "Gather needs data of rank >= 1");
        }
        long rows = data.shape()[0];
        List<TensorValue> picked = new ArrayList<>(indices.elementCount());
        for (int i = 0; i < indices.elementCount(); i++) {
            long index = (Long) indices.get(i);
            long resolved = index < 0 ? index + rows : index;
            if (resolved < 0 || resolved >= rows) {
                throw new InterpreterException(node.name(),
                    "Gather index " + index + " out of range for " + data.describe());
            }
            picked.add(data.row(resolved));
        }

        long[] rowShape = Arrays.copyOfRange(data.shape(), 1, data.rank());
        long[] outShape = concat(indices.shape(), rowShape);
        if (picked.isEmpty()) {
            return TensorValue.empty(data.elementType(), rowShape).reshape(outShape);
        }
        return TensorValue.stack(picked).reshape(outShape);
    }

    /**
     * Row-wise (1-D condition) or element-wise (same-shape condition) selection.
     */
    private TensorValue select(Node node, TensorValue cond, TensorValue x, TensorValue y) {
        if (!Arrays.equals(x.shape(), y.shape()) || x.elementType() != y.elementType()) {
            throw new InterpreterException(node.name(),
                "Select operands differ: " + x.describe() + " vs " + y.describe());
        }
        if (Arrays.equals(cond.shape(), x.shape())) {
            Object[] data = new Object[x.elementCount()];
            for (int i = 0; i < data.length; i++) {
                data[i] = (Boolean) cond.get(i) ? x.get(i) : y.get(i);
            }
            return TensorValue.of(x.elementType(), x.shape(), data);
        }
        if (cond.rank() != 1 || x.rank() == 0 || cond.shape()[0] != x.shape()[0]) {
            throw new InterpreterException(node.name(),
                "Select condition " + cond.describe() + " does not match rows of " + x.describe());
        }
        long rows = cond.shape()[0];
        if (rows == 0) {
            return x;
        }
        List<TensorValue> chosen = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            chosen.add((Boolean) cond.get(i) ? x.row(i) : y.row(i));
        }
        return TensorValue.stack(chosen);
    }

    private List<TensorValue> executeIf(Node node, Scope scope) {
        boolean predicate = scope.lookup(node.input(0)).asBoolean();
        Branch branch = Branch.select(predicate, node);
        return run(branch.graph(), scope, List.of());
    }

    /**
     * Loop(M, cond, v...) runs while {@code iter < M && cond}; either bound may be omitted.
     */
    private List<TensorValue> executeLoop(Node node, Scope scope) {
        Graph body = node.graphAttribute(Ops.ATTR_BODY);
        String tripInput = node.input(0);
        String condInput = node.input(1);
        if (tripInput.isEmpty() && condInput.isEmpty()) {
            throw new InterpreterException(node.name(), "Loop without trip count or condition never terminates");
        }
        long tripCount = tripInput.isEmpty() ? Long.MAX_VALUE : scope.lookup(tripInput).asLong();
        boolean keepGoing = condInput.isEmpty() || scope.lookup(condInput).asBoolean();

        int carriedCount = node.inputCount() - 2;
        List<TensorValue> carried = new ArrayList<>(carriedCount);
        for (int i = 0; i < carriedCount; i++) {
            carried.add(scope.lookup(node.input(2 + i)));
        }
        int scanCount = body.outputs().size() - 1 - carriedCount;
        List<List<TensorValue>> scans = new ArrayList<>(scanCount);
        for (int i = 0; i < scanCount; i++) {
            scans.add(new ArrayList<>());
        }

        ValueInfo iterInput = body.inputs().get(0);
        long iter = 0;
        while (iter < tripCount && keepGoing) {
            List<TensorValue> formals = new ArrayList<>(2 + carriedCount);
            formals.add(iterationValue(iterInput, iter));
            formals.add(TensorValue.scalarBool(keepGoing));
            formals.addAll(carried);

            List<TensorValue> results = run(body, scope, formals);
            keepGoing = results.get(0).asBoolean();
            for (int i = 0; i < carriedCount; i++) {
                carried.set(i, results.get(1 + i));
            }
            for (int i = 0; i < scanCount; i++) {
                scans.get(i).add(results.get(1 + carriedCount + i));
            }
            iter++;
        }
        LOG.fine(() -> "Loop " + node.name() + " ran " + scans.stream().findFirst().map(List::size).orElse(0)
                + " scan iterations");

        List<TensorValue> outputs = new ArrayList<>(carried);
        for (int i = 0; i < scanCount; i++) {
            List<TensorValue> values = scans.get(i);
            if (values.isEmpty()) {
                outputs.add(emptyScan(node, body.outputs().get(1 + carriedCount + i)));
            } else {
                outputs.add(TensorValue.stack(values));
            }
        }
        return outputs;
    }

    private static TensorValue iterationValue(ValueInfo iterInput, long iter) {
        if (iterInput.shape().rank() == 1) {
            return TensorValue.ofLongs(ElementType.INT64, new long[]{1}, iter);
        }
        return TensorValue.scalarLong(iter);
    }

    private static TensorValue emptyScan(Node node, ValueInfo scanOutput) {
        Shape rowShape = scanOutput.shape();
        if (!rowShape.isFullyKnown()) {
            throw new InterpreterException(node.name(),
                "Zero-iteration scan output '" + scanOutput.name() + "' needs a static shape, got " + rowShape);
        }
        return TensorValue.empty(scanOutput.elementType(), rowShape.toArray());
    }

    private static long[] concat(long[] a, long[] b) {
        long[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }
}
