package io.surfworks.loopweaver.interp;

import io.surfworks.loopweaver.ir.AttributeValue;
import io.surfworks.loopweaver.ir.ElementType;
import io.surfworks.loopweaver.ir.Graph;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Ops;
import io.surfworks.loopweaver.ir.Shape;
import io.surfworks.loopweaver.ir.TensorValue;
import io.surfworks.loopweaver.ir.ValueInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GraphInterpreter")
class GraphInterpreterTest {

    private final GraphInterpreter interpreter = new GraphInterpreter();

    private static final TensorValue X = TensorValue.ofDoubles(ElementType.FLOAT, new long[]{3, 2},
            1, 1, 2, 2, 3, 3);
    private static final TensorValue Y = TensorValue.ofDoubles(ElementType.FLOAT, new long[]{3, 2},
            7, 7, 8, 8, 9, 9);

    private static ValueInfo floatMatrix(String name) {
        return ValueInfo.of(name, ElementType.FLOAT, Shape.of(3, 2));
    }

    private TensorValue single(Graph graph, Map<String, TensorValue> inputs) {
        Map<String, TensorValue> outputs = interpreter.execute(graph, inputs);
        assertEquals(1, outputs.size());
        return outputs.values().iterator().next();
    }

    @Nested
    @DisplayName("Select")
    class SelectOp {

        private Graph selectGraph() {
            return new Graph("select",
                    List.of(Node.of(Ops.SELECT, "sel", List.of("cond", "x", "y"), List.of("sel:0"))),
                    List.of(ValueInfo.of("cond", ElementType.BOOL, Shape.of(3)), floatMatrix("x"), floatMatrix("y")),
                    List.of(floatMatrix("sel:0")));
        }

        @Test
        @DisplayName("picks whole rows for a vector condition")
        void rowWise() {
            TensorValue cond = TensorValue.ofBooleans(new long[]{3}, true, false, true);

            TensorValue result = single(selectGraph(), Map.of("cond", cond, "x", X, "y", Y));

            assertEquals(TensorValue.ofDoubles(ElementType.FLOAT, new long[]{3, 2}, 1, 1, 8, 8, 3, 3), result);
        }

        @Test
        @DisplayName("picks elements for a condition of the operand shape")
        void elementWise() {
            Graph graph = new Graph("select",
                    List.of(Node.of(Ops.SELECT, "sel", List.of("cond", "x", "y"), List.of("sel:0"))),
                    List.of(ValueInfo.of("cond", ElementType.BOOL, Shape.of(3, 2)), floatMatrix("x"), floatMatrix("y")),
                    List.of(floatMatrix("sel:0")));
            TensorValue cond = TensorValue.ofBooleans(new long[]{3, 2}, true, false, false, true, true, false);

            TensorValue result = single(graph, Map.of("cond", cond, "x", X, "y", Y));

            assertEquals(TensorValue.ofDoubles(ElementType.FLOAT, new long[]{3, 2}, 1, 7, 8, 2, 3, 9), result);
        }

        @Test
        @DisplayName("rejects a condition that does not match the rows")
        void mismatchedCondition() {
            TensorValue cond = TensorValue.ofBooleans(new long[]{2}, true, false);

            InterpreterException e = assertThrows(InterpreterException.class,
                    () -> interpreter.execute(selectGraph(), Map.of("cond", cond, "x", X, "y", Y)));
            assertTrue(e.getMessage().contains("sel"));
        }
    }

    @Nested
    @DisplayName("tensor primitives")
    class Primitives {

        @Test
        @DisplayName("Gather with a [1] index keeps a leading axis that Squeeze removes")
        void gatherThenSqueeze() {
            Graph graph = new Graph("g",
                    List.of(new Node(Ops.CONSTANT, "idx", List.of(), List.of("idx"),
                                    Map.of(Ops.ATTR_VALUE, AttributeValue.of(
                                            TensorValue.ofLongs(ElementType.INT64, new long[]{1}, 2)))),
                            Node.of(Ops.GATHER, "gather", List.of("x", "idx"), List.of("gather:0")),
                            new Node(Ops.SQUEEZE, "squeeze", List.of("gather:0"), List.of("squeeze:0"),
                                    Map.of(Ops.ATTR_AXES, AttributeValue.ofInts(0)))),
                    List.of(floatMatrix("x")),
                    List.of(ValueInfo.of("gather:0", ElementType.FLOAT, Shape.of(1, 2)),
                            ValueInfo.of("squeeze:0", ElementType.FLOAT, Shape.of(2))));

            Map<String, TensorValue> outputs = interpreter.execute(graph, Map.of("x", X));

            assertArrayEquals(new long[]{1, 2}, outputs.get("gather:0").shape());
            assertEquals(TensorValue.ofDoubles(ElementType.FLOAT, new long[]{2}, 3, 3), outputs.get("squeeze:0"));
        }

        @Test
        @DisplayName("Size then Unsqueeze gives a one-element trip count")
        void sizeThenUnsqueeze() {
            Graph graph = new Graph("g",
                    List.of(Node.of(Ops.SIZE, "size", List.of("x"), List.of("size:0")),
                            new Node(Ops.UNSQUEEZE, "unsq", List.of("size:0"), List.of("unsq:0"),
                                    Map.of(Ops.ATTR_AXES, AttributeValue.ofInts(0)))),
                    List.of(floatMatrix("x")),
                    List.of(ValueInfo.of("unsq:0", ElementType.INT64, Shape.of(1))));

            TensorValue result = single(graph, Map.of("x", X));

            assertEquals(TensorValue.ofLongs(ElementType.INT64, new long[]{1}, 6), result);
        }

        @Test
        @DisplayName("Gather rejects an index past the last row")
        void gatherOutOfRange() {
            Graph graph = new Graph("g",
                    List.of(new Node(Ops.CONSTANT, "idx", List.of(), List.of("idx"),
                                    Map.of(Ops.ATTR_VALUE, AttributeValue.of(TensorValue.scalarLong(3)))),
                            Node.of(Ops.GATHER, "gather", List.of("x", "idx"), List.of("gather:0"))),
                    List.of(floatMatrix("x")),
                    List.of(ValueInfo.of("gather:0", ElementType.FLOAT, Shape.of(2))));

            assertThrows(InterpreterException.class, () -> interpreter.execute(graph, Map.of("x", X)));
        }

        @Test
        @DisplayName("Squeeze rejects an axis that is not 1")
        void squeezeWrongAxis() {
            Graph graph = new Graph("g",
                    List.of(new Node(Ops.SQUEEZE, "squeeze", List.of("x"), List.of("squeeze:0"),
                            Map.of(Ops.ATTR_AXES, AttributeValue.ofInts(0)))),
                    List.of(floatMatrix("x")),
                    List.of(ValueInfo.of("squeeze:0", ElementType.FLOAT, Shape.of(2))));

            assertThrows(InterpreterException.class, () -> interpreter.execute(graph, Map.of("x", X)));
        }
    }

    @Nested
    @DisplayName("control flow")
    class ControlFlow {

        private Graph passThrough(String name, String captured) {
            return new Graph(name,
                    List.of(Node.of(Ops.IDENTITY, name + "_id", List.of(captured), List.of("y"))),
                    List.of(),
                    List.of(floatMatrix("y")));
        }

        private Graph ifGraph() {
            Node ifNode = new Node(Ops.IF, "if", List.of("p"), List.of("if:0"), Map.of(
                    Ops.ATTR_THEN_BRANCH, AttributeValue.of(passThrough("then", "x")),
                    Ops.ATTR_ELSE_BRANCH, AttributeValue.of(passThrough("else", "y"))));
            return new Graph("g", List.of(ifNode),
                    List.of(ValueInfo.of("p", ElementType.BOOL, Shape.scalar()), floatMatrix("x"), floatMatrix("y")),
                    List.of(floatMatrix("if:0")));
        }

        @Test
        @DisplayName("If runs only the chosen branch, which reads outer values")
        void ifCapturesOuterValues() {
            assertEquals(X, single(ifGraph(), Map.of("p", TensorValue.scalarBool(true), "x", X, "y", Y)));
            assertEquals(Y, single(ifGraph(), Map.of("p", TensorValue.scalarBool(false), "x", X, "y", Y)));
        }

        private Graph rowCopyLoop() {
            Graph body = new Graph("body",
                    List.of(Node.of(Ops.GATHER, "g", List.of("x", "i"), List.of("g:0")),
                            new Node(Ops.SQUEEZE, "s", List.of("g:0"), List.of("row"),
                                    Map.of(Ops.ATTR_AXES, AttributeValue.ofInts(0))),
                            Node.of(Ops.IDENTITY, "c", List.of("cond"), List.of("cond_out")),
                            Node.of(Ops.IDENTITY, "v", List.of("acc"), List.of("acc_out"))),
                    List.of(ValueInfo.of("i", ElementType.INT64, Shape.of(1)),
                            ValueInfo.of("cond", ElementType.BOOL, Shape.scalar()),
                            ValueInfo.of("acc", ElementType.FLOAT, Shape.scalar())),
                    List.of(ValueInfo.of("cond_out", ElementType.BOOL, Shape.scalar()),
                            ValueInfo.of("acc_out", ElementType.FLOAT, Shape.scalar()),
                            ValueInfo.of("row", ElementType.FLOAT, Shape.of(2))));
            Node loop = new Node(Ops.LOOP, "loop", List.of("m", "keep", "acc0"), List.of("loop:0", "loop:1"),
                    Map.of(Ops.ATTR_BODY, AttributeValue.of(body)));
            return new Graph("g", List.of(loop),
                    List.of(ValueInfo.of("m", ElementType.INT64, Shape.of(1)),
                            ValueInfo.of("keep", ElementType.BOOL, Shape.scalar()),
                            ValueInfo.of("acc0", ElementType.FLOAT, Shape.scalar()),
                            ValueInfo.of("x", ElementType.FLOAT, Shape.of(Shape.UNKNOWN_DIM, 2))),
                    List.of(ValueInfo.of("loop:0", ElementType.FLOAT, Shape.scalar()),
                            ValueInfo.of("loop:1", ElementType.FLOAT, Shape.of(Shape.UNKNOWN_DIM, 2))));
        }

        private Map<String, TensorValue> loopInputs(long trips, boolean keep, TensorValue x) {
            return Map.of(
                    "m", TensorValue.ofLongs(ElementType.INT64, new long[]{1}, trips),
                    "keep", TensorValue.scalarBool(keep),
                    "acc0", TensorValue.scalarFloat(0.0),
                    "x", x);
        }

        @Test
        @DisplayName("Loop stacks scan outputs and carries values through")
        void loopStacksScans() {
            Map<String, TensorValue> outputs = interpreter.execute(rowCopyLoop(), loopInputs(3, true, X));

            assertEquals(TensorValue.scalarFloat(0.0), outputs.get("loop:0"));
            assertEquals(X, outputs.get("loop:1"));
        }

        @Test
        @DisplayName("Loop with a false initial condition runs zero iterations")
        void loopFalseCondition() {
            Map<String, TensorValue> outputs = interpreter.execute(rowCopyLoop(), loopInputs(3, false, X));

            assertArrayEquals(new long[]{0, 2}, outputs.get("loop:1").shape());
        }

        @Test
        @DisplayName("Loop with zero trips yields an empty scan of the body row shape")
        void loopZeroTrips() {
            TensorValue empty = TensorValue.empty(ElementType.FLOAT, new long[]{2});

            Map<String, TensorValue> outputs = interpreter.execute(rowCopyLoop(), loopInputs(0, true, empty));

            assertEquals(empty, outputs.get("loop:1"));
        }

        @Test
        @DisplayName("Loop without any bound is rejected")
        void loopWithoutBound() {
            Graph body = new Graph("body", List.of(),
                    List.of(ValueInfo.of("i", ElementType.INT64, Shape.scalar()),
                            ValueInfo.of("cond", ElementType.BOOL, Shape.scalar())),
                    List.of(ValueInfo.of("cond", ElementType.BOOL, Shape.scalar())));
            Node loop = new Node(Ops.LOOP, "forever", List.of("", ""), List.of(),
                    Map.of(Ops.ATTR_BODY, AttributeValue.of(body)));
            Graph graph = new Graph("g", List.of(loop), List.of(), List.of());

            InterpreterException e = assertThrows(InterpreterException.class,
                    () -> interpreter.execute(graph, Map.of()));
            assertTrue(e.getMessage().contains("forever"));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("missing graph input is reported")
        void missingInput() {
            Graph graph = new Graph("g", List.of(), List.of(floatMatrix("x")), List.of(floatMatrix("x")));

            InterpreterException e = assertThrows(InterpreterException.class,
                    () -> interpreter.execute(graph, Map.of()));
            assertTrue(e.getMessage().contains("'x'"));
        }

        @Test
        @DisplayName("unbound name is reported")
        void unboundName() {
            Graph graph = new Graph("g",
                    List.of(Node.of(Ops.IDENTITY, "id", List.of("nowhere"), List.of("id:0"))),
                    List.of(),
                    List.of(floatMatrix("id:0")));

            InterpreterException e = assertThrows(InterpreterException.class,
                    () -> interpreter.execute(graph, Map.of()));
            assertTrue(e.getMessage().contains("nowhere"));
        }

        @Test
        @DisplayName("unsupported operator is reported")
        void unsupportedOperator() {
            Graph graph = new Graph("g",
                    List.of(Node.of("MatMul", "mm", List.of("x", "x"), List.of("mm:0"))),
                    List.of(floatMatrix("x")),
                    List.of(floatMatrix("mm:0")));

            InterpreterException e = assertThrows(InterpreterException.class,
                    () -> interpreter.execute(graph, Map.of("x", X)));
            assertTrue(e.getMessage().contains("MatMul"));
        }
    }
}
