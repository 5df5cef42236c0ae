package io.surfworks.loopweaver.ir;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryGraphContextTest {

    @Test
    void unknownTypeFails() {
        InMemoryGraphContext ctx = new InMemoryGraphContext();

        UnknownTypeException e = assertThrows(UnknownTypeException.class, () -> ctx.getElementType("missing"));
        assertEquals("missing", e.getValueName());
    }

    @Test
    void declareWithoutShapeLeavesShapeUnknown() {
        InMemoryGraphContext ctx = new InMemoryGraphContext()
                .declare("x", ElementType.FLOAT, null);

        assertEquals(ElementType.FLOAT, ctx.getElementType("x"));
        assertEquals(Optional.empty(), ctx.getShape("x"));
    }

    @Test
    void settersOverwriteMetadata() {
        InMemoryGraphContext ctx = new InMemoryGraphContext();

        ctx.setOutputType("out", ElementType.INT64);
        ctx.setOutputShape("out", Shape.of(3));

        assertEquals(ElementType.INT64, ctx.getElementType("out"));
        assertEquals(Optional.of(Shape.of(3)), ctx.getShape("out"));
    }

    @Test
    void declareGraphReservesExistingNames() {
        Graph graph = new Graph("g",
                List.of(new Node(Ops.IDENTITY, "Identity__1", List.of("x"), List.of("Identity__1:0"), Map.of())),
                List.of(ValueInfo.of("x", ElementType.FLOAT, Shape.of(2))),
                List.of(ValueInfo.of("Identity__1:0", ElementType.FLOAT, Shape.of(2))));

        InMemoryGraphContext ctx = new InMemoryGraphContext().declareGraph(graph);

        assertTrue(ctx.names().isTaken("Identity__1"));
        assertTrue(ctx.names().isTaken("x"));
        assertEquals("Identity__2", ctx.freshName("Identity"));
        assertEquals(Optional.of(Shape.of(2)), ctx.getShape("x"));
    }
}
