package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.ElementType;
import io.surfworks.loopweaver.ir.InMemoryGraphContext;
import io.surfworks.loopweaver.ir.Shape;
import io.surfworks.loopweaver.lowering.SelectGraphs;
import io.surfworks.loopweaver.lowering.ShapeUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ShapeResolverTest {

    private final ShapeResolver resolver = ShapeResolver.forSelect(SelectGraphs.select("sel", "c", "x", "y"));

    @Test
    void candidatesAreTrueThenFalseOperand() {
        assertEquals(List.of("x", "y"), resolver.candidates());
    }

    @Test
    void prefersTrueOperand() {
        InMemoryGraphContext ctx = new InMemoryGraphContext()
                .declare("x", ElementType.FLOAT, Shape.of(4, 2))
                .declare("y", ElementType.FLOAT, Shape.of(4, 3));

        assertEquals(Shape.of(4, 2), resolver.resolve(ctx));
    }

    @Test
    void usesTrueOperandWhenFalseOperandUnknown() {
        InMemoryGraphContext ctx = new InMemoryGraphContext()
                .declare("x", ElementType.FLOAT, Shape.of(4, 2));

        assertEquals(Shape.of(4, 2), resolver.resolve(ctx));
    }

    @Test
    void fallsBackToFalseOperand() {
        InMemoryGraphContext ctx = new InMemoryGraphContext()
                .declare("y", ElementType.FLOAT, Shape.of(4, 3));

        assertEquals(Shape.of(4, 3), resolver.resolve(ctx));
    }

    @Test
    void skipsScalarShapes() {
        InMemoryGraphContext ctx = new InMemoryGraphContext()
                .declare("x", ElementType.FLOAT, Shape.scalar())
                .declare("y", ElementType.FLOAT, Shape.of(Shape.UNKNOWN_DIM));

        assertEquals(Shape.of(Shape.UNKNOWN_DIM), resolver.resolve(ctx));
    }

    @Test
    void failsWithoutAnyShape() {
        ShapeUnavailableException e = assertThrows(ShapeUnavailableException.class,
                () -> resolver.resolve(new InMemoryGraphContext()));

        assertEquals("sel", e.getNodeName());
        assertEquals(List.of("x", "y"), e.getCandidates());
    }
}
