package io.surfworks.loopweaver.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShapeTest {

    @Test
    void dropLeadingRemovesBatchDimension() {
        assertEquals(Shape.of(2, 5), Shape.of(3, 2, 5).dropLeading());
        assertEquals(Shape.scalar(), Shape.of(7).dropLeading());
    }

    @Test
    void dropLeadingOfScalarFails() {
        assertThrows(IllegalStateException.class, () -> Shape.scalar().dropLeading());
    }

    @Test
    void withLeadingPrependsDimension() {
        assertEquals(Shape.of(4, 2), Shape.of(2).withLeading(4));
        assertEquals(Shape.of(Shape.UNKNOWN_DIM), Shape.scalar().withLeading(Shape.UNKNOWN_DIM));
    }

    @Test
    void unknownDimensions() {
        Shape shape = Shape.of(Shape.UNKNOWN_DIM, 3);

        assertFalse(shape.isFullyKnown());
        assertEquals(Shape.UNKNOWN_DIM, shape.elementCount());
        assertEquals("[?, 3]", shape.toString());
    }

    @Test
    void elementCountOfKnownShape() {
        assertEquals(24, Shape.of(2, 3, 4).elementCount());
        assertEquals(1, Shape.scalar().elementCount());
        assertEquals(0, Shape.of(0, 2).elementCount());
    }

    @Test
    void rejectsNegativeDimensionsOtherThanUnknown() {
        assertThrows(IllegalArgumentException.class, () -> Shape.of(2, -3));
    }

    @Test
    void dimsAreImmutable() {
        Shape shape = new Shape(new java.util.ArrayList<>(List.of(1L, 2L)));

        assertThrows(UnsupportedOperationException.class, () -> shape.dims().add(3L));
        assertArrayEquals(new long[]{1, 2}, shape.toArray());
        assertTrue(Shape.scalar().isScalar());
    }
}
