package io.surfworks.loopweaver.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dense tensor with a fully known shape.
 *
 * <p>Elements are stored flat in row-major order and boxed by element kind:
 * {@link Boolean} for BOOL, {@link Long} for integer types and {@link Double}
 * for floating point types.
 *
 * <p>Example:
 * <pre>{@code
 * TensorValue rows = TensorValue.ofDoubles(ElementType.FLOAT, new long[]{3, 2},
 *         1, 1, 2, 2, 3, 3);
 * TensorValue second = rows.row(1);   // [2.0, 2.0], shape [2]
 * }</pre>
 */
public final class TensorValue {

    private final ElementType elementType;
    private final long[] shape;
    private final Object[] data;

    private TensorValue(ElementType elementType, long[] shape, Object[] data) {
        this.elementType = Objects.requireNonNull(elementType, "elementType cannot be null");
        this.shape = shape.clone();
        this.data = data.clone();

        long expected = 1;
        for (long d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Tensor shape must be fully known: " + Arrays.toString(shape));
            }
            expected *= d;
        }
        if (expected != data.length) {
            throw new IllegalArgumentException(
                "Shape " + Arrays.toString(shape) + " needs " + expected + " elements, got " + data.length);
        }
        for (Object element : data) {
            checkElement(elementType, element);
        }
    }

    /**
     * Create a tensor from already boxed elements.
     */
    public static TensorValue of(ElementType elementType, long[] shape, Object... data) {
        return new TensorValue(elementType, shape, data);
    }

    public static TensorValue ofBooleans(long[] shape, boolean... values) {
        Object[] data = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = values[i];
        }
        return new TensorValue(ElementType.BOOL, shape, data);
    }

    public static TensorValue ofLongs(ElementType elementType, long[] shape, long... values) {
        Object[] data = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = values[i];
        }
        return new TensorValue(elementType, shape, data);
    }

    public static TensorValue ofDoubles(ElementType elementType, long[] shape, double... values) {
        Object[] data = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = values[i];
        }
        return new TensorValue(elementType, shape, data);
    }

    public static TensorValue scalarBool(boolean value) {
        return ofBooleans(new long[0], value);
    }

    public static TensorValue scalarLong(long value) {
        return ofLongs(ElementType.INT64, new long[0], value);
    }

    public static TensorValue scalarFloat(double value) {
        return ofDoubles(ElementType.FLOAT, new long[0], value);
    }

    /**
     * Create an empty tensor whose leading dimension is zero.
     *
     * @param elementType the element type
     * @param rowShape the shape of a single (absent) row
     */
    public static TensorValue empty(ElementType elementType, long[] rowShape) {
        long[] shape = new long[rowShape.length + 1];
        System.arraycopy(rowShape, 0, shape, 1, rowShape.length);
        return new TensorValue(elementType, shape, new Object[0]);
    }

    /**
     * Stack equally shaped tensors along a new leading axis.
     *
     * @param rows the tensors to stack, at least one
     * @return a tensor of shape [rows.size()] + rows[0].shape
     */
    public static TensorValue stack(List<TensorValue> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Cannot stack zero tensors without a row shape, use empty()");
        }
        TensorValue first = rows.get(0);
        List<Object> data = new ArrayList<>();
        for (TensorValue row : rows) {
            if (row.elementType != first.elementType || !Arrays.equals(row.shape, first.shape)) {
                throw new IllegalArgumentException(
                    "Cannot stack " + row.describe() + " with " + first.describe());
            }
            data.addAll(Arrays.asList(row.data));
        }
        long[] shape = new long[first.shape.length + 1];
        shape[0] = rows.size();
        System.arraycopy(first.shape, 0, shape, 1, first.shape.length);
        return new TensorValue(first.elementType, shape, data.toArray());
    }

    public ElementType elementType() {
        return elementType;
    }

    public long[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int elementCount() {
        return data.length;
    }

    public Object get(int flatIndex) {
        return data[flatIndex];
    }

    /**
     * Returns the slice at {@code index} along the leading axis.
     *
     * @throws IndexOutOfBoundsException if index is outside [0, shape[0])
     */
    public TensorValue row(long index) {
        if (shape.length == 0) {
            throw new IllegalStateException("Cannot take a row of a scalar");
        }
        if (index < 0 || index >= shape[0]) {
            throw new IndexOutOfBoundsException("Row " + index + " out of range for " + describe());
        }
        long[] rowShape = Arrays.copyOfRange(shape, 1, shape.length);
        int rowSize = shape[0] == 0 ? 0 : data.length / (int) shape[0];
        int start = (int) index * rowSize;
        return new TensorValue(elementType, rowShape, Arrays.copyOfRange(data, start, start + rowSize));
    }

    /**
     * Same elements under a different shape with equal element count.
     */
    public TensorValue reshape(long[] newShape) {
        return new TensorValue(elementType, newShape, data);
    }

    public boolean asBoolean() {
        requireSingleElement();
        return (Boolean) data[0];
    }

    public long asLong() {
        requireSingleElement();
        return (Long) data[0];
    }

    public double asDouble() {
        requireSingleElement();
        return (Double) data[0];
    }

    private void requireSingleElement() {
        if (data.length != 1) {
            throw new IllegalStateException("Expected a single element but " + describe() + " has " + data.length);
        }
    }

    /**
     * Short description, e.g. {@code float[3, 2]}.
     */
    public String describe() {
        return elementType.irName() + Arrays.toString(shape);
    }

    private static void checkElement(ElementType type, Object element) {
        boolean ok = switch (type) {
            case BOOL -> element instanceof Boolean;
            case INT32, INT64 -> element instanceof Long;
            case FLOAT16, FLOAT, DOUBLE -> element instanceof Double;
        };
        if (!ok) {
            throw new IllegalArgumentException(
                "Element " + element + " is not valid for element type " + type.irName());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorValue that)) return false;
        return elementType == that.elementType
            && Arrays.equals(shape, that.shape)
            && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(elementType);
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return describe() + " " + Arrays.toString(data);
    }
}
