package io.surfworks.loopweaver.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Static tensor shape: tensor<3x?xf32> has dims [3, -1].
 *
 * <p>A dimension of {@link #UNKNOWN_DIM} is statically unknown. A shape that is
 * not known at all is represented as {@code Optional.empty()} by the context,
 * never by this record.
 *
 * @param dims the dimension sizes, outermost first
 */
public record Shape(List<Long> dims) {

    /** Marker for a dimension whose size is only known at runtime. */
    public static final long UNKNOWN_DIM = -1L;

    private static final Shape SCALAR = new Shape(List.of());

    public Shape {
        dims = List.copyOf(dims);
        for (long d : dims) {
            if (d < UNKNOWN_DIM) {
                throw new IllegalArgumentException("Invalid dimension " + d + " in " + dims);
            }
        }
    }

    public static Shape of(long... dims) {
        List<Long> list = new ArrayList<>(dims.length);
        for (long d : dims) {
            list.add(d);
        }
        return new Shape(list);
    }

    public static Shape scalar() {
        return SCALAR;
    }

    public int rank() {
        return dims.size();
    }

    public long dim(int i) {
        return dims.get(i);
    }

    public boolean isScalar() {
        return dims.isEmpty();
    }

    public boolean isFullyKnown() {
        return dims.stream().noneMatch(d -> d == UNKNOWN_DIM);
    }

    /**
     * Number of elements, or -1 if any dimension is unknown.
     */
    public long elementCount() {
        long count = 1;
        for (long d : dims) {
            if (d == UNKNOWN_DIM) {
                return UNKNOWN_DIM;
            }
            count *= d;
        }
        return count;
    }

    /**
     * Returns this shape without its leading (batch) dimension.
     *
     * @throws IllegalStateException if this shape is a scalar
     */
    public Shape dropLeading() {
        if (dims.isEmpty()) {
            throw new IllegalStateException("Cannot drop leading dimension of a scalar shape");
        }
        return new Shape(dims.subList(1, dims.size()));
    }

    /**
     * Returns a new shape with {@code leading} prepended.
     */
    public Shape withLeading(long leading) {
        List<Long> result = new ArrayList<>(dims.size() + 1);
        result.add(leading);
        result.addAll(dims);
        return new Shape(result);
    }

    /**
     * Returns the dims as a primitive array; only meaningful for fully known shapes.
     */
    public long[] toArray() {
        long[] result = new long[dims.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = dims.get(i);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < dims.size(); i++) {
            if (i > 0) sb.append(", ");
            long d = dims.get(i);
            sb.append(d == UNKNOWN_DIM ? "?" : String.valueOf(d));
        }
        sb.append("]");
        return sb.toString();
    }
}
