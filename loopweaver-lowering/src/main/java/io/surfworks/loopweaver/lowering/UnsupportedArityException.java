package io.surfworks.loopweaver.lowering;

/**
 * Thrown when an operator has fewer (or more) inputs than its lowering supports.
 */
public class UnsupportedArityException extends LoweringException {

    private final int expected;
    private final int actual;

    public UnsupportedArityException(String nodeName, String opType, int expected, int actual) {
        super(nodeName, String.format("%s with %d input(s) is not supported, expected %d", opType, actual, expected));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
