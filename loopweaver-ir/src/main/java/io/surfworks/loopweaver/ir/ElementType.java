package io.surfworks.loopweaver.ir;

/**
 * Element types a value signature can declare.
 */
public enum ElementType {
    BOOL("bool"),
    INT32("int32"),
    INT64("int64"),
    FLOAT16("float16"),
    FLOAT("float"),
    DOUBLE("double");

    private final String irName;

    ElementType(String irName) {
        this.irName = irName;
    }

    /**
     * Name used when printing or serializing the IR.
     */
    public String irName() {
        return irName;
    }

    public boolean isInteger() {
        return this == INT32 || this == INT64;
    }
}
