package io.surfworks.loopweaver.ir;

/**
 * Operator kinds and attribute names of the target IR.
 */
public final class Ops {

    private Ops() {}

    // ==================== Operator kinds ====================

    /** Select(condition, x, y): per-row choice between x and y. Not native to the target. */
    public static final String SELECT = "Select";

    /** Size(x): scalar int64 element count. */
    public static final String SIZE = "Size";

    public static final String UNSQUEEZE = "Unsqueeze";
    public static final String SQUEEZE = "Squeeze";

    /** Gather(data, indices) along axis 0. */
    public static final String GATHER = "Gather";

    public static final String CONSTANT = "Constant";
    public static final String IDENTITY = "Identity";

    /** If(cond) with then_branch / else_branch, each a zero-input graph. */
    public static final String IF = "If";

    /** Loop(M, cond, v_initial...) -> (v_final..., scan_outputs...) with a body graph. */
    public static final String LOOP = "Loop";

    // ==================== Attribute names ====================

    public static final String ATTR_AXES = "axes";
    public static final String ATTR_VALUE = "value";
    public static final String ATTR_THEN_BRANCH = "then_branch";
    public static final String ATTR_ELSE_BRANCH = "else_branch";
    public static final String ATTR_BODY = "body";
}
