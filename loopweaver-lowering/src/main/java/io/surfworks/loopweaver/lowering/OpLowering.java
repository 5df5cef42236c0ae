package io.surfworks.loopweaver.lowering;

import io.surfworks.loopweaver.ir.GraphContext;
import io.surfworks.loopweaver.ir.Node;

import java.util.List;

/**
 * Rewrites one operator kind into primitives the target IR supports.
 *
 * <p>An OpLowering defines:
 * <ul>
 *   <li>The operator kind it handles</li>
 *   <li>A lowering function that returns the replacement nodes</li>
 * </ul>
 *
 * <p>Lowerings are applied by {@link LoweringPass}, which splices the
 * replacement list in place of the original node.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public class NegLowering implements OpLowering {
 *     @Override
 *     public String opType() { return "Neg"; }
 *
 *     @Override
 *     public List<Node> lower(Node node, GraphContext ctx) {
 *         // Neg(x) -> Sub(0, x)
 *         ...
 *     }
 * }
 * }</pre>
 */
public interface OpLowering {

    /**
     * Returns the operator kind this lowering replaces, e.g. "Select".
     */
    String opType();

    /**
     * Builds the replacement for a node.
     *
     * <p>The last returned node must produce the original node's declared
     * outputs under the same names, so consumers are unaffected. Inferred
     * types and shapes are reported through {@code ctx}.
     *
     * @param node the node to replace, of kind {@link #opType()}
     * @param ctx metadata and naming services of the enclosing program
     * @return the new top-level nodes in execution order
     * @throws LoweringException if the node cannot be lowered; nothing is emitted in that case
     */
    List<Node> lower(Node node, GraphContext ctx);

    /**
     * Returns a human-readable description of this lowering.
     */
    default String description() {
        return opType() + " lowering";
    }
}
