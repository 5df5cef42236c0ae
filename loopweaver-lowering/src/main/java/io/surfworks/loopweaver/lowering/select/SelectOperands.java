package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.ElementType;
import io.surfworks.loopweaver.ir.Shape;

/**
 * Names and metadata of a Select being lowered, as seen from inside the loop body.
 *
 * @param condition the per-row condition vector
 * @param whenTrue  operand whose rows are taken where the condition holds
 * @param whenFalse operand whose rows are taken elsewhere
 * @param trueType  element type of {@code whenTrue}, also the output type
 * @param falseType element type of {@code whenFalse}
 * @param rowShape  shape of one row, i.e. the resolved operand shape without its batch dimension
 */
public record SelectOperands(
        String condition,
        String whenTrue,
        String whenFalse,
        ElementType trueType,
        ElementType falseType,
        Shape rowShape
) {
}
