package io.surfworks.loopweaver.interp;

import io.surfworks.loopweaver.ir.IrException;

/**
 * Thrown when a graph cannot be executed, e.g. an unbound name or a bad operand shape.
 */
public class InterpreterException extends IrException {

    public InterpreterException(String message) {
        super(message);
    }

    public InterpreterException(String nodeName, String message) {
        super(String.format("%s (at node '%s')", message, nodeName));
    }
}
