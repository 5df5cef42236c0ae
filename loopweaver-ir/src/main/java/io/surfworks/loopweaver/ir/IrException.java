package io.surfworks.loopweaver.ir;

/**
 * Base class for errors raised while building, querying or checking graphs.
 */
public class IrException extends RuntimeException {

    public IrException(String message) {
        super(message);
    }

    public IrException(String message, Throwable cause) {
        super(message, cause);
    }
}
