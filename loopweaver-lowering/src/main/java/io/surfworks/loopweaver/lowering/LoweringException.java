package io.surfworks.loopweaver.lowering;

/**
 * Thrown when an operator cannot be lowered.
 *
 * <p>Aborts the rewrite of that operator only; nothing is emitted for it.
 */
public class LoweringException extends RuntimeException {

    private final String nodeName;

    public LoweringException(String nodeName, String message) {
        super(String.format("Cannot lower node '%s': %s", nodeName, message));
        this.nodeName = nodeName;
    }

    public LoweringException(String nodeName, String message, Throwable cause) {
        super(String.format("Cannot lower node '%s': %s", nodeName, message), cause);
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
