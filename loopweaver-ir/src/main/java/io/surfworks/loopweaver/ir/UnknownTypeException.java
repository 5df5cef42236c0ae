package io.surfworks.loopweaver.ir;

/**
 * Thrown when the element type of a value was never inferred.
 */
public class UnknownTypeException extends IrException {

    private final String valueName;

    public UnknownTypeException(String valueName) {
        super(String.format("Element type of '%s' is unknown", valueName));
        this.valueName = valueName;
    }

    public String getValueName() {
        return valueName;
    }
}
