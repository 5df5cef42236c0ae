package io.surfworks.loopweaver.ir;

/**
 * Thrown when a name that must be unique is already taken.
 *
 * <p>A correct {@link NameRegistry} never produces one; seeing this means a
 * naming invariant was broken, not that the input was bad.
 */
public class NameCollisionException extends IrException {

    private final String name;

    public NameCollisionException(String name) {
        super(String.format("Name '%s' is already in use", name));
        this.name = name;
    }

    public NameCollisionException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
