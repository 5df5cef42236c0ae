package io.surfworks.loopweaver.interp;

import io.surfworks.loopweaver.ir.TensorValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Runtime bindings of one graph invocation, chained to the enclosing invocation.
 *
 * <p>Lookups check local bindings first and then walk the parent chain, so a
 * nested graph reads captured names by reference and a local definition
 * shadows an outer one. Values are never copied between scopes.
 */
final class Scope {

    private final Scope parent;
    private final Map<String, TensorValue> bindings = new HashMap<>();

    Scope(Scope parent) {
        this.parent = parent;
    }

    static Scope root() {
        return new Scope(null);
    }

    Scope child() {
        return new Scope(this);
    }

    void bind(String name, TensorValue value) {
        bindings.put(name, value);
    }

    /**
     * @throws InterpreterException if no scope in the chain binds the name
     */
    TensorValue lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            TensorValue value = scope.bindings.get(name);
            if (value != null) {
                return value;
            }
        }
        throw new InterpreterException("Value '" + name + "' is not bound in any enclosing scope");
    }
}
