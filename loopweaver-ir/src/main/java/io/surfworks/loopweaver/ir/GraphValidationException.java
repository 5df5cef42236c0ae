package io.surfworks.loopweaver.ir;

import java.util.List;

/**
 * Thrown by {@link GraphValidator#check(Graph)} when a graph breaks a structural invariant.
 */
public class GraphValidationException extends IrException {

    private final List<String> errors;

    public GraphValidationException(String graphName, List<String> errors) {
        super(format(graphName, errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String format(String graphName, List<String> errors) {
        StringBuilder sb = new StringBuilder("Graph '").append(graphName).append("' failed validation:\n");
        for (String error : errors) {
            sb.append("  - ").append(error).append("\n");
        }
        return sb.toString();
    }
}
