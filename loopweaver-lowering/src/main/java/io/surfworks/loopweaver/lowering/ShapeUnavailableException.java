package io.surfworks.loopweaver.lowering;

import java.util.List;

/**
 * Thrown when none of the candidate values has a usable static shape.
 *
 * <p>Nested graphs must declare their output shapes, so the rewrite cannot
 * proceed without one.
 */
public class ShapeUnavailableException extends LoweringException {

    private final List<String> candidates;

    public ShapeUnavailableException(String nodeName, List<String> candidates) {
        super(nodeName, "no static shape known for any of " + candidates + ", cannot declare subgraph outputs");
        this.candidates = List.copyOf(candidates);
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
