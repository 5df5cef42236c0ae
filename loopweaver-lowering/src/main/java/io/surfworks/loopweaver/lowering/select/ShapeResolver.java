package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.GraphContext;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Shape;
import io.surfworks.loopweaver.lowering.ShapeUnavailableException;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Picks the static shape that the generated subgraphs declare.
 *
 * <p>Candidates are tried in priority order and the first one with a known
 * shape of rank one or more wins. For Select the order is the true operand,
 * then the false operand.
 */
public final class ShapeResolver {

    private static final Logger LOG = Logger.getLogger(ShapeResolver.class.getName());

    private final String nodeName;
    private final List<String> candidates;

    /**
     * @param nodeName   the node being rewritten, for error reporting
     * @param candidates value names in priority order
     */
    public ShapeResolver(String nodeName, List<String> candidates) {
        this.nodeName = nodeName;
        this.candidates = List.copyOf(candidates);
    }

    /**
     * Resolver for Select(condition, x, y): tries x, then y.
     */
    public static ShapeResolver forSelect(Node select) {
        return new ShapeResolver(select.name(), List.of(select.input(1), select.input(2)));
    }

    /**
     * Returns the first usable candidate shape.
     *
     * @throws ShapeUnavailableException if no candidate has a known shape of rank >= 1
     */
    public Shape resolve(GraphContext ctx) {
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            Optional<Shape> shape = ctx.getShape(candidate).filter(s -> s.rank() >= 1);
            if (shape.isPresent()) {
                if (i > 0) {
                    LOG.fine("Shape of " + candidates.subList(0, i) + " unknown, using " + candidate
                            + " " + shape.get() + " for " + nodeName);
                }
                return shape.get();
            }
        }
        throw new ShapeUnavailableException(nodeName, candidates);
    }

    public List<String> candidates() {
        return candidates;
    }
}
