package io.surfworks.loopweaver.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues program-wide unique node and value names.
 *
 * <p>Fresh names have the form {@code prefix__N} where N comes from a single
 * counter shared by all prefixes. Names already present in the program are
 * registered with {@link #reserve(String)} and are never handed out again.
 *
 * <p>One registry is scoped to one program. It is safe to share between
 * threads rewriting different operators of the same program: the counter is
 * atomic and the taken set is concurrent.
 *
 * <p>Example:
 * <pre>{@code
 * NameRegistry names = new NameRegistry();
 * names.reserve("Select_3");
 * String loop = names.freshNodeName("loop", 2);  // "loop__1", with loop__1:0 and loop__1:1 reserved
 * String scan = NameRegistry.portName(loop, 1);  // "loop__1:1"
 * }</pre>
 */
public final class NameRegistry {

    private final Set<String> taken = ConcurrentHashMap.newKeySet();
    private final AtomicLong counter = new AtomicLong();

    /**
     * Returns a name starting with {@code prefix} that was never issued or reserved.
     */
    public String freshName(String prefix) {
        while (true) {
            String candidate = prefix + "__" + counter.incrementAndGet();
            if (taken.add(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * Returns a fresh node name whose output ports {@code name:0 .. name:n-1} are free as well.
     *
     * <p>The node name and all its ports are reserved together.
     */
    public String freshNodeName(String prefix, int outputCount) {
        while (true) {
            String candidate = freshName(prefix);
            if (reservePorts(candidate, outputCount)) {
                return candidate;
            }
        }
    }

    private boolean reservePorts(String nodeName, int outputCount) {
        List<String> claimed = new ArrayList<>(outputCount);
        for (int i = 0; i < outputCount; i++) {
            String port = portName(nodeName, i);
            if (!taken.add(port)) {
                claimed.forEach(taken::remove);
                return false;
            }
            claimed.add(port);
        }
        return true;
    }

    /**
     * Registers an existing program name.
     *
     * @throws NameCollisionException if the name was already issued or reserved
     */
    public void reserve(String name) {
        if (!taken.add(name)) {
            throw new NameCollisionException(name);
        }
    }

    /**
     * Registers an existing program name, tolerating repeats.
     *
     * @return true if the name was not yet known
     */
    public boolean reserveIfAbsent(String name) {
        return taken.add(name);
    }

    public boolean isTaken(String name) {
        return taken.contains(name);
    }

    /**
     * Name of output slot {@code index} of node {@code nodeName}.
     */
    public static String portName(String nodeName, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Output index must be non-negative: " + index);
        }
        return nodeName + ":" + index;
    }

    public static String portName(String nodeName) {
        return portName(nodeName, 0);
    }

    /**
     * Forgets all names and restarts the counter. Call between independent programs.
     */
    public void reset() {
        taken.clear();
        counter.set(0);
    }

    public int size() {
        return taken.size();
    }

    @Override
    public String toString() {
        return String.format("NameRegistry[taken=%d, counter=%d]", taken.size(), counter.get());
    }
}
