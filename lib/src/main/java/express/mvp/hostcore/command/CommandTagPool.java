package express.mvp.hostcore.command;

/**
 * Opaque command-tag pool sized to a host's queue depth.
 *
 * <p>The lifecycle core only creates and closes pools; tag handout belongs to the command layer.
 */
public class CommandTagPool implements AutoCloseable {

    private final int depth;

    private final TagAllocPolicy policy;

    private volatile boolean closed;

    /**
     * Creates a pool.
     *
     * @param depth number of tags, the host's {@code canQueue}
     * @param policy tag allocation order
     */
    public CommandTagPool(int depth, TagAllocPolicy policy) {
        if (depth <= 0) {
            throw new IllegalArgumentException("depth must be positive: " + depth);
        }
        this.depth = depth;
        this.policy = policy;
    }

    public int depth() {
        return depth;
    }

    public TagAllocPolicy policy() {
        return policy;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String toString() {
        return "CommandTagPool{depth=" + depth + ", policy=" + policy + ", closed=" + closed + "}";
    }
}
