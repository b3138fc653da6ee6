package express.mvp.hostcore.command;

/** Order in which command tags are handed out. */
public enum TagAllocPolicy {
    /** Lowest free tag first. */
    FIFO,
    /** Tags rotate through the whole range. */
    ROUND_ROBIN
}
