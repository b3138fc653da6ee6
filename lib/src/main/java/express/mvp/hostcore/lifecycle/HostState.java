package express.mvp.hostcore.lifecycle;

/**
 * Represents the states of a host adapter.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌─────────┐ publish  ┌─────────┐  error   ┌──────────┐
 * │ CREATED │─────────▶│ RUNNING │─────────▶│ RECOVERY │
 * └─────────┘          └─────────┘◀─────────└──────────┘
 *      │                    │      recovered      │
 *      │ remove             │ remove              │ remove
 *      ▼                    ▼                     ▼
 * ┌─────────────────────────────┐         ┌─────────────────┐
 * │           CANCEL            │────────▶│ CANCEL_RECOVERY │
 * └─────────────────────────────┘◀────────└─────────────────┘
 *                │                                 │
 *                ▼                                 ▼
 *           ┌─────────┐                    ┌──────────────┐
 *           │   DEL   │◀───────────────────│ DEL_RECOVERY │
 *           └─────────┘                    └──────────────┘
 * </pre>
 *
 * <p>{@link #CREATED} is only ever set at allocation; no transition targets it. {@link #DEL} is
 * terminal.
 *
 * @see HostStateMachine
 */
public enum HostState {

    /** Allocated but not yet published. */
    CREATED("created", false),

    /** Published and accepting work. */
    RUNNING("running", false),

    /** Removal in progress. */
    CANCEL("cancel", false),

    /** Terminal state: removal finished. */
    DEL("deleted", true),

    /** Error recovery in progress on a running host. */
    RECOVERY("recovery", false),

    /** Removal requested while recovery was running. */
    CANCEL_RECOVERY("cancel/recovery", false),

    /** Removal finished while recovery was still running. */
    DEL_RECOVERY("deleted/recovery", false);

    private final String displayName;
    private final boolean terminal;

    HostState(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    /**
     * Returns the name used in log messages and host attributes.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if this is the terminal deletion state.
     *
     * @return true only for {@link #DEL}
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Checks if error recovery is still running in this state.
     *
     * @return true for {@link #RECOVERY}, {@link #CANCEL_RECOVERY} and {@link #DEL_RECOVERY}
     */
    public boolean isRecovering() {
        return this == RECOVERY || this == CANCEL_RECOVERY || this == DEL_RECOVERY;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
