package express.mvp.hostcore.error;

import express.mvp.hostcore.lifecycle.HostState;

/**
 * Thrown when a host state change is not an edge of the host state table.
 *
 * <p>The host state is left unchanged. The attempted source and target are available for
 * diagnostics.
 *
 * @see express.mvp.hostcore.lifecycle.HostStateMachine
 */
public class IllegalStateTransitionException extends HostException {

    private final HostState from;

    private final HostState to;

    /**
     * Constructs a new exception for the rejected transition.
     *
     * @param from the state the host was in
     * @param to the requested state
     */
    public IllegalStateTransitionException(HostState from, HostState to) {
        super(
                HostErrorCode.ILLEGAL_STATE_TRANSITION,
                "Illegal host state transition " + from.displayName() + "->" + to.displayName());
        this.from = from;
        this.to = to;
    }

    /**
     * Returns the state the host was in.
     *
     * @return the source state
     */
    public HostState from() {
        return from;
    }

    /**
     * Returns the state that was requested.
     *
     * @return the target state
     */
    public HostState to() {
        return to;
    }
}
