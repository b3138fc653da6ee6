package express.mvp.hostcore.lifecycle;

import express.mvp.hostcore.error.IllegalStateTransitionException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transition table for the host state model.
 *
 * <p>Pure functions only: no locking, no logging, no I/O. Callers hold the host lock while they
 * consult the table and commit the result.
 *
 * <h2>Legal Transitions</h2>
 *
 * <pre>
 * CREATED | RECOVERY          → RUNNING
 * RUNNING                     → RECOVERY
 * CREATED | RUNNING | CANCEL_RECOVERY → CANCEL
 * CANCEL | DEL_RECOVERY       → DEL
 * CANCEL | RECOVERY           → CANCEL_RECOVERY
 * CANCEL_RECOVERY             → DEL_RECOVERY
 * </pre>
 *
 * <p>A request for the current state is always accepted as a no-op.
 *
 * @see HostState
 */
public final class HostStateMachine {

    // Legal source states per target state
    private static final Map<HostState, Set<HostState>> SOURCES = new EnumMap<>(HostState.class);

    static {
        SOURCES.put(HostState.CREATED, EnumSet.noneOf(HostState.class));
        SOURCES.put(HostState.RUNNING, EnumSet.of(HostState.CREATED, HostState.RECOVERY));
        SOURCES.put(HostState.RECOVERY, EnumSet.of(HostState.RUNNING));
        SOURCES.put(
                HostState.CANCEL,
                EnumSet.of(HostState.CREATED, HostState.RUNNING, HostState.CANCEL_RECOVERY));
        SOURCES.put(HostState.DEL, EnumSet.of(HostState.CANCEL, HostState.DEL_RECOVERY));
        SOURCES.put(HostState.CANCEL_RECOVERY, EnumSet.of(HostState.CANCEL, HostState.RECOVERY));
        SOURCES.put(HostState.DEL_RECOVERY, EnumSet.of(HostState.CANCEL_RECOVERY));
    }

    private HostStateMachine() {
        // Utility class
    }

    /**
     * Checks if a host may move from one state to another.
     *
     * @param from the current state
     * @param to the requested state
     * @return true if {@code from == to} or the pair is an edge of the table
     */
    public static boolean isValidTransition(HostState from, HostState to) {
        return from == to || SOURCES.get(to).contains(from);
    }

    /**
     * Validates a transition and returns the state to commit.
     *
     * @param from the current state
     * @param to the requested state
     * @return {@code to}
     * @throws IllegalStateTransitionException if the pair is not an edge of the table
     */
    public static HostState transition(HostState from, HostState to) {
        if (!isValidTransition(from, to)) {
            throw new IllegalStateTransitionException(from, to);
        }
        return to;
    }

    /**
     * Returns the states from which {@code target} may be entered.
     *
     * @param target the target state
     * @return unmodifiable set of legal source states
     */
    public static Set<HostState> sourcesOf(HostState target) {
        return Collections.unmodifiableSet(SOURCES.get(target));
    }

    /**
     * Returns the states reachable in one step from {@code from}.
     *
     * @param from the source state
     * @return a new set of legal target states, excluding {@code from} itself
     */
    public static Set<HostState> targetsOf(HostState from) {
        Set<HostState> targets = EnumSet.noneOf(HostState.class);
        for (Map.Entry<HostState, Set<HostState>> entry : SOURCES.entrySet()) {
            if (entry.getValue().contains(from)) {
                targets.add(entry.getKey());
            }
        }
        return targets;
    }
}
