/**
 * Host state model and the scoped unwinding used by multi-step lifecycle operations.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.hostcore.lifecycle.HostState} - The seven host states
 *   <li>{@link express.mvp.hostcore.lifecycle.HostStateMachine} - Transition table
 *   <li>{@link express.mvp.hostcore.lifecycle.UnwindScope} - Reverse-order release on failure
 * </ul>
 *
 * @see express.mvp.hostcore.HostLifecycleManager
 */
package express.mvp.hostcore.lifecycle;
