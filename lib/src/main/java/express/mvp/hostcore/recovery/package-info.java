/**
 * The error-recovery thread each host owns from allocation to destruction.
 *
 * <p>The lifecycle core starts and stops the thread; the recovery algorithm is supplied as a
 * {@link express.mvp.hostcore.recovery.RecoveryHandler}.
 */
package express.mvp.hostcore.recovery;
