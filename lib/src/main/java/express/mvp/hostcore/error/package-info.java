/**
 * Error taxonomy for host lifecycle operations.
 *
 * <p>All failures extend {@link express.mvp.hostcore.error.HostException}, which carries a
 * {@link express.mvp.hostcore.error.HostErrorCode} and a negative numeric status.
 *
 * <ul>
 *   <li>{@link express.mvp.hostcore.error.InvalidConfigurationException}
 *   <li>{@link express.mvp.hostcore.error.ResourceExhaustedException}
 *   <li>{@link express.mvp.hostcore.error.RegistrationException}
 *   <li>{@link express.mvp.hostcore.error.IllegalStateTransitionException}
 *   <li>{@link express.mvp.hostcore.error.AlreadyDeletedException}
 *   <li>{@link express.mvp.hostcore.error.WorkQueueNotConfiguredException}
 * </ul>
 */
package express.mvp.hostcore.error;
