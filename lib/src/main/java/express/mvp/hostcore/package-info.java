/**
 * Lifecycle core for host adapters: the controller instances through which downstream devices are
 * discovered, addressed and removed.
 *
 * <p>{@link express.mvp.hostcore.HostLifecycleManager} allocates, publishes, removes and destroys
 * {@link express.mvp.hostcore.Host} instances described by a
 * {@link express.mvp.hostcore.HostTemplate}. External layers plug in through
 * {@link express.mvp.hostcore.HostServices}.
 */
package express.mvp.hostcore;
