/**
 * Accounting of resources owned by hosts.
 *
 * <p>{@link express.mvp.hostcore.resource.ResourceTracker} records every owned thread, queue, pool
 * and storage block so that failed operations and destruction can be checked for leaks.
 */
package express.mvp.hostcore.resource;
