/**
 * Serial work queues owned by hosts and the façade drivers use to reach them.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.hostcore.work.HostWorkQueue} - Single-worker FIFO queue
 *   <li>{@link express.mvp.hostcore.work.HostWork} - Reusable item with pending semantics
 *   <li>{@link express.mvp.hostcore.work.WorkQueueBinding} - Queue/flush on a host's work queue
 * </ul>
 */
package express.mvp.hostcore.work;
