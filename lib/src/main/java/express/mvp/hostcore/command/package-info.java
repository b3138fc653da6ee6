/**
 * Command infrastructure a host sets up at publish: the tag pool sized to its queue depth, the
 * reserve command pool and zero-filled storage.
 */
package express.mvp.hostcore.command;
