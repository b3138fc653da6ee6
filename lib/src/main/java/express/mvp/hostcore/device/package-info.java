/**
 * Device-model collaborators: registration, reference counting, power state and child discovery.
 */
package express.mvp.hostcore.device;
