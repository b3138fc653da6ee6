/**
 * Process-wide set of published hosts.
 *
 * <p>Lookup by identity hands out a counted reference, so a host found here cannot be destroyed
 * until the caller releases it.
 */
package express.mvp.hostcore.registry;
