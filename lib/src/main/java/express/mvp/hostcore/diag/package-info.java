/**
 * Diagnostics and attribute-exposure collaborators. Both are external; the lifecycle core only
 * calls them at fixed points of allocate, publish, remove and destruction.
 */
package express.mvp.hostcore.diag;
