package express.mvp.hostcore.command;

import express.mvp.hostcore.error.ResourceExhaustedException;

/** Creates the command-tag pool a host needs before it can be published. */
@FunctionalInterface
public interface TagPoolAllocator {

    /** Allocator returning plain in-process pools. */
    TagPoolAllocator DEFAULT = CommandTagPool::new;

    /**
     * Allocates a pool.
     *
     * @param depth number of tags
     * @param policy tag allocation order
     * @return the new pool
     * @throws ResourceExhaustedException if the pool cannot be allocated
     */
    CommandTagPool allocate(int depth, TagAllocPolicy policy);
}
