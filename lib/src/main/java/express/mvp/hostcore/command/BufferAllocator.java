package express.mvp.hostcore.command;

import express.mvp.hostcore.error.ResourceExhaustedException;
import java.nio.ByteBuffer;

/** Source of zero-filled storage for host private data, transport data and reserve commands. */
@FunctionalInterface
public interface BufferAllocator {

    /** Heap allocator; {@link ByteBuffer#allocate(int)} already zero-fills. */
    BufferAllocator HEAP = (purpose, size) -> ByteBuffer.allocate(size);

    /**
     * Allocates a zero-filled buffer.
     *
     * @param purpose what the storage is for, used in diagnostics
     * @param size size in bytes, never negative
     * @return the buffer
     * @throws ResourceExhaustedException if the storage cannot be allocated
     */
    ByteBuffer allocate(String purpose, int size);
}
