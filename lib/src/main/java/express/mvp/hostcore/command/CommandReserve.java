package express.mvp.hostcore.command;

import java.nio.ByteBuffer;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Small fixed pool of command buffers kept aside for synchronous reset operations.
 *
 * <p>Each buffer holds one command descriptor block followed by a sense buffer. Buffers are taken
 * with {@link #poll()} and must be handed back with {@link #offer(ByteBuffer)}.
 */
public final class CommandReserve implements AutoCloseable {

    /** Number of buffers kept in reserve. */
    public static final int RESERVE_COMMANDS = 1;

    /** Bytes of sense data stored after each command. */
    public static final int SENSE_BUFFER_SIZE = 96;

    private final BlockingQueue<ByteBuffer> free;

    private final int capacity;

    private volatile boolean closed;

    private CommandReserve(BlockingQueue<ByteBuffer> free, int capacity) {
        this.free = free;
        this.capacity = capacity;
    }

    /**
     * Allocates a reserve.
     *
     * @param count number of buffers
     * @param maxCmdLen longest command the host accepts
     * @param allocator storage source
     * @return the reserve
     * @throws express.mvp.hostcore.error.ResourceExhaustedException if storage runs out
     */
    public static CommandReserve allocate(int count, int maxCmdLen, BufferAllocator allocator) {
        BlockingQueue<ByteBuffer> free = new ArrayBlockingQueue<>(count);
        for (int i = 0; i < count; i++) {
            free.add(allocator.allocate("command reserve", maxCmdLen + SENSE_BUFFER_SIZE));
        }
        return new CommandReserve(free, count);
    }

    /**
     * Takes a reserve buffer.
     *
     * @return a buffer, or null if all are in use or the reserve is closed
     */
    public ByteBuffer poll() {
        return closed ? null : free.poll();
    }

    /**
     * Returns a buffer taken with {@link #poll()}.
     *
     * @param buffer the buffer
     */
    public void offer(ByteBuffer buffer) {
        if (!closed) {
            buffer.clear();
            free.offer(buffer);
        }
    }

    public int capacity() {
        return capacity;
    }

    public int available() {
        return free.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        free.clear();
    }
}
