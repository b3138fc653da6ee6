package express.mvp.hostcore.command;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CommandTagPool} and {@link CommandReserve}. */
@DisplayName("Command pools")
class CommandPoolsTest {

    @Nested
    @DisplayName("CommandTagPool")
    class TagPoolTests {

        @Test
        @DisplayName("Default allocator keeps depth and policy")
        void defaultAllocator() {
            CommandTagPool pool = TagPoolAllocator.DEFAULT.allocate(32, TagAllocPolicy.FIFO);

            assertEquals(32, pool.depth());
            assertEquals(TagAllocPolicy.FIFO, pool.policy());
            assertFalse(pool.isClosed());
            pool.close();
            assertTrue(pool.isClosed());
        }

        @Test
        @DisplayName("Zero depth is rejected")
        void zeroDepth() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new CommandTagPool(0, TagAllocPolicy.ROUND_ROBIN));
        }
    }

    @Nested
    @DisplayName("CommandReserve")
    class ReserveTests {

        @Test
        @DisplayName("Buffers hold a command and sense data")
        void bufferSize() {
            CommandReserve reserve = CommandReserve.allocate(2, 12, BufferAllocator.HEAP);

            assertEquals(2, reserve.capacity());
            ByteBuffer buffer = reserve.poll();
            assertEquals(12 + CommandReserve.SENSE_BUFFER_SIZE, buffer.capacity());
            assertEquals(1, reserve.available());
        }

        @Test
        @DisplayName("Buffers are cleared when returned")
        void offerClears() {
            CommandReserve reserve = CommandReserve.allocate(1, 12, BufferAllocator.HEAP);
            ByteBuffer buffer = reserve.poll();
            buffer.put((byte) 1);

            reserve.offer(buffer);

            assertEquals(0, reserve.poll().position());
        }

        @Test
        @DisplayName("Exhausted or closed reserve yields null")
        void exhaustedOrClosed() {
            CommandReserve reserve = CommandReserve.allocate(1, 12, BufferAllocator.HEAP);
            ByteBuffer buffer = reserve.poll();
            assertNull(reserve.poll());

            reserve.close();
            reserve.offer(buffer);

            assertTrue(reserve.isClosed());
            assertNull(reserve.poll());
            assertEquals(0, reserve.available());
        }
    }
}
