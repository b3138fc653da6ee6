package express.mvp.hostcore;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide source of host identities.
 *
 * <p>Identities increase monotonically for the life of the process and are never reused.
 */
final class HostIdAllocator {

    private static final AtomicInteger NEXT = new AtomicInteger(0);

    private HostIdAllocator() {
        // Utility class
    }

    /**
     * Assigns the next identity.
     *
     * @return a unique identity, to be read as unsigned
     */
    static int allocate() {
        return NEXT.getAndIncrement();
    }
}
