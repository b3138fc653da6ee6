package express.mvp.hostcore.resource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks resources owned by hosts for leak detection.
 *
 * <p>Every background thread, queue, pool and storage block a host acquires is recorded here under
 * the host's name and removed when it is released. After a failed allocate or publish the set of
 * records for that host must be the same as before the call; after destruction it must be empty.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * long id = tracker.track("host0", "tmf_queue", 0);
 * // ... use resource ...
 * tracker.release(id);
 *
 * Collection<TrackedResource> leaks = tracker.getActiveResources("host0");
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. IDs come from an {@link AtomicLong}; records live in a
 * {@link ConcurrentHashMap}.
 */
public final class ResourceTracker {

    /** Process-wide instance. */
    private static final ResourceTracker INSTANCE = new ResourceTracker();

    /** Map of tracking ID to record. */
    private final Map<Long, TrackedResource> resources = new ConcurrentHashMap<>();

    /** ID generator. */
    private final AtomicLong idGenerator = new AtomicLong(1);

    /** Total acquisition count. */
    private final AtomicLong acquisitionCount = new AtomicLong(0);

    /** Total release count. */
    private final AtomicLong releaseCount = new AtomicLong(0);

    /** Creates an empty tracker. */
    public ResourceTracker() {
        // Empty
    }

    /**
     * Returns the process-wide tracker.
     *
     * @return the shared tracker instance
     */
    public static ResourceTracker getInstance() {
        return INSTANCE;
    }

    /**
     * Records a newly acquired resource.
     *
     * @param owner name of the owning host (e.g. "host0")
     * @param resource kind of resource (e.g. "tmf_queue")
     * @param sizeBytes size in bytes, or 0 for threads and queues
     * @return tracking ID for {@link #release(long)}
     */
    public long track(String owner, String resource, long sizeBytes) {
        long id = idGenerator.getAndIncrement();
        resources.put(id, new TrackedResource(id, owner, resource, sizeBytes, Instant.now()));
        acquisitionCount.incrementAndGet();
        return id;
    }

    /**
     * Records the release of a resource.
     *
     * @param id the ID returned from {@link #track(String, String, long)}
     * @return true if the resource was found and removed
     */
    public boolean release(long id) {
        if (id == 0) {
            return false;
        }
        TrackedResource record = resources.remove(id);
        if (record != null) {
            releaseCount.incrementAndGet();
            return true;
        }
        return false;
    }

    /**
     * Returns all unreleased resources.
     *
     * @return unmodifiable view of active records
     */
    public Collection<TrackedResource> getActiveResources() {
        return Collections.unmodifiableCollection(resources.values());
    }

    /**
     * Returns the unreleased resources of one owner.
     *
     * @param owner the owner name
     * @return snapshot of that owner's active records
     */
    public List<TrackedResource> getActiveResources(String owner) {
        List<TrackedResource> result = new ArrayList<>();
        for (TrackedResource record : resources.values()) {
            if (record.owner().equals(owner)) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * Returns the number of unreleased resources of one owner.
     *
     * @param owner the owner name
     * @return active count for the owner
     */
    public int getActiveCount(String owner) {
        return getActiveResources(owner).size();
    }

    /**
     * Returns the number of unreleased resources.
     *
     * @return active count
     */
    public int getActiveCount() {
        return resources.size();
    }

    /**
     * Returns the total bytes held by unreleased resources.
     *
     * @return active size in bytes
     */
    public long getActiveBytes() {
        return resources.values().stream().mapToLong(TrackedResource::sizeBytes).sum();
    }

    /**
     * Returns cumulative acquisition count.
     *
     * @return acquisition count
     */
    public long getAcquisitionCount() {
        return acquisitionCount.get();
    }

    /**
     * Returns cumulative release count.
     *
     * @return release count
     */
    public long getReleaseCount() {
        return releaseCount.get();
    }

    /** Clears all tracking data. */
    public void clear() {
        resources.clear();
        acquisitionCount.set(0);
        releaseCount.set(0);
    }

    /**
     * Returns a summary of tracking statistics.
     *
     * @return formatted statistics string
     */
    public String getSummary() {
        return String.format(
                "ResourceTracker[active=%d (%d bytes), total=%d acquired / %d released]",
                getActiveCount(), getActiveBytes(), acquisitionCount.get(), releaseCount.get());
    }

    /**
     * Record of a tracked resource.
     *
     * @param id tracking ID
     * @param owner owning host name
     * @param resource resource kind
     * @param sizeBytes size in bytes (0 for threads and queues)
     * @param acquiredAt acquisition time
     */
    public record TrackedResource(
            long id, String owner, String resource, long sizeBytes, Instant acquiredAt) {

        @Override
        public String toString() {
            return String.format(
                    "TrackedResource[id=%d, owner=%s, resource=%s, size=%d]",
                    id, owner, resource, sizeBytes);
        }
    }
}
