package express.mvp.hostcore;

import java.util.Objects;

/**
 * Transport template a host is published with.
 *
 * @param name transport name
 * @param hostDataSize bytes of zeroed per-host transport data to allocate at publish, or 0
 * @param createWorkQueue whether the host gets a dedicated serial work queue at publish
 */
public record HostTransport(String name, int hostDataSize, boolean createWorkQueue) {

    /** Transport every host gets unless its template names another. */
    public static final HostTransport BLANK = new HostTransport("blank", 0, false);

    public HostTransport {
        Objects.requireNonNull(name, "name");
        if (hostDataSize < 0) {
            throw new IllegalArgumentException("hostDataSize must not be negative: " + hostDataSize);
        }
    }
}
