package express.mvp.hostcore.diag;

import express.mvp.hostcore.Host;
import express.mvp.hostcore.error.RegistrationException;

/**
 * Exposes a published host's attributes to introspection tools.
 *
 * <p>The exporter reads {@link Host#attributes()} and any transport-specific metadata. Export
 * happens at the end of publish; unexport runs first in the unregistration half of removal.
 */
public interface HostAttributeExporter {

    /** Exporter that exposes nothing. */
    HostAttributeExporter NONE =
            new HostAttributeExporter() {
                @Override
                public void exportHost(Host host) { }

                @Override
                public void unexportHost(Host host) { }
            };

    /**
     * Exposes the host.
     *
     * @param host the host being published
     * @throws RegistrationException if the host cannot be exposed
     */
    void exportHost(Host host);

    /**
     * Withdraws the host's transport metadata and attributes.
     *
     * @param host the host being removed
     */
    void unexportHost(Host host);
}
