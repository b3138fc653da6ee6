package express.mvp.hostcore.diag;

import express.mvp.hostcore.Host;
import express.mvp.hostcore.HostTemplate;

/**
 * Diagnostics collaborator hosts register with.
 *
 * <p>A per-template directory is added at allocation and removed at destruction; a per-host entry
 * is added at the end of publish and removed during removal. All methods default to no-ops.
 */
public interface HostDiagnostics {

    /** Diagnostics that record nothing. */
    HostDiagnostics NONE = new HostDiagnostics() { };

    /**
     * Called once per allocated host, before the allocation returns.
     *
     * @param template the host's template
     */
    default void addTemplateDirectory(HostTemplate template) { }

    /**
     * Called once per destroyed host.
     *
     * @param template the host's template
     */
    default void removeTemplateDirectory(HostTemplate template) { }

    /**
     * Called when publish completes.
     *
     * @param host the published host
     */
    default void addHost(Host host) { }

    /**
     * Called during removal.
     *
     * @param host the host being removed
     */
    default void removeHost(Host host) { }
}
