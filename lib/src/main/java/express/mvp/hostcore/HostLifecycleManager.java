package express.mvp.hostcore;

import express.mvp.hostcore.command.CommandReserve;
import express.mvp.hostcore.command.CommandTagPool;
import express.mvp.hostcore.device.DeviceHandle;
import express.mvp.hostcore.device.DeviceKind;
import express.mvp.hostcore.device.DeviceModel;
import express.mvp.hostcore.error.HostException;
import express.mvp.hostcore.error.InvalidConfigurationException;
import express.mvp.hostcore.error.ResourceExhaustedException;
import express.mvp.hostcore.lifecycle.HostState;
import express.mvp.hostcore.lifecycle.UnwindScope;
import express.mvp.hostcore.recovery.RecoveryThread;
import express.mvp.hostcore.registry.HostRegistry;
import express.mvp.hostcore.resource.ResourceTracker;
import express.mvp.hostcore.work.HostWorkQueue;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates, publishes, removes and destroys hosts.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 * allocate ──► CREATED ──publish──► RUNNING ──remove──► CANCEL ──► DEL
 *                                                              │
 *                                 release (last reference) ◄───┘  destroy
 * </pre>
 *
 * <p>{@link #allocate(HostTemplate, int)} and {@link #publish(Host)} are all-or-nothing: on the
 * first failing step every resource acquired earlier in the same call is released, newest first,
 * and the original failure is rethrown. The one exception is a publish failure after the host went
 * {@code RUNNING}: the primary device registration, the parent reference and the state stay in
 * place, and the caller tears the host down with {@link #remove(Host)} and {@link #release(Host)}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * HostLifecycleManager manager = new HostLifecycleManager();
 * Host host = manager.allocate(template, 64);
 * try {
 *     manager.publish(host);
 * } catch (HostException e) {
 *     manager.release(host);
 *     throw e;
 * }
 * ...
 * manager.remove(host);
 * manager.release(host);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All operations are thread-safe. {@link #release(Host)} may block while the last reference
 * tears down the host's recovery thread and work queues.
 *
 * @see Host
 * @see HostServices
 */
public final class HostLifecycleManager {

    private static final Logger LOGGER = Logger.getLogger(HostLifecycleManager.class.getName());

    private static final String PRIVATE_DATA = "private data";
    private static final String RECOVERY_THREAD = "recovery thread";
    private static final String TMF_QUEUE = "tmf queue";
    private static final String TAG_POOL = "tag pool";
    private static final String COMMAND_RESERVE = "command reserve";
    private static final String HOST_DATA = "host data";
    private static final String WORK_QUEUE = "work queue";

    private final HostServices services;

    private final HostRegistry registry = new HostRegistry();

    /** Creates a manager with default, in-process collaborators. */
    public HostLifecycleManager() {
        this(HostServices.defaults());
    }

    public HostLifecycleManager(HostServices services) {
        this.services = Objects.requireNonNull(services, "services");
    }

    public HostRegistry registry() {
        return registry;
    }

    public HostServices services() {
        return services;
    }

    // ---- allocate ----

    /**
     * Allocates a host with its own lock.
     *
     * @param template host capabilities
     * @param privateSize bytes of zeroed driver-private storage
     * @return a {@code CREATED} host holding one reference for the caller
     * @throws InvalidConfigurationException if {@code privateSize} is negative
     * @throws ResourceExhaustedException if storage, the recovery thread or the urgent queue cannot
     *     be created
     */
    public Host allocate(HostTemplate template, int privateSize) {
        return allocate(template, privateSize, new ReentrantLock());
    }

    /**
     * Allocates a host that shares {@code hostLock} with other hosts.
     *
     * @param template host capabilities
     * @param privateSize bytes of zeroed driver-private storage
     * @param hostLock lock guarding the host's state
     * @return a {@code CREATED} host holding one reference for the caller
     * @throws InvalidConfigurationException if {@code privateSize} is negative
     * @throws ResourceExhaustedException if storage, the recovery thread or the urgent queue cannot
     *     be created
     */
    public Host allocate(HostTemplate template, int privateSize, Lock hostLock) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(hostLock, "hostLock");
        if (privateSize < 0) {
            throw new InvalidConfigurationException(
                    template.name() + ": negative private data size " + privateSize);
        }

        int id = HostIdAllocator.allocate();
        String name = "host" + Integer.toUnsignedString(id);
        Duration deadline =
                HostParameters.resolveErrorHandlerDeadline(
                        HostParameters.errorHandlerDeadlineSeconds(),
                        template.hasHostResetHandler(),
                        name);
        ByteBuffer privateData = services.bufferAllocator().allocate(PRIVATE_DATA, privateSize);
        Host host = new Host(id, template, privateData, hostLock, deadline, this::destroy);

        try (UnwindScope scope = new UnwindScope(name + ": allocate")) {
            try {
                track(host, PRIVATE_DATA, privateSize);
                scope.onFailure(PRIVATE_DATA, () -> untrack(host, PRIVATE_DATA));

                RecoveryThread recovery =
                        RecoveryThread.start(
                                host,
                                services.recoveryHandler(),
                                services.recoveryThreadFactory(),
                                "host_eh_" + Integer.toUnsignedString(id));
                host.recoveryThread(recovery);
                track(host, RECOVERY_THREAD, 0);
                scope.onFailure(
                        RECOVERY_THREAD,
                        () -> {
                            host.recoveryThread(null);
                            recovery.stop();
                            untrack(host, RECOVERY_THREAD);
                        });

                HostWorkQueue tmf =
                        createQueue(name, "host_tmf_" + Integer.toUnsignedString(id));
                if (tmf == null) {
                    throw new ResourceExhaustedException(
                            name + ": failed to create tmf work queue");
                }
                host.tmfQueue(tmf);
                track(host, TMF_QUEUE, 0);
                scope.onFailure(
                        TMF_QUEUE,
                        () -> {
                            host.tmfQueue(null);
                            tmf.destroy();
                            untrack(host, TMF_QUEUE);
                        });

                services.diagnostics().addTemplateDirectory(template);
                scope.commit();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, name + ": allocation failed", e);
                throw scope.fail(e);
            }
        }
        return host;
    }

    // ---- publish ----

    /**
     * Publishes a host under the platform root.
     *
     * @param host a {@code CREATED} host
     * @see #publish(Host, DeviceHandle, DeviceHandle)
     */
    public void publish(Host host) {
        publish(host, null, null);
    }

    /**
     * Publishes a host under a parent device.
     *
     * @param host a {@code CREATED} host
     * @param parent owning device, or null for the platform root
     * @see #publish(Host, DeviceHandle, DeviceHandle)
     */
    public void publish(Host host, DeviceHandle parent) {
        publish(host, parent, null);
    }

    /**
     * Makes an allocated host visible and moves it to {@code RUNNING}.
     *
     * @param host a {@code CREATED} host
     * @param parent owning device, or null for the platform root
     * @param dmaDevice DMA-capable device, or null to use the parent
     * @throws InvalidConfigurationException if the template's queue depth is zero, or the requested
     *     work queue cannot be created
     * @throws ResourceExhaustedException if the tag pool, reserve or transport data cannot be
     *     allocated
     * @throws express.mvp.hostcore.error.RegistrationException if the device model, the registry
     *     or a diagnostics collaborator rejects the host
     * @throws IllegalStateException if the host is not {@code CREATED}
     */
    public void publish(Host host, DeviceHandle parent, DeviceHandle dmaDevice) {
        HostTemplate template = host.template();
        LOGGER.info(host.name() + ": " + template.info(host));

        if (host.canQueue() == 0) {
            InvalidConfigurationException e =
                    new InvalidConfigurationException(
                            host.name() + ": can_queue = 0 no longer supported");
            LOGGER.severe(e.getMessage());
            throw e;
        }
        if (host.state() != HostState.CREATED) {
            throw new IllegalStateException(
                    host.name() + ": cannot publish a host in state " + host.state());
        }

        try (UnwindScope scope = new UnwindScope(host.name() + ": publish")) {
            try {
                publishSteps(host, parent, dmaDevice, scope);
                scope.commit();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, host.name() + ": publish failed", e);
                throw scope.fail(e);
            }
        }
    }

    private void publishSteps(
            Host host, DeviceHandle parent, DeviceHandle dmaDevice, UnwindScope scope) {
        DeviceModel deviceModel = services.deviceModel();

        CommandTagPool tagPool =
                services.tagPoolAllocator()
                        .allocate(host.canQueue(), host.template().tagAllocPolicy());
        if (tagPool == null) {
            throw new ResourceExhaustedException(host.name() + ": failed to allocate tag pool");
        }
        host.tagPool(tagPool);
        track(host, TAG_POOL, host.canQueue());
        scope.onFailure(
                TAG_POOL,
                () -> {
                    host.tagPool(null);
                    tagPool.close();
                    untrack(host, TAG_POOL);
                });

        CommandReserve reserve =
                CommandReserve.allocate(
                        CommandReserve.RESERVE_COMMANDS,
                        host.maxCmdLen(),
                        services.bufferAllocator());
        host.commandReserve(reserve);
        track(
                host,
                COMMAND_RESERVE,
                (long) reserve.capacity() * (host.maxCmdLen() + CommandReserve.SENSE_BUFFER_SIZE));
        scope.onFailure(
                COMMAND_RESERVE,
                () -> {
                    host.commandReserve(null);
                    reserve.close();
                    untrack(host, COMMAND_RESERVE);
                });

        DeviceHandle owner = parent != null ? parent : deviceModel.platformRoot();
        host.dmaDevice(dmaDevice != null ? dmaDevice : owner);

        DeviceHandle device = deviceModel.register(host.name(), owner, DeviceKind.HOST);
        host.device(device);
        scope.onFailure(
                "device",
                () -> {
                    // Once running, the registration stays for remove() to undo.
                    if (host.state() == HostState.CREATED) {
                        host.device(null);
                        deviceModel.unregister(device);
                    }
                });

        deviceModel.activatePower(device);

        host.setState(HostState.RUNNING);

        deviceModel.acquire(owner);
        host.parent(owner);

        host.get();
        try {
            registry.add(host);
        } catch (RuntimeException e) {
            host.put();
            throw e;
        }
        scope.onFailure(
                "registry entry",
                () -> {
                    if (registry.remove(host)) {
                        host.put();
                    }
                });

        int hostDataSize = host.transport().hostDataSize();
        if (hostDataSize > 0) {
            ByteBuffer hostData = services.bufferAllocator().allocate(HOST_DATA, hostDataSize);
            host.hostData(hostData);
            track(host, HOST_DATA, hostDataSize);
            scope.onFailure(
                    HOST_DATA,
                    () -> {
                        host.hostData(null);
                        untrack(host, HOST_DATA);
                    });
        }

        if (host.transport().createWorkQueue()) {
            HostWorkQueue workQueue =
                    createQueue(host.name(), "host_wq_" + Integer.toUnsignedString(host.id()));
            if (workQueue == null) {
                throw new InvalidConfigurationException(
                        host.name() + ": failed to create work queue");
            }
            host.workQueue(workQueue);
            track(host, WORK_QUEUE, 0);
            scope.onFailure(
                    WORK_QUEUE,
                    () -> {
                        host.workQueue(null);
                        workQueue.destroy();
                        untrack(host, WORK_QUEUE);
                    });
        }

        services.attributeExporter().exportHost(host);
        scope.onFailure("attributes", () -> services.attributeExporter().unexportHost(host));

        services.diagnostics().addHost(host);
    }

    // ---- remove ----

    /**
     * Removes a published host.
     *
     * <p>Blocks while the urgent queue drains and the discovery layer forgets the host's children.
     * Calling it on a host that is already being removed, or was removed, does nothing. The
     * caller's own reference is untouched; {@link #release(Host)} it afterwards.
     *
     * <p>A failing collaborator does not stop removal: the host still reaches a deleted state and
     * leaves the registry, then the first failure is rethrown with later ones suppressed.
     *
     * @param host the host
     * @throws IllegalStateException if the host cannot reach a deleted state, which means its
     *     state was corrupted
     */
    public void remove(Host host) {
        RemovalFailure failure = new RemovalFailure(host);
        ReentrantLock scanLock = host.scanLock();
        scanLock.lock();
        try {
            if (!startRemoval(host)) {
                return;
            }
            DeviceHandle device = host.device();
            if (device != null) {
                failure.attempt("device resume", () -> services.deviceModel().resume(device));
            }
            HostWorkQueue tmf = host.tmfQueue();
            if (tmf != null) {
                failure.attempt("tmf flush", tmf::flush);
            }
            failure.attempt(
                    "child removal", () -> services.discovery().forgetAllChildren(host));
        } finally {
            scanLock.unlock();
        }

        failure.attempt("diagnostics", () -> services.diagnostics().removeHost(host));

        Lock lock = host.hostLock();
        lock.lock();
        try {
            if (!host.transitionLocked(HostState.DEL)
                    && !host.transitionLocked(HostState.DEL_RECOVERY)) {
                throw new IllegalStateException(
                        host.name() + ": cannot delete host in state " + host.state());
            }
        } finally {
            lock.unlock();
        }

        failure.attempt(
                "attribute unexport", () -> services.attributeExporter().unexportHost(host));
        if (registry.remove(host)) {
            host.put();
        }
        DeviceHandle device = host.device();
        if (device != null) {
            failure.attempt("device unregister", () -> services.deviceModel().unregister(device));
        }
        LOGGER.info(host.name() + ": removed");
        failure.rethrow();
    }

    /** Keeps removal going past a failing step and reports the first failure at the end. */
    private static final class RemovalFailure {
        private final Host host;
        private RuntimeException first;

        RemovalFailure(Host host) {
            this.host = host;
        }

        void attempt(String step, Runnable action) {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, host.name() + ": remove " + step + " failed", e);
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }

        void rethrow() {
            if (first != null) {
                throw first;
            }
        }
    }

    private static boolean startRemoval(Host host) {
        Lock lock = host.hostLock();
        lock.lock();
        try {
            HostState current = host.state();
            if (current == HostState.CANCEL || current == HostState.CANCEL_RECOVERY) {
                return false;
            }
            return host.transitionLocked(HostState.CANCEL)
                    || host.transitionLocked(HostState.CANCEL_RECOVERY);
        } finally {
            lock.unlock();
        }
    }

    // ---- references ----

    /**
     * Drops the caller's reference; the last one destroys the host.
     *
     * @param host the host
     * @throws IllegalStateException if the host was already released
     */
    public void release(Host host) {
        host.put();
    }

    /**
     * Finds a published, not yet deleted host.
     *
     * @param id host identity
     * @return the host with a new reference the caller must release, or null
     */
    public Host lookup(int id) {
        return registry.lookup(id);
    }

    // ---- legacy registration ----

    /**
     * Allocates a host for a driver that publishes from its detect routine.
     *
     * <p>The host is appended to the template's legacy host list.
     *
     * @param template host capabilities
     * @param privateSize bytes of zeroed driver-private storage
     * @return the allocated host holding the caller's reference
     */
    public Host registerLegacy(HostTemplate template, int privateSize) {
        if (!template.hasDetect()) {
            LOGGER.log(
                    Level.WARNING,
                    "registerLegacy() called on new-style template for driver " + template.name(),
                    new Throwable("stack"));
        }
        Host host = allocate(template, privateSize);
        template.legacyHosts().add(host);
        return host;
    }

    /**
     * Drops a host from its template's legacy list and releases the caller's reference.
     *
     * @param host a host from {@link #registerLegacy(HostTemplate, int)}
     */
    public void unregisterLegacy(Host host) {
        host.template().legacyHosts().remove(host);
        host.put();
    }

    // ---- destroy ----

    /** Runs once, on the thread dropping the last reference. */
    private void destroy(Host host) {
        LOGGER.fine(host.name() + ": destroying (state " + host.state() + ")");

        cleanup(
                host,
                "template directory",
                () -> services.diagnostics().removeTemplateDirectory(host.template()));

        HostWorkQueue tmf = host.tmfQueue();
        if (tmf != null) {
            cleanup(host, TMF_QUEUE, tmf::destroy);
            host.tmfQueue(null);
            untrack(host, TMF_QUEUE);
        }

        RecoveryThread recovery = host.recoveryThread();
        if (recovery != null) {
            cleanup(host, RECOVERY_THREAD, recovery::stop);
            host.recoveryThread(null);
            untrack(host, RECOVERY_THREAD);
        }

        HostWorkQueue workQueue = host.workQueue();
        if (workQueue != null) {
            cleanup(host, WORK_QUEUE, workQueue::destroy);
            host.workQueue(null);
            untrack(host, WORK_QUEUE);
        }

        CommandReserve reserve = host.commandReserve();
        if (reserve != null) {
            cleanup(host, COMMAND_RESERVE, reserve::close);
            host.commandReserve(null);
            untrack(host, COMMAND_RESERVE);
        }

        CommandTagPool tagPool = host.tagPool();
        if (tagPool != null) {
            cleanup(host, TAG_POOL, tagPool::close);
            host.tagPool(null);
            untrack(host, TAG_POOL);
        }

        if (host.hostData() != null) {
            host.hostData(null);
            untrack(host, HOST_DATA);
        }
        untrack(host, PRIVATE_DATA);

        DeviceHandle parent = host.parent();
        if (host.state() != HostState.CREATED && parent != null) {
            cleanup(host, "parent reference", () -> services.deviceModel().release(parent));
        }
        LOGGER.fine(host.name() + ": destroyed");
    }

    private static void cleanup(Host host, String resource, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, host.name() + ": failed to release " + resource, e);
        }
    }

    /** Returns null if the factory fails; the caller picks the error to report. */
    private HostWorkQueue createQueue(String hostName, String queueName) {
        HostWorkQueue queue;
        try {
            queue = services.workQueueFactory().create(queueName);
        } catch (HostException e) {
            LOGGER.log(Level.WARNING, hostName + ": failed to create " + queueName, e);
            return null;
        }
        if (queue == null) {
            LOGGER.warning(hostName + ": failed to create " + queueName);
        }
        return queue;
    }

    private void track(Host host, String resource, long sizeBytes) {
        ResourceTracker tracker = services.resourceTracker();
        host.trackingIds.put(resource, tracker.track(host.name(), resource, sizeBytes));
    }

    private void untrack(Host host, String resource) {
        Long id = host.trackingIds.remove(resource);
        if (id != null) {
            services.resourceTracker().release(id);
        }
    }
}
