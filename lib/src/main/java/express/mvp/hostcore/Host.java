package express.mvp.hostcore;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.hostcore.command.CommandReserve;
import express.mvp.hostcore.command.CommandTagPool;
import express.mvp.hostcore.device.DeviceHandle;
import express.mvp.hostcore.error.AlreadyDeletedException;
import express.mvp.hostcore.error.IllegalStateTransitionException;
import express.mvp.hostcore.lifecycle.HostState;
import express.mvp.hostcore.lifecycle.HostStateMachine;
import express.mvp.hostcore.recovery.RecoveryThread;
import express.mvp.hostcore.work.HostWorkQueue;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * One host adapter instance: its state, reference count, locks and owned background resources.
 *
 * <p>Hosts are created by {@link HostLifecycleManager#allocate(HostTemplate, int)} holding one
 * reference for the caller. Every successful {@link #get()} adds a reference and every
 * {@link #put()} drops one; the put that drops the count to zero destroys the host, whichever
 * thread makes it.
 *
 * <h2>Locking</h2>
 *
 * <ul>
 *   <li><b>host lock:</b> guards {@link #state()} changes; held only for state checks and sets.
 *       May be shared between related hosts.
 *   <li><b>scan lock:</b> serializes removal against device discovery on this host.
 * </ul>
 *
 * <p>Any thread may read the state without locking. Only the lifecycle operations and the
 * recovery transitions below change it.
 *
 * <h2>Owned Resources</h2>
 *
 * <ul>
 *   <li>recovery thread and urgent (task management) queue: allocation to destruction
 *   <li>work queue, tag pool, reserve pool, transport data: publish to destruction
 * </ul>
 *
 * @see HostState
 * @see HostLifecycleManager
 */
public final class Host {

    private static final Logger LOGGER = Logger.getLogger(Host.class.getName());

    public static final int DEFAULT_MAX_CHANNEL = 0;
    public static final int DEFAULT_MAX_ID = 8;
    public static final int DEFAULT_MAX_LUN = 8;
    public static final int DEFAULT_MAX_CMD_LEN = 12;
    public static final int DEFAULT_DMA_CHANNEL = 0xff;
    public static final int DEFAULT_MAX_HOST_BLOCKED = 7;
    public static final int DEFAULT_MAX_SECTORS = 1024;
    public static final long DEFAULT_DMA_BOUNDARY = 0xFFFFFFFFL;

    private final int id;
    private final String name;
    private final HostTemplate template;
    private final HostTransport transport;

    private final int thisId;
    private final int canQueue;
    private final int sgTablesize;
    private final int sgProtTablesize;
    private final int cmdPerLun;
    private final boolean uncheckedIsaDma;
    private final boolean useClustering;
    private final boolean noWriteSame;
    private final int maxChannel;
    private final int maxId;
    private final int maxLun;
    private final int maxCmdLen;
    private final int dmaChannel;
    private final HostMode activeMode;
    private final int maxHostBlocked;
    private final int maxSectors;
    private final long dmaBoundary;
    private final Duration errorHandlerDeadline;

    private final ByteBuffer privateData;

    private final Lock hostLock;
    private final Condition hostWait;
    private final ReentrantLock scanLock = new ReentrantLock();

    private volatile HostState state = HostState.CREATED;

    private final AtomicInteger refCount = new AtomicInteger(1);
    private final AtomicBoolean destroyed = new AtomicBoolean();
    private final Consumer<Host> destructor;

    private volatile RecoveryThread recoveryThread;
    private volatile HostWorkQueue tmfQueue;
    private volatile HostWorkQueue workQueue;
    private volatile CommandTagPool tagPool;
    private volatile CommandReserve commandReserve;
    private volatile ByteBuffer hostData;
    private volatile DeviceHandle device;
    private volatile DeviceHandle parent;
    private volatile DeviceHandle dmaDevice;

    /** Resource name to tracking ID, for owned resources recorded in the tracker. */
    final Map<String, Long> trackingIds = new ConcurrentHashMap<>();

    Host(
            int id,
            HostTemplate template,
            ByteBuffer privateData,
            Lock hostLock,
            Duration errorHandlerDeadline,
            Consumer<Host> destructor) {
        this.id = id;
        this.name = "host" + Integer.toUnsignedString(id);
        this.template = template;
        this.transport = template.transport();
        this.privateData = privateData;
        this.hostLock = hostLock;
        this.hostWait = hostLock.newCondition();
        this.errorHandlerDeadline = errorHandlerDeadline;
        this.destructor = destructor;

        this.thisId = template.thisId();
        this.canQueue = template.canQueue();
        this.sgTablesize = template.sgTablesize();
        this.sgProtTablesize = template.sgProtTablesize();
        this.cmdPerLun = template.cmdPerLun();
        this.uncheckedIsaDma = template.uncheckedIsaDma();
        this.useClustering = template.useClustering();
        this.noWriteSame = template.noWriteSame();
        this.dmaChannel = DEFAULT_DMA_CHANNEL;
        this.maxChannel = orDefault(template.maxChannel(), DEFAULT_MAX_CHANNEL);
        this.maxId = orDefault(template.maxId(), DEFAULT_MAX_ID);
        this.maxLun = orDefault(template.maxLun(), DEFAULT_MAX_LUN);
        this.maxCmdLen = orDefault(template.maxCmdLen(), DEFAULT_MAX_CMD_LEN);
        this.activeMode =
                template.supportedMode() == HostMode.UNKNOWN
                        ? HostMode.INITIATOR
                        : template.supportedMode();
        this.maxHostBlocked =
                template.maxHostBlocked() != 0
                        ? template.maxHostBlocked()
                        : DEFAULT_MAX_HOST_BLOCKED;
        this.maxSectors = template.maxSectors() != 0 ? template.maxSectors() : DEFAULT_MAX_SECTORS;
        this.dmaBoundary =
                template.dmaBoundary() != 0 ? template.dmaBoundary() : DEFAULT_DMA_BOUNDARY;
    }

    private static int orDefault(int value, int defaultValue) {
        return value == HostTemplate.UNSET ? defaultValue : value;
    }

    // ---- Reference counting ----

    /**
     * Adds a reference.
     *
     * <p>The state check and the increment happen under the host lock, so no reference is ever
     * handed out on a host that is already deleted.
     *
     * @return this host
     * @throws AlreadyDeletedException if the host is deleted or already destroyed
     */
    public Host get() {
        if (!tryGet()) {
            throw new AlreadyDeletedException(name + ": host already deleted");
        }
        return this;
    }

    /**
     * Adds a reference unless the host is deleted.
     *
     * @return true if a reference was taken
     */
    public boolean tryGet() {
        hostLock.lock();
        try {
            if (state == HostState.DEL) {
                return false;
            }
            int c;
            do {
                c = refCount.get();
                if (c <= 0) {
                    return false;
                }
            } while (!refCount.compareAndSet(c, c + 1));
            return true;
        } finally {
            hostLock.unlock();
        }
    }

    /**
     * Drops a reference; the last one destroys the host.
     *
     * <p>Destruction stops the recovery thread and drains the host's queues, so this call may
     * block as long as the slowest pending work item.
     *
     * @throws IllegalStateException if the host was already released
     */
    public void put() {
        int c;
        do {
            c = refCount.get();
            if (c <= 0) {
                throw new IllegalStateException(name + ": already released (refCount=" + c + ")");
            }
        } while (!refCount.compareAndSet(c, c - 1));

        if (c == 1 && destroyed.compareAndSet(false, true)) {
            destructor.accept(this);
        }
    }

    public int refCount() {
        return refCount.get();
    }

    /**
     * Checks if the last reference was dropped.
     *
     * @return true once destruction has started
     */
    public boolean isDestroyed() {
        return destroyed.get();
    }

    // ---- State ----

    public HostState state() {
        return state;
    }

    /**
     * Moves the host to {@code target}.
     *
     * @param target the requested state
     * @throws IllegalStateTransitionException if the transition is not legal; state is unchanged
     */
    public void setState(HostState target) {
        hostLock.lock();
        try {
            HostState from = state;
            if (!transitionLocked(target)) {
                throw new IllegalStateTransitionException(from, target);
            }
        } finally {
            hostLock.unlock();
        }
    }

    /**
     * Moves the host to {@code target} if the transition is legal.
     *
     * @param target the requested state
     * @return true if the host is now in {@code target}
     */
    public boolean trySetState(HostState target) {
        hostLock.lock();
        try {
            return transitionLocked(target);
        } finally {
            hostLock.unlock();
        }
    }

    /** Caller holds the host lock. */
    boolean transitionLocked(HostState target) {
        HostState from = state;
        if (!HostStateMachine.isValidTransition(from, target)) {
            LOGGER.fine(
                    name
                            + ": Illegal host state transition "
                            + from.displayName()
                            + "->"
                            + target.displayName());
            return false;
        }
        if (from != target) {
            state = target;
            hostWait.signalAll();
        }
        return true;
    }

    /**
     * Enters error recovery and wakes the recovery thread.
     *
     * <p>A running host moves to {@code RECOVERY}; one whose removal has started moves to
     * {@code CANCEL_RECOVERY}.
     *
     * @return true if the host is now in recovery
     */
    public boolean beginRecovery() {
        boolean entered;
        hostLock.lock();
        try {
            if (state == HostState.RUNNING) {
                entered = transitionLocked(HostState.RECOVERY);
            } else if (state == HostState.CANCEL) {
                entered = transitionLocked(HostState.CANCEL_RECOVERY);
            } else {
                entered = false;
            }
        } finally {
            hostLock.unlock();
        }
        if (entered) {
            wakeRecovery();
        }
        return entered;
    }

    /**
     * Leaves error recovery.
     *
     * <p>A host in plain recovery returns to {@code RUNNING}; one whose removal started meanwhile
     * moves on to {@code CANCEL} or, if removal already finished, to {@code DEL}.
     *
     * @return the state after recovery
     * @throws IllegalStateException if the host is not in a recovery state
     */
    public HostState completeRecovery() {
        hostLock.lock();
        try {
            if (!state.isRecovering()) {
                throw new IllegalStateException(name + ": not in recovery (" + state + ")");
            }
            if (!transitionLocked(HostState.RUNNING)
                    && !transitionLocked(HostState.CANCEL)
                    && !transitionLocked(HostState.DEL)) {
                throw new IllegalStateException(name + ": no way out of " + state);
            }
            return state;
        } finally {
            hostLock.unlock();
        }
    }

    /**
     * Waits until the host leaves every recovery state.
     *
     * @param timeout longest time to wait
     * @return true if recovery is over, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitRecoveryFinished(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        hostLock.lock();
        try {
            while (state.isRecovering()) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = hostWait.awaitNanos(nanos);
            }
            return true;
        } finally {
            hostLock.unlock();
        }
    }

    /** Wakes the recovery thread, if it is waiting for work. */
    public void wakeRecovery() {
        RecoveryThread thread = recoveryThread;
        if (thread != null) {
            thread.wakeup();
        }
    }

    public Lock hostLock() {
        return hostLock;
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Discovery layers serialize against removal with this lock.")
    public ReentrantLock scanLock() {
        return scanLock;
    }

    // ---- Identity and configuration ----

    /** Unique identity, read as unsigned. */
    public int id() {
        return id;
    }

    /** Identity-derived name, {@code host<N>}. */
    public String name() {
        return name;
    }

    public HostTemplate template() {
        return template;
    }

    public HostTransport transport() {
        return transport;
    }

    public int thisId() {
        return thisId;
    }

    public int canQueue() {
        return canQueue;
    }

    public int sgTablesize() {
        return sgTablesize;
    }

    public int sgProtTablesize() {
        return sgProtTablesize;
    }

    public int cmdPerLun() {
        return cmdPerLun;
    }

    public boolean uncheckedIsaDma() {
        return uncheckedIsaDma;
    }

    public boolean useClustering() {
        return useClustering;
    }

    public boolean noWriteSame() {
        return noWriteSame;
    }

    public int maxChannel() {
        return maxChannel;
    }

    public int maxId() {
        return maxId;
    }

    public int maxLun() {
        return maxLun;
    }

    public int maxCmdLen() {
        return maxCmdLen;
    }

    public int dmaChannel() {
        return dmaChannel;
    }

    public HostMode activeMode() {
        return activeMode;
    }

    public int maxHostBlocked() {
        return maxHostBlocked;
    }

    public int maxSectors() {
        return maxSectors;
    }

    public long dmaBoundary() {
        return dmaBoundary;
    }

    /**
     * Returns the error-handler deadline fixed at allocation.
     *
     * @return the deadline, or null when disabled
     */
    public Duration errorHandlerDeadline() {
        return errorHandlerDeadline;
    }

    /**
     * Returns the zeroed driver-private storage requested at allocation.
     *
     * @return the private storage (capacity 0 if none was requested)
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Private storage belongs to the driver that allocated the host.")
    public ByteBuffer privateData() {
        return privateData;
    }

    /**
     * Returns the read-only attributes exposed to introspection tools.
     *
     * @return attribute name to value, in display order
     */
    public Map<String, String> attributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("unique_id", Integer.toUnsignedString(id));
        attributes.put("proc_name", template.name());
        attributes.put("state", state.displayName());
        attributes.put("can_queue", Integer.toString(canQueue));
        attributes.put("cmd_per_lun", Integer.toString(cmdPerLun));
        attributes.put("sg_tablesize", Integer.toString(sgTablesize));
        attributes.put("sg_prot_tablesize", Integer.toString(sgProtTablesize));
        attributes.put("unchecked_isa_dma", uncheckedIsaDma ? "1" : "0");
        attributes.put(
                "supported_mode", template.supportedMode().name().toLowerCase(Locale.ROOT));
        attributes.put("active_mode", activeMode.name().toLowerCase(Locale.ROOT));
        attributes.put("max_sectors", Integer.toString(maxSectors));
        attributes.put(
                "eh_deadline",
                errorHandlerDeadline == null
                        ? "off"
                        : Long.toString(errorHandlerDeadline.getSeconds()));
        return Collections.unmodifiableMap(attributes);
    }

    // ---- Owned resources ----

    public RecoveryThread recoveryThread() {
        return recoveryThread;
    }

    void recoveryThread(RecoveryThread recoveryThread) {
        this.recoveryThread = recoveryThread;
    }

    /** Urgent task-management queue, present from allocation to destruction. */
    public HostWorkQueue tmfQueue() {
        return tmfQueue;
    }

    void tmfQueue(HostWorkQueue tmfQueue) {
        this.tmfQueue = tmfQueue;
    }

    /** Dedicated work queue, or null if the transport did not ask for one. */
    public HostWorkQueue workQueue() {
        return workQueue;
    }

    void workQueue(HostWorkQueue workQueue) {
        this.workQueue = workQueue;
    }

    public CommandTagPool tagPool() {
        return tagPool;
    }

    void tagPool(CommandTagPool tagPool) {
        this.tagPool = tagPool;
    }

    public CommandReserve commandReserve() {
        return commandReserve;
    }

    void commandReserve(CommandReserve commandReserve) {
        this.commandReserve = commandReserve;
    }

    /**
     * Returns the zeroed transport data allocated at publish.
     *
     * @return the transport data, or null if the transport declares none
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Transport data is owned by the transport layer.")
    public ByteBuffer hostData() {
        return hostData;
    }

    void hostData(ByteBuffer hostData) {
        this.hostData = hostData;
    }

    /** Primary device registered at publish, or null. */
    public DeviceHandle device() {
        return device;
    }

    void device(DeviceHandle device) {
        this.device = device;
    }

    public DeviceHandle parent() {
        return parent;
    }

    void parent(DeviceHandle parent) {
        this.parent = parent;
    }

    public DeviceHandle dmaDevice() {
        return dmaDevice;
    }

    void dmaDevice(DeviceHandle dmaDevice) {
        this.dmaDevice = dmaDevice;
    }

    @Override
    public String toString() {
        return "Host[" + name + ", " + state + ", ref=" + refCount.get() + "]";
    }
}
