package express.mvp.hostcore;

import express.mvp.hostcore.command.BufferAllocator;
import express.mvp.hostcore.command.TagPoolAllocator;
import express.mvp.hostcore.device.DeviceDiscovery;
import express.mvp.hostcore.device.DeviceModel;
import express.mvp.hostcore.device.InMemoryDeviceModel;
import express.mvp.hostcore.diag.HostAttributeExporter;
import express.mvp.hostcore.diag.HostDiagnostics;
import express.mvp.hostcore.recovery.RecoveryHandler;
import express.mvp.hostcore.resource.ResourceTracker;
import express.mvp.hostcore.work.WorkQueueFactory;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * External collaborators the lifecycle manager drives.
 *
 * <p>Each collaborator is an interface so tests and embedding layers can substitute their own.
 *
 * <table border="1">
 *   <caption>Collaborators</caption>
 *   <tr><th>Collaborator</th><th>Default</th></tr>
 *   <tr><td>deviceModel</td><td>{@link InMemoryDeviceModel}</td></tr>
 *   <tr><td>discovery</td><td>{@link DeviceDiscovery#NONE}</td></tr>
 *   <tr><td>tagPoolAllocator</td><td>{@link TagPoolAllocator#DEFAULT}</td></tr>
 *   <tr><td>bufferAllocator</td><td>{@link BufferAllocator#HEAP}</td></tr>
 *   <tr><td>workQueueFactory</td><td>{@link WorkQueueFactory#DEFAULT}</td></tr>
 *   <tr><td>recoveryThreadFactory</td><td>daemon {@link HostThreadFactory}</td></tr>
 *   <tr><td>recoveryHandler</td><td>{@link RecoveryHandler#IDLE}</td></tr>
 *   <tr><td>diagnostics</td><td>{@link HostDiagnostics#NONE}</td></tr>
 *   <tr><td>attributeExporter</td><td>{@link HostAttributeExporter#NONE}</td></tr>
 *   <tr><td>resourceTracker</td><td>{@link ResourceTracker#getInstance()}</td></tr>
 * </table>
 *
 * @see HostLifecycleManager
 */
public final class HostServices {

    private final DeviceModel deviceModel;
    private final DeviceDiscovery discovery;
    private final TagPoolAllocator tagPoolAllocator;
    private final BufferAllocator bufferAllocator;
    private final WorkQueueFactory workQueueFactory;
    private final ThreadFactory recoveryThreadFactory;
    private final RecoveryHandler recoveryHandler;
    private final HostDiagnostics diagnostics;
    private final HostAttributeExporter attributeExporter;
    private final ResourceTracker resourceTracker;

    private HostServices(Builder builder) {
        this.deviceModel = builder.deviceModel;
        this.discovery = builder.discovery;
        this.tagPoolAllocator = builder.tagPoolAllocator;
        this.bufferAllocator = builder.bufferAllocator;
        this.workQueueFactory = builder.workQueueFactory;
        this.recoveryThreadFactory = builder.recoveryThreadFactory;
        this.recoveryHandler = builder.recoveryHandler;
        this.diagnostics = builder.diagnostics;
        this.attributeExporter = builder.attributeExporter;
        this.resourceTracker = builder.resourceTracker;
    }

    /**
     * Returns services with every default.
     *
     * @return default services with a fresh in-memory device model
     */
    public static HostServices defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public DeviceModel deviceModel() {
        return deviceModel;
    }

    public DeviceDiscovery discovery() {
        return discovery;
    }

    public TagPoolAllocator tagPoolAllocator() {
        return tagPoolAllocator;
    }

    public BufferAllocator bufferAllocator() {
        return bufferAllocator;
    }

    public WorkQueueFactory workQueueFactory() {
        return workQueueFactory;
    }

    public ThreadFactory recoveryThreadFactory() {
        return recoveryThreadFactory;
    }

    public RecoveryHandler recoveryHandler() {
        return recoveryHandler;
    }

    public HostDiagnostics diagnostics() {
        return diagnostics;
    }

    public HostAttributeExporter attributeExporter() {
        return attributeExporter;
    }

    public ResourceTracker resourceTracker() {
        return resourceTracker;
    }

    /** Builder for {@link HostServices}. */
    public static final class Builder {
        private DeviceModel deviceModel;
        private DeviceDiscovery discovery = DeviceDiscovery.NONE;
        private TagPoolAllocator tagPoolAllocator = TagPoolAllocator.DEFAULT;
        private BufferAllocator bufferAllocator = BufferAllocator.HEAP;
        private WorkQueueFactory workQueueFactory = WorkQueueFactory.DEFAULT;
        private ThreadFactory recoveryThreadFactory;
        private RecoveryHandler recoveryHandler = RecoveryHandler.IDLE;
        private HostDiagnostics diagnostics = HostDiagnostics.NONE;
        private HostAttributeExporter attributeExporter = HostAttributeExporter.NONE;
        private ResourceTracker resourceTracker = ResourceTracker.getInstance();

        private Builder() {}

        public Builder deviceModel(DeviceModel deviceModel) {
            this.deviceModel = Objects.requireNonNull(deviceModel, "deviceModel");
            return this;
        }

        public Builder discovery(DeviceDiscovery discovery) {
            this.discovery = Objects.requireNonNull(discovery, "discovery");
            return this;
        }

        public Builder tagPoolAllocator(TagPoolAllocator tagPoolAllocator) {
            this.tagPoolAllocator = Objects.requireNonNull(tagPoolAllocator, "tagPoolAllocator");
            return this;
        }

        public Builder bufferAllocator(BufferAllocator bufferAllocator) {
            this.bufferAllocator = Objects.requireNonNull(bufferAllocator, "bufferAllocator");
            return this;
        }

        public Builder workQueueFactory(WorkQueueFactory workQueueFactory) {
            this.workQueueFactory = Objects.requireNonNull(workQueueFactory, "workQueueFactory");
            return this;
        }

        /**
         * Sets the source of recovery threads. The manager renames each thread after its host.
         *
         * @param recoveryThreadFactory the factory; returning null means spawn failure
         * @return this builder
         */
        public Builder recoveryThreadFactory(ThreadFactory recoveryThreadFactory) {
            this.recoveryThreadFactory =
                    Objects.requireNonNull(recoveryThreadFactory, "recoveryThreadFactory");
            return this;
        }

        public Builder recoveryHandler(RecoveryHandler recoveryHandler) {
            this.recoveryHandler = Objects.requireNonNull(recoveryHandler, "recoveryHandler");
            return this;
        }

        public Builder diagnostics(HostDiagnostics diagnostics) {
            this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
            return this;
        }

        public Builder attributeExporter(HostAttributeExporter attributeExporter) {
            this.attributeExporter =
                    Objects.requireNonNull(attributeExporter, "attributeExporter");
            return this;
        }

        public Builder resourceTracker(ResourceTracker resourceTracker) {
            this.resourceTracker = Objects.requireNonNull(resourceTracker, "resourceTracker");
            return this;
        }

        public HostServices build() {
            if (deviceModel == null) {
                deviceModel = new InMemoryDeviceModel();
            }
            if (recoveryThreadFactory == null) {
                recoveryThreadFactory = new HostThreadFactory("host-eh");
            }
            return new HostServices(this);
        }
    }
}
