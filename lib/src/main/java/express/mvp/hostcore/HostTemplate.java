package express.mvp.hostcore;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.hostcore.command.TagAllocPolicy;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Driver-supplied description of a family of hosts.
 *
 * <p>Capability fields left at their "unset" value are replaced by documented defaults when a
 * host is allocated. A template is immutable apart from the list of hosts registered through the
 * legacy registration path.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * HostTemplate template = HostTemplate.builder("demo")
 *     .canQueue(64)
 *     .cmdPerLun(4)
 *     .maxSectors(2048)
 *     .hostResetHandler(true)
 *     .build();
 * }</pre>
 *
 * @see Host
 */
public final class HostTemplate {

    /** Value of the addressing and command-length fields meaning "use the default". */
    public static final int UNSET = -1;

    private final String name;
    private final Function<Host, String> info;
    private final int canQueue;
    private final int thisId;
    private final int sgTablesize;
    private final int sgProtTablesize;
    private final int cmdPerLun;
    private final boolean uncheckedIsaDma;
    private final boolean useClustering;
    private final boolean noWriteSame;
    private final HostMode supportedMode;
    private final int maxHostBlocked;
    private final int maxSectors;
    private final long dmaBoundary;
    private final int maxChannel;
    private final int maxId;
    private final int maxLun;
    private final int maxCmdLen;
    private final boolean hostResetHandler;
    private final TagAllocPolicy tagAllocPolicy;
    private final boolean detect;
    private final HostTransport transport;

    /** Hosts registered through the legacy path. */
    private final List<Host> legacyHosts = new CopyOnWriteArrayList<>();

    private HostTemplate(Builder builder) {
        this.name = builder.name;
        this.info = builder.info;
        this.canQueue = builder.canQueue;
        this.thisId = builder.thisId;
        this.sgTablesize = builder.sgTablesize;
        this.sgProtTablesize = builder.sgProtTablesize;
        this.cmdPerLun = builder.cmdPerLun;
        this.uncheckedIsaDma = builder.uncheckedIsaDma;
        this.useClustering = builder.useClustering;
        this.noWriteSame = builder.noWriteSame;
        this.supportedMode = builder.supportedMode;
        this.maxHostBlocked = builder.maxHostBlocked;
        this.maxSectors = builder.maxSectors;
        this.dmaBoundary = builder.dmaBoundary;
        this.maxChannel = builder.maxChannel;
        this.maxId = builder.maxId;
        this.maxLun = builder.maxLun;
        this.maxCmdLen = builder.maxCmdLen;
        this.hostResetHandler = builder.hostResetHandler;
        this.tagAllocPolicy = builder.tagAllocPolicy;
        this.detect = builder.detect;
        this.transport = builder.transport;
    }

    /**
     * Creates a builder.
     *
     * @param name driver name, used in diagnostics
     * @return a new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the line logged when a host of this template is published.
     *
     * @param host the host being published
     * @return the driver's info string, or the template name when it has none
     */
    public String info(Host host) {
        return info != null ? info.apply(host) : name;
    }

    /** Maximum outstanding commands per host; 0 is rejected at publish. */
    public int canQueue() {
        return canQueue;
    }

    public int thisId() {
        return thisId;
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

    public HostMode supportedMode() {
        return supportedMode;
    }

    /** Blocked retries before a host is unblocked; 0 means the default. */
    public int maxHostBlocked() {
        return maxHostBlocked;
    }

    /** Transfer size limit in sectors; 0 means the default. */
    public int maxSectors() {
        return maxSectors;
    }

    /** DMA segment boundary mask; 0 means the default. */
    public long dmaBoundary() {
        return dmaBoundary;
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

    /** Whether the driver can reset a whole host; required for an error-handler deadline. */
    public boolean hasHostResetHandler() {
        return hostResetHandler;
    }

    public TagAllocPolicy tagAllocPolicy() {
        return tagAllocPolicy;
    }

    /** Whether the driver has a legacy detect routine. */
    public boolean hasDetect() {
        return detect;
    }

    public HostTransport transport() {
        return transport;
    }

    /**
     * Returns the live list of hosts registered through the legacy path.
     *
     * @return the legacy host list
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Legacy registration appends to the template's own host list.")
    public List<Host> legacyHosts() {
        return legacyHosts;
    }

    @Override
    public String toString() {
        return "HostTemplate[" + name + ", canQueue=" + canQueue + "]";
    }

    /** Builder for {@link HostTemplate}. */
    public static final class Builder {
        private final String name;
        private Function<Host, String> info;
        private int canQueue;
        private int thisId = -1;
        private int sgTablesize;
        private int sgProtTablesize;
        private int cmdPerLun;
        private boolean uncheckedIsaDma;
        private boolean useClustering;
        private boolean noWriteSame;
        private HostMode supportedMode = HostMode.UNKNOWN;
        private int maxHostBlocked;
        private int maxSectors;
        private long dmaBoundary;
        private int maxChannel = UNSET;
        private int maxId = UNSET;
        private int maxLun = UNSET;
        private int maxCmdLen = UNSET;
        private boolean hostResetHandler;
        private TagAllocPolicy tagAllocPolicy = TagAllocPolicy.FIFO;
        private boolean detect;
        private HostTransport transport = HostTransport.BLANK;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder info(Function<Host, String> info) {
            this.info = info;
            return this;
        }

        public Builder canQueue(int canQueue) {
            this.canQueue = canQueue;
            return this;
        }

        public Builder thisId(int thisId) {
            this.thisId = thisId;
            return this;
        }

        public Builder sgTablesize(int sgTablesize) {
            this.sgTablesize = sgTablesize;
            return this;
        }

        public Builder sgProtTablesize(int sgProtTablesize) {
            this.sgProtTablesize = sgProtTablesize;
            return this;
        }

        public Builder cmdPerLun(int cmdPerLun) {
            this.cmdPerLun = cmdPerLun;
            return this;
        }

        public Builder uncheckedIsaDma(boolean uncheckedIsaDma) {
            this.uncheckedIsaDma = uncheckedIsaDma;
            return this;
        }

        public Builder useClustering(boolean useClustering) {
            this.useClustering = useClustering;
            return this;
        }

        public Builder noWriteSame(boolean noWriteSame) {
            this.noWriteSame = noWriteSame;
            return this;
        }

        public Builder supportedMode(HostMode supportedMode) {
            this.supportedMode = Objects.requireNonNull(supportedMode);
            return this;
        }

        public Builder maxHostBlocked(int maxHostBlocked) {
            this.maxHostBlocked = maxHostBlocked;
            return this;
        }

        public Builder maxSectors(int maxSectors) {
            this.maxSectors = maxSectors;
            return this;
        }

        public Builder dmaBoundary(long dmaBoundary) {
            this.dmaBoundary = dmaBoundary;
            return this;
        }

        public Builder maxChannel(int maxChannel) {
            this.maxChannel = maxChannel;
            return this;
        }

        public Builder maxId(int maxId) {
            this.maxId = maxId;
            return this;
        }

        public Builder maxLun(int maxLun) {
            this.maxLun = maxLun;
            return this;
        }

        public Builder maxCmdLen(int maxCmdLen) {
            this.maxCmdLen = maxCmdLen;
            return this;
        }

        public Builder hostResetHandler(boolean present) {
            this.hostResetHandler = present;
            return this;
        }

        public Builder tagAllocPolicy(TagAllocPolicy policy) {
            this.tagAllocPolicy = Objects.requireNonNull(policy);
            return this;
        }

        public Builder detect(boolean detect) {
            this.detect = detect;
            return this;
        }

        public Builder transport(HostTransport transport) {
            this.transport = Objects.requireNonNull(transport);
            return this;
        }

        public HostTemplate build() {
            return new HostTemplate(this);
        }
    }
}
