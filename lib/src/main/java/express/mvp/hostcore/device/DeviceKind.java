package express.mvp.hostcore.device;

/** Kinds of entities sharing the generic device representation. */
public enum DeviceKind {
    /** Platform or bus device that parents hosts. */
    PLATFORM,
    /** Primary device of a host adapter. */
    HOST,
    /** Target discovered behind a host. */
    TARGET,
    /** Addressable device discovered behind a host. */
    DEVICE
}
