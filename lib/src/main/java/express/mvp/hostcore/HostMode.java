package express.mvp.hostcore;

/** Operating mode a host supports or runs in. */
public enum HostMode {
    /** Not set by the template; hosts then run as initiators. */
    UNKNOWN,
    INITIATOR,
    TARGET
}
