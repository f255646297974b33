package in.tradefuse.domain.signal;

/**
 * Availability of one signal component for a scoring cycle.
 */
public enum ComponentStatus {
    PRESENT,
    MISSING,
    STALE;

    public boolean isUsable() {
        return this == PRESENT;
    }
}
