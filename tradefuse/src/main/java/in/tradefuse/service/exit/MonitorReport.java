package in.tradefuse.service.exit;

/**
 * Counters of one monitoring cycle.
 */
public record MonitorReport(
    int checked,
    int peaksUpdated,
    int stopsRaised,
    int exitsPublished,
    int skipped,
    int failures,
    boolean timedOut
) {
    public boolean hasFailures() {
        return failures > 0;
    }
}
