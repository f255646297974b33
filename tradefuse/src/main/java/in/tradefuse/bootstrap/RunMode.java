package in.tradefuse.bootstrap;

/**
 * Unit of work performed by one process invocation.
 */
public enum RunMode {
    SCORE,      // Score every configured instrument (or ENGINE_INSTRUMENT) and publish orders
    EXECUTE,    // Claim one batch from the order queue and execute it
    MONITOR,    // One trailing-stop pass over open positions
    LABEL;      // Label past decisions with their realized outcomes

    public static RunMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RUN_MODE is required (SCORE, EXECUTE, MONITOR, LABEL)");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown RUN_MODE: " + value, e);
        }
    }
}
