package stableui.gate;

/**
 * Snapshot of a gate's running counters.
 */
public record GateStats(long totalChecks, long changesDetected, long cacheHits, double avgCheckTimeMs) {

    /** Fraction of checks answered by the hash comparison alone. */
    public double cacheHitRate() {
        return totalChecks == 0 ? 0.0 : (double) cacheHits / totalChecks;
    }

    public double changeRate() {
        return totalChecks == 0 ? 0.0 : (double) changesDetected / totalChecks;
    }
}
