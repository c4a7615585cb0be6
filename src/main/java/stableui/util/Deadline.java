package stableui.util;

/**
 * Monotonic time budget for a plan. Every blocking call made on behalf of a
 * plan is bounded by {@link #remainingMs()}.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, false);

    private final long expiresAtNanos;
    private final boolean bounded;

    private Deadline(long expiresAtNanos, boolean bounded) {
        this.expiresAtNanos = expiresAtNanos;
        this.bounded = bounded;
    }

    public static Deadline after(long millis) {
        if (millis <= 0) throw new IllegalArgumentException("Deadline must be positive: " + millis);
        return new Deadline(System.nanoTime() + millis * 1_000_000L, true);
    }

    /** A deadline that never expires. */
    public static Deadline none() {
        return NONE;
    }

    public long remainingMs() {
        if (!bounded) return Long.MAX_VALUE;
        return Math.max(0L, (expiresAtNanos - System.nanoTime()) / 1_000_000L);
    }

    public boolean exhausted() {
        return bounded && System.nanoTime() - expiresAtNanos >= 0;
    }

    /** The smaller of {@code timeoutMs} and the remaining budget. */
    public long cap(long timeoutMs) {
        return Math.min(timeoutMs, remainingMs());
    }

    @Override
    public String toString() {
        return bounded ? "Deadline{remaining=" + remainingMs() + "ms}" : "Deadline{none}";
    }
}
