package stableui.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Timestamped snapshot of a surface.
 *
 * <p>The change gate fills {@code fingerprint} (a grayscale grid, row-major) and
 * {@code region}; the state tracker fills {@code selectors} and {@code flags}.
 * Instances are immutable: the fingerprint is copied on the way in and out.
 */
public final class Observation {

    private final String surfaceId;
    private final Instant timestamp;
    private final String structuralHash;
    private final int[] fingerprint;
    private final Region region;
    private final List<String> selectors;
    private final SurfaceFlags flags;

    public Observation(String surfaceId, Instant timestamp, String structuralHash, int[] fingerprint,
                       Region region, List<String> selectors, SurfaceFlags flags) {
        this.surfaceId      = surfaceId;
        this.timestamp      = Objects.requireNonNull(timestamp, "timestamp");
        this.structuralHash = Objects.requireNonNull(structuralHash, "structuralHash");
        this.fingerprint    = fingerprint == null ? null : fingerprint.clone();
        this.region         = region;
        this.selectors      = selectors == null ? List.of() : List.copyOf(selectors);
        this.flags          = flags == null ? SurfaceFlags.NONE : flags;
    }

    public static Observation structural(String surfaceId, String structuralHash,
                                         List<String> selectors, SurfaceFlags flags) {
        return new Observation(surfaceId, Instant.now(), structuralHash, null, null, selectors, flags);
    }

    public static Observation visual(String surfaceId, String contentHash, int[] fingerprint, Region region) {
        return new Observation(surfaceId, Instant.now(), contentHash, fingerprint, region, List.of(), null);
    }

    public String       getSurfaceId()      { return surfaceId; }
    public Instant      getTimestamp()      { return timestamp; }
    public String       getStructuralHash() { return structuralHash; }
    public Region       getRegion()         { return region; }
    public List<String> getSelectors()      { return selectors; }
    public SurfaceFlags getFlags()          { return flags; }

    public boolean hasFingerprint() { return fingerprint != null; }

    /** Returns a copy of the fingerprint grid, or {@code null} for structural-only observations. */
    public int[] getFingerprint() {
        return fingerprint == null ? null : fingerprint.clone();
    }

    public boolean sameHashAs(Observation other) {
        return other != null && structuralHash.equals(other.structuralHash);
    }

    @Override
    public String toString() {
        return String.format("Observation{surface=%s, hash=%s, selectors=%d, fingerprint=%s, at=%s}",
                surfaceId, structuralHash, selectors.size(),
                fingerprint == null ? "none" : fingerprint.length + " cells", timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Observation that)) return false;
        return Objects.equals(surfaceId, that.surfaceId)
                && timestamp.equals(that.timestamp)
                && structuralHash.equals(that.structuralHash)
                && Arrays.equals(fingerprint, that.fingerprint)
                && Objects.equals(region, that.region)
                && selectors.equals(that.selectors)
                && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(surfaceId, timestamp, structuralHash, region, selectors, flags);
        return 31 * result + Arrays.hashCode(fingerprint);
    }
}
