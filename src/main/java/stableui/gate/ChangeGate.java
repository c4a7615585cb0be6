package stableui.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.config.EngineConfig;
import stableui.model.Observation;
import stableui.model.Region;
import stableui.util.ContentHash;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Decides whether a surface changed enough since the last check to justify
 * re-analysis.
 *
 * <p>Each check runs in two tiers:
 * <ol>
 *   <li>a content hash of the frame; identical to the stored one means unchanged,
 *       with no further work</li>
 *   <li>otherwise a {@link Fingerprint} comparison; the surface changed when the
 *       fraction of differing cells reaches the threshold</li>
 * </ol>
 * The stored observation is replaced after every successful capture, so the next
 * check is always relative to the latest frame.
 *
 * <p>One gate watches one surface. It never throws from {@link #shouldAnalyze}:
 * a failed capture is reported as changed.
 */
public class ChangeGate {

    private static final Logger log = LoggerFactory.getLogger(ChangeGate.class);

    private final String surfaceId;
    private final FrameSource source;
    private final int gridSize;
    private final int pixelDelta;

    private double threshold;
    private Observation last;

    private long totalChecks;
    private long changesDetected;
    private long cacheHits;
    private double totalCheckTimeMs;

    /**
     * @throws IllegalArgumentException if {@code gridSize} is not positive, {@code pixelDelta}
     *                                  is negative or {@code threshold} is outside [0, 1]
     */
    public ChangeGate(String surfaceId, FrameSource source, double threshold, int gridSize, int pixelDelta) {
        if (gridSize <= 0) throw new IllegalArgumentException("Grid size must be positive: " + gridSize);
        if (pixelDelta < 0) throw new IllegalArgumentException("Pixel delta must be >= 0: " + pixelDelta);
        this.surfaceId  = surfaceId;
        this.source     = Objects.requireNonNull(source, "source");
        this.gridSize   = gridSize;
        this.pixelDelta = pixelDelta;
        setThreshold(threshold);
    }

    public ChangeGate(String surfaceId, FrameSource source, EngineConfig config) {
        this(surfaceId, source, config.getGateThreshold(), config.getGateGridSize(), config.getGatePixelDelta());
    }

    // ── Public API ────────────────────────────────────────────────────────

    /** Full-frame check. */
    public GateDecision shouldAnalyze() {
        return shouldAnalyze(null);
    }

    /**
     * Checks the given region of interest (or the full frame when {@code null}).
     */
    public synchronized GateDecision shouldAnalyze(Region roi) {
        long start = System.nanoTime();
        totalChecks++;

        BufferedImage frame;
        try {
            frame = source.capture(roi);
            if (frame == null) throw new IllegalStateException("frame source returned no image");
        } catch (RuntimeException e) {
            log.warn("ChangeGate[{}]: capture failed, assuming changed: {}", surfaceId, e.getMessage());
            return finish(start, true, GateDecision.Reason.CAPTURE_FAILED, 1.0);
        }

        String hash = ContentHash.of(frame);
        Observation previous = last;

        if (previous == null) {
            last = Observation.visual(surfaceId, hash, Fingerprint.of(frame, gridSize), roi);
            log.debug("ChangeGate[{}]: first check, hash={}", surfaceId, hash);
            return finish(start, true, GateDecision.Reason.FIRST_CHECK, 1.0);
        }

        if (!Objects.equals(previous.getRegion(), roi)) {
            last = Observation.visual(surfaceId, hash, Fingerprint.of(frame, gridSize), roi);
            log.debug("ChangeGate[{}]: region changed {} -> {}", surfaceId, previous.getRegion(), roi);
            return finish(start, true, GateDecision.Reason.REGION_CHANGED, 1.0);
        }

        if (previous.getStructuralHash().equals(hash)) {
            cacheHits++;
            last = Observation.visual(surfaceId, hash, previous.getFingerprint(), roi);
            return finish(start, false, GateDecision.Reason.IDENTICAL_HASH, 0.0);
        }

        int[] current = Fingerprint.of(frame, gridSize);
        double ratio = Fingerprint.diffRatio(previous.getFingerprint(), current, pixelDelta);
        last = Observation.visual(surfaceId, hash, current, roi);

        boolean changed = ratio >= threshold;
        log.debug("ChangeGate[{}]: diff ratio {} (threshold {}) -> {}",
                surfaceId, String.format("%.4f", ratio), threshold, changed ? "changed" : "unchanged");
        return finish(start, changed,
                changed ? GateDecision.Reason.CHANGED : GateDecision.Reason.BELOW_THRESHOLD, ratio);
    }

    /** Forgets the stored observation; the next check reports {@code FIRST_CHECK}. */
    public synchronized void reset() {
        last = null;
        log.debug("ChangeGate[{}]: reset", surfaceId);
    }

    /**
     * @throws IllegalArgumentException if {@code threshold} is outside [0, 1]
     */
    public synchronized void setThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Threshold must be within [0, 1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public synchronized double getThreshold() {
        return threshold;
    }

    /** The stored observation, or {@code null} before the first successful capture. */
    public synchronized Observation lastObservation() {
        return last;
    }

    public synchronized GateStats stats() {
        double avg = totalChecks == 0 ? 0.0 : totalCheckTimeMs / totalChecks;
        return new GateStats(totalChecks, changesDetected, cacheHits, avg);
    }

    public String getSurfaceId() {
        return surfaceId;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private GateDecision finish(long startNanos, boolean changed, GateDecision.Reason reason, double ratio) {
        double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        totalCheckTimeMs += elapsedMs;
        if (changed) changesDetected++;
        return new GateDecision(changed, reason, elapsedMs, ratio);
    }
}
