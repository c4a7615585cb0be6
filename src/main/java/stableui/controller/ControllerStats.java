package stableui.controller;

/**
 * Snapshot of a controller's counters. Structural and perceptual counts are
 * attempts, so one action that fell back counts once in each.
 */
public record ControllerStats(
        long structuralActions,
        long perceptualActions,
        long fallbacks,
        long verificationsPassed,
        long verificationsFailed,
        long overlaysDismissed,
        long loopsDetected) {

    public long totalActions() {
        return structuralActions + perceptualActions - fallbacks;
    }
}
