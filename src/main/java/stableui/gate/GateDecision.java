package stableui.gate;

/**
 * Result of one {@link ChangeGate#shouldAnalyze} call.
 *
 * @param changed   whether the caller should re-analyse the surface
 * @param reason    which branch of the gate produced the answer
 * @param elapsedMs wall time spent in the check
 * @param diffRatio fraction of fingerprint cells that differed; 0 when not measured,
 *                  1 when the gate could not compare
 */
public record GateDecision(boolean changed, Reason reason, double elapsedMs, double diffRatio) {

    public enum Reason {
        /** No previous observation to compare with. */
        FIRST_CHECK,
        /** Content hash identical to the previous frame. */
        IDENTICAL_HASH,
        /** Hashes differ but the fingerprints are within threshold. */
        BELOW_THRESHOLD,
        /** Fingerprints differ at or above threshold. */
        CHANGED,
        /** The region of interest differs from the previous observation's. */
        REGION_CHANGED,
        /** The frame could not be captured; assume changed. */
        CAPTURE_FAILED
    }
}
