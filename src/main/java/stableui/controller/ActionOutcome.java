package stableui.controller;

import stableui.model.FailureKind;

/**
 * Result of one {@link DecisionController#execute} call. Failures are values,
 * never exceptions.
 *
 * @param fellBack     a structural attempt was made and did not succeed, so perception was used
 * @param verified     result of the expected-outcome check; {@code null} when none was requested
 *                     or the action failed
 * @param failureKind  {@code null} on success
 * @param loopDetected the re-observation after this action completed a loop
 */
public record ActionOutcome(
        ExecutionMethod method,
        boolean success,
        long elapsedMs,
        boolean fellBack,
        Boolean verified,
        FailureKind failureKind,
        String message,
        boolean loopDetected) {

    /** Whether the action succeeded and, if an outcome was expected, it was observed. */
    public boolean succeededAndVerified() {
        return success && (verified == null || verified);
    }
}
