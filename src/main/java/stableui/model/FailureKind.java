package stableui.model;

/** Why an action or a plan did not succeed. Reported, never thrown. */
public enum FailureKind {
    CAPTURE_FAILURE,
    TARGET_NOT_FOUND,
    EXECUTION_FAILURE,
    VERIFICATION_FAILURE,
    ABORT_TRIGGERED,
    DEADLINE_EXCEEDED
}
