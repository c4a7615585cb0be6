package stableui.model;

import java.util.List;

/**
 * Outcome of running an {@link ActionPlan}.
 *
 * @param failedStep      zero-based index of the failing step, {@code null} on success
 * @param failureKind     {@code null} on success
 * @param stateAfter      surface state captured after the last step or after the failure
 * @param log             ordered, human-readable trace
 */
public record ExecutionResult(
        boolean success,
        int completedSteps,
        int totalSteps,
        Integer failedStep,
        FailureKind failureKind,
        String errorMessage,
        ScreenState stateAfter,
        long executionTimeMs,
        List<String> log) {

    public ExecutionResult {
        log = log == null ? List.of() : List.copyOf(log);
        if (success && failedStep != null) {
            throw new IllegalArgumentException("A successful result cannot name a failed step");
        }
    }

    public static ExecutionResult succeeded(int steps, ScreenState after, long elapsedMs, List<String> log) {
        return new ExecutionResult(true, steps, steps, null, null, null, after, elapsedMs, log);
    }

    public static ExecutionResult failed(int completed, int total, int failedStep, FailureKind kind,
                                         String message, ScreenState after, long elapsedMs, List<String> log) {
        return new ExecutionResult(false, completed, total, failedStep, kind, message, after, elapsedMs, log);
    }
}
