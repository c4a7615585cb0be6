package stableui.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered steps to run against one surface. If any abort condition holds at any
 * check point, execution halts regardless of remaining steps or retries.
 *
 * @param deadlineMs overall time budget; {@code null} uses the configured default
 */
public record ActionPlan(
        String goal,
        String surfaceId,
        List<ActionStep> steps,
        List<VerifyCondition> abortConditions,
        Long deadlineMs) {

    public ActionPlan {
        Objects.requireNonNull(surfaceId, "surfaceId");
        goal = goal == null ? "" : goal;
        steps = steps == null ? List.of() : List.copyOf(steps);
        abortConditions = abortConditions == null ? List.of() : List.copyOf(abortConditions);
    }

    public ActionPlan(String goal, String surfaceId, List<ActionStep> steps) {
        this(goal, surfaceId, steps, List.of(), null);
    }
}
