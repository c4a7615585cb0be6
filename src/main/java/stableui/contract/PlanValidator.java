package stableui.contract;

import stableui.model.ActionPlan;
import stableui.model.ActionStep;
import stableui.model.VerifyCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Rejects malformed plans before the first step runs. Every problem is collected
 * so a caller sees the whole list at once.
 */
public final class PlanValidator {

    private PlanValidator() {}

    /**
     * @param knownSurface whether a surface id names an open surface
     * @throws PlanValidationException if the plan has any problem
     */
    public static void validate(ActionPlan plan, Predicate<String> knownSurface) {
        List<String> problems = new ArrayList<>();

        if (!knownSurface.test(plan.surfaceId())) {
            problems.add("unknown surface '" + plan.surfaceId() + "'");
        }
        if (plan.steps().isEmpty()) {
            problems.add("plan has no steps");
        }
        if (plan.deadlineMs() != null && plan.deadlineMs() <= 0) {
            problems.add("deadline must be positive: " + plan.deadlineMs());
        }

        for (int i = 0; i < plan.steps().size(); i++) {
            ActionStep step = plan.steps().get(i);
            String where = "step " + i + " (" + step.operation().kind().wireName() + ")";
            if (step.operation().needsTarget() && !step.hasTarget()) {
                problems.add(where + ": target is required");
            }
            checkConditions(where + " verify_before", step.verifyBefore(), problems);
            checkConditions(where + " verify_after", step.verifyAfter(), problems);
        }
        checkConditions("abort_conditions", plan.abortConditions(), problems);

        if (!problems.isEmpty()) {
            throw new PlanValidationException(problems);
        }
    }

    private static void checkConditions(String where, List<VerifyCondition> conditions, List<String> problems) {
        for (int i = 0; i < conditions.size(); i++) {
            VerifyCondition c = conditions.get(i);
            if (c.type().needsTarget() && isBlank(c.target())) {
                problems.add(where + "[" + i + "] " + c.type().wireName() + ": target is required");
            }
            if (c.type().needsExpected() && isBlank(c.expected())) {
                problems.add(where + "[" + i + "] " + c.type().wireName() + ": expected value is required");
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
