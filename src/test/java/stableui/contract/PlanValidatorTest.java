package stableui.contract;

import org.testng.annotations.Test;
import stableui.model.ActionPlan;
import stableui.model.ActionStep;
import stableui.model.ConditionType;
import stableui.model.Operation;
import stableui.model.VerifyCondition;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

public class PlanValidatorTest {

    private static final Predicate<String> OPEN = Set.of("tab-1")::contains;

    @Test
    public void validate_acceptsWellFormedPlan() {
        ActionPlan plan = new ActionPlan("log in", "tab-1", List.of(
                ActionStep.builder(Operation.type("ada")).target("email").build(),
                ActionStep.builder(Operation.pause(100)).build(),
                ActionStep.builder(Operation.click()).target("submit")
                        .verifyAfter(VerifyCondition.screenChanged()).build()));

        assertThatCode(() -> PlanValidator.validate(plan, OPEN)).doesNotThrowAnyException();
    }

    @Test
    public void validate_rejectsUnknownSurface() {
        ActionPlan plan = new ActionPlan("", "tab-2", List.of(ActionStep.builder(Operation.verify()).build()));

        assertThatThrownBy(() -> PlanValidator.validate(plan, OPEN))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("unknown surface 'tab-2'");
    }

    @Test
    public void validate_rejectsEmptyPlanAndNonPositiveDeadline() {
        ActionPlan plan = new ActionPlan("", "tab-1", List.of(), List.of(), 0L);

        assertThatThrownBy(() -> PlanValidator.validate(plan, OPEN))
                .isInstanceOfSatisfying(PlanValidationException.class, e -> assertThat(e.getProblems())
                        .containsExactly("plan has no steps", "deadline must be positive: 0"));
    }

    @Test
    public void validate_collectsEveryProblem() {
        ActionPlan plan = new ActionPlan("", "tab-1",
                List.of(ActionStep.builder(Operation.click())
                                .verifyBefore(VerifyCondition.of(ConditionType.ELEMENT_FOUND, null))
                                .build(),
                        ActionStep.builder(Operation.type("x")).target("name")
                                .verifyAfter(VerifyCondition.of(ConditionType.FIELD_CONTAINS, "name", null))
                                .build()),
                List.of(VerifyCondition.of(ConditionType.TEXT_CONTAINS, null, " ")),
                null);

        assertThatThrownBy(() -> PlanValidator.validate(plan, OPEN))
                .isInstanceOfSatisfying(PlanValidationException.class, e -> assertThat(e.getProblems())
                        .containsExactly(
                                "step 0 (click): target is required",
                                "step 0 (click) verify_before[0] element_found: target is required",
                                "step 1 (type) verify_after[0] field_contains: expected value is required",
                                "abort_conditions[0] text_contains: expected value is required"));
    }

    @Test
    public void validationException_joinsProblemsIntoMessage() {
        PlanValidationException e = new PlanValidationException(List.of("a", "b"));

        assertThat(e).hasMessage("Invalid plan: a; b");
        assertThat(e.getProblems()).containsExactly("a", "b");
    }
}
