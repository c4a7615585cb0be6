package stableui.contract;

import com.fasterxml.jackson.databind.JsonNode;
import org.testng.annotations.Test;
import stableui.config.EngineConfig;
import stableui.model.ActionPlan;
import stableui.model.ActionStep;
import stableui.model.ConditionType;
import stableui.model.ExecutionResult;
import stableui.model.FailureKind;
import stableui.model.Operation;
import stableui.model.ScreenState;
import stableui.model.VerifyCondition;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PlanIOTest {

    private static final String LOGIN_PLAN = """
            {
              "goal": "log in",
              "screen_id": "tab-1",
              "deadline_ms": 20000,
              "steps": [
                {"op": "type", "target": "email", "params": {"text": "ada@example.com", "press_enter": true}},
                {"op": "click", "target": "submit", "retries": 1, "timeout_ms": 3000,
                 "verify_after": [
                   {"type": "screen_changed"},
                   {"type": "text_contains", "expected": "Welcome", "min_confidence": 0.6}
                 ]},
                {"action": "wait", "params": {"duration_ms": 250}},
                {"op": "scroll", "params": {"dy": 400}}
              ],
              "abort_conditions": [{"type": "text_contains", "text": "Account locked"}]
            }
            """;

    @Test
    public void fromJson_buildsPlanWithOperationsAndConditions() {
        ActionPlan plan = PlanIO.fromJson(LOGIN_PLAN);

        assertThat(plan.goal()).isEqualTo("log in");
        assertThat(plan.surfaceId()).isEqualTo("tab-1");
        assertThat(plan.deadlineMs()).isEqualTo(20000L);
        assertThat(plan.steps()).hasSize(4);

        ActionStep type = plan.steps().get(0);
        assertThat(type.operation()).isEqualTo(new Operation.Type("ada@example.com", true));
        assertThat(type.target()).isEqualTo("email");

        ActionStep click = plan.steps().get(1);
        assertThat(click.retries()).isEqualTo(1);
        assertThat(click.timeoutMs()).isEqualTo(3000L);
        assertThat(click.verifyAfter()).containsExactly(
                VerifyCondition.screenChanged(),
                new VerifyCondition(ConditionType.TEXT_CONTAINS, null, "Welcome", 0.6));

        assertThat(plan.steps().get(2).operation()).isEqualTo(Operation.pause(250));
        assertThat(plan.steps().get(3).operation()).isEqualTo(Operation.scroll(0, 400));
        assertThat(plan.abortConditions()).singleElement()
                .satisfies(c -> assertThat(c.expected()).isEqualTo("Account locked"));
    }

    @Test
    public void fromJson_takesStepDefaultsFromConfig() {
        EngineConfig config = EngineConfig.defaults().with("step.retries", "4").with("step.timeout.ms", "900");

        ActionPlan plan = PlanIO.fromJson("""
                {"screen_id": "tab-1", "steps": [{"op": "click", "target": "ok"}]}
                """, config);

        assertThat(plan.steps().get(0).retries()).isEqualTo(4);
        assertThat(plan.steps().get(0).timeoutMs()).isEqualTo(900L);
        assertThat(plan.deadlineMs()).isNull();
        assertThat(plan.abortConditions()).isEmpty();
    }

    @Test
    public void fromJson_rejectsMalformedJson() {
        assertThatThrownBy(() -> PlanIO.fromJson("{\"screen_id\": "))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    public void fromJson_rejectsSchemaViolations() {
        String json = """
                {"steps": [{"target": "ok", "retries": -1}]}
                """;

        assertThatThrownBy(() -> PlanIO.fromJson(json))
                .isInstanceOfSatisfying(PlanValidationException.class,
                        e -> assertThat(e.getProblems()).hasSizeGreaterThanOrEqualTo(2));
    }

    @Test
    public void fromJson_rejectsEmptySteps() {
        assertThatThrownBy(() -> PlanIO.fromJson("{\"screen_id\": \"tab-1\", \"steps\": []}"))
                .isInstanceOf(PlanValidationException.class);
    }

    @Test
    public void fromJson_rejectsUnknownOperation() {
        assertThatThrownBy(() -> PlanIO.fromJson("""
                {"screen_id": "tab-1", "steps": [{"op": "drag", "target": "ok"}]}
                """))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("Unknown operation: 'drag'");
    }

    @Test
    public void fromJson_rejectsUnknownConditionType() {
        assertThatThrownBy(() -> PlanIO.fromJson("""
                {"screen_id": "tab-1", "steps": [{"op": "verify", "verify_after": [{"type": "pixel_perfect"}]}]}
                """))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("pixel_perfect");
    }

    @Test
    public void read_loadsPlanFromFile() throws Exception {
        Path file = Files.createTempFile("plan", ".json");
        try {
            Files.writeString(file, LOGIN_PLAN);
            assertThat(PlanIO.read(file).steps()).hasSize(4);
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    public void toJson_writesResultInSnakeCase() throws Exception {
        ScreenState state = new ScreenState("tab-1", Instant.parse("2024-05-01T10:00:00Z"),
                List.of(), List.of(), List.of("Target 'x' not found"), List.of("x"), "abc123");
        ExecutionResult result = ExecutionResult.failed(1, 3, 1, FailureKind.VERIFICATION_FAILURE,
                "Step 1: post-condition failed", state, 42L, List.of("Step 0: ok"));

        JsonNode json = PlanIO.getMapper().readTree(PlanIO.toJson(result));

        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.get("completed_steps").asInt()).isEqualTo(1);
        assertThat(json.get("failed_step").asInt()).isEqualTo(1);
        assertThat(json.get("failure_kind").asText()).isEqualTo("VERIFICATION_FAILURE");
        assertThat(json.get("execution_time_ms").asLong()).isEqualTo(42L);
        assertThat(json.at("/state_after/structural_hash").asText()).isEqualTo("abc123");
        assertThat(json.at("/state_after/timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.at("/state_after/missing/0").asText()).isEqualTo("x");
    }
}
