package stableui.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.config.EngineConfig;
import stableui.model.ActionPlan;
import stableui.model.ActionStep;
import stableui.model.ConditionType;
import stableui.model.ExecutionResult;
import stableui.model.Operation;
import stableui.model.OperationKind;
import stableui.model.ScreenState;
import stableui.model.VerifyCondition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads {@link ActionPlan}s from JSON and writes results and states back as JSON.
 *
 * <p>On read: validates against {@code plan-schema.json} before building the plan.
 * A step names its operation with {@code op} (or {@code action}); operation
 * parameters live under {@code params}:
 * <pre>
 * {
 *   "goal": "log in",
 *   "screen_id": "tab-1",
 *   "steps": [
 *     {"op": "type", "target": "email", "params": {"text": "a@b.c"}},
 *     {"op": "click", "target": "submit", "verify_after": [{"type": "screen_changed"}], "retries": 2}
 *   ],
 *   "abort_conditions": [{"type": "text_contains", "expected": "Account locked"}]
 * }
 * </pre>
 *
 * <p>On write: snake_case property names, ISO-8601 timestamps.
 */
public final class PlanIO {

    private static final Logger log = LoggerFactory.getLogger(PlanIO.class);
    private static final String SCHEMA_RESOURCE = "/plan-schema.json";

    /** Shared reader/writer; thread-safe after configuration. */
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** Loaded once from the classpath; null if the resource is missing. */
    private static volatile JsonSchema planSchema;

    private PlanIO() {}

    // ── Reading ───────────────────────────────────────────────────────────

    /**
     * @throws PlanValidationException if the JSON is malformed, fails the schema, or
     *                                 names an unknown operation or condition
     */
    public static ActionPlan fromJson(String json) {
        return fromJson(json, EngineConfig.defaults());
    }

    /** As {@link #fromJson(String)}, taking step defaults from {@code config}. */
    public static ActionPlan fromJson(String json, EngineConfig config) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PlanValidationException("not valid JSON: " + e.getOriginalMessage(), e);
        }
        validateSchema(root);
        try {
            return toPlan(root, config);
        } catch (IllegalArgumentException e) {
            throw new PlanValidationException(e.getMessage(), e);
        }
    }

    public static ActionPlan read(Path path) throws IOException {
        log.debug("Reading plan from: {}", path);
        ActionPlan plan = fromJson(Files.readString(path));
        log.info("Loaded plan '{}' with {} steps from {}", plan.goal(), plan.steps().size(), path);
        return plan;
    }

    // ── Writing ───────────────────────────────────────────────────────────

    public static String toJson(ExecutionResult result) throws IOException {
        return MAPPER.writeValueAsString(result);
    }

    public static String toJson(ScreenState state) throws IOException {
        return MAPPER.writeValueAsString(state);
    }

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    // ── Plan building ─────────────────────────────────────────────────────

    private static ActionPlan toPlan(JsonNode root, EngineConfig config) {
        List<ActionStep> steps = new ArrayList<>();
        for (JsonNode s : root.path("steps")) {
            steps.add(toStep(s, config));
        }
        Long deadline = root.hasNonNull("deadline_ms") ? root.get("deadline_ms").asLong() : null;
        return new ActionPlan(text(root, "goal"), text(root, "screen_id"), steps,
                conditions(root.path("abort_conditions")), deadline);
    }

    private static ActionStep toStep(JsonNode s, EngineConfig config) {
        String opName = s.hasNonNull("op") ? s.get("op").asText() : text(s, "action");
        JsonNode params = s.path("params");
        Operation op = switch (OperationKind.fromName(opName)) {
            case CLICK  -> Operation.click();
            case TYPE   -> new Operation.Type(params.path("text").asText(""),
                                              params.path("press_enter").asBoolean(false));
            case WAIT   -> Operation.pause(params.path("duration_ms").asLong(0L));
            case VERIFY -> Operation.verify();
            case SCROLL -> Operation.scroll(params.path("dx").asInt(0), params.path("dy").asInt(0));
        };
        return new ActionStep(op, text(s, "target"),
                conditions(s.path("verify_before")), conditions(s.path("verify_after")),
                s.hasNonNull("retries") ? s.get("retries").asInt() : config.getStepRetries(),
                s.hasNonNull("timeout_ms") ? s.get("timeout_ms").asLong() : config.getStepTimeoutMs());
    }

    private static List<VerifyCondition> conditions(JsonNode array) {
        List<VerifyCondition> out = new ArrayList<>();
        for (JsonNode c : array) {
            String expected = c.hasNonNull("expected") ? c.get("expected").asText() : text(c, "text");
            double minConfidence = c.hasNonNull("min_confidence")
                    ? c.get("min_confidence").asDouble()
                    : VerifyCondition.DEFAULT_MIN_CONFIDENCE;
            out.add(new VerifyCondition(ConditionType.fromName(text(c, "type")), text(c, "target"),
                    expected, minConfidence));
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(JsonNode root) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("plan-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            List<String> problems = new ArrayList<>();
            errors.forEach(e -> problems.add(e.getMessage()));
            throw new PlanValidationException(problems);
        }
    }

    private static JsonSchema getSchema() {
        if (planSchema == null) {
            synchronized (PlanIO.class) {
                if (planSchema == null) {
                    try (InputStream is = PlanIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        planSchema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(is);
                        log.debug("Plan schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load plan schema: {}", e.getMessage());
                    }
                }
            }
        }
        return planSchema;
    }
}
