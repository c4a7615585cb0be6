package stableui.contract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.controller.DecisionController;
import stableui.dom.TextNormalizer;
import stableui.driver.DriverException;
import stableui.model.AnchorSpec;
import stableui.model.InteractiveElement;
import stableui.model.ScreenAnchor;
import stableui.model.ScreenElement;
import stableui.model.ScreenState;
import stableui.model.TargetSpec;
import stableui.model.VerifyCondition;
import stableui.util.Deadline;
import stableui.vision.Location;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates {@link VerifyCondition}s for one surface against its latest analysed
 * state, going back to the surface through the decision controller when the
 * state does not answer the question.
 *
 * <p>Screen-change conditions compare a fresh structural hash with the baseline
 * taken before the step. With no hash available, {@code screen_changed} holds and
 * {@code screen_unchanged} does not.
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final SurfaceSession session;

    public ConditionEvaluator(SurfaceSession session) {
        this.session = session;
    }

    /**
     * @param state        latest analysed state of the surface
     * @param baselineHash structural hash before the current step; {@code null} if unknown
     */
    public ConditionResult evaluate(VerifyCondition condition, ScreenState state, String baselineHash,
                                    Deadline deadline) {
        ConditionResult result;
        try {
            result = switch (condition.type()) {
                case ANCHOR_VISIBLE   -> anchorVisible(condition, state, deadline);
                case ELEMENT_FOUND    -> elementFound(condition, state, deadline);
                case TEXT_CONTAINS    -> textContains(condition, state, deadline);
                case FIELD_CONTAINS   -> fieldContains(condition, state, deadline);
                case SCREEN_CHANGED   -> screenChanged(baselineHash, deadline, true);
                case SCREEN_UNCHANGED -> screenChanged(baselineHash, deadline, false);
                case CURSOR_TYPE      -> cursorType(condition, state, deadline);
            };
        } catch (DriverException e) {
            result = ConditionResult.fail(condition + ": surface unavailable (" + e.getKind() + ": "
                    + e.getMessage() + ")");
        }
        log.debug("ConditionEvaluator[{}]: {} -> {}", session.getSurfaceId(), condition,
                result.holds() ? "holds" : "fails");
        return result;
    }

    /** First condition in the list that holds, if any. */
    public Optional<ConditionResult> firstHolding(List<VerifyCondition> conditions, ScreenState state,
                                                  String baselineHash, Deadline deadline) {
        for (VerifyCondition c : conditions) {
            ConditionResult r = evaluate(c, state, baselineHash, deadline);
            if (r.holds()) return Optional.of(r);
        }
        return Optional.empty();
    }

    /** First condition in the list that does not hold, if any. */
    public Optional<ConditionResult> firstFailing(List<VerifyCondition> conditions, ScreenState state,
                                                  String baselineHash, Deadline deadline) {
        for (VerifyCondition c : conditions) {
            ConditionResult r = evaluate(c, state, baselineHash, deadline);
            if (!r.holds()) return Optional.of(r);
        }
        return Optional.empty();
    }

    // ── Condition types ───────────────────────────────────────────────────

    private ConditionResult anchorVisible(VerifyCondition c, ScreenState state, Deadline deadline) {
        Optional<ScreenAnchor> anchor = state.anchor(c.target());
        if (anchor.isEmpty()) {
            AnchorSpec spec = session.anchorSpec(c.target()).orElse(AnchorSpec.text(c.target(), c.target()));
            ScreenState probe = controller().analyze(List.of(spec), List.of(), c.minConfidence(), deadline);
            anchor = probe.anchor(c.target());
        }
        if (anchor.isEmpty() || !anchor.get().found()) {
            return ConditionResult.fail(c + ": anchor not visible");
        }
        ScreenAnchor a = anchor.get();
        if (a.confidence() < c.minConfidence()) {
            return ConditionResult.fail(String.format("%s: anchor confidence %.2f below %.2f",
                    c, a.confidence(), c.minConfidence()));
        }
        return ConditionResult.pass(String.format("%s: visible (%.2f, %s)", c, a.confidence(), a.method()));
    }

    private ConditionResult elementFound(VerifyCondition c, ScreenState state, Deadline deadline) {
        Optional<ScreenElement> element = state.element(c.target());
        if (element.isEmpty() && !state.missing().contains(c.target())) {
            TargetSpec spec = session.targetSpec(c.target(), state);
            ScreenState probe = controller().analyze(List.of(), List.of(spec), c.minConfidence(), deadline);
            element = probe.element(c.target());
        }
        if (element.isEmpty()) {
            return ConditionResult.fail(c + ": element not found");
        }
        ScreenElement e = element.get();
        if (e.confidence() < c.minConfidence()) {
            return ConditionResult.fail(String.format("%s: element confidence %.2f below %.2f",
                    c, e.confidence(), c.minConfidence()));
        }
        return ConditionResult.pass(String.format("%s: found (%.2f, %s)", c, e.confidence(), e.method()));
    }

    private ConditionResult textContains(VerifyCondition c, ScreenState state, Deadline deadline) {
        String expected = TextNormalizer.normalize(c.expected());
        if (c.target() != null) {
            Optional<ScreenElement> element = state.element(c.target());
            if (element.isEmpty()) {
                return ConditionResult.fail(c + ": target not found");
            }
            InteractiveElement e = element.get().element();
            boolean holds = TextNormalizer.normalize(e.text()).contains(expected)
                    || TextNormalizer.normalize(e.ariaLabel()).contains(expected);
            return holds
                    ? ConditionResult.pass(c + ": target text matches")
                    : ConditionResult.fail(c + ": target text is '" + e.text() + "'");
        }
        if (controller().currentIndex(deadline).containsText(c.expected())) {
            return ConditionResult.pass(c + ": present in markup");
        }
        Optional<Location> seen = controller().locateText(c.expected(), deadline);
        if (seen.isPresent() && seen.get().confidence() >= c.minConfidence()) {
            return ConditionResult.pass(String.format("%s: seen at (%d,%d), %.2f",
                    c, seen.get().x(), seen.get().y(), seen.get().confidence()));
        }
        return ConditionResult.fail(c + ": text not present");
    }

    private ConditionResult fieldContains(VerifyCondition c, ScreenState state, Deadline deadline) {
        TargetSpec spec = session.targetSpec(c.target(), state);
        Optional<String> value = controller().fieldValue(spec, deadline);
        if (value.isEmpty()) {
            return ConditionResult.fail(c + ": field not found");
        }
        return value.get().contains(c.expected())
                ? ConditionResult.pass(c + ": field matches")
                : ConditionResult.fail(c + ": field value is '" + value.get() + "'");
    }

    private ConditionResult screenChanged(String baselineHash, Deadline deadline, boolean wantChanged) {
        String name = wantChanged ? "screen_changed" : "screen_unchanged";
        Optional<String> current = controller().currentHash(deadline);
        if (baselineHash == null || current.isEmpty()) {
            return wantChanged
                    ? ConditionResult.pass(name + ": no structural hash to compare, assuming changed")
                    : ConditionResult.fail(name + ": no structural hash to compare, assuming changed");
        }
        boolean changed = !current.get().equals(baselineHash);
        String detail = changed
                ? name + ": hash " + baselineHash + " -> " + current.get()
                : name + ": hash still " + baselineHash;
        return changed == wantChanged ? ConditionResult.pass(detail) : ConditionResult.fail(detail);
    }

    private ConditionResult cursorType(VerifyCondition c, ScreenState state, Deadline deadline) {
        TargetSpec spec = session.targetSpec(c.target(), state);
        Optional<String> cursor = controller().cssValue(spec, "cursor", deadline);
        if (cursor.isEmpty()) {
            return ConditionResult.fail(c + ": target not found");
        }
        return cursor.get().trim().equalsIgnoreCase(c.expected().trim())
                ? ConditionResult.pass(c + ": cursor is " + cursor.get())
                : ConditionResult.fail(c + ": cursor is " + cursor.get());
    }

    private DecisionController controller() {
        return session.getController();
    }
}
