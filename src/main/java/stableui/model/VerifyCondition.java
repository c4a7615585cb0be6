package stableui.model;

import java.util.Objects;

/**
 * Typed predicate evaluated before or after a step, or as a plan-wide abort condition.
 *
 * @param type          what to check
 * @param target        anchor or target name; may be {@code null} for surface-wide checks
 * @param expected      expected text, field value or cursor name, depending on {@code type}
 * @param minConfidence minimum confidence for anchor/element checks, in [0, 1]
 */
public record VerifyCondition(ConditionType type, String target, String expected, double minConfidence) {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.8;

    public VerifyCondition {
        Objects.requireNonNull(type, "type");
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence out of range [0,1]: " + minConfidence);
        }
    }

    public static VerifyCondition of(ConditionType type, String target) {
        return new VerifyCondition(type, target, null, DEFAULT_MIN_CONFIDENCE);
    }

    public static VerifyCondition of(ConditionType type, String target, String expected) {
        return new VerifyCondition(type, target, expected, DEFAULT_MIN_CONFIDENCE);
    }

    public static VerifyCondition screenChanged() {
        return new VerifyCondition(ConditionType.SCREEN_CHANGED, null, null, DEFAULT_MIN_CONFIDENCE);
    }

    public static VerifyCondition screenUnchanged() {
        return new VerifyCondition(ConditionType.SCREEN_UNCHANGED, null, null, DEFAULT_MIN_CONFIDENCE);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.wireName());
        if (target != null) sb.append(" '").append(target).append('\'');
        if (expected != null) sb.append(" expects '").append(expected).append('\'');
        return sb.toString();
    }
}
