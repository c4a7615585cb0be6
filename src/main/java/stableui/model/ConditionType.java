package stableui.model;

import java.util.Locale;

/** Predicates a {@link VerifyCondition} can express. */
public enum ConditionType {
    /** Named anchor found at or above the condition's confidence. */
    ANCHOR_VISIBLE(true, false),
    /** Named target present in the analysed state at or above the condition's confidence. */
    ELEMENT_FOUND(true, false),
    /** Surface text (or the target's text, when a target is named) contains the expected text. */
    TEXT_CONTAINS(false, true),
    /** The target field's current value contains the expected text. */
    FIELD_CONTAINS(true, true),
    /** Structural hash differs from the one observed before the step. */
    SCREEN_CHANGED(false, false),
    /** Structural hash equals the one observed before the step. */
    SCREEN_UNCHANGED(false, false),
    /** The target's computed cursor style equals the expected value. */
    CURSOR_TYPE(true, true);

    private final boolean needsTarget;
    private final boolean needsExpected;

    ConditionType(boolean needsTarget, boolean needsExpected) {
        this.needsTarget = needsTarget;
        this.needsExpected = needsExpected;
    }

    public boolean needsTarget()   { return needsTarget; }
    public boolean needsExpected() { return needsExpected; }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConditionType fromName(String name) {
        if (name == null) throw new IllegalArgumentException("Condition type must not be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown condition type: '" + name + "'", e);
        }
    }
}
