package stableui.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One candidate UI target found by the element indexer or by perception.
 *
 * <p>{@code text} keeps the original casing for display; {@code normalizedText}
 * is whitespace-collapsed and case-folded and is the only form used for matching.
 * Elements belong to the result set that produced them and are compared by
 * selector and text, never by identity.
 *
 * <p>{@code confidence} is 1.0 for elements parsed from markup and the backend's
 * estimate for perceived ones.
 */
public record InteractiveElement(
        String id,
        String tag,
        String role,
        String text,
        String normalizedText,
        String ariaLabel,
        String placeholder,
        BoundingBox boundingBox,
        String selector,
        SelectorStrategy selectorStrategy,
        double confidence) {

    public InteractiveElement {
        Objects.requireNonNull(id, "id");
        tag = tag == null ? "" : tag.toLowerCase(Locale.ROOT);
        text = text == null ? "" : text;
        normalizedText = normalizedText == null ? "" : normalizedText;
        selectorStrategy = selectorStrategy == null ? SelectorStrategy.NONE : selectorStrategy;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range [0,1]: " + confidence);
        }
    }

    /** Builds an element parsed from markup. */
    public static InteractiveElement structural(String id, String tag, String role, String text,
                                                String normalizedText, String ariaLabel, String placeholder,
                                                String selector, SelectorStrategy strategy) {
        return new InteractiveElement(id, tag, role, text, normalizedText, ariaLabel, placeholder,
                null, selector, strategy, 1.0);
    }

    /**
     * Builds an element reported by perception: no selector, coordinates only.
     */
    public static InteractiveElement perceived(String id, String role, String text, BoundingBox box,
                                               double confidence) {
        String display = text == null ? "" : text.trim().replaceAll("\\s+", " ");
        return new InteractiveElement(id, "", role, display, display.toLowerCase(Locale.ROOT),
                null, null, box, null, SelectorStrategy.NONE, confidence);
    }

    public boolean hasSelector() {
        return selector != null && !selector.isBlank();
    }

    /** Label if present, otherwise text, otherwise placeholder. */
    public String displayName() {
        if (ariaLabel != null && !ariaLabel.isBlank()) return ariaLabel;
        if (!text.isBlank()) return text;
        return placeholder != null ? placeholder : "";
    }

    @Override
    public String toString() {
        String name = displayName();
        if (name.length() > 30) name = name.substring(0, 30) + "…";
        return String.format("InteractiveElement{%s role=%s '%s' %s}", tag, role, name,
                hasSelector() ? selector : "(no selector)");
    }
}
