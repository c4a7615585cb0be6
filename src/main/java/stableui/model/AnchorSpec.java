package stableui.model;

import java.util.Objects;

/**
 * Declarative anchor request: "this surface should show X".
 *
 * @param name           unique name within one analysis
 * @param type           what kind of evidence to look for
 * @param text           text to find ({@link AnchorType#TEXT}) or description to locate
 *                       ({@link AnchorType#TEMPLATE})
 * @param selector       selector to query ({@link AnchorType#ELEMENT})
 * @param expectedRegion rough expected position; {@link ScreenRegion#ANY} when not constrained
 */
public record AnchorSpec(String name, AnchorType type, String text, String selector, ScreenRegion expectedRegion) {

    public AnchorSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Anchor name must not be blank");
        }
        Objects.requireNonNull(type, "type");
        expectedRegion = expectedRegion == null ? ScreenRegion.ANY : expectedRegion;
        if (type == AnchorType.ELEMENT && (selector == null || selector.isBlank())) {
            throw new IllegalArgumentException("Element anchor '" + name + "' needs a selector");
        }
        if (type != AnchorType.ELEMENT && (text == null || text.isBlank())) {
            throw new IllegalArgumentException(type + " anchor '" + name + "' needs text");
        }
    }

    public static AnchorSpec text(String name, String text) {
        return new AnchorSpec(name, AnchorType.TEXT, text, null, ScreenRegion.ANY);
    }

    public static AnchorSpec element(String name, String selector) {
        return new AnchorSpec(name, AnchorType.ELEMENT, null, selector, ScreenRegion.ANY);
    }

    public AnchorSpec expectedAt(ScreenRegion region) {
        return new AnchorSpec(name, type, text, selector, region);
    }

    /** What perception is asked to locate when structural lookup fails. */
    public String description() {
        return text != null && !text.isBlank() ? text : selector;
    }
}
