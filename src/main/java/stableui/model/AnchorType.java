package stableui.model;

import java.util.Locale;

/** Kind of evidence an anchor looks for. */
public enum AnchorType {
    /** Visible text somewhere on the surface. */
    TEXT,
    /** An element matching a selector. */
    ELEMENT,
    /** A visual template; perceptual only, located by description. */
    TEMPLATE;

    /** Parses the lower-case wire name ({@code text}, {@code element}, {@code template}). */
    public static AnchorType fromName(String name) {
        if (name == null) throw new IllegalArgumentException("Anchor type must not be null");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "text"              -> TEXT;
            case "element", "selector" -> ELEMENT;
            case "template", "icon"  -> TEMPLATE;
            default -> throw new IllegalArgumentException("Unknown anchor type: '" + name + "'");
        };
    }
}
