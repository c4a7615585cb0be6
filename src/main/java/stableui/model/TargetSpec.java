package stableui.model;

import java.util.Locale;

/**
 * Named target an analysis should look for, or an action should act on.
 * At least one of selector, text, role or description must be present.
 */
public record TargetSpec(String name, String selector, String text, String role, String description) {

    public TargetSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Target name must not be blank");
        }
        if (isBlank(selector) && isBlank(text) && isBlank(role) && isBlank(description)) {
            throw new IllegalArgumentException("Target '" + name + "' has nothing to match on");
        }
        role = role == null ? null : role.trim().toLowerCase(Locale.ROOT);
    }

    /** Target matched by its visible text, which is also its name. */
    public static TargetSpec named(String name) {
        return new TargetSpec(name, null, name, null, null);
    }

    public static TargetSpec bySelector(String name, String selector) {
        return new TargetSpec(name, selector, null, null, null);
    }

    public static TargetSpec byText(String name, String text) {
        return new TargetSpec(name, null, text, null, null);
    }

    public static TargetSpec byRole(String name, String role, String text) {
        return new TargetSpec(name, null, text, role, null);
    }

    public boolean hasSelector() { return !isBlank(selector); }
    public boolean hasText()     { return !isBlank(text); }
    public boolean hasRole()     { return !isBlank(role); }

    /** Whether the structural path has anything to look up. */
    public boolean isStructurallyAddressable() {
        return hasSelector() || hasText() || hasRole();
    }

    /** Free-text description handed to perception. */
    public String describe() {
        if (!isBlank(description)) return description;
        StringBuilder sb = new StringBuilder();
        if (hasRole()) sb.append(role).append(' ');
        sb.append(hasText() ? "'" + text + "'" : name);
        return sb.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
