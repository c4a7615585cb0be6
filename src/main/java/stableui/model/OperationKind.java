package stableui.model;

import java.util.Locale;

public enum OperationKind {
    CLICK, TYPE, WAIT, VERIFY, SCROLL;

    public static OperationKind fromName(String name) {
        if (name == null) throw new IllegalArgumentException("Operation must not be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown operation: '" + name + "'", e);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
