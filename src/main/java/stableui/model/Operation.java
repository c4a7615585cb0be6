package stableui.model;

import java.util.Objects;

/**
 * Closed set of operations a plan step can perform. Each variant carries only
 * the parameters it needs and validates them on construction.
 */
public sealed interface Operation
        permits Operation.Click, Operation.Type, Operation.Wait, Operation.Verify, Operation.Scroll {

    OperationKind kind();

    /** Whether the operation acts on a named target (and so needs one). */
    default boolean needsTarget() {
        return false;
    }

    record Click() implements Operation {
        @Override public OperationKind kind() { return OperationKind.CLICK; }
        @Override public boolean needsTarget() { return true; }
    }

    record Type(String text, boolean pressEnter) implements Operation {
        public Type {
            Objects.requireNonNull(text, "text");
        }
        @Override public OperationKind kind() { return OperationKind.TYPE; }
        @Override public boolean needsTarget() { return true; }

        /** Short preview for logs; typed text can be sensitive. */
        public String preview() {
            return text.length() <= 3 ? "***" : text.substring(0, 3) + "… (" + text.length() + " chars)";
        }
    }

    record Wait(long durationMs) implements Operation {
        public Wait {
            if (durationMs < 0) throw new IllegalArgumentException("Wait duration must be >= 0: " + durationMs);
        }
        @Override public OperationKind kind() { return OperationKind.WAIT; }
    }

    record Verify() implements Operation {
        @Override public OperationKind kind() { return OperationKind.VERIFY; }
    }

    /** Scrolls by a pixel delta, or brings the target into view when one is given. */
    record Scroll(int dx, int dy) implements Operation {
        @Override public OperationKind kind() { return OperationKind.SCROLL; }
    }

    static Operation click()                  { return new Click(); }
    static Operation type(String text)        { return new Type(text, false); }
    static Operation pause(long durationMs)   { return new Wait(durationMs); }
    static Operation verify()                 { return new Verify(); }
    static Operation scroll(int dx, int dy)   { return new Scroll(dx, dy); }
}
