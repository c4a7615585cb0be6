package stableui.driver;

/**
 * Unchecked exception raised by {@link StructuralDriver} and {@link InputBackend}
 * implementations. The {@link Kind} tells the caller whether a fallback or a
 * retry can help.
 */
public class DriverException extends RuntimeException {

    public enum Kind {
        /** Markup or frame could not be obtained. */
        CAPTURE,
        /** The call reached the surface and failed there. */
        EXECUTION,
        /** The call did not complete in time. */
        TIMEOUT,
        /** The selector could not be parsed. */
        INVALID_SELECTOR
    }

    private final Kind kind;

    public DriverException(Kind kind, String msg) {
        super(msg);
        this.kind = kind;
    }

    public DriverException(Kind kind, String msg, Throwable cause) {
        super(msg, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
