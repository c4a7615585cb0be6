package stableui.model;

/**
 * Metadata recorded alongside a structural hash.
 *
 * @param overlayPresent a dismissible overlay (consent banner and the like) is showing
 * @param modalPresent   a modal dialog is open
 * @param location       URL or window title, {@code null} when not known
 */
public record SurfaceFlags(boolean overlayPresent, boolean modalPresent, String location) {

    public static final SurfaceFlags NONE = new SurfaceFlags(false, false, null);

    public static SurfaceFlags at(String location) {
        return new SurfaceFlags(false, false, location);
    }
}
