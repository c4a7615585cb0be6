package stableui.model;

/**
 * Evaluated anchor. {@code method} is {@code null} when the anchor was not found.
 */
public record ScreenAnchor(
        String name,
        AnchorType type,
        ScreenRegion expectedRegion,
        boolean found,
        double confidence,
        DetectionMethod method,
        String detail) {

    public static ScreenAnchor notFound(AnchorSpec spec, String detail) {
        return new ScreenAnchor(spec.name(), spec.type(), spec.expectedRegion(), false, 0.0, null, detail);
    }

    public static ScreenAnchor found(AnchorSpec spec, double confidence, DetectionMethod method, String detail) {
        return new ScreenAnchor(spec.name(), spec.type(), spec.expectedRegion(), true, confidence, method, detail);
    }
}
