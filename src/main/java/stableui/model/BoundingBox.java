package stableui.model;

/**
 * Screen coordinates and dimensions of an element's bounding rectangle.
 *
 * <p>Produced by perception (structural markup carries no layout), and used as
 * the coordinate fallback when an element has to be driven through raw input.
 */
public record BoundingBox(double x, double y, double width, double height) {

    public BoundingBox {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                    "BoundingBox dimensions must be non-negative: " + width + "x" + height);
        }
    }

    public double centerX() { return x + width / 2.0; }
    public double centerY() { return y + height / 2.0; }

    public boolean contains(double px, double py) {
        return px >= x && px <= x + width && py >= y && py <= y + height;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox{x=%.1f, y=%.1f, w=%.1f, h=%.1f}", x, y, width, height);
    }
}
