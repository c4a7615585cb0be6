package stableui.model;

/**
 * Integer pixel rectangle used as a region of interest for captures.
 * A {@code null} region everywhere in the engine means "full frame".
 */
public record Region(int x, int y, int width, int height) {

    public Region {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Region origin must be non-negative: (" + x + ", " + y + ")");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region must have a positive size: " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return "Region{" + x + "," + y + " " + width + "x" + height + "}";
    }
}
