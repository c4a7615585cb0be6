package stableui.vision;

/**
 * Point located by perception, in the coordinates of the image it was found in.
 */
public record Location(int x, int y, double confidence) {

    public Location {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range [0,1]: " + confidence);
        }
    }

    /** Same location shifted by a region origin, for mapping back to viewport coordinates. */
    public Location offset(int dx, int dy) {
        return new Location(x + dx, y + dy, confidence);
    }
}
