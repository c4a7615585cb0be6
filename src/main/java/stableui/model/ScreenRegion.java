package stableui.model;

import java.util.Locale;

/**
 * Rough expected location of an anchor, expressed as a cell of a 3×3 split of
 * the frame. {@link #ANY} accepts every position.
 */
public enum ScreenRegion {
    TOP_LEFT(0, 0), TOP(1, 0), TOP_RIGHT(2, 0),
    LEFT(0, 1), CENTER(1, 1), RIGHT(2, 1),
    BOTTOM_LEFT(0, 2), BOTTOM(1, 2), BOTTOM_RIGHT(2, 2),
    ANY(-1, -1);

    private final int column;
    private final int row;

    ScreenRegion(int column, int row) {
        this.column = column;
        this.row = row;
    }

    /**
     * Returns whether the point lies in this region of a frame of the given size.
     * Frames with unknown size (non-positive dimensions) always match.
     */
    public boolean contains(double x, double y, double frameWidth, double frameHeight) {
        if (this == ANY || frameWidth <= 0 || frameHeight <= 0) return true;
        int col = Math.min(2, Math.max(0, (int) (x * 3 / frameWidth)));
        int r   = Math.min(2, Math.max(0, (int) (y * 3 / frameHeight)));
        return col == column && r == row;
    }

    /** Parses {@code top_left}, {@code top-left}, {@code center} and so on; {@code null} maps to {@link #ANY}. */
    public static ScreenRegion fromName(String name) {
        if (name == null || name.isBlank()) return ANY;
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (key.equals("MIDDLE")) return CENTER;
        try {
            return valueOf(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown screen region: '" + name + "'", e);
        }
    }
}
