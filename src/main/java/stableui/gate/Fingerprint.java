package stableui.gate;

import java.awt.image.BufferedImage;

/**
 * Low-resolution grayscale fingerprints and their comparison.
 *
 * <p>A fingerprint is a {@code size × size} grid sampled with nearest-neighbour
 * resampling; it is cheap to compute and insensitive to sub-cell noise, which is
 * all the gate needs.
 */
public final class Fingerprint {

    private Fingerprint() {}

    /**
     * Samples {@code image} down to a {@code size × size} grayscale grid (row-major, values 0–255).
     */
    public static int[] of(BufferedImage image, int size) {
        if (size <= 0) throw new IllegalArgumentException("Grid size must be positive: " + size);
        int width = image.getWidth();
        int height = image.getHeight();
        int[] grid = new int[size * size];
        for (int gy = 0; gy < size; gy++) {
            int sy = Math.min(height - 1, (int) ((gy + 0.5) * height / size));
            for (int gx = 0; gx < size; gx++) {
                int sx = Math.min(width - 1, (int) ((gx + 0.5) * width / size));
                grid[gy * size + gx] = luminance(image.getRGB(sx, sy));
            }
        }
        return grid;
    }

    /**
     * Fraction of cells whose values differ by more than {@code delta}.
     * Grids of different size are maximally different.
     */
    public static double diffRatio(int[] previous, int[] current, int delta) {
        if (previous == null || current == null || previous.length != current.length || current.length == 0) {
            return 1.0;
        }
        int differing = 0;
        for (int i = 0; i < current.length; i++) {
            if (Math.abs(previous[i] - current[i]) > delta) differing++;
        }
        return (double) differing / current.length;
    }

    /** ITU-R BT.601 luma of a packed RGB value. */
    static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >>  8) & 0xFF;
        int b =  rgb        & 0xFF;
        return (r * 299 + g * 587 + b * 114) / 1000;
    }
}
