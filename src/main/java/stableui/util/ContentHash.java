package stableui.util;

import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic content hashes for markup and frames.
 *
 * <p>Images are streamed row by row through a fixed-size buffer, so hashing a
 * 4K frame allocates no more than hashing a thumbnail.
 */
public final class ContentHash {

    /** Hex characters kept from the SHA-256 digest. */
    public static final int HASH_LENGTH = 16;

    private static final int BUFFER_PIXELS = 1024;

    private ContentHash() {}

    public static String of(String text) {
        MessageDigest md = sha256();
        md.update((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
        return truncate(md.digest());
    }

    /**
     * Hashes the dimensions and RGB values of an image.
     */
    public static String of(BufferedImage image) {
        MessageDigest md = sha256();
        int width = image.getWidth();
        int height = image.getHeight();
        ByteBuffer header = ByteBuffer.allocate(8).putInt(width).putInt(height);
        md.update(header.array());

        int[] pixels = new int[Math.min(BUFFER_PIXELS, width)];
        ByteBuffer bytes = ByteBuffer.allocate(pixels.length * 4);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x += pixels.length) {
                int n = Math.min(pixels.length, width - x);
                image.getRGB(x, y, n, 1, pixels, 0, n);
                bytes.clear();
                for (int i = 0; i < n; i++) bytes.putInt(pixels[i]);
                md.update(bytes.array(), 0, n * 4);
            }
        }
        return truncate(md.digest());
    }

    private static String truncate(byte[] digest) {
        return HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
