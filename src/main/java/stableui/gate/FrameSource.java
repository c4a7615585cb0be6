package stableui.gate;

import stableui.model.Region;

import java.awt.image.BufferedImage;

/**
 * Supplies the current frame of a surface to a {@link ChangeGate}.
 */
@FunctionalInterface
public interface FrameSource {

    /**
     * Captures the current frame.
     *
     * @param region region of interest, or {@code null} for the full frame
     * @return the captured image, never {@code null} on success
     * @throws RuntimeException if the frame cannot be obtained
     */
    BufferedImage capture(Region region);
}
