package stableui.vision;

import stableui.model.InteractiveElement;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Image-based element location. Best effort: implementations return empty results
 * rather than throwing when they cannot answer, and confidences may be low.
 * Default implementation is {@link StubPerceptionBackend}.
 */
public interface PerceptionBackend {

    /**
     * Locates the element matching a free-text description.
     *
     * @return the location with the backend's confidence, or empty if nothing matched
     */
    Optional<Location> locate(BufferedImage image, String description);

    /**
     * Lists the interactive elements visible in the image. Returned elements have
     * no selector and carry a bounding box in image coordinates.
     */
    List<InteractiveElement> describeRegion(BufferedImage image);
}
