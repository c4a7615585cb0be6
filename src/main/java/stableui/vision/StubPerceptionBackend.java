package stableui.vision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.model.InteractiveElement;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * No-op perception used when no vision endpoint is configured. Every lookup
 * comes back empty, so perceptual fallbacks fail cleanly.
 */
public class StubPerceptionBackend implements PerceptionBackend {

    private static final Logger log = LoggerFactory.getLogger(StubPerceptionBackend.class);

    @Override
    public Optional<Location> locate(BufferedImage image, String description) {
        log.debug("StubPerceptionBackend: locate('{}') -> empty (vision disabled)", description);
        return Optional.empty();
    }

    @Override
    public List<InteractiveElement> describeRegion(BufferedImage image) {
        log.debug("StubPerceptionBackend: describeRegion -> empty (vision disabled)");
        return List.of();
    }
}
