package stableui.vision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.config.EngineConfig;

/**
 * Creates the configured {@link PerceptionBackend}.
 */
public final class PerceptionBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(PerceptionBackendFactory.class);

    private PerceptionBackendFactory() {}

    public static PerceptionBackend create(EngineConfig config) {
        if (!config.isVisionEnabled()) {
            log.info("Vision disabled (vision.enabled=false), using StubPerceptionBackend");
            return new StubPerceptionBackend();
        }
        log.info("Vision enabled, creating HttpPerceptionClient for {}", config.getVisionEndpoint());
        return HttpPerceptionClient.fromConfig(config);
    }
}
