package stableui.contract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.config.EngineConfig;
import stableui.controller.DecisionController;
import stableui.dom.ElementIndexer;
import stableui.driver.InputBackend;
import stableui.driver.StructuralDriver;
import stableui.gate.ChangeGate;
import stableui.state.StateTracker;
import stableui.vision.PerceptionBackend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open surfaces keyed by surface id. Each surface gets its own change gate, state
 * tracker and decision controller; the element indexer is shared.
 *
 * <p>{@link #close(String)} is the explicit teardown of a surface's state.
 */
public class SurfaceRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SurfaceRegistry.class);

    private final EngineConfig config;
    private final ElementIndexer indexer;
    private final Map<String, SurfaceSession> sessions = new ConcurrentHashMap<>();

    public SurfaceRegistry(EngineConfig config, ElementIndexer indexer) {
        this.config  = Objects.requireNonNull(config, "config");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
    }

    public SurfaceRegistry(EngineConfig config) {
        this(config, new ElementIndexer());
    }

    /**
     * Opens a surface. The gate captures frames through the driver's screenshot.
     *
     * @throws IllegalStateException if the surface is already open
     */
    public SurfaceSession open(String surfaceId, StructuralDriver driver, PerceptionBackend perception,
                               InputBackend input) {
        Objects.requireNonNull(surfaceId, "surfaceId");
        ChangeGate gate = new ChangeGate(surfaceId, driver::screenshot, config);
        StateTracker tracker = new StateTracker(surfaceId, config);
        DecisionController controller = new DecisionController(surfaceId, driver, perception, input,
                indexer, tracker, gate, config);
        SurfaceSession session = new SurfaceSession(surfaceId, gate, tracker, controller);
        if (sessions.putIfAbsent(surfaceId, session) != null) {
            controller.close();
            throw new IllegalStateException("Surface already open: " + surfaceId);
        }
        log.info("SurfaceRegistry: opened surface '{}'", surfaceId);
        return session;
    }

    /** Tears down a surface's gate, tracker and controller. Unknown ids are ignored. */
    public void close(String surfaceId) {
        SurfaceSession session = sessions.remove(surfaceId);
        if (session == null) {
            log.debug("SurfaceRegistry: close of unknown surface '{}' ignored", surfaceId);
            return;
        }
        session.close();
        log.info("SurfaceRegistry: closed surface '{}'", surfaceId);
    }

    public boolean isOpen(String surfaceId) {
        return surfaceId != null && sessions.containsKey(surfaceId);
    }

    /** @throws IllegalArgumentException if the surface is not open */
    public SurfaceSession require(String surfaceId) {
        SurfaceSession session = surfaceId == null ? null : sessions.get(surfaceId);
        if (session == null) {
            throw new IllegalArgumentException("Unknown surface: " + surfaceId);
        }
        return session;
    }

    public List<String> surfaceIds() {
        return new ArrayList<>(sessions.keySet());
    }

    @Override
    public void close() {
        for (String id : surfaceIds()) {
            close(id);
        }
    }
}
