package stableui.contract;

import stableui.controller.DecisionController;
import stableui.gate.ChangeGate;
import stableui.model.AnchorSpec;
import stableui.model.InteractiveElement;
import stableui.model.ScreenElement;
import stableui.model.ScreenState;
import stableui.model.TargetSpec;
import stableui.state.StateTracker;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the engine keeps for one open surface: its change gate, state
 * tracker and decision controller, plus the last analysed state and the anchor
 * and target descriptions it was built from.
 *
 * <p>Steps name their targets; the descriptions registered through analysis are
 * how those names are turned back into something the controller can look up.
 */
public final class SurfaceSession implements AutoCloseable {

    private final String surfaceId;
    private final ChangeGate gate;
    private final StateTracker tracker;
    private final DecisionController controller;

    private final Map<String, AnchorSpec> knownAnchors = new LinkedHashMap<>();
    private final Map<String, TargetSpec> knownTargets = new LinkedHashMap<>();
    private final Object runLock = new Object();

    private ScreenState cachedState;
    private List<AnchorSpec> cachedAnchors = List.of();
    private List<TargetSpec> cachedTargets = List.of();

    SurfaceSession(String surfaceId, ChangeGate gate, StateTracker tracker, DecisionController controller) {
        this.surfaceId  = surfaceId;
        this.gate       = gate;
        this.tracker    = tracker;
        this.controller = controller;
    }

    public String getSurfaceId()              { return surfaceId; }
    public ChangeGate getGate()               { return gate; }
    public StateTracker getTracker()          { return tracker; }
    public DecisionController getController() { return controller; }

    /** Held for the whole of a plan run or a state analysis on this surface. */
    Object runLock() {
        return runLock;
    }

    // ── Cached analysis ───────────────────────────────────────────────────

    /** Cached state, if it was built from exactly these anchors and targets. */
    synchronized Optional<ScreenState> cachedFor(List<AnchorSpec> anchors, List<TargetSpec> targets) {
        if (cachedState == null) return Optional.empty();
        if (!cachedAnchors.equals(anchors) || !cachedTargets.equals(targets)) return Optional.empty();
        return Optional.of(cachedState);
    }

    synchronized void cache(ScreenState state, List<AnchorSpec> anchors, List<TargetSpec> targets) {
        this.cachedState   = state;
        this.cachedAnchors = List.copyOf(anchors);
        this.cachedTargets = List.copyOf(targets);
        anchors.forEach(a -> knownAnchors.put(a.name(), a));
        targets.forEach(t -> knownTargets.put(t.name(), t));
    }

    public synchronized Optional<ScreenState> lastState() {
        return Optional.ofNullable(cachedState);
    }

    synchronized void invalidate() {
        cachedState = null;
    }

    // ── Name resolution ───────────────────────────────────────────────────

    synchronized List<AnchorSpec> knownAnchors() {
        return List.copyOf(knownAnchors.values());
    }

    synchronized List<TargetSpec> knownTargets() {
        return List.copyOf(knownTargets.values());
    }

    synchronized Optional<AnchorSpec> anchorSpec(String name) {
        return Optional.ofNullable(knownAnchors.get(name));
    }

    /**
     * Description of a named target: the registered description, sharpened with the
     * selector synthesised for it in {@code state}; a bare text match on the name
     * when nothing was registered.
     */
    synchronized TargetSpec targetSpec(String name, ScreenState state) {
        TargetSpec known = knownTargets.get(name);
        String selector = state == null ? null : state.element(name)
                .map(ScreenElement::element)
                .filter(InteractiveElement::hasSelector)
                .map(InteractiveElement::selector)
                .orElse(null);
        if (known == null) {
            return selector == null
                    ? TargetSpec.named(name)
                    : new TargetSpec(name, selector, name, null, null);
        }
        if (selector == null || known.hasSelector()) return known;
        return new TargetSpec(name, selector, known.text(), known.role(), known.description());
    }

    @Override
    public synchronized void close() {
        controller.close();
        gate.reset();
        tracker.clear();
        cachedState = null;
        knownAnchors.clear();
        knownTargets.clear();
    }
}
