package stableui.controller;

import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.config.EngineConfig;
import stableui.dom.ElementIndex;
import stableui.dom.ElementIndexer;
import stableui.dom.TextNormalizer;
import stableui.driver.DriverException;
import stableui.driver.InputBackend;
import stableui.driver.StructuralDriver;
import stableui.gate.ChangeGate;
import stableui.model.AnchorSpec;
import stableui.model.AnchorType;
import stableui.model.BoundingBox;
import stableui.model.DetectionMethod;
import stableui.model.FailureKind;
import stableui.model.InteractiveElement;
import stableui.model.Observation;
import stableui.model.Operation;
import stableui.model.Region;
import stableui.model.ScreenAnchor;
import stableui.model.ScreenElement;
import stableui.model.ScreenRegion;
import stableui.model.ScreenState;
import stableui.model.SelectorStrategy;
import stableui.model.TargetSpec;
import stableui.state.StateTracker;
import stableui.util.Deadline;
import stableui.vision.Location;
import stableui.vision.PerceptionBackend;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Arbitrates, per action, between structural and perceptual execution on one surface.
 *
 * <p>For every action:
 * <ol>
 *   <li>refresh the element index from the current markup, dismissing known overlays
 *       first on a new surface or when one is showing</li>
 *   <li>resolve the target structurally (explicit selector, then text, then role) and,
 *       if found, act through the structural driver</li>
 *   <li>if the target is not structurally addressable, not found, or the structural call
 *       fails or times out, capture a screenshot, ask perception to locate the target
 *       and act through coordinate input</li>
 *   <li>re-observe the surface, feed the state tracker, and compare against the
 *       expected outcome if one was given</li>
 * </ol>
 * Every collaborator call is bounded by {@code action.timeout.ms} and by the caller's
 * {@link Deadline}. Failures are returned as {@link ActionOutcome}s, never thrown.
 *
 * <p>When the tracker reports a loop right after a structural action on a target,
 * the next action on that target goes to perception first. After
 * {@code tracker.loop.recovery.threshold} consecutive loop warnings the surface's
 * change gate is reset so the next analysis cannot be served from cache.
 *
 * <p>Also produces {@link ScreenState}s for the contract layer via {@link #analyze}.
 */
public class DecisionController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DecisionController.class);

    private final String surfaceId;
    private final StructuralDriver driver;
    private final PerceptionBackend perception;
    private final InputBackend input;
    private final ElementIndexer indexer;
    private final StateTracker tracker;
    private final ChangeGate gate;
    private final OverlayDismisser dismisser;
    private final long actionTimeoutMs;
    private final double perceptionMinConfidence;
    private final int loopRecoveryThreshold;
    private final BoundedCalls calls;

    /** Targets whose next action skips the structural path. */
    private final Set<String> perceptionFirst = new HashSet<>();

    private boolean firstAction = true;
    private String lastLocation;
    private Snapshot lastSnapshot;

    private long structuralActions;
    private long perceptualActions;
    private long fallbacks;
    private long verificationsPassed;
    private long verificationsFailed;
    private long overlaysDismissed;
    private long loopsDetected;

    public DecisionController(String surfaceId, StructuralDriver driver, PerceptionBackend perception,
                              InputBackend input, ElementIndexer indexer, StateTracker tracker,
                              ChangeGate gate, EngineConfig config) {
        this.surfaceId  = Objects.requireNonNull(surfaceId, "surfaceId");
        this.driver     = Objects.requireNonNull(driver, "driver");
        this.perception = Objects.requireNonNull(perception, "perception");
        this.input      = Objects.requireNonNull(input, "input");
        this.indexer    = Objects.requireNonNull(indexer, "indexer");
        this.tracker    = Objects.requireNonNull(tracker, "tracker");
        this.gate       = Objects.requireNonNull(gate, "gate");
        this.dismisser  = config.isOverlayDismissEnabled()
                ? new OverlayDismisser(driver, config.getOverlayDismissSelectors())
                : null;
        this.actionTimeoutMs         = config.getActionTimeoutMs();
        this.perceptionMinConfidence = config.getPerceptionMinConfidence();
        this.loopRecoveryThreshold   = Math.max(1, config.getLoopRecoveryThreshold());
        this.calls = new BoundedCalls(surfaceId);
    }

    // ── Actions ───────────────────────────────────────────────────────────

    public ActionOutcome execute(ActionRequest request) {
        return execute(request, Deadline.none());
    }

    /**
     * Executes one action. Never throws for driver, perception or input failures.
     */
    public synchronized ActionOutcome execute(ActionRequest request, Deadline deadline) {
        long start = System.nanoTime();
        log.info("DecisionController[{}]: {}", surfaceId, request.describe());

        if (deadline.exhausted()) {
            return outcome(start, ExecutionMethod.STRUCTURAL, Attempt.fail(FailureKind.DEADLINE_EXCEEDED,
                    "deadline exhausted before " + request.describe()), false, null, false);
        }

        Snapshot before = prepareSurface(deadline);
        ElementIndex index = before == null ? ElementIndex.empty() : before.index();

        TargetSpec target = request.target();
        boolean skipStructural = target != null && perceptionFirst.remove(target.name());
        boolean addressable = target == null || target.isStructurallyAddressable();

        Attempt attempt = null;
        boolean triedStructural = false;
        if (skipStructural) {
            log.info("DecisionController[{}]: '{}' looped last time, going to perception first",
                    surfaceId, target.name());
        } else if (addressable) {
            triedStructural = true;
            structuralActions++;
            attempt = attemptStructural(request, index, deadline);
        }

        ExecutionMethod method = ExecutionMethod.STRUCTURAL;
        boolean fellBack = false;
        if (attempt == null || !attempt.success()) {
            if (triedStructural) {
                fellBack = true;
                fallbacks++;
                log.info("DecisionController[{}]: structural {} failed ({}), falling back to perception",
                        surfaceId, request.describe(), attempt.message());
            }
            method = ExecutionMethod.PERCEPTUAL;
            if (deadline.exhausted()) {
                return outcome(start, method, Attempt.fail(FailureKind.DEADLINE_EXCEEDED,
                        "deadline exhausted before perceptual " + request.describe()), fellBack, null, false);
            }
            perceptualActions++;
            attempt = attemptPerceptual(request, deadline);
        }

        Observation beforeObs = before == null ? null : before.toObservation(surfaceId);
        Observation after = recordObservation(deadline);
        boolean loop = after != null && checkLoop(target, method);

        Boolean verified = null;
        if (attempt.success() && request.expected() != null) {
            verified = verify(request.expected(), beforeObs, after);
            if (verified) {
                verificationsPassed++;
            } else {
                verificationsFailed++;
                log.warn("DecisionController[{}]: expected outcome not observed after {}",
                        surfaceId, request.describe());
            }
        }
        return outcome(start, method, attempt, fellBack, verified, loop);
    }

    // ── Analysis ──────────────────────────────────────────────────────────

    /**
     * Evaluates anchors and targets against the current surface. Structural lookups
     * come first; perception is consulted only when something is not found
     * structurally, and the screenshot and element description are fetched at most
     * once per call.
     *
     * @param minConfidence targets below this confidence are reported missing
     */
    public synchronized ScreenState analyze(List<AnchorSpec> anchors, List<TargetSpec> targets,
                                            double minConfidence, Deadline deadline) {
        ScreenState.requireDistinctNames(anchors, targets);
        List<String> warnings = new ArrayList<>();
        ElementIndex index;
        try {
            lastSnapshot = snapshot(deadline);
            index = lastSnapshot.index();
        } catch (DriverException e) {
            log.warn("DecisionController[{}]: markup unavailable for analysis: {}", surfaceId, e.getMessage());
            warnings.add("Markup unavailable (" + e.getKind() + "): " + e.getMessage());
            index = ElementIndex.empty();
        }
        PerceptionPass pass = new PerceptionPass(deadline, warnings);

        List<ScreenAnchor> anchorResults = new ArrayList<>();
        for (AnchorSpec spec : anchors) {
            anchorResults.add(evaluateAnchor(spec, index, pass, minConfidence, warnings));
        }

        List<ScreenElement> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (TargetSpec spec : targets) {
            ScreenElement element = evaluateTarget(spec, index, pass, deadline);
            if (element != null && element.confidence() >= minConfidence) {
                found.add(element);
            } else {
                missing.add(spec.name());
                warnings.add(element == null
                        ? "Target '" + spec.name() + "' not found"
                        : String.format("Target '%s' below confidence (%.2f < %.2f)",
                                spec.name(), element.confidence(), minConfidence));
            }
        }

        if (index.overlayPresent()) {
            warnings.add("Dismissible overlay present");
        }
        if (tracker.status() == StateTracker.Status.LOOPING) {
            warnings.add("Loop detected: recent actions left the surface unchanged ("
                    + tracker.consecutiveLoopWarnings() + " consecutive warnings)");
        }

        ScreenState state = new ScreenState(surfaceId, Instant.now(), anchorResults, found, warnings, missing,
                index.structuralHash());
        log.info("DecisionController[{}]: analysed {} anchors ({} found), {} targets ({} missing)",
                surfaceId, anchorResults.size(), anchorResults.stream().filter(ScreenAnchor::found).count(),
                targets.size(), missing.size());
        return state;
    }

    // ── Probes used by condition evaluation ───────────────────────────────

    /** Fresh index of the current markup. */
    public synchronized ElementIndex currentIndex(Deadline deadline) {
        lastSnapshot = snapshot(deadline);
        return lastSnapshot.index();
    }

    /** Structural hash of the current markup, empty if it cannot be read. */
    public Optional<String> currentHash(Deadline deadline) {
        try {
            return Optional.of(currentIndex(deadline).structuralHash());
        } catch (DriverException e) {
            log.warn("DecisionController[{}]: structural hash unavailable: {}", surfaceId, e.getMessage());
            return Optional.empty();
        }
    }

    /** Current value of the target field, empty if the target cannot be resolved. */
    public synchronized Optional<String> fieldValue(TargetSpec target, Deadline deadline) {
        return readNode(target, deadline, "valueOf", node -> driver.valueOf(node));
    }

    /** Computed CSS property of the target, empty if the target cannot be resolved. */
    public synchronized Optional<String> cssValue(TargetSpec target, String property, Deadline deadline) {
        return readNode(target, deadline, "cssValue", node -> driver.cssValue(node, property));
    }

    /** Perceptual text search over the full viewport. */
    public synchronized Optional<Location> locateText(String text, Deadline deadline) {
        try {
            return perceive("text '" + text + "'", null, deadline);
        } catch (DriverException e) {
            log.warn("DecisionController[{}]: perceptual text search failed: {}", surfaceId, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public synchronized ControllerStats stats() {
        return new ControllerStats(structuralActions, perceptualActions, fallbacks,
                verificationsPassed, verificationsFailed, overlaysDismissed, loopsDetected);
    }

    public String getSurfaceId()      { return surfaceId; }
    public StateTracker getTracker()  { return tracker; }
    public ChangeGate getGate()       { return gate; }
    public double getPerceptionMinConfidence() { return perceptionMinConfidence; }

    @Override
    public void close() {
        calls.close();
    }

    // ── Surface preparation and observation ───────────────────────────────

    private Snapshot prepareSurface(Deadline deadline) {
        Snapshot snap = snapshotQuietly(deadline);
        String location = snap == null ? null : snap.location();
        boolean newSurface = firstAction || !Objects.equals(location, lastLocation);
        firstAction = false;
        lastLocation = location;

        boolean overlayShowing = snap != null && snap.index().overlayPresent();
        if (dismisser != null && (newSurface || overlayShowing)) {
            try {
                String clicked = calls.call("dismissOverlays", timeout(deadline), dismisser::dismiss);
                if (clicked != null) {
                    overlaysDismissed++;
                    snap = snapshotQuietly(deadline);
                }
            } catch (DriverException e) {
                log.debug("DecisionController[{}]: overlay dismissal skipped: {}", surfaceId, e.getMessage());
            }
        }
        return snap;
    }

    private Snapshot snapshot(Deadline deadline) {
        String markup = calls.call("getMarkup", timeout(deadline), driver::getMarkup);
        String location;
        try {
            location = calls.call("location", timeout(deadline), driver::location);
        } catch (DriverException e) {
            location = null;
        }
        return new Snapshot(indexer.index(markup), location);
    }

    private Snapshot snapshotQuietly(Deadline deadline) {
        try {
            lastSnapshot = snapshot(deadline);
            return lastSnapshot;
        } catch (DriverException e) {
            log.warn("DecisionController[{}]: markup capture failed: {}", surfaceId, e.getMessage());
            return null;
        }
    }

    private Observation recordObservation(Deadline deadline) {
        Snapshot snap = snapshotQuietly(deadline);
        if (snap == null) return null;
        ElementIndex index = snap.index();
        return tracker.observe(surfaceId, index.structuralHash(), index.selectors(), index.flags(snap.location()));
    }

    private boolean checkLoop(TargetSpec target, ExecutionMethod method) {
        if (!tracker.detectLoop()) return false;
        loopsDetected++;
        if (method == ExecutionMethod.STRUCTURAL && target != null) {
            perceptionFirst.add(target.name());
            log.info("DecisionController[{}]: loop after structural action on '{}', next attempt uses perception",
                    surfaceId, target.name());
        }
        if (tracker.consecutiveLoopWarnings() >= loopRecoveryThreshold) {
            log.info("DecisionController[{}]: {} consecutive loop warnings, forcing full re-analysis",
                    surfaceId, tracker.consecutiveLoopWarnings());
            gate.reset();
            tracker.acknowledgeLoop();
        }
        return true;
    }

    private boolean verify(ExpectedOutcome expected, Observation before, Observation after) {
        if (after == null) {
            log.warn("DecisionController[{}]: cannot re-observe surface for verification", surfaceId);
            return false;
        }
        if (expected.locationContains() != null) {
            String location = after.getFlags().location();
            if (location == null || !location.contains(expected.locationContains())) return false;
        }
        if (expected.textPresent() != null
                && (lastSnapshot == null || !lastSnapshot.index().containsText(expected.textPresent()))) {
            return false;
        }
        if (expected.selectorPresent() != null && !after.getSelectors().contains(expected.selectorPresent())) {
            return false;
        }
        if (expected.requireChange()) {
            return before != null && StateTracker.diff(before, after).hasSignificantChange();
        }
        return true;
    }

    // ── Structural path ───────────────────────────────────────────────────

    private Attempt attemptStructural(ActionRequest request, ElementIndex index, Deadline deadline) {
        Operation op = request.operation();
        try {
            if (request.target() == null) {
                Operation.Scroll scroll = (Operation.Scroll) op;
                calls.run("scrollBy", timeout(deadline), () -> driver.scrollBy(scroll.dx(), scroll.dy()));
                return Attempt.ok();
            }
            Optional<WebElement> node = resolveNode(request.target(), index, deadline);
            if (node.isEmpty()) {
                return Attempt.fail(FailureKind.TARGET_NOT_FOUND,
                        "no structural match for " + request.target().describe());
            }
            WebElement element = node.get();
            if (op instanceof Operation.Type type) {
                calls.run("fill", timeout(deadline), () -> driver.fill(element, type.text()));
                if (type.pressEnter()) {
                    calls.run("pressEnter", timeout(deadline), () -> driver.pressEnter(element));
                }
            } else if (op instanceof Operation.Scroll) {
                calls.run("scrollIntoView", timeout(deadline), () -> driver.scrollIntoView(element));
            } else {
                calls.run("click", timeout(deadline), () -> driver.click(element));
            }
            return Attempt.ok();
        } catch (DriverException e) {
            return Attempt.fail(kindOf(e), e.getMessage());
        }
    }

    private Optional<WebElement> resolveNode(TargetSpec target, ElementIndex index, Deadline deadline) {
        String selector = target.hasSelector()
                ? target.selector()
                : resolveElement(target, index).map(InteractiveElement::selector).orElse(null);
        if (selector == null) return Optional.empty();
        log.debug("DecisionController[{}]: '{}' resolved to {}", surfaceId, target.name(), selector);
        List<WebElement> nodes = calls.call("queryAll", timeout(deadline), () -> driver.queryAll(selector));
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    /**
     * Finds an indexed element for the target: by selector, then by text (exact, then
     * fuzzy), then by role. A role narrows a text match.
     */
    static Optional<InteractiveElement> resolveElement(TargetSpec target, ElementIndex index) {
        if (target.hasSelector()) {
            return index.findBySelector(target.selector());
        }
        List<InteractiveElement> candidates;
        if (target.hasText()) {
            candidates = index.findByText(target.text());
            if (candidates.isEmpty()) candidates = index.findByText(target.text(), true);
            if (target.hasRole()) {
                candidates = candidates.stream().filter(e -> target.role().equals(e.role())).toList();
            }
        } else if (target.hasRole()) {
            candidates = index.findByRole(target.role());
        } else {
            candidates = List.of();
        }
        return candidates.stream().filter(InteractiveElement::hasSelector).findFirst();
    }

    private <T> Optional<T> readNode(TargetSpec target, Deadline deadline, String what,
                                     Function<WebElement, T> read) {
        try {
            ElementIndex index = lastSnapshot != null ? lastSnapshot.index() : currentIndex(deadline);
            Optional<WebElement> node = resolveNode(target, index, deadline);
            if (node.isEmpty()) return Optional.empty();
            WebElement element = node.get();
            return Optional.ofNullable(calls.call(what, timeout(deadline), () -> read.apply(element)));
        } catch (DriverException e) {
            log.warn("DecisionController[{}]: {} on '{}' failed: {}", surfaceId, what, target.name(), e.getMessage());
            return Optional.empty();
        }
    }

    // ── Perceptual path ───────────────────────────────────────────────────

    private Attempt attemptPerceptual(ActionRequest request, Deadline deadline) {
        Operation op = request.operation();
        try {
            if (request.target() == null) {
                Operation.Scroll scroll = (Operation.Scroll) op;
                calls.run("input.scroll", timeout(deadline), () -> input.scroll(scroll.dx(), scroll.dy()));
                return Attempt.ok();
            }

            String description = request.target().describe();
            Optional<Location> located;
            try {
                located = perceive(description, request.roi(), deadline);
            } catch (DriverException e) {
                if (request.hint() == null) {
                    return Attempt.fail(FailureKind.CAPTURE_FAILURE, "screenshot failed: " + e.getMessage());
                }
                located = Optional.empty();
            }

            Location point;
            if (located.isPresent() && located.get().confidence() >= perceptionMinConfidence) {
                point = located.get();
            } else if (request.hint() != null) {
                BoundingBox box = request.hint();
                point = new Location((int) Math.round(box.centerX()), (int) Math.round(box.centerY()), 0.0);
                log.info("DecisionController[{}]: perception did not confirm {}, using known position ({}, {})",
                        surfaceId, description, point.x(), point.y());
            } else if (located.isPresent()) {
                return Attempt.fail(FailureKind.TARGET_NOT_FOUND, String.format(
                        "perception confidence %.2f below %.2f for %s",
                        located.get().confidence(), perceptionMinConfidence, description));
            } else {
                return Attempt.fail(FailureKind.TARGET_NOT_FOUND, "perception could not locate " + description);
            }

            int x = point.x();
            int y = point.y();
            if (op instanceof Operation.Type type) {
                calls.run("input.click", timeout(deadline), () -> input.click(x, y));
                calls.run("input.typeText", timeout(deadline), () -> input.typeText(type.text()));
                if (type.pressEnter()) {
                    calls.run("input.pressEnter", timeout(deadline), input::pressEnter);
                }
            } else if (op instanceof Operation.Scroll scroll) {
                calls.run("input.moveTo", timeout(deadline), () -> input.moveTo(x, y));
                calls.run("input.scroll", timeout(deadline), () -> input.scroll(scroll.dx(), scroll.dy()));
            } else {
                calls.run("input.click", timeout(deadline), () -> input.click(x, y));
            }
            return Attempt.ok();
        } catch (DriverException e) {
            return Attempt.fail(kindOf(e), e.getMessage());
        }
    }

    /**
     * Screenshots the region (or full viewport) and asks perception for the description.
     * The result is in viewport coordinates.
     *
     * @throws DriverException if the screenshot cannot be taken
     */
    private Optional<Location> perceive(String description, Region roi, Deadline deadline) {
        BufferedImage frame = calls.call("screenshot", timeout(deadline), () -> driver.screenshot(roi));
        Optional<Location> located;
        try {
            located = calls.call("locate", timeout(deadline), () -> perception.locate(frame, description));
        } catch (DriverException e) {
            log.warn("DecisionController[{}]: perception failed for {}: {}", surfaceId, description, e.getMessage());
            return Optional.empty();
        }
        if (located == null) return Optional.empty();
        return roi == null ? located : located.map(l -> l.offset(roi.x(), roi.y()));
    }

    // ── Analysis helpers ──────────────────────────────────────────────────

    private ScreenAnchor evaluateAnchor(AnchorSpec spec, ElementIndex index, PerceptionPass pass,
                                        double minConfidence, List<String> warnings) {
        if (spec.type() == AnchorType.TEXT && index.containsText(spec.text())) {
            return ScreenAnchor.found(spec, 1.0, DetectionMethod.STRUCTURAL, "text in markup");
        }
        if (spec.type() == AnchorType.ELEMENT) {
            if (index.findBySelector(spec.selector()).isPresent() || queryMatches(spec.selector(), pass.deadline)) {
                return ScreenAnchor.found(spec, 1.0, DetectionMethod.STRUCTURAL, "selector matched");
            }
            return ScreenAnchor.notFound(spec, "selector did not match");
        }

        Optional<PerceivedPoint> perceived = spec.type() == AnchorType.TEXT
                ? pass.findText(spec.text())
                : pass.locate(spec.text());
        if (perceived.isEmpty()) {
            return ScreenAnchor.notFound(spec, "not found structurally or perceptually");
        }
        PerceivedPoint p = perceived.get();
        if (p.confidence() < minConfidence) {
            return ScreenAnchor.notFound(spec, String.format("perceived with low confidence %.2f", p.confidence()));
        }
        if (!spec.expectedRegion().contains(p.x(), p.y(), pass.frameWidth(), pass.frameHeight())) {
            warnings.add("Anchor '" + spec.name() + "' found outside expected region " + spec.expectedRegion());
        }
        return ScreenAnchor.found(spec, p.confidence(), DetectionMethod.PERCEPTUAL, "perceived at " + p.x() + "," + p.y());
    }

    private ScreenElement evaluateTarget(TargetSpec spec, ElementIndex index, PerceptionPass pass, Deadline deadline) {
        InteractiveElement structural = resolveElement(spec, index).orElse(null);
        if (structural == null && spec.hasSelector() && queryMatches(spec.selector(), deadline)) {
            structural = new InteractiveElement(spec.name(), "", spec.role(), spec.text(), null, null, null,
                    null, spec.selector(), SelectorStrategy.NONE, 1.0);
        }

        if (structural != null) {
            // Perception already ran for another item: cross-check for free.
            Optional<PerceivedPoint> seen = pass.started() ? pass.findElement(spec) : Optional.empty();
            if (seen.isPresent()) {
                InteractiveElement combined = new InteractiveElement(structural.id(), structural.tag(),
                        structural.role(), structural.text(), structural.normalizedText(), structural.ariaLabel(),
                        structural.placeholder(), seen.get().box(), structural.selector(),
                        structural.selectorStrategy(), 1.0);
                return new ScreenElement(spec.name(), combined, 1.0, DetectionMethod.COMBINED);
            }
            return new ScreenElement(spec.name(), structural, 1.0, DetectionMethod.STRUCTURAL);
        }

        Optional<PerceivedPoint> perceived = pass.findElement(spec);
        if (perceived.isEmpty()) perceived = pass.locate(spec.describe());
        if (perceived.isEmpty()) return null;

        PerceivedPoint p = perceived.get();
        InteractiveElement element = InteractiveElement.perceived(spec.name(), spec.role(),
                spec.hasText() ? spec.text() : p.text(), p.box(), p.confidence());
        return new ScreenElement(spec.name(), element, p.confidence(), DetectionMethod.PERCEPTUAL);
    }

    private boolean queryMatches(String selector, Deadline deadline) {
        try {
            return !calls.call("queryAll", timeout(deadline), () -> driver.queryAll(selector)).isEmpty();
        } catch (DriverException e) {
            log.debug("DecisionController[{}]: query '{}' failed: {}", surfaceId, selector, e.getMessage());
            return false;
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private long timeout(Deadline deadline) {
        return deadline.cap(actionTimeoutMs);
    }

    private static FailureKind kindOf(DriverException e) {
        return switch (e.getKind()) {
            case CAPTURE          -> FailureKind.CAPTURE_FAILURE;
            case INVALID_SELECTOR -> FailureKind.TARGET_NOT_FOUND;
            case TIMEOUT, EXECUTION -> FailureKind.EXECUTION_FAILURE;
        };
    }

    private ActionOutcome outcome(long startNanos, ExecutionMethod method, Attempt attempt, boolean fellBack,
                                  Boolean verified, boolean loop) {
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
        if (attempt.success()) {
            log.info("DecisionController[{}]: done via {} in {} ms{}", surfaceId, method, elapsedMs,
                    fellBack ? " (fallback)" : "");
        } else {
            log.warn("DecisionController[{}]: action failed via {} ({}): {}", surfaceId, method,
                    attempt.kind(), attempt.message());
        }
        return new ActionOutcome(method, attempt.success(), elapsedMs, fellBack, verified,
                attempt.success() ? null : attempt.kind(), attempt.message(), loop);
    }

    private record Attempt(boolean success, FailureKind kind, String message) {
        static Attempt ok() {
            return new Attempt(true, null, null);
        }

        static Attempt fail(FailureKind kind, String message) {
            return new Attempt(false, kind, message);
        }
    }

    private record Snapshot(ElementIndex index, String location) {
        Observation toObservation(String surfaceId) {
            return Observation.structural(surfaceId, index.structuralHash(), index.selectors(), index.flags(location));
        }
    }

    private record PerceivedPoint(int x, int y, double confidence, BoundingBox box, String text) {}

    /**
     * Perception for one analysis: the screenshot and the element description are
     * fetched on first use and reused for every anchor and target.
     */
    private final class PerceptionPass {

        private final Deadline deadline;
        private final List<String> warnings;
        private boolean started;
        private BufferedImage frame;
        private List<InteractiveElement> described;

        PerceptionPass(Deadline deadline, List<String> warnings) {
            this.deadline = deadline;
            this.warnings = warnings;
        }

        boolean started() {
            return started;
        }

        double frameWidth()  { return frame == null ? 0 : frame.getWidth(); }
        double frameHeight() { return frame == null ? 0 : frame.getHeight(); }

        Optional<PerceivedPoint> findText(String text) {
            String needle = TextNormalizer.fuzzy(text);
            return described().stream()
                    .filter(e -> TextNormalizer.fuzzy(e.text()).contains(needle))
                    .max(Comparator.comparingDouble(InteractiveElement::confidence))
                    .map(this::toPoint)
                    .or(() -> locate("text '" + text + "'"));
        }

        Optional<PerceivedPoint> findElement(TargetSpec spec) {
            return described().stream()
                    .filter(e -> !spec.hasText()
                            || TextNormalizer.fuzzy(e.text()).contains(TextNormalizer.fuzzy(spec.text())))
                    .filter(e -> !spec.hasRole() || spec.role().equals(e.role()))
                    .filter(e -> spec.hasText() || spec.hasRole())
                    .max(Comparator.comparingDouble(InteractiveElement::confidence))
                    .map(this::toPoint);
        }

        Optional<PerceivedPoint> locate(String description) {
            BufferedImage image = frame();
            if (image == null) return Optional.empty();
            try {
                Optional<Location> loc = calls.call("locate", timeout(deadline),
                        () -> perception.locate(image, description));
                if (loc == null) return Optional.empty();
                return loc.map(l -> new PerceivedPoint(l.x(), l.y(), l.confidence(),
                        new BoundingBox(l.x(), l.y(), 0, 0), description));
            } catch (DriverException e) {
                warnings.add("Perception failed for " + description + ": " + e.getMessage());
                return Optional.empty();
            }
        }

        private PerceivedPoint toPoint(InteractiveElement e) {
            BoundingBox box = e.boundingBox() == null ? new BoundingBox(0, 0, 0, 0) : e.boundingBox();
            return new PerceivedPoint((int) Math.round(box.centerX()), (int) Math.round(box.centerY()),
                    e.confidence(), box, e.text());
        }

        private BufferedImage frame() {
            if (!started) {
                started = true;
                try {
                    frame = calls.call("screenshot", timeout(deadline), () -> driver.screenshot(null));
                } catch (DriverException e) {
                    log.warn("DecisionController[{}]: screenshot for analysis failed: {}", surfaceId, e.getMessage());
                    warnings.add("Screenshot unavailable: " + e.getMessage());
                }
            }
            return frame;
        }

        private List<InteractiveElement> described() {
            if (described == null) {
                BufferedImage image = frame();
                described = List.of();
                if (image != null) {
                    try {
                        List<InteractiveElement> result = calls.call("describeRegion", timeout(deadline),
                                () -> perception.describeRegion(image));
                        described = result == null ? List.of() : result;
                    } catch (DriverException e) {
                        warnings.add("Perception description failed: " + e.getMessage());
                    }
                }
            }
            return described;
        }
    }
}
