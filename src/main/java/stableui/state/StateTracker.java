package stableui.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.config.EngineConfig;
import stableui.model.Observation;
import stableui.model.SurfaceFlags;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Bounded history of observations of one surface, with loop detection.
 *
 * <p>Conceptually a two-state machine: {@link Status#STABLE} and
 * {@link Status#LOOPING}. Reaching {@code LOOPING} is reported to the caller
 * through {@link #detectLoop(int)} and {@link #consecutiveLoopWarnings()}; the
 * tracker itself takes no corrective action.
 */
public class StateTracker {

    private static final Logger log = LoggerFactory.getLogger(StateTracker.class);

    public enum Status { STABLE, LOOPING }

    private final String surfaceId;
    private final int capacity;
    private final int defaultWindow;
    private final Deque<Observation> history;

    private Status status = Status.STABLE;
    private int consecutiveLoopWarnings;
    private Observation lastCounted;

    public StateTracker(String surfaceId, int capacity, int defaultWindow) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        if (defaultWindow < 2) throw new IllegalArgumentException("loop window must be >= 2: " + defaultWindow);
        this.surfaceId     = Objects.requireNonNull(surfaceId, "surfaceId");
        this.capacity      = capacity;
        this.defaultWindow = defaultWindow;
        this.history       = new ArrayDeque<>(capacity);
    }

    public StateTracker(String surfaceId, EngineConfig config) {
        this(surfaceId, config.getTrackerCapacity(), config.getLoopWindow());
    }

    // ── Recording ─────────────────────────────────────────────────────────

    /**
     * Records an observation, evicting the oldest when full.
     *
     * @throws IllegalArgumentException if {@code surfaceId} is not the tracked surface
     */
    public synchronized Observation observe(String surfaceId, String structuralHash,
                                            List<String> selectors, SurfaceFlags flags) {
        if (!this.surfaceId.equals(surfaceId)) {
            throw new IllegalArgumentException(
                    "Tracker for '" + this.surfaceId + "' cannot record surface '" + surfaceId + "'");
        }
        Observation obs = Observation.structural(surfaceId, structuralHash, selectors, flags);
        if (history.size() == capacity) {
            history.removeFirst();
        }
        history.addLast(obs);
        return obs;
    }

    // ── Loop detection ────────────────────────────────────────────────────

    /** Loop check over the configured window. */
    public boolean detectLoop() {
        return detectLoop(defaultWindow);
    }

    /**
     * Reports a loop when the last {@code windowSize} observations all share one
     * structural hash. Fewer observations than the window is never a loop.
     * Updates {@link #status()} and the consecutive-warning counter; a looping
     * window is counted once per newest observation, so repeated checks without
     * a new observation leave the counter unchanged.
     */
    public synchronized boolean detectLoop(int windowSize) {
        if (windowSize < 2) throw new IllegalArgumentException("windowSize must be >= 2: " + windowSize);
        boolean looping = false;
        if (history.size() >= windowSize) {
            looping = true;
            String first = null;
            int seen = 0;
            Iterator<Observation> it = history.descendingIterator();
            while (it.hasNext() && seen < windowSize) {
                String hash = it.next().getStructuralHash();
                if (first == null) {
                    first = hash;
                } else if (!first.equals(hash)) {
                    looping = false;
                    break;
                }
                seen++;
            }
        }

        if (looping) {
            Observation newest = history.peekLast();
            if (newest == lastCounted) {
                return status == Status.LOOPING;
            }
            lastCounted = newest;
            consecutiveLoopWarnings++;
            if (status != Status.LOOPING) {
                log.info("StateTracker[{}]: loop detected, last {} observations identical", surfaceId, windowSize);
            }
            status = Status.LOOPING;
        } else {
            consecutiveLoopWarnings = 0;
            lastCounted = null;
            status = Status.STABLE;
        }
        return looping;
    }

    public synchronized Status status() {
        return status;
    }

    /** Number of loop checks in a row that reported a loop. */
    public synchronized int consecutiveLoopWarnings() {
        return consecutiveLoopWarnings;
    }

    /** Clears the loop counter after the caller has taken corrective action. */
    public synchronized void acknowledgeLoop() {
        consecutiveLoopWarnings = 0;
        lastCounted = history.peekLast();
        status = Status.STABLE;
    }

    // ── Diff ──────────────────────────────────────────────────────────────

    /** Diff between two observations; either may come from any tracker. */
    public static StateDiff diff(Observation older, Observation newer) {
        Objects.requireNonNull(older, "older");
        Objects.requireNonNull(newer, "newer");

        Set<String> before = new LinkedHashSet<>(older.getSelectors());
        Set<String> after  = new LinkedHashSet<>(newer.getSelectors());
        List<String> added = new ArrayList<>();
        for (String s : after) if (!before.contains(s)) added.add(s);
        List<String> removed = new ArrayList<>();
        for (String s : before) if (!after.contains(s)) removed.add(s);

        SurfaceFlags a = older.getFlags();
        SurfaceFlags b = newer.getFlags();
        return new StateDiff(added, removed,
                !older.sameHashAs(newer),
                !Objects.equals(a.location(), b.location()),
                !a.overlayPresent() && b.overlayPresent(),
                a.overlayPresent() && !b.overlayPresent(),
                !a.modalPresent() && b.modalPresent(),
                a.modalPresent() && !b.modalPresent());
    }

    /** Diff between the last two observations, or {@code null} with fewer than two. */
    public synchronized StateDiff lastDiff() {
        if (history.size() < 2) return null;
        Iterator<Observation> it = history.descendingIterator();
        Observation newer = it.next();
        Observation older = it.next();
        return diff(older, newer);
    }

    // ── History ───────────────────────────────────────────────────────────

    public synchronized Observation last() {
        return history.peekLast();
    }

    /** The most recent {@code limit} observations, oldest first. */
    public synchronized List<Observation> history(int limit) {
        List<Observation> all = new ArrayList<>(history);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    /** Number of distinct structural hashes currently held. */
    public synchronized int uniqueStates() {
        return (int) history.stream().map(Observation::getStructuralHash).distinct().count();
    }

    public synchronized int size() {
        return history.size();
    }

    public synchronized void clear() {
        history.clear();
        consecutiveLoopWarnings = 0;
        lastCounted = null;
        status = Status.STABLE;
    }

    public String getSurfaceId() {
        return surfaceId;
    }

    public int getCapacity() {
        return capacity;
    }
}
