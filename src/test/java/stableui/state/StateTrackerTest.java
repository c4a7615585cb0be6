package stableui.state;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import stableui.model.Observation;
import stableui.model.SurfaceFlags;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StateTrackerTest {

    private StateTracker tracker;

    @BeforeMethod
    public void setUp() {
        tracker = new StateTracker("tab-1", 5, 3);
    }

    // ── Ring buffer ───────────────────────────────────────────────────────

    @Test
    public void observe_evictsOldest_whenFull() {
        for (int i = 0; i < 7; i++) {
            record("h" + i);
        }

        assertThat(tracker.size()).isEqualTo(5);
        assertThat(tracker.history(10)).extracting(Observation::getStructuralHash)
                .containsExactly("h2", "h3", "h4", "h5", "h6");
        assertThat(tracker.last().getStructuralHash()).isEqualTo("h6");
    }

    @Test
    public void observe_rejectsForeignSurface() {
        assertThatThrownBy(() -> tracker.observe("tab-2", "h", List.of(), SurfaceFlags.NONE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tab-2");
    }

    @Test
    public void history_returnsMostRecentOldestFirst() {
        record("a");
        record("b");
        record("c");

        assertThat(tracker.history(2)).extracting(Observation::getStructuralHash).containsExactly("b", "c");
        assertThat(tracker.history(0)).isEmpty();
    }

    @Test
    public void uniqueStates_countsDistinctHashes() {
        record("a");
        record("b");
        record("a");

        assertThat(tracker.uniqueStates()).isEqualTo(2);
    }

    // ── Loop detection ────────────────────────────────────────────────────

    @Test
    public void detectLoop_returnsFalse_withFewerObservationsThanWindow() {
        record("same");
        record("same");

        assertThat(tracker.detectLoop()).isFalse();
        assertThat(tracker.status()).isEqualTo(StateTracker.Status.STABLE);
    }

    @Test
    public void detectLoop_returnsTrue_whenWindowIsIdentical() {
        record("x");
        record("same");
        record("same");
        record("same");

        assertThat(tracker.detectLoop()).isTrue();
        assertThat(tracker.status()).isEqualTo(StateTracker.Status.LOOPING);
        assertThat(tracker.consecutiveLoopWarnings()).isEqualTo(1);
    }

    @Test
    public void detectLoop_countsConsecutiveWarnings_andResetsOnProgress() {
        record("same");
        record("same");
        record("same");
        tracker.detectLoop();
        record("same");
        tracker.detectLoop();

        assertThat(tracker.consecutiveLoopWarnings()).isEqualTo(2);

        record("moved");
        assertThat(tracker.detectLoop()).isFalse();
        assertThat(tracker.consecutiveLoopWarnings()).isZero();
    }

    @Test
    public void detectLoop_countsOncePerObservation_whenCheckedRepeatedly() {
        record("same");
        record("same");
        record("same");

        assertThat(tracker.detectLoop()).isTrue();
        assertThat(tracker.detectLoop()).isTrue();
        assertThat(tracker.detectLoop(2)).isTrue();

        assertThat(tracker.consecutiveLoopWarnings()).isEqualTo(1);
        assertThat(tracker.status()).isEqualTo(StateTracker.Status.LOOPING);
    }

    @Test
    public void detectLoop_staysQuietAfterAcknowledge_untilNextObservation() {
        record("same");
        record("same");
        record("same");
        tracker.detectLoop();
        tracker.acknowledgeLoop();

        assertThat(tracker.detectLoop()).isFalse();
        assertThat(tracker.consecutiveLoopWarnings()).isZero();

        record("same");
        assertThat(tracker.detectLoop()).isTrue();
        assertThat(tracker.consecutiveLoopWarnings()).isEqualTo(1);
    }

    @Test
    public void detectLoop_rejectsWindowBelowTwo() {
        assertThatThrownBy(() -> tracker.detectLoop(1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StateTracker("t", 5, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void acknowledgeLoop_clearsStatus() {
        record("same");
        record("same");
        record("same");
        tracker.detectLoop();

        tracker.acknowledgeLoop();

        assertThat(tracker.status()).isEqualTo(StateTracker.Status.STABLE);
        assertThat(tracker.consecutiveLoopWarnings()).isZero();
    }

    // ── Diff ──────────────────────────────────────────────────────────────

    @Test
    public void lastDiff_reportsSelectorAndFlagChanges() {
        tracker.observe("tab-1", "h1", List.of("#a", "#b"), SurfaceFlags.at("https://x/login"));
        tracker.observe("tab-1", "h2", List.of("#b", "#c"),
                new SurfaceFlags(true, false, "https://x/home"));

        StateDiff diff = tracker.lastDiff();

        assertThat(diff.added()).containsExactly("#c");
        assertThat(diff.removed()).containsExactly("#a");
        assertThat(diff.hashChanged()).isTrue();
        assertThat(diff.locationChanged()).isTrue();
        assertThat(diff.overlayAppeared()).isTrue();
        assertThat(diff.modalAppeared()).isFalse();
        assertThat(diff.hasSignificantChange()).isTrue();
        assertThat(diff.elementsChanged()).isTrue();
    }

    @Test
    public void lastDiff_isNotSignificant_forIdenticalObservations() {
        record("h");
        record("h");

        assertThat(tracker.lastDiff().hasSignificantChange()).isFalse();
    }

    @Test
    public void lastDiff_isNull_withOneObservation() {
        record("h");

        assertThat(tracker.lastDiff()).isNull();
    }

    @Test
    public void clear_emptiesHistoryAndStatus() {
        record("same");
        record("same");
        record("same");
        tracker.detectLoop();

        tracker.clear();

        assertThat(tracker.size()).isZero();
        assertThat(tracker.last()).isNull();
        assertThat(tracker.status()).isEqualTo(StateTracker.Status.STABLE);
    }

    private void record(String hash) {
        tracker.observe("tab-1", hash, List.of("#btn"), SurfaceFlags.NONE);
    }
}
