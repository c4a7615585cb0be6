package stableui.gate;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import stableui.config.EngineConfig;
import stableui.model.Region;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayDeque;
import java.util.Deque;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChangeGate}.
 *
 * <p>Frames are synthetic images fed through a queue-backed {@link FrameSource}.
 */
public class ChangeGateTest {

    private final Deque<Object> frames = new ArrayDeque<>();
    private ChangeGate gate;

    @BeforeMethod
    public void setUp() {
        frames.clear();
        FrameSource source = region -> {
            Object next = frames.poll();
            if (next instanceof RuntimeException e) throw e;
            return (BufferedImage) next;
        };
        gate = new ChangeGate("tab-1", source, 0.01, 16, 10);
    }

    // ── Decisions ─────────────────────────────────────────────────────────

    @Test
    public void shouldAnalyze_reportsFirstCheck_onFirstFrame() {
        frames.add(solid(Color.WHITE));

        GateDecision d = gate.shouldAnalyze();

        assertThat(d.changed()).isTrue();
        assertThat(d.reason()).isEqualTo(GateDecision.Reason.FIRST_CHECK);
        assertThat(gate.lastObservation()).isNotNull();
    }

    @Test
    public void shouldAnalyze_returnsUnchanged_forIdenticalFrame() {
        frames.add(solid(Color.WHITE));
        frames.add(solid(Color.WHITE));

        gate.shouldAnalyze();
        GateDecision d = gate.shouldAnalyze();

        assertThat(d.changed()).isFalse();
        assertThat(d.reason()).isEqualTo(GateDecision.Reason.IDENTICAL_HASH);
        assertThat(d.diffRatio()).isZero();
        assertThat(gate.stats().cacheHits()).isEqualTo(1);
    }

    @Test
    public void shouldAnalyze_returnsChanged_whenLargeAreaDiffers() {
        frames.add(solid(Color.WHITE));
        frames.add(withBlock(Color.WHITE, Color.BLACK, 0, 0, 100, 50));

        gate.shouldAnalyze();
        GateDecision d = gate.shouldAnalyze();

        assertThat(d.changed()).isTrue();
        assertThat(d.reason()).isEqualTo(GateDecision.Reason.CHANGED);
        assertThat(d.diffRatio()).isGreaterThan(0.4);
    }

    @Test
    public void shouldAnalyze_returnsBelowThreshold_forSubCellNoise() {
        frames.add(solid(Color.WHITE));
        // Hash differs, but the 1-pixel change is never sampled by the 16x16 grid.
        BufferedImage noisy = solid(Color.WHITE);
        noisy.setRGB(0, 0, Color.BLACK.getRGB());
        frames.add(noisy);

        gate.shouldAnalyze();
        GateDecision d = gate.shouldAnalyze();

        assertThat(d.changed()).isFalse();
        assertThat(d.reason()).isEqualTo(GateDecision.Reason.BELOW_THRESHOLD);
    }

    @Test
    public void shouldAnalyze_treatsSmallDifferenceAsChange_whenThresholdIsZero() {
        gate.setThreshold(0.0);
        frames.add(solid(Color.WHITE));
        BufferedImage noisy = solid(Color.WHITE);
        noisy.setRGB(0, 0, Color.BLACK.getRGB());
        frames.add(noisy);

        gate.shouldAnalyze();
        GateDecision d = gate.shouldAnalyze();

        assertThat(d.changed()).isTrue();
    }

    @Test
    public void shouldAnalyze_assumesChanged_whenCaptureFails() {
        frames.add(solid(Color.WHITE));
        frames.add(new IllegalStateException("window minimised"));

        gate.shouldAnalyze();
        GateDecision d = gate.shouldAnalyze();

        assertThat(d.changed()).isTrue();
        assertThat(d.reason()).isEqualTo(GateDecision.Reason.CAPTURE_FAILED);
    }

    @Test
    public void shouldAnalyze_keepsStoredObservation_whenCaptureFails() {
        frames.add(solid(Color.WHITE));
        frames.add(new IllegalStateException("gone"));
        frames.add(solid(Color.WHITE));

        gate.shouldAnalyze();
        gate.shouldAnalyze();
        GateDecision d = gate.shouldAnalyze();

        assertThat(d.reason()).isEqualTo(GateDecision.Reason.IDENTICAL_HASH);
    }

    @Test
    public void shouldAnalyze_assumesChanged_whenSourceReturnsNull() {
        frames.add(solid(Color.WHITE));
        gate.shouldAnalyze();

        GateDecision d = gate.shouldAnalyze(); // empty queue yields null

        assertThat(d.changed()).isTrue();
        assertThat(d.reason()).isEqualTo(GateDecision.Reason.CAPTURE_FAILED);
    }

    @Test
    public void shouldAnalyze_reportsRegionChanged_whenRoiDiffers() {
        frames.add(solid(Color.WHITE));
        frames.add(solid(Color.WHITE));

        gate.shouldAnalyze();
        GateDecision d = gate.shouldAnalyze(new Region(0, 0, 50, 50));

        assertThat(d.changed()).isTrue();
        assertThat(d.reason()).isEqualTo(GateDecision.Reason.REGION_CHANGED);
        assertThat(gate.lastObservation().getRegion()).isEqualTo(new Region(0, 0, 50, 50));
    }

    @Test
    public void reset_makesNextCheckAFirstCheck() {
        frames.add(solid(Color.WHITE));
        frames.add(solid(Color.WHITE));

        gate.shouldAnalyze();
        gate.reset();
        GateDecision d = gate.shouldAnalyze();

        assertThat(d.reason()).isEqualTo(GateDecision.Reason.FIRST_CHECK);
    }

    // ── Configuration and stats ───────────────────────────────────────────

    @Test
    public void setThreshold_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> gate.setThreshold(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gate.setThreshold(-0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gate.setThreshold(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void constructor_rejectsNonPositiveGridAndNegativePixelDelta() {
        FrameSource source = region -> solid(Color.WHITE);

        assertThatThrownBy(() -> new ChangeGate("tab-1", source, 0.01, 0, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Grid size");
        assertThatThrownBy(() -> new ChangeGate("tab-1", source, 0.01, 16, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Pixel delta");
        assertThatThrownBy(() -> new ChangeGate("tab-1", source,
                EngineConfig.defaults().with("gate.grid.size", "0")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void configConstructor_usesConfiguredThreshold() {
        ChangeGate configured = new ChangeGate("tab-2", region -> solid(Color.WHITE),
                EngineConfig.defaults().with("gate.threshold", "0.25"));

        assertThat(configured.getThreshold()).isEqualTo(0.25);
        assertThat(configured.getSurfaceId()).isEqualTo("tab-2");
    }

    @Test
    public void stats_countChecksChangesAndHits() {
        frames.add(solid(Color.WHITE));
        frames.add(solid(Color.WHITE));
        frames.add(solid(Color.BLACK));
        frames.add(solid(Color.BLACK));

        for (int i = 0; i < 4; i++) gate.shouldAnalyze();
        GateStats stats = gate.stats();

        assertThat(stats.totalChecks()).isEqualTo(4);
        assertThat(stats.changesDetected()).isEqualTo(2);
        assertThat(stats.cacheHits()).isEqualTo(2);
        assertThat(stats.cacheHitRate()).isEqualTo(0.5);
        assertThat(stats.changeRate()).isEqualTo(0.5);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    static BufferedImage solid(Color color) {
        return withBlock(color, color, 0, 0, 0, 0);
    }

    static BufferedImage withBlock(Color background, Color block, int x, int y, int w, int h) {
        BufferedImage img = new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(background);
        g.fillRect(0, 0, 100, 100);
        if (w > 0 && h > 0) {
            g.setColor(block);
            g.fillRect(x, y, w, h);
        }
        g.dispose();
        return img;
    }
}
