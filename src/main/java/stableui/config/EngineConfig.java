package stableui.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed engine
 * configuration values with documented defaults.
 *
 * <p>Values can be overridden by placing a {@code config.local.properties} file on
 * the classpath (higher priority, not committed to VCS). Unparseable values are
 * logged and replaced by their default.
 */
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_GATE_THRESHOLD      = "gate.threshold";
    static final String KEY_GATE_GRID_SIZE      = "gate.grid.size";
    static final String KEY_GATE_PIXEL_DELTA    = "gate.pixel.delta";
    static final String KEY_TRACKER_CAPACITY    = "tracker.capacity";
    static final String KEY_LOOP_WINDOW         = "tracker.loop.window";
    static final String KEY_LOOP_RECOVERY       = "tracker.loop.recovery.threshold";
    static final String KEY_STEP_TIMEOUT        = "step.timeout.ms";
    static final String KEY_STEP_RETRIES        = "step.retries";
    static final String KEY_ACTION_TIMEOUT      = "action.timeout.ms";
    static final String KEY_RETRY_MAX           = "retry.max";
    static final String KEY_BACKOFF_MS          = "retry.backoff.ms";
    static final String KEY_BACKOFF_MULTIPLIER  = "retry.backoff.multiplier";
    static final String KEY_BACKOFF_MAX_MS      = "retry.backoff.max.ms";
    static final String KEY_PLAN_DEADLINE       = "plan.deadline.ms";
    static final String KEY_CONTRACT_MIN_CONF   = "contract.min.confidence";
    static final String KEY_PERCEPTION_MIN_CONF = "perception.min.confidence";
    static final String KEY_OVERLAY_ENABLED     = "overlay.dismiss.enabled";
    static final String KEY_OVERLAY_SELECTORS   = "overlay.dismiss.selectors";
    static final String KEY_VISION_ENABLED      = "vision.enabled";
    static final String KEY_VISION_ENDPOINT     = "vision.endpoint";
    static final String KEY_VISION_MODEL        = "vision.model";
    static final String KEY_VISION_KEY_ENV      = "vision.api.key.env";
    static final String KEY_VISION_TIMEOUT      = "vision.timeout.sec";

    // Defaults
    private static final double  DEFAULT_GATE_THRESHOLD      = 0.001;
    private static final int     DEFAULT_GATE_GRID_SIZE      = 32;
    private static final int     DEFAULT_GATE_PIXEL_DELTA    = 10;
    private static final int     DEFAULT_TRACKER_CAPACITY    = 20;
    private static final int     DEFAULT_LOOP_WINDOW         = 3;
    private static final int     DEFAULT_LOOP_RECOVERY       = 2;
    private static final long    DEFAULT_STEP_TIMEOUT        = 5000L;
    private static final int     DEFAULT_STEP_RETRIES        = 2;
    private static final long    DEFAULT_ACTION_TIMEOUT      = 2000L;
    private static final int     DEFAULT_RETRY_MAX           = 5;
    private static final long    DEFAULT_BACKOFF_MS          = 250L;
    private static final double  DEFAULT_BACKOFF_MULTIPLIER  = 2.0;
    private static final long    DEFAULT_BACKOFF_MAX_MS      = 2000L;
    private static final long    DEFAULT_PLAN_DEADLINE       = 60_000L;
    private static final double  DEFAULT_CONTRACT_MIN_CONF   = 0.8;
    private static final double  DEFAULT_PERCEPTION_MIN_CONF = 0.5;
    private static final boolean DEFAULT_OVERLAY_ENABLED     = true;
    private static final boolean DEFAULT_VISION_ENABLED      = false;
    private static final String  DEFAULT_VISION_ENDPOINT     = "http://localhost:8000/v1/chat/completions";
    private static final String  DEFAULT_VISION_MODEL        = "qwen2-vl-7b-instruct";
    private static final String  DEFAULT_VISION_KEY_ENV      = "VISION_API_KEY";
    private static final int     DEFAULT_VISION_TIMEOUT      = 30;

    /** Consent-banner accept buttons used when no selector table is configured. */
    static final List<String> DEFAULT_OVERLAY_SELECTORS = List.of(
            "button#onetrust-accept-btn-handler",
            "button#CybotCookiebotDialogBodyButtonAccept",
            "button[data-testid='uc-accept-all-button']",
            "button[aria-label='Accept all']",
            "button[data-testid='cookie-banner-accept']"
    );

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws IllegalStateException if the base config.properties cannot be loaded
     */
    public EngineConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** Accepts an already-populated {@link Properties} instance; used by tests. */
    EngineConfig(Properties props) {
        this.props = props;
    }

    /** Configuration with every value at its default, without touching the classpath. */
    public static EngineConfig defaults() {
        return new EngineConfig(new Properties());
    }

    /** Copy of this configuration with one value replaced. */
    public EngineConfig with(String key, String value) {
        Properties copy = new Properties();
        copy.putAll(props);
        copy.setProperty(key, value);
        return new EngineConfig(copy);
    }

    // ── Change gate ───────────────────────────────────────────────────────

    /** Fraction of fingerprint cells that must differ to count as changed (default: 0.001). */
    public double getGateThreshold() {
        return getDouble(KEY_GATE_THRESHOLD, DEFAULT_GATE_THRESHOLD);
    }

    /** Edge length of the fingerprint grid (default: 32). */
    public int getGateGridSize() {
        return getInt(KEY_GATE_GRID_SIZE, DEFAULT_GATE_GRID_SIZE);
    }

    /** Grayscale difference above which a cell counts as changed (default: 10). */
    public int getGatePixelDelta() {
        return getInt(KEY_GATE_PIXEL_DELTA, DEFAULT_GATE_PIXEL_DELTA);
    }

    // ── State tracker ─────────────────────────────────────────────────────

    public int getTrackerCapacity() {
        return getInt(KEY_TRACKER_CAPACITY, DEFAULT_TRACKER_CAPACITY);
    }

    public int getLoopWindow() {
        return getInt(KEY_LOOP_WINDOW, DEFAULT_LOOP_WINDOW);
    }

    /**
     * Consecutive loop warnings after which the surface is forced through a full
     * re-analysis (default: 2).
     */
    public int getLoopRecoveryThreshold() {
        return getInt(KEY_LOOP_RECOVERY, DEFAULT_LOOP_RECOVERY);
    }

    // ── Steps and timing ──────────────────────────────────────────────────

    public long getStepTimeoutMs() {
        return getLong(KEY_STEP_TIMEOUT, DEFAULT_STEP_TIMEOUT);
    }

    public int getStepRetries() {
        return getInt(KEY_STEP_RETRIES, DEFAULT_STEP_RETRIES);
    }

    /** Bound on each single driver, input or perception call (default: 2000 ms). */
    public long getActionTimeoutMs() {
        return getLong(KEY_ACTION_TIMEOUT, DEFAULT_ACTION_TIMEOUT);
    }

    /** Ceiling on any step's retry budget, whatever the plan asks for. */
    public int getRetryMax() {
        return getInt(KEY_RETRY_MAX, DEFAULT_RETRY_MAX);
    }

    public long getBackoffMs() {
        return getLong(KEY_BACKOFF_MS, DEFAULT_BACKOFF_MS);
    }

    public double getBackoffMultiplier() {
        return getDouble(KEY_BACKOFF_MULTIPLIER, DEFAULT_BACKOFF_MULTIPLIER);
    }

    public long getBackoffMaxMs() {
        return getLong(KEY_BACKOFF_MAX_MS, DEFAULT_BACKOFF_MAX_MS);
    }

    /** Plan deadline used when a plan does not declare one (default: 60 s). */
    public long getPlanDeadlineMs() {
        return getLong(KEY_PLAN_DEADLINE, DEFAULT_PLAN_DEADLINE);
    }

    // ── Confidence ────────────────────────────────────────────────────────

    public double getContractMinConfidence() {
        return getDouble(KEY_CONTRACT_MIN_CONF, DEFAULT_CONTRACT_MIN_CONF);
    }

    /** Below this, a perceptual location is not acted upon (default: 0.5). */
    public double getPerceptionMinConfidence() {
        return getDouble(KEY_PERCEPTION_MIN_CONF, DEFAULT_PERCEPTION_MIN_CONF);
    }

    // ── Overlays ──────────────────────────────────────────────────────────

    public boolean isOverlayDismissEnabled() {
        return getBool(KEY_OVERLAY_ENABLED, DEFAULT_OVERLAY_ENABLED);
    }

    /** CSS selectors of overlay dismiss buttons, tried in order. */
    public List<String> getOverlayDismissSelectors() {
        String raw = props.getProperty(KEY_OVERLAY_SELECTORS);
        if (raw == null || raw.isBlank()) return DEFAULT_OVERLAY_SELECTORS;
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    // ── Perception ────────────────────────────────────────────────────────

    public boolean isVisionEnabled() {
        return getBool(KEY_VISION_ENABLED, DEFAULT_VISION_ENABLED);
    }

    public String getVisionEndpoint() {
        return props.getProperty(KEY_VISION_ENDPOINT, DEFAULT_VISION_ENDPOINT).trim();
    }

    public String getVisionModel() {
        return props.getProperty(KEY_VISION_MODEL, DEFAULT_VISION_MODEL).trim();
    }

    /** Name of the environment variable holding the API key; the key itself is never configured. */
    public String getVisionApiKeyEnv() {
        return props.getProperty(KEY_VISION_KEY_ENV, DEFAULT_VISION_KEY_ENV).trim();
    }

    public int getVisionTimeoutSec() {
        return getInt(KEY_VISION_TIMEOUT, DEFAULT_VISION_TIMEOUT);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
