package visualwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Reads monitoring settings from {@code config.properties} (classpath) and
 * exposes typed accessors with sensible defaults.
 *
 * <p>An optional {@code config.local.properties} file on the classpath
 * overrides any value from the base file (not committed to VCS).
 *
 * <h3>Supported keys and defaults</h3>
 * <table>
 *   <tr><th>Key</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>monitor.persist.sessions</td><td>true</td><td>Restore active sessions on startup</td></tr>
 *   <tr><td>monitor.sessions.dir</td><td>.visual-watch</td><td>Root of the session store</td></tr>
 *   <tr><td>monitor.default.interval.sec</td><td>5</td><td>Interval when a request omits one</td></tr>
 *   <tr><td>monitor.significant.change.threshold</td><td>2.0</td><td>Percent above which a capture is significant</td></tr>
 *   <tr><td>monitor.max.sessions</td><td>10</td><td>Sessions allowed at once</td></tr>
 *   <tr><td>monitor.stop.timeout.ms</td><td>30000</td><td>Wait for an in-flight tick on stop</td></tr>
 *   <tr><td>monitor.comparison.tolerance</td><td>5</td><td>Tolerance passed to the comparison</td></tr>
 *   <tr><td>monitor.feedback.enabled</td><td>true</td><td>Master switch for auto-feedback</td></tr>
 *   <tr><td>monitor.feedback.rate.limit.ms</td><td>60000</td><td>Per-session feedback spacing</td></tr>
 *   <tr><td>monitor.feedback.max.concurrent</td><td>2</td><td>Concurrent feedback analyses</td></tr>
 *   <tr><td>monitor.scheduler.jitter.ms</td><td>500</td><td>Random delay added to each tick</td></tr>
 *   <tr><td>monitor.scheduler.backoff.multiplier</td><td>2.0</td><td>Backoff growth per failed tick</td></tr>
 *   <tr><td>monitor.scheduler.max.backoff.ms</td><td>60000</td><td>Backoff ceiling</td></tr>
 *   <tr><td>capture.output.dir</td><td>screenshots</td><td>Where providers write raw captures</td></tr>
 *   <tr><td>capture.browser</td><td>chrome</td><td>chrome, firefox or edge</td></tr>
 *   <tr><td>capture.headless</td><td>true</td><td>Run the browser headless</td></tr>
 *   <tr><td>capture.viewport.width / height</td><td>1200 / 800</td><td>Default viewport</td></tr>
 *   <tr><td>capture.page.load.timeout.sec</td><td>30</td><td>Navigation timeout</td></tr>
 *   <tr><td>comparison.output.dir</td><td>comparisons</td><td>Where diff images go</td></tr>
 *   <tr><td>feedback.analyzer</td><td>stub</td><td>stub or llm</td></tr>
 *   <tr><td>ai.llm.*</td><td>see accessors</td><td>OpenAI-compatible endpoint settings</td></tr>
 * </table>
 */
public class MonitorConfig {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_PERSIST_SESSIONS     = "monitor.persist.sessions";
    static final String KEY_SESSIONS_DIR         = "monitor.sessions.dir";
    static final String KEY_DEFAULT_INTERVAL     = "monitor.default.interval.sec";
    static final String KEY_THRESHOLD            = "monitor.significant.change.threshold";
    static final String KEY_MAX_SESSIONS         = "monitor.max.sessions";
    static final String KEY_STOP_TIMEOUT         = "monitor.stop.timeout.ms";
    static final String KEY_TOLERANCE            = "monitor.comparison.tolerance";
    static final String KEY_FEEDBACK_ENABLED     = "monitor.feedback.enabled";
    static final String KEY_FEEDBACK_RATE_LIMIT  = "monitor.feedback.rate.limit.ms";
    static final String KEY_FEEDBACK_CONCURRENT  = "monitor.feedback.max.concurrent";
    static final String KEY_JITTER               = "monitor.scheduler.jitter.ms";
    static final String KEY_BACKOFF_MULTIPLIER   = "monitor.scheduler.backoff.multiplier";
    static final String KEY_MAX_BACKOFF          = "monitor.scheduler.max.backoff.ms";
    static final String KEY_CAPTURE_DIR          = "capture.output.dir";
    static final String KEY_BROWSER              = "capture.browser";
    static final String KEY_HEADLESS             = "capture.headless";
    static final String KEY_VIEWPORT_WIDTH       = "capture.viewport.width";
    static final String KEY_VIEWPORT_HEIGHT      = "capture.viewport.height";
    static final String KEY_PAGE_LOAD_TIMEOUT    = "capture.page.load.timeout.sec";
    static final String KEY_COMPARISON_DIR       = "comparison.output.dir";
    static final String KEY_FEEDBACK_ANALYZER    = "feedback.analyzer";

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads configuration from the classpath. A missing base file is
     * tolerated; all defaults then apply.
     */
    public MonitorConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /**
     * Package-private constructor for tests: accepts a pre-populated
     * {@link Properties} instance, bypassing classpath I/O.
     */
    MonitorConfig(Properties props) {
        this.props = props;
    }

    /** Creates a config from explicit properties (no classpath I/O). */
    public static MonitorConfig of(Properties props) {
        Properties copy = new Properties();
        copy.putAll(props);
        return new MonitorConfig(copy);
    }

    // ── Monitoring ────────────────────────────────────────────────────────

    public boolean isPersistSessions()          { return getBoolean(KEY_PERSIST_SESSIONS, true); }
    public Path    getSessionsDirectory()       { return Path.of(getString(KEY_SESSIONS_DIR, ".visual-watch")); }
    public int     getDefaultIntervalSeconds()  { return getInt(KEY_DEFAULT_INTERVAL, 5); }
    public double  getSignificantChangeThreshold() { return getDouble(KEY_THRESHOLD, 2.0); }
    public int     getMaxSessions()             { return getInt(KEY_MAX_SESSIONS, 10); }
    public long    getStopTimeoutMs()           { return getLong(KEY_STOP_TIMEOUT, 30_000L); }
    public double  getComparisonTolerance()     { return getDouble(KEY_TOLERANCE, 5.0); }

    // ── Auto-feedback ─────────────────────────────────────────────────────

    public boolean isFeedbackEnabled()          { return getBoolean(KEY_FEEDBACK_ENABLED, true); }
    public long    getFeedbackRateLimitMs()     { return getLong(KEY_FEEDBACK_RATE_LIMIT, 60_000L); }
    public int     getMaxConcurrentFeedback()   { return getInt(KEY_FEEDBACK_CONCURRENT, 2); }
    public String  getFeedbackAnalyzer()        { return getString(KEY_FEEDBACK_ANALYZER, "stub"); }

    // ── Scheduler ─────────────────────────────────────────────────────────

    public long    getSchedulerJitterMs()       { return getLong(KEY_JITTER, 500L); }
    public double  getSchedulerBackoffMultiplier() { return getDouble(KEY_BACKOFF_MULTIPLIER, 2.0); }
    public long    getSchedulerMaxBackoffMs()   { return getLong(KEY_MAX_BACKOFF, 60_000L); }

    // ── Capture / comparison ──────────────────────────────────────────────

    public Path    getCaptureOutputDir()        { return Path.of(getString(KEY_CAPTURE_DIR, "screenshots")); }
    public String  getBrowser()                 { return getString(KEY_BROWSER, "chrome"); }
    public boolean isHeadless()                 { return getBoolean(KEY_HEADLESS, true); }
    public int     getViewportWidth()           { return getInt(KEY_VIEWPORT_WIDTH, 1200); }
    public int     getViewportHeight()          { return getInt(KEY_VIEWPORT_HEIGHT, 800); }
    public int     getPageLoadTimeoutSec()      { return getInt(KEY_PAGE_LOAD_TIMEOUT, 30); }
    public Path    getComparisonOutputDir()     { return Path.of(getString(KEY_COMPARISON_DIR, "comparisons")); }

    // ── LLM endpoint ──────────────────────────────────────────────────────

    /** Base URL of the OpenAI-compatible endpoint; defaults to Ollama's local address. */
    public String getLlmBaseUrl()      { return getString("ai.llm.base.url", "http://localhost:11434/v1"); }
    public String getLlmModel()        { return getString("ai.llm.model", "qwen2.5-coder:32b"); }
    public double getLlmTemperature()  { return getDouble("ai.llm.temperature", 0.1); }
    public int    getLlmMaxTokens()    { return getInt("ai.llm.max.tokens", 1024); }
    public int    getLlmTimeoutSec()   { return getInt("ai.llm.timeout.sec", 120); }
    public int    getLlmRetryCount()   { return getInt("ai.llm.retry.count", 2); }
    public long   getLlmRetryDelayMs() { return getLong("ai.llm.retry.delay.ms", 2000L); }

    // ── Runtime overrides ─────────────────────────────────────────────────

    /**
     * Overrides a key at runtime (e.g. from a CLI option). Takes precedence
     * over the config-file value.
     */
    public void set(String key, String value) {
        props.setProperty(key, value);
    }

    public void setSessionsDirectory(Path dir) {
        set(KEY_SESSIONS_DIR, dir.toString());
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {}, all monitor settings use defaults", CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private String getString(String key, String defaultValue) {
        String raw = props.getProperty(key);
        return raw == null || raw.isBlank() ? defaultValue : raw.trim();
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

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
}
