package visualwatch.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One continuous monitoring run against a single target and reference image.
 * Maps 1:1 to the {@code session.json} document described by
 * {@code session-schema.json}.
 *
 * <p>The capture list is append-only: records are added in tick order and
 * never reordered or replaced. {@link #getScreenshots()} returns a read-only
 * view.
 */
public class MonitoringSession {

    /** Current schema version: must match session-schema.json. */
    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    @JsonProperty("schemaVersion")
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    @JsonProperty("id")
    private String id;

    @JsonProperty("target")
    private CaptureTarget target;

    @JsonProperty("intervalSeconds")
    @JsonAlias("interval")
    private int intervalSeconds;

    @JsonProperty("referenceImagePath")
    private String referenceImagePath;

    @JsonProperty("startTime")
    private Instant startTime;

    @JsonProperty("isActive")
    private boolean active;

    @JsonProperty("autoFeedback")
    private boolean autoFeedback;

    @JsonProperty("screenshots")
    private List<CaptureRecord> screenshots = new CopyOnWriteArrayList<>();

    public MonitoringSession() {}

    public MonitoringSession(String id, CaptureTarget target, int intervalSeconds,
                             String referenceImagePath, Instant startTime,
                             boolean active, boolean autoFeedback) {
        this.id                 = id;
        this.target             = target;
        this.intervalSeconds    = intervalSeconds;
        this.referenceImagePath = referenceImagePath;
        this.startTime          = startTime;
        this.active             = active;
        this.autoFeedback       = autoFeedback;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String        getSchemaVersion()      { return schemaVersion; }
    public String        getId()                 { return id; }
    public CaptureTarget getTarget()             { return target; }
    public int           getIntervalSeconds()    { return intervalSeconds; }
    public String        getReferenceImagePath() { return referenceImagePath; }
    public Instant       getStartTime()          { return startTime; }
    public boolean       isActive()              { return active; }
    public boolean       isAutoFeedback()        { return autoFeedback; }

    public List<CaptureRecord> getScreenshots() {
        return Collections.unmodifiableList(screenshots);
    }

    // ── Mutators ─────────────────────────────────────────────────────────

    public void setActive(boolean active) { this.active = active; }

    /** Appends one capture at the end of the history. */
    public void addScreenshot(CaptureRecord record) {
        screenshots.add(Objects.requireNonNull(record, "record"));
    }

    @JsonProperty("screenshots")
    void setScreenshots(List<CaptureRecord> records) {
        this.screenshots = records != null
                ? new CopyOnWriteArrayList<>(records)
                : new CopyOnWriteArrayList<>();
    }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore
    public int getScreenshotCount() {
        return screenshots.size();
    }

    @JsonIgnore
    public boolean isVersionSupported() {
        return CURRENT_SCHEMA_VERSION.equals(schemaVersion);
    }

    /**
     * Returns an independent copy whose capture list will not see later
     * appends to this session.
     */
    public MonitoringSession snapshot() {
        MonitoringSession copy = new MonitoringSession(id, target, intervalSeconds,
                referenceImagePath, startTime, active, autoFeedback);
        copy.schemaVersion = schemaVersion;
        copy.screenshots   = new CopyOnWriteArrayList<>(new ArrayList<>(screenshots));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MonitoringSession)) return false;
        MonitoringSession that = (MonitoringSession) o;
        return intervalSeconds == that.intervalSeconds
                && active == that.active
                && autoFeedback == that.autoFeedback
                && Objects.equals(schemaVersion, that.schemaVersion)
                && Objects.equals(id, that.id)
                && Objects.equals(target, that.target)
                && Objects.equals(referenceImagePath, that.referenceImagePath)
                && Objects.equals(startTime, that.startTime)
                && Objects.equals(screenshots, that.screenshots);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaVersion, id, target, intervalSeconds, referenceImagePath,
                startTime, active, autoFeedback, screenshots);
    }

    @Override
    public String toString() {
        return String.format("MonitoringSession{id='%s', target=%s, active=%b, screenshots=%d}",
                id, target == null ? null : target.kind(), active, getScreenshotCount());
    }
}
