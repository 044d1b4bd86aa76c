package visualwatch.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one monitoring tick: where the image was stored and how far it
 * drifted from the reference.
 *
 * <p>{@code relativePath} is relative to the owning session's directory.
 * Documents written by older releases used an absolute {@code filepath}
 * field; the alias lets {@code SessionStore} read them for migration.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CaptureRecord {

    @JsonProperty("relativePath")
    @JsonAlias("filepath")
    private String relativePath;

    @JsonProperty("timestamp")
    private Instant timestamp;

    /** Null when the comparison did not produce a value. */
    @JsonProperty("differencePercentage")
    private Double differencePercentage;

    @JsonProperty("hasSignificantChange")
    private boolean significantChange;

    public CaptureRecord() {}

    public CaptureRecord(String relativePath, Instant timestamp,
                         Double differencePercentage, boolean significantChange) {
        this.relativePath         = relativePath;
        this.timestamp            = timestamp;
        this.differencePercentage = differencePercentage;
        this.significantChange    = significantChange;
    }

    /**
     * Builds a record, deriving {@code hasSignificantChange} as
     * {@code differencePercentage > threshold}.
     */
    public static CaptureRecord of(String relativePath, Instant timestamp,
                                   Double differencePercentage, double threshold) {
        boolean significant = differencePercentage != null && differencePercentage > threshold;
        return new CaptureRecord(relativePath, timestamp, differencePercentage, significant);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public String  getRelativePath()         { return relativePath; }
    public Instant getTimestamp()            { return timestamp; }
    public Double  getDifferencePercentage() { return differencePercentage; }
    public boolean hasSignificantChange()    { return significantChange; }

    public void setRelativePath(String relativePath) { this.relativePath = relativePath; }

    // ── Object ────────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaptureRecord)) return false;
        CaptureRecord that = (CaptureRecord) o;
        return significantChange == that.significantChange
                && Objects.equals(relativePath, that.relativePath)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(differencePercentage, that.differencePercentage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relativePath, timestamp, differencePercentage, significantChange);
    }

    @Override
    public String toString() {
        return String.format("CaptureRecord{path='%s', diff=%s, significant=%b}",
                relativePath, differencePercentage, significantChange);
    }
}
