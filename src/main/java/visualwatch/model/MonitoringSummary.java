package visualwatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Final report for a stopped session. Derived from the session at stop time;
 * never persisted on its own.
 */
public record MonitoringSummary(
        @JsonProperty("sessionId")          String sessionId,
        @JsonProperty("target")             CaptureTarget target,
        @JsonProperty("startTime")          Instant startTime,
        @JsonProperty("endTime")            Instant endTime,
        @JsonProperty("duration")           String duration,
        @JsonProperty("totalScreenshots")   int totalScreenshots,
        @JsonProperty("significantChanges") int significantChanges,
        @JsonProperty("averageDifference")  double averageDifference,
        @JsonProperty("screenshots")        List<CaptureRecord> screenshots) {

    public MonitoringSummary {
        screenshots = List.copyOf(screenshots);
    }

    /** Summarises {@code session} as of {@code endTime}. */
    public static MonitoringSummary of(MonitoringSession session, Instant endTime) {
        List<CaptureRecord> shots = session.getScreenshots();
        int significant = (int) shots.stream().filter(CaptureRecord::hasSignificantChange).count();
        return new MonitoringSummary(
                session.getId(),
                session.getTarget(),
                session.getStartTime(),
                endTime,
                formatDuration(Duration.between(session.getStartTime(), endTime)),
                shots.size(),
                significant,
                averageDifference(shots),
                shots);
    }

    /**
     * Mean of the difference percentages that are present; {@code 0} when no
     * capture produced one.
     */
    static double averageDifference(List<CaptureRecord> shots) {
        return shots.stream()
                .map(CaptureRecord::getDifferencePercentage)
                .filter(d -> d != null)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    /** Formats as {@code 1h 2m 3s}, {@code 2m 3s} or {@code 3s}. */
    static String formatDuration(Duration duration) {
        long totalSeconds = Math.max(0, duration.getSeconds());
        long hours   = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, seconds);
        }
        if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        }
        return seconds + "s";
    }
}
