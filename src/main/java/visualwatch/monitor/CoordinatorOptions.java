package visualwatch.monitor;

import visualwatch.config.MonitorConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link MonitoringCoordinator}. Built from {@link MonitorConfig}
 * in production; tests construct it directly.
 *
 * @param defaultIntervalSeconds     interval used when a request names none
 * @param significantChangeThreshold percent above which a capture is significant (strict)
 * @param maxSessions                sessions the coordinator holds at once
 * @param stopTimeout                how long stop waits for an in-flight tick
 * @param comparisonTolerance        tolerance handed to the comparison provider
 * @param restoreSessions            whether {@code init()} resumes persisted sessions
 * @param schedulerJitterMs          max jitter per tick
 * @param backoffMultiplier          backoff growth per failed tick
 * @param maxBackoffMs               backoff ceiling
 * @param captureDir                 staging directory providers capture into
 * @param comparisonDir              where diff images are written
 */
public record CoordinatorOptions(int defaultIntervalSeconds,
                                 double significantChangeThreshold,
                                 int maxSessions,
                                 Duration stopTimeout,
                                 double comparisonTolerance,
                                 boolean restoreSessions,
                                 long schedulerJitterMs,
                                 double backoffMultiplier,
                                 long maxBackoffMs,
                                 Path captureDir,
                                 Path comparisonDir) {

    public CoordinatorOptions {
        if (defaultIntervalSeconds < StartMonitoringRequest.MIN_INTERVAL_SECONDS
                || defaultIntervalSeconds > StartMonitoringRequest.MAX_INTERVAL_SECONDS) {
            throw new IllegalArgumentException("defaultIntervalSeconds out of range: " + defaultIntervalSeconds);
        }
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be >= 1, got " + maxSessions);
        }
        if (schedulerJitterMs < 0) {
            throw new IllegalArgumentException("schedulerJitterMs must be >= 0, got " + schedulerJitterMs);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(captureDir, "captureDir");
        Objects.requireNonNull(comparisonDir, "comparisonDir");
    }

    public static CoordinatorOptions fromConfig(MonitorConfig config) {
        return new CoordinatorOptions(
                config.getDefaultIntervalSeconds(),
                config.getSignificantChangeThreshold(),
                config.getMaxSessions(),
                Duration.ofMillis(config.getStopTimeoutMs()),
                config.getComparisonTolerance(),
                config.isPersistSessions(),
                config.getSchedulerJitterMs(),
                config.getSchedulerBackoffMultiplier(),
                config.getSchedulerMaxBackoffMs(),
                config.getCaptureOutputDir(),
                config.getComparisonOutputDir());
    }

    /** Defaults matching {@code config.properties}, with output under {@code workDir}. */
    public static CoordinatorOptions defaults(Path workDir) {
        return new CoordinatorOptions(5, 2.0, 10, Duration.ofSeconds(30), 5.0, true,
                500L, 2.0, 60_000L, workDir.resolve("screenshots"), workDir.resolve("comparisons"));
    }
}
