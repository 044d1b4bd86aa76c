package visualwatch.monitor;

import visualwatch.model.CaptureTarget;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of {@link MonitoringCoordinator#startMonitoring(StartMonitoringRequest)}.
 *
 * @param target          what to capture
 * @param referenceImage  image every capture is compared with; must exist
 * @param intervalSeconds seconds between ticks (1-300), or {@code null} for the configured default
 * @param autoFeedback    request feedback analysis on significant changes
 */
public record StartMonitoringRequest(CaptureTarget target, Path referenceImage,
                                     Integer intervalSeconds, boolean autoFeedback) {

    public static final int MIN_INTERVAL_SECONDS = 1;
    public static final int MAX_INTERVAL_SECONDS = 300;

    public StartMonitoringRequest {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(referenceImage, "referenceImage");
        if (intervalSeconds != null
                && (intervalSeconds < MIN_INTERVAL_SECONDS || intervalSeconds > MAX_INTERVAL_SECONDS)) {
            throw new IllegalArgumentException("intervalSeconds must be within "
                    + MIN_INTERVAL_SECONDS + "-" + MAX_INTERVAL_SECONDS + ", got " + intervalSeconds);
        }
    }

    public static StartMonitoringRequest of(CaptureTarget target, Path referenceImage) {
        return new StartMonitoringRequest(target, referenceImage, null, false);
    }
}
