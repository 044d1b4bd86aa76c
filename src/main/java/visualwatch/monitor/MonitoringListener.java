package visualwatch.monitor;

import visualwatch.compare.ComparisonResult;
import visualwatch.model.CaptureRecord;
import visualwatch.model.MonitoringSession;
import visualwatch.model.MonitoringSummary;

/**
 * Receives session lifecycle and capture events from a
 * {@link MonitoringCoordinator}. Every method defaults to a no-op.
 *
 * <p>Callbacks run on the thread that caused the event (a scheduler timer
 * thread for captures) and must return quickly. Exceptions thrown by a
 * listener are logged and otherwise ignored.
 */
public interface MonitoringListener {

    default void onSessionStarted(MonitoringSession session) {}

    default void onScreenshotCaptured(String sessionId, CaptureRecord record) {}

    default void onSignificantChange(String sessionId, CaptureRecord record, ComparisonResult comparison) {}

    default void onMonitoringError(String sessionId, Throwable error) {}

    default void onSessionPaused(String sessionId) {}

    default void onSessionResumed(String sessionId) {}

    default void onSessionStopped(MonitoringSummary summary) {}
}
