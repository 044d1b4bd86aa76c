package visualwatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualwatch.capture.CaptureProvider;
import visualwatch.capture.RobotCaptureProvider;
import visualwatch.capture.RoutingCaptureProvider;
import visualwatch.capture.WebDriverCaptureProvider;
import visualwatch.compare.PixelDiffComparisonProvider;
import visualwatch.config.MonitorConfig;
import visualwatch.feedback.FeedbackAnalyzers;
import visualwatch.feedback.FeedbackDispatcher;
import visualwatch.feedback.FeedbackOptions;
import visualwatch.monitor.CoordinatorOptions;
import visualwatch.monitor.MonitoringCoordinator;
import visualwatch.scheduler.TaskScheduler;
import visualwatch.store.SessionStore;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the object graph behind the CLI from a {@link MonitorConfig} and
 * tears it down again.
 */
final class MonitorRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MonitorRuntime.class);

    private final ScheduledExecutorService timers;
    private final ExecutorService          feedbackWorkers;
    private final CaptureProvider          captureProvider;
    private final MonitoringCoordinator    coordinator;

    private MonitorRuntime(ScheduledExecutorService timers, ExecutorService feedbackWorkers,
                           CaptureProvider captureProvider, MonitoringCoordinator coordinator) {
        this.timers          = timers;
        this.feedbackWorkers = feedbackWorkers;
        this.captureProvider = captureProvider;
        this.coordinator     = coordinator;
    }

    static MonitorRuntime create(MonitorConfig config) throws IOException {
        SessionStore store = new SessionStore(config.getSessionsDirectory());
        store.init();

        ScheduledExecutorService timers = TaskScheduler.newTimerPool(timerThreads(config));
        AtomicInteger counter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, config.getMaxConcurrentFeedback()), r -> {
            Thread t = new Thread(r, "visualwatch-feedback-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        FeedbackOptions feedbackOptions = config.isFeedbackEnabled()
                ? new FeedbackOptions(true, config.getFeedbackRateLimitMs(), config.getMaxConcurrentFeedback())
                : FeedbackOptions.disabled();
        FeedbackDispatcher dispatcher = new FeedbackDispatcher(FeedbackAnalyzers.create(config),
                feedbackOptions, workers, timers);

        CaptureProvider capture = new RoutingCaptureProvider(List.of(
                WebDriverCaptureProvider.fromConfig(config),
                new RobotCaptureProvider()));

        MonitoringCoordinator coordinator = new MonitoringCoordinator(capture,
                new PixelDiffComparisonProvider(), dispatcher, store,
                CoordinatorOptions.fromConfig(config), timers);

        log.debug("Runtime ready: store={}, feedback={}", store.getSessionsRoot(), feedbackOptions);
        return new MonitorRuntime(timers, workers, capture, coordinator);
    }

    /**
     * Ticks run on the timer threads and may block for a page-load timeout,
     * so every session gets a thread of its own plus one for the feedback
     * dispatcher's deferred drains.
     */
    static int timerThreads(MonitorConfig config) {
        return Math.max(1, config.getMaxSessions()) + 1;
    }

    MonitoringCoordinator coordinator() { return coordinator; }

    @Override
    public void close() {
        captureProvider.close();
        timers.shutdownNow();
        feedbackWorkers.shutdown();
        try {
            if (!feedbackWorkers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Feedback analyses still running at exit");
                feedbackWorkers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            feedbackWorkers.shutdownNow();
        }
    }
}
