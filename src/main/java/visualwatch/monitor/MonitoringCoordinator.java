package visualwatch.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualwatch.capture.CaptureOptions;
import visualwatch.capture.CaptureProvider;
import visualwatch.capture.CaptureResult;
import visualwatch.compare.ComparisonOptions;
import visualwatch.compare.ComparisonProvider;
import visualwatch.compare.ComparisonResult;
import visualwatch.feedback.FeedbackDispatcher;
import visualwatch.model.CaptureRecord;
import visualwatch.model.MonitoringSession;
import visualwatch.model.MonitoringSummary;
import visualwatch.scheduler.SchedulerOptions;
import visualwatch.scheduler.TaskScheduler;
import visualwatch.store.SessionStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Owns the monitoring sessions and runs their capture pipeline.
 *
 * <h3>Session states</h3>
 * <pre>
 *   start ──► ACTIVE ──pause──► PAUSED ──resume──► ACTIVE ──stop──► (gone)
 * </pre>
 * A paused session keeps {@code isActive=true} and its persisted document, so
 * a restarted process resumes it through {@link #init()}.
 *
 * <h3>One tick</h3>
 * capture &rarr; move the image into the session's {@code images/} directory
 * &rarr; compare with the reference &rarr; append a {@link CaptureRecord}
 * &rarr; persist &rarr; on a significant change notify listeners and, for
 * {@code autoFeedback} sessions, hand the diff image to the
 * {@link FeedbackDispatcher}. Any failure propagates out of the tick into the
 * session's {@link TaskScheduler}, which backs off.
 *
 * <p>Each session has exactly one scheduler while it is known to the
 * coordinator. Appending and saving happen under the session object's
 * monitor; readers take the same monitor and get snapshots.
 */
public class MonitoringCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MonitoringCoordinator.class);

    private final CaptureProvider          captureProvider;
    private final ComparisonProvider       comparisonProvider;
    private final FeedbackDispatcher       feedbackDispatcher;
    private final SessionStore             store;
    private final CoordinatorOptions       options;
    private final ScheduledExecutorService timers;
    private final Clock                    clock;

    private final Map<String, MonitoringSession> sessions   = new ConcurrentHashMap<>();
    private final Map<String, TaskScheduler>     schedulers = new ConcurrentHashMap<>();
    private final Set<String>                    paused     = ConcurrentHashMap.newKeySet();
    private final List<MonitoringListener>       listeners  = new CopyOnWriteArrayList<>();

    /** Serializes the session-limit check with registration. */
    private final Object registrationLock = new Object();

    public MonitoringCoordinator(CaptureProvider captureProvider,
                                 ComparisonProvider comparisonProvider,
                                 FeedbackDispatcher feedbackDispatcher,
                                 SessionStore store,
                                 CoordinatorOptions options,
                                 ScheduledExecutorService timers) {
        this(captureProvider, comparisonProvider, feedbackDispatcher, store, options, timers, Clock.systemUTC());
    }

    /** Package-private constructor for tests: accepts a controllable clock. */
    MonitoringCoordinator(CaptureProvider captureProvider,
                          ComparisonProvider comparisonProvider,
                          FeedbackDispatcher feedbackDispatcher,
                          SessionStore store,
                          CoordinatorOptions options,
                          ScheduledExecutorService timers,
                          Clock clock) {
        this.captureProvider    = Objects.requireNonNull(captureProvider, "captureProvider");
        this.comparisonProvider = Objects.requireNonNull(comparisonProvider, "comparisonProvider");
        this.feedbackDispatcher = Objects.requireNonNull(feedbackDispatcher, "feedbackDispatcher");
        this.store              = Objects.requireNonNull(store, "store");
        this.options            = Objects.requireNonNull(options, "options");
        this.timers             = Objects.requireNonNull(timers, "timers");
        this.clock              = Objects.requireNonNull(clock, "clock");
    }

    // ── Listeners ─────────────────────────────────────────────────────────

    public void addListener(MonitoringListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(MonitoringListener listener) {
        listeners.remove(listener);
    }

    // ── Lifecycle operations ──────────────────────────────────────────────

    /**
     * Creates, persists and starts a session. One capture is taken before
     * this method returns; if that first capture fails the failure is logged
     * and reported to listeners, and the scheduler retries with backoff.
     *
     * @return the new session id
     * @throws ReferenceImageNotFoundException if the reference image does not exist
     * @throws SessionLimitExceededException   if {@code maxSessions} are already running
     * @throws MonitoringException             if the new session cannot be persisted
     */
    public String startMonitoring(StartMonitoringRequest request) {
        Objects.requireNonNull(request, "request");
        Path reference = request.referenceImage().toAbsolutePath().normalize();
        if (!Files.isRegularFile(reference)) {
            log.error("Reference image not found: {}", reference);
            throw new ReferenceImageNotFoundException(reference);
        }
        int interval = request.intervalSeconds() != null
                ? request.intervalSeconds() : options.defaultIntervalSeconds();

        String id = UUID.randomUUID().toString();
        MonitoringSession session = new MonitoringSession(id, request.target(), interval,
                reference.toString(), clock.instant(), true, request.autoFeedback());
        TaskScheduler scheduler;

        synchronized (registrationLock) {
            if (sessions.size() >= options.maxSessions()) {
                log.warn("Refusing new session: {} session(s) already running", sessions.size());
                throw new SessionLimitExceededException(options.maxSessions());
            }
            try {
                store.save(session);
            } catch (IOException e) {
                throw new MonitoringException(MonitoringException.PERSISTENCE_FAILED,
                        "Could not persist new session " + id + ": " + e.getMessage(), e);
            }
            scheduler = newScheduler(session);
            sessions.put(id, session);
            schedulers.put(id, scheduler);
        }

        try {
            tick(session);
        } catch (Exception e) {
            log.warn("Initial capture for session {} failed, scheduler will retry: {}", id, e.getMessage());
            notifyListeners(l -> l.onMonitoringError(id, e));
        }
        synchronized (registrationLock) {
            // a listener or another caller may have stopped the session during the first capture
            if (schedulers.get(id) != scheduler) {
                log.info("Monitoring session {} was stopped before its scheduler started", id);
                return id;
            }
            scheduler.start();
        }

        log.info("Monitoring session {} started: {} target every {}s, autoFeedback={}",
                id, request.target().kind(), interval, request.autoFeedback());
        MonitoringSession started = snapshotOf(session);
        notifyListeners(l -> l.onSessionStarted(started));
        return id;
    }

    /**
     * Stops a session for good: no further ticks, final document persisted
     * and then removed from the store.
     *
     * <p>A tick already in progress is awaited (up to the configured stop
     * timeout) and its capture is part of the summary.
     *
     * @throws SessionNotFoundException if {@code id} is unknown
     */
    public MonitoringSummary stopMonitoring(String id) {
        MonitoringSession session = sessions.get(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }

        TaskScheduler scheduler;
        synchronized (registrationLock) {
            scheduler = schedulers.remove(id);
            if (scheduler != null) {
                scheduler.stop();
            }
        }
        if (scheduler != null) {
            if (!scheduler.awaitIdle(options.stopTimeout())) {
                log.warn("Session {} stopping while a capture is still running; its result will be dropped", id);
            }
        }

        MonitoringSummary summary;
        synchronized (session) {
            if (!sessions.remove(id, session)) {
                // a concurrent stop got here first
                throw new SessionNotFoundException(id);
            }
            paused.remove(id);
            session.setActive(false);
            summary = MonitoringSummary.of(session, clock.instant());
            try {
                store.save(session);
            } catch (IOException e) {
                log.error("Could not persist final state of session {}: {}", id, e.getMessage());
            }
            try {
                store.delete(id);
            } catch (IOException e) {
                log.error("Could not delete stored session {}: {}", id, e.getMessage());
            }
        }

        log.info("Monitoring session {} stopped after {}: {} capture(s), {} significant",
                id, summary.duration(), summary.totalScreenshots(), summary.significantChanges());
        notifyListeners(l -> l.onSessionStopped(summary));
        return summary;
    }

    /**
     * Stops ticking without ending the session.
     *
     * @return {@code false} if the session is unknown or already paused
     */
    public boolean pauseMonitoring(String id) {
        TaskScheduler scheduler = schedulers.get(id);
        MonitoringSession session = sessions.get(id);
        if (scheduler == null || session == null || !scheduler.isRunning()) {
            return false;
        }
        scheduler.stop();
        paused.add(id);
        persistQuietly(session);
        log.info("Monitoring session {} paused", id);
        notifyListeners(l -> l.onSessionPaused(id));
        return true;
    }

    /**
     * Restarts ticking for a paused session.
     *
     * @return {@code false} if the session is unknown, inactive or not paused
     */
    public boolean resumeMonitoring(String id) {
        TaskScheduler scheduler = schedulers.get(id);
        MonitoringSession session = sessions.get(id);
        if (scheduler == null || session == null || !session.isActive() || scheduler.isRunning()) {
            return false;
        }
        scheduler.start();
        paused.remove(id);
        log.info("Monitoring session {} resumed", id);
        notifyListeners(l -> l.onSessionResumed(id));
        return true;
    }

    /**
     * Resumes every persisted session still marked active, each with a fresh
     * scheduler at its own interval. Sessions beyond {@code maxSessions} stay
     * on disk and are skipped, as is a session whose scheduler cannot be
     * built; the remaining sessions are still resumed.
     *
     * @return the number of sessions resumed
     */
    public int init() {
        if (!options.restoreSessions()) {
            log.info("Session restore disabled; starting with no sessions");
            return 0;
        }
        int resumed = 0;
        for (MonitoringSession session : store.loadAll()) {
            String id = session.getId();
            if (!session.isActive() || sessions.containsKey(id)) {
                continue;
            }
            TaskScheduler scheduler;
            synchronized (registrationLock) {
                if (sessions.size() >= options.maxSessions()) {
                    log.warn("Session limit reached; not resuming stored session {}", id);
                    continue;
                }
                try {
                    scheduler = newScheduler(session);
                } catch (RuntimeException e) {
                    log.error("Not resuming stored session {}: {}", id, e.getMessage());
                    continue;
                }
                sessions.put(id, session);
                schedulers.put(id, scheduler);
                scheduler.start();
            }
            resumed++;
            log.info("Resumed session {} ({} capture(s) so far, every {}s)",
                    id, session.getScreenshotCount(), session.getIntervalSeconds());
        }
        log.info("Session restore complete: {} session(s) resumed", resumed);
        return resumed;
    }

    /**
     * Stops every session (each is summarised, persisted and removed from the
     * store) and clears the feedback dispatcher. Failures for individual
     * sessions are logged and do not stop the rest.
     */
    public void cleanup() {
        log.info("Cleaning up {} monitoring session(s)", sessions.size());
        schedulers.values().forEach(TaskScheduler::stop);

        List<String> failed = new ArrayList<>();
        for (String id : new ArrayList<>(sessions.keySet())) {
            try {
                stopMonitoring(id);
            } catch (RuntimeException e) {
                failed.add(id);
                log.warn("Failed to stop session {} during cleanup: {}", id, e.getMessage());
            }
        }
        sessions.clear();
        schedulers.clear();
        paused.clear();
        feedbackDispatcher.clear();
        if (!failed.isEmpty()) {
            log.warn("Cleanup finished with {} failure(s): {}", failed.size(), failed);
        }
    }

    /**
     * Stops all schedulers and forgets the sessions in memory while leaving
     * their documents in the store, so that the next {@link #init()} resumes
     * them.
     */
    public void shutdown() {
        log.info("Shutting down; {} session(s) stay persisted", sessions.size());
        schedulers.values().forEach(TaskScheduler::stop);
        for (Map.Entry<String, TaskScheduler> e : schedulers.entrySet()) {
            if (!e.getValue().awaitIdle(options.stopTimeout())) {
                log.warn("Session {} still capturing at shutdown", e.getKey());
            }
        }
        sessions.clear();
        schedulers.clear();
        paused.clear();
        feedbackDispatcher.clear();
    }

    // ── Queries ───────────────────────────────────────────────────────────

    /** Snapshot of one session, if known. */
    public Optional<MonitoringSession> getSession(String id) {
        MonitoringSession session = sessions.get(id);
        return session == null ? Optional.empty() : Optional.of(snapshotOf(session));
    }

    public List<MonitoringSession> getAllSessions() {
        List<MonitoringSession> all = new ArrayList<>();
        sessions.values().forEach(s -> all.add(snapshotOf(s)));
        return all;
    }

    /** Known sessions with {@code isActive=true}; paused sessions included. */
    public List<MonitoringSession> getActiveSessions() {
        List<MonitoringSession> active = new ArrayList<>();
        for (MonitoringSession s : sessions.values()) {
            MonitoringSession snap = snapshotOf(s);
            if (snap.isActive()) {
                active.add(snap);
            }
        }
        return active;
    }

    public boolean isPaused(String id) {
        return paused.contains(id);
    }

    // ── Tick ──────────────────────────────────────────────────────────────

    /** One pass of the capture pipeline for {@code session}. */
    void tick(MonitoringSession session) throws Exception {
        String id = session.getId();
        String fileName = "monitor_" + id + "_" + clock.millis() + ".png";
        CaptureResult capture = captureProvider.capture(session.getTarget(),
                new CaptureOptions("png", fileName, false, options.captureDir()));

        String relativePath = "images/" + capture.path().getFileName();
        Path stored;
        synchronized (session) {
            // stop deletes the session directory under this monitor; do not recreate it
            if (sessions.get(id) != session) {
                log.debug("Session {} ended during capture; discarding {}", id, capture.path());
                Files.deleteIfExists(capture.path());
                return;
            }
            stored = relocate(id, capture.path());
        }

        ComparisonResult comparison = comparisonProvider.compare(stored,
                Path.of(session.getReferenceImagePath()),
                ComparisonOptions.withTolerance(options.comparisonTolerance(), options.comparisonDir()));

        Instant when = capture.timestamp() != null ? capture.timestamp() : clock.instant();
        CaptureRecord record = CaptureRecord.of(relativePath, when,
                comparison.differencePercentage(), options.significantChangeThreshold());

        synchronized (session) {
            if (sessions.get(id) != session) {
                log.debug("Session {} ended during capture; dropping {}", id, relativePath);
                return;
            }
            session.addScreenshot(record);
            store.save(session);
        }

        log.debug("Session {} capture {}: {}% different", id, session.getScreenshotCount(),
                String.format("%.2f", comparison.differencePercentage()));
        notifyListeners(l -> l.onScreenshotCaptured(id, record));

        if (record.hasSignificantChange()) {
            log.info("Significant change in session {}: {}% (threshold {}%)", id,
                    String.format("%.2f", comparison.differencePercentage()),
                    options.significantChangeThreshold());
            notifyListeners(l -> l.onSignificantChange(id, record, comparison));
            if (session.isAutoFeedback()) {
                if (comparison.diffImagePath() != null) {
                    feedbackDispatcher.trigger(id, comparison.diffImagePath());
                } else {
                    log.debug("Session {} has no diff image to analyse", id);
                }
            }
        }
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    /**
     * Moves a capture into the session's images directory. A missing source
     * (e.g. a stub provider) is tolerated and the original path is returned.
     */
    private Path relocate(String id, Path source) throws IOException {
        Path target = store.getImagesDirectory(id).resolve(source.getFileName());
        if (!Files.exists(source)) {
            log.warn("Capture file {} for session {} does not exist; not relocated", source, id);
            return source;
        }
        Files.createDirectories(target.getParent());
        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    private TaskScheduler newScheduler(MonitoringSession session) {
        long intervalMs = session.getIntervalSeconds() * 1000L;
        SchedulerOptions schedulerOptions = SchedulerOptions.builder(intervalMs)
                .maxJitterMs(options.schedulerJitterMs())
                .backoffMultiplier(options.backoffMultiplier())
                .maxBackoffMs(Math.max(intervalMs, options.maxBackoffMs()))
                .build();
        String id = session.getId();
        return new TaskScheduler("session-" + id, () -> {
            try {
                tick(session);
            } catch (Exception e) {
                notifyListeners(l -> l.onMonitoringError(id, e));
                throw e;
            }
        }, schedulerOptions, timers);
    }

    private void persistQuietly(MonitoringSession session) {
        synchronized (session) {
            try {
                store.save(session);
            } catch (IOException e) {
                log.error("Could not persist session {}: {}", session.getId(), e.getMessage());
            }
        }
    }

    private static MonitoringSession snapshotOf(MonitoringSession session) {
        synchronized (session) {
            return session.snapshot();
        }
    }

    private void notifyListeners(Consumer<MonitoringListener> event) {
        for (MonitoringListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Monitoring listener {} threw: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
