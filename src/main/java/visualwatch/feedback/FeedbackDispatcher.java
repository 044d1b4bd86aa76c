package visualwatch.feedback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Decides when a significant change gets an (expensive) feedback analysis.
 *
 * <p>Three gates, in order:
 * <ol>
 *   <li><b>Enabled</b>: a disabled dispatcher refuses everything.</li>
 *   <li><b>Per-session rate limit</b>: a session may start at most one analysis
 *       per {@code rateLimitMs}; other sessions are unaffected.</li>
 *   <li><b>Global concurrency</b>: at most {@code maxConcurrent} analyses run at
 *       once; excess requests wait in a FIFO queue and are started as earlier
 *       analyses finish.</li>
 * </ol>
 *
 * <p>Analyses run on the supplied {@link Executor}. Analyzer failures are
 * logged and never reach the caller of {@link #trigger(String, Path)}.
 * All bookkeeping is guarded by the dispatcher's monitor.
 */
public class FeedbackDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FeedbackDispatcher.class);

    private final FeedbackAnalyzer         analyzer;
    private final FeedbackOptions          options;
    private final Executor                 workers;
    private final ScheduledExecutorService retryTimer;
    private final Clock                    clock;

    // Guarded by this
    private final Map<String, Long> lastTriggerTime = new HashMap<>();
    private final List<String>      active          = new ArrayList<>();
    private final Deque<Pending>    queue           = new ArrayDeque<>();
    private long                    epoch;

    /**
     * @param analyzer   the analyzer to invoke
     * @param options    enablement and limits
     * @param workers    runs analyses asynchronously
     * @param retryTimer optional; when present, a queued request that is still
     *                   rate-limited is retried once its window has passed
     */
    public FeedbackDispatcher(FeedbackAnalyzer analyzer, FeedbackOptions options,
                              Executor workers, ScheduledExecutorService retryTimer) {
        this(analyzer, options, workers, retryTimer, Clock.systemUTC());
    }

    /** Package-private constructor for tests: accepts a controllable clock. */
    FeedbackDispatcher(FeedbackAnalyzer analyzer, FeedbackOptions options,
                       Executor workers, ScheduledExecutorService retryTimer, Clock clock) {
        this.analyzer   = Objects.requireNonNull(analyzer, "analyzer");
        this.options    = Objects.requireNonNull(options, "options");
        this.workers    = Objects.requireNonNull(workers, "workers");
        this.retryTimer = retryTimer;
        this.clock      = Objects.requireNonNull(clock, "clock");
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Requests analysis of {@code diffImage} on behalf of {@code sessionKey}.
     *
     * @return {@code true} if the analysis was started now; {@code false} if it
     *         was refused (disabled, rate-limited) or queued for later
     */
    public boolean trigger(String sessionKey, Path diffImage) {
        Objects.requireNonNull(sessionKey, "sessionKey");
        Objects.requireNonNull(diffImage, "diffImage");

        if (!options.enabled()) {
            log.debug("Auto-feedback disabled, ignoring trigger for session {}", sessionKey);
            return false;
        }

        synchronized (this) {
            long now = clock.millis();
            long sinceLast = sinceLastTrigger(sessionKey, now);
            if (sinceLast < options.rateLimitMs()) {
                log.debug("Feedback rate-limited for session {} ({} ms since last, limit {} ms)",
                        sessionKey, sinceLast, options.rateLimitMs());
                return false;
            }

            if (active.size() >= options.maxConcurrent()) {
                queue.addLast(new Pending(sessionKey, diffImage, now));
                log.debug("Max concurrent feedback analyses reached ({}), queued session {} (queue size {})",
                        active.size(), sessionKey, queue.size());
                return false;
            }

            return startLocked(sessionKey, diffImage, now);
        }
    }

    /** Forgets rate-limit history, running analyses and queued requests. */
    public synchronized void clear() {
        lastTriggerTime.clear();
        active.clear();
        queue.clear();
        epoch++;
        log.debug("Feedback dispatcher state cleared");
    }

    public synchronized int getQueueSize()   { return queue.size(); }
    public synchronized int getActiveCount() { return active.size(); }

    public FeedbackOptions getOptions() { return options; }

    // ── Internals ─────────────────────────────────────────────────────────

    private long sinceLastTrigger(String sessionKey, long now) {
        Long last = lastTriggerTime.get(sessionKey);
        return last == null ? Long.MAX_VALUE : now - last;
    }

    /**
     * Caller holds the monitor and has checked both limits. A rejected start
     * leaves the session's rate-limit history as it was.
     */
    private boolean startLocked(String sessionKey, Path diffImage, long now) {
        Long previous = lastTriggerTime.put(sessionKey, now);
        active.add(sessionKey);
        long startedIn = epoch;
        log.info("Starting feedback analysis for session {}: {}", sessionKey, diffImage);
        try {
            workers.execute(() -> runAnalysis(sessionKey, diffImage, startedIn));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Feedback executor rejected analysis for session {}: {}", sessionKey, e.getMessage());
            active.remove(sessionKey);
            if (previous == null) {
                lastTriggerTime.remove(sessionKey);
            } else {
                lastTriggerTime.put(sessionKey, previous);
            }
            return false;
        }
    }

    private void runAnalysis(String sessionKey, Path diffImage, long startedIn) {
        try {
            FeedbackResult result = analyzer.analyze(diffImage, FeedbackRequestOptions.forMonitoring());
            log.info("Feedback analysis for session {} completed: {} issue(s), {} suggestion(s), confidence {}",
                    sessionKey, result.issues().size(), result.suggestions().size(),
                    String.format("%.2f", result.confidence()));
        } catch (FeedbackException e) {
            log.error("Feedback analysis failed for session {} [{}]: {}", sessionKey, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Feedback analysis failed for session {} ({})", sessionKey, diffImage, e);
        } finally {
            onAnalysisFinished(sessionKey, startedIn);
        }
    }

    private synchronized void onAnalysisFinished(String sessionKey, long startedIn) {
        if (startedIn != epoch) {
            // cleared while running; the slot was already released
            return;
        }
        active.remove(sessionKey);
        drainOneLocked();
    }

    /** Starts the queue head if capacity and its session's rate limit allow. */
    private void drainOneLocked() {
        if (queue.isEmpty() || active.size() >= options.maxConcurrent()) {
            return;
        }
        Pending next = queue.pollFirst();
        long now = clock.millis();
        long sinceLast = sinceLastTrigger(next.sessionKey(), now);
        if (sinceLast < options.rateLimitMs()) {
            queue.addLast(next);
            log.debug("Queued feedback for session {} still rate-limited, re-queued", next.sessionKey());
            scheduleDeferredDrain(options.rateLimitMs() - sinceLast);
            return;
        }
        log.debug("Dequeued feedback for session {} after {} ms in queue",
                next.sessionKey(), now - next.enqueuedAt());
        if (!startLocked(next.sessionKey(), next.diffImage(), now)) {
            queue.addFirst(next);
        }
    }

    private void scheduleDeferredDrain(long delayMs) {
        if (retryTimer == null) {
            return;
        }
        try {
            retryTimer.schedule(this::drainDeferred, Math.max(1, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Retry timer unavailable, queued feedback waits for the next completion");
        }
    }

    private synchronized void drainDeferred() {
        drainOneLocked();
    }

    private record Pending(String sessionKey, Path diffImage, long enqueuedAt) {}
}
