package visualwatch.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * Runs one {@link ScheduledTask} repeatedly on a shared
 * {@link ScheduledExecutorService}, never two runs at once.
 *
 * <p>Each run is armed as a one-shot timer only after the previous run has
 * returned, with a delay of {@code currentBackoff + uniform[0, maxJitter]}.
 * A failed run lengthens the backoff to
 * {@code min(interval * multiplier^consecutiveErrors, maxBackoff)}; a
 * successful run resets it to the interval. Task failures, {@link Error}s
 * included, are logged and never stop the scheduler: only {@link #stop()} does.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * ScheduledExecutorService timers = TaskScheduler.newTimerPool(2);
 * TaskScheduler scheduler = new TaskScheduler("session-42", this::tick,
 *         SchedulerOptions.builder(5_000).maxJitterMs(500).backoffMultiplier(2).maxBackoffMs(60_000).build(),
 *         timers);
 * scheduler.start();
 * // ...
 * scheduler.stop();
 * }</pre>
 *
 * <p>{@code stop()} cancels the pending timer but does not interrupt a run in
 * progress; that run completes and nothing is armed after it.
 * {@link #awaitIdle(Duration)} waits for it.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final String                   name;
    private final ScheduledTask            task;
    private final SchedulerOptions         options;
    private final ScheduledExecutorService timers;
    private final DoubleSupplier           random;

    /** Held for the whole duration of a run. */
    private final ReentrantLock executionLock = new ReentrantLock();

    // Guarded by this
    private boolean            running;
    private long               generation;
    private ScheduledFuture<?> pending;
    private int                consecutiveErrors;
    private long               currentBackoffMs;

    public TaskScheduler(String name, ScheduledTask task, SchedulerOptions options,
                         ScheduledExecutorService timers) {
        this(name, task, options, timers, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Package-private constructor for tests: {@code random} must return values
     * in {@code [0, 1]} and drives the jitter.
     */
    TaskScheduler(String name, ScheduledTask task, SchedulerOptions options,
                  ScheduledExecutorService timers, DoubleSupplier random) {
        this.name             = Objects.requireNonNull(name, "name");
        this.task             = Objects.requireNonNull(task, "task");
        this.options          = Objects.requireNonNull(options, "options");
        this.timers           = Objects.requireNonNull(timers, "timers");
        this.random           = Objects.requireNonNull(random, "random");
        this.currentBackoffMs = options.intervalMs();
    }

    /**
     * Creates a pool of daemon timer threads suitable for sharing between many
     * schedulers.
     */
    public static ScheduledExecutorService newTimerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "visualwatch-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /**
     * Starts the scheduler: resets error count and backoff, then arms the
     * first delayed run. A second call while running is ignored.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler '{}' already running, ignoring start()", name);
            return;
        }
        running           = true;
        generation++;
        consecutiveErrors = 0;
        currentBackoffMs  = options.intervalMs();
        log.debug("Scheduler '{}' started: {}", name, options);
        scheduleNext(generation);
    }

    /** Stops the scheduler. Safe to call repeatedly. */
    public synchronized void stop() {
        if (!running) {
            log.debug("Scheduler '{}' not running, stop() is a no-op", name);
            return;
        }
        running = false;
        generation++;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        log.debug("Scheduler '{}' stopped", name);
    }

    /**
     * Blocks until no run is in progress.
     *
     * @return {@code true} if idle, {@code false} on timeout or interrupt
     */
    public boolean awaitIdle(Duration timeout) {
        try {
            if (executionLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executionLock.unlock();
                return true;
            }
            log.warn("Scheduler '{}' still executing after {} ms", name, timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ── State ─────────────────────────────────────────────────────────────

    public synchronized boolean isRunning()            { return running; }
    public synchronized int     getConsecutiveErrors() { return consecutiveErrors; }
    public synchronized long    getCurrentBackoffMs()  { return currentBackoffMs; }
    public boolean              isExecuting()          { return executionLock.isLocked(); }
    public String               getName()              { return name; }
    public SchedulerOptions     getOptions()           { return options; }

    // ── Internals ─────────────────────────────────────────────────────────

    /** Delay for the next run: current backoff plus bounded jitter. */
    synchronized long nextDelayMs() {
        long delay = currentBackoffMs;
        if (options.maxJitterMs() > 0) {
            double r = Math.min(1.0, Math.max(0.0, random.getAsDouble()));
            delay += Math.round(r * options.maxJitterMs());
        }
        return delay;
    }

    private synchronized void scheduleNext(long gen) {
        if (!running || gen != generation) {
            return;
        }
        long delay = nextDelayMs();
        log.debug("Scheduler '{}' next run in {} ms", name, delay);
        try {
            pending = timers.schedule(() -> runTask(gen), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler '{}' could not arm next run (timer pool shut down)", name);
            running = false;
            pending = null;
        }
    }

    private synchronized boolean isCurrent(long gen) {
        return running && gen == generation;
    }

    private void runTask(long gen) {
        if (!isCurrent(gen)) {
            return;
        }
        executionLock.lock();
        try {
            if (!isCurrent(gen)) {
                return;
            }
            try {
                task.run();
                onSuccess(gen);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                onFailure(gen, e);
            } catch (Exception | Error e) {
                onFailure(gen, e);
            }
        } finally {
            executionLock.unlock();
        }
        scheduleNext(gen);
    }

    // A run that outlived a stop()/start() cycle must not touch the new cycle's backoff.
    private synchronized void onSuccess(long gen) {
        if (gen != generation) return;
        consecutiveErrors = 0;
        currentBackoffMs  = options.intervalMs();
        log.debug("Scheduler '{}' run completed", name);
    }

    private synchronized void onFailure(long gen, Throwable e) {
        if (gen != generation) {
            log.warn("Scheduler '{}' run failed after stop: {}", name, e.getMessage());
            return;
        }
        consecutiveErrors++;
        currentBackoffMs = options.backoffFor(consecutiveErrors);
        log.error("Scheduler '{}' run failed ({} in a row), next attempt in ~{} ms: {}",
                name, consecutiveErrors, currentBackoffMs, e.getMessage(), e);
    }
}
