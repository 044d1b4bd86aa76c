package visualwatch.feedback;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import visualwatch.MutableClock;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Analyses are handed to a recording executor so each test decides when they
 * run and complete.
 */
public class FeedbackDispatcherTest {

    private static final Path DIFF = Path.of("diff.png");

    private FeedbackAnalyzer analyzer;
    private List<Runnable> submitted;
    private MutableClock clock;

    @BeforeMethod
    public void setUp() throws Exception {
        analyzer  = mock(FeedbackAnalyzer.class);
        when(analyzer.analyze(any(), any())).thenReturn(FeedbackResult.unavailable("test"));
        submitted = new ArrayList<>();
        clock     = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    }

    private FeedbackDispatcher dispatcher(long rateLimitMs, int maxConcurrent) {
        return new FeedbackDispatcher(analyzer, new FeedbackOptions(true, rateLimitMs, maxConcurrent),
                submitted::add, null, clock);
    }

    // ── Gates ─────────────────────────────────────────────────────────────

    @Test
    public void disabled_refusesWithoutSideEffects() throws Exception {
        FeedbackDispatcher d = new FeedbackDispatcher(analyzer, FeedbackOptions.disabled(), submitted::add, null, clock);

        assertThat(d.trigger("a", DIFF)).isFalse();

        assertThat(submitted).isEmpty();
        assertThat(d.getQueueSize()).isZero();
        verifyNoInteractions(analyzer);
    }

    @Test(description = "Rate limiting is per session: A is refused within its window, B is accepted")
    public void rateLimit_isPerKey() {
        FeedbackDispatcher d = dispatcher(60_000, 5);

        assertThat(d.trigger("a", DIFF)).isTrue();
        clock.advanceMillis(1_000);
        assertThat(d.trigger("a", DIFF)).isFalse();
        assertThat(d.trigger("b", DIFF)).isTrue();

        clock.advanceMillis(59_000);
        assertThat(d.trigger("a", DIFF)).as("window elapsed").isTrue();
        assertThat(d.getQueueSize()).as("rate-limited requests are dropped, not queued").isZero();
    }

    @Test
    public void start_runsAnalyzerWithMonitoringOptions() throws Exception {
        FeedbackDispatcher d = dispatcher(0, 1);

        d.trigger("a", DIFF);
        submitted.get(0).run();

        verify(analyzer).analyze(eq(DIFF), eq(FeedbackRequestOptions.forMonitoring()));
        assertThat(d.getActiveCount()).isZero();
    }

    @Test(description = "Excess requests wait in FIFO order and start as slots free up")
    public void concurrencyLimit_queuesFifo() {
        FeedbackDispatcher d = dispatcher(0, 1);

        assertThat(d.trigger("a", Path.of("a.png"))).isTrue();
        assertThat(d.trigger("b", Path.of("b.png"))).isFalse();
        assertThat(d.trigger("c", Path.of("c.png"))).isFalse();
        assertThat(d.getActiveCount()).isEqualTo(1);
        assertThat(d.getQueueSize()).isEqualTo(2);

        submitted.get(0).run();
        assertThat(submitted).hasSize(2);
        assertThat(d.getQueueSize()).isEqualTo(1);

        submitted.get(1).run();
        submitted.get(2).run();
        assertThat(d.getQueueSize()).isZero();
        assertThat(d.getActiveCount()).isZero();
    }

    @Test
    public void queuedRequests_areServedInOrder() throws Exception {
        FeedbackDispatcher d = dispatcher(0, 1);
        d.trigger("a", Path.of("a.png"));
        d.trigger("b", Path.of("b.png"));
        d.trigger("c", Path.of("c.png"));

        for (int i = 0; i < 3; i++) {
            submitted.get(i).run();
        }

        var order = inOrder(analyzer);
        order.verify(analyzer).analyze(eq(Path.of("a.png")), any());
        order.verify(analyzer).analyze(eq(Path.of("b.png")), any());
        order.verify(analyzer).analyze(eq(Path.of("c.png")), any());
    }

    @Test(description = "Analyzer failures are absorbed and release the slot")
    public void analyzerFailure_releasesSlot() throws Exception {
        when(analyzer.analyze(any(), any()))
                .thenThrow(new FeedbackException(FeedbackException.ANALYSIS_FAILED, "bad image"))
                .thenThrow(new IllegalStateException("bug"))
                .thenReturn(FeedbackResult.unavailable("ok"));
        FeedbackDispatcher d = dispatcher(0, 1);

        d.trigger("a", DIFF);
        d.trigger("b", DIFF);
        d.trigger("c", DIFF);

        assertThatCode(() -> submitted.get(0).run()).doesNotThrowAnyException();
        assertThatCode(() -> submitted.get(1).run()).doesNotThrowAnyException();
        submitted.get(2).run();

        assertThat(d.getActiveCount()).isZero();
        verify(analyzer, times(3)).analyze(any(), any());
    }

    @Test(description = "A dequeued request still inside its rate window goes back to the tail and is retried later")
    public void drain_requeuesRateLimitedHeadAndRetriesWithTimer() {
        ScheduledExecutorService retryTimer = mock(ScheduledExecutorService.class);
        List<Runnable> deferred = new ArrayList<>();
        List<Long> delays = new ArrayList<>();
        doAnswer(inv -> {
            deferred.add(inv.getArgument(0));
            delays.add(inv.getArgument(1));
            return mock(ScheduledFuture.class);
        }).when(retryTimer).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));

        FeedbackDispatcher d = new FeedbackDispatcher(analyzer, new FeedbackOptions(true, 1_000, 1),
                submitted::add, retryTimer, clock);

        assertThat(d.trigger("a", DIFF)).isTrue();
        assertThat(d.trigger("b", DIFF)).isFalse();   // queued
        assertThat(d.trigger("b", DIFF)).isFalse();   // queued again: b has no history yet

        submitted.get(0).run();                        // a done -> first b starts
        assertThat(submitted).hasSize(2);

        submitted.get(1).run();                        // b done -> second b still rate-limited
        assertThat(submitted).hasSize(2);
        assertThat(d.getQueueSize()).isEqualTo(1);
        assertThat(delays).containsExactly(1_000L);

        clock.advanceMillis(1_000);
        deferred.get(0).run();

        assertThat(submitted).hasSize(3);
        assertThat(d.getQueueSize()).isZero();
        assertThat(d.getActiveCount()).isEqualTo(1);
    }

    @Test
    public void rejectedExecution_releasesSlot() {
        FeedbackDispatcher d = new FeedbackDispatcher(analyzer, new FeedbackOptions(true, 0, 1),
                r -> { throw new java.util.concurrent.RejectedExecutionException("shut down"); }, null, clock);

        assertThat(d.trigger("a", DIFF)).isFalse();
        assertThat(d.getActiveCount()).isZero();
    }

    @Test(description = "A queued request whose start is rejected stays at the head of the queue")
    public void rejectedDrain_keepsRequestQueuedAndRateHistoryUntouched() throws Exception {
        Path diffB = Path.of("b.png");
        AtomicBoolean rejecting = new AtomicBoolean();
        FeedbackDispatcher d = new FeedbackDispatcher(analyzer, new FeedbackOptions(true, 60_000, 1), r -> {
            if (rejecting.get()) throw new java.util.concurrent.RejectedExecutionException("shut down");
            submitted.add(r);
        }, null, clock);
        d.trigger("a", DIFF);
        d.trigger("b", diffB);

        rejecting.set(true);
        submitted.get(0).run();

        assertThat(d.getQueueSize()).isEqualTo(1);
        assertThat(d.getActiveCount()).isZero();

        rejecting.set(false);
        assertThat(d.trigger("c", DIFF)).isTrue();
        submitted.get(1).run();

        assertThat(d.getQueueSize()).isZero();
        assertThat(submitted).hasSize(3);
        submitted.get(2).run();
        verify(analyzer).analyze(eq(diffB), any());
    }

    @Test(description = "clear() forgets history, slots and queue; completions of earlier analyses are ignored")
    public void clear_resetsEverything() {
        FeedbackDispatcher d = dispatcher(60_000, 1);
        d.trigger("a", DIFF);
        d.trigger("b", DIFF);

        d.clear();

        assertThat(d.getActiveCount()).isZero();
        assertThat(d.getQueueSize()).isZero();
        assertThat(d.trigger("a", DIFF)).as("history forgotten").isTrue();

        submitted.get(0).run();                        // stale completion from before clear()
        assertThat(d.getActiveCount()).as("new analysis still counted").isEqualTo(1);
    }

    // ── Real executor ─────────────────────────────────────────────────────

    private ExecutorService pool;

    @AfterMethod
    public void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
            pool = null;
        }
    }

    @Test(description = "No more than maxConcurrent analyses run at once and none are dropped")
    public void concurrencyBound_holdsUnderLoad() throws Exception {
        pool = Executors.newFixedThreadPool(8);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch allDone = new CountDownLatch(10);
        FeedbackAnalyzer slow = (diff, opts) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            allDone.countDown();
            return FeedbackResult.unavailable("test");
        };
        FeedbackDispatcher d = new FeedbackDispatcher(slow, new FeedbackOptions(true, 0, 2), pool, null);

        for (int i = 0; i < 10; i++) {
            d.trigger("session-" + i, Path.of("diff-" + i + ".png"));
        }

        assertThat(allDone.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
    }
}
