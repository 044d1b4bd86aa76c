package visualwatch.scheduler;

/**
 * Timing parameters for a {@link TaskScheduler}.
 *
 * <table>
 *   <tr><th>Option</th><th>Default</th></tr>
 *   <tr><td>intervalMs</td><td>(required)</td></tr>
 *   <tr><td>maxJitterMs</td><td>0 (no jitter)</td></tr>
 *   <tr><td>backoffMultiplier</td><td>1.0 (no backoff)</td></tr>
 *   <tr><td>maxBackoffMs</td><td>intervalMs</td></tr>
 * </table>
 */
public final class SchedulerOptions {

    private final long   intervalMs;
    private final long   maxJitterMs;
    private final double backoffMultiplier;
    private final long   maxBackoffMs;

    private SchedulerOptions(Builder b) {
        this.intervalMs        = b.intervalMs;
        this.maxJitterMs       = b.maxJitterMs;
        this.backoffMultiplier = b.backoffMultiplier;
        this.maxBackoffMs      = b.maxBackoffMs != null ? b.maxBackoffMs : b.intervalMs;
    }

    public static Builder builder(long intervalMs) {
        return new Builder(intervalMs);
    }

    /** Fixed cadence: no jitter, no backoff. */
    public static SchedulerOptions fixed(long intervalMs) {
        return builder(intervalMs).build();
    }

    public long   intervalMs()        { return intervalMs; }
    public long   maxJitterMs()       { return maxJitterMs; }
    public double backoffMultiplier() { return backoffMultiplier; }
    public long   maxBackoffMs()      { return maxBackoffMs; }

    /**
     * Delay after {@code consecutiveErrors} failures in a row:
     * {@code min(interval * multiplier^errors, maxBackoff)}.
     */
    public long backoffFor(int consecutiveErrors) {
        if (consecutiveErrors <= 0) return intervalMs;
        double grown = intervalMs * Math.pow(backoffMultiplier, consecutiveErrors);
        return (long) Math.min(grown, (double) maxBackoffMs);
    }

    @Override
    public String toString() {
        return String.format("SchedulerOptions{intervalMs=%d, maxJitterMs=%d, backoffMultiplier=%.2f, maxBackoffMs=%d}",
                intervalMs, maxJitterMs, backoffMultiplier, maxBackoffMs);
    }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {

        private final long intervalMs;
        private long   maxJitterMs       = 0;
        private double backoffMultiplier = 1.0;
        private Long   maxBackoffMs;

        private Builder(long intervalMs) {
            if (intervalMs <= 0) {
                throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
            }
            this.intervalMs = intervalMs;
        }

        public Builder maxJitterMs(long maxJitterMs) {
            if (maxJitterMs < 0) {
                throw new IllegalArgumentException("maxJitterMs must be >= 0: " + maxJitterMs);
            }
            this.maxJitterMs = maxJitterMs;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1.0: " + backoffMultiplier);
            }
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxBackoffMs(long maxBackoffMs) {
            if (maxBackoffMs <= 0) {
                throw new IllegalArgumentException("maxBackoffMs must be positive: " + maxBackoffMs);
            }
            this.maxBackoffMs = maxBackoffMs;
            return this;
        }

        public SchedulerOptions build() {
            return new SchedulerOptions(this);
        }
    }
}
