package visualwatch.feedback;

/**
 * Limits applied by {@link FeedbackDispatcher}.
 *
 * @param enabled       when false every trigger is refused
 * @param rateLimitMs   minimum time between two analyses for the same session
 * @param maxConcurrent maximum analyses running at once across all sessions
 */
public record FeedbackOptions(boolean enabled, long rateLimitMs, int maxConcurrent) {

    public FeedbackOptions {
        if (rateLimitMs < 0) {
            throw new IllegalArgumentException("rateLimitMs must be >= 0: " + rateLimitMs);
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1: " + maxConcurrent);
        }
    }

    public static FeedbackOptions disabled() {
        return new FeedbackOptions(false, 0, 1);
    }
}
