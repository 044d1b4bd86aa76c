package visualwatch.feedback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualwatch.config.MonitorConfig;

import java.util.Locale;

/**
 * Creates the {@link FeedbackAnalyzer} selected by {@code feedback.analyzer}.
 */
public final class FeedbackAnalyzers {

    private static final Logger log = LoggerFactory.getLogger(FeedbackAnalyzers.class);

    private FeedbackAnalyzers() {}

    public static FeedbackAnalyzer create(MonitorConfig config) {
        String kind = config.getFeedbackAnalyzer().toLowerCase(Locale.ROOT);
        if ("llm".equals(kind)) {
            log.info("Feedback analyzer: LLM at {}", config.getLlmBaseUrl());
            return new LLMFeedbackAnalyzer(LLMClient.fromConfig(config));
        }
        if (!"stub".equals(kind)) {
            log.warn("Unknown feedback.analyzer '{}', using stub", kind);
        }
        log.info("Feedback analyzer: stub (feedback.analyzer={})", kind);
        return new StubFeedbackAnalyzer();
    }
}
