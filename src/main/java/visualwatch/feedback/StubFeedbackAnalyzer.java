package visualwatch.feedback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op analyzer used when {@code feedback.analyzer=stub} (the default).
 * Always returns an empty result, so monitoring works without an LLM endpoint.
 */
public class StubFeedbackAnalyzer implements FeedbackAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StubFeedbackAnalyzer.class);

    @Override
    public FeedbackResult analyze(Path diffImage, FeedbackRequestOptions options) {
        log.debug("FeedbackAnalyzer: stub, no analysis for {}", diffImage);
        return new FeedbackResult("No analyzer configured", List.of(), List.of(), "low", 0.0);
    }
}
