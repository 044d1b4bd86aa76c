package visualwatch.feedback;

import java.nio.file.Path;

/**
 * Turns a diff visualisation into actionable UI feedback.
 * Default implementation is {@link StubFeedbackAnalyzer} (returns an empty result).
 */
public interface FeedbackAnalyzer {

    /**
     * Analyses a diff image produced by a comparison.
     *
     * @param diffImage path to the diff visualisation
     * @param options   areas to focus on and kind of suggestions wanted
     * @return the analysis; never null
     * @throws FeedbackException if the diff image cannot be analysed at all
     */
    FeedbackResult analyze(Path diffImage, FeedbackRequestOptions options) throws FeedbackException;
}
