package visualwatch.feedback;

import java.util.List;

/**
 * What a {@link FeedbackAnalyzer} should focus on.
 *
 * @param priority        areas to look at first, most important first
 * @param suggestionsType which kind of suggestions to produce
 * @param context         free-text hint about the page, may be null
 */
public record FeedbackRequestOptions(List<Area> priority, SuggestionsType suggestionsType, String context) {

    public enum Area { LAYOUT, COLORS, TYPOGRAPHY, SPACING, CONTENT }

    public enum SuggestionsType { CSS, GENERAL, BOTH }

    public FeedbackRequestOptions {
        priority        = priority == null || priority.isEmpty() ? List.of(Area.LAYOUT) : List.copyOf(priority);
        suggestionsType = suggestionsType == null ? SuggestionsType.BOTH : suggestionsType;
    }

    /** Options used for automatic analysis of monitoring changes. */
    public static FeedbackRequestOptions forMonitoring() {
        return new FeedbackRequestOptions(List.of(Area.LAYOUT, Area.COLORS), SuggestionsType.BOTH, null);
    }
}
