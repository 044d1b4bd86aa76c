package visualwatch.feedback;

import java.util.List;

/**
 * Structured outcome of a diff analysis.
 *
 * @param summary     one-paragraph description of what changed
 * @param issues      detected problems, most severe first
 * @param suggestions proposed fixes
 * @param priority    overall priority label ({@code low}, {@code medium}, {@code high})
 * @param confidence  analyzer confidence in {@code [0, 1]}
 */
public record FeedbackResult(String summary,
                             List<Issue> issues,
                             List<Suggestion> suggestions,
                             String priority,
                             double confidence) {

    public FeedbackResult {
        issues      = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        confidence  = Math.max(0.0, Math.min(1.0, confidence));
    }

    /** Result returned when the analyzer backend could not be reached. */
    public static FeedbackResult unavailable(String reason) {
        return new FeedbackResult("Feedback analysis unavailable: " + reason,
                List.of(), List.of(), "low", 0.0);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    // ── Nested types ──────────────────────────────────────────────────────

    public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }

    public enum SuggestionType { CSS, GENERAL }

    public record Issue(String type, Severity severity, String description) {}

    public record Suggestion(SuggestionType type, String title, String description, String code, int priority) {}
}
