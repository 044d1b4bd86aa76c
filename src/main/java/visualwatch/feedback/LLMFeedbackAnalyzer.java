package visualwatch.feedback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Feedback analyzer backed by a chat-completion LLM.
 *
 * <p>The diff image itself is not uploaded. The analyzer measures it locally
 * (size, share of highlighted pixels, bounding box of the changed area) and
 * asks the model to interpret those measurements. The model must answer in a
 * line-oriented format:
 * <pre>
 * SUMMARY: &lt;one or two sentences&gt;
 * ISSUE: &lt;low|medium|high|critical&gt; | &lt;type&gt; | &lt;description&gt;
 * SUGGESTION: &lt;css|general&gt; | &lt;title&gt; | &lt;description&gt;
 * CONFIDENCE: &lt;0.0-1.0&gt;
 * </pre>
 * Unparseable lines are ignored. If the endpoint cannot be reached the result
 * is {@link FeedbackResult#unavailable(String)} rather than an exception.
 */
public class LLMFeedbackAnalyzer implements FeedbackAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LLMFeedbackAnalyzer.class);

    /** Pure red marks a changed pixel in diff images written by the pixel-diff comparison. */
    private static final int HIGHLIGHT_RGB = 0xFF0000;

    private final LLMClient llmClient;

    public LLMFeedbackAnalyzer(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public FeedbackResult analyze(Path diffImage, FeedbackRequestOptions options) throws FeedbackException {
        if (!Files.isRegularFile(diffImage)) {
            throw new FeedbackException(FeedbackException.DIFF_IMAGE_NOT_FOUND,
                    "Diff image not found: " + diffImage);
        }
        DiffStats stats = measure(diffImage);
        log.debug("Diff {} measured: {}", diffImage, stats);

        String reply;
        try {
            reply = llmClient.complete(List.of(
                    LLMClient.ChatMessage.system(buildSystemPrompt()),
                    LLMClient.ChatMessage.user(buildPrompt(stats, options))));
        } catch (IOException e) {
            log.warn("LLM feedback request failed: {}", e.getMessage());
            return FeedbackResult.unavailable(e.getMessage());
        }
        return parseReply(reply);
    }

    // ── Measurement ──────────────────────────────────────────────────────

    static DiffStats measure(Path diffImage) throws FeedbackException {
        BufferedImage img;
        try {
            img = ImageIO.read(diffImage.toFile());
        } catch (IOException e) {
            throw new FeedbackException(FeedbackException.ANALYSIS_FAILED,
                    "Could not read diff image " + diffImage + ": " + e.getMessage(), e);
        }
        if (img == null) {
            throw new FeedbackException(FeedbackException.ANALYSIS_FAILED,
                    "Unsupported diff image format: " + diffImage);
        }

        int width = img.getWidth();
        int height = img.getHeight();
        int changed = 0;
        int minX = width, minY = height, maxX = -1, maxY = -1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if ((img.getRGB(x, y) & 0xFFFFFF) == HIGHLIGHT_RGB) {
                    changed++;
                    minX = Math.min(minX, x);
                    minY = Math.min(minY, y);
                    maxX = Math.max(maxX, x);
                    maxY = Math.max(maxY, y);
                }
            }
        }
        return new DiffStats(width, height, changed,
                changed == 0 ? null : new int[]{minX, minY, maxX - minX + 1, maxY - minY + 1});
    }

    record DiffStats(int width, int height, int changedPixels, int[] boundingBox) {

        double changedPercentage() {
            long total = (long) width * height;
            return total == 0 ? 0.0 : changedPixels * 100.0 / total;
        }

        @Override
        public String toString() {
            String box = boundingBox == null ? "none"
                    : String.format("x=%d y=%d w=%d h=%d", boundingBox[0], boundingBox[1], boundingBox[2], boundingBox[3]);
            return String.format(Locale.ROOT, "%dx%d, %d changed pixels (%.2f%%), changed area %s",
                    width, height, changedPixels, changedPercentage(), box);
        }
    }

    // ── Prompt construction ──────────────────────────────────────────────

    private static String buildSystemPrompt() {
        return """
                You are a front-end engineer reviewing a visual regression between a reference
                screenshot and a new capture of the same page.
                Respond ONLY with lines in this format (no other text):
                SUMMARY: <one or two sentences describing the likely change>
                ISSUE: <low|medium|high|critical> | <layout|colors|typography|spacing|content> | <description>
                SUGGESTION: <css|general> | <short title> | <concrete fix>
                CONFIDENCE: <number between 0 and 1>
                """;
    }

    private static String buildPrompt(DiffStats stats, FeedbackRequestOptions options) {
        String focus = options.priority().stream()
                .map(a -> a.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder();
        sb.append("Diff measurements: ").append(stats).append('\n');
        sb.append("Focus areas, most important first: ").append(focus).append('\n');
        sb.append("Suggestion kinds wanted: ").append(options.suggestionsType().name().toLowerCase(Locale.ROOT)).append('\n');
        if (options.context() != null && !options.context().isBlank()) {
            sb.append("Page context: ").append(options.context()).append('\n');
        }
        return sb.toString();
    }

    // ── Reply parsing ────────────────────────────────────────────────────

    static FeedbackResult parseReply(String reply) {
        String summary = "";
        List<FeedbackResult.Issue> issues = new ArrayList<>();
        List<FeedbackResult.Suggestion> suggestions = new ArrayList<>();
        double confidence = 0.5;

        for (String raw : reply.split("\\R")) {
            String line = raw.trim();
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String key = line.substring(0, colon).trim().toUpperCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            switch (key) {
                case "SUMMARY" -> summary = value;
                case "ISSUE" -> {
                    String[] parts = value.split("\\|", 3);
                    if (parts.length == 3) {
                        issues.add(new FeedbackResult.Issue(parts[1].trim(),
                                parseSeverity(parts[0].trim()), parts[2].trim()));
                    }
                }
                case "SUGGESTION" -> {
                    String[] parts = value.split("\\|", 3);
                    if (parts.length == 3) {
                        FeedbackResult.SuggestionType type = "css".equalsIgnoreCase(parts[0].trim())
                                ? FeedbackResult.SuggestionType.CSS
                                : FeedbackResult.SuggestionType.GENERAL;
                        suggestions.add(new FeedbackResult.Suggestion(type, parts[1].trim(),
                                parts[2].trim(), null, suggestions.size() + 1));
                    }
                }
                case "CONFIDENCE" -> confidence = parseConfidence(value, confidence);
                default -> { /* ignore unknown keys */ }
            }
        }

        issues.sort((a, b) -> b.severity().compareTo(a.severity()));
        String priority = issues.isEmpty() ? "low"
                : issues.get(0).severity().compareTo(FeedbackResult.Severity.HIGH) >= 0 ? "high" : "medium";
        return new FeedbackResult(summary, issues, suggestions, priority, confidence);
    }

    private static FeedbackResult.Severity parseSeverity(String raw) {
        try {
            return FeedbackResult.Severity.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FeedbackResult.Severity.MEDIUM;
        }
    }

    private static double parseConfidence(String raw, double fallback) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            log.debug("Unparseable confidence '{}', keeping {}", raw, fallback);
            return fallback;
        }
    }
}
