package visualwatch.feedback;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import visualwatch.TestImages;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

public class LLMFeedbackAnalyzerTest {

    private Path tempDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("llm-feedback-test");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        TestImages.deleteRecursively(tempDir);
    }

    // ── Reply parsing ─────────────────────────────────────────────────────

    @Test
    public void parseReply_readsAllLineKinds() {
        FeedbackResult result = LLMFeedbackAnalyzer.parseReply("""
                SUMMARY: The navigation bar shifted down.
                ISSUE: medium | spacing | Extra top margin on nav
                ISSUE: critical | layout | Hero image overlaps the header
                SUGGESTION: css | Reset margin | nav { margin-top: 0; }
                SUGGESTION: general | Check banner | A cookie banner may push content
                CONFIDENCE: 0.8
                """);

        assertThat(result.summary()).isEqualTo("The navigation bar shifted down.");
        assertThat(result.issues()).extracting(FeedbackResult.Issue::severity)
                .containsExactly(FeedbackResult.Severity.CRITICAL, FeedbackResult.Severity.MEDIUM);
        assertThat(result.issues().get(0).type()).isEqualTo("layout");
        assertThat(result.suggestions()).extracting(FeedbackResult.Suggestion::type)
                .containsExactly(FeedbackResult.SuggestionType.CSS, FeedbackResult.SuggestionType.GENERAL);
        assertThat(result.suggestions().get(1).priority()).isEqualTo(2);
        assertThat(result.priority()).isEqualTo("high");
        assertThat(result.confidence()).isEqualTo(0.8);
    }

    @Test
    public void parseReply_ignoresNoiseAndClampsConfidence() {
        FeedbackResult result = LLMFeedbackAnalyzer.parseReply("""
                Sure! Here is my analysis.
                ISSUE: odd | content
                ISSUE: weird | content | Unknown severity falls back to medium
                CONFIDENCE: 7
                """);

        assertThat(result.summary()).isEmpty();
        assertThat(result.issues()).singleElement()
                .extracting(FeedbackResult.Issue::severity).isEqualTo(FeedbackResult.Severity.MEDIUM);
        assertThat(result.priority()).isEqualTo("medium");
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @Test
    public void parseReply_noIssues_isLowPriority() {
        FeedbackResult result = LLMFeedbackAnalyzer.parseReply("SUMMARY: nothing notable\nCONFIDENCE: abc");

        assertThat(result.hasIssues()).isFalse();
        assertThat(result.priority()).isEqualTo("low");
        assertThat(result.confidence()).isEqualTo(0.5);
    }

    // ── Measurement ───────────────────────────────────────────────────────

    @Test(description = "Red pixels are counted and bounded")
    public void measure_findsHighlightedArea() throws Exception {
        BufferedImage img = TestImages.solid(20, 10, Color.GRAY);
        for (int y = 2; y <= 4; y++) {
            for (int x = 5; x <= 8; x++) {
                img.setRGB(x, y, 0xFF0000);
            }
        }
        Path diff = TestImages.writePng(tempDir.resolve("diff.png"), img);

        LLMFeedbackAnalyzer.DiffStats stats = LLMFeedbackAnalyzer.measure(diff);

        assertThat(stats.width()).isEqualTo(20);
        assertThat(stats.height()).isEqualTo(10);
        assertThat(stats.changedPixels()).isEqualTo(12);
        assertThat(stats.boundingBox()).containsExactly(5, 2, 4, 3);
        assertThat(stats.changedPercentage()).isEqualTo(6.0);
    }

    @Test
    public void measure_noChange_hasNoBoundingBox() throws Exception {
        Path diff = TestImages.solidPng(tempDir.resolve("same.png"), 4, 4, Color.WHITE);

        LLMFeedbackAnalyzer.DiffStats stats = LLMFeedbackAnalyzer.measure(diff);

        assertThat(stats.changedPixels()).isZero();
        assertThat(stats.boundingBox()).isNull();
        assertThat(stats.toString()).contains("changed area none");
    }

    @Test
    public void measure_notAnImage_throwsAnalysisFailed() throws Exception {
        Path bogus = Files.writeString(tempDir.resolve("diff.png"), "not an image");

        assertThatThrownBy(() -> LLMFeedbackAnalyzer.measure(bogus))
                .isInstanceOf(FeedbackException.class)
                .extracting(e -> ((FeedbackException) e).getCode())
                .isEqualTo(FeedbackException.ANALYSIS_FAILED);
    }

    // ── analyze() ─────────────────────────────────────────────────────────

    @Test
    public void analyze_missingDiff_throwsNotFound() {
        LLMFeedbackAnalyzer analyzer = new LLMFeedbackAnalyzer(mock(LLMClient.class));

        assertThatThrownBy(() -> analyzer.analyze(tempDir.resolve("missing.png"),
                FeedbackRequestOptions.forMonitoring()))
                .isInstanceOf(FeedbackException.class)
                .extracting(e -> ((FeedbackException) e).getCode())
                .isEqualTo(FeedbackException.DIFF_IMAGE_NOT_FOUND);
    }

    @Test
    public void analyze_sendsMeasurementsAndParsesReply() throws Exception {
        LLMClient llm = mock(LLMClient.class);
        when(llm.complete(anyList())).thenReturn("SUMMARY: button recoloured\nCONFIDENCE: 0.9");
        Path diff = TestImages.solidPng(tempDir.resolve("diff.png"), 8, 8, Color.RED);

        FeedbackResult result = new LLMFeedbackAnalyzer(llm).analyze(diff, FeedbackRequestOptions.forMonitoring());

        assertThat(result.summary()).isEqualTo("button recoloured");
        verify(llm).complete(argThat(messages -> messages.size() == 2
                && messages.get(1).content().contains("64 changed pixels")
                && messages.get(1).content().contains("layout, colors")));
    }

    @Test(description = "An unreachable endpoint degrades to an 'unavailable' result")
    public void analyze_endpointDown_returnsUnavailable() throws Exception {
        LLMClient llm = mock(LLMClient.class);
        when(llm.complete(anyList())).thenThrow(new IOException("connection refused"));
        Path diff = TestImages.solidPng(tempDir.resolve("diff.png"), 2, 2, Color.RED);

        FeedbackResult result = new LLMFeedbackAnalyzer(llm).analyze(diff, FeedbackRequestOptions.forMonitoring());

        assertThat(result.summary()).contains("unavailable").contains("connection refused");
        assertThat(result.confidence()).isZero();
    }
}
