package visualwatch.compare;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import visualwatch.TestImages;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class PixelDiffComparisonProviderTest {

    private Path tempDir;
    private Path diffDir;
    private final PixelDiffComparisonProvider provider = new PixelDiffComparisonProvider();

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("pixel-diff-test");
        diffDir = tempDir.resolve("diffs");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        TestImages.deleteRecursively(tempDir);
    }

    @Test
    public void identicalImages_matchWithZeroDifference() throws Exception {
        Path ref = TestImages.solidPng(tempDir.resolve("ref.png"), 50, 40, Color.WHITE);
        Path cur = TestImages.solidPng(tempDir.resolve("cur.png"), 50, 40, Color.WHITE);

        ComparisonResult result = provider.compare(cur, ref, ComparisonOptions.withTolerance(0, diffDir));

        assertThat(result.differencePercentage()).isZero();
        assertThat(result.pixelsDifferent()).isZero();
        assertThat(result.totalPixels()).isEqualTo(2000);
        assertThat(result.isMatch()).isTrue();
        assertThat(result.diffImagePath()).isEqualTo(diffDir.resolve("cur_diff.png")).isRegularFile();
    }

    @Test(description = "A 10x10 changed block in a 100x100 image is 1%, highlighted red in the diff")
    public void changedBlock_isMeasuredAndHighlighted() throws Exception {
        Path ref = TestImages.solidPng(tempDir.resolve("ref.png"), 100, 100, Color.WHITE);
        BufferedImage changed = TestImages.solid(100, 100, Color.WHITE);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                changed.setRGB(x, y, 0x000000);
            }
        }
        Path cur = TestImages.writePng(tempDir.resolve("cur.png"), changed);

        ComparisonResult result = provider.compare(cur, ref, ComparisonOptions.withTolerance(0.5, diffDir));

        assertThat(result.pixelsDifferent()).isEqualTo(100);
        assertThat(result.differencePercentage()).isEqualTo(1.0);
        assertThat(result.isMatch()).isFalse();

        BufferedImage diff = ImageIO.read(result.diffImagePath().toFile());
        assertThat(diff.getRGB(5, 5) & 0xFFFFFF).isEqualTo(PixelDiffComparisonProvider.HIGHLIGHT_RGB);
        assertThat(diff.getRGB(50, 50) & 0xFFFFFF).as("unchanged pixels are dimmed").isEqualTo(0x7F7F7F);
    }

    @Test
    public void differenceWithinTolerance_isAMatch() throws Exception {
        Path ref = TestImages.solidPng(tempDir.resolve("ref.png"), 10, 10, Color.WHITE);
        BufferedImage img = TestImages.solid(10, 10, Color.WHITE);
        img.setRGB(0, 0, 0x000000);
        Path cur = TestImages.writePng(tempDir.resolve("cur.png"), img);

        ComparisonResult result = provider.compare(cur, ref, ComparisonOptions.withTolerance(1.0, diffDir));

        assertThat(result.differencePercentage()).isEqualTo(1.0);
        assertThat(result.isMatch()).isTrue();
    }

    @Test
    public void channelNoise_isIgnored() throws Exception {
        Path ref = TestImages.solidPng(tempDir.resolve("ref.png"), 10, 10, new Color(100, 100, 100));
        Path cur = TestImages.solidPng(tempDir.resolve("cur.png"), 10, 10, new Color(110, 95, 105));

        ComparisonResult result = provider.compare(cur, ref, new ComparisonOptions(0, false, null));

        assertThat(result.pixelsDifferent()).isZero();
        assertThat(result.diffImagePath()).isNull();
        assertThat(diffDir).doesNotExist();
    }

    @Test
    public void isSignificantDiff_usesPerChannelThreshold() {
        assertThat(PixelDiffComparisonProvider.isSignificantDiff(0x646464, 0x6E6464)).isFalse();
        assertThat(PixelDiffComparisonProvider.isSignificantDiff(0x646464, 0x646470)).isTrue();
        assertThat(PixelDiffComparisonProvider.isSignificantDiff(0xFF000000, 0x00000000)).as("alpha ignored").isFalse();
    }

    @Test(description = "The part of the larger image outside the common area counts as changed")
    public void sizeMismatch_countsUncoveredAreaAsChanged() throws Exception {
        Path ref = TestImages.solidPng(tempDir.resolve("ref.png"), 10, 10, Color.WHITE);
        Path cur = TestImages.solidPng(tempDir.resolve("cur.png"), 20, 10, Color.WHITE);

        ComparisonResult result = provider.compare(cur, ref, ComparisonOptions.withTolerance(5, diffDir));

        assertThat(result.totalPixels()).isEqualTo(200);
        assertThat(result.pixelsDifferent()).isEqualTo(100);
        assertThat(result.differencePercentage()).isEqualTo(50.0);
    }

    @Test
    public void missingReference_throwsImageNotFound() throws Exception {
        Path cur = TestImages.solidPng(tempDir.resolve("cur.png"), 5, 5, Color.WHITE);

        assertThatThrownBy(() -> provider.compare(cur, tempDir.resolve("nope.png"),
                ComparisonOptions.withTolerance(5, diffDir)))
                .isInstanceOf(ComparisonException.class)
                .hasMessageContaining("reference")
                .extracting(e -> ((ComparisonException) e).getCode())
                .isEqualTo(ComparisonException.IMAGE_NOT_FOUND);
    }

    @Test
    public void nonImageFile_throwsUnreadable() throws Exception {
        Path ref = TestImages.solidPng(tempDir.resolve("ref.png"), 5, 5, Color.WHITE);
        Path cur = Files.writeString(tempDir.resolve("cur.png"), "plain text");

        assertThatThrownBy(() -> provider.compare(cur, ref, ComparisonOptions.withTolerance(5, diffDir)))
                .isInstanceOf(ComparisonException.class)
                .extracting(e -> ((ComparisonException) e).getCode())
                .isEqualTo(ComparisonException.UNREADABLE_IMAGE);
    }

    @Test
    public void options_validateTolerance() {
        assertThatThrownBy(() -> new ComparisonOptions(-1, false, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ComparisonOptions(101, false, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ComparisonOptions(5, true, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
