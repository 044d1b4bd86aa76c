package visualwatch.compare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Pixel-by-pixel comparison.
 *
 * <p>Images of different sizes are compared over their common area, and the
 * uncovered part of the larger image counts as changed. A pixel differs when
 * any RGB channel moves by more than {@value #CHANNEL_NOISE}/255, which keeps
 * anti-aliasing noise out of the result.
 *
 * <p>The diff image shows changed pixels in pure red ({@code 0xFF0000}) over a
 * dimmed copy of the reference.
 */
public class PixelDiffComparisonProvider implements ComparisonProvider {

    private static final Logger log = LoggerFactory.getLogger(PixelDiffComparisonProvider.class);

    static final int CHANNEL_NOISE = 10;
    static final int HIGHLIGHT_RGB = 0xFF0000;

    @Override
    public ComparisonResult compare(Path current, Path reference, ComparisonOptions options) throws ComparisonException {
        BufferedImage ref = read(reference, "reference");
        BufferedImage cur = read(current, "current");

        int width  = Math.min(ref.getWidth(),  cur.getWidth());
        int height = Math.min(ref.getHeight(), cur.getHeight());
        long total = (long) Math.max(ref.getWidth(), cur.getWidth()) * Math.max(ref.getHeight(), cur.getHeight());
        long common = (long) width * height;
        long diff = total - common;

        BufferedImage diffImage = options.writeDiffImage()
                ? new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB) : null;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rRgb = ref.getRGB(x, y);
                int cRgb = cur.getRGB(x, y);
                boolean changed = rRgb != cRgb && isSignificantDiff(rRgb, cRgb);
                if (changed) {
                    diff++;
                }
                if (diffImage != null) {
                    diffImage.setRGB(x, y, changed ? HIGHLIGHT_RGB : (rRgb & 0xFEFEFE) >> 1);
                }
            }
        }

        double percentage = total == 0 ? 0.0 : diff * 100.0 / total;
        Path diffPath = diffImage != null ? writeDiff(diffImage, current, options.outputDir()) : null;
        boolean match = percentage <= options.tolerance();

        log.debug("Compared {} with {}: {}% ({}/{} pixels), match={}",
                current.getFileName(), reference.getFileName(),
                String.format(Locale.ROOT, "%.3f", percentage), diff, total, match);
        return new ComparisonResult(percentage, diff, total, diffPath, match);
    }

    /**
     * Returns {@code true} if the two RGB values differ by more than the noise
     * threshold on any channel.
     */
    static boolean isSignificantDiff(int rgb1, int rgb2) {
        int dr = Math.abs(((rgb1 >> 16) & 0xFF) - ((rgb2 >> 16) & 0xFF));
        int dg = Math.abs(((rgb1 >>  8) & 0xFF) - ((rgb2 >>  8) & 0xFF));
        int db = Math.abs(( rgb1        & 0xFF) - ( rgb2        & 0xFF));
        return dr > CHANNEL_NOISE || dg > CHANNEL_NOISE || db > CHANNEL_NOISE;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static BufferedImage read(Path path, String role) throws ComparisonException {
        if (!Files.isRegularFile(path)) {
            throw new ComparisonException(ComparisonException.IMAGE_NOT_FOUND,
                    "The " + role + " image does not exist: " + path);
        }
        try {
            BufferedImage img = ImageIO.read(path.toFile());
            if (img == null) {
                throw new ComparisonException(ComparisonException.UNREADABLE_IMAGE,
                        "The " + role + " image is not a supported format: " + path);
            }
            return img;
        } catch (IOException e) {
            throw new ComparisonException(ComparisonException.UNREADABLE_IMAGE,
                    "Could not read " + role + " image " + path + ": " + e.getMessage(), e);
        }
    }

    private static Path writeDiff(BufferedImage diffImage, Path current, Path outputDir) throws ComparisonException {
        String name = current.getFileName().toString();
        int dot = name.lastIndexOf('.');
        Path diffPath = outputDir.resolve((dot > 0 ? name.substring(0, dot) : name) + "_diff.png");
        try {
            Files.createDirectories(outputDir);
            ImageIO.write(diffImage, "PNG", diffPath.toFile());
            return diffPath;
        } catch (IOException e) {
            throw new ComparisonException(ComparisonException.COMPARISON_FAILED,
                    "Could not write diff image " + diffPath + ": " + e.getMessage(), e);
        }
    }
}
