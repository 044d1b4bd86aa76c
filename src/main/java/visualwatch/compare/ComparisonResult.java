package visualwatch.compare;

import java.nio.file.Path;

/**
 * Outcome of comparing a capture with its reference.
 *
 * @param differencePercentage share of differing pixels, 0-100
 * @param pixelsDifferent      number of differing pixels
 * @param totalPixels          pixels compared
 * @param diffImagePath        highlighted diff image, or {@code null} if none was written
 * @param isMatch              {@code differencePercentage <= tolerance}
 */
public record ComparisonResult(double differencePercentage, long pixelsDifferent, long totalPixels,
                               Path diffImagePath, boolean isMatch) {}
