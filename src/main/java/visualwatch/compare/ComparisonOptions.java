package visualwatch.compare;

import java.nio.file.Path;

/**
 * @param tolerance        percentage of differing pixels still reported as a match
 * @param writeDiffImage   whether to write the highlighted diff image
 * @param outputDir        where diff images go
 */
public record ComparisonOptions(double tolerance, boolean writeDiffImage, Path outputDir) {

    public static final double DEFAULT_TOLERANCE = 5.0;

    public ComparisonOptions {
        if (tolerance < 0 || tolerance > 100) {
            throw new IllegalArgumentException("tolerance must be within 0-100, got " + tolerance);
        }
        if (writeDiffImage && outputDir == null) {
            throw new IllegalArgumentException("outputDir is required when writing diff images");
        }
    }

    public static ComparisonOptions withTolerance(double tolerance, Path outputDir) {
        return new ComparisonOptions(tolerance, true, outputDir);
    }
}
