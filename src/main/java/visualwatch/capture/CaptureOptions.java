package visualwatch.capture;

import java.nio.file.Path;

/**
 * Per-capture settings.
 *
 * @param format    image format, {@code png} or {@code jpeg}
 * @param fileName  file name to use, or {@code null} to let the provider pick one
 * @param fullPage  capture the whole scrollable page (URL targets only)
 * @param outputDir directory the provider writes into
 */
public record CaptureOptions(String format, String fileName, boolean fullPage, Path outputDir) {

    public CaptureOptions {
        if (format == null || format.isBlank()) {
            format = "png";
        }
        if (!format.equals("png") && !format.equals("jpeg")) {
            throw new IllegalArgumentException("Unsupported capture format: " + format);
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir is required");
        }
    }

    /** PNG, provider-chosen name, viewport only. */
    public static CaptureOptions png(Path outputDir) {
        return new CaptureOptions("png", null, false, outputDir);
    }
}
