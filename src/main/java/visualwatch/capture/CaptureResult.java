package visualwatch.capture;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A capture written to disk.
 *
 * @param path      where the image was written
 * @param width     image width in pixels
 * @param height    image height in pixels
 * @param format    {@code png} or {@code jpeg}
 * @param size      file size in bytes
 * @param timestamp when the capture was taken
 */
public record CaptureResult(Path path, int width, int height, String format, long size, Instant timestamp) {}
