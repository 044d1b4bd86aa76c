package visualwatch.capture;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/** File naming and image writing shared by the capture providers. */
final class CaptureFiles {

    private static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private static final AtomicInteger SEQ = new AtomicInteger();

    private CaptureFiles() {}

    /** The requested name, or {@code <prefix>_<utc timestamp>_<seq>.<ext>}. */
    static Path targetFile(CaptureOptions options, String prefix, Instant now) {
        String ext = options.format().equals("jpeg") ? "jpg" : "png";
        String name = options.fileName() != null && !options.fileName().isBlank()
                ? options.fileName()
                : String.format("%s_%s_%04d.%s", prefix, TS_FMT.format(now), SEQ.incrementAndGet() % 10_000, ext);
        return options.outputDir().resolve(name);
    }

    /**
     * Writes {@code image} in the requested format.
     *
     * @return the written result
     */
    static CaptureResult write(BufferedImage image, Path file, String format, Instant timestamp) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        BufferedImage out = image;
        if (format.equals("jpeg") && image.getColorModel().hasAlpha()) {
            // JPEG has no alpha channel
            out = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
            out.getGraphics().drawImage(image, 0, 0, null);
        }
        if (!ImageIO.write(out, format.equals("jpeg") ? "jpg" : "png", file.toFile())) {
            throw new IOException("No image writer for format " + format);
        }
        return new CaptureResult(file, out.getWidth(), out.getHeight(), format, Files.size(file), timestamp);
    }

    /** Decodes PNG bytes (as returned by WebDriver) into an image. */
    static BufferedImage decode(byte[] bytes) throws IOException {
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(bytes));
        if (img == null) {
            throw new IOException("Could not decode screenshot bytes");
        }
        return img;
    }
}
