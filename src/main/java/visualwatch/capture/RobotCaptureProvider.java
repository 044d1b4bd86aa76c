package visualwatch.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualwatch.model.CaptureTarget;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Captures {@link CaptureTarget.Region} targets from the local screen with
 * {@link Robot}. Window targets are not supported: AWT cannot locate another
 * process's window.
 */
public class RobotCaptureProvider implements CaptureProvider {

    private static final Logger log = LoggerFactory.getLogger(RobotCaptureProvider.class);

    /** Grabs a rectangle of the screen. */
    @FunctionalInterface
    interface ScreenGrabber {
        BufferedImage grab(Rectangle area) throws AWTException;
    }

    private final ScreenGrabber grabber;

    public RobotCaptureProvider() {
        this(new RobotGrabber());
    }

    /** Package-private constructor for tests: bypasses the real screen. */
    RobotCaptureProvider(ScreenGrabber grabber) {
        this.grabber = grabber;
    }

    @Override
    public boolean supports(CaptureTarget target) {
        return target instanceof CaptureTarget.Region;
    }

    @Override
    public CaptureResult capture(CaptureTarget target, CaptureOptions options) throws CaptureException {
        if (!(target instanceof CaptureTarget.Region)) {
            throw new CaptureException(CaptureException.UNSUPPORTED_TARGET,
                    "Screen capture supports region targets only, got " + target.kind());
        }
        CaptureTarget.Region region = (CaptureTarget.Region) target;
        Rectangle area = new Rectangle(region.x(), region.y(), region.width(), region.height());

        BufferedImage image;
        try {
            image = grabber.grab(area);
        } catch (AWTException | SecurityException e) {
            throw new CaptureException(CaptureException.CAPTURE_FAILED,
                    "Screen capture of " + area + " failed: " + e.getMessage(), e);
        }

        Instant now = Instant.now();
        Path file = CaptureFiles.targetFile(options, "region", now);
        try {
            CaptureResult result = CaptureFiles.write(image, file, options.format(), now);
            log.debug("Captured region {} -> {}", area, file);
            return result;
        } catch (IOException e) {
            throw new CaptureException(CaptureException.CAPTURE_FAILED,
                    "Could not write capture " + file + ": " + e.getMessage(), e);
        }
    }

    private static final class RobotGrabber implements ScreenGrabber {

        private Robot robot;

        @Override
        public synchronized BufferedImage grab(Rectangle area) throws AWTException {
            if (GraphicsEnvironment.isHeadless()) {
                throw new AWTException("No display available (headless environment)");
            }
            if (robot == null) {
                robot = new Robot();
            }
            return robot.createScreenCapture(area);
        }
    }
}
