package visualwatch.capture;

import org.openqa.selenium.Dimension;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualwatch.config.MonitorConfig;
import visualwatch.model.CaptureTarget;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Captures {@link CaptureTarget.Url} targets with a Selenium-driven browser.
 *
 * <p>One browser is shared by every session and created on first use.
 * Captures are serialized on it: a browser has a single active page.
 * Selenium Manager resolves the matching driver binary.
 */
public class WebDriverCaptureProvider implements CaptureProvider {

    private static final Logger log = LoggerFactory.getLogger(WebDriverCaptureProvider.class);

    private final Supplier<WebDriver> driverFactory;
    private final int                 defaultWidth;
    private final int                 defaultHeight;
    private final Duration            pageLoadTimeout;

    private WebDriver driver; // guarded by this

    public WebDriverCaptureProvider(Supplier<WebDriver> driverFactory, int defaultWidth,
                                    int defaultHeight, Duration pageLoadTimeout) {
        this.driverFactory   = Objects.requireNonNull(driverFactory, "driverFactory");
        this.defaultWidth    = defaultWidth;
        this.defaultHeight   = defaultHeight;
        this.pageLoadTimeout = Objects.requireNonNull(pageLoadTimeout, "pageLoadTimeout");
    }

    /** Builds a provider for the {@code capture.*} browser settings of {@code config}. */
    public static WebDriverCaptureProvider fromConfig(MonitorConfig config) {
        String browser = config.getBrowser();
        boolean headless = config.isHeadless();
        return new WebDriverCaptureProvider(() -> createDriver(browser, headless),
                config.getViewportWidth(), config.getViewportHeight(),
                Duration.ofSeconds(config.getPageLoadTimeoutSec()));
    }

    @Override
    public boolean supports(CaptureTarget target) {
        return target instanceof CaptureTarget.Url;
    }

    @Override
    public synchronized CaptureResult capture(CaptureTarget target, CaptureOptions options) throws CaptureException {
        if (!(target instanceof CaptureTarget.Url)) {
            throw new CaptureException(CaptureException.UNSUPPORTED_TARGET,
                    "Browser capture supports url targets only, got " + target.kind());
        }
        CaptureTarget.Url url = (CaptureTarget.Url) target;
        WebDriver wd = driver();

        int width  = url.viewport() != null ? url.viewport().width()  : defaultWidth;
        int height = url.viewport() != null ? url.viewport().height() : defaultHeight;

        try {
            wd.manage().window().setSize(new Dimension(width, height));
            wd.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
            log.debug("Navigating to {} at {}x{}", url.url(), width, height);
            wd.get(url.url());
        } catch (TimeoutException e) {
            throw new CaptureException(CaptureException.TIMEOUT,
                    "Page load timed out after " + pageLoadTimeout.toSeconds() + "s: " + url.url(), e);
        } catch (WebDriverException e) {
            throw new CaptureException(CaptureException.NAVIGATION,
                    "Navigation to " + url.url() + " failed: " + e.getMessage(), e);
        }

        Instant now = Instant.now();
        Path file = CaptureFiles.targetFile(options, "page", now);
        try {
            byte[] png = screenshot(wd, options.fullPage());
            CaptureResult result = CaptureFiles.write(CaptureFiles.decode(png), file, options.format(), now);
            log.debug("Captured {} -> {} ({}x{})", url.url(), file, result.width(), result.height());
            return result;
        } catch (IOException | WebDriverException e) {
            throw new CaptureException(CaptureException.CAPTURE_FAILED,
                    "Screenshot of " + url.url() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (driver != null) {
            try {
                driver.quit();
            } catch (WebDriverException e) {
                log.warn("Browser did not quit cleanly: {}", e.getMessage());
            }
            driver = null;
            log.info("Browser closed");
        }
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private WebDriver driver() throws CaptureException {
        if (driver == null) {
            try {
                driver = driverFactory.get();
                log.info("Browser started for capture");
            } catch (WebDriverException e) {
                throw new CaptureException(CaptureException.CAPTURE_FAILED,
                        "Could not start browser: " + e.getMessage(), e);
            }
        }
        return driver;
    }

    private static byte[] screenshot(WebDriver wd, boolean fullPage) {
        if (fullPage && wd instanceof FirefoxDriver) {
            return ((FirefoxDriver) wd).getFullPageScreenshotAs(OutputType.BYTES);
        }
        if (fullPage) {
            log.debug("Full-page capture not available for this browser, capturing the viewport");
        }
        return ((TakesScreenshot) wd).getScreenshotAs(OutputType.BYTES);
    }

    static WebDriver createDriver(String browser, boolean headless) {
        return switch (browser.toLowerCase(Locale.ROOT).trim()) {
            case "chrome" -> {
                ChromeOptions opts = new ChromeOptions();
                if (headless) opts.addArguments("--headless=new");
                opts.addArguments("--hide-scrollbars");
                yield new ChromeDriver(opts);
            }
            case "firefox" -> {
                FirefoxOptions opts = new FirefoxOptions();
                if (headless) opts.addArguments("-headless");
                yield new FirefoxDriver(opts);
            }
            default -> {
                EdgeOptions opts = new EdgeOptions();
                if (headless) opts.addArguments("--headless=new");
                yield new EdgeDriver(opts);
            }
        };
    }
}
