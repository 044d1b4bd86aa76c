package visualwatch.capture;

import org.openqa.selenium.Dimension;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import visualwatch.TestImages;
import visualwatch.model.CaptureTarget;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Drives {@link WebDriverCaptureProvider} with a mocked browser; no real
 * browser is started.
 */
public class WebDriverCaptureProviderTest {

    private Path tempDir;
    private WebDriver driver;
    private WebDriver.Window window;
    private AtomicInteger driversCreated;
    private WebDriverCaptureProvider provider;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("webdriver-capture-test");

        driver = mock(WebDriver.class, withSettings().extraInterfaces(TakesScreenshot.class));
        WebDriver.Options manage = mock(WebDriver.Options.class);
        window = mock(WebDriver.Window.class);
        WebDriver.Timeouts timeouts = mock(WebDriver.Timeouts.class);
        when(driver.manage()).thenReturn(manage);
        when(manage.window()).thenReturn(window);
        when(manage.timeouts()).thenReturn(timeouts);
        when(((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES)).thenReturn(png(30, 20));

        driversCreated = new AtomicInteger();
        provider = new WebDriverCaptureProvider(() -> {
            driversCreated.incrementAndGet();
            return driver;
        }, 1200, 800, Duration.ofSeconds(15));
    }

    @AfterMethod
    public void tearDown() throws IOException {
        TestImages.deleteRecursively(tempDir);
    }

    private static byte[] png(int w, int h) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(TestImages.solid(w, h, Color.ORANGE), "PNG", out);
        return out.toByteArray();
    }

    @Test
    public void capture_navigatesAndWritesScreenshot() throws Exception {
        CaptureResult result = provider.capture(new CaptureTarget.Url("https://example.com"),
                new CaptureOptions("png", "home.png", false, tempDir));

        verify(driver).get("https://example.com");
        verify(window).setSize(new Dimension(1200, 800));
        assertThat(result.path()).isEqualTo(tempDir.resolve("home.png")).isRegularFile();
        assertThat(result.width()).isEqualTo(30);
        assertThat(result.height()).isEqualTo(20);
        assertThat(result.format()).isEqualTo("png");
        assertThat(result.size()).isPositive();
        assertThat(result.timestamp()).isNotNull();
    }

    @Test
    public void capture_usesTargetViewport() throws Exception {
        provider.capture(new CaptureTarget.Url("https://example.com", new CaptureTarget.Viewport(390, 844)),
                CaptureOptions.png(tempDir));

        verify(window).setSize(new Dimension(390, 844));
    }

    @Test(description = "The browser is started once and reused across captures")
    public void browser_isCreatedLazilyAndReused() throws Exception {
        assertThat(driversCreated).hasValue(0);

        provider.capture(new CaptureTarget.Url("https://a.example"), CaptureOptions.png(tempDir));
        provider.capture(new CaptureTarget.Url("https://b.example"), CaptureOptions.png(tempDir));

        assertThat(driversCreated).hasValue(1);
        try (var files = Files.list(tempDir)) {
            assertThat(files).as("generated names are unique").hasSize(2);
        }
    }

    @Test
    public void capture_jpeg_writesJpgFile() throws Exception {
        CaptureResult result = provider.capture(new CaptureTarget.Url("https://example.com"),
                new CaptureOptions("jpeg", null, false, tempDir));

        assertThat(result.format()).isEqualTo("jpeg");
        assertThat(result.path().getFileName().toString()).startsWith("page_").endsWith(".jpg");
        assertThat(ImageIO.read(result.path().toFile())).isNotNull();
    }

    @Test
    public void pageLoadTimeout_mapsToTimeoutCode() {
        doThrow(new TimeoutException("slow")).when(driver).get(anyString());

        assertThatThrownBy(() -> provider.capture(new CaptureTarget.Url("https://slow.example"),
                CaptureOptions.png(tempDir)))
                .isInstanceOf(CaptureException.class)
                .extracting(e -> ((CaptureException) e).getCode())
                .isEqualTo(CaptureException.TIMEOUT);
    }

    @Test
    public void navigationError_mapsToNavigationCode() {
        doThrow(new WebDriverException("net::ERR_NAME_NOT_RESOLVED")).when(driver).get(anyString());

        assertThatThrownBy(() -> provider.capture(new CaptureTarget.Url("https://nowhere.invalid"),
                CaptureOptions.png(tempDir)))
                .isInstanceOf(CaptureException.class)
                .extracting(e -> ((CaptureException) e).getCode())
                .isEqualTo(CaptureException.NAVIGATION);
    }

    @Test
    public void undecodableScreenshot_mapsToCaptureFailed() {
        when(((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES)).thenReturn(new byte[]{1, 2, 3});

        assertThatThrownBy(() -> provider.capture(new CaptureTarget.Url("https://example.com"),
                CaptureOptions.png(tempDir)))
                .isInstanceOf(CaptureException.class)
                .extracting(e -> ((CaptureException) e).getCode())
                .isEqualTo(CaptureException.CAPTURE_FAILED);
    }

    @Test
    public void browserStartFailure_mapsToCaptureFailed() {
        WebDriverCaptureProvider broken = new WebDriverCaptureProvider(() -> {
            throw new WebDriverException("chrome not found");
        }, 800, 600, Duration.ofSeconds(5));

        assertThatThrownBy(() -> broken.capture(new CaptureTarget.Url("https://example.com"),
                CaptureOptions.png(tempDir)))
                .isInstanceOf(CaptureException.class)
                .hasMessageContaining("chrome not found");
    }

    @Test
    public void nonUrlTarget_isUnsupported() {
        assertThat(provider.supports(new CaptureTarget.Region(0, 0, 10, 10))).isFalse();
        assertThatThrownBy(() -> provider.capture(new CaptureTarget.Region(0, 0, 10, 10),
                CaptureOptions.png(tempDir)))
                .isInstanceOf(CaptureException.class)
                .extracting(e -> ((CaptureException) e).getCode())
                .isEqualTo(CaptureException.UNSUPPORTED_TARGET);
        verify(driver, never()).get(any());
    }

    @Test
    public void close_quitsBrowserOnlyIfStarted() throws Exception {
        provider.close();
        assertThat(driversCreated).hasValue(0);

        provider.capture(new CaptureTarget.Url("https://example.com"), CaptureOptions.png(tempDir));
        provider.close();
        provider.close();

        verify(driver, times(1)).quit();
    }
}
