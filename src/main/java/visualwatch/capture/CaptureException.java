package visualwatch.capture;

/**
 * Raised by a {@link CaptureProvider} when no image could be produced.
 * The {@link #getCode() code} tells the caller which kind of failure it was.
 */
public class CaptureException extends Exception {

    public static final String TIMEOUT            = "TIMEOUT";
    public static final String NAVIGATION         = "NAVIGATION";
    public static final String UNSUPPORTED_TARGET = "UNSUPPORTED_TARGET";
    public static final String CAPTURE_FAILED     = "CAPTURE_FAILED";

    private final String code;

    public CaptureException(String code, String msg) {
        super(msg);
        this.code = code;
    }

    public CaptureException(String code, String msg, Throwable cause) {
        super(msg, cause);
        this.code = code;
    }

    public String getCode() { return code; }
}
