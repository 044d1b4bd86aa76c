package visualwatch.compare;

/** Raised when two images cannot be compared (missing, unreadable, or the diff cannot be written). */
public class ComparisonException extends Exception {

    public static final String IMAGE_NOT_FOUND   = "IMAGE_NOT_FOUND";
    public static final String UNREADABLE_IMAGE  = "UNREADABLE_IMAGE";
    public static final String COMPARISON_FAILED = "COMPARISON_FAILED";

    private final String code;

    public ComparisonException(String code, String msg) {
        super(msg);
        this.code = code;
    }

    public ComparisonException(String code, String msg, Throwable cause) {
        super(msg, cause);
        this.code = code;
    }

    public String getCode() { return code; }
}
