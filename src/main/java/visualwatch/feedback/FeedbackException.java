package visualwatch.feedback;

/**
 * Thrown by a {@link FeedbackAnalyzer} when a diff image cannot be analysed.
 */
public class FeedbackException extends Exception {

    public static final String DIFF_IMAGE_NOT_FOUND = "DIFF_IMAGE_NOT_FOUND";
    public static final String ANALYSIS_FAILED      = "ANALYSIS_FAILED";

    private final String code;

    public FeedbackException(String code, String msg) {
        super(msg);
        this.code = code;
    }

    public FeedbackException(String code, String msg, Throwable cause) {
        super(msg, cause);
        this.code = code;
    }

    public String getCode() { return code; }
}
