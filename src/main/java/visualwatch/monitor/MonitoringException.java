package visualwatch.monitor;

/**
 * Unchecked exception thrown by {@link MonitoringCoordinator} operations when
 * a request cannot be honoured. The {@link #getCode() code} identifies the
 * condition for callers that map errors onto a protocol.
 */
public class MonitoringException extends RuntimeException {

    public static final String SESSION_NOT_FOUND         = "SESSION_NOT_FOUND";
    public static final String REFERENCE_IMAGE_NOT_FOUND = "REFERENCE_IMAGE_NOT_FOUND";
    public static final String SESSION_LIMIT_EXCEEDED    = "SESSION_LIMIT_EXCEEDED";
    public static final String PERSISTENCE_FAILED        = "PERSISTENCE_FAILED";

    private final String code;

    public MonitoringException(String code, String msg) {
        super(msg);
        this.code = code;
    }

    public MonitoringException(String code, String msg, Throwable cause) {
        super(msg, cause);
        this.code = code;
    }

    public String getCode() { return code; }
}
