package visualwatch.monitor;

public class SessionLimitExceededException extends MonitoringException {

    public SessionLimitExceededException(int limit) {
        super(SESSION_LIMIT_EXCEEDED, "Maximum number of monitoring sessions reached (" + limit + ")");
    }
}
