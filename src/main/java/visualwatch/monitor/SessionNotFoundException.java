package visualwatch.monitor;

public class SessionNotFoundException extends MonitoringException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(SESSION_NOT_FOUND, "Monitoring session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
