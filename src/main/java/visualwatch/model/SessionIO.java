package visualwatch.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@link MonitoringSession} documents.
 *
 * <p>{@link #read(Path)} validates the JSON against {@code session-schema.json}
 * before deserializing and rejects unsupported schema versions.
 * {@link #readLegacy(Path)} skips both checks: legacy flat files predate the
 * schema and carry absolute capture paths.
 *
 * <p>On write: pretty-printed, ISO-8601 timestamps.
 */
public final class SessionIO {

    private static final Logger log = LoggerFactory.getLogger(SessionIO.class);
    private static final String SCHEMA_RESOURCE = "/session-schema.json";

    /** Interval bounds legacy documents must meet; the schema holds the same range. */
    static final int MIN_INTERVAL_SECONDS = 1;
    static final int MAX_INTERVAL_SECONDS = 300;

    /** Singleton ObjectMapper: thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema jsonSchema = null;

    private SessionIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a current-layout session document.
     *
     * @throws IOException                if the file cannot be read or parsed
     * @throws SchemaValidationException  if the document violates the schema
     * @throws SchemaVersionException     if the schema version is not supported
     */
    public static MonitoringSession read(Path path) throws IOException {
        log.debug("Reading session document: {}", path);
        String json = Files.readString(path);
        validateSchema(json, path.toString());
        MonitoringSession session = MAPPER.readValue(json, MonitoringSession.class);
        if (!session.isVersionSupported()) {
            throw new SchemaVersionException(
                    "Unsupported schema version: " + session.getSchemaVersion()
                    + " (expected: " + MonitoringSession.CURRENT_SCHEMA_VERSION + ")");
        }
        return session;
    }

    /**
     * Reads a legacy flat-file session document without schema validation.
     *
     * @throws IOException if the file cannot be parsed, has no id or its
     *                     interval is outside 1-300 seconds
     */
    public static MonitoringSession readLegacy(Path path) throws IOException {
        log.debug("Reading legacy session document: {}", path);
        MonitoringSession session = MAPPER.readValue(path.toFile(), MonitoringSession.class);
        if (session.getId() == null) {
            throw new IOException("Legacy session document has no id: " + path);
        }
        int interval = session.getIntervalSeconds();
        if (interval < MIN_INTERVAL_SECONDS || interval > MAX_INTERVAL_SECONDS) {
            throw new IOException("Legacy session document " + path + " has invalid interval: " + interval);
        }
        return session;
    }

    /**
     * Writes a session document (pretty-printed). Parent directories are
     * created as needed.
     */
    public static void write(MonitoringSession session, Path path) throws IOException {
        Files.createDirectories(path.getParent());
        MAPPER.writeValue(path.toFile(), session);
    }

    /** Serializes any model object (session, summary) to a JSON string. */
    public static String toJson(Object value) throws IOException {
        return MAPPER.writeValueAsString(value);
    }

    /** Deserializes a session from a JSON string (no schema validation). */
    public static MonitoringSession fromJson(String json) throws IOException {
        return MAPPER.readValue(json, MonitoringSession.class);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(String json, String source) throws IOException {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("session-schema.json not found on classpath, skipping schema validation");
            return;
        }
        JsonNode tree = MAPPER.readTree(json);
        Set<ValidationMessage> errors = schema.validate(tree);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new SchemaValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (jsonSchema == null) {
            synchronized (SessionIO.class) {
                if (jsonSchema == null) {
                    try (InputStream is = SessionIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        jsonSchema = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return jsonSchema;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaVersionException extends RuntimeException {
        public SchemaVersionException(String msg) { super(msg); }
    }

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
