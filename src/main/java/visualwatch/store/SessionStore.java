package visualwatch.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualwatch.model.CaptureRecord;
import visualwatch.model.MonitoringSession;
import visualwatch.model.SessionIO;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Filesystem-backed store for monitoring sessions, one directory per session:
 * <pre>
 * &lt;base&gt;/sessions/&lt;id&gt;/session.json
 * &lt;base&gt;/sessions/&lt;id&gt;/images/...
 * &lt;base&gt;/sessions/&lt;id&gt;/recordings/   (reserved)
 * </pre>
 *
 * <p>Sessions written by older releases as a flat {@code <id>.json} file
 * (absolute capture paths, {@code filepath}/{@code interval} field names) are
 * migrated on first load: captures are copied into {@code images/}, paths are
 * rewritten relative to the session directory, {@code session.json} is
 * written and the flat file is renamed to {@code <id>.json.migrated}.
 *
 * <p>Not synchronized. Callers serialize writes per session.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    static final String SESSION_FILE     = "session.json";
    static final String TEMP_FILE        = "session.json.tmp";
    static final String IMAGES_DIR       = "images";
    static final String RECORDINGS_DIR   = "recordings";
    static final String LEGACY_SUFFIX    = ".json";
    static final String MIGRATED_SUFFIX  = ".json.migrated";

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path sessionsDir;

    public SessionStore(Path baseDirectory) {
        this.sessionsDir = baseDirectory.resolve("sessions");
    }

    /** Creates the sessions root if needed. */
    public void init() throws IOException {
        try {
            Files.createDirectories(sessionsDir);
            log.debug("Session store initialised at {}", sessionsDir);
        } catch (IOException e) {
            log.error("Failed to initialise session store at {}: {}", sessionsDir, e.getMessage());
            throw e;
        }
    }

    // ── CRUD ──────────────────────────────────────────────────────────────

    /**
     * Writes the full session document. The document is written to a temp
     * file first and moved over {@code session.json}.
     */
    public void save(MonitoringSession session) throws IOException {
        String id = session.getId();
        Path dir = getSessionDirectory(id);
        try {
            Files.createDirectories(getImagesDirectory(id));
            Path tmp = dir.resolve(TEMP_FILE);
            SessionIO.write(session, tmp);
            moveIntoPlace(tmp, dir.resolve(SESSION_FILE));
            log.debug("Session {} saved ({} capture(s))", id, session.getScreenshotCount());
        } catch (IOException e) {
            log.error("Failed to save session {}: {}", id, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads one session, migrating a legacy flat file first when only that
     * exists.
     *
     * @return the session, or {@code null} if nothing is stored under {@code id}
     */
    public MonitoringSession load(String id) throws IOException {
        Path current = getSessionDirectory(id).resolve(SESSION_FILE);
        if (Files.isRegularFile(current)) {
            return SessionIO.read(current);
        }
        Path legacy = legacyPath(id);
        if (Files.isRegularFile(legacy)) {
            log.info("Detected legacy session {}, migrating", id);
            return migrateLegacy(id, legacy);
        }
        log.debug("No stored session {}", id);
        return null;
    }

    /**
     * Loads every stored session. A session that cannot be read, validated
     * or migrated is logged and skipped.
     */
    public List<MonitoringSession> loadAll() {
        List<String> ids;
        try {
            ids = listIds();
        } catch (IOException e) {
            log.error("Failed to list sessions in {}: {}", sessionsDir, e.getMessage());
            return List.of();
        }
        List<MonitoringSession> sessions = new ArrayList<>();
        for (String id : ids) {
            try {
                MonitoringSession session = load(id);
                if (session != null) {
                    sessions.add(session);
                }
            } catch (IOException | RuntimeException e) {
                log.error("Skipping unreadable session {}: {}", id, e.getMessage());
            }
        }
        log.debug("Loaded {} of {} stored session(s)", sessions.size(), ids.size());
        return sessions;
    }

    /**
     * Removes the session directory (images included) and any legacy flat
     * file for {@code id}.
     *
     * @return {@code true} if anything was removed
     */
    public boolean delete(String id) throws IOException {
        boolean removed = false;
        Path dir = getSessionDirectory(id);
        if (Files.exists(dir)) {
            deleteRecursively(dir);
            removed = true;
            log.debug("Session directory deleted: {}", dir);
        }
        if (Files.deleteIfExists(legacyPath(id))) {
            removed = true;
            log.debug("Legacy session file deleted for {}", id);
        }
        return removed;
    }

    /**
     * Lists stored session ids: directories containing {@code session.json}
     * plus legacy flat {@code <id>.json} files. Migration backups are ignored.
     */
    public List<String> listIds() throws IOException {
        if (!Files.isDirectory(sessionsDir)) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(sessionsDir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry)) {
                    if (Files.isRegularFile(entry.resolve(SESSION_FILE))) {
                        ids.add(name);
                    }
                } else if (name.endsWith(LEGACY_SUFFIX) && name.length() > LEGACY_SUFFIX.length()) {
                    String id = name.substring(0, name.length() - LEGACY_SUFFIX.length());
                    if (VALID_ID.matcher(id).matches() && !id.contains("..")) {
                        ids.add(id);
                    } else {
                        log.warn("Ignoring legacy file with unusable id: {}", entry);
                    }
                }
            }
        }
        List<String> sorted = new ArrayList<>(ids);
        sorted.sort(Comparator.naturalOrder());
        return sorted;
    }

    /** Deletes every stored session, legacy files and backups included. */
    public void clear() throws IOException {
        if (!Files.isDirectory(sessionsDir)) {
            return;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(sessionsDir)) {
            for (Path entry : entries) {
                deleteRecursively(entry);
            }
        }
        log.info("All sessions cleared from {}", sessionsDir);
    }

    // ── Paths ─────────────────────────────────────────────────────────────

    public Path getSessionsRoot() {
        return sessionsDir;
    }

    public Path getSessionDirectory(String id) {
        return sessionsDir.resolve(validateId(id));
    }

    public Path getImagesDirectory(String id) {
        return getSessionDirectory(id).resolve(IMAGES_DIR);
    }

    /** Reserved for recorded video; nothing writes here yet. */
    public Path getRecordingsDirectory(String id) {
        return getSessionDirectory(id).resolve(RECORDINGS_DIR);
    }

    /** Resolves a stored capture path against the session directory. */
    public Path resolve(String id, String relativePath) {
        return getSessionDirectory(id).resolve(relativePath).normalize();
    }

    // ── Migration ─────────────────────────────────────────────────────────

    private MonitoringSession migrateLegacy(String id, Path legacyFile) throws IOException {
        MonitoringSession session = SessionIO.readLegacy(legacyFile);
        if (!id.equals(session.getId())) {
            throw new IOException("Legacy session file " + legacyFile
                    + " declares id '" + session.getId() + "'");
        }

        Path imagesDir = getImagesDirectory(id);
        Files.createDirectories(imagesDir);

        int copied = 0;
        for (CaptureRecord shot : session.getScreenshots()) {
            String oldPath = shot.getRelativePath();
            if (oldPath == null || oldPath.isBlank()) {
                log.warn("Legacy session {} has a capture without a path", id);
                continue;
            }
            Path source = Path.of(oldPath);
            Path target = uniqueTarget(imagesDir, source.getFileName().toString());
            if (Files.isRegularFile(source)) {
                Files.copy(source, target);
                copied++;
                log.debug("Migrated capture {} -> {}", source, target);
            } else {
                log.warn("Capture file not found during migration of {}: {}", id, source);
            }
            shot.setRelativePath(IMAGES_DIR + "/" + target.getFileName());
        }

        save(session);

        Path backup = sessionsDir.resolve(id + MIGRATED_SUFFIX);
        Files.move(legacyFile, backup, StandardCopyOption.REPLACE_EXISTING);
        log.info("Legacy session {} migrated: {} of {} capture(s) copied, backup at {}",
                id, copied, session.getScreenshotCount(), backup);
        return session;
    }

    /** Picks {@code name}, or {@code name-1}, {@code name-2}... if taken. */
    private static Path uniqueTarget(Path dir, String fileName) {
        Path candidate = dir.resolve(fileName);
        if (!Files.exists(candidate)) {
            return candidate;
        }
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext  = dot > 0 ? fileName.substring(dot) : "";
        for (int i = 1; ; i++) {
            candidate = dir.resolve(base + "-" + i + ext);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private Path legacyPath(String id) {
        return sessionsDir.resolve(validateId(id) + LEGACY_SUFFIX);
    }

    static String validateId(String id) {
        if (id == null || !VALID_ID.matcher(id).matches() || id.contains("..")) {
            throw new IllegalArgumentException("Invalid session id: " + id);
        }
        return id;
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            Files.deleteIfExists(root);
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : paths) {
            Files.deleteIfExists(p);
        }
    }
}
