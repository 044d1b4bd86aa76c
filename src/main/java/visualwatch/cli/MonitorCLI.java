package visualwatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import visualwatch.config.MonitorConfig;
import visualwatch.model.CaptureTarget;
import visualwatch.model.MonitoringSession;
import visualwatch.model.MonitoringSummary;
import visualwatch.model.SessionIO;
import visualwatch.monitor.MonitoringCoordinator;
import visualwatch.monitor.MonitoringException;
import visualwatch.monitor.StartMonitoringRequest;
import visualwatch.store.SessionStore;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command-line entry point.
 *
 * <ul>
 *   <li>{@code visual-watch watch}: start one session and run until Ctrl+C or {@code --duration}</li>
 *   <li>{@code visual-watch resume}: resume persisted active sessions</li>
 *   <li>{@code visual-watch sessions}: list persisted sessions</li>
 * </ul>
 *
 * Exit codes: 0 success, 1 runtime failure, 2 usage error.
 */
@Command(
        name        = "visual-watch",
        description = "Periodically capture a page or screen region and compare it with a reference image",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                MonitorCLI.WatchCommand.class,
                MonitorCLI.ResumeCommand.class,
                MonitorCLI.SessionsCommand.class
        }
)
public class MonitorCLI implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(String[] args) {
        int exit = new CommandLine(new MonitorCLI()).execute(args);
        System.exit(exit);
    }

    /** Applies {@code --sessions-dir} on top of the classpath configuration. */
    static MonitorConfig loadConfig(Path sessionsDir) {
        MonitorConfig config = new MonitorConfig();
        if (sessionsDir != null) {
            config.setSessionsDirectory(sessionsDir);
        }
        return config;
    }

    // ── watch ─────────────────────────────────────────────────────────────

    @Command(
            name        = "watch",
            description = "Start a monitoring session (Ctrl+C to stop and print the summary)",
            mixinStandardHelpOptions = true
    )
    static class WatchCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(WatchCommand.class);

        @Spec
        CommandSpec spec;

        @Option(names = "--url", description = "Page to capture")
        String url;

        @Option(names = "--region", description = "Screen region to capture as x,y,width,height")
        String region;

        @Option(names = {"-r", "--reference"}, required = true, description = "Reference image (PNG)")
        Path reference;

        @Option(names = {"-i", "--interval"}, description = "Seconds between captures (1-300, default from config)")
        Integer interval;

        @Option(names = "--auto-feedback", description = "Analyse significant changes automatically")
        boolean autoFeedback;

        @Option(names = {"-d", "--duration"}, defaultValue = "0",
                description = "Stop after this many seconds (0 = run until Ctrl+C)")
        long durationSec;

        @Option(names = "--sessions-dir", description = "Session store directory (overrides monitor.sessions.dir)")
        Path sessionsDir;

        @Override
        public Integer call() throws Exception {
            CaptureTarget target = parseTarget();
            if (interval != null && (interval < StartMonitoringRequest.MIN_INTERVAL_SECONDS
                    || interval > StartMonitoringRequest.MAX_INTERVAL_SECONDS)) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "--interval must be between 1 and 300 seconds");
            }
            if (durationSec < 0) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--duration must not be negative");
            }

            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            MonitorRuntime runtime = MonitorRuntime.create(loadConfig(sessionsDir));
            MonitoringCoordinator coordinator = runtime.coordinator();
            String id;
            try {
                id = coordinator.startMonitoring(
                        new StartMonitoringRequest(target, reference, interval, autoFeedback));
            } catch (MonitoringException e) {
                err.println("Could not start monitoring [" + e.getCode() + "]: " + e.getMessage());
                runtime.close();
                return 1;
            }

            out.printf("Monitoring session %s started (%s). Press Ctrl+C to stop.%n", id, target.kind());
            out.flush();

            AtomicBoolean finished = new AtomicBoolean(false);
            CountDownLatch done = new CountDownLatch(1);
            Runnable finish = () -> {
                if (!finished.compareAndSet(false, true)) {
                    return;
                }
                try {
                    MonitoringSummary summary = coordinator.stopMonitoring(id);
                    out.println(SessionIO.toJson(summary));
                } catch (IOException | RuntimeException e) {
                    err.println("Error stopping session " + id + ": " + e.getMessage());
                    log.error("Failed to stop session {}", id, e);
                } finally {
                    out.flush();
                    runtime.close();
                    done.countDown();
                }
            };

            Thread hook = new Thread(finish, "visual-watch-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            if (durationSec > 0) {
                done.await(durationSec, TimeUnit.SECONDS);
                finish.run();
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("JVM already shutting down; hook stays registered");
                }
            } else {
                done.await();
            }
            return 0;
        }

        private CaptureTarget parseTarget() {
            boolean hasUrl = url != null && !url.isBlank();
            boolean hasRegion = region != null && !region.isBlank();
            if (hasUrl == hasRegion) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Specify exactly one of --url or --region");
            }
            if (hasUrl) {
                return new CaptureTarget.Url(url.trim());
            }
            String[] parts = region.split(",");
            if (parts.length != 4) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "--region must be x,y,width,height, got: " + region);
            }
            try {
                return new CaptureTarget.Region(
                        Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                        Integer.parseInt(parts[2].trim()), Integer.parseInt(parts[3].trim()));
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Invalid --region '" + region + "': " + e.getMessage());
            }
        }
    }

    // ── resume ────────────────────────────────────────────────────────────

    @Command(
            name        = "resume",
            description = "Resume persisted active sessions (Ctrl+C to pause them until the next resume)",
            mixinStandardHelpOptions = true
    )
    static class ResumeCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Option(names = "--sessions-dir", description = "Session store directory (overrides monitor.sessions.dir)")
        Path sessionsDir;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            MonitorRuntime runtime = MonitorRuntime.create(loadConfig(sessionsDir));
            int resumed = runtime.coordinator().init();
            if (resumed == 0) {
                out.println("No active sessions to resume.");
                runtime.close();
                return 0;
            }
            out.printf("Resumed %d session(s). Press Ctrl+C to exit; sessions stay persisted.%n", resumed);
            out.flush();

            CountDownLatch done = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.coordinator().shutdown();
                runtime.close();
                done.countDown();
            }, "visual-watch-shutdown"));
            done.await();
            return 0;
        }
    }

    // ── sessions ──────────────────────────────────────────────────────────

    @Command(
            name        = "sessions",
            description = "List persisted sessions",
            mixinStandardHelpOptions = true
    )
    static class SessionsCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(SessionsCommand.class);

        @Spec
        CommandSpec spec;

        @Option(names = "--sessions-dir", description = "Session store directory (overrides monitor.sessions.dir)")
        Path sessionsDir;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            SessionStore store = new SessionStore(loadConfig(sessionsDir).getSessionsDirectory());

            List<String> ids;
            try {
                ids = store.listIds();
            } catch (IOException e) {
                err.println("Cannot read session store: " + e.getMessage());
                return 1;
            }
            if (ids.isEmpty()) {
                out.println("No sessions found in " + store.getSessionsRoot().toAbsolutePath());
                return 0;
            }

            out.printf("%-38s %-8s %-8s %s%n", "ID", "TARGET", "CAPTURES", "STATE");
            for (String id : ids) {
                try {
                    MonitoringSession s = store.load(id);
                    if (s == null) continue;
                    out.printf("%-38s %-8s %-8d %s%n", id, s.getTarget() == null ? "?" : s.getTarget().kind(),
                            s.getScreenshotCount(), s.isActive() ? "active" : "stopped");
                } catch (IOException | RuntimeException e) {
                    log.warn("Unreadable session {}: {}", id, e.getMessage());
                    out.printf("%-38s %s%n", id, "(unreadable: " + e.getMessage() + ")");
                }
            }
            return 0;
        }
    }
}
