package io.pollwatch.cli;

import com.google.common.base.Splitter;
import io.pollwatch.BackpressurePolicy;
import io.pollwatch.ObserverConfig;
import io.pollwatch.PollingObserver;
import io.pollwatch.WatchErrorListener;
import io.pollwatch.WatchedPath;
import io.pollwatch.event.EventHandler;
import io.pollwatch.handler.JsonLinesEventHandler;
import io.pollwatch.handler.LoggingEventHandler;
import io.pollwatch.snapshot.DirectorySnapshotProvider;
import io.pollwatch.snapshot.MetadataSnapshotDiffer;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "pollwatch",
        mixinStandardHelpOptions = true,
        description = "Watches directory trees by polling and reports every change until interrupted.")
public final class PollWatchCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PollWatchCli.class);

    static final String PATHS_ENV = "POLLWATCH_PATHS";

    @CommandLine.Parameters(
            paramLabel = "PATH",
            arity = "0..*",
            description = "Directories to watch. Defaults to the " + PATHS_ENV + " environment variable.")
    private List<Path> paths = new ArrayList<>();

    @CommandLine.Option(names = "--interval", description = "Polling interval in milliseconds.")
    @Nullable
    private Long intervalMillis;

    @CommandLine.Option(
            names = "--max-depth",
            description = "How many levels below each root to watch (default: unlimited).")
    @Nullable
    private Integer maxDepth;

    @CommandLine.Option(names = "--queue-capacity", description = "Maximum queued events, 0 for unbounded.")
    @Nullable
    private Integer queueCapacity;

    @CommandLine.Option(
            names = "--backpressure",
            description = "What to do when the queue is full: ${COMPLETION-CANDIDATES}.")
    @Nullable
    private BackpressurePolicy backpressure;

    @CommandLine.Option(names = "--json", description = "Print events to stdout as JSON lines instead of logging them.")
    private boolean json = false;

    @CommandLine.Option(names = "--log-level", description = "Root log level (TRACE, DEBUG, INFO, WARN, ERROR).")
    @Nullable
    private String logLevel;

    public static void main(String[] args) {
        int exitCode = commandLine(new PollWatchCli()).execute(args);
        System.exit(exitCode);
    }

    /** Accepts {@code --backpressure drop_oldest} as well as {@code DROP_OLDEST}. */
    static CommandLine commandLine(PollWatchCli cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    @Blocking
    public Integer call() {
        if (logLevel != null) {
            Configurator.setAllLevels(LogManager.ROOT_LOGGER_NAME, Level.toLevel(logLevel, Level.INFO));
        }

        var roots = resolvePaths(System::getenv);
        if (roots.isEmpty()) {
            System.err.println("Error: at least one PATH is required (or set " + PATHS_ENV + ").");
            return 1;
        }

        ObserverConfig config;
        DirectorySnapshotProvider provider;
        try {
            config = resolveConfig(ObserverConfig.fromEnvironment());
            provider = maxDepth == null ? new DirectorySnapshotProvider() : new DirectorySnapshotProvider(maxDepth);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        if (maxDepth != null) {
            logger.info("Recording entries up to {} level(s) below each root", provider.maxDepth());
        }
        var observer = new PollingObserver(config, provider, new MetadataSnapshotDiffer(), WatchErrorListener.none());
        for (var root : roots) {
            if (!Files.isDirectory(root)) {
                logger.warn("{} is not a directory yet; it will be polled until it appears", root);
            }
            observer.addRule(root, handlerFor(root));
        }

        Runtime.getRuntime().addShutdownHook(new Thread(observer::close, "pollwatch-shutdown"));
        observer.run();
        return 0;
    }

    EventHandler handlerFor(Path root) {
        if (json) {
            return new JsonLinesEventHandler(WatchedPath.canonicalize(root), System.out);
        }
        return new LoggingEventHandler();
    }

    /** Command line paths, or the {@value #PATHS_ENV} list when none were given. */
    List<Path> resolvePaths(Function<String, String> environment) {
        if (!paths.isEmpty()) {
            return List.copyOf(paths);
        }
        var raw = environment.apply(PATHS_ENV);
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Splitter.on(File.pathSeparatorChar)
                .trimResults()
                .omitEmptyStrings()
                .splitToStream(raw)
                .map(Path::of)
                .toList();
    }

    /** Applies command line overrides on top of {@code base}. */
    ObserverConfig resolveConfig(ObserverConfig base) {
        var config = base;
        if (intervalMillis != null) {
            config = config.withDefaultInterval(Duration.ofMillis(intervalMillis));
        }
        if (queueCapacity != null) {
            config = config.withQueueCapacity(queueCapacity);
        }
        if (backpressure != null) {
            config = config.withBackpressure(backpressure);
        }
        return config;
    }
}
