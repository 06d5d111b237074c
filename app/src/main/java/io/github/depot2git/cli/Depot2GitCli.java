package io.github.depot2git.cli;

import io.github.depot2git.ConversionException;
import io.github.depot2git.ConversionRun;
import io.github.depot2git.UnrecognizedInputException;
import io.github.depot2git.config.ConfigLoader;
import io.github.depot2git.config.ConverterConfig;
import io.github.depot2git.config.MergeStrategy;
import io.github.depot2git.config.RetrievalMethod;
import io.github.depot2git.source.accurev.AccuRevCommandLine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "depot2git",
        mixinStandardHelpOptions = true,
        description = "Converts the streams of an AccuRev depot into git branches.")
public final class Depot2GitCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(Depot2GitCli.class);

    private static final Duration COMMAND_TIMEOUT = Duration.ofHours(1);

    @CommandLine.Option(
            names = {"-c", "--config"},
            description = "Configuration file. Default: ${DEFAULT-VALUE}.",
            defaultValue = ConfigLoader.DEFAULT_FILENAME)
    private Path configFile = Path.of(ConfigLoader.DEFAULT_FILENAME);

    @CommandLine.Option(
            names = {"-r", "--restart"},
            description = "Discard the converted state and branches and start over.")
    private boolean restart;

    @CommandLine.Option(
            names = {"-f", "--finalize"},
            description = "Stitch the converted branches together once processing is done.")
    private boolean finalizeHistory;

    @CommandLine.Option(
            names = "--stitch-plan",
            description = "With --finalize: write the planned rewrite to this file for review, or apply the plan"
                    + " in it when the file exists.")
    @Nullable
    private Path stitchPlan;

    @CommandLine.Option(
            names = {"-t", "--track"},
            description = "Keep converting new transactions until interrupted.")
    private boolean track;

    @CommandLine.Option(
            names = {"-I", "--intermission"},
            description = "Seconds to wait between runs when tracking. Default: ${DEFAULT-VALUE}.",
            defaultValue = "300")
    private int intermissionSeconds = 300;

    @CommandLine.Option(
            names = {"-u", "--check-missing-users"},
            description = "List the depot users that have no entry in the user map, then exit.")
    private boolean checkMissingUsers;

    @CommandLine.Option(
            names = {"-m", "--method"},
            description = "Retrieval method: pop, diff, deep-hist or skip.")
    @Nullable
    private String method;

    @CommandLine.Option(
            names = {"-s", "--merge-strategy"},
            description = "Merge strategy: normal, orphanage or skip.")
    @Nullable
    private String mergeStrategy;

    @CommandLine.Option(names = {"-g", "--git-repo-path"}, description = "The git repository to convert into.")
    @Nullable
    private Path gitRepoPath;

    @CommandLine.Option(names = {"-d", "--depot"}, description = "The depot to convert.")
    @Nullable
    private String depot;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Depot2GitCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        ConverterConfig config;
        try {
            config = resolveConfig();
        } catch (IOException | UnrecognizedInputException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        var source = new AccuRevCommandLine(config.executable(), COMMAND_TIMEOUT);
        try {
            if (config.username() != null && config.password() != null) {
                source.login(config.username(), config.password());
            }
            if (checkMissingUsers) {
                return reportMissingUsers(config, source);
            }
            return convert(config, source);
        } catch (ConversionException | IOException | GitAPIException e) {
            logger.error("Conversion aborted", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Tracking interrupted");
            return 0;
        } finally {
            if (config.username() != null) {
                try {
                    source.logout();
                } catch (ConversionException e) {
                    logger.warn("Logout failed: {}", e.getMessage());
                }
            }
        }
    }

    private int convert(ConverterConfig config, AccuRevCommandLine source)
            throws ConversionException, IOException, GitAPIException, InterruptedException {
        boolean first = true;
        do {
            if (!first) {
                config = reloadConfig(config);
            }
            try (var run = ConversionRun.open(config, source)) {
                run.run(new ConversionRun.Options(first && restart, finalizeHistory, stitchPlan));
            }
            first = false;
            if (track) {
                logger.info("Waiting {} seconds before the next run", intermissionSeconds);
                Thread.sleep(Duration.ofSeconds(intermissionSeconds).toMillis());
            }
        } while (track);
        return 0;
    }

    /** Re-reads the configuration between tracking runs, keeping the previous one when the file became invalid. */
    ConverterConfig reloadConfig(ConverterConfig previous) {
        try {
            return resolveConfig();
        } catch (IOException | UnrecognizedInputException e) {
            logger.warn("Keeping the previous configuration, {} is invalid: {}", configFile, e.getMessage());
            return previous;
        }
    }

    private static int reportMissingUsers(ConverterConfig config, AccuRevCommandLine source)
            throws ConversionException, IOException, GitAPIException {
        try (var run = ConversionRun.open(config, source)) {
            var missing = run.missingUsers();
            if (missing.isEmpty()) {
                System.out.println("Every user is mapped.");
            } else {
                System.out.println("Unmapped users:");
                missing.stream().sorted().forEach(user -> System.out.println("  " + user));
            }
        }
        return 0;
    }

    /** The configuration file, if present, with the command line options applied on top. */
    ConverterConfig resolveConfig() throws IOException, UnrecognizedInputException {
        ConverterConfig config;
        if (Files.exists(configFile)) {
            config = ConfigLoader.load(configFile);
        } else if (depot != null && gitRepoPath != null) {
            logger.info("No configuration file at {}, using defaults", configFile);
            config = ConverterConfig.defaults(depot, gitRepoPath);
        } else {
            throw new UnrecognizedInputException(
                    "No configuration file at " + configFile
                            + "; --depot and --git-repo-path are required without one");
        }
        if (depot != null) {
            config = config.withDepot(depot);
        }
        if (gitRepoPath != null) {
            config = config.withGitRepoPath(gitRepoPath);
        }
        if (method != null) {
            config = config.withMethod(RetrievalMethod.fromConfigName(method));
        }
        if (mergeStrategy != null) {
            config = config.withMergeStrategy(MergeStrategy.fromConfigName(mergeStrategy));
        }
        if (stitchPlan != null && !finalizeHistory) {
            throw new UnrecognizedInputException("--stitch-plan only applies together with --finalize");
        }
        if (track && finalizeHistory) {
            throw new UnrecognizedInputException(
                    "--finalize cannot be combined with --track; finalize once tracking stops");
        }
        if (intermissionSeconds < 0) {
            throw new UnrecognizedInputException("--intermission must not be negative");
        }
        return config;
    }
}
