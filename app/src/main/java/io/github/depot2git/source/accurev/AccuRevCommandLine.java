package io.github.depot2git.source.accurev;

import io.github.depot2git.ConversionException;
import io.github.depot2git.FatalConversionException;
import io.github.depot2git.TransientCommandException;
import io.github.depot2git.source.Depot;
import io.github.depot2git.source.SourceRepository;
import io.github.depot2git.source.StreamDiff;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.StreamTree;
import io.github.depot2git.source.Transaction;
import io.github.depot2git.source.TransactionKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** {@link SourceRepository} backed by the {@code accurev} command line client. */
public final class AccuRevCommandLine implements SourceRepository {
    private static final Logger logger = LogManager.getLogger(AccuRevCommandLine.class);

    private final String executable;
    private final Duration timeout;

    public AccuRevCommandLine(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    public AccuRevCommandLine() {
        this("accurev", Duration.ofHours(1));
    }

    public void login(String username, String password) throws ConversionException {
        run(List.of("login", username, password), null, Set.of(0));
        logger.info("Logged in to accurev as {}", username);
    }

    public void logout() throws ConversionException {
        run(List.of("logout"), null, Set.of(0));
    }

    @Override
    public List<Depot> depots() throws ConversionException {
        return AccuRevXml.depots(run(List.of("show", "-fix", "depots"), null, Set.of(0)));
    }

    @Override
    public Transaction transaction(String depot, long id) throws ConversionException {
        var transactions = hist(depot, null, id + ".1", null);
        if (transactions.isEmpty() || transactions.get(0).id() != id) {
            throw new TransientCommandException("accurev hist did not return transaction " + id);
        }
        return transactions.get(0);
    }

    @Override
    public Optional<Transaction> creationTransaction(String depot, StreamInfo stream) throws ConversionException {
        return hist(depot, stream.name(), "now", TransactionKind.MKSTREAM).stream()
                .filter(t -> t.stream() == null || t.stream().number() == stream.number())
                .findFirst();
    }

    @Override
    public long resolveTransaction(String depot, String spec) throws ConversionException {
        var transactions = hist(depot, null, spec + ".1", null);
        if (transactions.isEmpty()) {
            throw new TransientCommandException("accurev hist could not resolve transaction " + spec);
        }
        return transactions.get(0).id();
    }

    @Override
    public List<StreamInfo> streams(String depot, @Nullable Long transaction) throws ConversionException {
        var args = new ArrayList<>(List.of("show", "-p", depot, "-fixg"));
        if (transaction != null) {
            args.addAll(List.of("-t", Long.toString(transaction)));
        }
        args.add("streams");
        return AccuRevXml.streams(run(args, null, Set.of(0)));
    }

    @Override
    public StreamDiff diff(String depot, StreamInfo stream, long fromTransaction, long toTransaction)
            throws ConversionException {
        var args = List.of(
                "diff",
                "-a",
                "-i",
                "-v",
                stream.name(),
                "-V",
                stream.name(),
                "-t",
                fromTransaction + "-" + toTransaction,
                "-fx");
        // diff exits with 1 when it found differences
        return AccuRevXml.diff(run(args, null, Set.of(0, 1)), fromTransaction, toTransaction);
    }

    @Override
    public void populate(String depot, StreamInfo stream, long transaction, Path destination, boolean overwrite)
            throws ConversionException {
        var args = new ArrayList<>(List.of(
                "pop", "-v", stream.name(), "-L", destination.toString(), "-R", "-t", Long.toString(transaction)));
        if (overwrite) {
            args.add("-O");
        }
        args.add(".");
        run(args, destination, Set.of(0));
    }

    @Override
    public List<Transaction> deepHistory(String depot, StreamInfo stream, long fromTransaction, long toTransaction)
            throws ConversionException {
        if (toTransaction <= fromTransaction) {
            return List.of();
        }
        var range = toTransaction + "-" + (fromTransaction + 1);
        var chain = new LinkedHashSet<String>();
        chain.add(stream.name());
        addBasisChain(chain, depot, stream, toTransaction);
        // a stream re-parented inside the range inherited from another chain before the change
        for (var reconfigured : hist(depot, null, range, TransactionKind.CHSTREAM)) {
            if (reconfigured.id() - 1 > fromTransaction) {
                addBasisChain(chain, depot, stream, reconfigured.id() - 1);
            }
        }

        var byId = new TreeMap<Long, Transaction>();
        for (var name : chain) {
            for (var transaction : hist(depot, name, range, null)) {
                byId.putIfAbsent(transaction.id(), transaction);
            }
        }
        return List.copyOf(byId.values());
    }

    private void addBasisChain(Set<String> chain, String depot, StreamInfo stream, long transaction)
            throws ConversionException {
        var topology = StreamTree.of(streams(depot, transaction));
        if (topology.stream(stream.number()).isEmpty()) {
            return;
        }
        topology.basisChain(stream.number()).forEach(s -> chain.add(s.name()));
    }

    @Override
    public Set<String> users() throws ConversionException {
        return AccuRevXml.users(run(List.of("show", "-fx", "users"), null, Set.of(0)));
    }

    private List<Transaction> hist(
            String depot, @Nullable String stream, String timeSpec, @Nullable TransactionKind kind)
            throws ConversionException {
        var args = new ArrayList<>(List.of("hist", "-p", depot));
        if (stream != null) {
            args.addAll(List.of("-s", stream));
        }
        args.addAll(List.of("-t", timeSpec));
        if (kind != null) {
            args.addAll(List.of("-k", kind.wireName()));
        }
        args.add("-fevx");
        return AccuRevXml.transactions(run(args, null, Set.of(0)));
    }

    private String run(List<String> args, @Nullable Path workingDirectory, Set<Integer> acceptedExitCodes)
            throws ConversionException {
        var command = new ArrayList<String>(args.size() + 1);
        command.add(executable);
        command.addAll(args);
        logger.debug("Running {}", redact(command));

        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("depot2git-accurev", ".out");
            stderr = Files.createTempFile("depot2git-accurev", ".err");
            var pb = new ProcessBuilder(command);
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            // both streams go to files so a hung client cannot block us before the timeout applies
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(stderr.toFile());
            pb.redirectInput(ProcessBuilder.Redirect.from(Path.of(nullDevice()).toFile()));

            var process = pb.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                throw new TransientCommandException("accurev " + args.get(0) + " timed out after " + timeout);
            }
            int exitCode = process.exitValue();
            if (!acceptedExitCodes.contains(exitCode)) {
                var error = Files.readString(stderr, StandardCharsets.UTF_8).trim();
                throw new TransientCommandException(
                        "accurev " + args.get(0) + " exited with " + exitCode + (error.isEmpty() ? "" : ": " + error));
            }
            return Files.readString(stdout, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TransientCommandException("Failed to run accurev " + args.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalConversionException("Interrupted while running accurev " + args.get(0), e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static void deleteQuietly(@Nullable Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }

    private static String nullDevice() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")
                ? "NUL"
                : "/dev/null";
    }

    private static String redact(List<String> command) {
        if (command.size() > 3 && command.get(1).equals("login")) {
            return Arrays.toString(command.subList(0, 3).toArray()) + " [password]";
        }
        return command.toString();
    }
}
