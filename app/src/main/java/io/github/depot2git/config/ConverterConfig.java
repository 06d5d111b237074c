package io.github.depot2git.config;

import io.github.depot2git.util.Retrier;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Everything a conversion run needs to know, after the configuration file and the command line have been merged.
 *
 * @param endTransaction {@code now}, {@code highest} or a transaction number
 * @param streams streams to convert; empty converts every stream of the depot
 * @param remotes git remotes that receive the converted refs after each stage
 */
public record ConverterConfig(
        String depot,
        @Nullable String username,
        @Nullable String password,
        String executable,
        long startTransaction,
        String endTransaction,
        List<StreamMapping> streams,
        Path gitRepoPath,
        MessageStyle messageStyle,
        RetrievalMethod method,
        MergeStrategy mergeStrategy,
        int retryAttempts,
        Duration retryDelay,
        List<UserMapping> users,
        List<RemoteMapping> remotes) {

    public ConverterConfig {
        streams = List.copyOf(streams);
        users = List.copyOf(users);
        remotes = List.copyOf(remotes);
    }

    public static ConverterConfig defaults(String depot, Path gitRepoPath) {
        return new ConverterConfig(
                depot,
                null,
                null,
                "accurev",
                1,
                "now",
                List.of(),
                gitRepoPath,
                MessageStyle.NORMAL,
                RetrievalMethod.DEEP_HIST,
                MergeStrategy.NORMAL,
                Retrier.DEFAULT_ATTEMPTS,
                Retrier.DEFAULT_DELAY,
                List.of(),
                List.of());
    }

    public Retrier retrier() {
        return new Retrier(retryAttempts, retryDelay);
    }

    public Optional<UserMapping> user(String sourceUser) {
        return users.stream().filter(u -> u.sourceUser().equals(sourceUser)).findFirst();
    }

    public ConverterConfig withMethod(RetrievalMethod newMethod) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, endTransaction, streams,
                gitRepoPath, messageStyle, newMethod, mergeStrategy, retryAttempts, retryDelay, users, remotes);
    }

    public ConverterConfig withMergeStrategy(MergeStrategy newStrategy) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, endTransaction, streams,
                gitRepoPath, messageStyle, method, newStrategy, retryAttempts, retryDelay, users, remotes);
    }

    public ConverterConfig withGitRepoPath(Path newPath) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, endTransaction, streams,
                newPath, messageStyle, method, mergeStrategy, retryAttempts, retryDelay, users, remotes);
    }

    public ConverterConfig withDepot(String newDepot) {
        return new ConverterConfig(newDepot, username, password, executable, startTransaction, endTransaction, streams,
                gitRepoPath, messageStyle, method, mergeStrategy, retryAttempts, retryDelay, users, remotes);
    }

    public ConverterConfig withEndTransaction(String newEnd) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, newEnd, streams,
                gitRepoPath, messageStyle, method, mergeStrategy, retryAttempts, retryDelay, users, remotes);
    }

    public ConverterConfig withStreams(List<StreamMapping> newStreams) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, endTransaction, newStreams,
                gitRepoPath, messageStyle, method, mergeStrategy, retryAttempts, retryDelay, users, remotes);
    }

    public ConverterConfig withUsers(List<UserMapping> newUsers) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, endTransaction, streams,
                gitRepoPath, messageStyle, method, mergeStrategy, retryAttempts, retryDelay, newUsers, remotes);
    }

    public ConverterConfig withMessageStyle(MessageStyle newStyle) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, endTransaction, streams,
                gitRepoPath, newStyle, method, mergeStrategy, retryAttempts, retryDelay, users, remotes);
    }

    public ConverterConfig withRetry(int attempts, Duration delay) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, endTransaction, streams,
                gitRepoPath, messageStyle, method, mergeStrategy, attempts, delay, users, remotes);
    }

    public ConverterConfig withStartTransaction(long newStart) {
        return new ConverterConfig(depot, username, password, executable, newStart, endTransaction, streams,
                gitRepoPath, messageStyle, method, mergeStrategy, retryAttempts, retryDelay, users, remotes);
    }

    public ConverterConfig withRemotes(List<RemoteMapping> newRemotes) {
        return new ConverterConfig(depot, username, password, executable, startTransaction, endTransaction, streams,
                gitRepoPath, messageStyle, method, mergeStrategy, retryAttempts, retryDelay, users, newRemotes);
    }
}
