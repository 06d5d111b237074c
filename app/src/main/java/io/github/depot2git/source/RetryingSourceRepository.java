package io.github.depot2git.source;

import io.github.depot2git.ConversionException;
import io.github.depot2git.util.Retrier;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Wraps every source query in the run's retry budget. */
public final class RetryingSourceRepository implements SourceRepository {
    private final SourceRepository delegate;
    private final Retrier retrier;

    public RetryingSourceRepository(SourceRepository delegate, Retrier retrier) {
        this.delegate = delegate;
        this.retrier = retrier;
    }

    @Override
    public List<Depot> depots() throws ConversionException {
        return retrier.call("list depots", attempt -> delegate.depots());
    }

    @Override
    public Transaction transaction(String depot, long id) throws ConversionException {
        return retrier.call("read transaction " + id, attempt -> delegate.transaction(depot, id));
    }

    @Override
    public Optional<Transaction> creationTransaction(String depot, StreamInfo stream) throws ConversionException {
        return retrier.call(
                "find creation of stream " + stream.name(), attempt -> delegate.creationTransaction(depot, stream));
    }

    @Override
    public long resolveTransaction(String depot, String spec) throws ConversionException {
        return retrier.call("resolve transaction " + spec, attempt -> delegate.resolveTransaction(depot, spec));
    }

    @Override
    public List<StreamInfo> streams(String depot, @Nullable Long transaction) throws ConversionException {
        return retrier.call(
                "list streams at " + (transaction == null ? "now" : transaction),
                attempt -> delegate.streams(depot, transaction));
    }

    @Override
    public StreamDiff diff(String depot, StreamInfo stream, long fromTransaction, long toTransaction)
            throws ConversionException {
        return retrier.call(
                "diff " + stream.name() + " " + fromTransaction + "-" + toTransaction,
                attempt -> delegate.diff(depot, stream, fromTransaction, toTransaction));
    }

    @Override
    public void populate(String depot, StreamInfo stream, long transaction, Path destination, boolean overwrite)
            throws ConversionException {
        retrier.call("populate " + stream.name() + " at " + transaction, attempt -> {
            // a failed attempt may have left truncated files behind
            delegate.populate(depot, stream, transaction, destination, overwrite || attempt > 1);
            return null;
        });
    }

    @Override
    public List<Transaction> deepHistory(String depot, StreamInfo stream, long fromTransaction, long toTransaction)
            throws ConversionException {
        return retrier.call(
                "history of " + stream.name() + " " + fromTransaction + "-" + toTransaction,
                attempt -> delegate.deepHistory(depot, stream, fromTransaction, toTransaction));
    }

    @Override
    public Set<String> users() throws ConversionException {
        return retrier.call("list users", attempt -> delegate.users());
    }
}
