package io.github.depot2git.source;

import io.github.depot2git.ConversionException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Everything the converter asks of the source system. Implementations report transport failures as
 * {@link io.github.depot2git.TransientCommandException} and leave retrying to {@link RetryingSourceRepository}.
 * No method returns an empty result in place of a failure.
 */
public interface SourceRepository {
    List<Depot> depots() throws ConversionException;

    Transaction transaction(String depot, long id) throws ConversionException;

    /** The transaction that created the stream; empty for the depot's root stream. */
    Optional<Transaction> creationTransaction(String depot, StreamInfo stream) throws ConversionException;

    /** Resolves {@code now}, {@code highest} or a literal number to a transaction id. */
    long resolveTransaction(String depot, String spec) throws ConversionException;

    /** The depot's streams as of a transaction, or as of now when {@code transaction} is null. */
    List<StreamInfo> streams(String depot, @Nullable Long transaction) throws ConversionException;

    StreamDiff diff(String depot, StreamInfo stream, long fromTransaction, long toTransaction)
            throws ConversionException;

    /**
     * Writes the stream's content as of a transaction under {@code destination}. Without {@code overwrite} files
     * already present are left alone.
     */
    void populate(String depot, StreamInfo stream, long transaction, Path destination, boolean overwrite)
            throws ConversionException;

    /**
     * Transactions in {@code (fromTransaction, toTransaction]} that may have changed the stream's content: its own
     * and those of every stream in its basis chain, ordered by id.
     */
    List<Transaction> deepHistory(String depot, StreamInfo stream, long fromTransaction, long toTransaction)
            throws ConversionException;

    Set<String> users() throws ConversionException;
}
