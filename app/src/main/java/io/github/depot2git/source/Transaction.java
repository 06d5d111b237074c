package io.github.depot2git.source;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * A source transaction.
 *
 * @param time seconds since the epoch, UTC
 * @param stream the stream the transaction affected; for promotions the destination
 * @param fromStream promotion source, null for every other kind
 */
public record Transaction(
        long id,
        TransactionKind kind,
        String user,
        long time,
        String comment,
        @Nullable StreamRef stream,
        @Nullable StreamRef fromStream) {

    public Instant instant() {
        return Instant.ofEpochSecond(time);
    }

    @Override
    public String toString() {
        return "transaction " + id + " (" + kind.wireName() + ")";
    }
}
