package io.github.depot2git.process;

import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.StreamTree;
import io.github.depot2git.source.Transaction;
import java.util.List;
import java.util.Optional;

/**
 * One transaction being applied to the branches.
 *
 * @param entries every configured stream's history entry at this transaction
 * @param topology the stream tree as of this transaction
 */
public record TransactionStep(Transaction transaction, List<DepotHistory.StreamEntry> entries, StreamTree topology) {

    public long id() {
        return transaction.id();
    }

    public Optional<DepotHistory.StreamEntry> entry(int stream) {
        return entries.stream().filter(e -> e.stream() == stream).findFirst();
    }

    /**
     * The stream as of this transaction. Prefers the stream's own entry, which carries rename and re-parent
     * details for the stream it describes.
     */
    public StreamInfo info(int stream) throws InvariantViolationException {
        var own = entry(stream);
        if (own.isPresent()) {
            return own.get().info();
        }
        return topology.stream(stream)
                .orElseThrow(() -> new InvariantViolationException(
                        "Stream " + stream + " does not exist at transaction " + transaction.id()));
    }
}
