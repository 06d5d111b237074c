package io.github.depot2git.process;

import io.github.depot2git.ConversionContext;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.retrieve.MetadataRecord;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.StreamTree;
import io.github.depot2git.store.StateKeys;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;

/** The retrieved histories of a set of streams, indexed by stream and by transaction. */
public final class DepotHistory {
    private static final Logger logger = LogManager.getLogger(DepotHistory.class);

    /** One stream's metadata entry paired with its content entry. */
    public record StreamEntry(
            int stream, long transaction, MetadataRecord metadata, ObjectId contentCommit, ObjectId contentTree) {

        /** The stream as the source described it at this transaction. */
        public StreamInfo info() throws InvariantViolationException {
            return metadata.stream(stream)
                    .orElseThrow(() -> new InvariantViolationException(
                            "Stream " + stream + " is missing from its own metadata at transaction " + transaction));
        }
    }

    private final Map<Integer, NavigableMap<Long, StreamEntry>> byStream = new HashMap<>();
    private final NavigableMap<Long, List<StreamEntry>> byTransaction = new TreeMap<>();

    private DepotHistory() {}

    public static DepotHistory load(ConversionContext context, Collection<Integer> streams)
            throws IOException, InvariantViolationException {
        var history = new DepotHistory();
        var repository = context.target().repository();
        for (var stream : streams) {
            var keys = StateKeys.stream(context.depot().number(), stream);
            var metadata = context.store().entries(keys.metadata());
            var content = context.store().entries(keys.content());
            if (content.size() > metadata.size()) {
                throw new InvariantViolationException("Stream " + stream + " has more content than metadata entries");
            }
            var entries = new TreeMap<Long, StreamEntry>();
            for (int i = 0; i < content.size(); i++) {
                var meta = metadata.get(i);
                var data = content.get(i);
                if (meta.transaction() != data.transaction()) {
                    throw new InvariantViolationException("Stream " + stream + " histories diverge at entry " + i
                            + ": metadata " + meta.transaction() + ", content " + data.transaction());
                }
                var record = MetadataRecord.read(repository, meta.tree());
                var entry = new StreamEntry(stream, data.transaction(), record, data.commit(), data.tree());
                entries.put(entry.transaction(), entry);
                history.byTransaction.computeIfAbsent(entry.transaction(), k -> new ArrayList<>()).add(entry);
            }
            history.byStream.put(stream, entries);
            logger.debug("Loaded {} entries for stream {}", entries.size(), stream);
        }
        return history;
    }

    /** Transactions with at least one entry in {@code (after, upTo]}. */
    public NavigableSet<Long> transactions(long after, long upTo) {
        if (upTo <= after) {
            return Collections.emptyNavigableSet();
        }
        return byTransaction.subMap(after, false, upTo, true).navigableKeySet();
    }

    public List<StreamEntry> entriesAt(long transaction) {
        return byTransaction.getOrDefault(transaction, List.of());
    }

    public Optional<StreamEntry> entry(int stream, long transaction) {
        var entries = byStream.get(stream);
        return entries == null ? Optional.empty() : Optional.ofNullable(entries.get(transaction));
    }

    /** The stream's state as of a transaction: its latest entry at or before it. */
    public Optional<StreamEntry> latest(int stream, long transaction) {
        var entries = byStream.get(stream);
        if (entries == null) {
            return Optional.empty();
        }
        var floor = entries.floorEntry(transaction);
        return floor == null ? Optional.empty() : Optional.of(floor.getValue());
    }

    public Optional<StreamEntry> previous(int stream, long transaction) {
        var entries = byStream.get(stream);
        if (entries == null) {
            return Optional.empty();
        }
        var lower = entries.lowerEntry(transaction);
        return lower == null ? Optional.empty() : Optional.of(lower.getValue());
    }

    public List<StreamEntry> entries(int stream) {
        var entries = byStream.get(stream);
        return entries == null ? List.of() : List.copyOf(entries.values());
    }

    /** The stream tree as recorded by the latest entry of any stream at or before the transaction. */
    public Optional<StreamTree> topologyAt(long transaction) throws InvariantViolationException {
        var floor = byTransaction.floorEntry(transaction);
        if (floor == null) {
            return Optional.empty();
        }
        return Optional.of(StreamTree.of(floor.getValue().get(0).metadata().streams()));
    }
}
