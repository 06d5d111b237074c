package io.github.depot2git.retrieve;

import io.github.depot2git.ConversionContext;
import io.github.depot2git.ConversionException;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.Transaction;
import io.github.depot2git.source.TransactionKind;
import io.github.depot2git.store.EntryInfo;
import io.github.depot2git.store.JsonValues;
import io.github.depot2git.store.SequenceEntry;
import io.github.depot2git.store.StateKeys;
import io.github.depot2git.store.StateStore;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;

/**
 * Pulls one stream's history out of the source into its metadata and content histories.
 *
 * <p>Every step is resumable. The metadata entry for a transaction is appended before its content entry, content
 * that lags behind metadata is caught up first, and the high-water mark is written only once both histories reach
 * the end transaction. A rerun after an interruption continues from the histories' tips.
 */
public final class StreamRetriever {
    private static final Logger logger = LogManager.getLogger(StreamRetriever.class);

    static final String HIGH_WATER_MARK = "high-water-mark";

    private final ConversionContext context;
    private final ChangeDetector detector;

    public StreamRetriever(ConversionContext context) {
        this(context, ChangeDetector.forMethod(context.config().method(), context.source(), context.depot().name()));
    }

    public StreamRetriever(ConversionContext context, ChangeDetector detector) {
        this.context = context;
        this.detector = detector;
    }

    public RetrievalResult retrieve(StreamInfo stream, long startTransaction, long endTransaction)
            throws ConversionException, IOException {
        var keys = StateKeys.stream(context.depot().number(), stream.number());
        var store = context.store();

        var highWaterMark = highWaterMark(stream.number());
        if (highWaterMark.isPresent() && highWaterMark.get() >= endTransaction) {
            catchUpContent(stream);
            var tip = store.tipEntry(keys.content());
            logger.info("{} is up to date at transaction {}", stream.name(), highWaterMark.get());
            return new RetrievalResult(
                    tip.map(SequenceEntry::transaction).orElse(highWaterMark.get()),
                    tip.map(SequenceEntry::commit).orElse(null));
        }

        long lastTransaction;
        var metadataTip = store.tipEntry(keys.metadata());
        if (metadataTip.isEmpty()) {
            var first = firstTransaction(stream, startTransaction, endTransaction);
            if (first.isEmpty()) {
                logger.info("{} has no transactions up to {}", stream.name(), endTransaction);
                markRetrieved(stream, endTransaction);
                return new RetrievalResult(endTransaction, null);
            }
            appendMetadata(stream, first.get(), null);
            lastTransaction = first.get().id();
        } else {
            lastTransaction = metadataTip.get().transaction();
        }

        catchUpContent(stream);

        long searchFrom = Math.max(lastTransaction, highWaterMark.orElse(lastTransaction));
        while (true) {
            var change = detector.next(stream, lastTransaction, searchFrom, endTransaction);
            if (change.isEmpty()) {
                break;
            }
            var transaction = context.source().transaction(context.depot().name(), change.get().transaction());
            appendMetadata(stream, transaction, change.get());
            catchUpContent(stream);
            lastTransaction = transaction.id();
            searchFrom = lastTransaction;
        }

        verifyAligned(stream);
        markRetrieved(stream, endTransaction);
        var tip = store.tipEntry(keys.content());
        logger.info(
                "Retrieved {} up to transaction {} (last change {})", stream.name(), endTransaction, lastTransaction);
        return new RetrievalResult(lastTransaction, tip.map(SequenceEntry::commit).orElse(null));
    }

    /** The end transaction of the last complete retrieval of the stream. */
    public Optional<Long> highWaterMark(int streamNumber) throws IOException, InvariantViolationException {
        return highWaterMark(context.store(), context.depot().number(), streamNumber);
    }

    public static Optional<Long> highWaterMark(StateStore store, int depot, int streamNumber)
            throws IOException, InvariantViolationException {
        return JsonValues.readLong(store, StateKeys.stream(depot, streamNumber).highWaterMark(), HIGH_WATER_MARK);
    }

    private void markRetrieved(StreamInfo stream, long endTransaction) throws IOException, InvariantViolationException {
        var keys = StateKeys.stream(context.depot().number(), stream.number());
        JsonValues.writeLong(context.store(), keys.highWaterMark(), HIGH_WATER_MARK, endTransaction);
    }

    private Optional<Transaction> firstTransaction(StreamInfo stream, long startTransaction, long endTransaction)
            throws ConversionException {
        var depot = context.depot().name();
        var created = context.source().creationTransaction(depot, stream);
        // the root stream has no creation transaction; it exists from the depot's first transaction on
        var first = created.isPresent() ? created.get() : context.source().transaction(depot, 1);
        if (first.id() < startTransaction) {
            first = context.source().transaction(depot, startTransaction);
        }
        if (first.id() > endTransaction) {
            return Optional.empty();
        }
        return Optional.of(first);
    }

    private void appendMetadata(StreamInfo stream, Transaction transaction, @Nullable DetectedChange change)
            throws ConversionException, IOException {
        var depot = context.depot().name();
        var streams = context.source().streams(depot, transaction.id());
        @Nullable Integer created = null;

        if (transaction.kind() == TransactionKind.MKSTREAM || transaction.kind() == TransactionKind.CHSTREAM) {
            List<StreamInfo> before =
                    transaction.id() <= 1 ? List.of() : context.source().streams(depot, transaction.id() - 1);
            if (transaction.kind() == TransactionKind.MKSTREAM) {
                created = createdStream(transaction, before, streams);
            } else {
                streams = withPreviousState(transaction, before, streams);
            }
        }

        var record = new MetadataRecord(transaction, streams, change == null ? null : change.diff(), created);
        var tree = record.writeTree(context.target().repository());
        var keys = StateKeys.stream(context.depot().number(), stream.number());
        context.store().append(keys.metadata(), tree, entryInfo(transaction));
        logger.info("{}: recorded {}", stream.name(), transaction);
    }

    private static int createdStream(Transaction transaction, List<StreamInfo> before, List<StreamInfo> after)
            throws InvariantViolationException {
        var existing = before.stream().map(StreamInfo::number).collect(Collectors.toSet());
        return after.stream()
                .map(StreamInfo::number)
                .filter(n -> !existing.contains(n))
                .findFirst()
                .orElseThrow(() -> new InvariantViolationException(
                        "Could not tell which stream " + transaction + " created"));
    }

    private static List<StreamInfo> withPreviousState(
            Transaction transaction, List<StreamInfo> before, List<StreamInfo> after) {
        if (transaction.stream() == null) {
            return after;
        }
        int changed = transaction.stream().number();
        Map<Integer, StreamInfo> previous =
                before.stream().collect(Collectors.toMap(StreamInfo::number, s -> s, (a, b) -> a));
        return after.stream()
                .map(s -> {
                    var old = previous.get(s.number());
                    if (s.number() != changed || old == null) {
                        return s;
                    }
                    return s.withPrevious(
                            old.name().equals(s.name()) ? null : old.name(),
                            Objects.equals(old.basisNumber(), s.basisNumber()) ? null : old.basisNumber(),
                            Objects.equals(old.basisNumber(), s.basisNumber()) ? null : old.basisName());
                })
                .toList();
    }

    /**
     * Materializes content for every metadata entry that has none yet. The content history may only ever be a
     * prefix of the metadata history.
     */
    private void catchUpContent(StreamInfo stream) throws ConversionException, IOException {
        var keys = StateKeys.stream(context.depot().number(), stream.number());
        var metadata = context.store().entries(keys.metadata());
        var contentTip = context.store().tipEntry(keys.content());

        int next = 0;
        if (contentTip.isPresent()) {
            long contentTransaction = contentTip.get().transaction();
            while (next < metadata.size() && metadata.get(next).transaction() < contentTransaction) {
                next++;
            }
            if (next == metadata.size() || metadata.get(next).transaction() != contentTransaction) {
                throw new InvariantViolationException(stream.name() + ": content history is at transaction "
                        + contentTransaction + " which is not in the metadata history");
            }
            next++;
        }
        @Nullable ObjectId parent = contentTip.map(SequenceEntry::commit).orElse(null);
        for (int i = next; i < metadata.size(); i++) {
            var entry = metadata.get(i);
            var record = MetadataRecord.read(context.target().repository(), entry.tree());
            parent = materialize(stream, record, parent);
        }
    }

    private ObjectId materialize(StreamInfo stream, MetadataRecord record, @Nullable ObjectId parent)
            throws ConversionException, IOException {
        var transaction = record.transaction();
        var keys = StateKeys.stream(context.depot().number(), stream.number());
        var depot = context.depot().name();
        try (var lease = context.workingTree().acquire()) {
            lease.resetTo(parent);
            var diff = record.diff();
            if (parent == null || diff == null || detector.repopulates()) {
                lease.clear();
                context.source().populate(depot, stream, transaction.id(), context.workingTree().root(), true);
            } else {
                lease.deletePaths(diff.paths());
                lease.deleteEmptyDirectories();
                context.source().populate(depot, stream, transaction.id(), context.workingTree().root(), false);
            }
            lease.preserveEmptyDirectories();
            var tree = lease.snapshot();
            var commit = context.store().append(keys.content(), tree, entryInfo(transaction));
            lease.advanceHead(commit);
            logger.debug("{}: content for {} is {}", stream.name(), transaction, commit.name());
            return commit;
        }
    }

    private void verifyAligned(StreamInfo stream) throws IOException, InvariantViolationException {
        var keys = StateKeys.stream(context.depot().number(), stream.number());
        var metadata = context.store().entries(keys.metadata()).stream()
                .map(SequenceEntry::transaction)
                .toList();
        var content = context.store().entries(keys.content()).stream()
                .map(SequenceEntry::transaction)
                .toList();
        if (!metadata.equals(content)) {
            throw new InvariantViolationException(stream.name() + ": metadata and content histories disagree ("
                    + metadata.size() + " vs " + content.size() + " entries)");
        }
        if (new HashSet<>(metadata).size() != metadata.size()) {
            throw new InvariantViolationException(stream.name() + ": duplicate transactions in history");
        }
    }

    private EntryInfo entryInfo(Transaction transaction) {
        return new EntryInfo(transaction.id(), context.identities().identity(transaction.user(), transaction.time()));
    }
}
