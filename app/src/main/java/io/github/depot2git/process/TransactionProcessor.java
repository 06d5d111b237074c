package io.github.depot2git.process;

import io.github.depot2git.ConfiguredStream;
import io.github.depot2git.ConversionContext;
import io.github.depot2git.FatalConversionException;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.git.Annotation;
import io.github.depot2git.retrieve.StreamRetriever;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.StreamKind;
import io.github.depot2git.source.StreamRef;
import io.github.depot2git.source.StreamTree;
import io.github.depot2git.source.TransactionKind;
import io.github.depot2git.store.JsonValues;
import io.github.depot2git.store.StateKeys;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;

/**
 * Replays the retrieved histories, transaction by transaction, onto one branch per configured stream.
 *
 * <p>Commits are built from the content trees stored during retrieval; the source system and the working tree are
 * not involved. A checkpoint records the last transaction applied to every branch, and each branch tip's annotation
 * records the last transaction applied to that branch, so an interrupted run resumes without duplicating commits.
 */
public final class TransactionProcessor {
    private static final Logger logger = LogManager.getLogger(TransactionProcessor.class);

    static final String CHECKPOINT_FIELD = "transaction";

    private final ConversionContext context;
    private final List<ConfiguredStream> streams;
    private final BranchWriter writer;
    private final MergeDecisionEngine engine;
    private @Nullable DepotHistory history;

    public TransactionProcessor(ConversionContext context, List<ConfiguredStream> streams) {
        this.context = context;
        this.streams = List.copyOf(streams);
        this.writer = new BranchWriter(context, new BranchNames(streams));
        this.engine = new MergeDecisionEngine(context, writer);
    }

    /** @return the last transaction applied, or the previous checkpoint if there was nothing to do */
    public long process() throws IOException, FatalConversionException {
        var numbers = streams.stream().map(ConfiguredStream::number).toList();
        var loaded = DepotHistory.load(context, numbers);
        history = loaded;

        long end = lowestHighWaterMark();
        long checkpoint = checkpoint().orElse(context.config().startTransaction() - 1);
        recoverBranches(loaded, checkpoint);

        var transactions = loaded.transactions(checkpoint, end);
        logger.info("Processing {} transactions after {} up to {}", transactions.size(), checkpoint, end);
        long last = checkpoint;
        for (var id : transactions) {
            apply(loaded, id);
            writeCheckpoint(id);
            last = id;
        }
        return last;
    }

    public Optional<Long> checkpoint() throws IOException, InvariantViolationException {
        return JsonValues.readLong(context.store(), StateKeys.processing(context.depot().number()), CHECKPOINT_FIELD);
    }

    private void writeCheckpoint(long transaction) throws IOException, InvariantViolationException {
        JsonValues.writeLong(
                context.store(), StateKeys.processing(context.depot().number()), CHECKPOINT_FIELD, transaction);
    }

    private long lowestHighWaterMark() throws IOException, InvariantViolationException {
        long lowest = Long.MAX_VALUE;
        for (var stream : streams) {
            var mark = StreamRetriever.highWaterMark(context.store(), context.depot().number(), stream.number());
            if (mark.isEmpty()) {
                throw new InvariantViolationException(
                        "Stream " + stream.info().name() + " has not been retrieved yet; run retrieval first");
            }
            lowest = Math.min(lowest, mark.get());
        }
        return lowest == Long.MAX_VALUE ? 0 : lowest;
    }

    private void recoverBranches(DepotHistory loaded, long checkpoint) throws IOException, FatalConversionException {
        for (var stream : streams) {
            var atCheckpoint = loaded.latest(stream.number(), checkpoint);
            var info = atCheckpoint.isPresent() ? atCheckpoint.get().info() : stream.info();
            writer.recover(writer.names().branchFor(stream.number(), info.name()));
        }
    }

    void apply(DepotHistory loaded, long id) throws IOException, FatalConversionException {
        var entries = loaded.entriesAt(id);
        if (entries.isEmpty()) {
            return;
        }
        var metadata = entries.get(0).metadata();
        var step = new TransactionStep(metadata.transaction(), entries, StreamTree.of(metadata.streams()));
        logger.debug("Applying {} to {} streams", step.transaction(), entries.size());
        handlerFor(step.transaction().kind()).handle(step);
        initializeBranches(step);
    }

    /** Streams whose history starts here without the transaction itself creating their branch get one now. */
    private void initializeBranches(TransactionStep step) throws IOException, FatalConversionException {
        var pending = new ArrayList<Integer>();
        for (var entry : step.entries()) {
            if (!writer.state(entry.info()).exists()) {
                pending.add(entry.stream());
            }
        }
        for (var stream : step.topology().topologicalOrder(pending)) {
            var entry = step.entry(stream).orElseThrow();
            var info = entry.info();
            commitContent(step, info, entry.contentTree(), "Started converting " + info.name());
        }
    }

    TransactionHandler handlerFor(TransactionKind kind) {
        return switch (kind) {
            case MKSTREAM -> this::createStream;
            case CHSTREAM -> this::reconfigureStream;
            case ADD, KEEP, CO, MOVE -> this::commitChange;
            case PROMOTE -> this::promote;
            case DEFUNCT, PURGE -> this::deactivate;
            case DEFCOMP -> this::defineComponent;
        };
    }

    private void createStream(TransactionStep step) throws IOException, FatalConversionException {
        var entry = step.entries().stream()
                .filter(e -> e.metadata().createdStream() != null)
                .findFirst()
                .orElseThrow(() ->
                        new InvariantViolationException(step.transaction() + " does not name the stream it created"));
        int created = entry.metadata().createdStream();
        if (!writer.names().isConfigured(created)) {
            logger.debug("{} created stream {} which is not converted", step.transaction(), created);
            return;
        }
        var content = requireHistory().latest(created, step.id());
        if (content.isEmpty()) {
            logger.info("No content retrieved for stream {} at {}", created, step.transaction());
            return;
        }
        var info = step.info(created);
        var title = info.basisName() == null
                ? "Created " + info.name()
                : "Created " + info.name() + " based on " + info.basisName();
        commitContent(step, info, content.get().contentTree(), title);
    }

    private void reconfigureStream(TransactionStep step) throws IOException, FatalConversionException {
        var stream = affected(step);
        if (stream.isEmpty() || !writer.names().isConfigured(stream.get())) {
            return;
        }
        var info = step.info(stream.get());
        if (info.wasRenamed()) {
            writer.followRename(info, info.previousName());
        }
        if (info.wasReparented()) {
            var branch = writer.state(info);
            var newBase = writer.startingPoint(info, step.topology());
            if (branch.exists() && newBase.isPresent() && !branch.hasProcessed(step.id())) {
                // re-parenting is recorded as a hard reset onto the new basis, not a rebase
                context.target()
                        .setBranch(
                                branch.name(), branch.tip(), newBase.get(), true, "re-parent to " + info.basisName());
                logger.info("{}: reset onto new basis {}", branch.name(), info.basisName());
            }
        }
        var content = requireHistory().latest(info.number(), step.id());
        if (content.isPresent()) {
            commitContent(step, info, content.get().contentTree(), "Changed " + info.name());
        }
        propagate(step, info.number(), null);
    }

    private void commitChange(TransactionStep step) throws IOException, FatalConversionException {
        var stream = affected(step);
        if (stream.isEmpty() || !writer.names().isConfigured(stream.get())) {
            return;
        }
        var entry = step.entry(stream.get());
        if (entry.isEmpty()) {
            logger.debug("{} did not change the content of stream {}", step.transaction(), stream.get());
            return;
        }
        commitContent(step, entry.get().info(), entry.get().contentTree(), null);
    }

    private void promote(TransactionStep step) throws IOException, FatalConversionException {
        var transaction = step.transaction();
        var destinationRef = transaction.stream();
        if (destinationRef == null) {
            throw new InvariantViolationException(transaction + " has no destination stream");
        }
        var destination = step.info(destinationRef.number());
        var source = sourceOf(step);
        var entry = step.entry(destination.number());
        if (writer.names().isConfigured(destination.number()) && entry.isPresent()) {
            followRename(destination, step.id());
            if (source != null && writer.names().isConfigured(source.number())) {
                followRename(source, step.id());
            }
            var outcome = engine.commitOrMerge(
                    destination,
                    source,
                    step,
                    entry.get().contentTree(),
                    false,
                    annotation(destination, step).withPromotion(destination, source));
            logger.info("{} into {}: {}", transaction, destination.name(), outcome.decision());
        }
        propagate(step, destination.number(), source == null ? null : source.number());
    }

    private void deactivate(TransactionStep step) throws IOException, FatalConversionException {
        commitChange(step);
        var stream = affected(step);
        if (stream.isPresent() && !step.info(stream.get()).isWorkspace()) {
            propagate(step, stream.get(), null);
        }
    }

    private void defineComponent(TransactionStep step) {
        logger.info("Ignoring {}", step.transaction());
    }

    /**
     * Records the transaction on every other converted stream whose content changed with it, parents first. Each
     * stream takes the change from its nearest ancestor that already took it.
     */
    private void propagate(TransactionStep step, int origin, @Nullable Integer excluded)
            throws IOException, FatalConversionException {
        var candidates = new ArrayList<Integer>();
        for (var entry : step.entries()) {
            int stream = entry.stream();
            if (stream != origin && (excluded == null || stream != excluded) && writer.names().isConfigured(stream)) {
                candidates.add(stream);
            }
        }
        if (candidates.isEmpty()) {
            return;
        }
        var originInfo = step.info(origin);
        Set<Integer> reached = new HashSet<>();
        reached.add(origin);
        @Nullable StreamInfo primarySource = sourceOf(step);
        for (var stream : step.topology().topologicalOrder(candidates)) {
            var info = step.info(stream);
            var from = nearestReached(step.topology(), stream, reached).orElse(originInfo);
            var entry = step.entry(stream).orElseThrow();
            followRename(info, step.id());
            var annotation = annotation(info, step);
            if (step.transaction().kind() == TransactionKind.PROMOTE) {
                annotation = annotation.withPromotion(originInfo, primarySource);
            }
            var outcome = engine.commitOrMerge(info, from, step, entry.contentTree(), true, annotation);
            logger.debug("{} inherited by {}: {}", step.transaction(), info.name(), outcome.decision());
            reached.add(stream);
        }
    }

    private Optional<StreamInfo> nearestReached(StreamTree topology, int stream, Set<Integer> reached) {
        for (var ancestor : topology.basisChain(stream)) {
            if (reached.contains(ancestor.number())) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    /** Commits the stream's content as of this transaction on its branch, creating the branch if needed. */
    private void commitContent(TransactionStep step, StreamInfo stream, ObjectId tree, @Nullable String title)
            throws IOException, FatalConversionException {
        followRename(stream, step.id());
        var branch = writer.state(stream);
        if (branch.hasProcessed(step.id())) {
            logger.debug("{} already has {}", branch.name(), step.transaction());
            return;
        }
        var parent = branch.exists()
                ? Optional.ofNullable(branch.tip())
                : writer.startingPoint(stream, step.topology());
        var transaction = step.transaction();
        var message = context.messages().compose(transaction, stream, title, null, null);
        var commit = writer.build(tree, parent.map(List::of).orElse(List.of()), transaction, message.text());
        writer.publish(branch, commit, annotation(stream, step), message, transaction, false);
    }

    /** Renames the stream's branch if the stream had another name at its previous history entry. */
    private void followRename(StreamInfo stream, long transaction) throws IOException, FatalConversionException {
        var previous = requireHistory().previous(stream.number(), transaction);
        if (previous.isPresent()) {
            writer.followRename(stream, previous.get().info().name());
        }
    }

    private Annotation annotation(StreamInfo stream, TransactionStep step) {
        return Annotation.of(context.depot().name(), stream, step.transaction());
    }

    private Optional<Integer> affected(TransactionStep step) {
        StreamRef stream = step.transaction().stream();
        if (stream != null) {
            return Optional.of(stream.number());
        }
        if (step.entries().size() == 1) {
            return Optional.of(step.entries().get(0).stream());
        }
        logger.warn("{} does not name the stream it affected", step.transaction());
        return Optional.empty();
    }

    private @Nullable StreamInfo sourceOf(TransactionStep step) {
        var from = step.transaction().fromStream();
        if (from == null) {
            return null;
        }
        // workspaces that were since removed are missing from the stream list
        return step.topology()
                .stream(from.number())
                .orElse(StreamInfo.of(
                        from.number(), from.name(), context.depot().name(), StreamKind.WORKSPACE, null, null));
    }

    private DepotHistory requireHistory() {
        if (history == null) {
            throw new IllegalStateException("process() has not loaded the histories");
        }
        return history;
    }
}
