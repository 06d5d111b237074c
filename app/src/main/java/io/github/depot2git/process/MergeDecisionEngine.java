package io.github.depot2git.process;

import io.github.depot2git.ConversionContext;
import io.github.depot2git.FatalConversionException;
import io.github.depot2git.git.Annotation;
import io.github.depot2git.git.Refs;
import io.github.depot2git.source.StreamInfo;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;

/**
 * Decides how content arriving in a stream from another stream is recorded.
 *
 * <p>When the destination ends up with exactly the source branch's content, the history gets a real merge of the two
 * branches. Otherwise only part of the source arrived and the destination gets an ordinary single-parent commit.
 * The decision depends only on the two branch tips and the transaction, so replaying a transaction decides the same
 * way.
 */
public final class MergeDecisionEngine {
    private static final Logger logger = LogManager.getLogger(MergeDecisionEngine.class);

    public enum Decision {
        MERGE,
        CHERRY_PICK,
        NO_OP
    }

    /** @param commit the destination's tip after the decision */
    public record PromotionOutcome(Decision decision, @Nullable ObjectId commit) {}

    private final ConversionContext context;
    private final BranchWriter writer;

    public MergeDecisionEngine(ConversionContext context, BranchWriter writer) {
        this.context = context;
        this.writer = writer;
    }

    /**
     * Records {@code newTree} on the destination's branch.
     *
     * @param source the stream the content came from; null when unknown or not converted
     * @param inherited true when the destination only received the change through its basis
     * @param annotation annotation for the commit, already naming the destination
     */
    public PromotionOutcome commitOrMerge(
            StreamInfo destination,
            @Nullable StreamInfo source,
            TransactionStep step,
            ObjectId newTree,
            boolean inherited,
            Annotation annotation)
            throws IOException, FatalConversionException {
        var target = context.target();
        var transaction = step.transaction();
        var branch = writer.state(destination);
        if (branch.hasProcessed(transaction.id())) {
            logger.debug("{} already has {}", branch.name(), transaction);
            return new PromotionOutcome(Decision.NO_OP, branch.tip());
        }

        @Nullable ObjectId sourceTip = null;
        if (source != null && writer.names().isConfigured(source.number())) {
            sourceTip = writer.state(source).tip();
        }

        var base = branch.tip() != null
                ? branch.tip()
                : writer.startingPoint(destination, step.topology()).orElse(null);

        if (branch.tip() != null && target.sameContent(target.treeOf(branch.tip()), newTree)) {
            boolean alreadyMerged = sourceTip == null || target.isAncestor(sourceTip, branch.tip());
            if (inherited || alreadyMerged) {
                logger.debug("{}: nothing to record for {}", branch.name(), transaction);
                return new PromotionOutcome(Decision.NO_OP, branch.tip());
            }
        }

        var messages = context.messages();
        var sourceName = source == null ? "another stream" : source.name();
        var pickMessage =
                messages.compose(transaction, destination, pickTitle(sourceName, destination, inherited), null, source);
        var provisional =
                writer.build(newTree, base == null ? List.of() : List.of(base), transaction, pickMessage.text());

        boolean mergeable = sourceTip != null
                && !(base != null && target.isAncestor(sourceTip, base))
                && target.sameContent(newTree, target.treeOf(sourceTip));
        if (mergeable) {
            var parents = new ArrayList<ObjectId>();
            if (base != null) {
                parents.add(base);
            }
            parents.add(sourceTip);
            var message = messages.compose(
                    transaction, destination, "Merged " + sourceName + " into " + destination.name(), null, source);
            var merge = writer.build(newTree, parents, transaction, message.text());
            writer.publish(branch, merge, annotation, message, transaction, false);
            logger.debug(
                    "{}: merged {} for {}, provisional {} dropped",
                    branch.name(),
                    sourceName,
                    transaction,
                    Refs.abbreviate(provisional));
            return new PromotionOutcome(Decision.MERGE, merge);
        }

        writer.publish(branch, provisional, annotation, pickMessage, transaction, false);
        return new PromotionOutcome(Decision.CHERRY_PICK, provisional);
    }

    private static String pickTitle(String sourceName, StreamInfo destination, boolean inherited) {
        return inherited
                ? "Inherited changes from " + sourceName + " in " + destination.name()
                : "Promoted from " + sourceName + " into " + destination.name();
    }
}
