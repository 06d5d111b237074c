package io.github.depot2git.process;

import io.github.depot2git.ConversionContext;
import io.github.depot2git.FatalConversionException;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.git.Annotation;
import io.github.depot2git.git.CommitMessages;
import io.github.depot2git.git.Refs;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.StreamTree;
import io.github.depot2git.source.Transaction;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.jetbrains.annotations.Nullable;

/**
 * Creates annotated commits on stream branches. A published commit moves its branch with a compare-and-set
 * update and only then gets its annotation; if annotating fails the branch is put back.
 */
public final class BranchWriter {
    private static final Logger logger = LogManager.getLogger(BranchWriter.class);

    /** A stream's branch as found: its name, its tip if it exists, and the tip's annotation. */
    public record BranchState(String name, @Nullable ObjectId tip, @Nullable Annotation annotation) {
        public boolean exists() {
            return tip != null;
        }

        /** Whether the branch already reflects this transaction (or a later one). */
        public boolean hasProcessed(long transaction) {
            return annotation != null && annotation.transactionNumber() >= transaction;
        }
    }

    private final ConversionContext context;
    private final BranchNames names;

    public BranchWriter(ConversionContext context, BranchNames names) {
        this.context = context;
        this.names = names;
    }

    public BranchNames names() {
        return names;
    }

    public BranchState state(StreamInfo stream) throws IOException, FatalConversionException {
        var name = names.branchFor(stream.number(), stream.name());
        var tip = context.target().branchTip(name);
        if (tip.isEmpty()) {
            return new BranchState(name, null, null);
        }
        return new BranchState(name, tip.get(), context.target().annotations().read(tip.get()).orElse(null));
    }

    /**
     * Renames a branch that follows its stream's name when the stream was renamed since {@code previousName}. Does
     * nothing when the old branch is gone or the new one already exists, which is where an interrupted rename
     * leaves things.
     */
    public void followRename(StreamInfo stream, @Nullable String previousName)
            throws IOException, FatalConversionException {
        if (previousName == null || previousName.equals(stream.name()) || !names.followsStreamName(stream.number())) {
            return;
        }
        var from = BranchNames.sanitize(previousName);
        var to = BranchNames.sanitize(stream.name());
        if (from.equals(to)) {
            return;
        }
        if (context.target().branchTip(from).isPresent() && context.target().branchTip(to).isEmpty()) {
            context.target().renameBranch(from, to);
        }
    }

    /**
     * Where a new branch for the stream starts: the tip of the nearest ancestor stream that has a branch, or
     * nothing for an orphan.
     */
    public Optional<ObjectId> startingPoint(StreamInfo stream, StreamTree topology)
            throws IOException, FatalConversionException {
        for (var ancestor : topology.basisChain(stream.number())) {
            if (!names.isConfigured(ancestor.number())) {
                continue;
            }
            var tip = state(ancestor).tip();
            if (tip != null) {
                return Optional.of(tip);
            }
        }
        return Optional.empty();
    }

    public ObjectId build(ObjectId tree, List<ObjectId> parents, Transaction transaction, String message)
            throws IOException {
        return context.target().commit(tree, parents, identity(transaction), message);
    }

    public PersonIdent identity(Transaction transaction) {
        return context.identities().identity(transaction.user(), transaction.time());
    }

    /**
     * Points the branch at {@code commit} and annotates it.
     *
     * @param expectedTip the tip the decision was based on; null when the branch is being created
     */
    public void publish(
            BranchState branch,
            ObjectId commit,
            Annotation annotation,
            CommitMessages.Message message,
            Transaction transaction,
            boolean force)
            throws IOException, FatalConversionException {
        var target = context.target();
        var expectedTip = branch.tip();
        target.setBranch(branch.name(), expectedTip, commit, force, "transaction " + transaction.id());
        var ident = identity(transaction);
        try {
            target.annotations().write(commit, annotation, ident);
            if (message.info() != null) {
                target.notes(CommitMessages.INFO_NOTES_REF).write(commit, message.info(), ident);
            }
        } catch (IOException | InvariantViolationException e) {
            logger.error("Annotating {} on {} failed, moving the branch back", Refs.abbreviate(commit), branch.name());
            if (expectedTip == null) {
                target.deleteBranch(branch.name(), commit);
            } else {
                target.setBranch(branch.name(), commit, expectedTip, true, "undo transaction " + transaction.id());
            }
            throw new InvariantViolationException(
                    "Could not annotate " + commit.name() + " for transaction " + transaction.id(), e);
        }
        logger.info(
                "{}: {} -> {} ({})", branch.name(), Refs.abbreviate(expectedTip), Refs.abbreviate(commit), transaction);
    }

    /**
     * Makes sure the branch tip carries an annotation. A tip without one is left over from an interrupted run; the
     * branch goes back along first parents to the nearest annotated commit.
     */
    public void recover(String branch) throws IOException, FatalConversionException {
        var target = context.target();
        var tip = target.branchTip(branch);
        if (tip.isEmpty()) {
            return;
        }
        var commit = target.parseCommit(tip.get());
        int discarded = 0;
        while (target.annotations().read(commit).isEmpty()) {
            if (commit.getParentCount() != 1) {
                var stop = commit.getParentCount() == 0 ? "root" : "merge";
                throw new InvariantViolationException(
                        "Branch " + branch + " has no annotated commit before the " + stop + " " + commit.name());
            }
            logger.warn("{}: discarding unannotated commit {}", branch, commit.name());
            discarded++;
            commit = target.parseCommit(commit.getParent(0));
        }
        if (discarded > 0) {
            target.setBranch(branch, tip.get(), commit, true, "recover to last annotated commit");
            logger.warn("{}: reset to {} after discarding {} commits", branch, commit.name(), discarded);
        }
    }
}
