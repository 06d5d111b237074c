package io.github.depot2git.stitch;

import io.github.depot2git.ConfiguredStream;
import io.github.depot2git.ConversionContext;
import io.github.depot2git.FatalConversionException;
import io.github.depot2git.git.Annotation;
import io.github.depot2git.process.BranchNames;
import io.github.depot2git.process.DepotHistory;
import io.github.depot2git.store.StateKeys;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.revwalk.RevCommit;

/**
 * Finds commits on different branches that carry the same content and plans how to connect them.
 *
 * <p>Commits are grouped by tree. Within a group, a commit made by the same transaction on a descendant stream is
 * folded into the ancestor stream's commit when it adds no history of its own. Any other later commit gets the
 * latest earlier commit of each other stream as an extra parent, unless the two are already related.
 */
public final class HistoryStitcher {
    private static final Logger logger = LogManager.getLogger(HistoryStitcher.class);

    private record Node(RevCommit commit, Annotation annotation) {
        int stream() {
            return annotation.streamNumber();
        }

        long transaction() {
            return annotation.transactionNumber();
        }
    }

    private final ConversionContext context;
    private final List<ConfiguredStream> streams;

    public HistoryStitcher(ConversionContext context, List<ConfiguredStream> streams) {
        this.context = context;
        this.streams = List.copyOf(streams);
    }

    /** Computes the plan and stores it under the depot's stitch-plan key. */
    public RewritePlan plan() throws IOException, FatalConversionException {
        var target = context.target();
        var names = new BranchNames(streams);
        var branches = new ArrayList<String>();
        var tips = new ArrayList<ObjectId>();
        for (var stream : streams) {
            var branch = names.branchFor(stream.number(), stream.info().name());
            var tip = target.branchTip(branch);
            if (tip.isPresent()) {
                branches.add(branch);
                tips.add(tip.get());
            }
        }
        if (tips.isEmpty()) {
            logger.info("No branches to stitch");
            return save(new RewritePlan(branches, Map.of(), Map.of()));
        }

        var groups = new LinkedHashMap<ObjectId, List<Node>>();
        int annotated = 0;
        for (var commit : target.reachable(tips)) {
            var annotation = target.annotations().read(commit);
            if (annotation.isEmpty() || !annotation.get().depot().equals(context.depot().name())) {
                continue;
            }
            annotated++;
            groups.computeIfAbsent(commit.getTree().copy(), k -> new ArrayList<>())
                    .add(new Node(commit, annotation.get()));
        }
        logger.debug("{} annotated commits in {} distinct trees", annotated, groups.size());

        var history = DepotHistory.load(
                context, streams.stream().map(ConfiguredStream::number).toList());
        var aliases = new AliasMap();
        var extraParents = new HashMap<String, List<String>>();
        for (var group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            group.sort(Comparator.comparingInt((Node n) -> n.commit().getCommitTime())
                    .thenComparingLong(Node::transaction));
            foldSameTransaction(group, history, aliases);
            linkIdenticalContent(group, aliases, extraParents);
        }

        var plan = new RewritePlan(branches, aliases.resolved(), extraParents);
        logger.info(
                "Stitch plan: {} commits folded, {} commits get extra parents",
                plan.aliases().size(),
                plan.extraParents().size());
        return save(plan);
    }

    private void foldSameTransaction(List<Node> group, DepotHistory history, AliasMap aliases)
            throws IOException, FatalConversionException {
        for (int j = 1; j < group.size(); j++) {
            for (int i = 0; i < j; i++) {
                var a = group.get(i);
                var b = group.get(j);
                if (a.stream() == b.stream() || a.transaction() != b.transaction()) {
                    continue;
                }
                var topology = history.topologyAt(a.transaction());
                if (topology.isEmpty()) {
                    continue;
                }
                if (topology.get().isAncestor(a.stream(), b.stream()) && addsNoHistory(b, a)) {
                    aliases.add(b.commit().name(), a.commit().name());
                } else if (topology.get().isAncestor(b.stream(), a.stream()) && addsNoHistory(a, b)) {
                    aliases.add(a.commit().name(), b.commit().name());
                }
            }
        }
    }

    private void linkIdenticalContent(List<Node> group, AliasMap aliases, Map<String, List<String>> extraParents)
            throws IOException {
        var target = context.target();
        for (int j = 1; j < group.size(); j++) {
            var later = group.get(j);
            if (aliases.isAliased(later.commit().name())) {
                continue;
            }
            var seen = new HashSet<Integer>();
            seen.add(later.stream());
            for (int i = j - 1; i >= 0; i--) {
                var earlier = group.get(i);
                if (!seen.add(earlier.stream())) {
                    continue;
                }
                if (target.isAncestor(earlier.commit(), later.commit())
                        || target.isAncestor(later.commit(), earlier.commit())) {
                    continue;
                }
                extraParents
                        .computeIfAbsent(later.commit().name(), k -> new ArrayList<>())
                        .add(earlier.commit().name());
            }
        }
    }

    /** True when every parent of {@code commit} is already in the history of {@code into}. */
    private boolean addsNoHistory(Node commit, Node into) throws IOException {
        for (var parent : commit.commit().getParents()) {
            if (!context.target().isAncestor(parent, into.commit())) {
                return false;
            }
        }
        return true;
    }

    private RewritePlan save(RewritePlan plan) throws IOException, FatalConversionException {
        plan.save(context.store(), StateKeys.stitchPlan(context.depot().number()));
        return plan;
    }
}
