package io.github.depot2git.stitch;

import io.github.depot2git.ConversionContext;
import io.github.depot2git.FatalConversionException;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.git.CommitMessages;
import io.github.depot2git.git.Refs;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.revwalk.RevCommit;

/**
 * Applies a {@link RewritePlan} to the branches it names. Commits are rewritten once each, parents first; a commit
 * whose parents are unchanged keeps its id. Trees are reused as they are.
 */
public final class HistoryRewriter {
    private static final Logger logger = LogManager.getLogger(HistoryRewriter.class);

    private final ConversionContext context;

    public HistoryRewriter(ConversionContext context) {
        this.context = context;
    }

    /** @return the branches that moved, with their new tips */
    public Map<String, ObjectId> apply(RewritePlan plan) throws IOException, FatalConversionException {
        var result = new LinkedHashMap<String, ObjectId>();
        if (plan.isEmpty()) {
            logger.info("Nothing to rewrite");
            return result;
        }
        var target = context.target();
        var aliases = new AliasMap(plan.aliases());

        var oldTips = new LinkedHashMap<String, ObjectId>();
        for (var branch : plan.branches()) {
            var tip = target.branchTip(branch)
                    .orElseThrow(() ->
                            new InvariantViolationException("Branch " + branch + " vanished before rewrite"));
            oldTips.put(branch, tip);
        }

        var commits = new LinkedHashMap<ObjectId, RevCommit>();
        for (var commit : target.reachable(oldTips.values())) {
            commits.put(commit.copy(), commit);
        }

        var rewritten = new HashMap<ObjectId, ObjectId>();
        int created = 0;
        for (var commit : order(commits, plan, aliases)) {
            var id = commit.copy();
            var replacement = aliases.resolve(id.name());
            if (!replacement.equals(id.name())) {
                rewritten.put(id, rewritten.get(ObjectId.fromString(replacement)));
                continue;
            }
            var parents = new LinkedHashSet<ObjectId>();
            for (var parent : dependencies(commit, plan, aliases, false)) {
                parents.add(rewritten.get(parent));
            }
            var original = new ArrayList<ObjectId>();
            for (var parent : commit.getParents()) {
                original.add(parent.copy());
            }
            if (original.equals(new ArrayList<>(parents))) {
                rewritten.put(id, id);
                continue;
            }
            var newId = copy(commit, List.copyOf(parents));
            rewritten.put(id, newId);
            created++;
        }

        for (var entry : oldTips.entrySet()) {
            var newTip = rewritten.get(entry.getValue());
            if (!newTip.equals(entry.getValue())) {
                target.setBranch(entry.getKey(), entry.getValue(), newTip, true, "stitch history");
                result.put(entry.getKey(), newTip);
            }
        }
        logger.info("Rewrote {} commits, moved {} branches", created, result.size());
        return result;
    }

    /** Kahn's algorithm over original parents, extra parents and alias targets. */
    private List<RevCommit> order(Map<ObjectId, RevCommit> commits, RewritePlan plan, AliasMap aliases)
            throws InvariantViolationException {
        var pending = new HashMap<ObjectId, Integer>();
        var dependents = new HashMap<ObjectId, List<ObjectId>>();
        for (var commit : commits.values()) {
            var dependencies = dependencies(commit, plan, aliases, true);
            for (var dependency : dependencies) {
                if (!commits.containsKey(dependency)) {
                    throw new InvariantViolationException(
                            "Rewrite of " + commit.name() + " needs " + dependency.name() + ", which is not on any"
                                    + " rewritten branch");
                }
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(commit.copy());
            }
            pending.put(commit.copy(), dependencies.size());
        }
        var ready = new ArrayDeque<ObjectId>();
        for (var id : commits.keySet()) {
            if (pending.get(id) == 0) {
                ready.add(id);
            }
        }
        var ordered = new ArrayList<RevCommit>();
        while (!ready.isEmpty()) {
            var id = ready.poll();
            ordered.add(commits.get(id));
            for (var dependent : dependents.getOrDefault(id, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (ordered.size() != commits.size()) {
            throw new InvariantViolationException(
                    "Rewrite plan creates a cycle among " + (commits.size() - ordered.size()) + " commits");
        }
        return ordered;
    }

    /**
     * The commits that must be rewritten first: parents and extra parents, each resolved through the aliases, and
     * the alias target itself when {@code includeAlias} is set.
     */
    private static List<ObjectId> dependencies(
            RevCommit commit, RewritePlan plan, AliasMap aliases, boolean includeAlias)
            throws InvariantViolationException {
        var result = new LinkedHashSet<ObjectId>();
        var self = commit.name();
        var replacement = aliases.resolve(self);
        if (!replacement.equals(self)) {
            if (includeAlias) {
                result.add(ObjectId.fromString(replacement));
            }
            return List.copyOf(result);
        }
        var names = new ArrayList<String>();
        for (var parent : commit.getParents()) {
            names.add(parent.name());
        }
        names.addAll(plan.extraParents().getOrDefault(self, List.of()));
        for (var name : names) {
            var resolved = aliases.resolve(name);
            if (!resolved.equals(self)) {
                result.add(ObjectId.fromString(resolved));
            }
        }
        return List.copyOf(result);
    }

    private ObjectId copy(RevCommit commit, List<ObjectId> parents) throws IOException, FatalConversionException {
        var target = context.target();
        var builder = new CommitBuilder();
        builder.setTreeId(commit.getTree());
        builder.setParentIds(parents);
        builder.setAuthor(commit.getAuthorIdent());
        builder.setCommitter(commit.getCommitterIdent());
        builder.setEncoding(commit.getEncoding());
        builder.setMessage(commit.getFullMessage());
        ObjectId newId;
        try (var inserter = target.repository().newObjectInserter()) {
            newId = inserter.insert(builder);
            inserter.flush();
        }
        var ident = commit.getCommitterIdent();
        var annotation = target.annotations().read(commit);
        if (annotation.isPresent()) {
            target.annotations().write(newId, annotation.get(), ident);
        }
        var info = target.notes(CommitMessages.INFO_NOTES_REF);
        var infoText = info.read(commit);
        if (infoText.isPresent()) {
            info.write(newId, infoText.get(), ident);
        }
        logger.debug("{} -> {} with {} parents", Refs.abbreviate(commit), Refs.abbreviate(newId), parents.size());
        return newId;
    }
}
