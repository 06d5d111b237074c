package io.github.depot2git.git;

import io.github.depot2git.InvariantViolationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevSort;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.jetbrains.annotations.Nullable;

/**
 * The git repository being produced. Branch commits are created with plumbing from trees that already exist, so
 * nothing here touches the working directory.
 */
public final class TargetRepository implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TargetRepository.class);

    private final Repository repository;
    private final Git git;
    private final Annotations annotations;

    public TargetRepository(Repository repository) {
        this.repository = repository;
        this.git = new Git(repository);
        this.annotations = new Annotations(repository);
    }

    /** Opens the repository at {@code directory}, creating it (non-bare) if needed. */
    public static TargetRepository openOrInit(Path directory) throws IOException, GitAPIException {
        if (Files.isDirectory(directory.resolve(Constants.DOT_GIT))) {
            var repository = new FileRepositoryBuilder()
                    .setWorkTree(directory.toFile())
                    .setGitDir(directory.resolve(Constants.DOT_GIT).toFile())
                    .setMustExist(true)
                    .build();
            logger.debug("Opened existing repository at {}", directory);
            return new TargetRepository(repository);
        }
        Files.createDirectories(directory);
        var git = Git.init().setDirectory(directory.toFile()).call();
        var config = git.getRepository().getConfig();
        config.setInt("gc", null, "auto", 0);
        config.setBoolean("commit", null, "gpgsign", false);
        config.save();
        logger.info("Initialized new repository at {}", directory);
        return new TargetRepository(git.getRepository());
    }

    public Repository repository() {
        return repository;
    }

    public Git git() {
        return git;
    }

    public Annotations annotations() {
        return annotations;
    }

    public NotesNamespace notes(String ref) {
        return new NotesNamespace(repository, ref);
    }

    public Optional<ObjectId> branchTip(String branch) throws IOException, InvariantViolationException {
        return Refs.resolve(repository, Constants.R_HEADS + branch);
    }

    /**
     * Points {@code branch} at {@code target}; {@code expected} is the tip the caller last saw (null: the branch must
     * not exist yet).
     */
    public void setBranch(String branch, @Nullable ObjectId expected, ObjectId target, boolean force, String reason)
            throws IOException, InvariantViolationException {
        Refs.compareAndSet(repository, Constants.R_HEADS + branch, expected, target, force, "depot2git: " + reason);
    }

    public void deleteBranch(String branch, ObjectId expected) throws IOException, InvariantViolationException {
        Refs.delete(repository, Constants.R_HEADS + branch, expected);
    }

    public void renameBranch(String from, String to) throws IOException, InvariantViolationException {
        var rename = repository.renameRef(Constants.R_HEADS + from, Constants.R_HEADS + to);
        var result = rename.rename();
        if (result != RefUpdate.Result.RENAMED) {
            throw new InvariantViolationException("Renaming branch " + from + " to " + to + " failed: " + result);
        }
        logger.info("Renamed branch {} to {}", from, to);
    }

    public List<String> branches() throws IOException {
        var names = new ArrayList<String>();
        for (var ref : repository.getRefDatabase().getRefsByPrefix(Constants.R_HEADS)) {
            names.add(ref.getName().substring(Constants.R_HEADS.length()));
        }
        return names;
    }

    public ObjectId commit(ObjectId tree, List<? extends ObjectId> parents, PersonIdent ident, String message)
            throws IOException {
        return GitObjects.insertCommit(repository, tree, parents, ident, message);
    }

    public RevCommit parseCommit(ObjectId commit) throws IOException {
        try (var walk = new RevWalk(repository)) {
            return walk.parseCommit(commit);
        }
    }

    public ObjectId treeOf(ObjectId commit) throws IOException {
        return parseCommit(commit).getTree().copy();
    }

    /** Structural diff of two trees, recursing into subtrees. */
    public List<DiffEntry> diffTrees(ObjectId a, ObjectId b) throws IOException {
        try (var walk = new TreeWalk(repository)) {
            walk.addTree(a);
            walk.addTree(b);
            walk.setRecursive(true);
            return DiffEntry.scan(walk);
        }
    }

    public boolean sameContent(ObjectId treeA, ObjectId treeB) throws IOException {
        return treeA.equals(treeB) || diffTrees(treeA, treeB).isEmpty();
    }

    /** True when {@code ancestor} is reachable from {@code descendant}, including equality. */
    public boolean isAncestor(ObjectId ancestor, ObjectId descendant) throws IOException {
        try (var walk = new RevWalk(repository)) {
            return walk.isMergedInto(walk.parseCommit(ancestor), walk.parseCommit(descendant));
        }
    }

    /** Every commit reachable from the tips, parents before children. */
    public List<RevCommit> reachable(Collection<ObjectId> tips) throws IOException {
        var commits = new ArrayList<RevCommit>();
        try (var walk = new RevWalk(repository)) {
            for (var tip : tips) {
                walk.markStart(walk.parseCommit(tip));
            }
            walk.sort(RevSort.TOPO, true);
            walk.sort(RevSort.REVERSE, true);
            for (var commit : walk) {
                commits.add(commit);
            }
        }
        return commits;
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }
}
