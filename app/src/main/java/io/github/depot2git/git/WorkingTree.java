package io.github.depot2git.git;

import io.github.depot2git.FatalConversionException;
import io.github.depot2git.InvariantViolationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.dircache.DirCacheEntry;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;

/**
 * The single working directory of the target repository, where retrieved content is materialized before it is
 * snapshotted into a tree. Access goes through an exclusive {@link Lease}.
 */
public final class WorkingTree {
    private static final Logger logger = LogManager.getLogger(WorkingTree.class);

    /** Placeholder that keeps otherwise empty directories in git. */
    public static final String EMPTY_DIR_MARKER = ".gitignore";

    private final TargetRepository target;
    private final Path root;
    private final ReentrantLock lock = new ReentrantLock();

    public WorkingTree(TargetRepository target) {
        this.target = target;
        this.root = target.repository().getWorkTree().toPath().toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * Takes exclusive use of the working directory. The lease must be closed by the holder; closing verifies that
     * everything in the directory is committed.
     */
    public Lease acquire() throws InvariantViolationException {
        if (!lock.tryLock()) {
            throw new InvariantViolationException("Working tree " + root + " is already in use");
        }
        return new Lease();
    }

    public final class Lease implements AutoCloseable {
        private boolean closed;

        private Lease() {}

        /**
         * Discards anything uncommitted and checks out {@code commit} detached; with no commit the directory and the
         * index are emptied.
         */
        public void resetTo(@Nullable ObjectId commit) throws IOException, FatalConversionException {
            checkOpen();
            try {
                if (commit == null) {
                    clear();
                    var index = target.repository().lockDirCache();
                    index.builder().commit();
                } else {
                    var head = target.repository().updateRef(Constants.HEAD, true);
                    head.setNewObjectId(commit);
                    head.forceUpdate();
                    target.git().reset().setMode(ResetCommand.ResetType.HARD).setRef(commit.name()).call();
                    target.git().clean().setCleanDirectories(true).setIgnore(false).setForce(true).call();
                }
            } catch (GitAPIException e) {
                throw new FatalConversionException("Could not reset working tree to " + Refs.abbreviate(commit), e);
            }
        }

        /** Removes everything except the git directory. */
        public void clear() throws IOException {
            checkOpen();
            try (Stream<Path> children = Files.list(root)) {
                for (var child : children.toList()) {
                    if (!child.getFileName().toString().equals(Constants.DOT_GIT)) {
                        deleteRecursively(child);
                    }
                }
            }
        }

        /** Deletes the given paths (files or directories, relative to the root) where they exist. */
        public void deletePaths(Collection<String> paths) throws IOException {
            checkOpen();
            for (var path : paths) {
                var resolved = resolveInside(path);
                if (Files.exists(resolved, LinkOption.NOFOLLOW_LINKS)) {
                    deleteRecursively(resolved);
                }
            }
        }

        /** Removes directories that contain nothing, innermost first. */
        public void deleteEmptyDirectories() throws IOException {
            checkOpen();
            for (var dir : directoriesDeepestFirst()) {
                try (Stream<Path> entries = Files.list(dir)) {
                    if (entries.findAny().isEmpty()) {
                        Files.delete(dir);
                    }
                }
            }
        }

        /** Drops an empty {@value #EMPTY_DIR_MARKER} into every empty directory so git keeps it. */
        public void preserveEmptyDirectories() throws IOException {
            checkOpen();
            for (var dir : directoriesDeepestFirst()) {
                try (Stream<Path> entries = Files.list(dir)) {
                    if (entries.findAny().isEmpty()) {
                        Files.createFile(dir.resolve(EMPTY_DIR_MARKER));
                    }
                }
            }
        }

        /**
         * Stages the complete directory contents, ignore rules notwithstanding, and returns the tree. The index
         * afterwards matches the directory exactly.
         */
        public ObjectId snapshot() throws IOException {
            checkOpen();
            var repository = target.repository();
            var files = regularFiles();
            var index = repository.lockDirCache();
            try (var inserter = repository.newObjectInserter()) {
                var builder = index.builder();
                for (var file : files) {
                    var relative = root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
                    var entry = new DirCacheEntry(relative);
                    if (Files.isSymbolicLink(file)) {
                        var linkTarget = Files.readSymbolicLink(file).toString().getBytes(StandardCharsets.UTF_8);
                        entry.setFileMode(FileMode.SYMLINK);
                        entry.setObjectId(inserter.insert(Constants.OBJ_BLOB, linkTarget));
                        entry.setLength(linkTarget.length);
                    } else {
                        var bytes = Files.readAllBytes(file);
                        entry.setFileMode(Files.isExecutable(file) && !isWindows()
                                ? FileMode.EXECUTABLE_FILE
                                : FileMode.REGULAR_FILE);
                        entry.setObjectId(inserter.insert(Constants.OBJ_BLOB, bytes));
                        entry.setLength(bytes.length);
                        entry.setLastModified(Files.getLastModifiedTime(file).toInstant());
                    }
                    builder.add(entry);
                }
                builder.finish();
                var tree = index.writeTree(inserter);
                inserter.flush();
                index.write();
                index.commit();
                return tree;
            } finally {
                index.unlock();
            }
        }

        /** Moves the detached HEAD to a commit whose tree is what {@link #snapshot()} just staged. */
        public void advanceHead(ObjectId commit) throws IOException {
            checkOpen();
            var head = target.repository().updateRef(Constants.HEAD, true);
            head.setNewObjectId(commit);
            head.forceUpdate();
        }

        /** Fails unless the directory, the index and HEAD agree. */
        public void verifyClean() throws FatalConversionException {
            checkOpen();
            try {
                var status = target.git().status().call();
                if (!status.isClean()) {
                    var dirty = new ArrayList<String>();
                    dirty.addAll(status.getUncommittedChanges());
                    dirty.addAll(status.getUntracked());
                    throw new InvariantViolationException("Working tree " + root + " has uncommitted changes: "
                            + dirty.subList(0, Math.min(10, dirty.size())));
                }
            } catch (GitAPIException e) {
                throw new FatalConversionException("Could not read working tree status", e);
            }
        }

        @Override
        public void close() throws FatalConversionException {
            if (closed) {
                return;
            }
            try {
                verifyClean();
            } finally {
                closed = true;
                lock.unlock();
            }
        }

        private void checkOpen() {
            if (closed) {
                throw new IllegalStateException("Working tree lease already released");
            }
        }
    }

    private Path resolveInside(String relative) throws IOException {
        var resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IOException("Path escapes the working tree: " + relative);
        }
        return resolved;
    }

    private List<Path> directoriesDeepestFirst() throws IOException {
        var gitDir = root.resolve(Constants.DOT_GIT);
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(p -> !p.equals(root))
                    .filter(p -> !p.startsWith(gitDir))
                    .filter(p -> Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))
                    .sorted(Comparator.comparingInt(Path::getNameCount).reversed())
                    .toList();
        }
    }

    private List<Path> regularFiles() throws IOException {
        var gitDir = root.resolve(Constants.DOT_GIT);
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(p -> !p.startsWith(gitDir))
                    .filter(p -> Files.isSymbolicLink(p) || Files.isRegularFile(p))
                    .sorted()
                    .toList();
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            try (Stream<Path> walk = Files.walk(path)) {
                for (var p : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(p);
                }
            }
        } else {
            Files.delete(path);
        }
        logger.trace("Deleted {}", path);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
