package io.github.depot2git.git;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.TreeFormatter;
import org.eclipse.jgit.treewalk.TreeWalk;

/** Object-level helpers that work on any JGit repository, including in-memory ones. */
public final class GitObjects {
    private GitObjects() {}

    /** A tree holding the given files at its top level. */
    public static ObjectId insertFlatTree(Repository repository, Map<String, byte[]> files) throws IOException {
        SortedMap<String, byte[]> sorted = new TreeMap<>(files);
        try (var inserter = repository.newObjectInserter()) {
            var tree = new TreeFormatter();
            for (var file : sorted.entrySet()) {
                var blob = inserter.insert(Constants.OBJ_BLOB, file.getValue());
                tree.append(file.getKey(), FileMode.REGULAR_FILE, blob);
            }
            var id = inserter.insert(tree);
            inserter.flush();
            return id;
        }
    }

    public static ObjectId emptyTree(Repository repository) throws IOException {
        try (var inserter = repository.newObjectInserter()) {
            var id = inserter.insert(new TreeFormatter());
            inserter.flush();
            return id;
        }
    }

    public static ObjectId insertCommit(
            Repository repository, ObjectId tree, List<? extends ObjectId> parents, PersonIdent ident, String message)
            throws IOException {
        try (ObjectInserter inserter = repository.newObjectInserter()) {
            var builder = new CommitBuilder();
            builder.setTreeId(tree);
            builder.setParentIds(parents.toArray(new ObjectId[0]));
            builder.setAuthor(ident);
            builder.setCommitter(ident);
            builder.setMessage(message);
            var id = inserter.insert(builder);
            inserter.flush();
            return id;
        }
    }

    /** Reads a file from a tree; empty when the path is absent. */
    public static Optional<byte[]> readFile(Repository repository, ObjectId tree, String path) throws IOException {
        try (var walk = TreeWalk.forPath(repository, path, tree)) {
            if (walk == null) {
                return Optional.empty();
            }
            return Optional.of(repository.open(walk.getObjectId(0), Constants.OBJ_BLOB).getBytes());
        }
    }
}
