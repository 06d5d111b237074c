package io.github.depot2git.store;

import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.git.GitObjects;
import io.github.depot2git.git.Refs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;

/**
 * {@link StateStore} kept inside a git repository as refs under {@link StateKey#NAMESPACE}.
 *
 * <p>A sequence is the first-parent chain of its ref, one commit per entry with the message
 * {@code transaction <id>}. A single value is a commit whose tree holds one {@value #VALUE_FILE} file; each put
 * parents the previous value so earlier values stay reachable.
 */
public final class GitStateStore implements StateStore {
    private static final Logger logger = LogManager.getLogger(GitStateStore.class);

    static final String VALUE_FILE = "value";
    private static final Pattern ENTRY_MESSAGE = Pattern.compile("^transaction (\\d+)\\s*$");

    private final Repository repository;

    public GitStateStore(Repository repository) {
        this.repository = repository;
    }

    public Repository repository() {
        return repository;
    }

    @Override
    public ObjectId put(StateKey key, byte[] value) throws IOException, InvariantViolationException {
        var previous = tip(key);
        var tree = GitObjects.insertFlatTree(repository, Map.of(VALUE_FILE, value));
        var commit = GitObjects.insertCommit(
                repository,
                tree,
                previous.map(List::of).orElse(List.of()),
                new PersonIdent("depot2git", "depot2git@localhost"),
                "update " + key.name());
        Refs.compareAndSet(repository, key.ref(), previous.orElse(null), commit, false, "depot2git: put");
        return commit;
    }

    @Override
    public Optional<byte[]> get(StateKey key) throws IOException, InvariantViolationException {
        var commit = tip(key);
        if (commit.isEmpty()) {
            return Optional.empty();
        }
        try (var walk = new RevWalk(repository)) {
            var tree = walk.parseCommit(commit.get()).getTree();
            var value = GitObjects.readFile(repository, tree, VALUE_FILE);
            if (value.isEmpty()) {
                throw new InvariantViolationException("State value " + key + " has no " + VALUE_FILE + " file");
            }
            return value;
        }
    }

    @Override
    public ObjectId append(StateKey key, ObjectId tree, EntryInfo info)
            throws IOException, InvariantViolationException {
        var previous = tipEntry(key);
        if (previous.isPresent() && previous.get().transaction() >= info.transaction()) {
            throw new InvariantViolationException("Cannot append transaction " + info.transaction() + " to " + key
                    + " after transaction " + previous.get().transaction());
        }
        var parents = previous.map(e -> List.of(e.commit())).orElse(List.of());
        var commit =
                GitObjects.insertCommit(repository, tree, parents, info.ident(), "transaction " + info.transaction());
        Refs.compareAndSet(
                repository,
                key.ref(),
                previous.map(SequenceEntry::commit).orElse(null),
                commit,
                false,
                "depot2git: append transaction " + info.transaction());
        logger.debug("Appended transaction {} to {} as {}", info.transaction(), key, Refs.abbreviate(commit));
        return commit;
    }

    @Override
    public Optional<ObjectId> tip(StateKey key) throws IOException, InvariantViolationException {
        return Refs.resolve(repository, key.ref());
    }

    @Override
    public Optional<SequenceEntry> tipEntry(StateKey key) throws IOException, InvariantViolationException {
        var tip = tip(key);
        if (tip.isEmpty()) {
            return Optional.empty();
        }
        try (var walk = new RevWalk(repository)) {
            return Optional.of(entry(key, walk.parseCommit(tip.get())));
        }
    }

    @Override
    public List<SequenceEntry> entries(StateKey key) throws IOException, InvariantViolationException {
        var tip = tip(key);
        if (tip.isEmpty()) {
            return List.of();
        }
        var entries = new ArrayList<SequenceEntry>();
        try (var walk = new RevWalk(repository)) {
            var commit = walk.parseCommit(tip.get());
            while (true) {
                entries.add(entry(key, commit));
                if (commit.getParentCount() == 0) {
                    break;
                }
                commit = walk.parseCommit(commit.getParent(0));
            }
        }
        Collections.reverse(entries);
        return entries;
    }

    @Override
    public boolean delete(StateKey key) throws IOException, InvariantViolationException {
        var tip = tip(key);
        if (tip.isEmpty()) {
            return false;
        }
        Refs.delete(repository, key.ref(), tip.get());
        logger.info("Deleted state {}", key);
        return true;
    }

    @Override
    public List<StateKey> keys(String prefix) throws IOException {
        var keys = new ArrayList<StateKey>();
        for (var ref : repository.getRefDatabase().getRefsByPrefix(StateKey.NAMESPACE + prefix)) {
            keys.add(new StateKey(ref.getName().substring(StateKey.NAMESPACE.length())));
        }
        return keys;
    }

    private static SequenceEntry entry(StateKey key, RevCommit commit) throws InvariantViolationException {
        var matcher = ENTRY_MESSAGE.matcher(commit.getFullMessage());
        if (!matcher.find()) {
            throw new InvariantViolationException(
                    "Entry " + commit.name() + " of " + key + " does not name a transaction");
        }
        return new SequenceEntry(commit.copy(), commit.getTree().copy(), Long.parseLong(matcher.group(1)));
    }
}
