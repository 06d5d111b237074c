package io.github.depot2git.git;

import io.github.depot2git.InvariantViolationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.eclipse.jgit.lib.AnyObjectId;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.notes.NoteMap;
import org.eclipse.jgit.revwalk.RevWalk;
import org.jetbrains.annotations.Nullable;

/** One git notes ref. Each write is a commit on the notes ref, published with a compare-and-set update. */
public final class NotesNamespace {
    private final Repository repository;
    private final String ref;

    public NotesNamespace(Repository repository, String ref) {
        this.repository = repository;
        this.ref = ref;
    }

    public String ref() {
        return ref;
    }

    public Optional<String> read(AnyObjectId object) throws IOException, InvariantViolationException {
        var tip = Refs.resolve(repository, ref);
        if (tip.isEmpty()) {
            return Optional.empty();
        }
        try (var reader = repository.newObjectReader();
                var walk = new RevWalk(reader)) {
            var notes = NoteMap.read(reader, walk.parseCommit(tip.get()));
            var blob = notes.get(object);
            if (blob == null) {
                return Optional.empty();
            }
            return Optional.of(new String(reader.open(blob).getBytes(), StandardCharsets.UTF_8));
        }
    }

    public void write(AnyObjectId object, String text, PersonIdent ident)
            throws IOException, InvariantViolationException {
        update(object, text, ident, "Notes added by depot2git");
    }

    public void remove(AnyObjectId object, PersonIdent ident) throws IOException, InvariantViolationException {
        update(object, null, ident, "Notes removed by depot2git");
    }

    private void update(AnyObjectId object, @Nullable String text, PersonIdent ident, String message)
            throws IOException, InvariantViolationException {
        var tip = Refs.resolve(repository, ref);
        ObjectId commit;
        try (var reader = repository.newObjectReader();
                var walk = new RevWalk(reader);
                var inserter = repository.newObjectInserter()) {
            var notes = tip.isPresent() ? NoteMap.read(reader, walk.parseCommit(tip.get())) : NoteMap.newEmptyMap();
            notes.set(object, text, inserter);
            var builder = new CommitBuilder();
            builder.setTreeId(notes.writeTree(inserter));
            builder.setParentIds(tip.map(List::of).orElse(List.of()));
            builder.setAuthor(ident);
            builder.setCommitter(ident);
            builder.setMessage(message + "\n");
            commit = inserter.insert(builder);
            inserter.flush();
        }
        Refs.compareAndSet(repository, ref, tip.orElse(null), commit, false, "depot2git: notes");
    }
}
