package io.github.depot2git.git;

import io.github.depot2git.InvariantViolationException;
import java.io.IOException;
import java.util.Optional;
import org.eclipse.jgit.lib.AnyObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;

/** The notes ref holding every branch commit's {@link Annotation}. */
public final class Annotations {
    public static final String NOTES_REF = "refs/notes/depot2git";

    private final NotesNamespace notes;

    public Annotations(Repository repository) {
        this.notes = new NotesNamespace(repository, NOTES_REF);
    }

    public void write(AnyObjectId commit, Annotation annotation, PersonIdent ident)
            throws IOException, InvariantViolationException {
        notes.write(commit, annotation.toJson(), ident);
    }

    /** Empty when the commit has no note or the note is not a readable annotation. */
    public Optional<Annotation> read(AnyObjectId commit) throws IOException, InvariantViolationException {
        var text = notes.read(commit);
        return text.isEmpty() ? Optional.empty() : Annotation.parse(text.get());
    }

    public Annotation require(AnyObjectId commit) throws IOException, InvariantViolationException {
        var annotation = read(commit);
        if (annotation.isEmpty()) {
            throw new InvariantViolationException("Commit " + commit.name() + " has no readable annotation");
        }
        return annotation.get();
    }
}
