package io.github.depot2git.git;

import io.github.depot2git.InvariantViolationException;
import java.io.IOException;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.jetbrains.annotations.Nullable;

/**
 * Ref reads and compare-and-set writes. Every write is re-read afterwards; a ref that does not end up where the
 * update claimed is treated as corrupt state.
 */
public final class Refs {
    private static final Logger logger = LogManager.getLogger(Refs.class);

    private Refs() {}

    /** The object a ref points at, empty when the ref does not exist. */
    public static Optional<ObjectId> resolve(Repository repository, String refName)
            throws IOException, InvariantViolationException {
        var ref = repository.exactRef(refName);
        if (ref == null) {
            return Optional.empty();
        }
        var id = ref.getObjectId();
        if (id == null) {
            throw new InvariantViolationException("Ref " + refName + " exists but does not point at an object");
        }
        return Optional.of(id);
    }

    /**
     * Moves {@code refName} from {@code expected} (null: must not exist) to {@code newId}. Non-fast-forward moves
     * need {@code force}.
     */
    public static void compareAndSet(
            Repository repository,
            String refName,
            @Nullable ObjectId expected,
            ObjectId newId,
            boolean force,
            String reason)
            throws IOException, InvariantViolationException {
        var update = repository.updateRef(refName);
        update.setExpectedOldObjectId(expected == null ? ObjectId.zeroId() : expected);
        update.setNewObjectId(newId);
        update.setForceUpdate(force);
        update.setRefLogMessage(reason, false);
        var result = update.update();
        switch (result) {
            case NEW, FAST_FORWARD, FORCED ->
                logger.debug("{}: {} -> {}", refName, abbreviate(expected), abbreviate(newId));
            case NO_CHANGE -> {
                if (!newId.equals(expected)) {
                    throw new InvariantViolationException("Update of " + refName + " reported no change");
                }
            }
            default -> throw new InvariantViolationException(
                    "Update of " + refName + " to " + newId.name() + " failed: " + result);
        }
        verify(repository, refName, newId);
    }

    public static void delete(Repository repository, String refName, @Nullable ObjectId expected)
            throws IOException, InvariantViolationException {
        var update = repository.updateRef(refName);
        if (expected != null) {
            update.setExpectedOldObjectId(expected);
        }
        update.setForceUpdate(true);
        var result = update.delete();
        if (result != RefUpdate.Result.FORCED && result != RefUpdate.Result.NO_CHANGE) {
            throw new InvariantViolationException("Deleting " + refName + " failed: " + result);
        }
        if (repository.exactRef(refName) != null) {
            throw new InvariantViolationException("Ref " + refName + " still exists after delete");
        }
    }

    private static void verify(Repository repository, String refName, ObjectId expected)
            throws IOException, InvariantViolationException {
        var ref = repository.exactRef(refName);
        if (ref == null || !expected.equals(ref.getObjectId())) {
            var found = ref == null ? "nothing" : String.valueOf(ref.getObjectId());
            throw new InvariantViolationException(
                    "Ref " + refName + " is not at " + expected.name() + " after a successful update; found " + found);
        }
    }

    public static String abbreviate(@Nullable ObjectId id) {
        return id == null ? "(none)" : id.abbreviate(8).name();
    }
}
