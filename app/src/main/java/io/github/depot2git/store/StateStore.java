package io.github.depot2git.store;

import io.github.depot2git.InvariantViolationException;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.eclipse.jgit.lib.ObjectId;

/**
 * Durable key-value and append-log storage for the converter's own state.
 *
 * <p>Single values ({@link #put}/{@link #get}) and append-only sequences ({@link #append}/{@link #entries}) share
 * the key space but a key is only ever used one way. Every write is atomic: either the key moves to the new value
 * or an {@link InvariantViolationException} is thrown and the key is untouched.
 */
public interface StateStore {
    ObjectId put(StateKey key, byte[] value) throws IOException, InvariantViolationException;

    Optional<byte[]> get(StateKey key) throws IOException, InvariantViolationException;

    /**
     * Appends an entry whose content is {@code tree}. Transaction ids within a sequence must strictly increase.
     *
     * @return the commit recording the entry
     */
    ObjectId append(StateKey key, ObjectId tree, EntryInfo info) throws IOException, InvariantViolationException;

    Optional<ObjectId> tip(StateKey key) throws IOException, InvariantViolationException;

    Optional<SequenceEntry> tipEntry(StateKey key) throws IOException, InvariantViolationException;

    /** All entries of a sequence, oldest first. */
    List<SequenceEntry> entries(StateKey key) throws IOException, InvariantViolationException;

    boolean delete(StateKey key) throws IOException, InvariantViolationException;

    /** Keys whose name starts with {@code prefix}. */
    List<StateKey> keys(String prefix) throws IOException;
}
