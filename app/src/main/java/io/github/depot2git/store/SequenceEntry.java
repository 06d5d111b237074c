package io.github.depot2git.store;

import org.eclipse.jgit.lib.ObjectId;

public record SequenceEntry(ObjectId commit, ObjectId tree, long transaction) {}
