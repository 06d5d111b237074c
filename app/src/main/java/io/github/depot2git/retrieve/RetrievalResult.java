package io.github.depot2git.retrieve;

import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;

/** @param contentCommit tip of the content history, null when nothing has been retrieved for the stream */
public record RetrievalResult(long lastTransaction, @Nullable ObjectId contentCommit) {}
