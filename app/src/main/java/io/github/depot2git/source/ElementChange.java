package io.github.depot2git.source;

import org.jetbrains.annotations.Nullable;

/**
 * One element that differs between two transactions of a stream. A move has both paths; additions lack
 * {@code fromPath}, removals lack {@code toPath}. Paths are relative to the stream root and use {@code /}.
 */
public record ElementChange(@Nullable String fromPath, @Nullable String toPath) {}
