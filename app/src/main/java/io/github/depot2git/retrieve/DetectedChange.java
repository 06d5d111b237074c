package io.github.depot2git.retrieve;

import io.github.depot2git.source.StreamDiff;
import org.jetbrains.annotations.Nullable;

/** @param diff what changed since the previous entry; null when the policy re-populates everything */
public record DetectedChange(long transaction, @Nullable StreamDiff diff) {}
