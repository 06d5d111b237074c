package io.github.depot2git.config;

import org.jetbrains.annotations.Nullable;

/** A stream to convert; without an explicit branch name the branch follows the stream's name. */
public record StreamMapping(String streamName, @Nullable String branchName) {}
