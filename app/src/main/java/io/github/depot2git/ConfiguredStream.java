package io.github.depot2git;

import io.github.depot2git.source.StreamInfo;
import org.jetbrains.annotations.Nullable;

/**
 * A stream selected for conversion.
 *
 * @param info the stream as it is now
 * @param explicitBranch the branch name fixed by configuration; null when the branch follows the stream's name
 */
public record ConfiguredStream(StreamInfo info, @Nullable String explicitBranch) {
    public int number() {
        return info.number();
    }
}
