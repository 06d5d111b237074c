package io.github.depot2git.retrieve;

import io.github.depot2git.source.StreamInfo;
import java.util.Optional;

/** Treats every transaction as a change. Slow but needs nothing from the source beyond populate. */
public final class PopChangeDetector implements ChangeDetector {
    @Override
    public Optional<DetectedChange> next(StreamInfo stream, long lastTransaction, long searchFrom, long end) {
        var candidate = searchFrom + 1;
        return candidate <= end ? Optional.of(new DetectedChange(candidate, null)) : Optional.empty();
    }

    @Override
    public boolean repopulates() {
        return true;
    }
}
