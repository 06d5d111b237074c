package io.github.depot2git.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record StreamDiff(long fromTransaction, long toTransaction, List<ElementChange> changes) {
    public StreamDiff {
        changes = List.copyOf(changes);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /** Every path on either side of a change, in order of first appearance. */
    public Set<String> paths() {
        var paths = new LinkedHashSet<String>();
        for (var change : changes) {
            if (change.fromPath() != null) {
                paths.add(change.fromPath());
            }
            if (change.toPath() != null) {
                paths.add(change.toPath());
            }
        }
        return paths;
    }
}
