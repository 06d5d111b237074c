package io.github.depot2git.retrieve;

import io.github.depot2git.ConversionException;
import io.github.depot2git.config.RetrievalMethod;
import io.github.depot2git.source.SourceRepository;
import io.github.depot2git.source.StreamInfo;
import java.util.Optional;

/** Finds the next transaction that changed a stream's content. */
public interface ChangeDetector {
    /**
     * @param lastTransaction the transaction of the stream's latest metadata entry
     * @param searchFrom candidates at or below this are already known not to matter
     * @param end last transaction to consider
     */
    Optional<DetectedChange> next(StreamInfo stream, long lastTransaction, long searchFrom, long end)
            throws ConversionException;

    /** Whether content entries are materialized from scratch instead of from the previous entry plus a diff. */
    default boolean repopulates() {
        return false;
    }

    static ChangeDetector forMethod(RetrievalMethod method, SourceRepository source, String depot) {
        return switch (method) {
            case POP -> new PopChangeDetector();
            case DIFF -> new DiffChangeDetector(source, depot);
            case DEEP_HIST -> new DeepHistoryChangeDetector(source, depot);
            case SKIP -> throw new IllegalArgumentException("Retrieval is disabled");
        };
    }
}
