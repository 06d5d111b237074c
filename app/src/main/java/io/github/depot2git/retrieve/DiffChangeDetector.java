package io.github.depot2git.retrieve;

import io.github.depot2git.ConversionException;
import io.github.depot2git.source.SourceRepository;
import io.github.depot2git.source.StreamInfo;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Diffs the last entry against each following transaction in turn until something differs. */
public final class DiffChangeDetector implements ChangeDetector {
    private static final Logger logger = LogManager.getLogger(DiffChangeDetector.class);

    private final SourceRepository source;
    private final String depot;

    public DiffChangeDetector(SourceRepository source, String depot) {
        this.source = source;
        this.depot = depot;
    }

    @Override
    public Optional<DetectedChange> next(StreamInfo stream, long lastTransaction, long searchFrom, long end)
            throws ConversionException {
        for (long candidate = searchFrom + 1; candidate <= end; candidate++) {
            var diff = source.diff(depot, stream, lastTransaction, candidate);
            if (!diff.isEmpty()) {
                return Optional.of(new DetectedChange(candidate, diff));
            }
            logger.trace("{}: no change between {} and {}", stream.name(), lastTransaction, candidate);
        }
        return Optional.empty();
    }
}
