package io.github.depot2git.retrieve;

import io.github.depot2git.ConversionException;
import io.github.depot2git.source.SourceRepository;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.Transaction;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Asks the source once for every transaction that could have touched the stream, then diffs only against those.
 * Only as good as the source's history; the diff confirms each candidate.
 */
public final class DeepHistoryChangeDetector implements ChangeDetector {
    private static final Logger logger = LogManager.getLogger(DeepHistoryChangeDetector.class);

    private final SourceRepository source;
    private final String depot;

    private @Nullable Integer cachedStream;
    private long cachedFrom;
    private long cachedEnd;
    private List<Transaction> candidates = List.of();

    public DeepHistoryChangeDetector(SourceRepository source, String depot) {
        this.source = source;
        this.depot = depot;
    }

    @Override
    public Optional<DetectedChange> next(StreamInfo stream, long lastTransaction, long searchFrom, long end)
            throws ConversionException {
        if (cachedStream == null || cachedStream != stream.number() || searchFrom < cachedFrom || end != cachedEnd) {
            candidates = source.deepHistory(depot, stream, searchFrom, end);
            cachedStream = stream.number();
            cachedFrom = searchFrom;
            cachedEnd = end;
            logger.debug("{}: {} candidate transactions in {}-{}", stream.name(), candidates.size(), searchFrom, end);
        }
        for (var candidate : candidates) {
            if (candidate.id() <= searchFrom || candidate.id() > end) {
                continue;
            }
            var diff = source.diff(depot, stream, lastTransaction, candidate.id());
            if (!diff.isEmpty()) {
                return Optional.of(new DetectedChange(candidate.id(), diff));
            }
        }
        return Optional.empty();
    }
}
