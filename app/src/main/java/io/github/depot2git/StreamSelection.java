package io.github.depot2git;

import io.github.depot2git.source.StreamInfo;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Resolves the configured stream names against the depot. */
public final class StreamSelection {
    private static final Logger logger = LogManager.getLogger(StreamSelection.class);

    private StreamSelection() {}

    /** Every configured stream, or every stream of the depot when none is configured, ordered by number. */
    public static List<ConfiguredStream> resolve(ConversionContext context) throws ConversionException {
        var current = context.source().streams(context.depot().name(), null);
        var mappings = context.config().streams();
        var selected = new ArrayList<ConfiguredStream>();
        if (mappings.isEmpty()) {
            for (var stream : current) {
                selected.add(new ConfiguredStream(stream, null));
            }
            logger.info(
                    "No streams configured, converting all {} streams of {}", selected.size(), context.depot().name());
        } else {
            for (var mapping : mappings) {
                var stream = current.stream()
                        .filter(s -> s.name().equals(mapping.streamName()))
                        .findFirst()
                        .orElseThrow(() -> new UnrecognizedInputException(
                                "Stream " + mapping.streamName() + " does not exist in depot "
                                        + context.depot().name()));
                selected.add(new ConfiguredStream(stream, mapping.branchName()));
            }
        }
        selected.sort(Comparator.comparingInt(ConfiguredStream::number));
        return selected;
    }

    public static List<StreamInfo> infos(List<ConfiguredStream> streams) {
        return streams.stream().map(ConfiguredStream::info).toList();
    }
}
