package io.github.depot2git.process;

import io.github.depot2git.ConfiguredStream;
import io.github.depot2git.ConversionContext;
import io.github.depot2git.FatalConversionException;
import io.github.depot2git.git.Annotation;
import io.github.depot2git.retrieve.StreamRetriever;
import java.io.IOException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Converts each stream on its own: its branch is a linear replay of the stream's content history with no links to
 * other branches. Useful when the promotion structure is not wanted or not trustworthy.
 */
public final class OrphanageProcessor {
    private static final Logger logger = LogManager.getLogger(OrphanageProcessor.class);

    private final ConversionContext context;
    private final List<ConfiguredStream> streams;
    private final BranchWriter writer;

    public OrphanageProcessor(ConversionContext context, List<ConfiguredStream> streams) {
        this.context = context;
        this.streams = List.copyOf(streams);
        this.writer = new BranchWriter(context, new BranchNames(streams));
    }

    public void process() throws IOException, FatalConversionException {
        var numbers = streams.stream().map(ConfiguredStream::number).toList();
        var history = DepotHistory.load(context, numbers);
        for (var stream : streams) {
            var end = StreamRetriever.highWaterMark(context.store(), context.depot().number(), stream.number());
            if (end.isEmpty()) {
                logger.warn("{} has not been retrieved, skipping", stream.info().name());
                continue;
            }
            boolean recovered = false;
            int written = 0;
            for (var entry : history.entries(stream.number())) {
                if (entry.transaction() > end.get()) {
                    break;
                }
                var info = entry.info();
                var previous = history.previous(stream.number(), entry.transaction());
                if (previous.isPresent()) {
                    writer.followRename(info, previous.get().info().name());
                }
                if (!recovered) {
                    writer.recover(writer.state(info).name());
                    recovered = true;
                }
                var branch = writer.state(info);
                if (branch.hasProcessed(entry.transaction())) {
                    continue;
                }
                var transaction = entry.metadata().transaction();
                var message = context.messages().compose(transaction, info, null, null, null);
                var commit = writer.build(
                        entry.contentTree(),
                        branch.tip() == null ? List.of() : List.of(branch.tip()),
                        transaction,
                        message.text());
                var annotation = Annotation.of(context.depot().name(), info, transaction);
                writer.publish(branch, commit, annotation, message, transaction, false);
                written++;
            }
            logger.info("{}: {} commits written", stream.info().name(), written);
        }
    }
}
