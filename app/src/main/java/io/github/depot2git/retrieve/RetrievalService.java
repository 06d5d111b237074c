package io.github.depot2git.retrieve;

import io.github.depot2git.ConfiguredStream;
import io.github.depot2git.ConversionContext;
import io.github.depot2git.ConversionException;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Retrieves every configured stream up to one end transaction, resolved once for the whole run. */
public final class RetrievalService {
    private static final Logger logger = LogManager.getLogger(RetrievalService.class);

    private final ConversionContext context;
    private final StreamRetriever retriever;

    public RetrievalService(ConversionContext context) {
        this(context, new StreamRetriever(context));
    }

    public RetrievalService(ConversionContext context, StreamRetriever retriever) {
        this.context = context;
        this.retriever = retriever;
    }

    public Map<Integer, RetrievalResult> retrieveAll(List<ConfiguredStream> streams)
            throws ConversionException, IOException {
        var config = context.config();
        var end = context.source().resolveTransaction(context.depot().name(), config.endTransaction());
        logger.info("Retrieving {} streams of {} up to transaction {}", streams.size(), context.depot().name(), end);

        var results = new LinkedHashMap<Integer, RetrievalResult>();
        for (var stream : streams) {
            results.put(stream.number(), retriever.retrieve(stream.info(), config.startTransaction(), end));
        }
        return results;
    }
}
