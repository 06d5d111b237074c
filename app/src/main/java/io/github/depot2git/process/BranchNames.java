package io.github.depot2git.process;

import io.github.depot2git.ConfiguredStream;
import io.github.depot2git.UnrecognizedInputException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.Repository;

/** Which streams get a branch, and what it is called. */
public final class BranchNames {
    private final Map<Integer, ConfiguredStream> streams;

    public BranchNames(List<ConfiguredStream> streams) {
        this.streams = streams.stream().collect(Collectors.toMap(ConfiguredStream::number, Function.identity()));
    }

    public boolean isConfigured(int stream) {
        return streams.containsKey(stream);
    }

    public Optional<ConfiguredStream> configured(int stream) {
        return Optional.ofNullable(streams.get(stream));
    }

    /** True when the branch follows the stream's name and so must be renamed with it. */
    public boolean followsStreamName(int stream) {
        var configured = streams.get(stream);
        return configured != null && configured.explicitBranch() == null;
    }

    /** The branch for a stream that is called {@code streamName} at the time of interest. */
    public String branchFor(int stream, String streamName) throws UnrecognizedInputException {
        var configured = streams.get(stream);
        if (configured != null && configured.explicitBranch() != null) {
            return configured.explicitBranch();
        }
        return sanitize(streamName);
    }

    public static String sanitize(String streamName) throws UnrecognizedInputException {
        var name = streamName.strip().replace(' ', '_');
        if (name.isEmpty() || !Repository.isValidRefName(Constants.R_HEADS + name)) {
            throw new UnrecognizedInputException("Cannot derive a branch name from stream name '" + streamName + "'");
        }
        return name;
    }
}
