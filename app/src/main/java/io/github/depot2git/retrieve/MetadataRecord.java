package io.github.depot2git.retrieve;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.git.GitObjects;
import io.github.depot2git.source.StreamDiff;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.Transaction;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.jetbrains.annotations.Nullable;

/**
 * One metadata history entry: what the source said about a transaction that changed the stream.
 *
 * @param streams the depot's streams as of the transaction
 * @param diff changes against the previous entry; absent for the first entry and when retrieving by full populate
 * @param createdStream for {@code mkstream}, the number of the stream it created
 */
public record MetadataRecord(
        Transaction transaction,
        List<StreamInfo> streams,
        @Nullable StreamDiff diff,
        @Nullable Integer createdStream) {

    public static final String FILE = "metadata.json";

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    public MetadataRecord {
        streams = List.copyOf(streams);
    }

    public Optional<StreamInfo> stream(int number) {
        return streams.stream().filter(s -> s.number() == number).findFirst();
    }

    public ObjectId writeTree(Repository repository) throws IOException {
        return GitObjects.insertFlatTree(repository, Map.of(FILE, objectMapper.writeValueAsBytes(this)));
    }

    public static MetadataRecord read(Repository repository, ObjectId tree)
            throws IOException, InvariantViolationException {
        var bytes = GitObjects.readFile(repository, tree, FILE);
        if (bytes.isEmpty()) {
            throw new InvariantViolationException("Metadata entry tree " + tree.name() + " has no " + FILE);
        }
        try {
            return objectMapper.readValue(bytes.get(), MetadataRecord.class);
        } catch (IOException e) {
            throw new InvariantViolationException("Metadata entry tree " + tree.name() + " is unreadable", e);
        }
    }
}
