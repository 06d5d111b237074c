package io.github.depot2git.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.depot2git.InvariantViolationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/** Single numeric values kept as small JSON objects, e.g. {@code {"high-water-mark": 42}}. */
public final class JsonValues {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonValues() {}

    public static Optional<Long> readLong(StateStore store, StateKey key, String field)
            throws IOException, InvariantViolationException {
        var value = store.get(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        var node = objectMapper.readTree(value.get());
        if (node == null || !node.has(field) || !node.get(field).canConvertToLong()) {
            throw new InvariantViolationException("State value " + key + " has no numeric " + field);
        }
        return Optional.of(node.get(field).asLong());
    }

    public static void writeLong(StateStore store, StateKey key, String field, long value)
            throws IOException, InvariantViolationException {
        var json = objectMapper.createObjectNode().put(field, value);
        store.put(key, objectMapper.writeValueAsString(json).getBytes(StandardCharsets.UTF_8));
    }
}
