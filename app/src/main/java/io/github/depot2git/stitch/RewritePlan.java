package io.github.depot2git.stitch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.store.StateKey;
import io.github.depot2git.store.StateStore;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A history rewrite: the branches to rewrite, commits to drop in favour of another commit, and parents to add.
 * Commit ids are hex strings so the plan can be reviewed and stored as JSON.
 */
public record RewritePlan(
        @JsonProperty("branches") List<String> branches,
        @JsonProperty("aliases") Map<String, String> aliases,
        @JsonProperty("extra_parents") Map<String, List<String>> extraParents) {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public RewritePlan {
        branches = List.copyOf(branches);
        aliases = Map.copyOf(aliases);
        extraParents = Map.copyOf(extraParents);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return aliases.isEmpty() && extraParents.isEmpty();
    }

    public String toJson() throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }

    public static RewritePlan fromJson(String json) throws IOException {
        return objectMapper.readValue(json, RewritePlan.class);
    }

    public void save(StateStore store, StateKey key) throws IOException, InvariantViolationException {
        store.put(key, objectMapper.writeValueAsBytes(this));
    }

    public static Optional<RewritePlan> load(StateStore store, StateKey key)
            throws IOException, InvariantViolationException {
        var value = store.get(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(value.get(), RewritePlan.class));
    }
}
