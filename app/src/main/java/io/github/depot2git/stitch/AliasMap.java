package io.github.depot2git.stitch;

import com.google.common.base.Joiner;
import io.github.depot2git.InvariantViolationException;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/** Commit ids that are replaced by other commits, resolved transitively. */
public final class AliasMap {
    private final Map<String, String> aliases = new HashMap<>();

    public AliasMap() {}

    public AliasMap(Map<String, String> aliases) {
        this.aliases.putAll(aliases);
    }

    public void add(String from, String to) {
        aliases.put(from, to);
    }

    public boolean isAliased(String commit) {
        return aliases.containsKey(commit);
    }

    /** Follows aliases until a commit that is not replaced. */
    public String resolve(String commit) throws InvariantViolationException {
        var seen = new LinkedHashSet<String>();
        var current = commit;
        while (aliases.containsKey(current)) {
            if (!seen.add(current)) {
                throw new InvariantViolationException(
                        "Alias cycle: " + Joiner.on(" -> ").join(seen) + " -> " + current);
            }
            current = aliases.get(current);
        }
        return current;
    }

    /** Every alias mapped straight to its final commit. */
    public Map<String, String> resolved() throws InvariantViolationException {
        var result = new HashMap<String, String>();
        for (var from : aliases.keySet()) {
            result.put(from, resolve(from));
        }
        return result;
    }
}
