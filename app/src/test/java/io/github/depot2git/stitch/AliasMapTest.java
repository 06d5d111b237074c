package io.github.depot2git.stitch;

import static org.junit.jupiter.api.Assertions.*;

import io.github.depot2git.InvariantViolationException;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class AliasMapTest {

    @Test
    void testResolveFollowsChains() throws Exception {
        var aliases = new AliasMap();
        aliases.add("c", "b");
        aliases.add("b", "a");

        assertEquals("a", aliases.resolve("c"));
        assertEquals("a", aliases.resolve("b"));
        assertEquals("a", aliases.resolve("a"));
        assertEquals("x", aliases.resolve("x"));
        assertTrue(aliases.isAliased("b"));
        assertFalse(aliases.isAliased("a"));
        assertEquals(Map.of("b", "a", "c", "a"), aliases.resolved());
    }

    @Test
    void testCycleIsRejected() {
        var aliases = new AliasMap(Map.of("a", "b", "b", "a"));
        var e = assertThrows(InvariantViolationException.class, () -> aliases.resolve("a"));
        assertTrue(e.getMessage().startsWith("Alias cycle"), e.getMessage());
    }
}
