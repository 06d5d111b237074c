package io.github.depot2git.store;

import static org.junit.jupiter.api.Assertions.*;

import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.git.GitObjects;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.internal.storage.dfs.DfsRepositoryDescription;
import org.eclipse.jgit.internal.storage.dfs.InMemoryRepository;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GitStateStoreTest {

    @TempDir
    Path tempDir;

    private Git git;
    private GitStateStore store;

    @BeforeEach
    void setUp() throws Exception {
        git = Git.init().setDirectory(tempDir.toFile()).call();
        store = new GitStateStore(git.getRepository());
    }

    @AfterEach
    void tearDown() {
        git.close();
    }

    private ObjectId tree(String content) throws Exception {
        return GitObjects.insertFlatTree(
                git.getRepository(), Map.of("file.txt", content.getBytes(StandardCharsets.UTF_8)));
    }

    private static EntryInfo info(long transaction) {
        return new EntryInfo(transaction, new PersonIdent("alice", "alice@example.com"));
    }

    @Test
    void testPutAndGet() throws Exception {
        var key = new StateKey("depots/1/processing");
        assertTrue(store.get(key).isEmpty());

        store.put(key, "first".getBytes(StandardCharsets.UTF_8));
        store.put(key, "second".getBytes(StandardCharsets.UTF_8));

        assertEquals("second", new String(store.get(key).orElseThrow(), StandardCharsets.UTF_8));
        assertEquals(1, git.getRepository().parseCommit(store.tip(key).orElseThrow()).getParentCount());
    }

    @Test
    void testAppendKeepsEntriesInOrder() throws Exception {
        var key = StateKeys.stream(1, 2).metadata();
        var first = store.append(key, tree("a"), info(3));
        store.append(key, tree("b"), info(7));
        var last = store.append(key, tree("c"), info(12));

        var entries = store.entries(key);
        assertEquals(3, entries.size());
        assertEquals(3, entries.get(0).transaction());
        assertEquals(7, entries.get(1).transaction());
        assertEquals(12, entries.get(2).transaction());
        assertEquals(first, entries.get(0).commit());
        assertEquals(last, store.tipEntry(key).orElseThrow().commit());
        assertEquals(tree("c"), store.tipEntry(key).orElseThrow().tree());
    }

    @Test
    void testAppendRejectsNonIncreasingTransaction() throws Exception {
        var key = StateKeys.stream(1, 2).content();
        store.append(key, tree("a"), info(5));

        assertThrows(InvariantViolationException.class, () -> store.append(key, tree("b"), info(5)));
        assertThrows(InvariantViolationException.class, () -> store.append(key, tree("b"), info(4)));
        assertEquals(1, store.entries(key).size(), "A rejected append must leave the sequence untouched");
    }

    @Test
    void testDeleteAndKeys() throws Exception {
        var keys = StateKeys.stream(1, 2);
        store.append(keys.metadata(), tree("a"), info(1));
        store.append(keys.content(), tree("a"), info(1));
        store.put(StateKeys.processing(9), "{}".getBytes(StandardCharsets.UTF_8));

        var found = store.keys(StateKeys.depotPrefix(1));
        assertEquals(2, found.size());
        assertTrue(found.contains(keys.metadata()));

        assertTrue(store.delete(keys.metadata()));
        assertFalse(store.delete(keys.metadata()));
        assertTrue(store.entries(keys.metadata()).isEmpty());
        assertEquals(1, store.keys(StateKeys.depotPrefix(9)).size());
    }

    @Test
    void testDanglingSymbolicRefIsCorruptState() throws Exception {
        var key = new StateKey("depots/1/broken");
        var update = git.getRepository().updateRef(key.ref());
        update.link("refs/heads/does-not-exist");

        assertThrows(InvariantViolationException.class, () -> store.get(key));
    }

    @Test
    void testInMemoryRepository() throws Exception {
        try (var repository = new InMemoryRepository(new DfsRepositoryDescription("state"))) {
            var memoryStore = new GitStateStore(repository);
            var key = StateKeys.stitchPlan(1);
            memoryStore.put(key, "plan".getBytes(StandardCharsets.UTF_8));
            assertEquals("plan", new String(memoryStore.get(key).orElseThrow(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void testInvalidKeyName() {
        assertThrows(IllegalArgumentException.class, () -> new StateKey("depots/1/bad..name"));
    }
}
