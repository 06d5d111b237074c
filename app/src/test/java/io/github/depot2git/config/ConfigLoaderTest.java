package io.github.depot2git.config;

import static org.junit.jupiter.api.Assertions.*;

import io.github.depot2git.UnrecognizedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static final String FULL = """
            <depot2git>
                <source depot="Trunk" username="joe" password="secret" start-transaction="5" end-transaction="120">
                    <stream name="Trunk" branch-name="main"/>
                    <stream name="Dev"/>
                </source>
                <git repo-path="trunk-git" message-style="notes">
                    <remote name="origin" url="https://example.com/trunk.git"/>
                    <remote name="backup" url="https://example.com/b.git" push-url="ssh://git@example.com/b.git"/>
                </git>
                <method>diff</method>
                <merge-strategy>orphanage</merge-strategy>
                <retry attempts="5" delay-seconds="0"/>
                <usermaps>
                    <map-user source="joe" name="Joe Bloggs" email="joe@example.com" timezone="+0100"/>
                    <map-user source="ann" name="Ann Other" email="ann@example.com"/>
                </usermaps>
            </depot2git>
            """;

    @Test
    void testLoadFullConfiguration() throws Exception {
        var file = tempDir.resolve(ConfigLoader.DEFAULT_FILENAME);
        Files.writeString(file, FULL, StandardCharsets.UTF_8);

        var config = ConfigLoader.load(file);

        assertEquals("Trunk", config.depot());
        assertEquals("joe", config.username());
        assertEquals("secret", config.password());
        assertEquals(5, config.startTransaction());
        assertEquals("120", config.endTransaction());
        assertEquals(2, config.streams().size());
        assertEquals(new StreamMapping("Trunk", "main"), config.streams().get(0));
        assertNull(config.streams().get(1).branchName());
        assertEquals(tempDir.resolve("trunk-git").normalize(), config.gitRepoPath());
        assertEquals(MessageStyle.NOTES, config.messageStyle());
        assertEquals(RetrievalMethod.DIFF, config.method());
        assertEquals(MergeStrategy.ORPHANAGE, config.mergeStrategy());
        assertEquals(5, config.retryAttempts());
        assertEquals(Duration.ZERO, config.retryDelay());
        assertEquals(2, config.users().size());
        assertEquals("+0100", config.user("joe").orElseThrow().timezone());
        assertNull(config.user("ann").orElseThrow().timezone());
        assertEquals(2, config.remotes().size());
        assertEquals(new RemoteMapping("origin", "https://example.com/trunk.git", null), config.remotes().get(0));
        assertEquals("https://example.com/trunk.git", config.remotes().get(0).effectivePushUrl());
        assertEquals("ssh://git@example.com/b.git", config.remotes().get(1).effectivePushUrl());
    }

    @Test
    void testDefaults() throws Exception {
        var config = ConfigLoader.parse(
                """
                <depot2git>
                    <source depot="Trunk"/>
                    <git repo-path="/tmp/out"/>
                </depot2git>
                """,
                tempDir);

        assertEquals(RetrievalMethod.DEEP_HIST, config.method());
        assertEquals(MergeStrategy.NORMAL, config.mergeStrategy());
        assertEquals(MessageStyle.NORMAL, config.messageStyle());
        assertEquals("now", config.endTransaction());
        assertEquals(1, config.startTransaction());
        assertTrue(config.streams().isEmpty());
        assertNull(config.username());
        assertTrue(config.remotes().isEmpty());
    }

    @Test
    void testUnknownMethodIsRejected() {
        var xml = """
                <depot2git>
                    <source depot="Trunk"/>
                    <git repo-path="out"/>
                    <method>telepathy</method>
                </depot2git>
                """;
        var e = assertThrows(UnrecognizedInputException.class, () -> ConfigLoader.parse(xml, tempDir));
        assertTrue(e.getMessage().contains("telepathy"), e.getMessage());
    }

    @Test
    void testMissingRequiredElements() {
        assertThrows(
                UnrecognizedInputException.class,
                () -> ConfigLoader.parse("<depot2git><git repo-path=\"out\"/></depot2git>", tempDir));
        assertThrows(
                UnrecognizedInputException.class,
                () -> ConfigLoader.parse("<depot2git><source depot=\"Trunk\"/></depot2git>", tempDir));
        assertThrows(UnrecognizedInputException.class, () -> ConfigLoader.parse("<depot2git", tempDir));
    }

    @Test
    void testBadNumber() {
        var xml = """
                <depot2git>
                    <source depot="Trunk" start-transaction="first"/>
                    <git repo-path="out"/>
                </depot2git>
                """;
        assertThrows(UnrecognizedInputException.class, () -> ConfigLoader.parse(xml, tempDir));
    }

    @Test
    void testRemoteNeedsNameAndUrl() {
        var unnamed = """
                <depot2git>
                    <source depot="Trunk"/>
                    <git repo-path="out"><remote url="https://example.com/a.git"/></git>
                </depot2git>
                """;
        assertThrows(UnrecognizedInputException.class, () -> ConfigLoader.parse(unnamed, tempDir));
        var twice = """
                <depot2git>
                    <source depot="Trunk"/>
                    <git repo-path="out">
                        <remote name="origin" url="https://example.com/a.git"/>
                        <remote name="origin" url="https://example.com/b.git"/>
                    </git>
                </depot2git>
                """;
        assertThrows(UnrecognizedInputException.class, () -> ConfigLoader.parse(twice, tempDir));
    }
}
