package io.github.depot2git.git;

import static org.junit.jupiter.api.Assertions.*;

import io.github.depot2git.ConversionRun;
import io.github.depot2git.UnrecognizedInputException;
import io.github.depot2git.config.ConverterConfig;
import io.github.depot2git.config.MergeStrategy;
import io.github.depot2git.config.RemoteMapping;
import io.github.depot2git.store.StateKey;
import io.github.depot2git.testutil.Conversions;
import io.github.depot2git.testutil.FakeDepot;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.transport.URIish;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class RemotePublisherTest {

    @TempDir
    Path tempDir;

    private static FakeDepot depot() {
        var depot = new FakeDepot("Root");
        depot.mkworkspace("ws", "Root");
        depot.keep("ws", "joe", "first", Map.of("a.txt", "1"));
        depot.promote("ws", "Root", "joe", "promote first");
        return depot;
    }

    private ConverterConfig config(RemoteMapping... remotes) {
        return Conversions.config(tempDir.resolve("repo"), MergeStrategy.NORMAL, "Root", "ws")
                .withRemotes(List.of(remotes));
    }

    private Git bareRemote(String name) throws Exception {
        return Git.init().setDirectory(tempDir.resolve(name).toFile()).setBare(true).call();
    }

    @Test
    void testConvertedRefsArePushed() throws Exception {
        try (var remote = bareRemote("origin.git");
                var run = ConversionRun.open(
                        config(new RemoteMapping("origin", tempDir.resolve("origin.git").toString(), null)),
                        depot())) {
            run.run(ConversionRun.Options.defaults());

            var target = run.context().target();
            var remoteRepository = remote.getRepository();
            for (var branch : List.of("Root", "ws")) {
                var pushed = remoteRepository.exactRef("refs/heads/" + branch);
                assertNotNull(pushed, branch + " was not pushed");
                assertEquals(target.branchTip(branch).orElseThrow(), pushed.getObjectId());
            }
            assertNotNull(remoteRepository.exactRef(Annotations.NOTES_REF));
            assertFalse(remoteRepository.getRefDatabase().getRefsByPrefix(StateKey.NAMESPACE).isEmpty());
        }
    }

    @Test
    void testPushUrlIsUsedForPushing() throws Exception {
        var pushUrl = tempDir.resolve("push.git").toString();
        try (var pushRemote = bareRemote("push.git");
                var run = ConversionRun.open(
                        config(new RemoteMapping("origin", "https://example.com/never-used.git", pushUrl)), depot())) {
            var remotes = run.context().target().git().remoteList().call();
            assertEquals(1, remotes.size());
            assertEquals(new URIish("https://example.com/never-used.git"), remotes.get(0).getURIs().get(0));
            assertEquals(new URIish(pushUrl), remotes.get(0).getPushURIs().get(0));

            run.run(ConversionRun.Options.defaults());
            assertNotNull(pushRemote.getRepository().exactRef("refs/heads/Root"));
        }
    }

    @Test
    void testExistingRemoteMustMatch() throws Exception {
        var origin = new RemoteMapping("origin", tempDir.resolve("a.git").toString(), null);
        try (var run = ConversionRun.open(config(origin), depot())) {
            assertEquals(1, run.context().target().git().remoteList().call().size());
        }
        // reopening with the same remote is fine
        ConversionRun.open(config(origin), depot()).close();

        var moved = new RemoteMapping("origin", tempDir.resolve("b.git").toString(), null);
        assertThrows(UnrecognizedInputException.class, () -> ConversionRun.open(config(moved), depot()));
    }

    @Test
    void testFailedPushDoesNotStopTheConversion() throws Exception {
        var missing = new RemoteMapping("origin", tempDir.resolve("missing.git").toString(), null);
        try (var run = ConversionRun.open(config(missing), depot())) {
            run.run(ConversionRun.Options.defaults());

            var target = run.context().target();
            assertTrue(target.branchTip("Root").isPresent());
            var publisher = new RemotePublisher(target, List.of(missing));
            assertFalse(publisher.pushBranches(List.of("Root")));
        }
    }
}
