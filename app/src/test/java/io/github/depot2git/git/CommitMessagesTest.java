package io.github.depot2git.git;

import static org.junit.jupiter.api.Assertions.*;

import io.github.depot2git.config.MessageStyle;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.StreamKind;
import io.github.depot2git.source.StreamRef;
import io.github.depot2git.source.Transaction;
import io.github.depot2git.source.TransactionKind;
import org.junit.jupiter.api.Test;

public class CommitMessagesTest {

    private static final StreamInfo DEV = StreamInfo.of(3, "Dev", "Trunk", StreamKind.NORMAL, 1, "Trunk");
    private static final StreamInfo WORKSPACE = StreamInfo.of(7, "joe_ws", "Trunk", StreamKind.WORKSPACE, 3, "Dev");
    private static final Transaction PROMOTE = new Transaction(
            42, TransactionKind.PROMOTE, "joe", 1600000000L, "Fix the build\n", DEV.ref(), new StreamRef(7, "joe_ws"));

    @Test
    void testNormalStyleAppendsAlignedTrailers() {
        var message = new CommitMessages(MessageStyle.NORMAL)
                .compose(PROMOTE, DEV, "Merged joe_ws into Dev", null, WORKSPACE);

        var expected = """
                Merged joe_ws into Dev

                Fix the build

                Depot-transaction:   42 (promote)
                Depot-user:          joe
                Depot-stream:        Dev (3)
                Depot-stream-basis:  Trunk (1)
                Depot-source-stream: joe_ws (7)
                """;
        assertEquals(expected, message.text());
        assertNull(message.info());
    }

    @Test
    void testNotesStyleMovesTrailersOut() {
        var message = new CommitMessages(MessageStyle.NOTES).compose(PROMOTE, DEV, null, null, WORKSPACE);

        assertEquals("Fix the build\n", message.text());
        assertNotNull(message.info());
        assertTrue(message.info().startsWith("Depot-transaction:"));
        assertTrue(message.info().contains("Depot-source-stream: joe_ws (7)"));
    }

    @Test
    void testCleanStyle() {
        var messages = new CommitMessages(MessageStyle.CLEAN);
        assertEquals("Fix the build\n", messages.compose(PROMOTE, DEV, "ignored", null, null).text());

        var silent = new Transaction(43, TransactionKind.KEEP, "joe", 1600000060L, "  ", WORKSPACE.ref(), null);
        assertEquals("Transaction 43\n", messages.compose(silent, WORKSPACE, null, null, null).text());
        assertEquals("Created x\n", messages.compose(silent, WORKSPACE, "Created x", null, null).text());
    }

    @Test
    void testDestinationTrailerOnlyForOtherStreams() {
        var trailers = CommitMessages.trailers(PROMOTE, WORKSPACE, DEV, null);
        assertTrue(trailers.contains("Depot-destination-stream: Dev (3)"), trailers);
        assertFalse(CommitMessages.trailers(PROMOTE, DEV, DEV, null).contains("Depot-destination-stream"));
    }
}
