package io.github.depot2git.process;

import static io.github.depot2git.testutil.Conversions.filesAt;
import static io.github.depot2git.testutil.Conversions.firstParents;
import static org.junit.jupiter.api.Assertions.*;

import io.github.depot2git.ConversionRun;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.StreamSelection;
import io.github.depot2git.config.ConverterConfig;
import io.github.depot2git.config.MergeStrategy;
import io.github.depot2git.config.MessageStyle;
import io.github.depot2git.config.RetrievalMethod;
import io.github.depot2git.git.CommitMessages;
import io.github.depot2git.store.StateKeys;
import io.github.depot2git.testutil.Conversions;
import io.github.depot2git.testutil.FakeDepot;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.nio.charset.StandardCharsets;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TransactionProcessorTest {

    @TempDir
    Path tempDir;

    private ConversionRun run;

    @AfterEach
    void tearDown() {
        if (run != null) {
            run.close();
        }
    }

    private ConversionRun convert(ConverterConfig config, FakeDepot depot) throws Exception {
        if (run != null) {
            run.close();
        }
        run = ConversionRun.open(config, depot);
        run.run(ConversionRun.Options.defaults());
        return run;
    }

    private ConverterConfig config(String... streams) {
        return Conversions.config(tempDir.resolve("repo"), MergeStrategy.NORMAL, streams);
    }

    private ObjectId tip(String branch) throws Exception {
        return run.context().target().branchTip(branch).orElseThrow(() -> new AssertionError("no branch " + branch));
    }

    private RevCommit commit(ObjectId id) throws Exception {
        return run.context().target().parseCommit(id);
    }

    private long annotatedTransaction(ObjectId commit) throws Exception {
        return run.context().target().annotations().require(commit).transactionNumber();
    }

    /** Root with one workspace that keeps and promotes twice: transactions 1 to 6. */
    private static FakeDepot linearDepot() {
        var depot = new FakeDepot("Root");
        depot.mkworkspace("ws", "Root");
        depot.keep("ws", "joe", "first", Map.of("a.txt", "1"));
        depot.promote("ws", "Root", "joe", "promote first");
        depot.keep("ws", "joe", "second", Map.of("a.txt", "2"));
        depot.promote("ws", "Root", "joe", "promote second");
        return depot;
    }

    @Test
    void testLinearHistory() throws Exception {
        var depot = linearDepot();
        convert(config("Root"), depot);

        var history = firstParents(run.context().target().repository(), tip("Root"));
        assertEquals(3, history.size());
        assertEquals(List.of(1L, 4L, 6L), List.of(
                annotatedTransaction(history.get(0)),
                annotatedTransaction(history.get(1)),
                annotatedTransaction(history.get(2))));
        for (var commit : history) {
            assertTrue(commit.getParentCount() <= 1);
        }
        assertEquals(Map.of("a.txt", "2"), filesAt(run.context().target().repository(), tip("Root")));

        var last = commit(tip("Root"));
        assertEquals("joe", last.getAuthorIdent().getName());
        assertEquals((FakeDepot.EPOCH + 6 * 60) * 1000, last.getAuthorIdent().getWhen().getTime());
        assertTrue(last.getFullMessage().contains("promote second"), last.getFullMessage());
        assertTrue(last.getFullMessage().contains("Depot-transaction:"), last.getFullMessage());
        assertEquals(6L, new TransactionProcessor(run.context(), List.of()).checkpoint().orElseThrow());
    }

    @Test
    void testPromotionOfWholeWorkspaceIsAMerge() throws Exception {
        var depot = linearDepot();
        convert(config("Root", "ws"), depot);

        var repository = run.context().target().repository();
        var rootTip = commit(tip("Root"));
        var wsTip = tip("ws");
        assertEquals(2, rootTip.getParentCount(), "promotion of the whole workspace should merge it");
        assertEquals(wsTip, rootTip.getParent(1));
        assertTrue(rootTip.getFullMessage().startsWith("Merged ws into Root"), rootTip.getFullMessage());
        assertEquals(filesAt(repository, wsTip), filesAt(repository, rootTip));

        var annotation = run.context().target().annotations().require(rootTip);
        assertEquals(6, annotation.transactionNumber());
        assertEquals("promote", annotation.transactionKind());
        assertEquals("Root", annotation.dstStream());
        assertEquals("ws", annotation.srcStream());

        // the workspace branch starts from the Root commit that existed when it was created
        var wsHistory = firstParents(repository, wsTip);
        assertEquals(1L, annotatedTransaction(wsHistory.get(0)));
        assertEquals(2L, annotatedTransaction(wsHistory.get(1)));
    }

    @Test
    void testPartialPromotionIsACherryPick() throws Exception {
        var depot = new FakeDepot("Root");
        depot.mkworkspace("ws", "Root");
        depot.keep("ws", "joe", "two files", Map.of("a.txt", "1", "b.txt", "1"));
        depot.promote("ws", "Root", "joe", "only a", "a.txt");
        convert(config("Root", "ws"), depot);

        var rootTip = commit(tip("Root"));
        assertEquals(1, rootTip.getParentCount());
        assertEquals(Map.of("a.txt", "1"), filesAt(run.context().target().repository(), rootTip));
        assertTrue(rootTip.getFullMessage().startsWith("Promoted from ws into Root"), rootTip.getFullMessage());

        // promoting the rest makes Root equal to the workspace, which is recorded as a merge
        depot.promote("ws", "Root", "joe", "the rest", "b.txt");
        convert(config("Root", "ws"), depot);

        var merged = commit(tip("Root"));
        assertEquals(2, merged.getParentCount());
        assertEquals(rootTip, merged.getParent(0));
        assertEquals(tip("ws"), merged.getParent(1));
    }

    @Test
    void testChildStreamInheritsPromotion() throws Exception {
        var depot = new FakeDepot("Root");
        depot.mkstream("Dev", "Root");
        depot.mkworkspace("ws", "Root");
        depot.keep("ws", "joe", "change", Map.of("a.txt", "1"));
        depot.promote("ws", "Root", "joe", "promote");
        convert(config("Root", "Dev"), depot);

        var repository = run.context().target().repository();
        var rootTip = tip("Root");
        var devTip = commit(tip("Dev"));
        assertEquals(Map.of("a.txt", "1"), filesAt(repository, devTip));
        assertEquals(2, devTip.getParentCount());
        assertEquals(rootTip, devTip.getParent(1));
        assertEquals(5L, annotatedTransaction(devTip));
        assertTrue(run.context().target().isAncestor(rootTip, devTip));
    }

    @Test
    void testRenamedStreamKeepsItsBranch() throws Exception {
        var depot = new FakeDepot("Root");
        depot.mkstream("Dev", "Root");
        depot.mkworkspace("ws", "Dev");
        depot.keep("ws", "joe", "one", Map.of("a.txt", "1"));
        depot.promote("ws", "Dev", "joe", "promote one");
        depot.chstream("Dev", "Dev2", "Root");
        depot.keep("ws", "joe", "two", Map.of("b.txt", "1"));
        depot.promote("ws", "Dev2", "joe", "promote two");
        convert(config("Root", "Dev2"), depot);

        var target = run.context().target();
        assertTrue(target.branchTip("Dev").isEmpty(), "the old branch name should be gone");
        var history = firstParents(target.repository(), tip("Dev2"));
        assertEquals(4, history.size());
        assertEquals(Map.of("a.txt", "1", "b.txt", "1"), filesAt(target.repository(), tip("Dev2")));
        assertEquals("Dev2", target.annotations().require(tip("Dev2")).stream());
    }

    @Test
    void testEveryCommitIsAnnotated() throws Exception {
        var depot = linearDepot();
        depot.mkstream("Dev", "Root");
        depot.keep("ws", "ann", "third", Map.of("c.txt", "3"));
        depot.promote("ws", "Root", "ann", "promote third");
        convert(config("Root", "Dev", "ws"), depot);

        var target = run.context().target();
        var tips = List.of(tip("Root"), tip("Dev"), tip("ws"));
        for (var commit : target.reachable(tips)) {
            var annotation = target.annotations().read(commit);
            assertTrue(annotation.isPresent(), "commit " + commit.name() + " has no annotation");
            assertEquals(FakeDepot.DEPOT, annotation.get().depot());
        }
    }

    @Test
    void testRerunIsIdempotent() throws Exception {
        var depot = linearDepot();
        convert(config("Root", "ws"), depot);
        var rootTip = tip("Root");
        var wsTip = tip("ws");

        convert(config("Root", "ws"), depot);
        assertEquals(rootTip, tip("Root"));
        assertEquals(wsTip, tip("ws"));

        // losing the checkpoint replays every transaction; the annotations make each one a no-op
        run.context().store().delete(StateKeys.processing(run.context().depot().number()));
        convert(config("Root", "ws"), depot);
        assertEquals(rootTip, tip("Root"));
        assertEquals(wsTip, tip("ws"));
    }

    @Test
    void testUnannotatedTipIsDiscarded() throws Exception {
        var depot = linearDepot();
        convert(config("Root"), depot);
        var target = run.context().target();
        var annotatedTip = tip("Root");

        // a commit left behind by a run that died before annotating it
        var stray = target.commit(
                target.treeOf(annotatedTip),
                List.of(annotatedTip),
                new PersonIdent("someone", "someone@example.com"),
                "stray");
        target.setBranch("Root", annotatedTip, stray, false, "test");

        depot.keep("ws", "joe", "third", Map.of("a.txt", "3"));
        depot.promote("ws", "Root", "joe", "promote third");
        convert(config("Root"), depot);

        var newTip = commit(tip("Root"));
        assertEquals(annotatedTip, newTip.getParent(0));
        assertFalse(run.context().target().isAncestor(stray, newTip));
        assertEquals(8L, annotatedTransaction(newTip));
    }

    @Test
    void testNotesMessageStyle() throws Exception {
        var depot = linearDepot();
        convert(config("Root").withMessageStyle(MessageStyle.NOTES), depot);

        var target = run.context().target();
        var message = commit(tip("Root")).getFullMessage();
        assertFalse(message.contains("Depot-transaction"), message);
        var info = target.notes(CommitMessages.INFO_NOTES_REF).read(tip("Root"));
        assertTrue(info.orElseThrow().matches("(?s).*Depot-transaction:\\s+6 \\(promote\\).*"), info.get());
    }

    @Test
    void testProcessingRequiresRetrieval() throws Exception {
        var depot = linearDepot();
        run = ConversionRun.open(config("Root").withMethod(RetrievalMethod.SKIP), depot);
        var streams = StreamSelection.resolve(run.context());
        var processor = new TransactionProcessor(run.context(), streams);
        assertThrows(InvariantViolationException.class, processor::process);
    }

    @Test
    void testReparentResetsOntoNewBasis() throws Exception {
        var depot = new FakeDepot("Root");
        depot.mkstream("Dev", "Root");
        depot.mkstream("Other", "Root");
        depot.mkworkspace("ws", "Other");
        depot.keep("ws", "joe", "change", Map.of("a.txt", "1"));
        depot.promote("ws", "Other", "joe", "promote to Other");
        convert(config("Root", "Dev", "Other"), depot);
        var oldDevTip = tip("Dev");

        long reparented = depot.chstream("Dev", "Dev", "Other");
        convert(config("Root", "Dev", "Other"), depot);

        var target = run.context().target();
        var devTip = commit(tip("Dev"));
        assertEquals(tip("Other"), devTip.getParent(0));
        assertFalse(target.isAncestor(oldDevTip, devTip), "re-parenting replaces the old history, it does not merge");
        assertEquals(reparented, annotatedTransaction(devTip));
        assertEquals(Map.of("a.txt", "1"), filesAt(target.repository(), devTip));
    }

    @Test
    void testFailedAnnotationMovesTheBranchBack() throws Exception {
        var depot = linearDepot();
        var config = config("Root").withMessageStyle(MessageStyle.NOTES);
        convert(config, depot);
        var annotatedTip = tip("Root");
        var repository = run.context().target().repository();

        // a notes ref that does not point at a commit cannot take another note
        ObjectId blob;
        try (var inserter = repository.newObjectInserter()) {
            blob = inserter.insert(Constants.OBJ_BLOB, "not a notes commit".getBytes(StandardCharsets.UTF_8));
            inserter.flush();
        }
        var corrupt = repository.updateRef(CommitMessages.INFO_NOTES_REF);
        corrupt.setNewObjectId(blob);
        corrupt.setForceUpdate(true);
        corrupt.forceUpdate();

        depot.keep("ws", "joe", "third", Map.of("a.txt", "3"));
        depot.promote("ws", "Root", "joe", "promote third");
        assertThrows(InvariantViolationException.class, () -> convert(config, depot));
        assertEquals(annotatedTip, tip("Root"));

        var repair = run.context().target().repository().updateRef(CommitMessages.INFO_NOTES_REF);
        repair.setForceUpdate(true);
        repair.delete();
        convert(config, depot);
        assertEquals(annotatedTip, commit(tip("Root")).getParent(0));
        assertEquals(8L, annotatedTransaction(tip("Root")));
    }

    @Test
    void testDefunctPropagatesToChildStream() throws Exception {
        var depot = new FakeDepot("Root");
        depot.mkstream("Dev", "Root");
        depot.mkworkspace("ws", "Root");
        depot.keep("ws", "joe", "two files", Map.of("a.txt", "1", "b.txt", "1"));
        depot.promote("ws", "Root", "joe", "promote");
        long removed = depot.defunct("Root", "joe", "drop b", "b.txt");
        convert(config("Root", "Dev"), depot);

        var target = run.context().target();
        var rootTip = commit(tip("Root"));
        var devTip = commit(tip("Dev"));
        assertEquals(removed, annotatedTransaction(rootTip));
        assertEquals("defunct", target.annotations().require(rootTip).transactionKind());
        assertEquals(Map.of("a.txt", "1"), filesAt(target.repository(), rootTip));

        assertEquals(removed, annotatedTransaction(devTip));
        assertEquals(Map.of("a.txt", "1"), filesAt(target.repository(), devTip));
        assertTrue(target.isAncestor(rootTip, devTip));
    }

    @Test
    void testDefunctInWorkspaceStaysThere() throws Exception {
        var depot = linearDepot();
        convert(config("Root", "ws"), depot);
        var rootTip = tip("Root");

        depot.keep("ws", "joe", "new file", Map.of("b.txt", "1"));
        long removed = depot.defunct("ws", "joe", "drop it again", "b.txt");
        convert(config("Root", "ws"), depot);

        assertEquals(rootTip, tip("Root"));
        assertEquals(removed, annotatedTransaction(tip("ws")));
        assertEquals(Map.of("a.txt", "2"), filesAt(run.context().target().repository(), tip("ws")));
    }
}
