package io.github.depot2git.source.accurev;

import static org.junit.jupiter.api.Assertions.*;

import io.github.depot2git.TransientCommandException;
import io.github.depot2git.UnrecognizedInputException;
import io.github.depot2git.source.ElementChange;
import io.github.depot2git.source.StreamKind;
import io.github.depot2git.source.StreamRef;
import io.github.depot2git.source.Transaction;
import io.github.depot2git.source.TransactionKind;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class AccuRevXmlTest {

    @Test
    void testStreams() throws Exception {
        var xml = """
                <streams>
                    <stream name="Trunk" depotName="Trunk" streamNumber="1" isDynamic="true" type="normal"/>
                    <stream name="Dev" basis="Trunk" basisStreamNumber="1" depotName="Trunk" streamNumber="3"
                            isDynamic="true" type="normal" time="1600000600"/>
                    <stream name="joe_ws" basis="Dev" basisStreamNumber="3" depotName="Trunk" streamNumber="2"
                            isDynamic="false" type="workspace"/>
                </streams>
                """;

        var streams = AccuRevXml.streams(xml);

        assertEquals(3, streams.size());
        var trunk = streams.get(0);
        assertTrue(trunk.isRoot());
        assertEquals("Trunk", trunk.name());
        var workspace = streams.get(1);
        assertEquals(2, workspace.number());
        assertEquals(StreamKind.WORKSPACE, workspace.kind());
        assertEquals(3, workspace.basisNumber());
        var dev = streams.get(2);
        assertEquals(1600000600L, dev.timeLock());
        assertEquals("Trunk", dev.basisName());
    }

    @Test
    void testSingleStream() throws Exception {
        var streams = AccuRevXml.streams(
                "<streams><stream name=\"Trunk\" depotName=\"Trunk\" streamNumber=\"1\" type=\"normal\"/></streams>");
        assertEquals(1, streams.size());
        assertNull(streams.get(0).timeLock());
    }

    @Test
    void testPromoteTransaction() throws Exception {
        var xml = """
                <AcResponse Command="hist" TaskId="42">
                    <transaction id="17" type="promote" time="1600001000" user="joe" streamName="Dev"
                            streamNumber="3" fromStreamName="joe_ws" fromStreamNumber="2">
                        <comment>Fix the build</comment>
                        <version path="/./src/Main.java" eid="4" virtual="3/2" real="2/5"
                                virtualNamedVersion="Dev/2" realNamedVersion="joe_ws/5"/>
                    </transaction>
                </AcResponse>
                """;

        var transactions = AccuRevXml.transactions(xml);

        assertEquals(1, transactions.size());
        var transaction = transactions.get(0);
        assertEquals(17, transaction.id());
        assertEquals(TransactionKind.PROMOTE, transaction.kind());
        assertEquals("joe", transaction.user());
        assertEquals(1600001000L, transaction.time());
        assertEquals("Fix the build", transaction.comment());
        assertEquals(new StreamRef(3, "Dev"), transaction.stream());
        assertEquals(new StreamRef(2, "joe_ws"), transaction.fromStream());
    }

    @Test
    void testStreamsFromNamedVersions() throws Exception {
        var xml = """
                <AcResponse>
                    <transaction id="9" type="promote" time="1600000900" user="ann">
                        <version path="/./a.txt" virtual="3/1" real="2/1"
                                virtualNamedVersion="Dev/1" realNamedVersion="ann_ws/1"/>
                    </transaction>
                    <transaction id="8" type="keep" time="1600000800" user="ann">
                        <comment>wip</comment>
                    </transaction>
                </AcResponse>
                """;

        var transactions = AccuRevXml.transactions(xml);

        assertEquals(List.of(8L, 9L), transactions.stream().map(Transaction::id).toList());
        assertNull(transactions.get(0).fromStream(), "Only promotions have a source stream");
        assertEquals(new StreamRef(3, "Dev"), transactions.get(1).stream());
        assertEquals(new StreamRef(2, "ann_ws"), transactions.get(1).fromStream());
    }

    @Test
    void testUnknownTransactionKindIsFatal() {
        var xml = "<AcResponse><transaction id=\"1\" type=\"teleport\" time=\"1\" user=\"x\"/></AcResponse>";
        assertThrows(UnrecognizedInputException.class, () -> AccuRevXml.transactions(xml));
    }

    @Test
    void testGarbledOutputIsTransient() {
        assertThrows(TransientCommandException.class, () -> AccuRevXml.transactions(""));
        assertThrows(TransientCommandException.class, () -> AccuRevXml.transactions("<AcResponse><transac"));
        assertThrows(
                TransientCommandException.class,
                () -> AccuRevXml.transactions("<AcResponse><transaction type=\"keep\"/></AcResponse>"));
    }

    @Test
    void testDiff() throws Exception {
        var xml = """
                <AcResponse>
                    <Element>
                        <Change What="changed">
                            <Stream1 Name="/./src/a.txt"/>
                            <Stream2 Name="/./src/a.txt"/>
                        </Change>
                    </Element>
                    <Element>
                        <Change What="moved">
                            <Stream1 Name="/./old.txt"/>
                            <Stream2 Name="/./dir/new.txt"/>
                        </Change>
                    </Element>
                    <Element>
                        <Change What="removed">
                            <Stream1 Name="/./gone.txt"/>
                        </Change>
                    </Element>
                </AcResponse>
                """;

        var diff = AccuRevXml.diff(xml, 3, 7);

        assertEquals(3, diff.fromTransaction());
        assertEquals(
                List.of(
                        new ElementChange("src/a.txt", "src/a.txt"),
                        new ElementChange("old.txt", "dir/new.txt"),
                        new ElementChange("gone.txt", null)),
                diff.changes());
        assertTrue(AccuRevXml.diff("<AcResponse/>", 1, 2).isEmpty());
    }

    @Test
    void testDepotsAndUsers() throws Exception {
        var depots = AccuRevXml.depots("""
                <AcResponse>
                    <Element Number="1" Name="Trunk"/>
                    <Element Number="4" Name="Tools"/>
                </AcResponse>
                """);
        assertEquals(2, depots.size());
        assertEquals("Tools", depots.get(1).name());

        var users = AccuRevXml.users("""
                <AcResponse>
                    <Element Number="1" Name="joe" Kind="full"/>
                    <Element Number="2" Name="ann" Kind="full"/>
                </AcResponse>
                """);
        assertEquals(Set.of("ann", "joe"), users);
    }

    @Test
    void testNormalizePath() {
        assertEquals("a/b.txt", AccuRevXml.normalizePath("/./a/b.txt"));
        assertEquals("a/b.txt", AccuRevXml.normalizePath("\\.\\a\\b.txt"));
        assertEquals("a.txt", AccuRevXml.normalizePath("./a.txt"));
        assertNull(AccuRevXml.normalizePath(null));
    }
}
