package io.github.depot2git.source.accurev;

import static org.junit.jupiter.api.Assertions.*;

import io.github.depot2git.TransientCommandException;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.StreamKind;
import io.github.depot2git.source.Transaction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
public class AccuRevCommandLineTest {

    @TempDir
    Path tempDir;

    /** Writes an executable shell script standing in for the accurev client. */
    private Path client(String body) throws Exception {
        var script = tempDir.resolve("accurev");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        assertTrue(script.toFile().setExecutable(true));
        return script;
    }

    /** A client answering each command line with the file named after its arguments, joined by underscores. */
    private Path cannedClient() throws Exception {
        var responses = tempDir.resolve("responses");
        Files.createDirectories(responses);
        return client("key=$(echo \"$*\" | tr ' ' '_')\n"
                + "if [ -f \"" + responses + "/$key\" ]; then cat \"" + responses + "/$key\"; "
                + "else echo '<AcResponse/>'; fi");
    }

    private void respond(String commandLine, String xml) throws Exception {
        Files.writeString(
                tempDir.resolve("responses").resolve(commandLine.replace(' ', '_')), xml, StandardCharsets.UTF_8);
    }

    @Test
    void testOutputIsParsed() throws Exception {
        var accurev = new AccuRevCommandLine(
                client("echo '<AcResponse><Element Number=\"1\" Name=\"Trunk\"/></AcResponse>'").toString(),
                Duration.ofSeconds(30));

        var depots = accurev.depots();

        assertEquals(1, depots.size());
        assertEquals("Trunk", depots.get(0).name());
    }

    @Test
    void testHungCommandTimesOut() throws Exception {
        var accurev = new AccuRevCommandLine(
                client("sleep 8\necho '<AcResponse/>'").toString(), Duration.ofMillis(500));

        long started = System.nanoTime();
        var e = assertThrows(TransientCommandException.class, accurev::depots);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        assertTrue(elapsedMillis < 3000, "took " + elapsedMillis + " ms");
    }

    @Test
    void testRejectedExitCodeIsTransient() throws Exception {
        var accurev = new AccuRevCommandLine(
                client("echo 'Not authenticated' >&2\nexit 2").toString(), Duration.ofSeconds(30));

        var e = assertThrows(TransientCommandException.class, accurev::users);

        assertTrue(e.getMessage().contains("exited with 2"), e.getMessage());
        assertTrue(e.getMessage().contains("Not authenticated"), e.getMessage());
    }

    @Test
    void testDeepHistoryCoversBasisBeforeReparenting() throws Exception {
        var accurev = new AccuRevCommandLine(cannedClient().toString(), Duration.ofSeconds(30));
        respond("show -p D -fixg -t 10 streams", """
                <streams>
                    <stream name="Root" depotName="D" streamNumber="1" type="normal"/>
                    <stream name="Old" basis="Root" basisStreamNumber="1" depotName="D" streamNumber="2" type="normal"/>
                    <stream name="Dev" basis="Other" basisStreamNumber="4"
                        depotName="D" streamNumber="3" type="normal"/>
                    <stream name="Other" basis="Root" basisStreamNumber="1"
                        depotName="D" streamNumber="4" type="normal"/>
                </streams>
                """);
        respond("show -p D -fixg -t 6 streams", """
                <streams>
                    <stream name="Root" depotName="D" streamNumber="1" type="normal"/>
                    <stream name="Old" basis="Root" basisStreamNumber="1" depotName="D" streamNumber="2" type="normal"/>
                    <stream name="Dev" basis="Old" basisStreamNumber="2" depotName="D" streamNumber="3" type="normal"/>
                    <stream name="Other" basis="Root" basisStreamNumber="1"
                        depotName="D" streamNumber="4" type="normal"/>
                </streams>
                """);
        respond("hist -p D -t 10-1 -k chstream -fevx", """
                <AcResponse>
                    <transaction id="7" type="chstream" time="1600000700"
                        user="admin" streamName="Dev" streamNumber="3"/>
                </AcResponse>
                """);
        respond("hist -p D -s Old -t 10-1 -fevx", """
                <AcResponse>
                    <transaction id="5" type="promote" time="1600000500" user="joe" streamName="Old" streamNumber="2"/>
                </AcResponse>
                """);
        respond("hist -p D -s Dev -t 10-1 -fevx", """
                <AcResponse>
                    <transaction id="8" type="keep" time="1600000800" user="joe" streamName="Dev" streamNumber="3"/>
                </AcResponse>
                """);
        respond("hist -p D -s Other -t 10-1 -fevx", """
                <AcResponse>
                    <transaction id="9" type="promote" time="1600000900"
                        user="ann" streamName="Other" streamNumber="4"/>
                </AcResponse>
                """);

        var dev = StreamInfo.of(3, "Dev", "D", StreamKind.NORMAL, 4, "Other");
        var history = accurev.deepHistory("D", dev, 0, 10);

        assertEquals(List.of(5L, 8L, 9L), history.stream().map(Transaction::id).toList());
    }
}
