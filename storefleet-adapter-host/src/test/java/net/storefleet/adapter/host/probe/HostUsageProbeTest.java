package net.storefleet.adapter.host.probe;

import net.storefleet.adapter.host.process.RecordingCommandRunner;
import net.storefleet.core.error.InfrastructureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static net.storefleet.adapter.host.process.RecordingCommandRunner.fail;
import static net.storefleet.adapter.host.process.RecordingCommandRunner.ok;
import static org.junit.jupiter.api.Assertions.*;

class HostUsageProbeTest {

    @TempDir
    Path tmp;

    private HostUsageProbe probe(RecordingCommandRunner runner, boolean projectQuota) {
        return new HostUsageProbe(runner, new HostUsageProbe.Settings(projectQuota, "/", tmp, Duration.ofSeconds(30)));
    }

    @Test
    void disk_prefersProjectQuota_inKilobytes() throws Exception {
        Path ws = Files.createDirectories(tmp.resolve("customer-42"));
        var runner = new RecordingCommandRunner().respond(cmd -> ok("""
                Project,BlockStatus,BlockUsed,BlockSoft
                #4,ok,10,0
                #42,ok,2048,0
                """));
        assertEquals(2048L * 1024, probe(runner, true).diskBytes(42, ws));
        assertFalse(runner.ran("du"));
    }

    @Test
    void disk_fallsBackToDu_whenProjectMissing() throws Exception {
        Path ws = Files.createDirectories(tmp.resolve("customer-9"));
        var runner = new RecordingCommandRunner().respond(cmd -> cmd.get(0).equals("repquota")
                ? ok("#1,ok,5,0\n")
                : ok("123456\t" + ws + "\n"));
        assertEquals(123456L, probe(runner, true).diskBytes(9, ws));
        assertTrue(runner.ran("du", "-sb"));
    }

    @Test
    void disk_duFailure_propagates_missingWorkspaceIsZero() throws Exception {
        Path ws = Files.createDirectories(tmp.resolve("customer-1"));
        var runner = new RecordingCommandRunner().respond(cmd -> fail(1, "du: cannot read directory"));
        assertThrows(InfrastructureException.class, () -> probe(runner, false).diskBytes(1, ws));
        assertEquals(0, probe(runner, false).diskBytes(2, tmp.resolve("customer-2")));
    }

    @Test
    void bandwidth_sumsBytesSinceBillingStart() throws Exception {
        Files.writeString(tmp.resolve("customer-5-access.log"), """
                1.2.3.4 - - [28/Feb/2026:23:59:59 +0000] "GET / HTTP/1.1" 200 9999 "-" "curl/8"
                1.2.3.4 - - [01/Mar/2026:00:00:00 +0000] "GET / HTTP/1.1" 200 1000 "-" "curl/8"
                1.2.3.4 - - [10/Mar/2026:08:00:00 +0100] "GET /a HTTP/1.1" 304 - "-" "curl/8"
                garbage line
                5.6.7.8 - - [10/Mar/2026:08:00:00 +0100] "POST /cart HTTP/1.1" 201 250 "https://x/" "Mozilla/5.0 (X11)"
                """);
        long bytes = probe(new RecordingCommandRunner(), false)
                .bandwidthBytes(5, Instant.parse("2026-03-01T00:00:00Z"));
        assertEquals(1250, bytes);
        assertEquals(0, probe(new RecordingCommandRunner(), false).bandwidthBytes(6, Instant.EPOCH));
    }
}
