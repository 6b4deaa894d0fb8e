package net.storefleet.adapter.host.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {

    final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void capturesOutputAndExitCode_stderrMerged() throws Exception {
        CommandResult r = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), Duration.ofSeconds(10));
        assertEquals(3, r.exitCode());
        assertFalse(r.timedOut());
        assertFalse(r.ok());
        assertTrue(r.output().contains("out"));
        assertTrue(r.output().contains("err"));
    }

    @Test
    void runsInWorkDir(@TempDir Path dir) throws Exception {
        CommandResult r = runner.run(List.of("pwd"), dir, Duration.ofSeconds(10));
        assertTrue(r.ok());
        assertEquals(dir.toRealPath().toString(), r.output().strip());
    }

    @Test
    void timeout_killsProcess() throws Exception {
        long start = System.nanoTime();
        CommandResult r = runner.run(List.of("sleep", "30"), Duration.ofMillis(200));
        assertTrue(r.timedOut());
        assertEquals(CommandResult.TIMEOUT_EXIT, r.exitCode());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
    }

    @Test
    void emptyCommand_rejected() {
        assertThrows(IllegalArgumentException.class, () -> runner.run(List.of(), Duration.ofSeconds(1)));
    }

    @Test
    void tail_keepsEnd() {
        CommandResult r = new CommandResult(1, "  abcdefghij \n", false);
        assertEquals("hij", r.tail(3));
        assertEquals("abcdefghij", r.tail(100));
    }
}
