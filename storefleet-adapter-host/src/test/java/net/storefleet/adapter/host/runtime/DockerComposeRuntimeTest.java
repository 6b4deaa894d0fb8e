package net.storefleet.adapter.host.runtime;

import net.storefleet.adapter.host.process.RecordingCommandRunner;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.pipeline.EnvironmentRenderer;
import net.storefleet.core.spi.ContainerRuntime.Health;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static net.storefleet.adapter.host.process.RecordingCommandRunner.fail;
import static net.storefleet.adapter.host.process.RecordingCommandRunner.ok;
import static org.junit.jupiter.api.Assertions.*;

class DockerComposeRuntimeTest {

    @TempDir
    Path root;
    Path ws;
    RecordingCommandRunner runner;
    DockerComposeRuntime runtime;

    @BeforeEach
    void setUp() throws Exception {
        ws = Files.createDirectories(root.resolve("customer-7"));
        runner = new RecordingCommandRunner();
        runtime = new DockerComposeRuntime(runner, DockerComposeRuntime.Timeouts.defaults());
    }

    private void writeDefinition() throws Exception {
        Files.writeString(ws.resolve(EnvironmentRenderer.DEFINITION_FILE), "services: {}\n");
    }

    @Test
    void up_requiresDefinition_andUsesProjectName() throws Exception {
        assertThrows(InfrastructureException.class, () -> runtime.up(ws));
        assertTrue(runner.calls.isEmpty());

        writeDefinition();
        runtime.up(ws);
        assertEquals(List.of("docker", "compose", "-p", "customer-7", "-f",
                ws.resolve("docker-compose.yml").toString(), "up", "-d"), runner.last());
    }

    @Test
    void down_worksWithoutDefinition_removesVolumes() throws Exception {
        runtime.down(ws);
        assertEquals(List.of("docker", "compose", "-p", "customer-7", "down", "-v", "--remove-orphans"), runner.last());
    }

    @Test
    void nonZeroExit_becomesInfrastructureFailure() throws Exception {
        writeDefinition();
        runner.respond(cmd -> fail(1, "Error response from daemon: port is already allocated"));
        InfrastructureException ex = assertThrows(InfrastructureException.class, () -> runtime.up(ws));
        assertTrue(ex.getMessage().contains("port is already allocated"));
    }

    @Test
    void health_fromNdjson() throws Exception {
        runner.respond(cmd -> ok("""
                {"Name":"customer-7-web","State":"running","Health":""}
                {"Name":"customer-7-db","State":"running","Health":"healthy"}
                """));
        assertEquals(Health.RUNNING, runtime.health(ws));

        runner.respond(cmd -> ok("""
                {"Name":"customer-7-web","State":"running","Health":"starting"}
                {"Name":"customer-7-db","State":"running","Health":"healthy"}
                """));
        assertEquals(Health.STARTING, runtime.health(ws));
    }

    @Test
    void health_fromJsonArray_exitedWins() throws Exception {
        runner.respond(cmd -> ok("""
                [{"Name":"customer-7-web","State":"exited"},{"Name":"customer-7-db","State":"running"}]
                """));
        assertEquals(Health.EXITED, runtime.health(ws));
    }

    @Test
    void health_noContainers_absent() throws Exception {
        runner.respond(cmd -> ok(""));
        assertEquals(Health.ABSENT, runtime.health(ws));
        runner.respond(cmd -> ok("[]"));
        assertEquals(Health.ABSENT, runtime.health(ws));
    }

    @Test
    void health_created_isStarting() throws Exception {
        runner.respond(cmd -> ok("{\"Name\":\"customer-7-web\",\"State\":\"created\"}"));
        assertEquals(Health.STARTING, runtime.health(ws));
    }

    @Test
    void health_upperCaseStates_underTurkishLocale() throws Exception {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            runner.respond(cmd -> ok("{\"Name\":\"customer-7-web\",\"State\":\"RUNNING\",\"Health\":\"HEALTHY\"}"));
            assertEquals(Health.RUNNING, runtime.health(ws));
        } finally {
            Locale.setDefault(saved);
        }
    }
}
