package net.storefleet.adapter.host.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.storefleet.adapter.host.process.CommandResult;
import net.storefleet.adapter.host.process.CommandRunner;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.pipeline.EnvironmentRenderer;
import net.storefleet.core.spi.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * docker compose v2 CLI 기반 런타임. 프로젝트 이름은 워크스페이스 디렉터리 이름(customer-{id}).
 */
public final class DockerComposeRuntime implements ContainerRuntime {
    private static final Logger log = LoggerFactory.getLogger(DockerComposeRuntime.class);

    public record Timeouts(Duration up, Duration down, Duration inspect) {
        public static Timeouts defaults() {
            return new Timeouts(Duration.ofMinutes(5), Duration.ofMinutes(2), Duration.ofSeconds(10));
        }
    }

    private final CommandRunner runner;
    private final Timeouts timeouts;
    private final ObjectMapper om = new ObjectMapper();

    public DockerComposeRuntime(CommandRunner runner, Timeouts timeouts) {
        this.runner = runner;
        this.timeouts = timeouts;
    }

    @Override
    public void up(Path workspace) throws Exception {
        Path def = definition(workspace);
        if (!Files.exists(def)) {
            throw new InfrastructureException("environment definition missing: " + def);
        }
        exec(workspace, timeouts.up(), "up", "-d");
    }

    @Override
    public void down(Path workspace) throws Exception {
        // 정의 파일이 없어도 프로젝트 이름만으로 내린다 (없는 프로젝트는 no-op)
        exec(workspace, timeouts.down(), "down", "-v", "--remove-orphans");
    }

    @Override
    public void stop(Path workspace) throws Exception {
        exec(workspace, timeouts.down(), "stop");
    }

    @Override
    public void start(Path workspace) throws Exception {
        exec(workspace, timeouts.up(), "start");
    }

    @Override
    public Health health(Path workspace) throws Exception {
        CommandResult r = runner.run(compose(workspace, "ps", "-a", "--format", "json"), workspace(workspace),
                timeouts.inspect());
        if (!r.ok()) {
            throw new InfrastructureException("compose ps failed (" + r.exitCode() + "): " + r.tail(300));
        }
        return summarize(parseContainers(r.output()));
    }

    /** compose 버전에 따라 JSON 배열 또는 줄 단위 객체(NDJSON) */
    List<JsonNode> parseContainers(String output) throws Exception {
        List<JsonNode> out = new ArrayList<>();
        String s = output == null ? "" : output.strip();
        if (s.isEmpty()) return out;
        if (s.startsWith("[")) {
            om.readTree(s).forEach(out::add);
            return out;
        }
        for (String line : s.split("\\R")) {
            if (line.isBlank() || !line.strip().startsWith("{")) continue;
            out.add(om.readTree(line));
        }
        return out;
    }

    static Health summarize(List<JsonNode> containers) {
        if (containers.isEmpty()) return Health.ABSENT;
        boolean allReady = true;
        for (JsonNode c : containers) {
            String state = c.path("State").asText("").toLowerCase(Locale.ROOT);
            String health = c.path("Health").asText("").toLowerCase(Locale.ROOT);
            if (state.equals("exited") || state.equals("dead")) return Health.EXITED;
            if (!state.equals("running")) allReady = false;
            else if (!health.isEmpty() && !health.equals("healthy")) allReady = false;
        }
        return allReady ? Health.RUNNING : Health.STARTING;
    }

    private void exec(Path workspace, Duration timeout, String... args) throws Exception {
        List<String> cmd = compose(workspace, args);
        CommandResult r = runner.run(cmd, workspace(workspace), timeout);
        if (r.timedOut()) {
            throw new InfrastructureException("compose " + args[0] + " timed out after " + timeout);
        }
        if (r.exitCode() != 0) {
            throw new InfrastructureException("compose " + args[0] + " failed (" + r.exitCode() + "): " + r.tail(500));
        }
        log.info("compose {} ok: {}", args[0], project(workspace));
    }

    List<String> compose(Path workspace, String... args) {
        List<String> cmd = new ArrayList<>(List.of("docker", "compose", "-p", project(workspace)));
        Path def = definition(workspace);
        if (Files.exists(def)) {
            cmd.add("-f");
            cmd.add(def.toString());
        }
        cmd.addAll(List.of(args));
        return cmd;
    }

    private static Path workspace(Path workspace) {
        return Files.isDirectory(workspace) ? workspace : null;
    }

    static String project(Path workspace) {
        return workspace.getFileName().toString();
    }

    private static Path definition(Path workspace) {
        return workspace.resolve(EnvironmentRenderer.DEFINITION_FILE);
    }
}
