package net.storefleet.adapter.host.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * ProcessBuilder 기반 구현. 출력은 별도 스레드에서 끝까지 읽어 파이프가 막히지 않게 한다.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Path workDir, Duration timeout) throws Exception {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must contain at least the program");
        }
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        if (workDir != null) pb.directory(workDir.toFile());

        log.debug("exec {} (timeout={})", command, timeout);
        Process p = pb.start();
        CompletableFuture<String> out = CompletableFuture.supplyAsync(() -> drain(p.getInputStream()));

        boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
            log.warn("command timed out after {}: {}", timeout, command.get(0));
            return CommandResult.timeout(collect(out));
        }
        return new CommandResult(p.exitValue(), collect(out), false);
    }

    private static String drain(InputStream in) {
        try (in) {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            in.transferTo(buf);
            return buf.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            // 강제 종료로 스트림이 닫히면 여기로 온다
            return "";
        }
    }

    private static String collect(CompletableFuture<String> out) throws InterruptedException {
        try {
            return out.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | java.util.concurrent.TimeoutException e) {
            log.debug("output not collected: {}", e.toString());
            return "";
        }
    }
}
