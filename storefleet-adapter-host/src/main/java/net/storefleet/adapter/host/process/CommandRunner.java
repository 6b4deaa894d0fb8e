package net.storefleet.adapter.host.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 호스트 명령 실행 포트. 어댑터 테스트에서는 기록용 구현으로 대체한다.
 * 셸을 거치지 않으므로 인자는 그대로 전달된다.
 */
public interface CommandRunner {
    CommandResult run(List<String> command, Path workDir, Duration timeout) throws Exception;

    default CommandResult run(List<String> command, Duration timeout) throws Exception {
        return run(command, null, timeout);
    }
}
