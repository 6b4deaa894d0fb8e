package net.storefleet.core.spi;

import java.nio.file.Path;

/**
 * 테넌트 워크스페이스에 렌더링된 환경 정의(compose)를 구동하는 런타임.
 * 모든 연산은 멱등: 존재하지 않는 환경을 내리는 것은 no-op.
 */
public interface ContainerRuntime {
    enum Health { RUNNING, STARTING, EXITED, ABSENT }

    void up(Path workspace) throws Exception;

    /** 컨테이너 + 볼륨 제거 */
    void down(Path workspace) throws Exception;

    /** 볼륨은 유지한 채 정지 (suspend) */
    void stop(Path workspace) throws Exception;

    void start(Path workspace) throws Exception;

    Health health(Path workspace) throws Exception;
}
