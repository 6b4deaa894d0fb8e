package net.storefleet.core.error;

import java.util.Locale;

public enum ErrorKind {
    /** 포트/용량 소진. 운영자 조치 대상이며 테넌트 책임이 아님 */
    RESOURCE_EXHAUSTED,
    /** 컨테이너 런타임, 프록시 reload 등 재시도 가능한 인프라 실패 */
    TRANSIENT_INFRASTRUCTURE,
    /** 인입 단계에서 거부 (도메인 형식, 중복 등) */
    VALIDATION,
    /** 헬스 확인 실패 등 롤백을 유발하는 파이프라인 실패 */
    TERMINAL_PIPELINE,
    /** 인증서 발급, 알림 전송. 로그만 남김 */
    BEST_EFFORT,
    /** 워커 크래시로 RUNNING 에 남은 잡을 정리한 경우 */
    WORKER_LOST;

    public static ErrorKind from(String s) {
        if (s == null) return null;
        try { return ErrorKind.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return null; }
    }
}
