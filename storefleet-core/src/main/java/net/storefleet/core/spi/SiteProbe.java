package net.storefleet.core.spi;

/** 테넌트 스토어 도메인이 HTTP 로 응답하는지 */
public interface SiteProbe {
    /** 5xx 가 아닌 응답이면 true. 연결 실패/타임아웃은 false */
    boolean responds(String domain);
}
