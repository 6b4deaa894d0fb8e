package net.storefleet.core.spi;

public interface ReverseProxy {
    record Route(long tenantId, String domain, int port) { }

    /**
     * 테넌트 라우트를 쓰고 문법 검사 후에만 활성화한다.
     * 검사 실패 시 이전 상태로 되돌리고 InfrastructureException.
     */
    void apply(Route route) throws Exception;

    /** 멱등 제거 */
    void remove(long tenantId) throws Exception;

    boolean isActive(long tenantId) throws Exception;
}
