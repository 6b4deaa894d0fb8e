package net.storefleet.core.spi;

public interface CertificateIssuer {
    /** 도메인 검증(ACME) 방식 발급. 성공하면 해당 라우트에 TLS 가 활성화된다 */
    void issue(long tenantId, String domain) throws Exception;
}
