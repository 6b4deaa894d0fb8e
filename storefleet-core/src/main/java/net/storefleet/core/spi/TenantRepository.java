package net.storefleet.core.spi;

import net.storefleet.core.model.Platform;
import net.storefleet.core.model.Tenant;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface TenantRepository {
    /** PENDING 으로 생성. 도메인 unique 위반이면 empty */
    Optional<Tenant> insertPending(String domain, String email, Platform platform, String planCode,
                                   long serverId, Instant now) throws Exception;

    Optional<Tenant> findById(long id) throws Exception;

    Optional<Tenant> findByDomain(String domain) throws Exception;

    List<Tenant> findByStatus(Tenant.Status status) throws Exception;

    /** 해당 서버에 배치된 status 테넌트 */
    List<Tenant> findByStatusAndServer(Tenant.Status status, long serverId) throws Exception;

    /** 해당 서버의 ACTIVE 이면서 TLS 미적용 테넌트 */
    List<Tenant> findActiveWithoutTls(long serverId) throws Exception;

    /** 서버별 live 테넌트 수 (FAILED 제외) */
    Map<Long, Integer> countLiveByServer() throws Exception;

    /** PENDING/FAILED → PROVISIONING (서버 지정, 에러 초기화) */
    boolean markProvisioning(long id, long serverId, Instant now) throws Exception;

    /** FAILED 상태에서 재시도 대상 서버 변경 */
    boolean reassignServer(long id, long serverId, Instant now) throws Exception;

    /** 할당된 포트 기록 (PROVISIONING 중) */
    boolean assignPort(long id, long serverId, int port, Instant now) throws Exception;

    /** PROVISIONING → ACTIVE + 암호화된 자격 증명 저장 */
    boolean markActive(long id, String sealedCredentials, Instant now) throws Exception;

    /** expected → FAILED. 포트 기록은 지움 */
    boolean markFailed(long id, Tenant.Status expected, String errorMessage, Instant now) throws Exception;

    void setTlsEnabled(long id, boolean enabled, Instant now) throws Exception;

    /** ACTIVE → SUSPENDED */
    boolean suspend(long id, String reason, boolean automatic, Instant now) throws Exception;

    /** SUSPENDED → ACTIVE */
    boolean reactivate(long id, Instant now) throws Exception;

    boolean delete(long id) throws Exception;
}
