package net.storefleet.core.spi;

import net.storefleet.core.model.HealthAlert;
import net.storefleet.core.model.TenantHealth;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TenantHealthRepository {
    Optional<TenantHealth> find(long tenantId) throws Exception;

    /** DOWN 으로 기록하고 갱신된 연속 실패 수를 돌려준다 */
    int recordFailure(long tenantId, Instant now) throws Exception;

    /** UP 으로 기록하고 초기화 직전의 연속 실패 수를 돌려준다 */
    int recordSuccess(long tenantId, Instant now) throws Exception;

    /** 마지막 경보가 sentBefore 이전이거나 없을 때만 선점하고 true */
    boolean tryMarkAlerted(long tenantId, Instant now, Instant sentBefore) throws Exception;

    HealthAlert insertAlert(HealthAlert alert) throws Exception;

    List<HealthAlert> findAlerts(long tenantId) throws Exception;
}
