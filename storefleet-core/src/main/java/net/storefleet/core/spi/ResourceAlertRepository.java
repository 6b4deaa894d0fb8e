package net.storefleet.core.spi;

import net.storefleet.core.model.ResourceAlert;

import java.time.Instant;
import java.util.List;

public interface ResourceAlertRepository {
    /**
     * (tenant, kind) 쿨다운 선점. 마지막 발송이 sentBefore 이전이거나 기록이 없을 때만 true.
     * 원자적 조건부 갱신/삽입으로 동시 호출 중 하나만 이긴다.
     */
    boolean tryAcquireCooldown(long tenantId, ResourceAlert.Kind kind, Instant now, Instant sentBefore) throws Exception;

    ResourceAlert insert(ResourceAlert alert) throws Exception;

    List<ResourceAlert> findByTenant(long tenantId) throws Exception;
}
