package net.storefleet.app.api.dto;

import net.storefleet.core.model.Tenant;

import java.time.Instant;

/** 밀봉된 자격 증명은 내보내지 않는다 */
public record TenantView(
        long id,
        String domain,
        String email,
        String platform,
        String plan,
        String status,
        Long serverId,
        Integer webPort,
        boolean tlsEnabled,
        String storeUrl,
        String suspensionReason,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt
) {
    public static TenantView of(Tenant t) {
        return new TenantView(t.id(), t.domain(), t.email(), t.platform().name(), t.planCode(),
                t.status().code(), t.serverId(), t.webPort(), t.tlsEnabled(), t.storeUrl(),
                t.suspensionReason(), t.errorMessage(), t.createdAt(), t.updatedAt());
    }
}
