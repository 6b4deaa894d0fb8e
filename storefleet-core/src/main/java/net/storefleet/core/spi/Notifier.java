package net.storefleet.core.spi;

import net.storefleet.core.model.HealthAlert;
import net.storefleet.core.model.ResourceAlert;
import net.storefleet.core.model.Tenant;

/** fire-and-forget 알림. 실패해도 호출 측 흐름을 되돌리지 않는다 */
public interface Notifier {
    record ReadyNotice(long tenantId, String email, String domain, String storeUrl, String adminUrl,
                       String adminUser, String temporaryPassword) {
        @Override
        public String toString() {
            return "ReadyNotice{tenantId=" + tenantId + ", domain='" + domain + "', adminUser='" + adminUser + "'}";
        }
    }

    void tenantReady(ReadyNotice notice) throws Exception;

    void resourceAlert(Tenant tenant, ResourceAlert alert) throws Exception;

    /** 스토어 다운/복구 */
    void healthAlert(Tenant tenant, HealthAlert alert) throws Exception;
}
