package net.storefleet.adapter.host.notify;

import net.storefleet.core.model.HealthAlert;
import net.storefleet.core.model.ResourceAlert;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 웹훅 주소가 없을 때의 기본 구현. 비밀번호는 남기지 않는다 */
public final class LogOnlyNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LogOnlyNotifier.class);

    @Override
    public void tenantReady(ReadyNotice notice) {
        log.info("tenant ready (no webhook configured): {} store={} admin={}",
                notice, notice.storeUrl(), notice.adminUrl());
    }

    @Override
    public void resourceAlert(Tenant tenant, ResourceAlert alert) {
        log.warn("resource alert (no webhook configured): tenant={} domain={} alert={}",
                tenant.id(), tenant.domain(), alert);
    }

    @Override
    public void healthAlert(Tenant tenant, HealthAlert alert) {
        log.warn("health alert (no webhook configured): tenant={} domain={} kind={} detail={}",
                tenant.id(), tenant.domain(), alert.kind(), alert.detail());
    }
}
