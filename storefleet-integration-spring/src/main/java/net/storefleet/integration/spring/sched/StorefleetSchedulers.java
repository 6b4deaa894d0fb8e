package net.storefleet.integration.spring.sched;

import net.storefleet.core.certificates.CertificateRenewalService;
import net.storefleet.core.fleet.HeartbeatService;
import net.storefleet.core.maintenance.MaintenanceService;
import net.storefleet.core.monitoring.TenantHealthMonitor;
import net.storefleet.core.queue.ProvisioningWorker;
import net.storefleet.core.quota.QuotaMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/**
 * 워커 프로세스의 주기 루프. 각 루프는 독립적으로 실패하고 다음 주기에 다시 돈다.
 */
public class StorefleetSchedulers {
    private static final Logger log = LoggerFactory.getLogger(StorefleetSchedulers.class);

    private final WorkerIdentity identity;
    private final HeartbeatService heartbeat;
    private final ProvisioningWorker worker;
    private final QuotaMonitor quota;
    private final TenantHealthMonitor health;
    private final MaintenanceService maintenance;
    private final CertificateRenewalService certificates;

    private Duration dequeueWait = Duration.ofSeconds(5);
    private Duration staleJobAfter = Duration.ofMinutes(30);
    private Duration offlineAfter = Duration.ofMinutes(15);
    private Duration logRetention = Duration.ofDays(30);

    public StorefleetSchedulers(WorkerIdentity identity,
                                HeartbeatService heartbeat,
                                ProvisioningWorker worker,
                                QuotaMonitor quota,
                                TenantHealthMonitor health,
                                MaintenanceService maintenance,
                                CertificateRenewalService certificates) {
        this.identity = identity;
        this.heartbeat = heartbeat;
        this.worker = worker;
        this.quota = quota;
        this.health = health;
        this.maintenance = maintenance;
        this.certificates = certificates;
    }

    @Scheduled(fixedDelayString = "${storefleet.scheduler.heartbeat-delay-ms:30000}")
    public void heartbeat() {
        if (!identity.isBound()) return;
        try {
            if (!heartbeat.beat(identity.context().serverId())) {
                log.warn("heartbeat rejected: server {} not found", identity.context().serverId());
            }
        } catch (Exception e) {
            log.error("heartbeat loop failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${storefleet.scheduler.worker-delay-ms:1000}")
    public void work() {
        if (!identity.isBound()) return;
        try {
            worker.runOnce(identity.context(), dequeueWait);
        } catch (Exception e) {
            log.error("worker loop failed ({})", identity.context(), e);
        }
    }

    @Scheduled(fixedDelayString = "${storefleet.scheduler.quota-delay-ms:3600000}",
               initialDelayString = "${storefleet.scheduler.quota-initial-delay-ms:60000}")
    public void quota() {
        if (!identity.isBound()) return;
        try {
            var r = quota.runCycle(identity.context().serverId());
            log.info("quota cycle: sampled={} failed={} alerts={}", r.sampled(), r.failed(), r.alertsRaised().size());
        } catch (Exception e) {
            log.error("quota loop failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${storefleet.scheduler.health-delay-ms:60000}",
               initialDelayString = "${storefleet.scheduler.health-initial-delay-ms:30000}")
    public void health() {
        if (!identity.isBound()) return;
        try {
            health.runCycle(identity.context().serverId());
        } catch (Exception e) {
            log.error("health loop failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${storefleet.scheduler.certificate-delay-ms:3600000}",
               initialDelayString = "${storefleet.scheduler.certificate-initial-delay-ms:120000}")
    public void certificates() {
        if (!identity.isBound()) return;
        try {
            certificates.retryPending(identity.context().serverId());
        } catch (Exception e) {
            log.error("certificate loop failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${storefleet.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() {
        try {
            maintenance.runOnce(staleJobAfter, offlineAfter, logRetention);
        } catch (Exception e) {
            log.error("maintenance loop failed", e);
        }
    }

    public void setDequeueWait(Duration dequeueWait) {
        this.dequeueWait = dequeueWait;
    }

    public void setStaleJobAfter(Duration staleJobAfter) {
        this.staleJobAfter = staleJobAfter;
    }

    public void setOfflineAfter(Duration offlineAfter) {
        this.offlineAfter = offlineAfter;
    }

    public void setLogRetention(Duration logRetention) {
        this.logRetention = logRetention;
    }
}
