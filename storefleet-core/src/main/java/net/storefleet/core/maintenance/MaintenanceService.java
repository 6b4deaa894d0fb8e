package net.storefleet.core.maintenance;

import net.storefleet.core.error.ErrorKind;
import net.storefleet.core.model.ProvisioningJob;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ProvisioningJobRepository;
import net.storefleet.core.spi.ProvisioningLogRepository;
import net.storefleet.core.spi.ServerRepository;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final ProvisioningJobRepository jobs;
    private final TenantRepository tenants;
    private final ServerRepository servers;
    private final ProvisioningLogRepository logs;
    private final TxRunner tx;
    private final Clock clock;

    public static final String WORKER_LOST_REASON = "worker stopped updating the job, reset by maintenance";

    public MaintenanceService(ProvisioningJobRepository jobs,
                              TenantRepository tenants,
                              ServerRepository servers,
                              ProvisioningLogRepository logs,
                              TxRunner tx,
                              Clock clock) {
        this.jobs = jobs;
        this.tenants = tenants;
        this.servers = servers;
        this.logs = logs;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 오래 갱신되지 않은 RUNNING 잡 → FAILED(WORKER_LOST), 테넌트도 FAILED 로 (재시도 가능)
     * - 하트비트가 끊긴 ACTIVE 서버 → OFFLINE (삭제하지 않음)
     * - 보존 기간 지난 프로비저닝 로그 삭제(선택)
     */
    public MaintenanceReport runOnce(Duration staleJobAfter,
                                     Duration offlineAfter,
                                     Duration logRetention) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        // 1) 워커가 죽어 RUNNING 에 멈춘 잡 회수
        List<ProvisioningJob> stale = tx.required(() -> jobs.findStaleRunning(now.minus(staleJobAfter)));
        for (ProvisioningJob job : stale) {
            var error = new ProvisioningJob.JobError(ErrorKind.WORKER_LOST, job.stepName(), WORKER_LOST_REASON);
            boolean reset = tx.required(() -> {
                if (!jobs.markFailed(job.id(), error, now)) return false;
                if (tenants.markFailed(job.tenantId(), Tenant.Status.PROVISIONING, error.summary(), now)) {
                    r.failedTenants++;
                }
                return true;
            });
            if (reset) {
                r.resetJobs++;
                log.warn("job {} (tenant {}) stuck at step '{}' since {}, reset to FAILED",
                        job.id(), job.tenantId(), job.stepName(), job.updatedAt());
            }
        }

        // 2) 조용한 서버 OFFLINE
        if (offlineAfter != null) {
            r.offlineServers = tx.required(() -> servers.markOfflineSilentSince(now.minus(offlineAfter), now));
        }

        // 3) 로그 보존 (TTL 지난 것)
        if (logRetention != null && !logRetention.isZero() && !logRetention.isNegative()) {
            Instant threshold = now.minus(logRetention);
            r.prunedLogs = tx.required(() -> logs.deleteOlderThan(threshold));
        }

        r.timestamp = now;
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int resetJobs;
        public int failedTenants;
        public int offlineServers;
        public int prunedLogs;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", resetJobs=" + resetJobs +
                    ", failedTenants=" + failedTenants +
                    ", offlineServers=" + offlineServers +
                    ", prunedLogs=" + prunedLogs +
                    '}';
        }
    }
}
