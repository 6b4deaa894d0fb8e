package net.storefleet.core.backup;

import net.storefleet.core.error.StepFailedException;
import net.storefleet.core.error.TenantValidationException;
import net.storefleet.core.model.BackupJob;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.BackupJobRepository;
import net.storefleet.core.spi.BackupTool;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** 외부 백업 도구 호출과 그 이력(BackupJob) 기록 */
public final class BackupService {
    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    private final TenantRepository tenants;
    private final BackupJobRepository backups;
    private final BackupTool tool;
    private final TxRunner tx;
    private final Clock clock;

    public BackupService(TenantRepository tenants, BackupJobRepository backups, BackupTool tool,
                         TxRunner tx, Clock clock) {
        this.tenants = tenants;
        this.backups = backups;
        this.tool = tool;
        this.tx = tx;
        this.clock = clock;
    }

    /** @return 스냅샷 식별자 */
    public String backup(long tenantId, BackupJob.Scope scope) throws Exception {
        requireEnvironment(tenantId);
        BackupJob job = tx.required(() -> backups.insertRunning(tenantId, BackupJob.Kind.BACKUP, scope, clock.now()));
        try {
            String snapshot = tool.backup(tenantId, scope);
            tx.required(() -> backups.markCompleted(job.id(), snapshot, clock.now()));
            log.info("tenant {} backup ({}) completed: snapshot {}", tenantId, scope.arg(), snapshot);
            return snapshot;
        } catch (Exception e) {
            recordFailure(job, e);
            throw new StepFailedException("backup failed for tenant " + tenantId + ": " + e.getMessage(), e);
        }
    }

    public void restore(long tenantId, String snapshotId, BackupJob.Scope scope) throws Exception {
        if (snapshotId == null || snapshotId.isBlank()) {
            throw new TenantValidationException("snapshot id is required");
        }
        requireEnvironment(tenantId);
        BackupJob job = tx.required(() -> backups.insertRunning(tenantId, BackupJob.Kind.RESTORE, scope, clock.now()));
        try {
            tool.restore(tenantId, snapshotId, scope);
            tx.required(() -> backups.markCompleted(job.id(), snapshotId, clock.now()));
            log.info("tenant {} restored from snapshot {} ({})", tenantId, snapshotId, scope.arg());
        } catch (Exception e) {
            recordFailure(job, e);
            throw new StepFailedException("restore failed for tenant " + tenantId + ": " + e.getMessage(), e);
        }
    }

    public List<BackupJob> history(long tenantId) throws Exception {
        return tx.required(() -> backups.findByTenant(tenantId));
    }

    private void recordFailure(BackupJob job, Exception cause) throws Exception {
        if (cause instanceof InterruptedException) Thread.currentThread().interrupt();
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        log.error("backup job {} ({}) for tenant {} failed: {}", job.id(), job.kind(), job.tenantId(), message);
        tx.required(() -> backups.markFailed(job.id(), message, clock.now()));
    }

    /** 환경(볼륨)이 있는 상태에서만 */
    private void requireEnvironment(long tenantId) throws Exception {
        Tenant t = tx.required(() -> tenants.findById(tenantId))
                .orElseThrow(() -> new TenantValidationException("unknown tenant: " + tenantId));
        if (t.status() != Tenant.Status.ACTIVE && t.status() != Tenant.Status.SUSPENDED) {
            throw new TenantValidationException("tenant " + tenantId + " is " + t.status() + ", no environment to back up");
        }
    }
}
