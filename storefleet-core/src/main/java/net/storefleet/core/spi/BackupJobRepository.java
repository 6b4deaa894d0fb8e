package net.storefleet.core.spi;

import net.storefleet.core.model.BackupJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BackupJobRepository {
    BackupJob insertRunning(long tenantId, BackupJob.Kind kind, BackupJob.Scope scope, Instant now) throws Exception;

    void markCompleted(long id, String snapshotId, Instant now) throws Exception;

    void markFailed(long id, String errorMessage, Instant now) throws Exception;

    Optional<BackupJob> findById(long id) throws Exception;

    List<BackupJob> findByTenant(long tenantId) throws Exception;
}
