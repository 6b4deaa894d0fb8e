package net.storefleet.core.spi;

import net.storefleet.core.model.BackupJob;

/** 외부 백업/복원 도구. 저장 포맷은 해석하지 않는다 */
public interface BackupTool {
    /** @return 스냅샷 식별자 */
    String backup(long tenantId, BackupJob.Scope scope) throws Exception;

    void restore(long tenantId, String snapshotId, BackupJob.Scope scope) throws Exception;
}
