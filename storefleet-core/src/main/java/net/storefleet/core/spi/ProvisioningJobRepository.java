package net.storefleet.core.spi;

import net.storefleet.core.model.ProvisioningJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ProvisioningJobRepository {
    /** QUEUED 로 적재. 테넌트에 in-flight 잡이 있으면 (unique 위반) empty */
    Optional<ProvisioningJob> insertQueued(long tenantId, long serverId, int attempt, Instant now) throws Exception;

    Optional<ProvisioningJob> findById(long id) throws Exception;

    Optional<ProvisioningJob> findInFlight(long tenantId) throws Exception;

    List<ProvisioningJob> findByTenant(long tenantId) throws Exception;

    int countByTenant(long tenantId) throws Exception;

    /** 서버 큐에서 가장 오래된 QUEUED 하나를 RUNNING 으로 선점 */
    Optional<ProvisioningJob> claimNext(long serverId, Instant now) throws Exception;

    /** RUNNING 잡의 스텝 커서 전진 */
    boolean advance(long id, int stepCursor, String stepName, Instant now) throws Exception;

    boolean markSucceeded(long id, Instant now) throws Exception;

    /** in-flight → FAILED. 이미 종료된 잡은 건드리지 않음 */
    boolean markFailed(long id, ProvisioningJob.JobError error, Instant now) throws Exception;

    /** UPDATED_AT 이 threshold 이전인 RUNNING 잡 */
    List<ProvisioningJob> findStaleRunning(Instant threshold) throws Exception;
}
