package net.storefleet.core.queue;

import net.storefleet.core.error.AlreadyInFlightException;
import net.storefleet.core.model.ProvisioningJob;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ProvisioningJobRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 서버별 논리 큐. 영속 잡 테이블 위에서 동작한다.
 * in-flight 유일성은 저장소 unique 제약(INFLIGHT_TENANT_ID)으로 보장.
 */
public final class JobDispatchService {
    private static final Logger log = LoggerFactory.getLogger(JobDispatchService.class);

    private final ProvisioningJobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final Duration pollInterval;

    public JobDispatchService(ProvisioningJobRepository jobs, TxRunner tx, Clock clock, Duration pollInterval) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    /** 테넌트에 QUEUED/RUNNING 잡이 있으면 적재하지 않고 거부 */
    public long enqueue(long tenantId, long serverId) throws Exception {
        int attempt = tx.required(() -> jobs.countByTenant(tenantId)) + 1;
        Optional<ProvisioningJob> created =
                tx.requiresNew(() -> jobs.insertQueued(tenantId, serverId, attempt, clock.now()));
        if (created.isEmpty()) {
            Long existing = tx.required(() -> jobs.findInFlight(tenantId)).map(ProvisioningJob::id).orElse(null);
            throw new AlreadyInFlightException(tenantId, existing);
        }
        long jobId = created.get().id();
        log.info("job {} enqueued: tenant={} server={} attempt={}", jobId, tenantId, serverId, attempt);
        return jobId;
    }

    /** 해당 서버 큐에서 하나를 선점. maxWait 동안 pollInterval 간격으로 대기 */
    public Optional<ProvisioningJob> dequeue(long serverId, Duration maxWait) throws Exception {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            Optional<ProvisioningJob> claimed = tx.requiresNew(() -> jobs.claimNext(serverId, clock.now()));
            if (claimed.isPresent()) {
                log.info("job {} claimed by server {}", claimed.get().id(), serverId);
                return claimed;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return Optional.empty();
            Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), Duration.ofNanos(remaining).toMillis())));
        }
    }

    public boolean markStep(long jobId, int stepCursor, String stepName) throws Exception {
        return tx.required(() -> jobs.advance(jobId, stepCursor, stepName, clock.now()));
    }

    public boolean succeed(long jobId) throws Exception {
        return tx.required(() -> jobs.markSucceeded(jobId, clock.now()));
    }

    public boolean fail(long jobId, ProvisioningJob.JobError error) throws Exception {
        return tx.required(() -> jobs.markFailed(jobId, error, clock.now()));
    }

    public Optional<ProvisioningJob> find(long jobId) throws Exception {
        return tx.required(() -> jobs.findById(jobId));
    }

    public Optional<ProvisioningJob> inFlight(long tenantId) throws Exception {
        return tx.required(() -> jobs.findInFlight(tenantId));
    }
}
