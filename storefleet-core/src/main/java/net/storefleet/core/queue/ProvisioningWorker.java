package net.storefleet.core.queue;

import net.storefleet.core.allocator.PlanCatalog;
import net.storefleet.core.error.ErrorKind;
import net.storefleet.core.error.ProvisioningException;
import net.storefleet.core.model.PlanTier;
import net.storefleet.core.model.ProvisioningJob;
import net.storefleet.core.model.Server;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineReport;
import net.storefleet.core.pipeline.ProvisioningPipeline;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ServerRepository;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 서버 하나의 큐를 소비하는 워커.
 * 한 번에 한 잡만 실행하며, 상태는 호출 측이 넘겨주는 WorkerContext 에만 남긴다.
 */
public final class ProvisioningWorker {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningWorker.class);

    private final JobDispatchService dispatch;
    private final TenantRepository tenants;
    private final ServerRepository servers;
    private final PlanCatalog plans;
    private final ProvisioningPipeline pipeline;
    private final TxRunner tx;
    private final Clock clock;

    public ProvisioningWorker(JobDispatchService dispatch,
                              TenantRepository tenants,
                              ServerRepository servers,
                              PlanCatalog plans,
                              ProvisioningPipeline pipeline,
                              TxRunner tx,
                              Clock clock) {
        this.dispatch = dispatch;
        this.tenants = tenants;
        this.servers = servers;
        this.plans = plans;
        this.pipeline = pipeline;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 잡 하나를 꺼내 끝까지 실행.
     * @return 처리한 잡. 대기 시간 안에 일이 없으면 empty
     */
    public Optional<ProvisioningJob> runOnce(WorkerContext ctx, Duration maxWait) throws Exception {
        Optional<ProvisioningJob> claimed = dispatch.dequeue(ctx.serverId(), maxWait);
        if (claimed.isEmpty()) return Optional.empty();

        ProvisioningJob job = claimed.get();
        boolean ok = execute(job);
        ctx.record(job.id(), ok, clock.now());
        log.info("[{}] job {} finished: {} ({})", ctx.workerName(), job.id(), ok ? "SUCCEEDED" : "FAILED", ctx);
        return dispatch.find(job.id());
    }

    private boolean execute(ProvisioningJob job) throws Exception {
        Optional<Tenant> found = tx.required(() -> tenants.findById(job.tenantId()));
        if (found.isEmpty()) {
            return abort(job, ErrorKind.VALIDATION, "tenant " + job.tenantId() + " no longer exists");
        }
        Server server = tx.required(() -> servers.findById(job.serverId())).orElse(null);
        if (server == null) {
            return abort(job, ErrorKind.VALIDATION, "server " + job.serverId() + " no longer exists");
        }

        boolean entered = tx.required(() -> tenants.markProvisioning(job.tenantId(), job.serverId(), clock.now()));
        if (!entered) {
            return abort(job, ErrorKind.VALIDATION,
                    "tenant " + job.tenantId() + " is " + found.get().status() + ", not PENDING/FAILED");
        }
        Tenant tenant = tx.required(() -> tenants.findById(job.tenantId())).orElseThrow();

        PlanTier plan;
        try {
            plan = plans.require(tenant.planCode());
        } catch (ProvisioningException e) {
            tx.required(() -> tenants.markFailed(tenant.id(), Tenant.Status.PROVISIONING, e.getMessage(), clock.now()));
            return abort(job, e.kind(), e.getMessage());
        }

        PipelineReport report = pipeline.run(new PipelineContext(job, tenant, server, plan));
        if (report.succeeded()) {
            dispatch.succeed(job.id());
            return true;
        }
        dispatch.fail(job.id(), report.toJobError());
        return false;
    }

    private boolean abort(ProvisioningJob job, ErrorKind kind, String message) throws Exception {
        log.warn("job {} aborted before pipeline: {}", job.id(), message);
        dispatch.fail(job.id(), new ProvisioningJob.JobError(kind, null, message));
        return false;
    }
}
