package net.storefleet.core.pipeline;

import net.storefleet.core.error.ErrorKind;
import net.storefleet.core.error.ProvisioningException;
import net.storefleet.core.model.ProvisioningLogEntry;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ProvisioningJobRepository;
import net.storefleet.core.spi.ProvisioningLogRepository;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 고정 순서 스텝 목록을 실행하는 상태 기계.
 * - 각 스텝 시작 전에 잡 커서를 커밋 (이전 스텝의 부수효과가 내구화된 뒤에만 다음 스텝)
 * - BEST_EFFORT 실패는 경계에서 잡아 기록만
 * - CRITICAL 실패는 (rollbackEligible 이면) 실패 스텝 + 완료 스텝을 역순 보상 후 테넌트 FAILED
 * - 커서 커밋이 거부되면(잡이 더 이상 RUNNING 이 아님) 즉시 멈추고 완료 스텝을 보상
 */
public final class ProvisioningPipeline {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningPipeline.class);

    private final List<PipelineStep> steps;
    private final ProvisioningJobRepository jobs;
    private final TenantRepository tenants;
    private final ProvisioningLogRepository logs;
    private final TxRunner tx;
    private final Clock clock;

    public ProvisioningPipeline(List<PipelineStep> steps,
                                ProvisioningJobRepository jobs,
                                TenantRepository tenants,
                                ProvisioningLogRepository logs,
                                TxRunner tx,
                                Clock clock) {
        if (steps.isEmpty()) throw new IllegalArgumentException("pipeline needs at least one step");
        this.steps = List.copyOf(steps);
        this.jobs = jobs;
        this.tenants = tenants;
        this.logs = logs;
        this.tx = tx;
        this.clock = clock;
    }

    public List<String> stepNames() {
        return steps.stream().map(PipelineStep::name).toList();
    }

    public PipelineReport run(PipelineContext ctx) throws Exception {
        long jobId = ctx.job().id();
        List<PipelineStep> completed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (int i = 0; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            int cursor = i + 1;
            boolean owned = tx.required(() -> jobs.advance(jobId, cursor, step.name(), clock.now()));
            if (!owned) {
                return abandon(ctx, step, completed, skipped);
            }
            journal(ctx, ProvisioningLogEntry.Level.INFO, step.name(), "step " + cursor + " started");

            try {
                step.execute(ctx);
                completed.add(step);
                journal(ctx, ProvisioningLogEntry.Level.INFO, step.name(), "step " + cursor + " completed");
            } catch (Exception e) {
                if (e instanceof InterruptedException) Thread.currentThread().interrupt();

                if (step.kind() == PipelineStep.Kind.BEST_EFFORT) {
                    log.warn("tenant {} best-effort step '{}' failed: {}", ctx.tenantId(), step.name(), e.getMessage());
                    journal(ctx, ProvisioningLogEntry.Level.WARN, step.name(), "skipped: " + describe(e));
                    skipped.add(step.name());
                    continue;
                }
                return fail(ctx, step, e, completed, skipped);
            }
        }

        log.info("tenant {} provisioned on server {} port {}", ctx.tenantId(), ctx.serverId(), ctx.port());
        return PipelineReport.success(names(completed), skipped);
    }

    private PipelineReport fail(PipelineContext ctx, PipelineStep failed, Exception cause,
                                List<PipelineStep> completed, List<String> skipped) throws Exception {
        ErrorKind kind = ProvisioningException.classify(cause);
        String message = describe(cause);
        log.error("tenant {} step '{}' failed ({}): {}", ctx.tenantId(), failed.name(), kind, message, cause);
        journal(ctx, ProvisioningLogEntry.Level.ERROR, failed.name(), message);

        List<String> rollbackFailures = new ArrayList<>();
        boolean rolledBack = failed.rollbackEligible();
        if (rolledBack) {
            List<PipelineStep> walk = new ArrayList<>(completed);
            walk.add(failed);
            for (int i = walk.size() - 1; i >= 0; i--) {
                PipelineStep s = walk.get(i);
                try {
                    s.compensate(ctx);
                } catch (Exception e) {
                    // 롤백 실패는 기록만 하고 계속 진행. 테넌트는 반드시 FAILED 로 남긴다
                    log.warn("tenant {} rollback of '{}' failed: {}", ctx.tenantId(), s.name(), e.getMessage());
                    journal(ctx, ProvisioningLogEntry.Level.WARN, s.name(), "rollback failed: " + describe(e));
                    rollbackFailures.add(s.name());
                }
            }
            journal(ctx, ProvisioningLogEntry.Level.INFO, failed.name(),
                    "rollback finished" + (rollbackFailures.isEmpty() ? "" : " with failures " + rollbackFailures));
        }

        String tenantError = "[" + failed.name() + "] " + message;
        boolean marked = tx.required(() ->
                tenants.markFailed(ctx.tenantId(), Tenant.Status.PROVISIONING, tenantError, clock.now()));
        if (!marked) {
            log.warn("tenant {} was not PROVISIONING when marking failed", ctx.tenantId());
        }

        return PipelineReport.failure(names(completed), skipped, failed.name(), kind, message,
                rolledBack, rollbackFailures);
    }

    /** 정리 작업 등으로 잡을 잃었을 때. 잡 상태는 이미 종결이므로 보상만 하고 잡 기록은 건드리지 않는다 */
    private PipelineReport abandon(PipelineContext ctx, PipelineStep next, List<PipelineStep> completed,
                                   List<String> skipped) throws Exception {
        String message = "job " + ctx.job().id() + " is no longer RUNNING, stopped before '" + next.name() + "'";
        log.warn("tenant {}: {}", ctx.tenantId(), message);
        journal(ctx, ProvisioningLogEntry.Level.WARN, next.name(), message);

        List<String> rollbackFailures = new ArrayList<>();
        for (int i = completed.size() - 1; i >= 0; i--) {
            PipelineStep s = completed.get(i);
            try {
                s.compensate(ctx);
            } catch (Exception e) {
                log.warn("tenant {} rollback of '{}' failed: {}", ctx.tenantId(), s.name(), e.getMessage());
                journal(ctx, ProvisioningLogEntry.Level.WARN, s.name(), "rollback failed: " + describe(e));
                rollbackFailures.add(s.name());
            }
        }

        // 보통은 정리 작업이 이미 FAILED 로 바꿔 두었다
        tx.required(() -> tenants.markFailed(ctx.tenantId(), Tenant.Status.PROVISIONING,
                "[" + next.name() + "] " + message, clock.now()));
        return PipelineReport.failure(names(completed), skipped, next.name(), ErrorKind.WORKER_LOST, message,
                true, rollbackFailures);
    }

    /** 단계 로그 적재 실패가 파이프라인을 깨지 않도록 */
    private void journal(PipelineContext ctx, ProvisioningLogEntry.Level level, String step, String message) {
        var entry = new ProvisioningLogEntry(null, ctx.job().id(), ctx.tenantId(), level, step, message, clock.now());
        try {
            tx.requiresNew(() -> logs.append(entry));
        } catch (Exception e) {
            log.warn("provisioning log append failed for job {}: {}", ctx.job().id(), e.getMessage());
        }
    }

    private static List<String> names(List<PipelineStep> steps) {
        return steps.stream().map(PipelineStep::name).toList();
    }

    static String describe(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
