package net.storefleet.core.pipeline.step;

import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.ContainerRuntime;
import net.storefleet.core.spi.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 1. 워크스페이스 보장. 이전 시도의 잔여 환경이 있으면 먼저 내린다 */
public final class EnsureWorkspaceStep implements PipelineStep {
    private static final Logger log = LoggerFactory.getLogger(EnsureWorkspaceStep.class);

    private final WorkspaceStore workspaces;
    private final ContainerRuntime runtime;

    public EnsureWorkspaceStep(WorkspaceStore workspaces, ContainerRuntime runtime) {
        this.workspaces = workspaces;
        this.runtime = runtime;
    }

    @Override public String name() { return "ensure-workspace"; }

    @Override public boolean rollbackEligible() { return false; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        long tenantId = ctx.tenantId();
        if (workspaces.exists(tenantId)) {
            log.info("tenant {} workspace exists from a previous attempt, tearing down leftovers", tenantId);
            runtime.down(workspaces.resolve(tenantId));
        }
        ctx.workspace(workspaces.ensure(tenantId, ctx.tenant().platform()));
    }
}
