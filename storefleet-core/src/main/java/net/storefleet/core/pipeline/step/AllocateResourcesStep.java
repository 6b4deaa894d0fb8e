package net.storefleet.core.pipeline.step;

import net.storefleet.core.allocator.ResourceAllocator;
import net.storefleet.core.error.StepFailedException;
import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;

/** 3. 포트(같은 서버의 기존 할당은 재사용) + 쿼터 부여 */
public final class AllocateResourcesStep implements PipelineStep {
    private final ResourceAllocator allocator;
    private final TenantRepository tenants;
    private final TxRunner tx;
    private final Clock clock;

    public AllocateResourcesStep(ResourceAllocator allocator, TenantRepository tenants, TxRunner tx, Clock clock) {
        this.allocator = allocator;
        this.tenants = tenants;
        this.tx = tx;
        this.clock = clock;
    }

    @Override public String name() { return "allocate-resources"; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        int port = allocator.allocatePort(ctx.serverId(), ctx.tenantId());
        ctx.port(port);
        allocator.allocateQuota(ctx.tenantId(), ctx.plan().code());

        boolean recorded = tx.required(() ->
                tenants.assignPort(ctx.tenantId(), ctx.serverId(), port, clock.now()));
        if (!recorded) throw new StepFailedException("tenant " + ctx.tenantId() + " is no longer provisioning");
    }

    @Override
    public void compensate(PipelineContext ctx) throws Exception {
        allocator.releaseTenantPort(ctx.tenantId());
        allocator.releaseQuota(ctx.tenantId());
    }
}
