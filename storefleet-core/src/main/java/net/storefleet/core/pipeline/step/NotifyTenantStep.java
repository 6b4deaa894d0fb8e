package net.storefleet.core.pipeline.step;

import net.storefleet.core.model.Platform;
import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.Notifier;

/** 10. 준비 완료 알림 (fire-and-forget) */
public final class NotifyTenantStep implements PipelineStep {
    private final Notifier notifier;

    public NotifyTenantStep(Notifier notifier) {
        this.notifier = notifier;
    }

    @Override public String name() { return "notify-tenant"; }

    @Override public Kind kind() { return Kind.BEST_EFFORT; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        var t = ctx.tenant();
        String store = ctx.storeUrl();
        String admin = store + (t.platform() == Platform.MAGENTO ? "/admin" : "/wp-admin");
        notifier.tenantReady(new Notifier.ReadyNotice(
                t.id(), t.email(), t.domain(), store, admin,
                ctx.credentials().adminUser(), ctx.credentials().adminPassword()));
    }
}
