package net.storefleet.core.pipeline.step;

import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.ReverseProxy;

/** 6. 리버스 프록시 라우트 (문법 검사 통과 시에만 활성화) */
public final class ConfigureRouteStep implements PipelineStep {
    private final ReverseProxy proxy;

    public ConfigureRouteStep(ReverseProxy proxy) {
        this.proxy = proxy;
    }

    @Override public String name() { return "configure-route"; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        proxy.apply(new ReverseProxy.Route(ctx.tenantId(), ctx.tenant().domain(), ctx.port()));
    }

    @Override
    public void compensate(PipelineContext ctx) throws Exception {
        proxy.remove(ctx.tenantId());
    }
}
