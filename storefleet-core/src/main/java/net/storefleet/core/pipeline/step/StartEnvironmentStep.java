package net.storefleet.core.pipeline.step;

import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.ContainerRuntime;

/** 5. 이전 시도의 컨테이너/볼륨을 지우고 새로 기동 */
public final class StartEnvironmentStep implements PipelineStep {
    private final ContainerRuntime runtime;

    public StartEnvironmentStep(ContainerRuntime runtime) {
        this.runtime = runtime;
    }

    @Override public String name() { return "start-environment"; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        runtime.down(ctx.workspace());
        runtime.up(ctx.workspace());
    }

    @Override
    public void compensate(PipelineContext ctx) throws Exception {
        if (ctx.workspace() != null) runtime.down(ctx.workspace());
    }
}
