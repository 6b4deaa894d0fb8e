package net.storefleet.core.pipeline.step;

import net.storefleet.core.pipeline.EnvironmentRenderer;
import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.WorkspaceStore;

/** 4. 플랜 한도(메모리/CPU)를 넣어 환경 정의를 워크스페이스에 기록 */
public final class RenderEnvironmentStep implements PipelineStep {
    private final EnvironmentRenderer renderer;
    private final WorkspaceStore workspaces;

    public RenderEnvironmentStep(EnvironmentRenderer renderer, WorkspaceStore workspaces) {
        this.renderer = renderer;
        this.workspaces = workspaces;
    }

    @Override public String name() { return "render-environment"; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        if (ctx.port() == null || ctx.credentials() == null) {
            throw new IllegalStateException("port and credentials must be prepared before rendering");
        }
        String definition = renderer.render(ctx.tenant(), ctx.plan(), ctx.credentials(), ctx.port());
        workspaces.write(ctx.tenantId(), EnvironmentRenderer.DEFINITION_FILE, definition);
    }
}
