package net.storefleet.core.pipeline.step;

import net.storefleet.core.pipeline.CredentialGenerator;
import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;

/** 2. 자격 증명은 시도마다 새로 만든다 (이전 시도 값 재사용 금지) */
public final class GenerateCredentialsStep implements PipelineStep {
    private final CredentialGenerator generator;

    public GenerateCredentialsStep(CredentialGenerator generator) {
        this.generator = generator;
    }

    @Override public String name() { return "generate-credentials"; }

    @Override public boolean rollbackEligible() { return false; }

    @Override
    public void execute(PipelineContext ctx) {
        ctx.credentials(generator.generate(ctx.tenant()));
    }
}
