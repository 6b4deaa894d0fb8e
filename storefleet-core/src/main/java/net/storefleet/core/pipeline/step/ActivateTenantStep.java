package net.storefleet.core.pipeline.step;

import net.storefleet.core.error.StepFailedException;
import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.CredentialCipher;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;

/** 9. 자격 증명 암호화 저장 + ACTIVE 전이 */
public final class ActivateTenantStep implements PipelineStep {
    private final CredentialCipher cipher;
    private final TenantRepository tenants;
    private final TxRunner tx;
    private final Clock clock;

    public ActivateTenantStep(CredentialCipher cipher, TenantRepository tenants, TxRunner tx, Clock clock) {
        this.cipher = cipher;
        this.tenants = tenants;
        this.tx = tx;
        this.clock = clock;
    }

    @Override public String name() { return "activate-tenant"; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        String sealed = cipher.seal(ctx.credentials());
        boolean activated = tx.required(() -> tenants.markActive(ctx.tenantId(), sealed, clock.now()));
        if (!activated) throw new StepFailedException("tenant " + ctx.tenantId() + " could not be activated");
    }
}
