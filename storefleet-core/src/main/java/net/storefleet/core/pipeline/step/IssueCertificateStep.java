package net.storefleet.core.pipeline.step;

import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.CertificateIssuer;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;

/** 7. 인증서 발급 (best-effort). 실패 시 평문 라우트 유지, 이후 주기적으로 재시도 */
public final class IssueCertificateStep implements PipelineStep {
    private final CertificateIssuer issuer;
    private final TenantRepository tenants;
    private final TxRunner tx;
    private final Clock clock;

    public IssueCertificateStep(CertificateIssuer issuer, TenantRepository tenants, TxRunner tx, Clock clock) {
        this.issuer = issuer;
        this.tenants = tenants;
        this.tx = tx;
        this.clock = clock;
    }

    @Override public String name() { return "issue-certificate"; }

    @Override public Kind kind() { return Kind.BEST_EFFORT; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        issuer.issue(ctx.tenantId(), ctx.tenant().domain());
        tx.required(() -> tenants.setTlsEnabled(ctx.tenantId(), true, clock.now()));
        ctx.tlsEnabled(true);
    }
}
