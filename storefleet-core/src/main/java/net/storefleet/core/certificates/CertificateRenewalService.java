package net.storefleet.core.certificates;

import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.CertificateIssuer;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** 프로비저닝 중 인증서 발급에 실패한 테넌트를 이후 주기에 재시도 */
public final class CertificateRenewalService {
    private static final Logger log = LoggerFactory.getLogger(CertificateRenewalService.class);

    private final TenantRepository tenants;
    private final CertificateIssuer issuer;
    private final TxRunner tx;
    private final Clock clock;

    public CertificateRenewalService(TenantRepository tenants, CertificateIssuer issuer, TxRunner tx, Clock clock) {
        this.tenants = tenants;
        this.issuer = issuer;
        this.tx = tx;
        this.clock = clock;
    }

    /** @return 이번 주기에 TLS 가 켜진 테넌트 수 */
    public int retryPending(long serverId) throws Exception {
        List<Tenant> pending = tx.required(() -> tenants.findActiveWithoutTls(serverId));
        int issued = 0;
        for (Tenant t : pending) {
            try {
                issuer.issue(t.id(), t.domain());
                tx.required(() -> tenants.setTlsEnabled(t.id(), true, clock.now()));
                issued++;
                log.info("certificate issued for tenant {} ({})", t.id(), t.domain());
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                log.warn("certificate retry failed for tenant {} ({}): {}", t.id(), t.domain(), e.getMessage());
            }
        }
        return issued;
    }
}
