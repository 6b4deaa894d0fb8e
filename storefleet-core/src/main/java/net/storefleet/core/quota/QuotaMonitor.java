package net.storefleet.core.quota;

import net.storefleet.core.model.QuotaGrant;
import net.storefleet.core.model.ResourceAlert;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.model.UsageSample;
import net.storefleet.core.spi.BillingCalendar;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.Notifier;
import net.storefleet.core.spi.QuotaRepository;
import net.storefleet.core.spi.ResourceAlertRepository;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import net.storefleet.core.spi.UsageProbe;
import net.storefleet.core.spi.UsageRepository;
import net.storefleet.core.spi.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 이 호스트에 배치된 ACTIVE 테넌트의 디스크/대역폭 사용량을 샘플링하고 한도 대비 경보를 낸다.
 * 측정은 호스트 로컬(작업 디렉터리, 액세스 로그)이므로 다른 서버의 테넌트는 건드리지 않는다.
 * 경보는 (tenant, kind) 쿨다운 행을 원자적으로 선점한 경우에만 기록/발송.
 */
public final class QuotaMonitor {
    private static final Logger log = LoggerFactory.getLogger(QuotaMonitor.class);

    public record Settings(double warningPercent, double criticalPercent, Duration cooldown, ZoneId zone) {
        public Settings {
            if (warningPercent <= 0 || criticalPercent < warningPercent) {
                throw new IllegalArgumentException("thresholds must satisfy 0 < warning <= critical");
            }
        }

        public static Settings defaults() {
            return new Settings(80.0, 90.0, Duration.ofHours(24), ZoneId.of("UTC"));
        }
    }

    public record QuotaCycleReport(int sampled, int failed, List<ResourceAlert> alertsRaised) { }

    private final TenantRepository tenants;
    private final QuotaRepository quotas;
    private final UsageRepository usage;
    private final ResourceAlertRepository alerts;
    private final UsageProbe probe;
    private final WorkspaceStore workspaces;
    private final Notifier notifier;
    private final BillingCalendar billing;
    private final TxRunner tx;
    private final Clock clock;
    private final Settings settings;

    public QuotaMonitor(TenantRepository tenants,
                        QuotaRepository quotas,
                        UsageRepository usage,
                        ResourceAlertRepository alerts,
                        UsageProbe probe,
                        WorkspaceStore workspaces,
                        Notifier notifier,
                        BillingCalendar billing,
                        TxRunner tx,
                        Clock clock,
                        Settings settings) {
        this.tenants = tenants;
        this.quotas = quotas;
        this.usage = usage;
        this.alerts = alerts;
        this.probe = probe;
        this.workspaces = workspaces;
        this.notifier = notifier;
        this.billing = billing;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;
    }

    public QuotaCycleReport runCycle(long serverId) throws Exception {
        List<Tenant> active = tx.required(() -> tenants.findByStatusAndServer(Tenant.Status.ACTIVE, serverId));
        int sampled = 0, failed = 0;
        List<ResourceAlert> raised = new ArrayList<>();

        for (Tenant t : active) {
            try {
                raised.addAll(sample(t));
                sampled++;
            } catch (Exception e) {
                // 한 테넌트 실패가 사이클 전체를 멈추지 않게
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                failed++;
                log.warn("usage sampling failed for tenant {}: {}", t.id(), e.getMessage());
            }
        }
        if (!raised.isEmpty() || failed > 0) {
            log.info("quota cycle on server {}: sampled={} failed={} alerts={}",
                    serverId, sampled, failed, raised.size());
        }
        return new QuotaCycleReport(sampled, failed, raised);
    }

    /** 테넌트 하나 측정 + 샘플 upsert + 경보 판단 */
    List<ResourceAlert> sample(Tenant t) throws Exception {
        Instant now = clock.now();
        long disk = probe.diskBytes(t.id(), workspaces.resolve(t.id()));
        long bandwidth = probe.bandwidthBytes(t.id(), billing.periodStart(now));

        LocalDate day = LocalDate.ofInstant(now, settings.zone());
        tx.required(() -> usage.upsertSample(new UsageSample(t.id(), day, disk, bandwidth, now)));

        Optional<QuotaGrant> grant = tx.required(() -> quotas.findByTenant(t.id()));
        if (grant.isEmpty()) {
            log.debug("tenant {} has no quota grant, skipping threshold check", t.id());
            return List.of();
        }

        List<ResourceAlert> out = new ArrayList<>(2);
        check(t, ResourceAlert.Resource.DISK, disk, grant.get().diskBytes(), now).ifPresent(out::add);
        check(t, ResourceAlert.Resource.BANDWIDTH, bandwidth, grant.get().bandwidthBytes(), now).ifPresent(out::add);
        return out;
    }

    private Optional<ResourceAlert> check(Tenant t, ResourceAlert.Resource resource, long used, long limit,
                                          Instant now) throws Exception {
        if (limit <= 0) return Optional.empty();
        double percent = used * 100.0 / limit;

        // critical 이 warning 을 대체한다
        ResourceAlert.Level level;
        if (percent >= settings.criticalPercent()) level = ResourceAlert.Level.CRITICAL;
        else if (percent >= settings.warningPercent()) level = ResourceAlert.Level.WARNING;
        else return Optional.empty();

        ResourceAlert.Kind kind = ResourceAlert.Kind.of(resource, level);
        Instant sentBefore = now.minus(settings.cooldown());

        // 쿨다운 선점과 경보 기록은 한 트랜잭션
        Optional<ResourceAlert> recorded = tx.requiresNew(() -> {
            if (!alerts.tryAcquireCooldown(t.id(), kind, now, sentBefore)) return Optional.empty();
            return Optional.of(alerts.insert(new ResourceAlert(null, t.id(), kind, percent, used, limit, now)));
        });
        if (recorded.isEmpty()) {
            log.debug("tenant {} {} suppressed by cooldown", t.id(), kind);
            return Optional.empty();
        }

        log.info("tenant {} {} at {}% ({} / {} bytes)", t.id(), kind, String.format("%.1f", percent), used, limit);
        try {
            notifier.resourceAlert(t, recorded.get());
        } catch (Exception e) {
            log.warn("alert notification failed for tenant {} {}: {}", t.id(), kind, e.getMessage());
        }
        return recorded;
    }
}
