package net.storefleet.core.monitoring;

import net.storefleet.core.model.HealthAlert;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ContainerRuntime;
import net.storefleet.core.spi.Notifier;
import net.storefleet.core.spi.SiteProbe;
import net.storefleet.core.spi.TenantHealthRepository;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import net.storefleet.core.spi.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 이 호스트에 배치된 ACTIVE 테넌트의 스토어 응답과 컨테이너 상태를 점검한다.
 * 연속 실패가 임계치에 닿으면 DOWN 경보(쿨다운 안에서는 한 번), 그 뒤 첫 성공에 RECOVERED 경보.
 */
public final class TenantHealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(TenantHealthMonitor.class);

    public record Settings(int failureThreshold, Duration alertCooldown) {
        public Settings {
            if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
        }

        public static Settings defaults() {
            return new Settings(3, Duration.ofMinutes(5));
        }
    }

    public record HealthCycleReport(int checked, int down, int failed, List<HealthAlert> alertsRaised) { }

    private final TenantRepository tenants;
    private final TenantHealthRepository health;
    private final SiteProbe site;
    private final ContainerRuntime runtime;
    private final WorkspaceStore workspaces;
    private final Notifier notifier;
    private final TxRunner tx;
    private final Clock clock;
    private final Settings settings;

    public TenantHealthMonitor(TenantRepository tenants,
                               TenantHealthRepository health,
                               SiteProbe site,
                               ContainerRuntime runtime,
                               WorkspaceStore workspaces,
                               Notifier notifier,
                               TxRunner tx,
                               Clock clock,
                               Settings settings) {
        this.tenants = tenants;
        this.health = health;
        this.site = site;
        this.runtime = runtime;
        this.workspaces = workspaces;
        this.notifier = notifier;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;
    }

    public HealthCycleReport runCycle(long serverId) throws Exception {
        List<Tenant> active = tx.required(() -> tenants.findByStatusAndServer(Tenant.Status.ACTIVE, serverId));
        int checked = 0, down = 0, failed = 0;
        List<HealthAlert> raised = new ArrayList<>();

        for (Tenant t : active) {
            try {
                Check c = check(t);
                checked++;
                if (!c.ok()) down++;
                judge(t, c).ifPresent(raised::add);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                failed++;
                log.warn("health check bookkeeping failed for tenant {}: {}", t.id(), e.getMessage());
            }
        }
        if (down > 0 || failed > 0 || !raised.isEmpty()) {
            log.info("health cycle on server {}: checked={} down={} failed={} alerts={}",
                    serverId, checked, down, failed, raised.size());
        }
        return new HealthCycleReport(checked, down, failed, raised);
    }

    record Check(boolean siteOk, ContainerRuntime.Health container) {
        boolean containerOk() { return container == ContainerRuntime.Health.RUNNING; }

        boolean ok() { return siteOk && containerOk(); }

        String describe() {
            List<String> issues = new ArrayList<>(2);
            if (!siteOk) issues.add("HTTP");
            if (!containerOk()) issues.add("container " + (container == null ? "unknown" : container));
            return String.join(", ", issues);
        }
    }

    Check check(Tenant t) throws InterruptedException {
        boolean siteOk = site.responds(t.domain());
        ContainerRuntime.Health container;
        try {
            container = runtime.health(workspaces.resolve(t.id()));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            // 조회 실패는 컨테이너 비정상으로 본다
            log.warn("container state of tenant {} unavailable: {}", t.id(), e.getMessage());
            container = null;
        }
        return new Check(siteOk, container);
    }

    private Optional<HealthAlert> judge(Tenant t, Check c) throws Exception {
        Instant now = clock.now();
        if (!c.ok()) {
            int failures = tx.required(() -> health.recordFailure(t.id(), now));
            log.debug("tenant {} check failed ({}), {} in a row", t.id(), c.describe(), failures);
            if (failures < settings.failureThreshold()) return Optional.empty();

            Instant sentBefore = now.minus(settings.alertCooldown());
            Optional<HealthAlert> recorded = tx.requiresNew(() -> {
                if (!health.tryMarkAlerted(t.id(), now, sentBefore)) return Optional.empty();
                return Optional.of(health.insertAlert(new HealthAlert(null, t.id(), HealthAlert.Kind.DOWN,
                        c.describe() + " down", failures, now)));
            });
            recorded.ifPresent(a -> {
                log.error("tenant {} ({}) is down: {} after {} failed checks", t.id(), t.domain(), c.describe(), failures);
                send(t, a);
            });
            return recorded;
        }

        int previous = tx.required(() -> health.recordSuccess(t.id(), now));
        if (previous < settings.failureThreshold()) return Optional.empty();

        HealthAlert recovered = tx.required(() -> health.insertAlert(new HealthAlert(null, t.id(),
                HealthAlert.Kind.RECOVERED, "recovered after " + previous + " failed checks", previous, now)));
        log.info("tenant {} ({}) recovered after {} failed checks", t.id(), t.domain(), previous);
        send(t, recovered);
        return Optional.of(recovered);
    }

    private void send(Tenant t, HealthAlert alert) {
        try {
            notifier.healthAlert(t, alert);
        } catch (Exception e) {
            log.warn("health notification failed for tenant {} {}: {}", t.id(), alert.kind(), e.getMessage());
        }
    }
}
