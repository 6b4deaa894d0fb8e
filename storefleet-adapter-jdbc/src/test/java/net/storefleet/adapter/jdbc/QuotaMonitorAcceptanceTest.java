package net.storefleet.adapter.jdbc;

import net.storefleet.core.lifecycle.IntakeReceipt;
import net.storefleet.core.lifecycle.IntakeRequest;
import net.storefleet.core.model.ResourceAlert;
import net.storefleet.core.model.Server;
import net.storefleet.core.model.UsageSample;
import net.storefleet.core.queue.WorkerContext;
import net.storefleet.core.quota.QuotaMonitor;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class QuotaMonitorAcceptanceTest extends TestSupport {
    private static final long GIB = 1024L * 1024 * 1024;

    EngineFixture e;
    Server server;

    @BeforeAll
    void initAll() {
        e = new EngineFixture(ds);
    }

    @BeforeEach
    void reset() throws Exception {
        deleteAll(e.tx);
        e = new EngineFixture(ds);
        server = seedServer(e.tx, "quota.storefleet.net", 10, 8001, 8010, e.clock.now());
    }

    /** starter 플랜(디스크 25GB, 대역폭 250GB) ACTIVE 테넌트 */
    private long activeTenant(String domain) throws Exception {
        IntakeReceipt r = e.lifecycle.submit(new IntakeRequest(domain, "owner@" + domain, "woocommerce", "starter", null));
        e.worker.runOnce(new WorkerContext(server.id(), "quota-worker"), Duration.ofMillis(500)).orElseThrow();
        return r.tenantId();
    }

    private List<ResourceAlert> alertsOf(long tenantId) throws Exception {
        return e.tx.required(() -> e.alerts.findByTenant(tenantId));
    }

    // ========== q1: 24시간 안의 두 critical 샘플 → 경보 1건 ==========
    @Test
    void q1_twoCriticalSamplesWithinCooldown_oneAlert() throws Exception {
        long id = activeTenant("full-disk.example.com");
        e.usageProbe.disk.put(id, 24 * GIB);

        QuotaMonitor.QuotaCycleReport first = e.quotaMonitor.runCycle(server.id());
        assertEquals(1, first.sampled());
        assertEquals(1, first.alertsRaised().size());
        assertEquals(ResourceAlert.Kind.DISK_CRITICAL, first.alertsRaised().get(0).kind());

        e.clock.advance(Duration.ofHours(6));
        e.usageProbe.disk.put(id, 24 * GIB + 512L * 1024 * 1024);
        QuotaMonitor.QuotaCycleReport second = e.quotaMonitor.runCycle(server.id());
        assertTrue(second.alertsRaised().isEmpty(), "suppressed by cooldown");

        List<ResourceAlert> stored = alertsOf(id);
        assertEquals(1, stored.size());
        assertEquals(1, e.mailbox.alerts.size());

        // 같은 날 샘플은 한 행으로 갱신
        UsageSample sample = e.tx.required(() -> e.usage.findSample(id, LocalDate.of(2026, 3, 10))).orElseThrow();
        assertEquals(24 * GIB + 512L * 1024 * 1024, sample.diskBytes());

        // 쿨다운이 지나면 다시
        e.clock.advance(Duration.ofHours(19));
        assertEquals(1, e.quotaMonitor.runCycle(server.id()).alertsRaised().size());
        assertEquals(2, alertsOf(id).size());
    }

    // ========== q2: critical 이 warning 을 대체, 자원별 독립 ==========
    @Test
    void q2_criticalSupersedesWarning_perResource() throws Exception {
        long id = activeTenant("busy.example.com");
        e.usageProbe.disk.put(id, 23 * GIB);           // 92%
        e.usageProbe.bandwidth.put(id, 210 * GIB);     // 84%

        List<ResourceAlert> raised = e.quotaMonitor.runCycle(server.id()).alertsRaised();
        assertEquals(2, raised.size());
        assertEquals(ResourceAlert.Kind.DISK_CRITICAL, raised.get(0).kind());
        assertEquals(ResourceAlert.Kind.BANDWIDTH_WARNING, raised.get(1).kind());
        assertEquals(84.0, raised.get(1).percent(), 0.01);
        assertTrue(alertsOf(id).stream().noneMatch(a -> a.kind() == ResourceAlert.Kind.DISK_WARNING));
    }

    // ========== q3: 임계 미만은 샘플만 ==========
    @Test
    void q3_belowThresholds_sampleOnly() throws Exception {
        long id = activeTenant("calm.example.com");
        e.usageProbe.disk.put(id, 5 * GIB);

        var report = e.quotaMonitor.runCycle(server.id());
        assertEquals(1, report.sampled());
        assertTrue(report.alertsRaised().isEmpty());
        assertTrue(e.tx.required(() -> e.usage.findSample(id, LocalDate.of(2026, 3, 10))).isPresent());
    }

    // ========== q4: 테넌트 하나의 측정 실패는 격리, 알림 실패는 기록을 막지 않음 ==========
    @Test
    void q4_failuresIsolated() throws Exception {
        long broken = activeTenant("broken.example.com");
        long ok = activeTenant("ok.example.com");
        e.usageProbe.broken.add(broken);
        e.usageProbe.disk.put(ok, 25 * GIB);
        e.mailbox.fail = true;

        var report = e.quotaMonitor.runCycle(server.id());
        assertEquals(1, report.sampled());
        assertEquals(1, report.failed());
        assertEquals(1, alertsOf(ok).size(), "alert recorded although the notification failed");
        assertTrue(alertsOf(broken).isEmpty());
    }

    // ========== q5: SUSPENDED 테넌트는 측정 대상 아님 ==========
    @Test
    void q5_suspendedTenants_skipped() throws Exception {
        long id = activeTenant("paused.example.com");
        e.lifecycle.suspend(id, "payment overdue", true);
        e.usageProbe.disk.put(id, 25 * GIB);

        assertEquals(0, e.quotaMonitor.runCycle(server.id()).sampled());
        assertTrue(alertsOf(id).isEmpty());
    }

    // ========== q6: 다른 서버의 모니터는 이 서버 테넌트의 샘플을 덮어쓰지 않음 ==========
    @Test
    void q6_otherHostMonitor_leavesForeignTenantsAlone() throws Exception {
        Server other = seedServer(e.tx, "quota-b.storefleet.net", 10, 8001, 8010, e.clock.now());
        long id = activeTenant("host-a.example.com");
        e.usageProbe.disk.put(id, 24 * GIB);

        var onA = e.quotaMonitor.runCycle(server.id());
        assertEquals(1, onA.sampled());
        assertEquals(1, onA.alertsRaised().size());

        // B 호스트: 자기 작업 디렉터리만 보는 빈 측정기
        QuotaMonitor monitorB = new QuotaMonitor(e.tenants, e.quotas, e.usage, e.alerts, new HostFakes.Usage(),
                e.workspaces, e.mailbox, now -> e.clock.now(), e.tx, e.clock, QuotaMonitor.Settings.defaults());
        var onB = monitorB.runCycle(other.id());
        assertEquals(0, onB.sampled());
        assertEquals(0, onB.failed());

        UsageSample sample = e.tx.required(() -> e.usage.findSample(id, LocalDate.of(2026, 3, 10))).orElseThrow();
        assertEquals(24 * GIB, sample.diskBytes());
        assertEquals(1, alertsOf(id).size());
    }
}
