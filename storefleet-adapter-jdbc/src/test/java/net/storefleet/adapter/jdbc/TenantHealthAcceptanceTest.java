package net.storefleet.adapter.jdbc;

import net.storefleet.core.lifecycle.IntakeReceipt;
import net.storefleet.core.lifecycle.IntakeRequest;
import net.storefleet.core.model.HealthAlert;
import net.storefleet.core.model.Server;
import net.storefleet.core.model.TenantHealth;
import net.storefleet.core.monitoring.TenantHealthMonitor;
import net.storefleet.core.queue.WorkerContext;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 스토어 응답/컨테이너 점검과 다운·복구 경보
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class TenantHealthAcceptanceTest extends TestSupport {

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
        server = seedServer(e.tx, "health.storefleet.net", 10, 8001, 8010, e.clock.now());
    }

    private long activeTenant(String domain, Server on) throws Exception {
        IntakeReceipt r = e.lifecycle.submit(new IntakeRequest(domain, "owner@" + domain, "woocommerce", "starter", on.id()));
        e.worker.runOnce(new WorkerContext(on.id(), "health-worker"), Duration.ofMillis(500)).orElseThrow();
        return r.tenantId();
    }

    private List<HealthAlert> alertsOf(long tenantId) throws Exception {
        return e.tx.required(() -> e.health.findAlerts(tenantId));
    }

    private TenantHealthMonitor.HealthCycleReport cycle() throws Exception {
        TenantHealthMonitor.HealthCycleReport r = e.healthMonitor.runCycle(server.id());
        e.clock.advance(Duration.ofMinutes(1));
        return r;
    }

    // ========== h1: 임계치(3회)에서 한 번, 쿨다운 뒤 다시, 복구 시 RECOVERED ==========
    @Test
    void h1_downAfterThreshold_cooldown_thenRecovered() throws Exception {
        long id = activeTenant("flaky.example.com", server);
        e.sites.down.add("flaky.example.com");

        assertTrue(cycle().alertsRaised().isEmpty());
        assertTrue(cycle().alertsRaised().isEmpty());
        var third = cycle();
        assertEquals(1, third.down());
        assertEquals(1, third.alertsRaised().size());
        assertEquals(HealthAlert.Kind.DOWN, third.alertsRaised().get(0).kind());
        assertEquals(3, third.alertsRaised().get(0).consecutiveFailures());
        assertTrue(third.alertsRaised().get(0).detail().contains("HTTP"));

        // 5분 쿨다운 안에서는 다시 보내지 않음
        assertTrue(cycle().alertsRaised().isEmpty());
        assertTrue(cycle().alertsRaised().isEmpty());
        assertEquals(1, e.mailbox.health.size());

        e.clock.advance(Duration.ofMinutes(5));
        assertEquals(1, cycle().alertsRaised().size(), "cooldown passed");

        e.sites.down.clear();
        var recovered = cycle();
        assertEquals(0, recovered.down());
        assertEquals(HealthAlert.Kind.RECOVERED, recovered.alertsRaised().get(0).kind());
        assertEquals(6, recovered.alertsRaised().get(0).consecutiveFailures());

        TenantHealth state = e.tx.required(() -> e.health.find(id)).orElseThrow();
        assertEquals(TenantHealth.Status.UP, state.status());
        assertEquals(0, state.consecutiveFailures());
        assertEquals(List.of(HealthAlert.Kind.DOWN, HealthAlert.Kind.DOWN, HealthAlert.Kind.RECOVERED),
                alertsOf(id).stream().map(HealthAlert::kind).toList());
        assertEquals(3, e.mailbox.health.size());
    }

    // ========== h2: 멈춘 컨테이너도 다운 ==========
    @Test
    void h2_stoppedContainer_countsAsDown() throws Exception {
        long id = activeTenant("stopped.example.com", server);
        e.runtime.stop(e.workspaces.resolve(id));

        cycle();
        cycle();
        List<HealthAlert> raised = cycle().alertsRaised();
        assertEquals(1, raised.size());
        assertTrue(raised.get(0).detail().contains("container EXITED"));
        assertFalse(raised.get(0).detail().contains("HTTP"));
    }

    // ========== h3: 임계치 전에 회복하면 경보 없음 ==========
    @Test
    void h3_shortBlip_noAlerts() throws Exception {
        long id = activeTenant("blip.example.com", server);
        e.sites.down.add("blip.example.com");
        cycle();
        cycle();
        e.sites.down.clear();
        cycle();

        assertTrue(alertsOf(id).isEmpty());
        assertTrue(e.mailbox.health.isEmpty());
        assertEquals(0, e.tx.required(() -> e.health.find(id)).orElseThrow().consecutiveFailures());
    }

    // ========== h4: 다른 서버의 테넌트와 정지된 테넌트는 점검하지 않음 ==========
    @Test
    void h4_onlyLocalActiveTenants_checked() throws Exception {
        Server other = seedServer(e.tx, "health-b.storefleet.net", 10, 8001, 8010, e.clock.now());
        long local = activeTenant("local.example.com", server);
        long foreign = activeTenant("foreign.example.com", other);
        long paused = activeTenant("paused.example.com", server);
        e.lifecycle.suspend(paused, "payment overdue", true);

        var report = cycle();
        assertEquals(1, report.checked());
        assertTrue(e.tx.required(() -> e.health.find(local)).isPresent());
        assertTrue(e.tx.required(() -> e.health.find(foreign)).isEmpty());
        assertTrue(e.tx.required(() -> e.health.find(paused)).isEmpty());
    }

    // ========== h5: 알림 실패해도 경보 기록은 남음 ==========
    @Test
    void h5_notificationFailure_alertStillRecorded() throws Exception {
        long id = activeTenant("quiet.example.com", server);
        e.sites.down.add("quiet.example.com");
        e.mailbox.fail = true;

        cycle();
        cycle();
        assertEquals(1, cycle().alertsRaised().size());
        assertEquals(1, alertsOf(id).size());
    }
}
