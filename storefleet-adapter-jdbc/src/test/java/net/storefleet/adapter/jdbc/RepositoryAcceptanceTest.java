package net.storefleet.adapter.jdbc;

import net.storefleet.adapter.jdbc.repo.*;
import net.storefleet.core.error.ErrorKind;
import net.storefleet.core.model.*;
import net.storefleet.core.spi.TxRunner;
import org.junit.jupiter.api.*;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 저장소 단위 계약: 멱등 upsert, 조건부 전환, 종료 상태 불변, 저장소 CHECK
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class RepositoryAcceptanceTest extends TestSupport {

    TxRunner tx;
    JdbcServerRepository servers;
    JdbcTenantRepository tenants;
    JdbcProvisioningJobRepository jobs;
    JdbcQuotaRepository quotas;
    JdbcUsageRepository usage;

    final Instant t0 = Instant.parse("2026-03-10T09:00:00Z");

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        servers = new JdbcServerRepository();
        tenants = new JdbcTenantRepository();
        jobs = new JdbcProvisioningJobRepository();
        quotas = new JdbcQuotaRepository();
        usage = new JdbcUsageRepository();
    }

    @BeforeEach
    void truncateAll() throws Exception {
        deleteAll(tx);
    }

    private Tenant pending(Server s, String domain) throws Exception {
        return tx.required(() -> tenants.insertPending(domain, "a@" + domain, Platform.WOOCOMMERCE, "starter", s.id(), t0))
                .orElseThrow();
    }

    // ========== r1: 서버 등록은 hostname 기준 멱등 ==========
    @Test
    void r1_serverUpsert_idempotentByHostname() throws Exception {
        Server a = tx.required(() -> servers.upsert("node", "node.storefleet.net", "10.0.0.5", 20, 8001, 8100, t0));
        Server b = tx.required(() -> servers.upsert("node-renamed", "node.storefleet.net", "10.0.0.6", 40, 8001, 8200, t0));

        assertEquals(a.id(), b.id());
        assertEquals("node-renamed", b.name());
        assertEquals(40, b.maxTenants());
        assertEquals(200, b.portCapacity());
        assertEquals(1, tx.required(servers::findAll).size());
        assertNull(b.lastHeartbeat());
    }

    @Test
    void r2_updateStatus_rejectsUnknown() throws Exception {
        Server s = seedServer(tx, "s.storefleet.net", 5, 8001, 8005, t0);
        assertThrows(IllegalArgumentException.class,
                () -> tx.required(() -> servers.updateStatus(s.id(), Server.Status.UNKNOWN, t0)));
    }

    // ========== r3: 테넌트 전환은 기대 상태에서만 ==========
    @Test
    void r3_tenantTransitions_guardedByExpectedStatus() throws Exception {
        Server s = seedServer(tx, "s.storefleet.net", 5, 8001, 8005, t0);
        Tenant t = pending(s, "guard.example.com");

        assertFalse(tx.required(() -> tenants.markActive(t.id(), "sealed", t0)), "PENDING cannot jump to ACTIVE");
        assertFalse(tx.required(() -> tenants.suspend(t.id(), "x", false, t0)));

        assertTrue(tx.required(() -> tenants.markProvisioning(t.id(), s.id(), t0)));
        assertFalse(tx.required(() -> tenants.markActive(t.id(), "sealed", t0)), "no port yet");
        assertTrue(tx.required(() -> tenants.assignPort(t.id(), s.id(), 8001, t0)));
        assertTrue(tx.required(() -> tenants.markActive(t.id(), "sealed", t0)));
        assertFalse(tx.required(() -> tenants.markProvisioning(t.id(), s.id(), t0)), "ACTIVE is not retryable");

        assertTrue(tx.required(() -> tenants.suspend(t.id(), "abuse", false, t0)));
        assertTrue(tx.required(() -> tenants.reactivate(t.id(), t0)));
        assertFalse(tx.required(() -> tenants.reactivate(t.id(), t0)));
    }

    // ========== r4: ACTIVE 는 포트 없이 존재할 수 없다 (저장소 CHECK) ==========
    @Test
    void r4_storageCheck_activeRequiresPort() throws Exception {
        Server s = seedServer(tx, "s.storefleet.net", 5, 8001, 8005, t0);
        Tenant t = pending(s, "check.example.com");

        assertThrows(SQLException.class, () -> tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement("UPDATE TB_TENANT SET STATUS = 'ACTIVE' WHERE ID = ?")) {
                ps.setLong(1, t.id());
                ps.executeUpdate();
            }
        }));
    }

    // ========== r5: 종료된 잡은 다시 바뀌지 않음, in-flight 표식 해제 ==========
    @Test
    void r5_terminalJob_isImmutable_andReleasesInFlightSlot() throws Exception {
        Server s = seedServer(tx, "s.storefleet.net", 5, 8001, 8005, t0);
        Tenant t = pending(s, "job.example.com");

        ProvisioningJob job = tx.required(() -> jobs.insertQueued(t.id(), s.id(), 1, t0)).orElseThrow();
        assertTrue(tx.required(() -> jobs.insertQueued(t.id(), s.id(), 2, t0)).isEmpty(), "second in-flight job refused");

        assertFalse(tx.required(() -> jobs.advance(job.id(), 1, "ensure-workspace", t0)), "QUEUED cannot advance");
        var error = new ProvisioningJob.JobError(ErrorKind.TERMINAL_PIPELINE, "verify-health", "timeout");
        assertTrue(tx.required(() -> jobs.markFailed(job.id(), error, t0)));
        assertFalse(tx.required(() -> jobs.markSucceeded(job.id(), t0)));
        assertFalse(tx.required(() -> jobs.markFailed(job.id(), error, t0)));

        ProvisioningJob stored = tx.required(() -> jobs.findById(job.id())).orElseThrow();
        assertEquals(ProvisioningJob.Status.FAILED, stored.status());
        assertEquals(error, stored.error());
        assertNotNull(stored.finishedAt());
        assertTrue(tx.required(() -> jobs.findInFlight(t.id())).isEmpty());

        assertTrue(tx.required(() -> jobs.insertQueued(t.id(), s.id(), 2, t0)).isPresent(), "slot free again");
        assertEquals(2, tx.required(() -> jobs.countByTenant(t.id())));
    }

    // ========== r6: 쿼터/샘플 upsert ==========
    @Test
    void r6_quotaAndUsage_upsertKeepOneRow() throws Exception {
        Server s = seedServer(tx, "s.storefleet.net", 5, 8001, 8005, t0);
        Tenant t = pending(s, "quota.example.com");

        tx.required(() -> quotas.upsert(new QuotaGrant(t.id(), "starter", 10, 100, t0)));
        QuotaGrant g = tx.required(() -> quotas.upsert(new QuotaGrant(t.id(), "growth", 20, 200, t0)));
        assertEquals("growth", g.planCode());
        assertEquals(20, tx.required(() -> quotas.findByTenant(t.id())).orElseThrow().diskBytes());
        assertEquals(1, tx.required(() -> quotas.delete(t.id())));
        assertEquals(0, tx.required(() -> quotas.delete(t.id())));

        LocalDate day = LocalDate.of(2026, 3, 10);
        tx.required(() -> usage.upsertSample(new UsageSample(t.id(), day, 1, 2, t0)));
        tx.required(() -> usage.upsertSample(new UsageSample(t.id(), day, 3, 4, t0.plusSeconds(60))));
        UsageSample u = tx.required(() -> usage.findSample(t.id(), day)).orElseThrow();
        assertEquals(3, u.diskBytes());
        assertEquals(4, u.bandwidthBytes());
    }

    // ========== r7: 오류 메시지는 컬럼 길이로 잘림 ==========
    @Test
    void r7_longErrorMessage_isClipped() throws Exception {
        Server s = seedServer(tx, "s.storefleet.net", 5, 8001, 8005, t0);
        Tenant t = pending(s, "long.example.com");
        tx.required(() -> tenants.markProvisioning(t.id(), s.id(), t0));

        String huge = "x".repeat(10_000);
        assertTrue(tx.required(() -> tenants.markFailed(t.id(), Tenant.Status.PROVISIONING, huge, t0)));
        assertEquals(JdbcTenantRepository.MAX_MESSAGE,
                tx.required(() -> tenants.findById(t.id())).orElseThrow().errorMessage().length());
    }

    // ========== r8: unique 위반 뒤에도 같은 트랜잭션을 계속 쓸 수 있음 (savepoint) ==========
    @Test
    void r8_duplicateInsert_rollsBackToSavepoint_transactionContinues() throws Exception {
        Server s = seedServer(tx, "sp.storefleet.net", 5, 8001, 8005, t0);
        pending(s, "taken.example.com");

        long second = tx.required(() -> {
            assertTrue(tenants.insertPending("taken.example.com", "b@taken.example.com",
                    Platform.WOOCOMMERCE, "starter", s.id(), t0).isEmpty());
            // PostgreSQL 은 savepoint 없이는 여기서 "current transaction is aborted"
            return tenants.insertPending("fresh.example.com", "b@fresh.example.com",
                    Platform.WOOCOMMERCE, "starter", s.id(), t0).orElseThrow().id();
        });

        assertEquals("fresh.example.com", tx.required(() -> tenants.findById(second)).orElseThrow().domain());
        assertEquals(2, tx.required(() -> tenants.findByStatus(Tenant.Status.PENDING)).size());
    }

    // ========== r9: 충돌 판정은 SQLSTATE 기준 ==========
    @Test
    void r9_conflictDetection_bySqlState() {
        assertTrue(JdbcUtil.isConflict(new SQLException("duplicate key", "23505")));
        assertTrue(JdbcUtil.isConflict(new SQLException("could not serialize", "40001")));
        assertTrue(JdbcUtil.isConflict(new SQLException("wrapped", "XX000", new SQLException("dup", "23505"))));
        assertFalse(JdbcUtil.isConflict(new SQLException("check violation", "23514")));
    }
}
