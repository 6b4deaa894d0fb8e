package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.HealthAlert;
import net.storefleet.core.model.TenantHealth;
import net.storefleet.core.spi.TenantHealthRepository;

import java.sql.*;
import java.time.Instant;
import java.util.*;

/** 테넌트 하나는 자기 서버의 모니터만 점검하므로 상태 행은 읽고-쓰기로 충분하다 */
public final class JdbcTenantHealthRepository implements TenantHealthRepository {
    public static final int MAX_DETAIL = 1000;

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public Optional<TenantHealth> find(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_TENANT_HEALTH WHERE TENANT_ID=?")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toTenantHealth(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public int recordFailure(long tenantId, Instant now) throws Exception {
        int failures = find(tenantId).map(TenantHealth::consecutiveFailures).orElse(0) + 1;
        write(tenantId, TenantHealth.Status.DOWN, failures, now);
        return failures;
    }

    @Override
    public int recordSuccess(long tenantId, Instant now) throws Exception {
        int previous = find(tenantId).map(TenantHealth::consecutiveFailures).orElse(0);
        write(tenantId, TenantHealth.Status.UP, 0, now);
        return previous;
    }

    private void write(long tenantId, TenantHealth.Status status, int failures, Instant now) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("""
            UPDATE TB_TENANT_HEALTH
               SET STATUS = ?, CONSECUTIVE_FAILURES = ?, LAST_CHECKED_AT = ?
             WHERE TENANT_ID = ?
        """)) {
            ps.setString(1, status.name());
            ps.setInt(2, failures);
            ps.setTimestamp(3, JdbcUtil.ts(now));
            ps.setLong(4, tenantId);
            if (ps.executeUpdate() == 1) return;
        }
        try (var ps = c.prepareStatement("""
            INSERT INTO TB_TENANT_HEALTH (TENANT_ID, STATUS, CONSECUTIVE_FAILURES, LAST_CHECKED_AT, LAST_ALERT_AT)
            VALUES (?, ?, ?, ?, NULL)
        """)) {
            ps.setLong(1, tenantId);
            ps.setString(2, status.name());
            ps.setInt(3, failures);
            ps.setTimestamp(4, JdbcUtil.ts(now));
            ps.executeUpdate();
        }
    }

    @Override
    public boolean tryMarkAlerted(long tenantId, Instant now, Instant sentBefore) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TENANT_HEALTH
               SET LAST_ALERT_AT = ?
             WHERE TENANT_ID = ? AND (LAST_ALERT_AT IS NULL OR LAST_ALERT_AT < ?)
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setLong(2, tenantId);
            ps.setTimestamp(3, JdbcUtil.ts(sentBefore));
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public HealthAlert insertAlert(HealthAlert a) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_HEALTH_ALERT (TENANT_ID, KIND, DETAIL, CONSECUTIVE_FAILURES, RAISED_AT)
            VALUES (?, ?, ?, ?, ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, a.tenantId());
            ps.setString(2, a.kind().code());
            ps.setString(3, JdbcUtil.clip(a.detail(), MAX_DETAIL));
            ps.setInt(4, a.consecutiveFailures());
            ps.setTimestamp(5, JdbcUtil.ts(a.raisedAt()));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no generated key for TB_HEALTH_ALERT");
                return new HealthAlert(keys.getLong(1), a.tenantId(), a.kind(), a.detail(),
                        a.consecutiveFailures(), a.raisedAt());
            }
        }
    }

    @Override
    public List<HealthAlert> findAlerts(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_HEALTH_ALERT WHERE TENANT_ID=? ORDER BY ID")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<HealthAlert>();
                while (rs.next()) out.add(RowMappers.toHealthAlert(rs));
                return out;
            }
        }
    }
}
