package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.ResourceAlert;
import net.storefleet.core.spi.ResourceAlertRepository;

import java.sql.*;
import java.time.Instant;
import java.util.*;

public final class JdbcResourceAlertRepository implements ResourceAlertRepository {

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public boolean tryAcquireCooldown(long tenantId, ResourceAlert.Kind kind, Instant now, Instant sentBefore) throws Exception {
        Connection c = mustConn();

        // 1) 쿨다운이 지난 기존 행 갱신. 동시 갱신자는 새 값으로 WHERE 를 다시 평가해 진다
        try (var ps = c.prepareStatement("""
            UPDATE TB_ALERT_COOLDOWN
               SET LAST_SENT_AT = ?
             WHERE TENANT_ID = ? AND KIND = ? AND LAST_SENT_AT < ?
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setLong(2, tenantId);
            ps.setString(3, kind.code());
            ps.setTimestamp(4, JdbcUtil.ts(sentBefore));
            if (ps.executeUpdate() == 1) return true;
        }

        // 2) 첫 발송이면 insert. PK 충돌(행이 이미 있음 = 쿨다운 중 또는 동시 선점)이면 짐
        return JdbcUtil.attempt(c, () -> {
            try (var ps = c.prepareStatement("""
                INSERT INTO TB_ALERT_COOLDOWN (TENANT_ID, KIND, LAST_SENT_AT) VALUES (?, ?, ?)
            """)) {
                ps.setLong(1, tenantId);
                ps.setString(2, kind.code());
                ps.setTimestamp(3, JdbcUtil.ts(now));
                return ps.executeUpdate() == 1;
            }
        }).orElse(false);
    }

    @Override
    public ResourceAlert insert(ResourceAlert a) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_RESOURCE_ALERT (TENANT_ID, KIND, USAGE_PERCENT, USAGE_BYTES, LIMIT_BYTES, NOTIFIED_AT)
            VALUES (?, ?, ?, ?, ?, ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, a.tenantId());
            ps.setString(2, a.kind().code());
            ps.setDouble(3, a.percent());
            ps.setLong(4, a.usageBytes());
            ps.setLong(5, a.limitBytes());
            ps.setTimestamp(6, JdbcUtil.ts(a.notifiedAt()));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no generated key for TB_RESOURCE_ALERT");
                return new ResourceAlert(keys.getLong(1), a.tenantId(), a.kind(), a.percent(),
                        a.usageBytes(), a.limitBytes(), a.notifiedAt());
            }
        }
    }

    @Override
    public List<ResourceAlert> findByTenant(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_RESOURCE_ALERT WHERE TENANT_ID=? ORDER BY ID")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<ResourceAlert>();
                while (rs.next()) out.add(RowMappers.toAlert(rs));
                return out;
            }
        }
    }
}
