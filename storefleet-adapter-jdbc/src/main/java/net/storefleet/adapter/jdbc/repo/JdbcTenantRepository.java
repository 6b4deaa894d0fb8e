package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.Platform;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.TenantRepository;

import java.sql.*;
import java.time.Instant;
import java.util.*;

/** 상태 전이는 모두 기대 상태를 WHERE 에 건 조건부 update */
public final class JdbcTenantRepository implements TenantRepository {
    public static final int MAX_MESSAGE = 4000;

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public Optional<Tenant> insertPending(String domain, String email, Platform platform, String planCode,
                                          long serverId, Instant now) throws Exception {
        Connection c = mustConn();
        Optional<Long> id = JdbcUtil.attempt(c, () -> {
            try (var ps = c.prepareStatement("""
                INSERT INTO TB_TENANT
                    (DOMAIN_NAME, EMAIL, PLATFORM, PLAN_CODE, STATUS, SERVER_ID, WEB_PORT,
                     TLS_ENABLED, AUTO_SUSPENDED, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, 'PENDING', ?, NULL, 'N', 'N', ?, ?)
            """, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, domain);
                ps.setString(2, email);
                ps.setString(3, platform.code());
                ps.setString(4, planCode);
                ps.setLong(5, serverId);
                ps.setTimestamp(6, JdbcUtil.ts(now));
                ps.setTimestamp(7, JdbcUtil.ts(now));
                ps.executeUpdate();
                try (var keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) throw new SQLException("no generated key for TB_TENANT");
                    return keys.getLong(1);   // ID 가 첫 컬럼
                }
            }
        });
        if (id.isEmpty()) return Optional.empty();
        return findById(id.get());
    }

    @Override
    public Optional<Tenant> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_TENANT WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toTenant(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Tenant> findByDomain(String domain) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_TENANT WHERE DOMAIN_NAME=?")) {
            ps.setString(1, domain);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toTenant(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Tenant> findByStatus(Tenant.Status status) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_TENANT WHERE STATUS=? ORDER BY ID")) {
            ps.setString(1, status.code());
            return list(ps);
        }
    }

    @Override
    public List<Tenant> findByStatusAndServer(Tenant.Status status, long serverId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_TENANT WHERE STATUS=? AND SERVER_ID=? ORDER BY ID")) {
            ps.setString(1, status.code());
            ps.setLong(2, serverId);
            return list(ps);
        }
    }

    @Override
    public List<Tenant> findActiveWithoutTls(long serverId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_TENANT
             WHERE SERVER_ID = ? AND STATUS = 'ACTIVE' AND TLS_ENABLED = 'N'
             ORDER BY ID
        """)) {
            ps.setLong(1, serverId);
            return list(ps);
        }
    }

    @Override
    public Map<Long, Integer> countLiveByServer() throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT SERVER_ID, COUNT(*) AS CNT
              FROM TB_TENANT
             WHERE SERVER_ID IS NOT NULL
               AND STATUS IN ('PENDING', 'PROVISIONING', 'ACTIVE', 'SUSPENDED')
             GROUP BY SERVER_ID
        """); var rs = ps.executeQuery()) {
            var out = new HashMap<Long, Integer>();
            while (rs.next()) out.put(rs.getLong("SERVER_ID"), rs.getInt("CNT"));
            return out;
        }
    }

    @Override
    public boolean markProvisioning(long id, long serverId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TENANT
               SET STATUS = 'PROVISIONING',
                   SERVER_ID = ?,
                   ERROR_MESSAGE = NULL,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS IN ('PENDING', 'FAILED')
        """)) {
            ps.setLong(1, serverId);
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean reassignServer(long id, long serverId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TENANT
               SET SERVER_ID = ?, WEB_PORT = NULL, UPDATED_AT = ?
             WHERE ID = ? AND STATUS IN ('PENDING', 'FAILED')
        """)) {
            ps.setLong(1, serverId);
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean assignPort(long id, long serverId, int port, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TENANT
               SET SERVER_ID = ?, WEB_PORT = ?, UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'PROVISIONING'
        """)) {
            ps.setLong(1, serverId);
            ps.setInt(2, port);
            ps.setTimestamp(3, JdbcUtil.ts(now));
            ps.setLong(4, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean markActive(long id, String sealedCredentials, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TENANT
               SET STATUS = 'ACTIVE',
                   SEALED_CREDENTIALS = ?,
                   ERROR_MESSAGE = NULL,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'PROVISIONING' AND WEB_PORT IS NOT NULL
        """)) {
            ps.setString(1, sealedCredentials);
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean markFailed(long id, Tenant.Status expected, String errorMessage, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TENANT
               SET STATUS = 'FAILED',
                   WEB_PORT = NULL,
                   TLS_ENABLED = 'N',
                   ERROR_MESSAGE = ?,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS = ?
        """)) {
            ps.setString(1, JdbcUtil.clip(errorMessage, MAX_MESSAGE));
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            ps.setString(4, expected.code());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void setTlsEnabled(long id, boolean enabled, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("UPDATE TB_TENANT SET TLS_ENABLED=?, UPDATED_AT=? WHERE ID=?")) {
            ps.setString(1, JdbcUtil.yn(enabled));
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean suspend(long id, String reason, boolean automatic, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TENANT
               SET STATUS = 'SUSPENDED',
                   SUSPENSION_REASON = ?,
                   AUTO_SUSPENDED = ?,
                   SUSPENDED_AT = ?,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'ACTIVE'
        """)) {
            ps.setString(1, JdbcUtil.clip(reason, 500));
            ps.setString(2, JdbcUtil.yn(automatic));
            ps.setTimestamp(3, JdbcUtil.ts(now));
            ps.setTimestamp(4, JdbcUtil.ts(now));
            ps.setLong(5, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean reactivate(long id, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TENANT
               SET STATUS = 'ACTIVE',
                   SUSPENSION_REASON = NULL,
                   AUTO_SUSPENDED = 'N',
                   REACTIVATED_AT = ?,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'SUSPENDED'
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_TENANT WHERE ID=?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() == 1;
        }
    }

    private static List<Tenant> list(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            var out = new ArrayList<Tenant>();
            while (rs.next()) out.add(RowMappers.toTenant(rs));
            return out;
        }
    }
}
