package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.QuotaGrant;
import net.storefleet.core.spi.QuotaRepository;

import java.sql.*;
import java.util.*;

public final class JdbcQuotaRepository implements QuotaRepository {

    private Connection mustConn() { return TxContext.require(); }

    /** update 후 없으면 insert. 동시 insert 에 지면 다시 update */
    @Override
    public QuotaGrant upsert(QuotaGrant g) throws Exception {
        Connection c = mustConn();
        if (update(c, g) == 0) {
            Optional<Integer> inserted = JdbcUtil.attempt(c, () -> {
                try (var ps = c.prepareStatement("""
                    INSERT INTO TB_QUOTA (TENANT_ID, PLAN_CODE, DISK_BYTES, BANDWIDTH_BYTES, GRANTED_AT)
                    VALUES (?, ?, ?, ?, ?)
                """)) {
                    ps.setLong(1, g.tenantId());
                    ps.setString(2, g.planCode());
                    ps.setLong(3, g.diskBytes());
                    ps.setLong(4, g.bandwidthBytes());
                    ps.setTimestamp(5, JdbcUtil.ts(g.grantedAt()));
                    return ps.executeUpdate();
                }
            });
            if (inserted.isEmpty()) update(c, g);
        }
        return findByTenant(g.tenantId()).orElseThrow();
    }

    private static int update(Connection c, QuotaGrant g) throws SQLException {
        try (var ps = c.prepareStatement("""
            UPDATE TB_QUOTA
               SET PLAN_CODE = ?, DISK_BYTES = ?, BANDWIDTH_BYTES = ?, GRANTED_AT = ?
             WHERE TENANT_ID = ?
        """)) {
            ps.setString(1, g.planCode());
            ps.setLong(2, g.diskBytes());
            ps.setLong(3, g.bandwidthBytes());
            ps.setTimestamp(4, JdbcUtil.ts(g.grantedAt()));
            ps.setLong(5, g.tenantId());
            return ps.executeUpdate();
        }
    }

    @Override
    public Optional<QuotaGrant> findByTenant(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_QUOTA WHERE TENANT_ID=?")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toQuota(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public int delete(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_QUOTA WHERE TENANT_ID=?")) {
            ps.setLong(1, tenantId);
            return ps.executeUpdate();
        }
    }
}
