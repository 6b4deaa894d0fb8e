package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.SuspensionLogEntry;
import net.storefleet.core.spi.SuspensionLogRepository;

import java.sql.*;
import java.util.*;

public final class JdbcSuspensionLogRepository implements SuspensionLogRepository {

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public void append(SuspensionLogEntry e) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_SUSPENSION_LOG (TENANT_ID, ACTION, REASON, AUTOMATIC, LOGGED_AT)
            VALUES (?, ?, ?, ?, ?)
        """)) {
            ps.setLong(1, e.tenantId());
            ps.setString(2, e.action().name());
            ps.setString(3, JdbcUtil.clip(e.reason(), 500));
            ps.setString(4, JdbcUtil.yn(e.automatic()));
            ps.setTimestamp(5, JdbcUtil.ts(e.loggedAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public List<SuspensionLogEntry> findByTenant(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_SUSPENSION_LOG WHERE TENANT_ID=? ORDER BY ID")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<SuspensionLogEntry>();
                while (rs.next()) out.add(RowMappers.toSuspension(rs));
                return out;
            }
        }
    }
}
