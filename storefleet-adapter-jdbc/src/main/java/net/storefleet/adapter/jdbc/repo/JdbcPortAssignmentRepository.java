package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.PortAssignment;
import net.storefleet.core.spi.PortAssignmentRepository;

import java.sql.*;
import java.time.Instant;
import java.util.*;

/** PK(SERVER_ID, PORT) + UNIQUE(TENANT_ID) 가 할당 경쟁의 심판 */
public final class JdbcPortAssignmentRepository implements PortAssignmentRepository {

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public boolean tryInsert(long serverId, int port, long tenantId, Instant now) throws Exception {
        Connection c = mustConn();
        return JdbcUtil.attempt(c, () -> {
            try (var ps = c.prepareStatement("""
                INSERT INTO TB_PORT_ASSIGNMENT (SERVER_ID, PORT, TENANT_ID, ASSIGNED_AT)
                VALUES (?, ?, ?, ?)
            """)) {
                ps.setLong(1, serverId);
                ps.setInt(2, port);
                ps.setLong(3, tenantId);
                ps.setTimestamp(4, JdbcUtil.ts(now));
                return ps.executeUpdate() == 1;
            }
        }).orElse(false);
    }

    @Override
    public Optional<PortAssignment> findByTenant(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_PORT_ASSIGNMENT WHERE TENANT_ID=?")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toPortAssignment(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Integer> findUsedPorts(long serverId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT PORT FROM TB_PORT_ASSIGNMENT WHERE SERVER_ID=? ORDER BY PORT")) {
            ps.setLong(1, serverId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<Integer>();
                while (rs.next()) out.add(rs.getInt(1));
                return out;
            }
        }
    }

    @Override
    public int countByServer(long serverId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT COUNT(*) FROM TB_PORT_ASSIGNMENT WHERE SERVER_ID=?")) {
            ps.setLong(1, serverId);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    @Override
    public int delete(long serverId, int port) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_PORT_ASSIGNMENT WHERE SERVER_ID=? AND PORT=?")) {
            ps.setLong(1, serverId);
            ps.setInt(2, port);
            return ps.executeUpdate();
        }
    }

    @Override
    public int deleteByTenant(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_PORT_ASSIGNMENT WHERE TENANT_ID=?")) {
            ps.setLong(1, tenantId);
            return ps.executeUpdate();
        }
    }
}
