package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.Server;
import net.storefleet.core.spi.ServerRepository;

import java.sql.*;
import java.time.Instant;
import java.util.*;

public final class JdbcServerRepository implements ServerRepository {

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public Server upsert(String name, String hostname, String address,
                         int maxTenants, int portRangeStart, int portRangeEnd, Instant now) throws Exception {
        Connection c = mustConn();

        // 1) 있으면 선언 값 갱신 (상태/하트비트는 건드리지 않음)
        if (updateDeclared(c, name, hostname, address, maxTenants, portRangeStart, portRangeEnd, now) == 0) {
            // 2) 없으면 생성. 동시 등록에 지면 다시 갱신
            Optional<Boolean> inserted = JdbcUtil.attempt(c, () -> {
                try (var ps = c.prepareStatement("""
                    INSERT INTO TB_SERVER
                        (NAME, HOSTNAME, ADDRESS, STATUS, MAX_TENANTS, PORT_RANGE_START, PORT_RANGE_END,
                         LAST_HEARTBEAT, CREATED_AT, UPDATED_AT)
                    VALUES (?, ?, ?, 'ACTIVE', ?, ?, ?, NULL, ?, ?)
                """)) {
                    ps.setString(1, name);
                    ps.setString(2, hostname);
                    ps.setString(3, address);
                    ps.setInt(4, maxTenants);
                    ps.setInt(5, portRangeStart);
                    ps.setInt(6, portRangeEnd);
                    ps.setTimestamp(7, JdbcUtil.ts(now));
                    ps.setTimestamp(8, JdbcUtil.ts(now));
                    ps.executeUpdate();
                }
                return Boolean.TRUE;
            });
            if (inserted.isEmpty()) {
                updateDeclared(c, name, hostname, address, maxTenants, portRangeStart, portRangeEnd, now);
            }
        }
        return findByHostname(hostname).orElseThrow(() -> new IllegalStateException("server vanished: " + hostname));
    }

    private int updateDeclared(Connection c, String name, String hostname, String address,
                               int maxTenants, int start, int end, Instant now) throws SQLException {
        try (var ps = c.prepareStatement("""
            UPDATE TB_SERVER
               SET NAME = ?, ADDRESS = ?, MAX_TENANTS = ?, PORT_RANGE_START = ?, PORT_RANGE_END = ?,
                   UPDATED_AT = ?
             WHERE HOSTNAME = ?
        """)) {
            ps.setString(1, name);
            ps.setString(2, address);
            ps.setInt(3, maxTenants);
            ps.setInt(4, start);
            ps.setInt(5, end);
            ps.setTimestamp(6, JdbcUtil.ts(now));
            ps.setString(7, hostname);
            return ps.executeUpdate();
        }
    }

    @Override
    public Optional<Server> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_SERVER WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toServer(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Server> findByHostname(String hostname) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_SERVER WHERE HOSTNAME=?")) {
            ps.setString(1, hostname);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toServer(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Server> findAll() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_SERVER ORDER BY ID");
             var rs = ps.executeQuery()) {
            var out = new ArrayList<Server>();
            while (rs.next()) out.add(RowMappers.toServer(rs));
            return out;
        }
    }

    @Override
    public boolean heartbeat(long id, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_SERVER
               SET LAST_HEARTBEAT = ?,
                   STATUS = CASE WHEN STATUS = 'OFFLINE' THEN 'ACTIVE' ELSE STATUS END,
                   UPDATED_AT = ?
             WHERE ID = ?
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void updateStatus(long id, Server.Status status, Instant now) throws Exception {
        if (status == Server.Status.UNKNOWN) throw new IllegalArgumentException("cannot store UNKNOWN status");
        try (var ps = mustConn().prepareStatement("UPDATE TB_SERVER SET STATUS=?, UPDATED_AT=? WHERE ID=?")) {
            ps.setString(1, status.code());
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            ps.executeUpdate();
        }
    }

    @Override
    public int markOfflineSilentSince(Instant threshold, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_SERVER
               SET STATUS = 'OFFLINE',
                   UPDATED_AT = ?
             WHERE STATUS = 'ACTIVE'
               AND (LAST_HEARTBEAT < ? OR (LAST_HEARTBEAT IS NULL AND CREATED_AT < ?))
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setTimestamp(2, JdbcUtil.ts(threshold));
            ps.setTimestamp(3, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }
}
