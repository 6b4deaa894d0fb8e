package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.UsageSample;
import net.storefleet.core.spi.UsageRepository;

import java.sql.*;
import java.time.LocalDate;
import java.util.*;

/** (TENANT_ID, SAMPLE_DATE) 하루 한 행 */
public final class JdbcUsageRepository implements UsageRepository {

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public void upsertSample(UsageSample s) throws Exception {
        Connection c = mustConn();
        if (update(c, s) > 0) return;
        Optional<Integer> inserted = JdbcUtil.attempt(c, () -> {
            try (var ps = c.prepareStatement("""
                INSERT INTO TB_USAGE_SAMPLE (TENANT_ID, SAMPLE_DATE, DISK_BYTES, BANDWIDTH_BYTES, SAMPLED_AT)
                VALUES (?, ?, ?, ?, ?)
            """)) {
                ps.setLong(1, s.tenantId());
                ps.setObject(2, s.sampleDate());
                ps.setLong(3, s.diskBytes());
                ps.setLong(4, s.bandwidthBytes());
                ps.setTimestamp(5, JdbcUtil.ts(s.sampledAt()));
                return ps.executeUpdate();
            }
        });
        if (inserted.isEmpty()) update(c, s);
    }

    private static int update(Connection c, UsageSample s) throws SQLException {
        try (var ps = c.prepareStatement("""
            UPDATE TB_USAGE_SAMPLE
               SET DISK_BYTES = ?, BANDWIDTH_BYTES = ?, SAMPLED_AT = ?
             WHERE TENANT_ID = ? AND SAMPLE_DATE = ?
        """)) {
            ps.setLong(1, s.diskBytes());
            ps.setLong(2, s.bandwidthBytes());
            ps.setTimestamp(3, JdbcUtil.ts(s.sampledAt()));
            ps.setLong(4, s.tenantId());
            ps.setObject(5, s.sampleDate());
            return ps.executeUpdate();
        }
    }

    @Override
    public Optional<UsageSample> findSample(long tenantId, LocalDate date) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_USAGE_SAMPLE WHERE TENANT_ID=? AND SAMPLE_DATE=?")) {
            ps.setLong(1, tenantId);
            ps.setObject(2, date);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toUsageSample(rs)) : Optional.empty();
            }
        }
    }
}
