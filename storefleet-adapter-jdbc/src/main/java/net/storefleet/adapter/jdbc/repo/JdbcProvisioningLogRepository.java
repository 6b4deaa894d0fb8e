package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.ProvisioningLogEntry;
import net.storefleet.core.spi.ProvisioningLogRepository;

import java.sql.*;
import java.time.Instant;
import java.util.*;

public final class JdbcProvisioningLogRepository implements ProvisioningLogRepository {

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public void append(ProvisioningLogEntry e) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_PROVISIONING_LOG (JOB_ID, TENANT_ID, LOG_LEVEL, STEP_NAME, MESSAGE, LOGGED_AT)
            VALUES (?, ?, ?, ?, ?, ?)
        """)) {
            ps.setLong(1, e.jobId());
            ps.setLong(2, e.tenantId());
            ps.setString(3, e.level().name());
            ps.setString(4, e.stepName());
            ps.setString(5, JdbcUtil.clip(e.message() == null ? "" : e.message(), JdbcTenantRepository.MAX_MESSAGE));
            ps.setTimestamp(6, JdbcUtil.ts(e.loggedAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public List<ProvisioningLogEntry> findByJob(long jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_PROVISIONING_LOG WHERE JOB_ID=? ORDER BY ID")) {
            ps.setLong(1, jobId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<ProvisioningLogEntry>();
                while (rs.next()) out.add(RowMappers.toLogEntry(rs));
                return out;
            }
        }
    }

    @Override
    public int deleteOlderThan(Instant threshold) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_PROVISIONING_LOG WHERE LOGGED_AT < ?")) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }
}
