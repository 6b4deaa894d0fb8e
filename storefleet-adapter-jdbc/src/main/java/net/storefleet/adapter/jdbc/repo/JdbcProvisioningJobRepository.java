package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.ProvisioningJob;
import net.storefleet.core.spi.ProvisioningJobRepository;

import java.sql.*;
import java.time.Instant;
import java.util.*;

/**
 * 잡 테이블 = 서버별 논리 큐.
 * INFLIGHT_TENANT_ID unique 제약이 테넌트당 QUEUED/RUNNING 1건을 보장한다.
 */
public final class JdbcProvisioningJobRepository implements ProvisioningJobRepository {
    /** 다른 워커가 같은 후보를 먼저 가져간 경우 재시도 횟수 */
    static final int CLAIM_ATTEMPTS = 5;

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public Optional<ProvisioningJob> insertQueued(long tenantId, long serverId, int attempt, Instant now) throws Exception {
        Connection c = mustConn();
        Optional<Long> id = JdbcUtil.attempt(c, () -> {
            try (var ps = c.prepareStatement("""
                INSERT INTO TB_PROVISIONING_JOB
                    (TENANT_ID, SERVER_ID, STATUS, INFLIGHT_TENANT_ID, STEP_CURSOR, ATTEMPT, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, 'QUEUED', ?, 0, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS)) {
                ps.setLong(1, tenantId);
                ps.setLong(2, serverId);
                ps.setLong(3, tenantId);
                ps.setInt(4, attempt);
                ps.setTimestamp(5, JdbcUtil.ts(now));
                ps.setTimestamp(6, JdbcUtil.ts(now));
                ps.executeUpdate();
                try (var keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) throw new SQLException("no generated key for TB_PROVISIONING_JOB");
                    return keys.getLong(1);
                }
            }
        });
        if (id.isEmpty()) return Optional.empty();
        return findById(id.get());
    }

    @Override
    public Optional<ProvisioningJob> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_PROVISIONING_JOB WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<ProvisioningJob> findInFlight(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_PROVISIONING_JOB WHERE INFLIGHT_TENANT_ID=?")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<ProvisioningJob> findByTenant(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_PROVISIONING_JOB WHERE TENANT_ID=? ORDER BY ID")) {
            ps.setLong(1, tenantId);
            return list(ps);
        }
    }

    @Override
    public int countByTenant(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT COUNT(*) FROM TB_PROVISIONING_JOB WHERE TENANT_ID=?")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    @Override
    public Optional<ProvisioningJob> claimNext(long serverId, Instant now) throws Exception {
        Connection c = mustConn();
        for (int i = 0; i < CLAIM_ATTEMPTS; i++) {
            // 1) 가장 오래된 후보
            Long id = null;
            try (var ps = c.prepareStatement("""
                SELECT ID FROM TB_PROVISIONING_JOB
                 WHERE SERVER_ID = ? AND STATUS = 'QUEUED'
                 ORDER BY CREATED_AT ASC, ID ASC
                 FETCH FIRST 1 ROWS ONLY
            """)) {
                ps.setLong(1, serverId);
                try (var rs = ps.executeQuery()) {
                    if (rs.next()) id = rs.getLong(1);
                }
            }
            if (id == null) return Optional.empty();

            // 2) 조건부 전환. 진 경우 다음 후보
            final long candidate = id;
            Optional<Integer> updated = JdbcUtil.attempt(c, () -> {
                try (var up = c.prepareStatement("""
                    UPDATE TB_PROVISIONING_JOB
                       SET STATUS = 'RUNNING',
                           STARTED_AT = ?,
                           UPDATED_AT = ?
                     WHERE ID = ? AND STATUS = 'QUEUED'
                """)) {
                    up.setTimestamp(1, JdbcUtil.ts(now));
                    up.setTimestamp(2, JdbcUtil.ts(now));
                    up.setLong(3, candidate);
                    return up.executeUpdate();
                }
            });
            if (updated.orElse(0) == 1) return findById(candidate);
        }
        return Optional.empty();
    }

    @Override
    public boolean advance(long id, int stepCursor, String stepName, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_PROVISIONING_JOB
               SET STEP_CURSOR = ?, STEP_NAME = ?, UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'RUNNING'
        """)) {
            ps.setInt(1, stepCursor);
            ps.setString(2, stepName);
            ps.setTimestamp(3, JdbcUtil.ts(now));
            ps.setLong(4, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean markSucceeded(long id, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_PROVISIONING_JOB
               SET STATUS = 'SUCCEEDED',
                   INFLIGHT_TENANT_ID = NULL,
                   FINISHED_AT = ?,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'RUNNING'
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean markFailed(long id, ProvisioningJob.JobError error, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_PROVISIONING_JOB
               SET STATUS = 'FAILED',
                   INFLIGHT_TENANT_ID = NULL,
                   ERROR_KIND = ?,
                   ERROR_STEP = ?,
                   ERROR_MESSAGE = ?,
                   FINISHED_AT = ?,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS IN ('QUEUED', 'RUNNING')
        """)) {
            ps.setString(1, error == null || error.kind() == null ? null : error.kind().name());
            ps.setString(2, error == null ? null : error.step());
            ps.setString(3, error == null ? null : JdbcUtil.clip(error.message(), JdbcTenantRepository.MAX_MESSAGE));
            ps.setTimestamp(4, JdbcUtil.ts(now));
            ps.setTimestamp(5, JdbcUtil.ts(now));
            ps.setLong(6, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<ProvisioningJob> findStaleRunning(Instant threshold) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_PROVISIONING_JOB
             WHERE STATUS = 'RUNNING' AND UPDATED_AT < ?
             ORDER BY ID
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return list(ps);
        }
    }

    private static List<ProvisioningJob> list(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            var out = new ArrayList<ProvisioningJob>();
            while (rs.next()) out.add(RowMappers.toJob(rs));
            return out;
        }
    }
}
