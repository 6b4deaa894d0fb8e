package net.storefleet.adapter.jdbc.repo;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.adapter.jdbc.mapper.RowMappers;
import net.storefleet.core.model.BackupJob;
import net.storefleet.core.spi.BackupJobRepository;

import java.sql.*;
import java.time.Instant;
import java.util.*;

public final class JdbcBackupJobRepository implements BackupJobRepository {

    private Connection mustConn() { return TxContext.require(); }

    @Override
    public BackupJob insertRunning(long tenantId, BackupJob.Kind kind, BackupJob.Scope scope, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_BACKUP_JOB (TENANT_ID, KIND, SCOPE, STATUS, CREATED_AT)
            VALUES (?, ?, ?, 'RUNNING', ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, tenantId);
            ps.setString(2, kind.name());
            ps.setString(3, scope.name());
            ps.setTimestamp(4, JdbcUtil.ts(now));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no generated key for TB_BACKUP_JOB");
                return new BackupJob(keys.getLong(1), tenantId, kind, scope, BackupJob.Status.RUNNING,
                        null, null, now, null);
            }
        }
    }

    @Override
    public void markCompleted(long id, String snapshotId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_BACKUP_JOB
               SET STATUS = 'COMPLETED', SNAPSHOT_ID = ?, FINISHED_AT = ?
             WHERE ID = ? AND STATUS = 'RUNNING'
        """)) {
            ps.setString(1, snapshotId);
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void markFailed(long id, String errorMessage, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_BACKUP_JOB
               SET STATUS = 'FAILED', ERROR_MESSAGE = ?, FINISHED_AT = ?
             WHERE ID = ? AND STATUS = 'RUNNING'
        """)) {
            ps.setString(1, JdbcUtil.clip(errorMessage, JdbcTenantRepository.MAX_MESSAGE));
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<BackupJob> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_BACKUP_JOB WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toBackupJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<BackupJob> findByTenant(long tenantId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_BACKUP_JOB WHERE TENANT_ID=? ORDER BY ID")) {
            ps.setLong(1, tenantId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<BackupJob>();
                while (rs.next()) out.add(RowMappers.toBackupJob(rs));
                return out;
            }
        }
    }
}
