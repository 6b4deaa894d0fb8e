package net.storefleet.adapter.jdbc.mapper;

import net.storefleet.adapter.jdbc.JdbcUtil;
import net.storefleet.core.error.ErrorKind;
import net.storefleet.core.model.*;

import java.sql.*;
import java.time.LocalDate;

public final class RowMappers {
    private RowMappers() {}

    // --- Server ---
    public static Server toServer(ResultSet rs) throws SQLException {
        return new Server(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("HOSTNAME"),
                rs.getString("ADDRESS"),
                Server.Status.from(rs.getString("STATUS")),
                rs.getInt("MAX_TENANTS"),
                rs.getInt("PORT_RANGE_START"),
                rs.getInt("PORT_RANGE_END"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_HEARTBEAT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- Tenant ---
    public static Tenant toTenant(ResultSet rs) throws SQLException {
        return new Tenant(
                rs.getLong("ID"),
                rs.getString("DOMAIN_NAME"),
                rs.getString("EMAIL"),
                Platform.from(rs.getString("PLATFORM")),
                rs.getString("PLAN_CODE"),
                Tenant.Status.from(rs.getString("STATUS")),
                JdbcUtil.getLongOrNull(rs, "SERVER_ID"),
                JdbcUtil.getInteger(rs, "WEB_PORT"),
                JdbcUtil.isY(rs.getString("TLS_ENABLED")),
                rs.getString("SUSPENSION_REASON"),
                JdbcUtil.isY(rs.getString("AUTO_SUSPENDED")),
                JdbcUtil.toInstant(rs.getTimestamp("SUSPENDED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("REACTIVATED_AT")),
                rs.getString("SEALED_CREDENTIALS"),
                rs.getString("ERROR_MESSAGE"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- ProvisioningJob ---
    public static ProvisioningJob toJob(ResultSet rs) throws SQLException {
        String kind = rs.getString("ERROR_KIND");
        ProvisioningJob.JobError error = kind == null ? null
                : new ProvisioningJob.JobError(ErrorKind.from(kind), rs.getString("ERROR_STEP"), rs.getString("ERROR_MESSAGE"));
        return new ProvisioningJob(
                rs.getLong("ID"),
                rs.getLong("TENANT_ID"),
                rs.getLong("SERVER_ID"),
                ProvisioningJob.Status.from(rs.getString("STATUS")),
                rs.getInt("STEP_CURSOR"),
                rs.getString("STEP_NAME"),
                rs.getInt("ATTEMPT"),
                error,
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT"))
        );
    }

    // --- PortAssignment ---
    public static PortAssignment toPortAssignment(ResultSet rs) throws SQLException {
        return new PortAssignment(
                rs.getLong("SERVER_ID"),
                rs.getInt("PORT"),
                rs.getLong("TENANT_ID"),
                rs.getTimestamp("ASSIGNED_AT").toInstant()
        );
    }

    // --- Quota / usage ---
    public static QuotaGrant toQuota(ResultSet rs) throws SQLException {
        return new QuotaGrant(
                rs.getLong("TENANT_ID"),
                rs.getString("PLAN_CODE"),
                rs.getLong("DISK_BYTES"),
                rs.getLong("BANDWIDTH_BYTES"),
                rs.getTimestamp("GRANTED_AT").toInstant()
        );
    }

    public static UsageSample toUsageSample(ResultSet rs) throws SQLException {
        return new UsageSample(
                rs.getLong("TENANT_ID"),
                rs.getObject("SAMPLE_DATE", LocalDate.class),
                rs.getLong("DISK_BYTES"),
                rs.getLong("BANDWIDTH_BYTES"),
                rs.getTimestamp("SAMPLED_AT").toInstant()
        );
    }

    public static ResourceAlert toAlert(ResultSet rs) throws SQLException {
        return new ResourceAlert(
                rs.getLong("ID"),
                rs.getLong("TENANT_ID"),
                ResourceAlert.Kind.from(rs.getString("KIND")),
                rs.getDouble("USAGE_PERCENT"),
                rs.getLong("USAGE_BYTES"),
                rs.getLong("LIMIT_BYTES"),
                rs.getTimestamp("NOTIFIED_AT").toInstant()
        );
    }

    // --- tenant health ---
    public static TenantHealth toTenantHealth(ResultSet rs) throws SQLException {
        return new TenantHealth(
                rs.getLong("TENANT_ID"),
                TenantHealth.Status.from(rs.getString("STATUS")),
                rs.getInt("CONSECUTIVE_FAILURES"),
                rs.getTimestamp("LAST_CHECKED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_ALERT_AT"))
        );
    }

    public static HealthAlert toHealthAlert(ResultSet rs) throws SQLException {
        return new HealthAlert(
                rs.getLong("ID"),
                rs.getLong("TENANT_ID"),
                HealthAlert.Kind.from(rs.getString("KIND")),
                rs.getString("DETAIL"),
                rs.getInt("CONSECUTIVE_FAILURES"),
                rs.getTimestamp("RAISED_AT").toInstant()
        );
    }

    // --- logs ---
    public static ProvisioningLogEntry toLogEntry(ResultSet rs) throws SQLException {
        return new ProvisioningLogEntry(
                rs.getLong("ID"),
                rs.getLong("JOB_ID"),
                rs.getLong("TENANT_ID"),
                ProvisioningLogEntry.Level.valueOf(rs.getString("LOG_LEVEL")),
                rs.getString("STEP_NAME"),
                rs.getString("MESSAGE"),
                rs.getTimestamp("LOGGED_AT").toInstant()
        );
    }

    public static SuspensionLogEntry toSuspension(ResultSet rs) throws SQLException {
        return new SuspensionLogEntry(
                rs.getLong("ID"),
                rs.getLong("TENANT_ID"),
                SuspensionLogEntry.Action.valueOf(rs.getString("ACTION")),
                rs.getString("REASON"),
                JdbcUtil.isY(rs.getString("AUTOMATIC")),
                rs.getTimestamp("LOGGED_AT").toInstant()
        );
    }

    // --- BackupJob ---
    public static BackupJob toBackupJob(ResultSet rs) throws SQLException {
        return new BackupJob(
                rs.getLong("ID"),
                rs.getLong("TENANT_ID"),
                BackupJob.Kind.valueOf(rs.getString("KIND")),
                BackupJob.Scope.from(rs.getString("SCOPE")),
                BackupJob.Status.from(rs.getString("STATUS")),
                rs.getString("SNAPSHOT_ID"),
                rs.getString("ERROR_MESSAGE"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT"))
        );
    }
}
