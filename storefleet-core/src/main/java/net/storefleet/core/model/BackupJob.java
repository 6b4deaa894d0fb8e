package net.storefleet.core.model;

import java.time.Instant;
import java.util.Locale;

public record BackupJob(
        Long id,
        long tenantId,
        Kind kind,
        Scope scope,
        Status status,
        String snapshotId,
        String errorMessage,
        Instant createdAt,
        Instant finishedAt
) {
    public enum Kind { BACKUP, RESTORE }

    public enum Scope {
        DB, FILES, BOTH;

        public static Scope from(String s) {
            if (s == null) return BOTH;
            return Scope.valueOf(s.trim().toUpperCase(Locale.ROOT));
        }
        /** 외부 스크립트 인자 표기 */
        public String arg() { return name().toLowerCase(Locale.ROOT); }
    }

    public enum Status {
        RUNNING, COMPLETED, FAILED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
    }
}
