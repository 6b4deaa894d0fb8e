package net.storefleet.core.model;

import net.storefleet.core.error.ErrorKind;

import java.time.Instant;
import java.util.Locale;

public record ProvisioningJob(
        Long id,
        Long tenantId,
        Long serverId,
        Status status,          // QUEUED/RUNNING/SUCCEEDED/FAILED
        int stepCursor,         // 마지막으로 시작한 스텝 번호 (1-base, 0 = 아직 없음)
        String stepName,
        int attempt,
        JobError error,         // FAILED 일 때만
        Instant createdAt,
        Instant startedAt,
        Instant updatedAt,
        Instant finishedAt
) {
    public enum Status {
        QUEUED, RUNNING, SUCCEEDED, FAILED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    /** 구조화된 실패 정보 */
    public record JobError(ErrorKind kind, String step, String message) {
        public String summary() {
            return step == null ? message : "[" + step + "] " + message;
        }
    }

    public boolean inFlight() {
        return status == Status.QUEUED || status == Status.RUNNING;
    }
}
