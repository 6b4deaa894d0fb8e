package net.storefleet.core.model;

import java.time.Instant;
import java.util.Locale;

/** 테넌트별 최근 점검 결과와 연속 실패 수 */
public record TenantHealth(
        long tenantId,
        Status status,
        int consecutiveFailures,
        Instant lastCheckedAt,
        Instant lastAlertAt
) {
    public enum Status {
        UP, DOWN, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
    }
}
