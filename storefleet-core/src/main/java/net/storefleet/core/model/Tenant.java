package net.storefleet.core.model;

import java.time.Instant;
import java.util.Locale;

public record Tenant(
        Long id,
        String domain,
        String email,
        Platform platform,
        String planCode,
        Status status,          // PENDING/PROVISIONING/ACTIVE/SUSPENDED/FAILED
        Long serverId,
        Integer webPort,        // ACTIVE/SUSPENDED 동안 non-null (DB CHECK)
        boolean tlsEnabled,
        String suspensionReason,
        boolean autoSuspended,
        Instant suspendedAt,
        Instant reactivatedAt,
        String sealedCredentials,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt
) {
    public enum Status {
        PENDING, PROVISIONING, ACTIVE, SUSPENDED, FAILED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    public boolean retryable() { return status == Status.FAILED; }

    public String storeUrl() { return (tlsEnabled ? "https://" : "http://") + domain; }

    public String adminUrl() {
        return storeUrl() + (platform == Platform.MAGENTO ? "/admin" : "/wp-admin");
    }
}
