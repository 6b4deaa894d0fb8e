package net.storefleet.core.model;

import java.time.Instant;
import java.util.Locale;

public record HealthAlert(
        Long id,
        long tenantId,
        Kind kind,
        String detail,
        int consecutiveFailures,
        Instant raisedAt
) {
    public enum Kind {
        DOWN, RECOVERED;

        public static Kind from(String s) { return Kind.valueOf(s.toUpperCase(Locale.ROOT)); }

        public String code() { return name(); }
    }
}
