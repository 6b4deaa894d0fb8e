package net.storefleet.core.model;

import java.time.Instant;

public record ProvisioningLogEntry(
        Long id,
        long jobId,
        long tenantId,
        Level level,
        String stepName,
        String message,
        Instant loggedAt
) {
    public enum Level { INFO, WARN, ERROR }
}
