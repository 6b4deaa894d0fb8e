package net.storefleet.core.model;

import java.time.Instant;

public record SuspensionLogEntry(
        Long id,
        long tenantId,
        Action action,
        String reason,
        boolean automatic,
        Instant loggedAt
) {
    public enum Action { SUSPEND, REACTIVATE }
}
