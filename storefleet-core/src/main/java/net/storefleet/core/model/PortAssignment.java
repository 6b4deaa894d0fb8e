package net.storefleet.core.model;

import java.time.Instant;

public record PortAssignment(
        long serverId,
        int port,
        long tenantId,
        Instant assignedAt
) { }
