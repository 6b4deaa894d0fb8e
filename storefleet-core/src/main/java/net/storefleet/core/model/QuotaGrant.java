package net.storefleet.core.model;

import java.time.Instant;

public record QuotaGrant(
        long tenantId,
        String planCode,
        long diskBytes,
        long bandwidthBytes,
        Instant grantedAt
) { }
