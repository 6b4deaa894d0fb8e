package net.storefleet.core.model;

import java.time.Instant;
import java.time.LocalDate;

/** (tenantId, sampleDate) 자연키로 upsert 되는 일 단위 측정값 */
public record UsageSample(
        long tenantId,
        LocalDate sampleDate,
        long diskBytes,
        long bandwidthBytes,    // 과금 주기 시작 이후 누적
        Instant sampledAt
) { }
