package net.storefleet.core.spi;

import net.storefleet.core.model.UsageSample;

import java.time.LocalDate;
import java.util.Optional;

public interface UsageRepository {
    /** (tenantId, sampleDate) 자연키 upsert */
    void upsertSample(UsageSample sample) throws Exception;

    Optional<UsageSample> findSample(long tenantId, LocalDate date) throws Exception;
}
