package net.storefleet.core.spi;

import net.storefleet.core.model.ProvisioningLogEntry;

import java.time.Instant;
import java.util.List;

public interface ProvisioningLogRepository {
    void append(ProvisioningLogEntry entry) throws Exception;

    List<ProvisioningLogEntry> findByJob(long jobId) throws Exception;

    int deleteOlderThan(Instant threshold) throws Exception;
}
