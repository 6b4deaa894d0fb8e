package net.storefleet.core.spi;

import net.storefleet.core.model.SuspensionLogEntry;

import java.util.List;

public interface SuspensionLogRepository {
    void append(SuspensionLogEntry entry) throws Exception;

    List<SuspensionLogEntry> findByTenant(long tenantId) throws Exception;
}
