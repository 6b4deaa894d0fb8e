package net.storefleet.core.spi;

import net.storefleet.core.model.QuotaGrant;

import java.util.Optional;

public interface QuotaRepository {
    QuotaGrant upsert(QuotaGrant grant) throws Exception;

    Optional<QuotaGrant> findByTenant(long tenantId) throws Exception;

    int delete(long tenantId) throws Exception;
}
