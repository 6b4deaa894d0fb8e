package net.storefleet.core.spi;

import java.nio.file.Path;
import java.time.Instant;

public interface UsageProbe {
    long diskBytes(long tenantId, Path workspace) throws Exception;

    /** since 이후 전송된 바이트 (access log 기준) */
    long bandwidthBytes(long tenantId, Instant since) throws Exception;
}
