package net.storefleet.core.model;

public record PlanTier(
        String code,
        String memoryLimit,     // compose mem_limit 표기 (예: 1g)
        String cpuLimit,        // compose cpus 표기 (예: 1.0)
        long diskGb,
        long bandwidthGb
) {
    private static final long GIB = 1024L * 1024 * 1024;

    public long diskBytes() { return diskGb * GIB; }

    public long bandwidthBytes() { return bandwidthGb * GIB; }
}
