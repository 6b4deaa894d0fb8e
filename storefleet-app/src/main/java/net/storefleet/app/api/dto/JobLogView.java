package net.storefleet.app.api.dto;

import net.storefleet.core.model.ProvisioningJob;
import net.storefleet.core.model.ProvisioningLogEntry;

import java.time.Instant;
import java.util.List;

public record JobLogView(
        long jobId,
        Long tenantId,
        String status,
        int stepCursor,
        String stepName,
        String error,
        List<Line> lines
) {
    public record Line(Instant at, String level, String step, String message) { }

    public static JobLogView of(ProvisioningJob job, List<ProvisioningLogEntry> entries) {
        return new JobLogView(job.id(), job.tenantId(), job.status().code(), job.stepCursor(), job.stepName(),
                job.error() == null ? null : job.error().summary(),
                entries.stream()
                        .map(e -> new Line(e.loggedAt(), e.level().name(), e.stepName(), e.message()))
                        .toList());
    }
}
