package net.storefleet.core.pipeline;

import net.storefleet.core.error.ErrorKind;
import net.storefleet.core.model.ProvisioningJob;

import java.util.List;

public record PipelineReport(
        boolean succeeded,
        List<String> completedSteps,
        List<String> skippedSteps,      // best-effort 실패
        String failedStep,
        ErrorKind errorKind,
        String errorMessage,
        boolean rolledBack,
        List<String> rollbackFailures
) {
    static PipelineReport success(List<String> completed, List<String> skipped) {
        return new PipelineReport(true, List.copyOf(completed), List.copyOf(skipped),
                null, null, null, false, List.of());
    }

    static PipelineReport failure(List<String> completed, List<String> skipped, String failedStep,
                                  ErrorKind kind, String message, boolean rolledBack, List<String> rollbackFailures) {
        return new PipelineReport(false, List.copyOf(completed), List.copyOf(skipped),
                failedStep, kind, message, rolledBack, List.copyOf(rollbackFailures));
    }

    public ProvisioningJob.JobError toJobError() {
        return succeeded ? null : new ProvisioningJob.JobError(errorKind, failedStep, errorMessage);
    }
}
