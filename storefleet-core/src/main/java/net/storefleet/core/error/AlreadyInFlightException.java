package net.storefleet.core.error;

/** 테넌트에 QUEUED/RUNNING 잡이 이미 있을 때. 큐에 넣지 않고 거부한다. */
public class AlreadyInFlightException extends ProvisioningException {
    private final long tenantId;
    private final Long existingJobId;

    public AlreadyInFlightException(long tenantId, Long existingJobId) {
        super(ErrorKind.VALIDATION, "tenant " + tenantId + " already has an in-flight job"
                + (existingJobId == null ? "" : " (job " + existingJobId + ")"));
        this.tenantId = tenantId;
        this.existingJobId = existingJobId;
    }

    public long tenantId() { return tenantId; }

    public Long existingJobId() { return existingJobId; }
}
