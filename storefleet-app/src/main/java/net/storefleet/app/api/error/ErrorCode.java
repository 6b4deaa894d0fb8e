package net.storefleet.app.api.error;

public enum ErrorCode {
    BAD_REQUEST, TENANT_NOT_FOUND, JOB_NOT_FOUND, ALREADY_IN_FLIGHT, RESOURCE_EXHAUSTED,
    INFRASTRUCTURE, STEP_FAILED, INTERNAL_ERROR
}
