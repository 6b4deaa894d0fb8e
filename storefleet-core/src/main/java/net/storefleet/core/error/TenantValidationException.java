package net.storefleet.core.error;

public class TenantValidationException extends ProvisioningException {
    public TenantValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
