package net.storefleet.core.error;

public class InfrastructureException extends ProvisioningException {
    public InfrastructureException(String message) {
        super(ErrorKind.TRANSIENT_INFRASTRUCTURE, message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_INFRASTRUCTURE, message, cause);
    }
}
