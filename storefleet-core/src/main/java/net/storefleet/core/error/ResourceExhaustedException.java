package net.storefleet.core.error;

public class ResourceExhaustedException extends ProvisioningException {
    public ResourceExhaustedException(String message) {
        super(ErrorKind.RESOURCE_EXHAUSTED, message);
    }
}
