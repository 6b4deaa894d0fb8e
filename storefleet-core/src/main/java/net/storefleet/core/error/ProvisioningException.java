package net.storefleet.core.error;

public class ProvisioningException extends Exception {
    private final ErrorKind kind;

    public ProvisioningException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProvisioningException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    /** 예외를 분류. 도메인 예외가 아니면 일시적 인프라 실패로 본다 */
    public static ErrorKind classify(Throwable t) {
        if (t instanceof ProvisioningException pe) return pe.kind();
        return ErrorKind.TRANSIENT_INFRASTRUCTURE;
    }
}
