package net.storefleet.core.error;

/** 롤백 대상이 되는 파이프라인 최종 실패 (예: 헬스 확인 타임아웃) */
public class StepFailedException extends ProvisioningException {
    public StepFailedException(String message) {
        super(ErrorKind.TERMINAL_PIPELINE, message);
    }

    public StepFailedException(String message, Throwable cause) {
        super(ErrorKind.TERMINAL_PIPELINE, message, cause);
    }
}
