package net.storefleet.core.lifecycle;

/** 인테이크 협력자가 보내는 신규 테넌트 요청. serverHint 는 선택 */
public record IntakeRequest(String domain, String email, String platform, String planCode, Long serverHint) { }
