package net.storefleet.app.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import net.storefleet.core.lifecycle.IntakeRequest;

/** 도메인 형식/중복, 플랫폼, 플랜 검증은 코어가 다시 한다 */
public record IntakeBody(
        @NotBlank String domain,
        @NotBlank @Email String email,
        @NotBlank String platform,
        @NotBlank String plan,
        Long serverHint
) {
    public IntakeRequest toRequest() {
        return new IntakeRequest(domain, email, platform, plan, serverHint);
    }
}
