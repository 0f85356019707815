package com.example.admission.application.request;

import com.example.admission.ratelimiter.guard.EmailPayload;
import jakarta.validation.constraints.Email;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 인증 메일 재전송 요청 DTO
 * 이메일이 있으면 @RateLimited(perEmail) 제한 대상
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResendVerificationRequest implements EmailPayload {

    @Email
    private String email;
}
