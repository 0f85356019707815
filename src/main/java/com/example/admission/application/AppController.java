package com.example.admission.application;

import com.example.admission.application.request.LoginRequest;
import com.example.admission.application.request.PasswordResetRequest;
import com.example.admission.application.request.ResendVerificationRequest;
import com.example.admission.application.response.MessageResponse;
import com.example.admission.ratelimiter.annotation.RateLimited;
import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.exception.RateLimitExceededException;
import com.example.admission.ratelimiter.service.RateLimiterService;
import com.example.admission.ratelimiter.support.EmailRateLimit;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Rate Limiting 적용 예시 컨트롤러
 *
 * - login: application.yml 의 endpoint-limits 로 필터에서 제한
 * - resendVerification: @RateLimited 가드
 * - passwordReset: EmailRateLimit 직접 호출
 */
@RestController
public class AppController {

    static final String PASSWORD_RESET_EMAIL_LIMIT = "3/hour";

    private final RateLimiterService rateLimiterService;
    private final EmailRateLimit passwordResetEmailLimit;

    public AppController(RateLimiterService rateLimiterService) {
        this.rateLimiterService = rateLimiterService;
        this.passwordResetEmailLimit = new EmailRateLimit(rateLimiterService, PASSWORD_RESET_EMAIL_LIMIT);
    }

    @GetMapping(value = "/api/status", name = "status")
    public MessageResponse status() {
        return response("Rate limiter " + (rateLimiterService.isEnabled() ? "enabled" : "disabled"));
    }

    @PostMapping(value = "/api/auth/login", name = "login")
    public MessageResponse login(@Valid @RequestBody LoginRequest request) {
        return response("Login accepted for " + request.getEmail());
    }

    @PostMapping(value = "/api/auth/resend-verification", name = "resend_verification")
    @RateLimited(perIp = "10/hour", perEmail = "3/hour", endpoint = "resend_verification")
    public MessageResponse resendVerification(@Valid @RequestBody ResendVerificationRequest request) {
        return response("Verification email queued");
    }

    @PostMapping(value = "/api/auth/password-reset", name = "password_reset")
    public MessageResponse passwordReset(@Valid @RequestBody PasswordResetRequest request) {
        RateLimitResult result = passwordResetEmailLimit.check(request.getEmail(), "password_reset");
        if (!result.isAllowed()) {
            throw new RateLimitExceededException(
                    "Rate limit exceeded for this email: " + PASSWORD_RESET_EMAIL_LIMIT + ". Try again later.",
                    result.getResetAt(),
                    PASSWORD_RESET_EMAIL_LIMIT);
        }
        return response("Password reset email queued");
    }

    private MessageResponse response(String message) {
        return MessageResponse.builder()
                .message(message)
                .backend(rateLimiterService.getActiveBackendName())
                .build();
    }
}
