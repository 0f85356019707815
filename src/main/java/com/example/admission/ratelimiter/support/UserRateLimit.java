package com.example.admission.ratelimiter.support;

import com.example.admission.ratelimiter.core.Dimension;
import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.service.RateLimiterService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;

/**
 * 하나의 제한 문자열에 묶인 사용자 기반 검사 도구
 * 익명 요청은 백엔드를 조회하지 않고 허용합니다.
 */
@RequiredArgsConstructor
public class UserRateLimit {

    private final RateLimiterService rateLimiterService;
    private final String limit;

    public RateLimitResult check(HttpServletRequest request, @Nullable String endpoint) {
        String userId = rateLimiterService.getUserIdentifier(request);
        if (userId == null) {
            return RateLimitResult.allowed(rateLimiterService.getActiveBackendName());
        }
        return rateLimiterService.checkRateLimit(Dimension.USER, userId, limit, endpoint);
    }
}
