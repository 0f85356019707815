package com.example.admission.ratelimiter.support;

import com.example.admission.ratelimiter.core.Dimension;
import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.service.RateLimiterService;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;

/**
 * 하나의 제한 문자열에 묶인 이메일 기반 검사 도구
 */
@RequiredArgsConstructor
public class EmailRateLimit {

    private final RateLimiterService rateLimiterService;
    private final String limit;

    public RateLimitResult check(String email, @Nullable String endpoint) {
        return rateLimiterService.checkRateLimit(Dimension.EMAIL, email, limit, endpoint);
    }
}
