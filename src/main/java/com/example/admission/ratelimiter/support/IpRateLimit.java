package com.example.admission.ratelimiter.support;

import com.example.admission.ratelimiter.core.Dimension;
import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.service.RateLimiterService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;

/**
 * 하나의 제한 문자열에 묶인 IP 기반 검사 도구
 */
@RequiredArgsConstructor
public class IpRateLimit {

    private final RateLimiterService rateLimiterService;
    private final String limit;

    public RateLimitResult check(HttpServletRequest request, @Nullable String endpoint) {
        String clientIp = rateLimiterService.getClientIp(request);
        return rateLimiterService.checkRateLimit(Dimension.IP, clientIp, limit, endpoint);
    }
}
