package com.example.admission.ratelimiter.filter;

import com.example.admission.ratelimiter.config.RateLimiterProperties;
import com.example.admission.ratelimiter.util.ResponseUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 제한을 적용하지 않고 안내용 헤더만 붙이는 필터
 *
 * - X-RateLimit-Policy: {@link RateLimitFilter} 가 이미 설정한 값이 없을 때만 기본 안내 문구
 * - X-RateLimit-Service: 서비스 이름
 *
 * 제외 경로를 포함한 모든 응답에 적용됩니다.
 */
@RequiredArgsConstructor
public class RateLimitHeaderFilter extends OncePerRequestFilter {

    private final RateLimiterProperties properties;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        RateLimiterProperties.InfoHeaders infoHeaders = properties.getInfoHeaders();

        if (!response.containsHeader(ResponseUtil.HEADER_RATE_LIMIT_POLICY)
                && StringUtils.hasText(infoHeaders.getPolicy())) {
            response.setHeader(ResponseUtil.HEADER_RATE_LIMIT_POLICY, infoHeaders.getPolicy());
        }
        if (StringUtils.hasText(infoHeaders.getService())) {
            response.setHeader(ResponseUtil.HEADER_RATE_LIMIT_SERVICE, infoHeaders.getService());
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !properties.isEnabled() || !properties.getInfoHeaders().isEnabled();
    }
}
