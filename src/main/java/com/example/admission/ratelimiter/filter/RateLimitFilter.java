package com.example.admission.ratelimiter.filter;

import com.example.admission.ratelimiter.config.RateLimiterProperties;
import com.example.admission.ratelimiter.core.Dimension;
import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.exception.RateLimitExceededException;
import com.example.admission.ratelimiter.service.RateLimiterService;
import com.example.admission.ratelimiter.util.ResponseUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;

/**
 * 모든 요청에 전역 / 엔드포인트별 Rate Limiting 을 적용하는 서블릿 필터
 *
 * 검사 순서 (첫 위반에서 중단):
 * 전역 IP → 전역 사용자 → 엔드포인트 IP → 엔드포인트 사용자 → 엔드포인트 이메일
 *
 * 필터 내부 오류는 기록만 하고 요청을 통과시킵니다 (fail-open).
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    static final String GLOBAL_ENDPOINT = "global";
    static final String UNKNOWN_ENDPOINT = "unknown";

    private static final String[] STATIC_PATHS = {"/static/", "/media/"};

    private final RateLimiterService rateLimiterService;
    private final RateLimiterProperties properties;
    private final EndpointNameResolver endpointNameResolver;
    private final EmailExtractor emailExtractor;
    private final Clock clock;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        HttpServletRequest effectiveRequest = request;

        try {
            // 1. 엔드포인트 이름 확인
            String endpointName = resolveEndpointName(request);
            RateLimiterProperties.DimensionLimits endpointLimits = properties.getEndpointLimit(endpointName);

            // 2. 이메일 제한이 있는 JSON 요청은 본문을 재사용할 수 있게 캐싱 (크기를 알 수 없거나 크면 이메일 검사 생략)
            if (endpointLimits != null && StringUtils.hasText(endpointLimits.getPerEmail())
                    && CachedBodyHttpServletRequest.isJsonRequest(request)) {
                if (isCacheable(request)) {
                    effectiveRequest = new CachedBodyHttpServletRequest(request);
                } else {
                    log.debug("Request body too large or of unknown length ({} bytes), email rate limit skipped",
                            request.getContentLengthLong());
                }
            }

            // 3. 전역 제한 → 엔드포인트 제한
            applyGlobalRateLimits(effectiveRequest);
            applyEndpointRateLimits(effectiveRequest, endpointName, endpointLimits);

        } catch (RateLimitExceededException e) {
            // 요청 거부 - 429 응답
            ResponseUtil.sendTooManyRequestsResponse(response, e, clock);
            return;
        } catch (Exception e) {
            log.error("Rate limiting error, request passes through", e);
        }

        // 정보용 헤더 (추가 Redis 호출 없음)
        String globalPerIp = properties.getDefaultLimits().getPerIp();
        if (StringUtils.hasText(globalPerIp)) {
            response.setHeader(ResponseUtil.HEADER_RATE_LIMIT_POLICY, globalPerIp);
        }

        filterChain.doFilter(effectiveRequest, response);
    }

    //제외 경로, 정적 파일, 비활성화 상태는 필터를 건너뜀
    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) throws ServletException {
        if (!rateLimiterService.isEnabled()) {
            return true;
        }

        String path = request.getRequestURI().substring(request.getContextPath().length());
        for (String excluded : properties.getExcludedPaths()) {
            if (StringUtils.hasText(excluded) && path.startsWith(excluded)) {
                return true;
            }
        }
        for (String staticPath : STATIC_PATHS) {
            if (path.startsWith(staticPath)) {
                return true;
            }
        }
        return false;
    }

    private boolean isCacheable(HttpServletRequest request) {
        long contentLength = request.getContentLengthLong();
        return contentLength >= 0 && contentLength <= properties.getMaxCachedBodySize().toBytes();
    }

    private String resolveEndpointName(HttpServletRequest request) {
        try {
            String name = endpointNameResolver.resolve(request);
            return StringUtils.hasText(name) ? name : UNKNOWN_ENDPOINT;
        } catch (RuntimeException e) {
            log.debug("Endpoint name resolution failed: {}", e.getMessage());
            return UNKNOWN_ENDPOINT;
        }
    }

    private void applyGlobalRateLimits(HttpServletRequest request) {
        RateLimiterProperties.DimensionLimits globalLimits = properties.getDefaultLimits();
        String clientIp = rateLimiterService.getClientIp(request);
        String userId = rateLimiterService.getUserIdentifier(request);

        if (StringUtils.hasText(globalLimits.getPerIp())) {
            enforce(Dimension.IP, clientIp, globalLimits.getPerIp(), GLOBAL_ENDPOINT,
                    "Global rate limit exceeded: %s. Try again later.");
        }

        if (userId != null && StringUtils.hasText(globalLimits.getPerUser())) {
            enforce(Dimension.USER, userId, globalLimits.getPerUser(), GLOBAL_ENDPOINT,
                    "Global rate limit exceeded: %s. Try again later.");
        }
    }

    private void applyEndpointRateLimits(HttpServletRequest request, String endpointName,
                                         RateLimiterProperties.DimensionLimits endpointLimits) {
        if (endpointLimits == null) {
            return;
        }

        String clientIp = rateLimiterService.getClientIp(request);
        String userId = rateLimiterService.getUserIdentifier(request);

        if (StringUtils.hasText(endpointLimits.getPerIp())) {
            enforce(Dimension.IP, clientIp, endpointLimits.getPerIp(), endpointName,
                    "Rate limit exceeded for this action: %s. Try again later.");
        }

        if (userId != null && StringUtils.hasText(endpointLimits.getPerUser())) {
            enforce(Dimension.USER, userId, endpointLimits.getPerUser(), endpointName,
                    "Rate limit exceeded for this action: %s. Try again later.");
        }

        if (StringUtils.hasText(endpointLimits.getPerEmail())) {
            String email = emailExtractor.extractEmail(request);
            if (StringUtils.hasText(email)) {
                enforce(Dimension.EMAIL, email, endpointLimits.getPerEmail(), endpointName,
                        "Rate limit exceeded for this email: %s. Try again later.");
            }
        }
    }

    private void enforce(Dimension dimension, String identifier, String limit, String endpointName,
                         String detailFormat) {
        RateLimitResult result = rateLimiterService.checkRateLimit(dimension, identifier, limit, endpointName);
        if (!result.isAllowed()) {
            log.warn("Rate limit exceeded - {}: {}, endpoint: {}, limit: {}",
                    dimension.getKeyName(), identifier, endpointName, limit);
            throw new RateLimitExceededException(String.format(detailFormat, limit), result.getResetAt(), limit);
        }
    }
}
