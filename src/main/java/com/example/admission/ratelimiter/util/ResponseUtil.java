package com.example.admission.ratelimiter.util;

import com.example.admission.ratelimiter.exception.RateLimitExceededException;
import com.example.admission.ratelimiter.exception.RateLimitProblem;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.time.Clock;

/**
 * Rate Limiting 응답 처리 유틸리티
 */
@Slf4j
public final class ResponseUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    // Rate Limiting 관련 HTTP 헤더
    public static final String HEADER_RATE_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RATE_LIMIT_POLICY = "X-RateLimit-Policy";
    public static final String HEADER_RATE_LIMIT_SERVICE = "X-RateLimit-Service";
    public static final String HEADER_RETRY_AFTER = HttpHeaders.RETRY_AFTER;

    private ResponseUtil() {
    }

    /**
     * 429 응답 헤더 생성
     * Retry-After 는 항상, X-RateLimit-Reset / X-RateLimit-Limit 은 값이 있을 때만 포함
     */
    public static HttpHeaders rateLimitHeaders(RateLimitExceededException exception, Clock clock) {
        HttpHeaders headers = new HttpHeaders();
        long resetAt = exception.getResetAt();

        headers.set(HEADER_RETRY_AFTER, String.valueOf(TimeUtil.calculateRetryAfterSeconds(resetAt, clock)));
        if (resetAt > 0) {
            headers.set(HEADER_RATE_LIMIT_RESET, String.valueOf(resetAt));
        }
        if (StringUtils.hasText(exception.getLimit())) {
            headers.set(HEADER_RATE_LIMIT, exception.getLimit());
        }
        return headers;
    }

    /**
     * 429 Too Many Requests 응답 작성 (필터용)
     */
    public static void sendTooManyRequestsResponse(HttpServletResponse response,
                                                   RateLimitExceededException exception,
                                                   Clock clock) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");

        rateLimitHeaders(exception, clock).forEach((name, values) -> response.setHeader(name, values.get(0)));

        response.getWriter().write(objectMapper.writeValueAsString(RateLimitProblem.of(exception.getDetail())));
        response.getWriter().flush();

        log.debug("429 response sent - limit: {}, resetAt: {}", exception.getLimit(), exception.getResetAt());
    }
}
