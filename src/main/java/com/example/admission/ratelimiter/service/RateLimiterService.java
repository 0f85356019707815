package com.example.admission.ratelimiter.service;

import com.example.admission.ratelimiter.backend.CacheFixedWindowBackend;
import com.example.admission.ratelimiter.backend.RedisSlidingWindowBackend;
import com.example.admission.ratelimiter.backend.WindowBackend;
import com.example.admission.ratelimiter.config.RateLimiterProperties;
import com.example.admission.ratelimiter.core.Dimension;
import com.example.admission.ratelimiter.core.LimitSpec;
import com.example.admission.ratelimiter.core.RateLimitKey;
import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.util.KeyBuilder;
import com.example.admission.ratelimiter.util.LimitSpecParser;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.Principal;

/**
 * Rate Limiter 진입점
 *
 * 제한 문자열 해석, 키 생성, 백엔드 선택을 담당합니다.
 * 백엔드는 생성 시점에 Redis 연결을 한 번 확인하여 결정하며 이후 다시 확인하지 않습니다.
 * Redis 가 실행 중 장애가 나더라도 재시작 전까지 Redis 백엔드를 계속 사용합니다 (각 호출은 fail-open).
 */
@Slf4j
@Service
public class RateLimiterService {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    static final String DEFAULT_CLIENT_IP = "127.0.0.1";

    private final RateLimiterProperties properties;
    private final WindowBackend backend;

    public RateLimiterService(RateLimiterProperties properties,
                              RedisSlidingWindowBackend redisBackend,
                              CacheFixedWindowBackend fallbackBackend) {
        this.properties = properties;
        if (redisBackend.isAvailable()) {
            this.backend = redisBackend;
        } else {
            log.warn("Redis unavailable at startup, using in-memory fixed window cache for rate limiting");
            this.backend = fallbackBackend;
        }
        log.info("RateLimiterService initialized - enabled: {}, backend: {}",
                properties.isEnabled(), backend.getName());
    }

    /**
     * 요청이 제한 이내인지 확인하고 기록합니다.
     *
     * @param dimension 제한 축 (ip, user, email, custom)
     * @param identifier IP 주소, 사용자 ID, 이메일 등
     * @param limitSpec "10/hour" 형식의 제한 문자열
     * @param endpoint 엔드포인트별 제한에 사용할 이름 (없으면 null)
     * @return 판정 결과, 예외를 던지지 않음
     */
    public RateLimitResult checkRateLimit(Dimension dimension, String identifier,
                                          String limitSpec, @Nullable String endpoint) {
        if (!properties.isEnabled()) {
            return RateLimitResult.allowed(backend.getName());
        }

        LimitSpec spec = LimitSpecParser.parse(limitSpec);
        if (spec.isUnlimited()) {
            return RateLimitResult.allowed(backend.getName());
        }

        if (!StringUtils.hasText(identifier)) {
            log.debug("Empty {} identifier, skipping rate limit check", dimension.getKeyName());
            return RateLimitResult.allowed(backend.getName());
        }

        String key = KeyBuilder.build(RateLimitKey.builder()
                .dimension(dimension)
                .identifier(identifier)
                .endpoint(endpoint)
                .build());

        RateLimitResult result = backend.checkAndRecord(key, spec.getCount(), spec.getWindowSeconds());
        log.debug("Rate limit check - key: {}, limit: {}, allowed: {}", key, spec.getRaw(), result.isAllowed());
        return result;
    }

    /**
     * 클라이언트 IP 추출
     * 프록시 환경을 고려하여 X-Forwarded-For 의 첫 번째 주소를 우선 사용합니다.
     */
    public String getClientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwardedFor)) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        String remoteAddr = request.getRemoteAddr();
        return StringUtils.hasText(remoteAddr) ? remoteAddr : DEFAULT_CLIENT_IP;
    }

    /**
     * 인증된 사용자 식별자 (익명 요청은 null)
     */
    @Nullable
    public String getUserIdentifier(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        if (principal == null || !StringUtils.hasText(principal.getName())) {
            return null;
        }
        return principal.getName();
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public String getActiveBackendName() {
        return backend.getName();
    }
}
