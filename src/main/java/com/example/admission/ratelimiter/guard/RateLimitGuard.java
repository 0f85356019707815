package com.example.admission.ratelimiter.guard;

import com.example.admission.ratelimiter.core.Dimension;
import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.exception.RateLimitExceededException;
import com.example.admission.ratelimiter.service.RateLimiterService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.function.Function;

/**
 * 라우트 단위 Rate Limit 가드
 *
 * ip → user → email 순서로 검사하고 첫 위반에서 {@link RateLimitExceededException} 을 던집니다.
 * 응답 변환은 호출한 쪽(MVC 예외 처리기)이 담당합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitGuard {

    static final String UNKNOWN_ENDPOINT = "unknown";

    private final RateLimiterService rateLimiterService;

    /**
     * 핸들러를 가드로 감쌉니다.
     *
     * @param policy 적용할 제한 조합
     * @param emailLookup 요청에서 이메일을 꺼내는 함수 (없으면 null 반환)
     * @param handler 보호할 핸들러
     */
    public <T> GuardedHandler<T> wrap(GuardPolicy policy,
                                      Function<HttpServletRequest, String> emailLookup,
                                      GuardedHandler<T> handler) {
        return request -> {
            check(policy, request, emailLookup.apply(request));
            return handler.handle(request);
        };
    }

    public <T> GuardedHandler<T> wrap(GuardPolicy policy, GuardedHandler<T> handler) {
        return wrap(policy, request -> null, handler);
    }

    /**
     * 제한 조합을 검사합니다.
     *
     * @throws RateLimitExceededException 제한을 넘은 경우
     */
    public void check(GuardPolicy policy, HttpServletRequest request, @Nullable String email) {
        if (!rateLimiterService.isEnabled()) {
            return;
        }

        String endpoint = StringUtils.hasText(policy.getEndpoint()) ? policy.getEndpoint() : UNKNOWN_ENDPOINT;

        // IP 기반 제한
        if (StringUtils.hasText(policy.getPerIp())) {
            String clientIp = rateLimiterService.getClientIp(request);
            enforce(Dimension.IP, clientIp, policy.getPerIp(), endpoint);
        }

        // 사용자 기반 제한 (익명 요청은 건너뜀)
        if (StringUtils.hasText(policy.getPerUser())) {
            String userId = rateLimiterService.getUserIdentifier(request);
            if (userId != null) {
                enforce(Dimension.USER, userId, policy.getPerUser(), endpoint);
            }
        }

        // 이메일 기반 제한 (이메일 재전송 등)
        if (StringUtils.hasText(policy.getPerEmail()) && StringUtils.hasText(email)) {
            enforce(Dimension.EMAIL, email, policy.getPerEmail(), endpoint);
        }
    }

    private void enforce(Dimension dimension, String identifier, String limit, String endpoint) {
        RateLimitResult result = rateLimiterService.checkRateLimit(dimension, identifier, limit, endpoint);
        if (!result.isAllowed()) {
            log.warn("Rate limit exceeded for {} {} on endpoint {}", dimension.getKeyName(), identifier, endpoint);
            throw new RateLimitExceededException(
                    String.format("Rate limit exceeded: %s. Try again later.", limit),
                    result.getResetAt(),
                    limit);
        }
    }
}
