package com.example.admission.ratelimiter.filter;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.lang.Nullable;

/**
 * 요청을 처리할 엔드포인트의 논리 이름을 찾습니다.
 * 엔드포인트별 제한(rate-limiter.endpoint-limits)의 키로 사용됩니다.
 */
@FunctionalInterface
public interface EndpointNameResolver {

    /**
     * @param request 현재 요청
     * @return 엔드포인트 이름, 찾지 못하면 null
     */
    @Nullable
    String resolve(HttpServletRequest request);
}
