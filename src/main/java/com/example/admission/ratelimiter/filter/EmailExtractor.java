package com.example.admission.ratelimiter.filter;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.lang.Nullable;

/**
 * 이메일 기반 제한에 사용할 이메일을 요청에서 꺼냅니다.
 * 본문 형식(JSON, form)에 대한 지식은 구현체에만 둡니다.
 */
@FunctionalInterface
public interface EmailExtractor {

    /**
     * @param request 현재 요청
     * @return 이메일, 없거나 읽을 수 없으면 null (이메일 제한을 건너뜀)
     */
    @Nullable
    String extractEmail(HttpServletRequest request);
}
