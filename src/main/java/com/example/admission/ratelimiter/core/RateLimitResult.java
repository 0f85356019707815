package com.example.admission.ratelimiter.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Rate Limiting 판정 결과를 담는 클래스
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class RateLimitResult {

    private final boolean allowed; // 요청 허용 여부 (true: 허용, false: 거부)
    private final long resetAt; // 제한이 풀리는 시각 (epoch 초 단위, 허용 시 0)
    private final String backend; // 판정을 내린 백엔드 이름

    //허용된 요청을 생성하는 정적 메소드
    public static RateLimitResult allowed(String backend) {
        return RateLimitResult.builder()
                .allowed(true)
                .resetAt(0)
                .backend(backend)
                .build();
    }

    //거부된 요청을 생성하는 정적 메소드
    public static RateLimitResult rejected(long resetAt, String backend) {
        return RateLimitResult.builder()
                .allowed(false)
                .resetAt(resetAt)
                .backend(backend)
                .build();
    }
}
