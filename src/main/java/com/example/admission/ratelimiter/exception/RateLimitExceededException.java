package com.example.admission.ratelimiter.exception;

import lombok.Getter;

/**
 * 요청 한도 초과 예외
 *
 * Rate Limiter 밖으로 전달되는 유일한 예외입니다.
 * {@link RateLimitExceptionHandler} 가 429 응답으로 변환합니다.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final long resetAt;   // 제한이 풀리는 시각 (epoch 초, 모르면 0)
    private final String limit;   // 위반한 제한 문자열

    public RateLimitExceededException(String detail, long resetAt, String limit) {
        super(detail);
        this.resetAt = resetAt;
        this.limit = limit;
    }

    public String getDetail() {
        return getMessage();
    }
}
