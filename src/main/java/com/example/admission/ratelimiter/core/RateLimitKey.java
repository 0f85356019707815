package com.example.admission.ratelimiter.core;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.springframework.lang.Nullable;

/**
 * Rate Limit 키의 구성 요소
 * 실제 백엔드 키 문자열은 {@link com.example.admission.ratelimiter.util.KeyBuilder}가 만듭니다.
 */
@Getter
@Builder
@ToString
public class RateLimitKey {

    @NonNull
    private final Dimension dimension;

    @NonNull
    private final String identifier;

    @Nullable
    private final String endpoint;
}
