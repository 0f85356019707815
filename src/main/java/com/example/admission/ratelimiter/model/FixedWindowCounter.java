package com.example.admission.ratelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Fixed Window 카운터 상태 (fallback 캐시 값)
 * windowSeconds 는 캐시 엔트리의 TTL 로 사용됩니다.
 */
@Getter
@ToString
@AllArgsConstructor
public class FixedWindowCounter {

    private final long count;          // 현재 윈도우 내 요청 수
    private final long windowSeconds;  // 윈도우 크기 (초)

    public FixedWindowCounter increment() {
        return new FixedWindowCounter(count + 1, windowSeconds);
    }
}
