package com.example.admission.ratelimiter.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * "N/unit" 형식의 제한 문자열을 해석한 결과
 * count 가 0 이면 "제한 없음"을 의미합니다.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LimitSpec {

    private final int count;            // 윈도우 내 허용 요청 수
    private final long windowSeconds;   // 윈도우 크기 (초)
    private final String raw;           // 원본 문자열 (응답 헤더에 그대로 사용)

    public static LimitSpec of(int count, long windowSeconds, String raw) {
        return new LimitSpec(count, windowSeconds, raw);
    }

    //제한 없음을 나타내는 LimitSpec 생성
    public static LimitSpec unlimited(String raw) {
        return new LimitSpec(0, 0, raw);
    }

    public boolean isUnlimited() {
        return count == 0;
    }
}
