package com.example.admission.ratelimiter.util;

import java.time.Clock;

/**
 * 시간 관련 유틸리티 클래스
 */
public final class TimeUtil {

    // reset 시각을 알 수 없을 때 사용하는 기본 재시도 시간
    public static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

    private TimeUtil() {
    }

    //현재 시간을 초로 반환
    public static long currentTimeSeconds(Clock clock) {
        return clock.millis() / 1000;
    }

    //초를 밀리초로 변환
    public static long secondsToMillis(long seconds) {
        return seconds * 1000;
    }

    //재시도 권장 시간 계산 (초 단위, 최소 1초)
    public static long calculateRetryAfterSeconds(long resetAtSeconds, Clock clock) {
        if (resetAtSeconds <= 0) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
        return Math.max(1, resetAtSeconds - currentTimeSeconds(clock));
    }
}
