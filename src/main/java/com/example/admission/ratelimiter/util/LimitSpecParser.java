package com.example.admission.ratelimiter.util;

import com.example.admission.ratelimiter.core.LimitSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * "N/unit" 형식의 제한 문자열 파서
 *
 * 잘못된 입력은 예외를 던지지 않고 "제한 없음"으로 처리합니다 (fail-open).
 * 알 수 없는 단위는 hour 로 간주합니다.
 */
@Slf4j
public final class LimitSpecParser {

    private static final long DEFAULT_PERIOD_SECONDS = 3600L;

    private static final Map<String, Long> PERIODS = Map.of(
            "second", 1L,
            "minute", 60L,
            "hour", 3600L,
            "day", 86400L
    );

    private LimitSpecParser() {
    }

    public static LimitSpec parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return LimitSpec.unlimited(raw);
        }

        String[] parts = raw.split("/", -1);
        if (parts.length != 2) {
            log.warn("Invalid rate limit format '{}': expected <count>/<unit>", raw);
            return LimitSpec.unlimited(raw);
        }

        int count;
        try {
            count = Integer.parseInt(parts[0].trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid rate limit format '{}': {}", raw, e.getMessage());
            return LimitSpec.unlimited(raw);
        }
        if (count <= 0) {
            log.warn("Invalid rate limit format '{}': count must be positive", raw);
            return LimitSpec.unlimited(raw);
        }

        // 알 수 없는 단위는 hour
        long windowSeconds = PERIODS.getOrDefault(parts[1].trim(), DEFAULT_PERIOD_SECONDS);
        return LimitSpec.of(count, windowSeconds, raw);
    }
}
