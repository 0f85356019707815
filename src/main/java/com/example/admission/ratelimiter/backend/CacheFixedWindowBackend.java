package com.example.admission.ratelimiter.backend;

import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.model.FixedWindowCounter;
import com.example.admission.ratelimiter.util.TimeUtil;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * In-memory Fixed Window Counter Backend (Caffeine)
 *
 * 동작 원리:
 * - 키별 정수 카운터를 캐시에 저장하고, 쓰기마다 TTL 을 윈도우 크기로 갱신
 * - 카운터가 한도 이상이면 거부, 아니면 1 증가
 *
 * 단점:
 * - 윈도우 경계에서 최대 약 2배까지 허용될 수 있음
 * - 읽기와 쓰기가 분리되어 있어 동시 요청 시 근사치
 * - 프로세스 로컬 상태 (인스턴스 간 공유되지 않음)
 *
 * Redis 가 기동 시점에 연결되지 않을 때만 사용됩니다.
 */
@Slf4j
public class CacheFixedWindowBackend implements WindowBackend {

    public static final String NAME = "cache-fixed-window";

    private final Cache<String, FixedWindowCounter> counters;
    private final Clock clock;

    public CacheFixedWindowBackend(Cache<String, FixedWindowCounter> counters, Clock clock) {
        this.counters = counters;
        this.clock = clock;
    }

    @Override
    public RateLimitResult checkAndRecord(String key, int limit, long windowSeconds) {
        try {
            FixedWindowCounter current = counters.getIfPresent(key);
            long count = current != null ? current.getCount() : 0;

            if (count >= limit) {
                return RateLimitResult.rejected(TimeUtil.currentTimeSeconds(clock) + windowSeconds, NAME);
            }

            counters.put(key, new FixedWindowCounter(count, windowSeconds).increment());
            return RateLimitResult.allowed(NAME);

        } catch (RuntimeException e) {
            log.error("Cache rate limit check failed for key {}: {}", key, e.getMessage());
            return RateLimitResult.allowed(NAME);
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * 엔트리별 TTL 을 지원하는 Caffeine 빌더
     * 생성/갱신 시 TTL 은 값의 windowSeconds, 읽기는 TTL 에 영향 없음
     */
    public static Caffeine<String, FixedWindowCounter> cacheBuilder(long maximumSize) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, FixedWindowCounter>() {
                    @Override
                    public long expireAfterCreate(String key, FixedWindowCounter value, long currentTime) {
                        return TimeUnit.SECONDS.toNanos(value.getWindowSeconds());
                    }

                    @Override
                    public long expireAfterUpdate(String key, FixedWindowCounter value,
                                                  long currentTime, long currentDuration) {
                        return TimeUnit.SECONDS.toNanos(value.getWindowSeconds());
                    }

                    @Override
                    public long expireAfterRead(String key, FixedWindowCounter value,
                                                long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                });
    }
}
