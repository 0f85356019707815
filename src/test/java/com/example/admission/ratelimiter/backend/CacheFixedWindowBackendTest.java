package com.example.admission.ratelimiter.backend;

import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.model.FixedWindowCounter;
import com.example.admission.ratelimiter.support.MutableClock;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Caffeine Fixed Window fallback 백엔드 테스트
 * Ticker 와 Clock 을 함께 움직여 TTL 만료를 검증합니다.
 */
@DisplayName("Cache Fixed Window 백엔드 테스트")
class CacheFixedWindowBackendTest {

    private final AtomicLong nanos = new AtomicLong();
    private MutableClock clock;
    private Cache<String, FixedWindowCounter> counters;
    private CacheFixedWindowBackend backend;

    @BeforeEach
    void setUp() {
        Ticker ticker = nanos::get;
        clock = new MutableClock(Instant.parse("2021-01-01T00:00:00Z"));
        counters = CacheFixedWindowBackend.cacheBuilder(1_000).ticker(ticker).build();
        backend = new CacheFixedWindowBackend(counters, clock);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
        clock.advance(duration);
    }

    @Test
    @DisplayName("한도까지 허용하고 초과 요청은 거부해야 함")
    void allowsUpToLimitThenDenies() {
        for (int i = 1; i <= 3; i++) {
            RateLimitResult result = backend.checkAndRecord("k", 3, 60);
            assertTrue(result.isAllowed(), i + "번째 요청은 허용되어야 합니다");
            assertEquals(0, result.getResetAt());
        }

        RateLimitResult denied = backend.checkAndRecord("k", 3, 60);

        assertFalse(denied.isAllowed(), "4번째 요청은 거부되어야 합니다");
        assertEquals(1609459200L + 60, denied.getResetAt());
        assertEquals(CacheFixedWindowBackend.NAME, denied.getBackend());
    }

    @Test
    @DisplayName("거부된 요청은 카운터를 증가시키지 않아야 함")
    void deniedRequestsAreNotCounted() {
        backend.checkAndRecord("k", 1, 60);
        backend.checkAndRecord("k", 1, 60);
        backend.checkAndRecord("k", 1, 60);

        assertEquals(1, counters.getIfPresent("k").getCount());
    }

    @Test
    @DisplayName("TTL 이 지나면 카운터가 사라지고 다시 허용되어야 함")
    void counterExpiresAfterWindow() {
        backend.checkAndRecord("k", 1, 60);
        assertFalse(backend.checkAndRecord("k", 1, 60).isAllowed());

        advance(Duration.ofSeconds(61));
        counters.cleanUp();

        assertNull(counters.getIfPresent("k"));
        assertTrue(backend.checkAndRecord("k", 1, 60).isAllowed(), "윈도우 이후에는 허용되어야 합니다");
    }

    @Test
    @DisplayName("허용된 쓰기마다 TTL 이 갱신되어야 함")
    void writesRefreshTtl() {
        backend.checkAndRecord("k", 3, 60);
        advance(Duration.ofSeconds(40));
        backend.checkAndRecord("k", 3, 60);
        advance(Duration.ofSeconds(40));

        assertNotNull(counters.getIfPresent("k"), "두 번째 쓰기 이후 60초가 지나지 않았으므로 남아 있어야 합니다");
        assertEquals(2, counters.getIfPresent("k").getCount());
    }

    @Test
    @DisplayName("키별로 독립적으로 집계되어야 함")
    void keysAreIndependent() {
        assertTrue(backend.checkAndRecord("a", 1, 60).isAllowed());
        assertFalse(backend.checkAndRecord("a", 1, 60).isAllowed());

        assertTrue(backend.checkAndRecord("b", 1, 60).isAllowed());
    }

    @Test
    @DisplayName("캐시 오류는 허용으로 처리되어야 함 (fail-open)")
    void cacheErrorsFailOpen() {
        Cache<String, FixedWindowCounter> broken = mock(Cache.class);
        when(broken.getIfPresent(anyString())).thenThrow(new IllegalStateException("boom"));
        CacheFixedWindowBackend brokenBackend = new CacheFixedWindowBackend(broken, clock);

        RateLimitResult result = assertDoesNotThrow(() -> brokenBackend.checkAndRecord("k", 1, 60));

        assertTrue(result.isAllowed());
        assertEquals(0, result.getResetAt());
    }
}
