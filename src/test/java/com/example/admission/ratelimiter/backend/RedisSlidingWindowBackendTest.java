package com.example.admission.ratelimiter.backend;

import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis Sliding Window 백엔드 단위 테스트
 * SessionCallback 을 mock RedisOperations 위에서 실제로 실행하여 명령 순서와 인자를 검증합니다.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Redis Sliding Window 백엔드 테스트")
class RedisSlidingWindowBackendTest {

    private static final Instant NOW = Instant.parse("2021-01-01T00:00:00Z"); // 1609459200
    private static final String KEY = "rate_limit:ip:1.2.3.4";

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private RedisOperations<String, String> operations;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    private RedisSlidingWindowBackend backend;

    @BeforeEach
    void setUp() {
        backend = new RedisSlidingWindowBackend(redisTemplate, new MutableClock(NOW));
        when(operations.opsForZSet()).thenReturn(zSetOperations);
        // 템플릿에 전달된 콜백을 mock 세션에서 실행
        when(redisTemplate.execute(any(SessionCallback.class)))
                .thenAnswer(invocation -> ((SessionCallback<?>) invocation.getArgument(0)).execute(operations));
    }

    // 첫 번째 EXEC = (삭제 수, ZCARD), 두 번째 EXEC = (ZADD, EXPIRE)
    private void givenTrimResult(long removed, long countInWindow) {
        when(operations.exec()).thenReturn(List.<Object>of(removed, countInWindow), List.<Object>of(true, true));
    }

    @Test
    @DisplayName("윈도우 밖 로그 삭제와 개수 확인을 하나의 트랜잭션으로 실행해야 함")
    void trimsAndCountsInOneTransaction() {
        givenTrimResult(0, 0);

        backend.checkAndRecord(KEY, 3, 60);

        long windowStart = NOW.toEpochMilli() - 60_000;
        InOrder order = inOrder(operations, zSetOperations);
        order.verify(operations).multi();
        order.verify(zSetOperations).removeRangeByScore(KEY, 0, windowStart - 1);
        order.verify(zSetOperations).zCard(KEY);
        order.verify(operations).exec();
    }

    @Test
    @DisplayName("한도 미만이면 기록과 TTL 설정을 함께 실행해야 함")
    void recordsWithTtlInOneTransaction() {
        givenTrimResult(1, 2);

        RateLimitResult result = backend.checkAndRecord(KEY, 3, 60);

        assertTrue(result.isAllowed());
        assertEquals(0, result.getResetAt());
        assertEquals(RedisSlidingWindowBackend.NAME, result.getBackend());

        InOrder order = inOrder(operations, zSetOperations);
        order.verify(zSetOperations).zCard(KEY);
        order.verify(operations).exec();
        order.verify(operations).multi();
        order.verify(zSetOperations).add(eq(KEY), anyString(), eq((double) NOW.toEpochMilli()));
        order.verify(operations).expire(KEY, Duration.ofSeconds(60));
        order.verify(operations).exec();
    }

    @Test
    @DisplayName("ZCARD 결과가 한도에 도달하면 기록하지 않고 now + window 로 거부해야 함")
    void deniesWithoutRecordingAtLimit() {
        givenTrimResult(5, 3);

        RateLimitResult result = backend.checkAndRecord(KEY, 3, 3600);

        assertFalse(result.isAllowed());
        assertEquals(1609459200L + 3600, result.getResetAt());
        verify(zSetOperations, never()).add(anyString(), anyString(), anyDouble());
        verify(operations, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("삭제된 로그 수가 아니라 ZCARD 결과로 판정해야 함")
    void decisionUsesCountNotRemoved() {
        givenTrimResult(10, 0);

        assertTrue(backend.checkAndRecord(KEY, 1, 60).isAllowed());
    }

    @Test
    @DisplayName("Redis 연결 오류는 허용으로 처리되어야 함 (fail-open)")
    void connectionFailureFailsOpen() {
        doThrow(new RedisConnectionFailureException("Connection refused"))
                .when(redisTemplate).execute(any(SessionCallback.class));

        RateLimitResult result = assertDoesNotThrow(() -> backend.checkAndRecord(KEY, 1, 60));

        assertTrue(result.isAllowed());
        assertEquals(0, result.getResetAt());
    }

    @Test
    @DisplayName("기록 단계의 타임아웃도 허용으로 처리되어야 함")
    void timeoutWhileRecordingFailsOpen() {
        when(operations.exec())
                .thenReturn(List.<Object>of(0L, 0L))
                .thenThrow(new QueryTimeoutException("Redis command timed out"));

        RateLimitResult result = backend.checkAndRecord(KEY, 1, 60);

        assertTrue(result.isAllowed());
    }

    @Test
    @DisplayName("비어 있는 트랜잭션 결과는 허용으로 처리되어야 함")
    void discardedTransactionFailsOpen() {
        when(operations.exec()).thenReturn(List.of());

        assertTrue(backend.checkAndRecord(KEY, 1, 60).isAllowed());
        verify(zSetOperations, never()).add(anyString(), anyString(), anyDouble());
    }

    @Test
    @DisplayName("PING 성공 시 사용 가능으로 판단해야 함")
    void availableWhenPingSucceeds() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");

        assertTrue(backend.isAvailable());
    }

    @Test
    @DisplayName("PING 실패 시 사용 불가로 판단해야 함")
    void unavailableWhenPingFails() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertFalse(backend.isAvailable());
    }
}
