package com.example.admission.ratelimiter.backend;

import com.example.admission.ratelimiter.core.RateLimitResult;
import com.example.admission.ratelimiter.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Redis Sliding Window Log Backend
 *
 * 동작 원리:
 * - Redis Sorted Set 에 허용된 요청의 타임스탬프(밀리초)를 score 로 저장
 * - MULTI/EXEC 트랜잭션으로 만료된 로그 삭제(ZREMRANGEBYSCORE)와 개수 확인(ZCARD)을 원자적으로 수행
 * - 한도 이내이면 별도 MULTI/EXEC 로 ZADD + EXPIRE (TTL 없는 키가 남지 않도록 함께 실행)
 *
 * 한계:
 * - 개수 확인과 기록 사이에 간격이 있으므로 같은 키에 동시 요청이 몰리면
 *   동시에 처리 중인 요청 수만큼 한도를 넘을 수 있음 (근사 제한기)
 * - Redis 오류 시 요청을 허용 (fail-open)
 */
@Slf4j
@Component
public class RedisSlidingWindowBackend implements WindowBackend {

    public static final String NAME = "redis-sliding-window-log";

    private final RedisTemplate<String, String> redisTemplate;
    private final Clock clock;

    public RedisSlidingWindowBackend(RedisTemplate<String, String> redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public RateLimitResult checkAndRecord(String key, int limit, long windowSeconds) {
        try {
            long currentTime = clock.millis();
            long windowStart = currentTime - TimeUtil.secondsToMillis(windowSeconds);

            // 1~2. 오래된 로그 삭제 + 현재 개수 확인 (원자적 배치)
            long count = trimAndCount(key, windowStart);

            // 3. 한도 이내이면 현재 요청 기록 후 TTL 갱신
            if (count < limit) {
                recordWithTtl(key, currentTime, windowSeconds);
                return RateLimitResult.allowed(NAME);
            }

            // 4. 거부
            return RateLimitResult.rejected(currentTime / 1000 + windowSeconds, NAME);

        } catch (RuntimeException e) {
            log.error("Redis rate limit check failed for key {}: {}", key, e.getMessage());
            return RateLimitResult.allowed(NAME);
        }
    }

    /**
     * Redis 연결 확인 (PING)
     * 서비스 생성 시점에 한 번만 호출됩니다.
     */
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return pong != null;
        } catch (RuntimeException e) {
            log.warn("Redis connection failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    private long trimAndCount(String key, long windowStart) {
        List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = stringOperations(operations);
                ops.multi();
                // score < windowStart 인 로그만 삭제
                ops.opsForZSet().removeRangeByScore(key, 0, windowStart - 1);
                ops.opsForZSet().zCard(key);
                return ops.exec();
            }
        });

        if (results == null || results.size() < 2 || !(results.get(1) instanceof Number)) {
            throw new IllegalStateException("Unexpected transaction result: " + results);
        }
        return ((Number) results.get(1)).longValue();
    }

    private void recordWithTtl(String key, long currentTime, long windowSeconds) {
        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = stringOperations(operations);
                ops.multi();
                ops.opsForZSet().add(key, newMember(currentTime), currentTime);
                ops.expire(key, Duration.ofSeconds(windowSeconds));
                return ops.exec();
            }
        });
    }

    // SessionCallback 은 템플릿의 키/값 타입을 메서드 타입 파라미터로만 넘겨주므로 캐스팅이 필요함
    @SuppressWarnings("unchecked")
    private static RedisOperations<String, String> stringOperations(RedisOperations<?, ?> operations) {
        return (RedisOperations<String, String>) operations;
    }

    //같은 밀리초에 들어온 요청도 서로 다른 멤버가 되도록 난수 접미사 추가
    private static String newMember(long currentTime) {
        return currentTime + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
