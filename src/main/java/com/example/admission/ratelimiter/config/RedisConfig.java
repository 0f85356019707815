package com.example.admission.ratelimiter.config;

import com.example.admission.ratelimiter.backend.CacheFixedWindowBackend;
import com.example.admission.ratelimiter.model.FixedWindowCounter;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;

/**
 * Rate Limiter 저장소 설정 클래스
 *
 * - Redis Sliding Window 백엔드가 사용할 RedisTemplate
 * - Redis 미연결 시 사용할 Caffeine fallback 백엔드
 * - 판정 시각에 사용할 Clock
 *
 * 연결 문자열과 타임아웃은 spring.data.redis.* (Lettuce) 설정을 따릅니다.
 */
@Slf4j
@Configuration
public class RedisConfig {

    /**
     * RedisTemplate<String, String> Bean 등록
     * Key 와 Value 모두 String 으로 직렬화하여 Redis 에 저장합니다.
     */
    @Bean
    public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        StringRedisSerializer serializer = new StringRedisSerializer();
        template.setKeySerializer(serializer);
        template.setValueSerializer(serializer);
        template.setHashKeySerializer(serializer);
        template.setHashValueSerializer(serializer);

        template.afterPropertiesSet();
        return template;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock rateLimiterClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheFixedWindowBackend cacheFixedWindowBackend(RateLimiterProperties properties, Clock clock) {
        long maximumSize = properties.getFallback().getMaximumSize();
        Cache<String, FixedWindowCounter> counters = CacheFixedWindowBackend.cacheBuilder(maximumSize).build();

        log.info("Fallback fixed-window cache configured with maximumSize: {}", maximumSize);
        return new CacheFixedWindowBackend(counters, clock);
    }
}
