package com.example.admission.ratelimiter.filter;

import com.example.admission.ratelimiter.config.RateLimiterProperties;
import com.example.admission.ratelimiter.service.RateLimiterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;

/**
 * Rate Limit Filter 등록 및 설정
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FilterConfiguration {

    private final RateLimiterService rateLimiterService;
    private final RateLimiterProperties rateLimiterProperties;
    private final EndpointNameResolver endpointNameResolver;
    private final EmailExtractor emailExtractor;
    private final Clock clock;

    //RateLimitFilter를 Spring Boot에 등록
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration() {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>();

        registration.setFilter(new RateLimitFilter(
                rateLimiterService, rateLimiterProperties, endpointNameResolver, emailExtractor, clock));

        // 모든 요청에 적용 (제외 경로는 필터 내부에서 판단)
        registration.addUrlPatterns("/*");
        registration.setName("rateLimitFilter");

        // Filter 순서 설정 (가능한 한 빨리 실행되도록)
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);

        log.info("RateLimitFilter registered - excluded paths: {}, endpoint limits: {}",
                rateLimiterProperties.getExcludedPaths(), rateLimiterProperties.getEndpointLimits().keySet());

        return registration;
    }

    //안내용 헤더 필터는 제한 필터 다음에 실행 (제한 필터가 설정한 정책 헤더를 유지)
    @Bean
    public FilterRegistrationBean<RateLimitHeaderFilter> rateLimitHeaderFilterRegistration() {
        FilterRegistrationBean<RateLimitHeaderFilter> registration = new FilterRegistrationBean<>();

        registration.setFilter(new RateLimitHeaderFilter(rateLimiterProperties));
        registration.addUrlPatterns("/*");
        registration.setName("rateLimitHeaderFilter");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 20);

        return registration;
    }
}
