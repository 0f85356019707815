package com.example.admission.ratelimiter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rate Limiter 설정 프로퍼티
 * 제한 값은 모두 "N/unit" 문자열 (예: 100/hour)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "rate-limiter")
public class RateLimiterProperties {

    private boolean enabled = true; // Rate Limiter 활성화

    @Valid
    private DimensionLimits defaultLimits = new DimensionLimits(); // 전역 제한 (PER_IP, PER_USER)

    private Map<String, DimensionLimits> endpointLimits = new HashMap<>(); // 엔드포인트 이름별 제한

    private List<String> excludedPaths = new ArrayList<>(List.of( // 제한을 적용하지 않는 경로 prefix
            "/admin/",
            "/api/schema/",
            "/api/docs/",
            "/api/redoc/",
            "/health/",
            "/ping/",
            "/actuator/"
    ));

    private DataSize maxCachedBodySize = DataSize.ofKilobytes(64); // 이메일 추출을 위해 캐싱할 JSON 본문 최대 크기

    @Valid
    private Fallback fallback = new Fallback(); // Redis 미연결 시 사용하는 캐시 설정

    @Valid
    private InfoHeaders infoHeaders = new InfoHeaders(); // 모든 응답에 붙이는 안내용 헤더

    @Data
    public static class DimensionLimits {
        private String perIp;
        private String perUser;
        private String perEmail; // 엔드포인트 제한에서만 사용
    }

    @Data
    public static class InfoHeaders {
        private boolean enabled = true;
        private String policy = "See API documentation for limits"; // X-RateLimit-Policy 기본값
        private String service = "admission-control";               // X-RateLimit-Service
    }

    @Data
    public static class Fallback {
        @Min(1)
        private long maximumSize = 100_000;
    }

    /**
     * 엔드포인트 제한 조회 (없으면 null)
     */
    public DimensionLimits getEndpointLimit(String endpointName) {
        return endpointLimits.get(endpointName);
    }
}
