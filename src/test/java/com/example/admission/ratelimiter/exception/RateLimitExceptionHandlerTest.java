package com.example.admission.ratelimiter.exception;

import com.example.admission.ratelimiter.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateLimitExceptionHandler 테스트")
class RateLimitExceptionHandlerTest {

    private static final Instant NOW = Instant.parse("2021-01-01T00:00:00Z"); // 1609459200

    private final RateLimitExceptionHandler handler = new RateLimitExceptionHandler(new MutableClock(NOW));
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/resend-verification");

    @Test
    @DisplayName("429 상태, 헤더, 본문으로 변환해야 함")
    void convertsTo429() throws Exception {
        RateLimitExceededException ex = new RateLimitExceededException(
                "Rate limit exceeded: 3/hour. Try again later.", NOW.getEpochSecond() + 3600, "3/hour");

        ResponseEntity<RateLimitProblem> response = handler.handleRateLimit(ex, request);

        assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
        HttpHeaders headers = response.getHeaders();
        assertEquals("3600", headers.getFirst(HttpHeaders.RETRY_AFTER));
        assertEquals("3/hour", headers.getFirst("X-RateLimit-Limit"));
        assertEquals("1609462800", headers.getFirst("X-RateLimit-Reset"));

        RateLimitProblem body = response.getBody();
        assertNotNull(body);
        assertEquals(429, body.getStatus());
        assertEquals("Rate limit exceeded: 3/hour. Try again later.", body.getDetail());

        JsonNode json = new ObjectMapper().valueToTree(body);
        assertEquals("errors.rate_limit_exceeded", json.get("i18n_key").asText());
        assertEquals("VDJ-GEN-RATE-429", json.get("code").asText());
        assertFalse(json.has("i18nKey"));
    }

    @Test
    @DisplayName("reset 시각을 모르면 Retry-After 는 60, Reset 헤더는 생략해야 함")
    void unknownResetDefaultsRetryAfter() {
        RateLimitExceededException ex = new RateLimitExceededException("Rate limit exceeded", 0, null);

        HttpHeaders headers = handler.handleRateLimit(ex, request).getHeaders();

        assertEquals("60", headers.getFirst(HttpHeaders.RETRY_AFTER));
        assertNull(headers.getFirst("X-RateLimit-Reset"));
        assertNull(headers.getFirst("X-RateLimit-Limit"));
    }
}
