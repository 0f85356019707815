package com.example.admission.ratelimiter.exception;

import com.example.admission.ratelimiter.util.ResponseUtil;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

/**
 * {@link RateLimitExceededException} 을 429 응답으로 변환
 * (@RateLimited 가드에서 던진 예외가 여기로 옵니다)
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class RateLimitExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<RateLimitProblem> handleRateLimit(RateLimitExceededException ex, HttpServletRequest req) {
        log.warn("Request rejected - path: {}, limit: {}", req.getRequestURI(), ex.getLimit());

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(ResponseUtil.rateLimitHeaders(ex, clock))
                .contentType(MediaType.APPLICATION_JSON)
                .body(RateLimitProblem.of(ex.getDetail()));
    }
}
