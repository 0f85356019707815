package com.example.admission.ratelimiter.guard;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 가드로 감쌀 수 있는 요청 처리기
 *
 * @param <T> 처리 결과 타입
 */
@FunctionalInterface
public interface GuardedHandler<T> {

    T handle(HttpServletRequest request) throws Exception;
}
