package com.example.admission.ratelimiter.guard;

/**
 * 이메일 기반 제한 대상이 되는 요청 본문
 * {@code @RateLimited(perEmail = ...)} 메서드의 인자가 이 인터페이스를 구현하면 이메일 제한이 적용됩니다.
 */
public interface EmailPayload {

    String getEmail();
}
