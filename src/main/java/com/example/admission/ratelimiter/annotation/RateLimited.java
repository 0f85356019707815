package com.example.admission.ratelimiter.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Rate Limit 어노테이션
 * 컨트롤러 메서드에 적용하여 해당 라우트에만 제한을 겁니다.
 *
 * <pre>
 * &#64;RateLimited(perIp = "10/hour", perEmail = "3/hour")
 * &#64;PostMapping("/resend-verification")
 * public ResponseEntity&lt;Void&gt; resend(&#64;RequestBody ResendRequest request) { ... }
 * </pre>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    /**
     * IP 기반 제한 (예: "100/hour"), 빈 값이면 검사하지 않음
     */
    String perIp() default "";

    /**
     * 사용자 기반 제한, 인증된 요청에만 적용
     */
    String perUser() default "";

    /**
     * 이메일 기반 제한
     * 메서드 인자 중 {@link com.example.admission.ratelimiter.guard.EmailPayload} 에 이메일이 있을 때만 적용
     */
    String perEmail() default "";

    /**
     * 엔드포인트 이름, 비어 있으면 메서드 이름 사용
     */
    String endpoint() default "";
}
