package com.example.admission.ratelimiter.aspect;

import com.example.admission.ratelimiter.annotation.RateLimited;
import com.example.admission.ratelimiter.guard.EmailPayload;
import com.example.admission.ratelimiter.guard.GuardPolicy;
import com.example.admission.ratelimiter.guard.RateLimitGuard;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Rate Limit AOP Aspect
 * {@link RateLimited} 어노테이션이 적용된 메서드의 호출을 가로채서 {@link RateLimitGuard} 로 검사합니다.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class RateLimitAspect {

    private final RateLimitGuard rateLimitGuard;

    @Around("@annotation(rateLimited)")
    public Object around(ProceedingJoinPoint joinPoint, RateLimited rateLimited) throws Throwable {
        HttpServletRequest request = currentRequest();
        if (request == null) {
            // HTTP 요청 밖에서의 호출은 제한 대상이 아님
            log.debug("No current request for {}, skipping rate limit", joinPoint.getSignature().toShortString());
            return joinPoint.proceed();
        }

        GuardPolicy policy = GuardPolicy.builder()
                .perIp(rateLimited.perIp())
                .perUser(rateLimited.perUser())
                .perEmail(rateLimited.perEmail())
                .endpoint(StringUtils.hasText(rateLimited.endpoint())
                        ? rateLimited.endpoint()
                        : joinPoint.getSignature().getName())
                .build();

        rateLimitGuard.check(policy, request, findEmail(joinPoint.getArgs()));

        return joinPoint.proceed();
    }

    //메서드 인자 중 첫 번째 EmailPayload 의 이메일
    private static String findEmail(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof EmailPayload) {
                String email = ((EmailPayload) arg).getEmail();
                if (StringUtils.hasText(email)) {
                    return email.trim();
                }
            }
        }
        return null;
    }

    private static HttpServletRequest currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes) {
            return ((ServletRequestAttributes) attributes).getRequest();
        }
        return null;
    }
}
