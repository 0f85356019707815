package com.example.admission.ratelimiter.guard;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.lang.Nullable;

/**
 * 단일 라우트에 적용할 제한 조합
 * 비어 있는 항목은 검사하지 않습니다.
 */
@Getter
@Builder
@ToString
public class GuardPolicy {

    @Nullable
    private final String perIp;     // IP 기반 제한 (예: 100/hour)

    @Nullable
    private final String perUser;   // 사용자 기반 제한 (인증된 요청만)

    @Nullable
    private final String perEmail;  // 이메일 기반 제한 (이메일이 있을 때만)

    @Nullable
    private final String endpoint;  // 키에 붙일 엔드포인트 이름
}
