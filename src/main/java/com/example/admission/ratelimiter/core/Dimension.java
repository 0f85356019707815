package com.example.admission.ratelimiter.core;

/**
 * Rate Limit 적용 축 (Dimension)
 * 키 생성 시 {@link #getKeyName()} 값이 네임스페이스 바로 뒤에 들어갑니다.
 */
public enum Dimension {
    IP("ip"),          // 클라이언트 IP 주소 기반
    USER("user"),      // 인증된 사용자 ID 기반
    EMAIL("email"),    // 요청 본문의 이메일 기반
    CUSTOM("custom");  // 호출자가 지정한 임의 식별자

    private final String keyName;

    Dimension(String keyName) {
        this.keyName = keyName;
    }

    public String getKeyName() {
        return keyName;
    }
}
