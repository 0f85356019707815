package com.example.admission.ratelimiter.util;

import com.example.admission.ratelimiter.core.Dimension;
import com.example.admission.ratelimiter.core.RateLimitKey;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;

/**
 * 백엔드 저장소에 사용할 Rate Limit 키 생성기
 * 형식: rate_limit:{dimension}:{identifier}[:{endpoint}]
 */
public final class KeyBuilder {

    public static final String NAMESPACE = "rate_limit";
    public static final int MAX_IDENTIFIER_LENGTH = 50;

    private KeyBuilder() {
    }

    public static String build(RateLimitKey key) {
        return build(key.getDimension(), key.getIdentifier(), key.getEndpoint());
    }

    public static String build(Dimension dimension, String identifier, String endpoint) {
        StringBuilder sb = new StringBuilder(NAMESPACE)
                .append(':').append(dimension.getKeyName())
                .append(':').append(normalizeIdentifier(identifier));
        if (StringUtils.hasText(endpoint)) {
            sb.append(':').append(endpoint);
        }
        return sb.toString();
    }

    //긴 식별자는 고정 길이(32자) 해시로 치환하여 키 크기를 제한
    static String normalizeIdentifier(String identifier) {
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            return DigestUtils.md5DigestAsHex(identifier.getBytes(StandardCharsets.UTF_8));
        }
        return identifier;
    }
}
