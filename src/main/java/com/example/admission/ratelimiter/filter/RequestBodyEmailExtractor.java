package com.example.admission.ratelimiter.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;

/**
 * 기본 이메일 추출기
 *
 * - JSON 요청: 캐싱된 본문의 최상위 "email" 필드
 * - 그 외: "email" 요청 파라미터 (form, query string)
 *
 * JSON 으로 읽을 수 없는 본문은 "이메일 없음"으로 취급합니다.
 */
@Slf4j
@Component
public class RequestBodyEmailExtractor implements EmailExtractor {

    static final String EMAIL_FIELD = "email";

    private final ObjectMapper objectMapper;

    public RequestBodyEmailExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    @Nullable
    public String extractEmail(HttpServletRequest request) {
        if (CachedBodyHttpServletRequest.isJsonRequest(request)) {
            return request instanceof CachedBodyHttpServletRequest
                    ? fromJson(((CachedBodyHttpServletRequest) request).getCachedBody())
                    : null;
        }

        String email = request.getParameter(EMAIL_FIELD);
        return StringUtils.hasText(email) ? email.trim() : null;
    }

    @Nullable
    private String fromJson(byte[] body) {
        if (body.length == 0) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode email = root != null ? root.get(EMAIL_FIELD) : null;
            if (email == null || !email.isTextual() || !StringUtils.hasText(email.asText())) {
                return null;
            }
            return email.asText().trim();
        } catch (IOException e) {
            log.debug("Request body is not valid JSON, email rate limit skipped: {}", e.getMessage());
            return null;
        }
    }
}
