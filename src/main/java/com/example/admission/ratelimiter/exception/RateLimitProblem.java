package com.example.admission.ratelimiter.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 429 응답 본문
 */
@Getter
@AllArgsConstructor
public class RateLimitProblem {

    public static final String TYPE = "https://docs.yourapp.com/problems/rate-limit-exceeded";
    public static final String TITLE = "Rate limit exceeded";
    public static final String CODE = "VDJ-GEN-RATE-429";
    public static final String I18N_KEY = "errors.rate_limit_exceeded";

    private final String type;
    private final String title;
    private final int status;
    private final String detail;
    private final String code;

    @JsonProperty("i18n_key")
    private final String i18nKey;

    public static RateLimitProblem of(String detail) {
        return new RateLimitProblem(TYPE, TITLE, 429, detail, CODE, I18N_KEY);
    }
}
