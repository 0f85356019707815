package com.example.admission.ratelimiter.backend;

import com.example.admission.ratelimiter.core.RateLimitResult;

/**
 * 윈도우 기반 카운터 저장소의 공통 인터페이스
 * 구현체는 여러 요청 스레드에서 동시에 호출될 수 있어야 합니다.
 */
public interface WindowBackend {

    /**
     * 현재 윈도우의 요청 수를 확인하고, 한도 이내이면 이번 요청을 기록합니다.
     * 저장소 오류는 예외로 전파하지 않고 허용 결과로 변환해야 합니다 (fail-open).
     *
     * @param key 백엔드 키 ({@link com.example.admission.ratelimiter.util.KeyBuilder} 결과)
     * @param limit 윈도우 내 허용 요청 수
     * @param windowSeconds 윈도우 크기 (초)
     * @return 판정 결과
     */
    RateLimitResult checkAndRecord(String key, int limit, long windowSeconds);

    /**
     * 백엔드 이름을 반환합니다.
     *
     * @return 백엔드 이름
     */
    String getName();
}
