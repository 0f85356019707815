package com.example.admission.application.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 데모 엔드포인트 공통 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {
    private String message; // 응답 메시지
    private String backend; // 현재 사용 중인 Rate Limit 백엔드
}
