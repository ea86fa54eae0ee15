package com.pitwall.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ErrorResponse {

    /**
     * 에러 코드 (시스템/비즈니스 식별용)
     * 예: CIRCUIT_OPEN, UPSTREAM_UNAVAILABLE, UNKNOWN_CATEGORY
     */
    private String code;

    /**
     * 클라이언트에 노출되는 메시지
     */
    private String message;
}
