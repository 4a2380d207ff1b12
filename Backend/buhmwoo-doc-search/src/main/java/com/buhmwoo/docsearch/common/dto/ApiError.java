package com.buhmwoo.docsearch.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;

/**
 * API 에러 응답 표준 객체.
 * - 모든 예외 응답은 ApiResponseDto< ApiError > 형태로 내려가며,
 *   검색 클라이언트(채팅 도구/대시보드)가 동일한 스키마로 처리할 수 있습니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "code", "message", "path", "timestamp", "details" })
public class ApiError {

    /** 애플리케이션 표준 에러 코드 (예: E400, E500) */
    private final String code;

    /** 사람 친화적 메시지 */
    private final String message;

    /** 요청 경로(에러가 발생한 엔드포인트) */
    private final String path;

    /** 서버 기준 에러 발생 시각(UTC) */
    private final Instant timestamp;

    /** 잘못된 옵션 필드 등 상세 컨텍스트 */
    private final Map<String, Object> details;

    public ApiError(String code, String message, String path, Map<String, Object> details) {
        this.code = code;
        this.message = message;
        this.path = path;
        this.details = details;
        this.timestamp = Instant.now();
    }

    public static ApiError of(ErrorCode errorCode, String message, String path, Map<String, Object> details) {
        return new ApiError(errorCode.getCode(), message, path, details);
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
