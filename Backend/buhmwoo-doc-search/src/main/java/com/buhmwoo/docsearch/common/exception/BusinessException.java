package com.buhmwoo.docsearch.common.exception;

import com.buhmwoo.docsearch.common.dto.ErrorCode;

import java.util.Map;

public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final Map<String, Object> details; // 선택: 잘못된 필드/값 컨텍스트

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details;
    }

    // 편의 팩토리
    public static BusinessException invalidOption(String field, Object rejected, String msg) {
        Map<String, Object> details = new java.util.LinkedHashMap<>();
        details.put("field", field);
        details.put("rejected", rejected);
        return new BusinessException(ErrorCode.VALIDATION_ERROR, msg, details);
    }

    public ErrorCode getErrorCode() { return errorCode; }
    public Map<String, Object> getDetails() { return details; }
}
