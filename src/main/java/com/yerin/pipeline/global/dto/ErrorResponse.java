package com.yerin.pipeline.global.dto;

import com.yerin.pipeline.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;

import java.time.Instant;

public record ErrorResponse(
        int status,
        String code,
        String message,
        String path,
        Instant timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, HttpServletRequest request) {
        return new ErrorResponse(
                errorCode.getHttpStatus().value(),
                errorCode.getCode(),
                errorCode.getMessage(),
                request.getRequestURI(),
                Instant.now()
        );
    }
}
