package com.yerin.pipeline.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    INVALID_TRANSITION(HttpStatus.CONFLICT, "허용되지 않는 작업 상태 전이입니다.", "JOB-002"),
    INVALID_STATUS(HttpStatus.BAD_REQUEST, "알 수 없는 작업 상태입니다.", "JOB-003"),
    INVALID_RESOURCE_KEY(HttpStatus.BAD_REQUEST, "리소스 키를 만들 수 없는 식별자입니다.", "JOB-004");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
