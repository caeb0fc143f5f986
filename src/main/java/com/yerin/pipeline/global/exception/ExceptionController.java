package com.yerin.pipeline.global.exception;

import com.yerin.pipeline.global.dto.ErrorResponse;
import com.yerin.pipeline.global.exception.code.CommonErrorCode;
import com.yerin.pipeline.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class ExceptionController {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException e,
                                                            HttpServletRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getHttpStatus().is5xxServerError()) {
            log.error("AppException: {}, path={} {}", errorCode.getMessage(),
                    request.getMethod(), request.getRequestURI(), e);
        } else {
            log.warn("AppException: {}, path={} {}", errorCode.getMessage(),
                    request.getMethod(), request.getRequestURI());
        }

        ErrorResponse body = ErrorResponse.of(errorCode, request);
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
                                                          HttpServletRequest request) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String msg = (fieldError != null)
                ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                : "입력값이 유효하지 않습니다.";
        return invalidParameter(msg, request);
    }

    @ExceptionHandler({HandlerMethodValidationException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponse> handleParameterValidation(Exception e,
                                                                   HttpServletRequest request) {
        return invalidParameter("요청 파라미터 검증에 실패했습니다.", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                            HttpServletRequest request) {
        return invalidParameter(e.getName() + " 값의 형식이 올바르지 않습니다.", request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e,
                                                          HttpServletRequest request) {
        return invalidParameter("요청 본문을 읽을 수 없습니다.", request);
    }

    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(DataAccessResourceFailureException e,
                                                                HttpServletRequest request) {
        log.error("Job store unavailable, path={} {}", request.getMethod(), request.getRequestURI(), e);
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.SERVICE_UNAVAILABLE, request);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e,
                                                   HttpServletRequest request) {
        log.error("Unhandled exception: ", e);
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.INTERNAL_SERVER_ERROR, request);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ResponseEntity<ErrorResponse> invalidParameter(String msg, HttpServletRequest request) {
        ErrorCode errorCode = CommonErrorCode.INVALID_PARAMETER.withDetail(msg);
        log.warn("Validation failed: {}, path={} {}", msg,
                request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.of(errorCode, request));
    }
}
