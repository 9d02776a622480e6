package com.example.userservice;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.Map;

/**
 * 모든 실패는 {"error": "..."} 형태로 내려간다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidIdException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleInvalidId(InvalidIdException e, WebRequest request) {
        log.warn("잘못된 id 형식 - path={}, id={}", getRequestPath(request), e.getId());
        return error(e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleUnreadableBody(HttpMessageNotReadableException e, WebRequest request) {
        log.warn("요청 본문 파싱 실패 - path={}", getRequestPath(request));
        return error(e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(UserNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> handleUserNotFound(UserNotFoundException e, WebRequest request) {
        log.warn("사용자 없음 - path={}, id={}", getRequestPath(request), e.getUserId());
        return error(e.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, String> handleStoreFailure(DataAccessException e, WebRequest request) {
        log.error("MongoDB 처리 실패 - path={}", getRequestPath(request), e);
        return error(e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e, WebRequest request) {
        // 405, 없는 경로 등 Spring MVC 표준 예외는 원래 상태 코드를 유지
        if (e instanceof ErrorResponse) {
            ErrorResponse errorResponse = (ErrorResponse) e;
            log.warn("요청 처리 불가 - path={}, status={}", getRequestPath(request), errorResponse.getStatusCode());
            return ResponseEntity.status(errorResponse.getStatusCode()).body(error(e.getMessage()));
        }
        log.error("알 수 없는 오류 - path={}", getRequestPath(request), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error("internal server error"));
    }

    private static Map<String, String> error(String message) {
        return Map.of("error", message == null ? "unknown error" : message);
    }

    // "uri=/users/1;client=..." 에서 경로만 남긴다
    private static String getRequestPath(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
