package com.example.postservice;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * 실패 응답은 모두 {"error": "..."}.
 * 400 입력 오류, 404 사용자/게시글 없음, 502 UserService 연결 불가, 500 저장소 오류.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UserServiceUnavailableException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, String> handleUserServiceUnavailable(UserServiceUnavailableException e, WebRequest request) {
        log.warn("UserService 연결 불가 - path={}, userId={}, cause={}",
                getRequestPath(request), e.getUserId(), e.getMessage());
        return error("cannot connect to user-service");
    }

    @ExceptionHandler(UserNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> handleUserNotFound(UserNotFoundException e, WebRequest request) {
        log.warn("존재하지 않는 사용자 - path={}, userId={}", getRequestPath(request), e.getUserId());
        return error(e.getMessage());
    }

    @ExceptionHandler(PostNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> handlePostNotFound(PostNotFoundException e, WebRequest request) {
        log.warn("게시글 없음 - path={}, postId={}", getRequestPath(request), e.getPostId());
        return error(e.getMessage());
    }

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

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleInvalidBody(MethodArgumentNotValidException e, WebRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("요청 본문 검증 실패 - path={}, message={}", getRequestPath(request), message);
        return error(message);
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, String> handleStoreFailure(DataAccessException e, WebRequest request) {
        log.error("MongoDB 처리 실패 - path={}", getRequestPath(request), e);
        return error(e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e, WebRequest request) {
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

    private static String getRequestPath(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
