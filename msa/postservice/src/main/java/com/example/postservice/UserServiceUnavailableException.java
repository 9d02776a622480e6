package com.example.postservice;

/**
 * UserService 에 연결할 수 없거나 응답을 해석할 수 없을 때.
 */
public class UserServiceUnavailableException extends RuntimeException {

    private final String userId;

    public UserServiceUnavailableException(String userId, String message) {
        super(message);
        this.userId = userId;
    }

    public UserServiceUnavailableException(String userId, Throwable cause) {
        super(cause.getMessage(), cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
