package com.example.userservice;

public class UserNotFoundException extends RuntimeException {

    private final String userId;

    public UserNotFoundException(String userId) {
        super("user not found");
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
