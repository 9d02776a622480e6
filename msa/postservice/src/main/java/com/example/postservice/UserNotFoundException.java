package com.example.postservice;

public class UserNotFoundException extends RuntimeException {

    private final String userId;

    public UserNotFoundException(String userId) {
        super("user does not exist");
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
