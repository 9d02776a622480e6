package com.example.userservice;

public class InvalidIdException extends RuntimeException {

    private final String id;

    public InvalidIdException(String id, String message) {
        super(message);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
