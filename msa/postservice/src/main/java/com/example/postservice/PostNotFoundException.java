package com.example.postservice;

public class PostNotFoundException extends RuntimeException {

    private final String postId;

    public PostNotFoundException(String postId) {
        super("post not found");
        this.postId = postId;
    }

    public String getPostId() {
        return postId;
    }
}
