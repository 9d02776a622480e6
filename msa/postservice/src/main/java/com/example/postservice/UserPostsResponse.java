package com.example.postservice;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class UserPostsResponse {

    @JsonProperty("user_id")
    private final String userId;

    private final List<Post> posts;
}
