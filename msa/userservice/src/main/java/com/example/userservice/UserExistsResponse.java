package com.example.userservice;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * {@code GET /users/exists/{id}} 응답. 존재하지 않는 경우도 200 으로 내려간다.
 */
@Getter
@AllArgsConstructor
public class UserExistsResponse {

    private final String id;
    private final boolean exists;
}
