package com.example.postservice;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * UserService 호출 설정 ({@code userservice.*}).
 *
 * @param baseUrl      UserService 주소. 끝의 '/' 는 있어도 된다.
 * @param timeout      연결/읽기 타임아웃, 기본 5초
 * @param maxAttempts  연결 실패 시 최대 시도 횟수, 기본 1 (재시도 없음)
 * @param retryBackoff 재시도 간 기본 대기 시간, 기본 500ms
 */
@Validated
@ConfigurationProperties(prefix = "userservice")
public record UserServiceProperties(
        @NotBlank String baseUrl, Duration timeout, int maxAttempts, Duration retryBackoff) {

    public UserServiceProperties {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = Duration.ofSeconds(5);
        }
        if (maxAttempts <= 0) {
            maxAttempts = 1;
        }
        if (retryBackoff == null || retryBackoff.isNegative()) {
            retryBackoff = Duration.ofMillis(500);
        }
    }
}
