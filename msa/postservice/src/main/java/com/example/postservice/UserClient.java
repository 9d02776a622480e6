package com.example.postservice;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ThreadLocalRandom;

@Slf4j
@Component
@RequiredArgsConstructor
public class UserClient implements UserExistenceChecker {

    private final RestTemplate restTemplate;
    private final UserServiceProperties properties;

    private String getExistsUrl() {
        String base = properties.baseUrl().endsWith("/")
                ? properties.baseUrl().substring(0, properties.baseUrl().length() - 1)
                : properties.baseUrl();
        return base + "/users/exists/{id}";
    }

    @Override
    public boolean userExists(String userId) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return requestExists(userId);
            } catch (UserServiceUnavailableException e) {
                if (attempt >= properties.maxAttempts()) {
                    log.error("UserService 호출 실패 - userId={}, 시도 {}회", userId, attempt, e);
                    throw e;
                }
                log.warn("UserService 호출 실패 - {}회차 재시도, userId={}", attempt, userId);
                try {
                    Thread.sleep(backoff(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private boolean requestExists(String userId) {
        ResponseEntity<UserExistsResponse> response;
        try {
            response = restTemplate.getForEntity(getExistsUrl(), UserExistsResponse.class, userId);
        } catch (HttpClientErrorException.BadRequest e) {
            // 형식이 잘못된 id 는 어떤 사용자도 가리킬 수 없다
            log.debug("UserService 가 id 형식 오류로 응답 - userId={}", userId);
            return false;
        } catch (RestClientException e) {
            // 연결 실패, 타임아웃, 5xx, 응답 해석 실패 모두 "알 수 없음"
            throw new UserServiceUnavailableException(userId, e);
        }

        UserExistsResponse body = response.getBody();
        if (body == null || body.getExists() == null) {
            throw new UserServiceUnavailableException(userId, "UserService 응답에 exists 값이 없습니다.");
        }
        log.debug("UserService 존재 확인 - userId={}, exists={}", userId, body.getExists());
        return body.getExists();
    }

    private long backoff(int attempt) {
        long base = properties.retryBackoff().toMillis() * attempt;
        return base + ThreadLocalRandom.current().nextLong(base / 2 + 1);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class UserExistsResponse {
        private String id;
        private Boolean exists;
    }
}
