package com.example.userservice;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class MongoConfig {

    // 연결, 서버 선택, 소켓 읽기 모두 store.timeout 안에 끝나야 한다
    @Bean
    public MongoClientSettingsBuilderCustomizer storeTimeoutCustomizer(
            @Value("${store.timeout:5s}") Duration timeout) {
        // 소켓 설정은 int 밀리초만 받는다. 범위를 넘으면 기동 시점에 실패
        int socketMillis = Math.toIntExact(timeout.toMillis());
        return builder -> builder
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(socketMillis, TimeUnit.MILLISECONDS)
                        .readTimeout(socketMillis, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }
}
