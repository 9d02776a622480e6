package com.example.postservice;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(UserServiceProperties.class)
public class RestTemplateConfig {

    @Bean
    public DeadlineHttpRequestFactory userServiceRequestFactory(UserServiceProperties properties) {
        Timeout timeout = Timeout.ofMilliseconds(properties.timeout().toMillis());

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(200);
        // 호출 대상은 UserService 하나뿐
        connectionManager.setDefaultMaxPerRoute(200);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(timeout)
                .setSocketTimeout(timeout)
                .build());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(timeout)
                        .setResponseTimeout(timeout)
                        .build())
                .evictIdleConnections(TimeValue.ofMinutes(1))
                .evictExpiredConnections()
                .build();

        // 소켓 타임아웃은 read 한 번에 대한 상한이라, 호출 전체는 별도 deadline 으로 끊는다
        return new DeadlineHttpRequestFactory(httpClient, properties.timeout());
    }

    @Bean
    public RestTemplate restTemplate(DeadlineHttpRequestFactory userServiceRequestFactory) {
        return new RestTemplate(userServiceRequestFactory);
    }
}
