package com.example.postservice;

import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.core5.concurrent.Cancellable;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 요청 생성 시점부터 deadline 이 지나면 요청을 abort 한다.
 * 연결, 응답 대기, 본문 읽기를 모두 합친 시간에 대한 상한이며, 이미 끝난 요청에 대한 abort 는 아무 일도 하지 않는다.
 */
public class DeadlineHttpRequestFactory extends HttpComponentsClientHttpRequestFactory {

    private final Duration deadline;
    private final ScheduledExecutorService scheduler;

    public DeadlineHttpRequestFactory(HttpClient httpClient, Duration deadline) {
        super(httpClient);
        this.deadline = deadline;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("userservice-deadline-");
        threadFactory.setDaemon(true);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
    }

    @Override
    protected void postProcessHttpRequest(ClassicHttpRequest request) {
        if (request instanceof Cancellable) {
            Cancellable cancellable = (Cancellable) request;
            scheduler.schedule(cancellable::cancel, deadline.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void destroy() throws Exception {
        scheduler.shutdownNow();
        super.destroy();
    }
}
