package com.autonomous.gateway.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class GatewayClientConfig {

    @Bean
    public RestClient agentRestClient(RestClient.Builder builder,
                                      @Value("${gateway.remote.connect-timeout:10s}") Duration connectTimeout,
                                      @Value("${gateway.remote.read-timeout:120s}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());

        log.info("Remote agent client: connectTimeout={}, readTimeout={}", connectTimeout, readTimeout);

        return builder
            .requestFactory(requestFactory)
            .build();
    }

    /**
     * Worker pool shared by dispatch calls, stream consumers and reconciler polls.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService gatewayWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "gateway-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
