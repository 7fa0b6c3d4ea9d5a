package com.volunteersinc.payment_settlement.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

/**
 * HTTP client for the push gateway: pooled connections with bounded
 * connect and read timeouts, and per-call timing metrics.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class PushClientConfig {

    private final MeterRegistry meterRegistry;

    @Value("${settlement.push.connect-timeout:5000}")
    private int connectTimeout;

    @Value("${settlement.push.read-timeout:10000}")
    private int readTimeout;

    @Value("${settlement.push.max-connections:50}")
    private int maxConnections;

    @Bean
    public RestTemplate pushRestTemplate(RestTemplateBuilder builder) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnections);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout))
                .setSocketTimeout(Timeout.ofMilliseconds(readTimeout))
                .build());

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectTimeout))
                .setResponseTimeout(Timeout.ofMilliseconds(readTimeout))
                .build();

        HttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

        log.info("Push client configured: connectTimeout={}ms, readTimeout={}ms, maxConnections={}",
                connectTimeout, readTimeout, maxConnections);

        return builder
                .requestFactory(() -> requestFactory)
                .additionalInterceptors(timingInterceptor())
                .build();
    }

    private ClientHttpRequestInterceptor timingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            String host = request.getURI().getHost();
            String outcome = "error";
            try {
                ClientHttpResponse response = execution.execute(request, body);
                outcome = String.valueOf(response.getStatusCode().value());
                return response;
            } catch (IOException e) {
                log.debug("Push request I/O failure: host={}, error={}", host, e.getMessage());
                throw e;
            } finally {
                meterRegistry.timer("notification.push.request",
                        "host", host != null ? host : "unknown",
                        "status", outcome
                ).record(Duration.ofMillis(System.currentTimeMillis() - startTime));
            }
        };
    }
}
