package com.flagship.settlement_engine.config;

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

/**
 * HTTP client for the external transfer API.
 *
 * Pooled Apache HttpClient 5 with explicit connect and read timeouts. A call
 * that hits the read timeout has an unknown outcome and is never retried by
 * the client itself.
 */
@Configuration
@Slf4j
public class TransferClientConfig {

    @Value("${settlement.transfer.base-url:http://localhost:9400}")
    private String baseUrl;

    @Value("${settlement.transfer.connect-timeout-ms:2000}")
    private int connectTimeoutMs;

    @Value("${settlement.transfer.read-timeout-ms:5000}")
    private int readTimeoutMs;

    @Value("${settlement.transfer.max-connections:50}")
    private int maxConnections;

    @Bean
    public RestTemplate transferRestTemplate(RestTemplateBuilder builder) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnections);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build());

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();

        HttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

        RestTemplate restTemplate = builder
                .rootUri(baseUrl)
                .requestFactory(() -> requestFactory)
                .additionalInterceptors(loggingInterceptor())
                .build();

        log.info("Transfer client configured: baseUrl={}, connectTimeout={}ms, readTimeout={}ms",
                baseUrl, connectTimeoutMs, readTimeoutMs);

        return restTemplate;
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("Transfer API {} {} -> {} in {}ms",
                    request.getMethod(), request.getURI(), response.getStatusCode(),
                    System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
