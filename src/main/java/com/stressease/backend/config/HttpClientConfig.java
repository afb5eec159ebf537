package com.stressease.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind the RestClient used for LLM calls.
 *
 * The generation call is one of the two suspension points of a chat request,
 * so both the connect and the response timeout are bounded. A timeout surfaces
 * as ResourceAccessException, which the retry/circuit-breaker decorator turns
 * into a degraded reply.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${llm.http.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${llm.http.read-timeout-ms:30000}")
    private long readTimeoutMs;

    @Value("${llm.http.max-connections:20}")
    private int maxConnections;

    @Bean
    public RestClient.Builder llmRestClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                        .build())
                .build();

        log.info("LLM HttpClient configured [connectTimeout={}ms, readTimeout={}ms, maxConnections={}]",
                connectTimeoutMs, readTimeoutMs, maxConnections);

        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
