package com.pricehistory.marketdata.config;

import com.pricehistory.common.retry.RetryPolicy;
import com.pricehistory.marketdata.client.ResilientHttpClient;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${alpha-vantage.base-url:https://www.alphavantage.co}")
    private String baseUrl;

    @Value("${alpha-vantage.http.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${alpha-vantage.http.request-timeout-seconds:30}")
    private long requestTimeoutSeconds;

    @Value("${alpha-vantage.http.max-connections:16}")
    private int maxConnections;

    @Value("${alpha-vantage.retry.max-retries:5}")
    private int maxRetries;

    @Value("${alpha-vantage.retry.backoff-factor-ms:500}")
    private long backoffFactorMs;

    /**
     * One pooled connection provider for the lifetime of the application, shared by every
     * upstream call. Disposed by Spring on shutdown.
     */
    @Bean(destroyMethod = "dispose")
    public ConnectionProvider alphaVantageConnectionProvider() {
        return ConnectionProvider.builder("alpha-vantage")
            .maxConnections(maxConnections)
            .pendingAcquireTimeout(Duration.ofSeconds(requestTimeoutSeconds))
            .maxIdleTime(Duration.ofSeconds(30))
            .build();
    }

    @Bean
    public WebClient alphaVantageWebClient(WebClient.Builder builder, ConnectionProvider alphaVantageConnectionProvider) {
        HttpClient httpClient = HttpClient.create(alphaVantageConnectionProvider)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(requestTimeoutSeconds));

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            // full-history payloads are several MB
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public RetryPolicy alphaVantageRetryPolicy() {
        RetryPolicy policy = new RetryPolicy(maxRetries, Duration.ofMillis(backoffFactorMs));
        log.info("Upstream retry configured. {}", policy);
        return policy;
    }

    @Bean
    public ResilientHttpClient resilientHttpClient(WebClient alphaVantageWebClient, RetryPolicy alphaVantageRetryPolicy) {
        return new ResilientHttpClient(alphaVantageWebClient, alphaVantageRetryPolicy,
            Duration.ofSeconds(requestTimeoutSeconds), Schedulers.parallel());
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(),
                ResilientHttpClient.sanitize(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }
}
