package com.pricehistory.marketdata.client;

import com.pricehistory.common.exception.MalformedResponseException;
import com.pricehistory.common.exception.RetryExhaustedException;
import com.pricehistory.common.exception.UpstreamHttpException;
import com.pricehistory.common.retry.AttemptOutcome;
import com.pricehistory.common.retry.RetryPolicy;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one logical upstream request through the {@link RetryPolicy}.
 *
 * <p><strong>Flow per attempt:</strong>
 * <ol>
 *   <li>Exchange over the shared, pooled {@link WebClient} with a per-attempt timeout.</li>
 *   <li>Classify: 2xx → success; 429/500/502/503/504 or connect/timeout/reset → retryable;
 *       any other status → {@link UpstreamHttpException}, returned at once.</li>
 *   <li>On a retryable failure wait {@code backoffFactor * 2^attempt} on {@code delayScheduler}
 *       ({@link Retry#backoff} with jitter off), then try again, up to {@code maxRetries}
 *       attempts in total.</li>
 *   <li>Once the budget is spent emit {@link RetryExhaustedException}.</li>
 *   <li>A body over the codec's in-memory limit → {@link MalformedResponseException}.</li>
 * </ol>
 *
 * <p>Waits are timers, not sleeping threads: only the subscriber of this particular request is
 * held back. The client holds no per-request state and is safe for concurrent use.
 */
public class ResilientHttpClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientHttpClient.class);

    private static final int MAX_BODY_IN_ERROR = 200;

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final Duration defaultTimeout;
    private final Scheduler delayScheduler;

    public ResilientHttpClient(WebClient webClient, RetryPolicy retryPolicy,
                               Duration defaultTimeout, Scheduler delayScheduler) {
        this.webClient      = webClient;
        this.retryPolicy    = retryPolicy;
        this.defaultTimeout = defaultTimeout;
        this.delayScheduler = delayScheduler;
    }

    public Mono<String> get(String path, Map<String, String> queryParams) {
        return execute(HttpMethod.GET, path, queryParams, defaultTimeout);
    }

    /**
     * @param method      HTTP method
     * @param path        path relative to the client's base URL
     * @param queryParams query parameters, appended in iteration order
     * @param timeout     per-attempt timeout; {@code null} uses the configured default
     * @return the response body of the first successful attempt
     */
    public Mono<String> execute(HttpMethod method, String path, Map<String, String> queryParams, Duration timeout) {
        Duration perAttempt = timeout != null ? timeout : defaultTimeout;
        return Mono.defer(() -> withRetries(method, path, queryParams, perAttempt));
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private Mono<String> withRetries(HttpMethod method, String path, Map<String, String> queryParams,
                                     Duration timeout) {
        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return exchange(method, path, queryParams).timeout(timeout);
            })
            .onErrorMap(ResilientHttpClient::isTransportError, RetryableFailure::transport)
            .flatMap(response -> classify(path, response))
            .retryWhen(retrySpec(path))
            .doOnSuccess(body -> {
                if (attempts.get() > 1) {
                    log.info("Upstream request recovered. path={} attempt={}/{}",
                             path, attempts.get(), retryPolicy.getMaxRetries());
                }
            });
    }

    private Mono<String> classify(String path, UpstreamResponse response) {
        AttemptOutcome outcome = retryPolicy.classifyStatus(response.status());
        if (outcome == AttemptOutcome.SUCCESS) {
            return Mono.just(response.body());
        }
        if (outcome.isRetryable()) {
            return Mono.error(RetryableFailure.status(response.status()));
        }
        log.warn("Upstream rejected request. path={} status={}", path, response.status());
        return Mono.error(new UpstreamHttpException(response.status(), abbreviate(response.body())));
    }

    /**
     * {@code backoffFactor * 2^k} after failed attempt k, jitter disabled. Only
     * {@link RetryableFailure} signals are retried.
     */
    private RetryBackoffSpec retrySpec(String path) {
        return Retry.backoff(retryPolicy.getRetriesAfterFirst(), retryPolicy.getBackoffFactor())
            .jitter(0d)
            .scheduler(delayScheduler)
            .filter(RetryableFailure.class::isInstance)
            .doBeforeRetry(signal -> log.warn("Upstream request failed (attempt {}/{}). path={} reason={} retryInMs={}",
                signal.totalRetries() + 1, retryPolicy.getMaxRetries(), path, signal.failure().getMessage(),
                retryPolicy.delayAfter((int) signal.totalRetries()).toMillis()))
            .onRetryExhaustedThrow((backoff, signal) -> {
                RetryableFailure last = (RetryableFailure) signal.failure();
                int attempts = (int) signal.totalRetries() + 1;
                log.warn("Upstream retries exhausted. path={} attempts={} reason={}", path, attempts, last.getMessage());
                return new RetryExhaustedException(attempts, last.status, last.getCause());
            });
    }

    /**
     * Performs a single HTTP exchange. Any status is a normal completion; only transport
     * problems are errors. Query values are expanded as URI variables so reserved characters
     * ({@code +}, {@code &}, braces) are percent-encoded.
     */
    protected Mono<UpstreamResponse> exchange(HttpMethod method, String path, Map<String, String> queryParams) {
        return webClient.method(method)
            .uri(uriBuilder -> {
                uriBuilder.path(path);
                queryParams.keySet().forEach(name -> uriBuilder.queryParam(name, "{" + name + "}"));
                return uriBuilder.build(queryParams);
            })
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new UpstreamResponse(response.statusCode().value(), body)))
            .onErrorMap(ResilientHttpClient::exceedsBufferLimit,
                e -> new MalformedResponseException("Response body exceeds the in-memory limit. path=" + path, e));
    }

    static boolean isTransportError(Throwable error) {
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return true;
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof TimeoutException || t instanceof ReadTimeoutException) {
                return true;
            }
        }
        return false;
    }

    static boolean exceedsBufferLimit(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof DataBufferLimitException) {
                return true;
            }
        }
        return false;
    }

    /** Masks the API key in a URL or query string before it reaches a log line. */
    public static String sanitize(String url) {
        return url == null ? null : url.replaceAll("(?i)apikey=[^&]+", "apikey=***");
    }

    private static String abbreviate(String body) {
        String oneLine = body.replaceAll("\\s+", " ").strip();
        return oneLine.length() <= MAX_BODY_IN_ERROR ? oneLine : oneLine.substring(0, MAX_BODY_IN_ERROR) + "...";
    }

    /**
     * Internal signal for a failed attempt that may be retried. Never leaves this class.
     */
    private static final class RetryableFailure extends RuntimeException {

        private final Integer status;

        private RetryableFailure(String message, Integer status, Throwable cause) {
            super(message, cause);
            this.status = status;
        }

        static RetryableFailure status(int status) {
            return new RetryableFailure("status " + status, status, null);
        }

        static RetryableFailure transport(Throwable error) {
            return new RetryableFailure(error.getClass().getSimpleName() + ": " + error.getMessage(), null, error);
        }
    }
}
