package com.example.food_search.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * 제공자 공통 HTTP 오류 변환과 재시도 정책.
 */
@Slf4j
final class ProviderErrors {

    private static final int MAX_BODY_LOG = 300;

    private ProviderErrors() {
    }

    static Mono<? extends Throwable> clientError(String provider, ClientResponse resp) {
        int status = resp.statusCode().value();
        return resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    log.warn("{} 4xx error. status={}, body={}", provider, status, shrink(body));
                    return Mono.error(new FoodProviderClientException(provider, status,
                            provider + " rejected the request (" + status + ")"));
                });
    }

    static Mono<? extends Throwable> serverError(String provider, ClientResponse resp) {
        int status = resp.statusCode().value();
        return resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    log.warn("{} 5xx error. status={}, body={}", provider, status, shrink(body));
                    return Mono.error(new FoodProviderServerException(provider, status,
                            provider + " server error (" + status + ")"));
                });
    }

    // 4xx 와 응답 본문 파싱 실패는 다시 보내도 같으므로 재시도하지 않는다
    static Retry retryPolicy() {
        return Retry.backoff(2, Duration.ofMillis(200))
                .filter(ex -> !(ex instanceof FoodProviderClientException) && !(ex instanceof DecodingException))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private static String shrink(String body) {
        String t = body.replaceAll("\\s+", " ").trim();
        return t.length() <= MAX_BODY_LOG ? t : t.substring(0, MAX_BODY_LOG) + "...";
    }
}
