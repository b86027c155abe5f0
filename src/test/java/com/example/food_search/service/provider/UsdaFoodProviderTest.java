package com.example.food_search.service.provider;

import com.example.food_search.service.model.FoodQuery;
import com.example.food_search.service.model.RawCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;
import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.OK;

class UsdaFoodProviderTest {

    private static final String SEARCH_JSON = """
            {
              "totalHits": 4,
              "foods": [
                {
                  "fdcId": 168878,
                  "description": "Rice, white, long-grain, regular, cooked",
                  "dataType": "SR Legacy",
                  "foodNutrients": [
                    {"nutrientId": 1003, "nutrientName": "Protein", "value": 2.69, "unitName": "G"},
                    {"nutrientId": 1004, "nutrientName": "Total lipid (fat)", "value": 0.28, "unitName": "G"},
                    {"nutrientId": 1005, "nutrientName": "Carbohydrate, by difference", "value": 28.2, "unitName": "G"},
                    {"nutrientId": 1008, "nutrientName": "Energy", "value": 130, "unitName": "KCAL"}
                  ]
                },
                {
                  "fdcId": 1,
                  "description": "  ",
                  "foodNutrients": [{"nutrientId": 1008, "value": 100}]
                },
                {
                  "fdcId": 2,
                  "description": "Rice, no nutrients"
                },
                {
                  "fdcId": 3,
                  "description": "Rice bran, crude",
                  "foodNutrients": [
                    {"nutrientId": 1008, "value": 316},
                    {"nutrientId": 1004, "value": -1}
                  ]
                }
              ]
            }
            """;

    private static final FoodQuery QUERY = new FoodQuery("white rice", "rice white", "trace-1");

    @Test
    @DisplayName("검색 응답을 후보로 변환하고 이름/영양소 배열이 없는 항목은 버린다")
    void lookup_mapsFoodsAndDropsMalformedEntries() {
        UsdaFoodProvider provider = provider(request -> json(OK, SEARCH_JSON));

        List<RawCandidate> candidates = provider.lookup(QUERY).block();

        assertThat(candidates).hasSize(2);

        RawCandidate rice = candidates.get(0);
        assertThat(rice.getDescription()).isEqualTo("Rice, white, long-grain, regular, cooked");
        assertThat(rice.getCalories()).isEqualTo(130);
        assertThat(rice.getProtein()).isEqualTo(2.69);
        assertThat(rice.getCarbs()).isEqualTo(28.2);
        assertThat(rice.getFat()).isEqualTo(0.28);
        assertThat(rice.getServingSize()).isNull();
        assertThat(rice.getSourceId()).isEqualTo("168878");

        // 없는 영양소는 0, 음수도 0
        RawCandidate bran = candidates.get(1);
        assertThat(bran.getCalories()).isEqualTo(316);
        assertThat(bran.getProtein()).isZero();
        assertThat(bran.getFat()).isZero();
    }

    @Test
    @DisplayName("정규화된 쿼리와 고정 파라미터, traceId 헤더로 요청한다")
    void lookup_sendsNormalizedQuery() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        UsdaFoodProvider provider = provider(request -> {
            captured.set(request);
            return json(OK, "{\"foods\": []}");
        });

        List<RawCandidate> candidates = provider.lookup(QUERY).block();

        assertThat(candidates).isEmpty();
        ClientRequest request = captured.get();
        assertThat(request.url().getPath()).isEqualTo("/fdc/v1/foods/search");
        assertThat(request.url().getQuery())
                .contains("query=rice white")
                .contains("api_key=test-key")
                .contains("pageSize=20")
                .contains("dataType=Foundation,SR Legacy");
        assertThat(request.headers().getFirst("X-Trace-Id")).isEqualTo("trace-1");
    }

    @Test
    @DisplayName("4xx 는 재시도 없이 클라이언트 예외로 끝난다")
    void lookup_failsWithoutRetryOn4xx() {
        AtomicInteger callCount = new AtomicInteger(0);
        UsdaFoodProvider provider = provider(request -> {
            callCount.incrementAndGet();
            return json(BAD_REQUEST, "{\"error\":\"API_KEY_INVALID\"}");
        });

        StepVerifier.create(provider.lookup(QUERY))
                .expectError(FoodProviderClientException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(callCount.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("5xx 는 두 번 재시도한 뒤 서버 예외로 끝난다")
    void lookup_retriesThenFailsOn5xx() {
        AtomicInteger callCount = new AtomicInteger(0);
        UsdaFoodProvider provider = provider(request -> {
            callCount.incrementAndGet();
            return json(INTERNAL_SERVER_ERROR, "{\"error\":\"5xx\"}");
        });

        StepVerifier.create(provider.lookup(QUERY))
                .expectError(FoodProviderServerException.class)
                .verify(Duration.ofSeconds(5));

        // 최초 호출 + 재시도 2회
        assertThat(callCount.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("응답이 없으면 제한 시간 뒤 TimeoutException")
    void lookup_timesOut() {
        UsdaFoodProvider provider = provider(request -> Mono.never());

        StepVerifier.withVirtualTime(() -> provider.lookup(QUERY))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(3))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("fdcId 단건 조회는 nutrient.id / amount 구조를 읽고 traceId 를 헤더로 보낸다")
    void findById_mapsDetailResponse() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        UsdaFoodProvider provider = provider(request -> {
            captured.set(request);
            return json(OK, """
                    {
                      "fdcId": 171705,
                      "description": "Broccoli, raw",
                      "foodNutrients": [
                        {"nutrient": {"id": 1008, "name": "Energy", "unitName": "kcal"}, "amount": 34},
                        {"nutrient": {"id": 1003, "name": "Protein"}, "amount": 2.82},
                        {"nutrient": {"id": 1005, "name": "Carbohydrate, by difference"}, "amount": 6.64},
                        {"nutrient": {"id": 1004, "name": "Total lipid (fat)"}, "amount": 0.37},
                        {"nutrient": {"id": 1079, "name": "Fiber"}, "amount": 2.6},
                        {"amount": 1.0}
                      ]
                    }
                    """);
        });

        Optional<RawCandidate> found = provider.findById(171705L, "trace-7").block();

        assertThat(found).isPresent();
        assertThat(found.get().getDescription()).isEqualTo("Broccoli, raw");
        assertThat(found.get().getCalories()).isEqualTo(34);
        assertThat(found.get().getProtein()).isEqualTo(2.82);
        assertThat(found.get().getCarbs()).isEqualTo(6.64);
        assertThat(found.get().getFat()).isEqualTo(0.37);
        assertThat(captured.get().url().getPath()).isEqualTo("/fdc/v1/food/171705");
        assertThat(captured.get().headers().getFirst("X-Trace-Id")).isEqualTo("trace-7");
    }

    @Test
    @DisplayName("영양소가 없는 단건 응답은 빈 Optional")
    void findById_withoutNutrients_isEmpty() {
        UsdaFoodProvider provider = provider(request -> json(OK, "{\"fdcId\": 5, \"description\": \"Mystery\"}"));

        assertThat(provider.findById(5L, null).block()).isEmpty();
    }

    @Test
    @DisplayName("없는 fdcId 는 404 -> 클라이언트 예외")
    void findById_notFound_fails() {
        UsdaFoodProvider provider = provider(request -> json(NOT_FOUND, "{}"));

        StepVerifier.create(provider.findById(404L, null))
                .expectError(FoodProviderClientException.class)
                .verify(Duration.ofSeconds(5));
    }

    private static UsdaFoodProvider provider(ExchangeFunction exchange) {
        WebClient usdaWebClient = WebClient.builder()
                .exchangeFunction(exchange)
                .build();

        UsdaFoodProvider provider = new UsdaFoodProvider(usdaWebClient);
        ReflectionTestUtils.setField(provider, "apiKey", "test-key");
        ReflectionTestUtils.setField(provider, "timeoutSeconds", 2L);
        return provider;
    }

    private static Mono<ClientResponse> json(org.springframework.http.HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
