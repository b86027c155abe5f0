package com.example.food_search.service.provider;

import com.example.food_search.dto.UsdaFoodResponse;
import com.example.food_search.dto.UsdaSearchResponse;
import com.example.food_search.service.model.FoodQuery;
import com.example.food_search.service.model.RawCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * USDA FoodData Central. 일반 식품 위주의 1순위 제공자.
 * 검색 결과의 영양값은 100g 기준이다.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class UsdaFoodProvider implements FoodProvider {

    static final String NAME = "usda";

    static final int ENERGY_KCAL = 1008;
    static final int PROTEIN = 1003;
    static final int CARBOHYDRATE = 1005;
    static final int FAT = 1004;

    private static final int PAGE_SIZE = 20;
    private static final String DATA_TYPES = "Foundation,SR Legacy";

    @Qualifier("usdaWebClient")
    private final WebClient usdaWebClient;

    @Value("${food.provider.usda.api-key:DEMO_KEY}")
    private String apiKey;

    @Value("${food.provider.usda.timeout-seconds:5}")
    private long timeoutSeconds;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<List<RawCandidate>> lookup(FoodQuery query) {
        String q = query.getNormalized();

        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            log.info("USDA search requested. query='{}'", q);

            return usdaWebClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/fdc/v1/foods/search")
                            .queryParam("query", q)
                            .queryParam("api_key", apiKey)
                            .queryParam("pageSize", PAGE_SIZE)
                            .queryParam("dataType", DATA_TYPES)
                            .build()
                    )
                    .headers(headers -> {
                        if (query.getTraceId() != null) {
                            headers.add("X-Trace-Id", query.getTraceId());
                        }
                    })
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, resp -> ProviderErrors.clientError(NAME, resp))
                    .onStatus(HttpStatusCode::is5xxServerError, resp -> ProviderErrors.serverError(NAME, resp))
                    .bodyToMono(UsdaSearchResponse.class)
                    .map(this::toCandidates)
                    .defaultIfEmpty(List.of())
                    .retryWhen(ProviderErrors.retryPolicy())
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .doOnNext(candidates -> log.info("USDA search done. query='{}', resultCount={}, elapsedMs={}",
                            q, candidates.size(), System.currentTimeMillis() - start));
        });
    }

    /**
     * fdcId 로 단건 조회. 없는 식품이면 빈 Optional.
     * traceId 가 있으면 X-Trace-Id 로 함께 보낸다.
     */
    public Mono<Optional<RawCandidate>> findById(long fdcId, String traceId) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            log.info("USDA food details requested. fdcId={}", fdcId);

            return usdaWebClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/fdc/v1/food/{fdcId}")
                            .queryParam("api_key", apiKey)
                            .build(fdcId)
                    )
                    .headers(headers -> {
                        if (traceId != null) {
                            headers.add("X-Trace-Id", traceId);
                        }
                    })
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, resp -> ProviderErrors.clientError(NAME, resp))
                    .onStatus(HttpStatusCode::is5xxServerError, resp -> ProviderErrors.serverError(NAME, resp))
                    .bodyToMono(UsdaFoodResponse.class)
                    .map(this::toCandidate)
                    .defaultIfEmpty(Optional.empty())
                    .retryWhen(ProviderErrors.retryPolicy())
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .doOnNext(found -> log.info("USDA food details done. fdcId={}, found={}, elapsedMs={}",
                            fdcId, found.isPresent(), System.currentTimeMillis() - start));
        });
    }

    private List<RawCandidate> toCandidates(UsdaSearchResponse response) {
        if (response == null || response.getFoods() == null) {
            return List.of();
        }
        List<RawCandidate> list = new ArrayList<>();
        for (UsdaSearchResponse.Food food : response.getFoods()) {
            // 이름이나 영양소 배열이 없으면 버린다
            if (food == null || isBlank(food.getDescription())
                    || food.getFoodNutrients() == null || food.getFoodNutrients().isEmpty()) {
                continue;
            }
            List<UsdaSearchResponse.FoodNutrient> nutrients = food.getFoodNutrients();
            list.add(RawCandidate.builder()
                    .description(food.getDescription().trim())
                    .calories(nutrient(nutrients, ENERGY_KCAL))
                    .protein(nutrient(nutrients, PROTEIN))
                    .carbs(nutrient(nutrients, CARBOHYDRATE))
                    .fat(nutrient(nutrients, FAT))
                    .sourceId(food.getFdcId() != null ? String.valueOf(food.getFdcId()) : null)
                    .build());
        }
        return list;
    }

    private Optional<RawCandidate> toCandidate(UsdaFoodResponse food) {
        if (food == null || isBlank(food.getDescription())
                || food.getFoodNutrients() == null || food.getFoodNutrients().isEmpty()) {
            return Optional.empty();
        }
        double calories = 0, protein = 0, carbs = 0, fat = 0;
        for (UsdaFoodResponse.FoodNutrient n : food.getFoodNutrients()) {
            if (n == null || n.getNutrient() == null || n.getNutrient().getId() == null) continue;
            double amount = sanitize(n.getAmount());
            int id = n.getNutrient().getId();
            if (id == ENERGY_KCAL) calories = amount;
            else if (id == PROTEIN) protein = amount;
            else if (id == CARBOHYDRATE) carbs = amount;
            else if (id == FAT) fat = amount;
        }
        return Optional.of(RawCandidate.builder()
                .description(food.getDescription().trim())
                .calories(calories)
                .protein(protein)
                .carbs(carbs)
                .fat(fat)
                .sourceId(food.getFdcId() != null ? String.valueOf(food.getFdcId()) : null)
                .build());
    }

    private static double nutrient(List<UsdaSearchResponse.FoodNutrient> nutrients, int id) {
        for (UsdaSearchResponse.FoodNutrient n : nutrients) {
            if (n != null && n.getNutrientId() != null && n.getNutrientId() == id) {
                return sanitize(n.getValue());
            }
        }
        return 0;
    }

    private static double sanitize(Double value) {
        if (value == null || value.isNaN() || value.isInfinite() || value < 0) return 0;
        return value;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
