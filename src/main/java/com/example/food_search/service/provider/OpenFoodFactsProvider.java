package com.example.food_search.service.provider;

import com.example.food_search.service.model.FoodQuery;
import com.example.food_search.service.model.RawCandidate;
import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Open Food Facts. 커뮤니티가 관리하는 가공식품(브랜드) 데이터베이스.
 * USDA 에서 쓸만한 결과가 없을 때만 호출된다.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class OpenFoodFactsProvider implements FoodProvider {

    static final String NAME = "open-food-facts";

    private static final int PAGE_SIZE = 10;
    private static final double KJ_PER_KCAL = 4.184;
    private static final int LONG_NAME_LENGTH = 60;

    static final int ALL_MACROS_BONUS = 30;
    static final int POPULARITY_BONUS = 20;
    static final int LONG_NAME_PENALTY = -30;

    // "12.3 g", "0,5", "≈3.2" 같은 값에서 숫자만
    private static final Pattern P_NUM = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    @Qualifier("openFoodFactsWebClient")
    private final WebClient openFoodFactsWebClient;

    @Value("${food.provider.open-food-facts.timeout-seconds:5}")
    private long timeoutSeconds;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<List<RawCandidate>> lookup(FoodQuery query) {
        String q = query.getOriginal();

        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            log.info("Open Food Facts search requested. query='{}'", q);

            return openFoodFactsWebClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/cgi/search.pl")
                            .queryParam("search_terms", q)
                            .queryParam("search_simple", 1)
                            .queryParam("action", "process")
                            .queryParam("json", 1)
                            .queryParam("page_size", PAGE_SIZE)
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
                    .bodyToMono(JsonNode.class)
                    .map(root -> toCandidates(root, q))
                    .defaultIfEmpty(List.of())
                    .retryWhen(ProviderErrors.retryPolicy())
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .doOnNext(candidates -> log.info("Open Food Facts search done. query='{}', resultCount={}, elapsedMs={}",
                            q, candidates.size(), System.currentTimeMillis() - start));
        });
    }

    @Override
    public int qualityAdjustment(RawCandidate candidate) {
        int adjustment = 0;
        if (candidate.hasAllMacros()) {
            adjustment += ALL_MACROS_BONUS;
        }
        if (candidate.isPopular()) {
            adjustment += POPULARITY_BONUS;
        }
        if (candidate.getDescription().length() > LONG_NAME_LENGTH) {
            adjustment += LONG_NAME_PENALTY;
        }
        return adjustment;
    }

    private List<RawCandidate> toCandidates(JsonNode root, String fallbackName) {
        JsonNode products = root == null ? null : root.path("products");
        if (products == null || !products.isArray()) {
            return List.of();
        }

        List<RawCandidate> list = new ArrayList<>();
        for (JsonNode product : products) {
            JsonNode nutr = product.path("nutriments");
            // 영양 정보 객체 자체가 없으면 버린다
            if (!nutr.isObject()) continue;

            String name = firstText(product, "product_name", "product_name_en");
            if (name == null) name = fallbackName;

            JsonNode tags = product.path("popularity_tags");

            list.add(RawCandidate.builder()
                    .description(name.trim())
                    .calories(kcal(nutr))
                    .protein(number(nutr, "proteins_100g", "proteins"))
                    .carbs(number(nutr, "carbohydrates_100g", "carbohydrates"))
                    .fat(number(nutr, "fat_100g", "fat"))
                    .servingSize(firstText(product, "serving_size"))
                    .sourceId(firstText(product, "code"))
                    .popular(tags.isArray() && tags.size() > 0)
                    .build());
        }
        return list;
    }

    // kcal 이 없으면 kJ 에서 환산 (energy_100g 는 보통 kJ)
    private static double kcal(JsonNode nutr) {
        Double kcal = numberOrNull(nutr, "energy-kcal_100g");
        if (kcal == null) kcal = numberOrNull(nutr, "energy-kcal");
        if (kcal == null) {
            Double kj = numberOrNull(nutr, "energy-kj_100g");
            if (kj == null) kj = numberOrNull(nutr, "energy_100g");
            if (kj != null) kcal = kj / KJ_PER_KCAL;
        }
        return kcal == null ? 0 : Math.max(0, kcal);
    }

    private static double number(JsonNode nutr, String key, String fallbackKey) {
        Double v = numberOrNull(nutr, key);
        if (v == null) v = numberOrNull(nutr, fallbackKey);
        return v == null ? 0 : Math.max(0, v);
    }

    private static Double numberOrNull(JsonNode node, String key) {
        JsonNode v = node.path(key);
        if (v.isMissingNode() || v.isNull()) return null;

        if (v.isNumber()) return finiteOrNull(v.asDouble());

        String raw = v.asText(null);
        if (raw == null) return null;

        Matcher m = P_NUM.matcher(raw.trim().replace(',', '.'));
        if (!m.find()) return null;

        try {
            return finiteOrNull(Double.parseDouble(m.group()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // 1e400 이나 아주 긴 숫자 문자열은 Infinity 로 읽히므로 값 없음으로 본다
    private static Double finiteOrNull(double v) {
        return Double.isNaN(v) || Double.isInfinite(v) ? null : v;
    }

    private static String firstText(JsonNode obj, String... keys) {
        for (String k : keys) {
            JsonNode v = obj.get(k);
            if (v == null || v.isNull()) continue;
            String s = v.asText(null);
            if (s != null && !s.isBlank()) return s;
        }
        return null;
    }
}
