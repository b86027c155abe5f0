package com.example.food_search.service;

import com.example.food_search.dto.FoodItem;
import com.example.food_search.dto.MacrosDto;
import com.example.food_search.service.model.FoodQuery;
import com.example.food_search.service.model.RawCandidate;
import com.example.food_search.service.model.ScoredCandidate;
import com.example.food_search.service.provider.FoodProvider;
import com.example.food_search.service.ranking.FoodNameSimplifier;
import com.example.food_search.service.ranking.FoodSimilarity;
import com.example.food_search.service.ranking.RelevanceScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class FoodSearchServiceImpl implements FoodSearchService {

    static final int MAX_RESULTS = 8;
    static final String DEFAULT_SERVING_SIZE = "100g";

    // @Order 순서 (USDA -> Open Food Facts)
    private final List<FoodProvider> providers;
    private final QueryNormalizer queryNormalizer;
    private final RelevanceScorer relevanceScorer;
    private final FoodNameSimplifier nameSimplifier;
    private final FoodSimilarity foodSimilarity;

    @Override
    public List<FoodItem> search(String query) {
        try {
            List<FoodItem> items = searchAsync(query).block();
            return items != null ? items : List.of();
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                log.warn("Food search interrupted. query='{}'", query);
            } else {
                log.error("Food search failed unexpectedly. query='{}'", query, e);
            }
            return List.of();
        }
    }

    @Override
    public Mono<List<FoodItem>> searchAsync(String query) {
        if (query == null || query.isBlank()) {
            return Mono.just(List.<FoodItem>of());
        }

        String original = query.trim().toLowerCase(Locale.ROOT);
        String normalized = queryNormalizer.normalize(query);
        FoodQuery foodQuery = new FoodQuery(original, normalized, MDC.get("traceId"));

        long totalStart = System.currentTimeMillis();
        log.info("Food search pipeline start. query='{}'", original);
        if (!normalized.equals(original)) {
            log.debug("Query rewritten for reference naming. '{}' -> '{}'", original, normalized);
        }

        // 한 번에 하나씩, 처음으로 쓸만한 결과를 준 제공자에서 멈춘다
        return Flux.fromIterable(providers)
                .concatMap(provider -> attempt(provider, foodQuery))
                .next()
                .map(ranked -> {
                    log.info("Food search pipeline summary. query='{}', resultCount={}, totalMs={}",
                            original, ranked.size(), System.currentTimeMillis() - totalStart);
                    return ranked;
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("No provider yielded usable candidates. query='{}', totalMs={}",
                            original, System.currentTimeMillis() - totalStart);
                    return List.<FoodItem>of();
                }))
                .onErrorResume(ex -> {
                    log.error("Food search pipeline failed. query='{}'", original, ex);
                    return Mono.just(List.<FoodItem>of());
                });
    }

    /**
     * 제공자 하나를 호출해서 순위가 매겨진 결과를 만든다.
     * 실패하거나 쓸만한 후보가 없으면 empty 로 끝나서 다음 제공자로 넘어간다.
     */
    private Mono<List<FoodItem>> attempt(FoodProvider provider, FoodQuery query) {
        long start = System.currentTimeMillis();

        return Mono.defer(() -> provider.lookup(query))
                .onErrorResume(ex -> {
                    log.warn("Provider failed, trying next. provider={}, elapsedMs={}, reason={}",
                            provider.name(), System.currentTimeMillis() - start, ex.toString());
                    return Mono.empty();
                })
                .flatMap(raw -> {
                    List<RawCandidate> usable = raw.stream()
                            .filter(RawCandidate::hasNutrition)
                            .toList();
                    if (usable.isEmpty()) {
                        log.warn("Provider returned no usable candidates, trying next. provider={}, rawCount={}",
                                provider.name(), raw.size());
                        return Mono.empty();
                    }
                    return Mono.just(rank(usable, query, provider));
                });
    }

    private List<FoodItem> rank(List<RawCandidate> usable, FoodQuery query, FoodProvider provider) {
        List<ScoredCandidate> scored = new ArrayList<>(usable.size());
        for (RawCandidate c : usable) {
            int score = relevanceScorer.score(c.getDescription(), query.getOriginal())
                    + provider.qualityAdjustment(c);
            scored.add(new ScoredCandidate(c, nameSimplifier.simplify(c.getDescription()), score, provider.name()));
        }

        // List.sort 는 stable -> 동점이면 제공자 순서 유지
        scored.sort(Comparator.comparingInt(ScoredCandidate::getScore).reversed());

        List<ScoredCandidate> unique = deduplicate(scored);

        log.debug("Ranked candidates. provider={}, usable={}, unique={}, top={}",
                provider.name(), usable.size(), unique.size(),
                unique.isEmpty() ? null : unique.get(0).getSimplifiedName());

        return unique.stream()
                .map(this::toFoodItem)
                .toList();
    }

    // 점수 순으로 훑으면서 이미 뽑힌 것과 비슷하면 버린다. 앞선(점수 높은) 항목은 밀려나지 않는다.
    private List<ScoredCandidate> deduplicate(List<ScoredCandidate> sorted) {
        List<ScoredCandidate> kept = new ArrayList<>();
        for (ScoredCandidate candidate : sorted) {
            if (kept.size() >= MAX_RESULTS) break;

            boolean duplicate = kept.stream()
                    .anyMatch(k -> foodSimilarity.areSimilar(k.getSimplifiedName(), candidate.getSimplifiedName()));
            if (!duplicate) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private FoodItem toFoodItem(ScoredCandidate candidate) {
        RawCandidate raw = candidate.getRaw();
        String servingSize = raw.getServingSize() != null && !raw.getServingSize().isBlank()
                ? raw.getServingSize().trim()
                : DEFAULT_SERVING_SIZE;

        return new FoodItem(
                candidate.getSimplifiedName(),
                servingSize,
                MacrosDto.rounded(raw.getCalories(), raw.getProtein(), raw.getCarbs(), raw.getFat())
        );
    }
}
