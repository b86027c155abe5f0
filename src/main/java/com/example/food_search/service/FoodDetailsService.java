package com.example.food_search.service;

import com.example.food_search.common.log.MdcTraceIdFilter;
import com.example.food_search.dto.FoodItem;
import com.example.food_search.dto.MacrosDto;
import com.example.food_search.service.model.RawCandidate;
import com.example.food_search.service.provider.UsdaFoodProvider;
import com.example.food_search.service.ranking.FoodNameSimplifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.util.Optional;

/**
 * USDA fdcId 단건 조회. 검색과 마찬가지로 실패는 예외 대신 빈 결과.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FoodDetailsService {

    private final UsdaFoodProvider usdaFoodProvider;
    private final FoodNameSimplifier nameSimplifier;

    public Optional<FoodItem> findDetails(long fdcId) {
        long start = System.currentTimeMillis();
        try {
            Optional<RawCandidate> found = usdaFoodProvider.findById(fdcId, MDC.get(MdcTraceIdFilter.TRACE_ID_KEY)).block();
            if (found == null || found.isEmpty()) {
                log.info("Food details not found. fdcId={}, elapsedMs={}", fdcId, System.currentTimeMillis() - start);
                return Optional.empty();
            }
            RawCandidate c = found.get();
            log.info("Food details done. fdcId={}, elapsedMs={}", fdcId, System.currentTimeMillis() - start);
            return Optional.of(new FoodItem(
                    nameSimplifier.simplify(c.getDescription()),
                    FoodSearchServiceImpl.DEFAULT_SERVING_SIZE,
                    MacrosDto.rounded(c.getCalories(), c.getProtein(), c.getCarbs(), c.getFat())
            ));
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Food details lookup failed. fdcId={}, elapsedMs={}, reason={}",
                    fdcId, System.currentTimeMillis() - start, e.toString());
            return Optional.empty();
        }
    }
}
