package com.example.food_search.service;

import com.example.food_search.dto.FoodItem;
import reactor.core.publisher.Mono;

import java.util.List;

public interface FoodSearchService {

    /**
     * 최대 8개, 절대 예외를 던지지 않는다. 실패하면 빈 리스트.
     */
    List<FoodItem> search(String query);

    /**
     * 구독을 취소하면 진행 중인 제공자 호출도 취소된다. error 시그널은 보내지 않는다.
     */
    Mono<List<FoodItem>> searchAsync(String query);
}
