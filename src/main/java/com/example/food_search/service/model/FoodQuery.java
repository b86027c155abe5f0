package com.example.food_search.service.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 한 번의 검색 동안만 유지되는 쿼리.
 * original: trim + 소문자, normalized: 데이터베이스 명명 규칙에 맞게 재배열한 것.
 * traceId 는 호출 스레드의 MDC 에서 미리 꺼내 둔 값 (제공자 호출은 다른 스레드에서 일어날 수 있음).
 */
@Getter
@ToString
@RequiredArgsConstructor
public class FoodQuery {

    private final String original;
    private final String normalized;
    private final String traceId;

}
