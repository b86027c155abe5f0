package com.example.food_search.service.provider;

import com.example.food_search.service.model.FoodQuery;
import com.example.food_search.service.model.RawCandidate;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 외부 영양 데이터베이스 하나.
 * 검색 서비스는 @Order 순서대로 제공자를 시도하고, 처음으로 쓸만한 결과를 준 제공자만 사용한다.
 */
public interface FoodProvider {

    /** 로그/진단용 태그 */
    String name();

    /**
     * 실패(HTTP 오류, 타임아웃 등)는 error 시그널로 내보낸다. 결과가 없으면 빈 리스트.
     */
    Mono<List<RawCandidate>> lookup(FoodQuery query);

    /** 제공자 고유의 품질 보정 점수. 기본은 0 */
    default int qualityAdjustment(RawCandidate candidate) {
        return 0;
    }
}
