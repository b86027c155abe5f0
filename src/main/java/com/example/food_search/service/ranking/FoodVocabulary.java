package com.example.food_search.service.ranking;

import java.util.List;
import java.util.Set;

/**
 * 정렬/이름 단순화에 쓰는 고정 단어 목록.
 * 모두 소문자, 불변 컬렉션이다.
 */
public final class FoodVocabulary {

    private FoodVocabulary() {
    }

    // 쿼리 첫 단어가 이 중 하나면 맨 뒤로 보낸다 ("white rice" -> "rice white")
    public static final Set<String> QUERY_DESCRIPTORS = Set.of(
            "white", "brown", "black", "red", "green", "whole", "skim", "low", "fat",
            "plain", "greek", "raw", "cooked", "baked", "fried", "grilled", "steamed",
            "fresh", "frozen", "canned", "dried", "sliced", "diced", "ground"
    );

    // 메인 음식 앞에 붙는 수식어 ("Rice, white" -> "White Rice")
    public static final Set<String> PREFIX_DESCRIPTORS = Set.of(
            "white", "brown", "black", "red", "green", "yellow", "wild",
            "whole", "skim", "low-fat", "nonfat", "fat-free", "plain",
            "greek", "light", "dark", "sweet"
    );

    // 괄호로 뒤에 붙는 조리 상태. 순서대로 먼저 맞는 것을 쓴다.
    public static final List<String> PREPARATION_METHODS = List.of(
            "raw", "cooked", "boiled", "steamed", "baked", "fried", "grilled",
            "roasted", "broiled", "sauteed", "dried", "canned", "frozen"
    );

    public static final Set<String> NOISE_WORDS = Set.of(
            "nfs", "ns", "unenriched", "enriched", "fortified", "regular",
            "standard", "commercial", "retail", "all varieties", "various types"
    );

    public static final Set<String> DERIVATIVE_INDICATORS = Set.of(
            "flour", "oil", "milk", "butter", "powder", "extract", "syrup", "juice", "sauce"
    );

    public static final Set<String> SPECIFICITY_INDICATORS = Set.of(
            "infant", "baby", "formula", "supplement", "restaurant", "fast food",
            "brand", "homemade", "commercial", "industrial"
    );

    // 보통 익혀 먹는 음식
    public static final Set<String> TYPICALLY_COOKED_FOODS = Set.of(
            "rice", "pasta", "chicken", "beef", "pork", "fish", "egg", "potato",
            "broccoli", "beans", "lentils", "oats", "quinoa"
    );

    public static final Set<String> COOKED_STATES = Set.of("cooked", "boiled", "steamed");

    public static final Set<String> RAW_STATES = Set.of("raw", "uncooked");

    // 중복 판단 시 지우는 단어
    public static final Set<String> SIMILARITY_STOP_WORDS = Set.of(
            "cooked", "raw", "steamed", "boiled", "fried", "grilled", "baked", "roasted",
            "regular", "standard", "plain", "whole", "fresh"
    );
}
