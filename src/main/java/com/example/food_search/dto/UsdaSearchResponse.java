package com.example.food_search.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UsdaSearchResponse {

    private List<Food> foods;

    // foods[] 항목
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Food {
        private Long fdcId;
        private String description;
        private List<FoodNutrient> foodNutrients;
    }

    // 검색 응답의 영양소는 평평한 구조
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FoodNutrient {
        private Integer nutrientId;
        private String nutrientName;
        private Double value;
        private String unitName;
    }
}
