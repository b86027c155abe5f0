package com.example.food_search.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * /fdc/v1/food/{fdcId} 단건 조회 응답.
 * 검색 응답과 달리 영양소 id 가 nutrient 객체 안에 있다.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UsdaFoodResponse {

    private Long fdcId;
    private String description;
    private List<FoodNutrient> foodNutrients;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FoodNutrient {
        private Nutrient nutrient;
        private Double amount;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Nutrient {
        private Integer id;
        private String name;
        private String unitName;
    }
}
