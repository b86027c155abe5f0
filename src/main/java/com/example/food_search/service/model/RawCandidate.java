package com.example.food_search.service.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 제공자가 돌려준 원본 후보. 영양값은 음수가 아니며 없으면 0.
 */
@Getter
@Builder
@ToString
public class RawCandidate {

    private final String description;

    private final double calories;
    private final double protein;
    private final double carbs;
    private final double fat;

    // null 이면 100g 기준
    private final String servingSize;

    // 제공자 쪽 식별자 (FDC id, 바코드 등). 진단용
    private final String sourceId;

    private final boolean popular;

    public boolean hasNutrition() {
        return calories != 0 || protein != 0 || carbs != 0 || fat != 0;
    }

    public boolean hasAllMacros() {
        return calories > 0 && protein > 0 && carbs > 0 && fat > 0;
    }
}
