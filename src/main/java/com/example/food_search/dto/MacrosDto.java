package com.example.food_search.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * 화면 표시용으로 반올림된 영양값.
 * 칼로리는 정수, 나머지는 소수점 한 자리.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class MacrosDto {

    private int calories;
    private double protein;
    private double carbs;
    private double fat;

    public static MacrosDto rounded(double calories, double protein, double carbs, double fat) {
        return new MacrosDto(
                (int) Math.round(calories),
                oneDecimal(protein),
                oneDecimal(carbs),
                oneDecimal(fat)
        );
    }

    private static double oneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
