package com.example.food_search.service.ranking;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 표시용 이름 두 개가 사실상 같은 음식인지 판단한다. 중복 제거 전용.
 */
@Component
public class FoodSimilarity {

    private static final int MIN_CONTAINMENT_LENGTH = 5;

    public boolean areSimilar(String nameA, String nameB) {
        String a = normalize(nameA);
        String b = normalize(nameB);

        if (a.equals(b)) return true;

        // "White Rice" vs "White Rice Long Grain"
        return a.length() > MIN_CONTAINMENT_LENGTH
                && b.length() > MIN_CONTAINMENT_LENGTH
                && (a.contains(b) || b.contains(a));
    }

    static String normalize(String name) {
        if (name == null) return "";

        String s = name.toLowerCase(Locale.ROOT)
                .replaceAll("\\(.*?\\)", " ")
                .replaceAll("[^a-z0-9\\s]", " ");

        return Arrays.stream(s.split("\\s+"))
                .filter(w -> !w.isEmpty())
                .filter(w -> !FoodVocabulary.SIMILARITY_STOP_WORDS.contains(w))
                .collect(Collectors.joining(" "));
    }
}
