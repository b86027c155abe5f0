package com.example.food_search.service;

import com.example.food_search.service.ranking.FoodVocabulary;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;

/**
 * 사용자 쿼리를 데이터베이스 명명 규칙("주재료, 수식어")에 가깝게 바꾼다.
 * "white rice" -> "rice white"
 */
@Component
public class QueryNormalizer {

    public String normalize(String query) {
        if (query == null) return "";

        // trim + 소문자 + 중복 공백 제거
        String q = query.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (q.isEmpty()) return q;

        String[] words = q.split(" ");

        // 첫 단어가 수식어면 맨 뒤로
        if (words.length >= 2 && FoodVocabulary.QUERY_DESCRIPTORS.contains(words[0])) {
            String[] reordered = Arrays.copyOf(Arrays.copyOfRange(words, 1, words.length), words.length);
            reordered[words.length - 1] = words[0];
            return String.join(" ", reordered);
        }

        return q;
    }
}
