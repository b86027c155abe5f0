package com.example.food_search.service.ranking;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 쉼표로 나열된 데이터베이스 식품명을 짧은 표시용 이름으로 바꾼다.
 * <pre>
 * "Rice, white, long-grain, regular, cooked" -> "White Rice Long-grain (Cooked)"
 * "Broccoli, raw"                           -> "Broccoli (Raw)"
 * </pre>
 */
@Component
public class FoodNameSimplifier {

    // 메인 음식 뒤로 살펴볼 수식어 개수 (노이즈 단어는 세지 않음)
    private static final int MAX_EXAMINED_SEGMENTS = 3;

    private static final TermMatcher NOISE = TermMatcher.of(FoodVocabulary.NOISE_WORDS);
    private static final TermMatcher PREPARATION = TermMatcher.of(FoodVocabulary.PREPARATION_METHODS);

    public String simplify(String rawName) {
        if (rawName == null) return "";

        List<String> parts = Arrays.stream(rawName.split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();

        if (parts.isEmpty()) return titleCase(rawName);
        if (parts.size() == 1) return titleCase(parts.get(0));

        String mainFood = parts.get(0);
        String prefix = null;
        String preparation = null;
        String extra = null;

        int examined = 0;
        for (int i = 1; i < parts.size() && examined < MAX_EXAMINED_SEGMENTS; i++) {
            String part = parts.get(i);
            String lower = part.toLowerCase(Locale.ROOT);

            if (NOISE.matchesAny(lower)) continue;
            examined++;

            Optional<String> method;
            if (prefix == null && isPrefixDescriptor(lower)) {
                prefix = part;
            } else if (preparation == null && (method = PREPARATION.firstMatch(lower)).isPresent()) {
                preparation = method.get();
            } else if (extra == null && lower.length() > 2 && lower.length() < 20) {
                extra = part;
            }
        }

        StringBuilder sb = new StringBuilder();
        if (prefix != null) sb.append(prefix).append(' ');
        sb.append(mainFood);
        if (extra != null) sb.append(' ').append(extra);
        if (preparation != null) sb.append(" (").append(preparation).append(')');

        return titleCase(sb.toString());
    }

    private static boolean isPrefixDescriptor(String segment) {
        String firstWord = segment.split("\\s+")[0];
        return FoodVocabulary.PREFIX_DESCRIPTORS.contains(firstWord);
    }

    /** 단어마다 첫 글자만 대문자. "(cooked)" 처럼 괄호로 시작해도 글자를 찾아 올린다. */
    static String titleCase(String s) {
        String[] words = s.trim().toLowerCase(Locale.ROOT).split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(capitalizeFirstLetter(word));
        }
        return sb.toString();
    }

    private static String capitalizeFirstLetter(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (Character.isLetter(word.charAt(i))) {
                return word.substring(0, i)
                        + Character.toUpperCase(word.charAt(i))
                        + word.substring(i + 1);
            }
        }
        return word;
    }
}
