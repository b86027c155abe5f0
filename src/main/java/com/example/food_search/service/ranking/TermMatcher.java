package com.example.food_search.service.ranking;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 단어 목록을 "단어 단위"로 찾는 매처.
 * 부분 문자열 매칭이면 "boiled" 안의 "oil" 같은 오탐이 생기기 때문에
 * 앞뒤가 영숫자가 아닌 경우만 인정한다. 복수형(s, es)은 허용.
 */
final class TermMatcher {

    private final List<String> terms;
    private final List<Pattern> patterns;

    private TermMatcher(Collection<String> terms) {
        this.terms = List.copyOf(terms);
        this.patterns = new ArrayList<>(terms.size());
        for (String term : this.terms) {
            patterns.add(Pattern.compile("(?<![a-z0-9])" + Pattern.quote(term) + "(?:e?s)?(?![a-z0-9])"));
        }
    }

    static TermMatcher of(Collection<String> terms) {
        return new TermMatcher(terms);
    }

    /** text 는 소문자여야 한다. */
    boolean matchesAny(String text) {
        return firstMatch(text).isPresent();
    }

    Optional<String> firstMatch(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(text).find()) {
                return Optional.of(terms.get(i));
            }
        }
        return Optional.empty();
    }

    /** 단일 토큰이 단어 그 자체(또는 복수형)인지. */
    static boolean sameWord(String token, String word) {
        if (token.equals(word)) return true;
        if (!token.startsWith(word)) return false;
        String rest = token.substring(word.length());
        return rest.equals("s") || rest.equals("es");
    }
}
