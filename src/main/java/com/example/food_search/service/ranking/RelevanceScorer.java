package com.example.food_search.service.ranking;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 후보 이름과 원본 쿼리만으로 관련도 점수를 계산한다.
 * 같은 입력이면 항상 같은 점수 (상태 없음).
 */
@Component
public class RelevanceScorer {

    static final int EXACT_MATCH = 1000;
    static final int PREFIX_MATCH = 500;
    static final int PHRASE_MATCH = 300;
    static final int ALL_WORDS_MATCH = 200;
    static final int PER_WORD_MATCH = 50;

    static final int BREVITY_BASE = 50;
    static final int BREVITY_PER_WORD = 8;

    static final int FIRST_TOKEN_BONUS = 60;
    static final int SECOND_TOKEN_BONUS = 30;
    static final int BURIED_PENALTY = -20;

    static final int DERIVATIVE_PENALTY = -100;
    static final int SPECIFICITY_PENALTY = -50;

    static final int COOKED_BONUS = 40;
    static final int RAW_PENALTY = -20;

    private static final TermMatcher DERIVATIVES = TermMatcher.of(FoodVocabulary.DERIVATIVE_INDICATORS);
    private static final TermMatcher SPECIFICITY = TermMatcher.of(FoodVocabulary.SPECIFICITY_INDICATORS);
    private static final TermMatcher TYPICALLY_COOKED = TermMatcher.of(FoodVocabulary.TYPICALLY_COOKED_FOODS);
    private static final TermMatcher COOKED = TermMatcher.of(FoodVocabulary.COOKED_STATES);
    private static final TermMatcher RAW = TermMatcher.of(FoodVocabulary.RAW_STATES);

    public int score(String candidateName, String query) {
        String name = lower(candidateName);
        String q = lower(query);
        List<String> queryWords = tokens(q);
        List<String> nameTokens = tokens(name);

        int score = matchScore(name, q, queryWords);

        // 짧은 이름일수록 기본 식품일 가능성이 높다
        score += Math.max(0, BREVITY_BASE - BREVITY_PER_WORD * nameTokens.size());

        score += positionScore(nameTokens, queryWords);

        if (DERIVATIVES.matchesAny(name) && !DERIVATIVES.matchesAny(q)) {
            score += DERIVATIVE_PENALTY;
        }

        if (SPECIFICITY.matchesAny(name)) {
            score += SPECIFICITY_PENALTY;
        }

        if (TYPICALLY_COOKED.matchesAny(q)) {
            if (COOKED.matchesAny(name)) {
                score += COOKED_BONUS;
            } else if (RAW.matchesAny(name)) {
                score += RAW_PENALTY;
            }
        }

        return score;
    }

    // 가장 높은 단계 하나만 적용
    private int matchScore(String name, String q, List<String> queryWords) {
        if (queryWords.isEmpty()) return 0;

        if (name.equals(q)) return EXACT_MATCH;
        if (name.startsWith(q)) return PREFIX_MATCH;
        if (name.contains(q)) return PHRASE_MATCH;

        long matching = queryWords.stream().filter(name::contains).count();
        if (matching == queryWords.size()) return ALL_WORDS_MATCH;
        return (int) matching * PER_WORD_MATCH;
    }

    private int positionScore(List<String> nameTokens, List<String> queryWords) {
        if (queryWords.isEmpty()) return 0;

        String first = queryWords.get(0);
        int index = -1;
        for (int i = 0; i < nameTokens.size(); i++) {
            if (TermMatcher.sameWord(nameTokens.get(i), first)) {
                index = i;
                break;
            }
        }

        if (index == 0) return FIRST_TOKEN_BONUS;
        if (index == 1) return SECOND_TOKEN_BONUS;
        if (index > 2) return BURIED_PENALTY;
        return 0;
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    // 쉼표/공백 기준 토큰
    static List<String> tokens(String s) {
        if (s.isEmpty()) return List.of();
        return Arrays.stream(s.split("[\\s,]+"))
                .filter(t -> !t.isEmpty())
                .toList();
    }
}
