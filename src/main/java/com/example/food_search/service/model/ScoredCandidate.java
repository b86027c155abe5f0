package com.example.food_search.service.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
public class ScoredCandidate {

    private final RawCandidate raw;
    private final String simplifiedName;
    private final int score;
    private final String sourceProvider;

}
