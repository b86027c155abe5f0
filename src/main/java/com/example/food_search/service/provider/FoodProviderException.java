package com.example.food_search.service.provider;

import lombok.Getter;

@Getter
public class FoodProviderException extends RuntimeException {

    private final String provider;
    private final int status;

    public FoodProviderException(String provider, int status, String message) {
        super(message);
        this.provider = provider;
        this.status = status;
    }
}
