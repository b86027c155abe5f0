package com.example.food_search.service.provider;

public class FoodProviderServerException extends FoodProviderException {

    public FoodProviderServerException(String provider, int status, String message) {
        super(provider, status, message);
    }
}
