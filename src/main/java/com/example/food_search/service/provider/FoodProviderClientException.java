package com.example.food_search.service.provider;

/**
 * 4xx. 다시 보내도 결과가 같으므로 재시도하지 않는다.
 */
public class FoodProviderClientException extends FoodProviderException {

    public FoodProviderClientException(String provider, int status, String message) {
        super(provider, status, message);
    }
}
