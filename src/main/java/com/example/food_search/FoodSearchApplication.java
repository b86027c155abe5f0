package com.example.food_search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FoodSearchApplication {

	public static void main(String[] args) {
		SpringApplication.run(FoodSearchApplication.class, args);
	}

}
