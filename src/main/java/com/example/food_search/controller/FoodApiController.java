package com.example.food_search.controller;

import com.example.food_search.dto.FoodItem;
import com.example.food_search.service.FoodDetailsService;
import com.example.food_search.service.FoodSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/foods")
@RequiredArgsConstructor
@Slf4j
public class FoodApiController {

    private final FoodSearchService foodSearchService;
    private final FoodDetailsService foodDetailsService;

    // q 가 없거나 비어 있으면 빈 배열
    @GetMapping("/search")
    public List<FoodItem> search(@RequestParam(name = "q", required = false) String query) {
        return foodSearchService.search(query);
    }

    @GetMapping("/{fdcId}")
    public ResponseEntity<FoodItem> details(@PathVariable long fdcId) {
        return foodDetailsService.findDetails(fdcId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
