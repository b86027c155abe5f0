package com.example.food_search.controller;

import com.example.food_search.dto.FoodItem;
import com.example.food_search.service.FoodSearchService;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Controller
@AllArgsConstructor
@Slf4j
public class SearchController {

    private final FoodSearchService foodSearchService;

    @GetMapping("/")
    public String rootRedirect() {
        return "redirect:/search";
    }

    @GetMapping("/search")
    public String searchPage(
            @RequestParam(name = "q", required = false) String query,
            Model model
    ) {

        log.info("request start. traceId={}", MDC.get("traceId"));

        List<FoodItem> result = null;

        if (query != null && !query.isBlank()) {
            result = foodSearchService.search(query);
        }

        model.addAttribute("query", query);
        model.addAttribute("result", result);

        log.info("request end. traceId={}", MDC.get("traceId"));
        // templates/search.html
        return "search";
    }
}
