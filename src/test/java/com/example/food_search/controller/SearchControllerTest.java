package com.example.food_search.controller;

import com.example.food_search.dto.FoodItem;
import com.example.food_search.dto.MacrosDto;
import com.example.food_search.service.FoodSearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SearchController.class)
public class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    // SearchController가 주입받는 FoodSearchService를 모킹해서 주입
    @MockitoBean
    private FoodSearchService foodSearchService;

    @Test
    @DisplayName("루트(/) 호출 시 /search로 리다이렉트된다")
    void rootRedirectsToSearch() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/search"));
    }

    @Test
    @DisplayName("쿼리 없이 /search 호출 시 검색 페이지가 200 OK로 렌더링된다")
    void getSearchPage_withoutQuery_returnsSearchView() throws Exception {
        mockMvc.perform(get("/search"))
                .andExpect(status().isOk())
                .andExpect(view().name("search"))
                .andExpect(model().attribute("query", (Object) null))
                .andExpect(model().attribute("result", (Object) null));

        Mockito.verifyNoInteractions(foodSearchService);
    }

    @Test
    @DisplayName("쿼리와 함께 /search 호출 시 검색 결과가 모델과 화면에 담긴다")
    void getSearchPage_withQuery_callsServiceAndPopulatesModel() throws Exception {
        // given
        String query = "white rice";
        List<FoodItem> items = List.of(
                new FoodItem("White Rice (Cooked)", "100g", new MacrosDto(130, 2.7, 28.2, 0.3))
        );

        Mockito.when(foodSearchService.search(query)).thenReturn(items);

        // when & then
        mockMvc.perform(get("/search").param("q", query))
                .andExpect(status().isOk())
                .andExpect(view().name("search"))
                .andExpect(model().attribute("query", query))
                .andExpect(model().attribute("result", items))
                .andExpect(content().string(containsString("White Rice (Cooked)")));
    }

    @Test
    @DisplayName("결과가 없으면 안내 문구가 보인다")
    void getSearchPage_withNoMatches_showsMessage() throws Exception {
        Mockito.when(foodSearchService.search("xyzzy")).thenReturn(List.of());

        mockMvc.perform(get("/search").param("q", "xyzzy"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("No matching foods.")));
    }
}
