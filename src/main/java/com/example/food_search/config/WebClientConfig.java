package com.example.food_search.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Value("${food.provider.usda.base-url:https://api.nal.usda.gov}")
    private String usdaBaseUrl;

    @Value("${food.provider.open-food-facts.base-url:https://world.openfoodfacts.org}")
    private String openFoodFactsBaseUrl;

    // OFF 는 클라이언트 식별용 User-Agent 를 요구한다
    @Value("${food.provider.open-food-facts.user-agent:food-search/0.0.1}")
    private String openFoodFactsUserAgent;

    @Bean
    public WebClient usdaWebClient(WebClient.Builder builder) {
        return builder.clone()
                .baseUrl(usdaBaseUrl)
                .clientConnector(new ReactorClientHttpConnector(providerHttpClient()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public WebClient openFoodFactsWebClient(WebClient.Builder builder) {
        return builder.clone()
                .baseUrl(openFoodFactsBaseUrl)
                .clientConnector(new ReactorClientHttpConnector(providerHttpClient()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, openFoodFactsUserAgent)
                .build();
    }

    private HttpClient providerHttpClient() {
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 2000)
                .responseTimeout(Duration.ofSeconds(3))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(3))
                        .addHandlerLast(new WriteTimeoutHandler(3))
                );
    }
}
