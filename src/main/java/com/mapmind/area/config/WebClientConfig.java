package com.mapmind.area.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class WebClientConfig {

    // Overpass 응답은 반경 1.5km 만 돼도 수 MB 가 나온다
    private static final int MAX_IN_MEMORY = 16 * 1024 * 1024;

    @Bean
    public WebClient geocoderWebClient(GeocoderProperties props) {
        log.info("Geocoder baseUrl = {}", props.getBaseUrl());
        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }

    @Bean
    public WebClient overpassWebClient(OverpassProperties props) {
        log.info("Overpass baseUrl = {}", props.getBaseUrl());
        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .exchangeStrategies(
                        ExchangeStrategies.builder()
                                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY))
                                .build()
                )
                .build();
    }
}
