package com.mapmind.area.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "mapmind.overpass")
public class OverpassProperties {
    private String baseUrl = "https://overpass-api.de/api";
    private Duration timeout = Duration.ofSeconds(60);   // 클라이언트 측 대기 한도
    private int queryTimeoutSeconds = 300;                // QL [timeout:N]
}
