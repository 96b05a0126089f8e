package com.mapmind.area.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "mapmind.geocoder")
public class GeocoderProperties {
    private String baseUrl = "https://nominatim.openstreetmap.org";
    private String userAgent = "MapMind/1.0";  // Nominatim 은 UA 없으면 403
    private Duration timeout = Duration.ofSeconds(15);
}
