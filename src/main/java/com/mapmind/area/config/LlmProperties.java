package com.mapmind.area.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI 호환 엔드포인트 설정. 기본값은 Gemini 의 OpenAI 호환 API.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "mapmind.llm")
public class LlmProperties {
    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai/";
    private String apiKey;
    private String modelName = "gemini-2.0-flash";
    private Double temperature = 0.7;
    private int timeoutSeconds = 60;
}
