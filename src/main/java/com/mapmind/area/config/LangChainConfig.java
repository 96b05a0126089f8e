package com.mapmind.area.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * api-key 가 비어 있으면 ChatModel 빈을 만들지 않는다.
 * 이 경우 생성형 보강은 전부 "사용 불가"로 처리되고 결정적 경로로 간다.
 */
@Slf4j
@Configuration
public class LangChainConfig {

    @Bean
    @ConditionalOnExpression("!'${mapmind.llm.api-key:}'.isBlank()")
    public ChatModel chatModel(LlmProperties props) {
        log.info("LLM baseUrl = {}, model = {}", props.getBaseUrl(), props.getModelName());
        return OpenAiChatModel.builder()
                .baseUrl(props.getBaseUrl())
                .apiKey(props.getApiKey())
                .modelName(props.getModelName())
                .temperature(props.getTemperature())
                .timeout(Duration.ofSeconds(props.getTimeoutSeconds()))
                .build();
    }
}
