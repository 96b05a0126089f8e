package com.mapmind.area.service.enrichment;

import com.mapmind.area.exception.EnrichmentUnavailableException;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * ChatModel 호출을 감싸서 타임아웃과 실패를 EnrichmentUnavailableException 하나로 모은다.
 * 모델 빈이 없으면 (api-key 미설정) 호출 즉시 unavailable.
 */
@Slf4j
@Component
public class GenerativeTextClient {

    private final ObjectProvider<ChatModel> chatModelProvider;

    public GenerativeTextClient(ObjectProvider<ChatModel> chatModelProvider) {
        this.chatModelProvider = chatModelProvider;
    }

    public boolean isAvailable() {
        return chatModelProvider.getIfAvailable() != null;
    }

    public String generate(String stage, String prompt, Duration timeout) {
        ChatModel model = chatModelProvider.getIfAvailable();
        if (model == null) {
            throw new EnrichmentUnavailableException(stage, "No generative model configured", null);
        }

        long started = System.nanoTime();
        try {
            String text = Mono.fromCallable(() -> model.chat(prompt))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
            log.debug("[{}] generative call took {} ms", stage, (System.nanoTime() - started) / 1_000_000);
            return text;
        } catch (RuntimeException e) {
            log.error("[{}] LLM API Error: {}", stage, e.getMessage());
            throw new EnrichmentUnavailableException(stage, "LLM API Error: " + e.getMessage(), e);
        }
    }
}
