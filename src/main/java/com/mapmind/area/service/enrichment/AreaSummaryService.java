package com.mapmind.area.service.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapmind.area.config.AnalysisProperties;
import com.mapmind.area.exception.AreaAnalysisException;
import com.mapmind.area.model.AreaSummary;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.util.LlmJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 생성형 모델로 동네 요약문 + 15분 도시 점수를 만든다.
 *
 * 실패하면 기본적으로 빈 요약(AreaSummary.EMPTY)으로 대체한다.
 * summary-required=true 일 때만 예외를 그대로 올려 502 로 끝낸다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AreaSummaryService {

    public static final String STAGE = "summary-enrichment";

    private final GenerativeTextClient client;
    private final AreaPrompts prompts;
    private final AnalysisProperties props;
    private final ObjectMapper objectMapper;

    public AreaSummary summarize(String area, String city, CategorizedPois pois) {
        try {
            String text = client.generate(STAGE, prompts.summary(area, city, pois), props.getSummaryTimeout());
            return parse(text);
        } catch (AreaAnalysisException e) {
            if (props.isSummaryRequired()) {
                throw e;
            }
            log.warn("Summary enrichment failed for '{}, {}', continuing with empty summary: {}",
                    area, city, e.getMessage());
            return AreaSummary.EMPTY;
        }
    }

    AreaSummary parse(String text) {
        JsonNode json = LlmJson.extractObject(text, objectMapper, STAGE);
        String summary = json.path("summary").asText("");
        return new AreaSummary(summary, rating(json.get("ai_rating")));
    }

    // 숫자 또는 "85" 같은 문자열 둘 다 온다. 그 외는 0
    static int rating(JsonNode node) {
        if (node == null || node.isNull()) return 0;
        if (node.isNumber()) return clampRating(node.asDouble());
        if (node.isTextual()) {
            try {
                return clampRating(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    // int 로 좁히기 전에 0..100 으로 자른다
    private static int clampRating(double value) {
        if (Double.isNaN(value)) return 0;
        return (int) Math.round(Math.max(0.0, Math.min(100.0, value)));
    }
}
