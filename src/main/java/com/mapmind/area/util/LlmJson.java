package com.mapmind.area.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapmind.area.exception.EnrichmentParseException;

/**
 * 생성형 모델 응답에서 JSON 객체를 꺼내는 유틸.
 * - 첫 '{' 부터 마지막 '}' 까지를 잘라 파싱한다 (앞뒤 설명문, ```json 펜스 무시)
 * - 그런 구간이 없거나 파싱 실패면 EnrichmentParseException
 */
public final class LlmJson {
    private LlmJson() {}

    public static JsonNode extractObject(String text, ObjectMapper mapper, String stage) {
        if (text == null || text.isBlank()) {
            throw new EnrichmentParseException(stage, "Empty response from generative model");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new EnrichmentParseException(stage, "No JSON found in the response");
        }

        JsonNode node;
        try {
            node = mapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new EnrichmentParseException(stage, "Malformed JSON in the response: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new EnrichmentParseException(stage, "Response JSON is not an object");
        }
        return node;
    }
}
