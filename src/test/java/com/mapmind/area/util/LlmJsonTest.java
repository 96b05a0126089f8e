package com.mapmind.area.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapmind.area.exception.EnrichmentParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LlmJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testExtractsBetweenFirstAndLastBrace() {
        String text = "Sure! ```json\n{\"summary\":\"Lively {mixed} area\",\"ai_rating\":72}\n``` Hope this helps.";

        JsonNode node = LlmJson.extractObject(text, mapper, "summary-enrichment");

        assertEquals("Lively {mixed} area", node.path("summary").asText());
        assertEquals(72, node.path("ai_rating").asInt());
    }

    @Test
    void testNoBracesIsParseError() {
        EnrichmentParseException e = assertThrows(EnrichmentParseException.class,
                () -> LlmJson.extractObject("no json here", mapper, "geometry-enrichment"));
        assertEquals("geometry-enrichment", e.getStage());
    }

    @Test
    void testReversedBracesIsParseError() {
        assertThrows(EnrichmentParseException.class,
                () -> LlmJson.extractObject("} oops {", mapper, "summary-enrichment"));
    }

    @Test
    void testMalformedJsonIsParseError() {
        assertThrows(EnrichmentParseException.class,
                () -> LlmJson.extractObject("{\"summary\": \"unterminated}", mapper, "summary-enrichment"));
    }

    @Test
    void testBlankIsParseError() {
        assertThrows(EnrichmentParseException.class, () -> LlmJson.extractObject("  ", mapper, "s"));
        assertThrows(EnrichmentParseException.class, () -> LlmJson.extractObject(null, mapper, "s"));
    }
}
