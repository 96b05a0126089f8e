package com.mapmind.area.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapmind.area.model.BoundingBox;
import com.mapmind.area.model.CategorizedPois;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AreaPrompts {

    private static final String SUMMARY_TEMPLATE = """
            Imagine you're a local resident giving a friendly, conversational tour of %1$s, %2$s.
            Create an engaging summary that covers:

            1. The neighborhood's vibe and lifestyle (based on the POIs)
            2. What makes this area special for a 15-minute city concept
            3. What daily life might look like here
            4. Any unique features or interesting combinations of amenities

            Use a conversational, first-person tone as if you're talking to a friend.
            Include specific references to the POIs and their distribution:
            %3$s

            Make it personal and relatable, mentioning real scenarios like:
            - Morning coffee runs
            - Weekend activities
            - Daily conveniences
            - Community spots

            Keep it concise but engaging, around 3-4 sentences.

            Provide a structured JSON response with the following keys:
            - "summary": (in simple text, *NOT in JSON*) A concise summary of the living potential of the area, highlighting the strengths and weaknesses in each super-category.
            - "ai_rating": A numerical rating from 0 to 100 representing how well this area functions as a "15-minute city" where residents can access most daily needs within a 15-minute walk or bike ride.

            IMPORTANT: Only return the raw JSON, no additional text or explanations. The response must start with '{' and end with '}'.
            """;

    private static final String GEOMETRY_TEMPLATE = """
            Create a complete GeoJSON FeatureCollection for %1$s, %2$s that includes:

            1. A boundary polygon feature with these properties:
               - type: "boundary"
               - name: "%1$s, %2$s"
               - fillColor: "#0070f3"
               - fillOpacity: 0.2
               - strokeColor: "#0070f3"
               - strokeWidth: 2

            2. Point features for each POI in this data:
            %3$s

            The boundary should be a simple polygon that covers the bounding box: %4$s
            [west, south, east, north] = %4$s

            Each POI should have these properties:
            - type: "poi"
            - category: (the POI category)
            - name: (the POI name if available, otherwise use the category)
            - color: (assign a unique color to each category)

            Return ONLY valid GeoJSON with no additional text or explanations.
            The response must be a complete, valid GeoJSON FeatureCollection.
            """;

    private final ObjectMapper objectMapper;

    public String summary(String area, String city, CategorizedPois pois) {
        return SUMMARY_TEMPLATE.formatted(area, city, toJson(pois));
    }

    public String geometry(String area, String city, CategorizedPois pois, BoundingBox bbox) {
        return GEOMETRY_TEMPLATE.formatted(area, city, toJson(pois), toJson(bbox));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // 우리 모델 객체라 실패할 일이 없다
            throw new IllegalStateException("Cannot serialize prompt payload", e);
        }
    }
}
