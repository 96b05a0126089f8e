package com.mapmind.area.service.geometry;

import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.geojson.Feature;
import com.mapmind.area.model.geojson.FeatureCollection;
import com.mapmind.area.model.geojson.Geometry;
import com.mapmind.area.service.CategoryClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeterministicGeometryBuilderTest {

    private final DeterministicGeometryBuilder builder = new DeterministicGeometryBuilder(new CategoryClassifier());

    @Test
    void testBuildsBoundaryThenOnePointPerPoi() {
        // Given
        CategorizedPois pois = GeometryFixtures.samplePois();

        // When
        FeatureCollection doc = builder.build("Koramangala", "Bengaluru", pois,
                GeometryFixtures.BBOX, ColorMode.SUPER_CATEGORY);

        // Then
        assertEquals("FeatureCollection", doc.type());
        assertEquals(4, doc.features().size());
        assertEquals(1, doc.boundaryCount());
        assertEquals(3, doc.poiCount());
        assertTrue(doc.features().get(0).isBoundary());
    }

    @Test
    void testBoundaryStyleAndRing() {
        Feature boundary = builder.boundary("Koramangala", "Bengaluru", GeometryFixtures.BBOX);

        assertEquals(Geometry.POLYGON, boundary.geometry().type());
        assertEquals(List.of(GeometryFixtures.BBOX.ring()), boundary.geometry().coordinates());

        Map<String, Object> props = boundary.properties();
        assertEquals("boundary", props.get("type"));
        assertEquals("Koramangala, Bengaluru", props.get("name"));
        assertEquals("#0070f3", props.get("fillColor"));
        assertEquals(0.2, props.get("fillOpacity"));
        assertEquals("#0070f3", props.get("strokeColor"));
        assertEquals(2, props.get("strokeWidth"));
    }

    @Test
    void testSuperCategoryModeProperties() {
        FeatureCollection doc = builder.build("A", "B", GeometryFixtures.samplePois(),
                GeometryFixtures.BBOX, ColorMode.SUPER_CATEGORY);

        Feature brew = doc.features().get(1);
        assertEquals(List.of(77.591, 12.971), brew.geometry().coordinates());
        assertEquals("poi", brew.properties().get("type"));
        assertEquals("food_drink", brew.properties().get("super_category"));
        assertEquals("Food & Drink", brew.properties().get("display_name"));
        assertEquals("cafe", brew.properties().get("category"));
        assertEquals("Brew", brew.properties().get("name"));
        assertEquals("#FF8042", brew.properties().get("color"));

        // 이름 없는 cafe → raw category 로 대체
        Feature unnamedCafe = doc.features().get(2);
        assertEquals("cafe", unnamedCafe.properties().get("name"));

        Feature bakery = doc.features().get(3);
        assertEquals("shopping", bakery.properties().get("super_category"));
        assertEquals("#FFBB28", bakery.properties().get("color"));
    }

    @Test
    void testRawCategoryModeProperties() {
        FeatureCollection doc = builder.build("A", "B", GeometryFixtures.samplePois(),
                GeometryFixtures.BBOX, ColorMode.RAW_CATEGORY);

        Feature cafe = doc.features().get(1);
        Feature bakery = doc.features().get(3);
        assertEquals("#0088FE", cafe.properties().get("color"));
        assertEquals("#00C49F", bakery.properties().get("color"));
        assertFalse(cafe.properties().containsKey("super_category"));
        assertEquals("shop_bakery", bakery.properties().get("name"));
    }

    @Test
    void testPoisOnlyHasNoBoundary() {
        FeatureCollection doc = builder.poisOnly(GeometryFixtures.samplePois());

        assertEquals(0, doc.boundaryCount());
        assertEquals(3, doc.poiCount());
    }

    @Test
    void testEmptyPoisStillHasBoundary() {
        FeatureCollection doc = builder.build("A", "B", new CategorizedPois(),
                GeometryFixtures.BBOX, ColorMode.SUPER_CATEGORY);

        assertEquals(1, doc.features().size());
        assertEquals(1, doc.boundaryCount());
    }
}
