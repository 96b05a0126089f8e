package com.mapmind.area.service;

import com.mapmind.area.dto.response.ChartEntry;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.Coordinate;
import com.mapmind.area.model.PoiKind;
import com.mapmind.area.model.RawPoi;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorTest {

    private final Aggregator aggregator = new Aggregator(new CategoryClassifier());

    private static CategorizedPois pois(String... categories) {
        List<RawPoi> list = new ArrayList<>();
        double lat = 12.9;
        for (String c : categories) {
            list.add(new RawPoi(new Coordinate(lat, 77.6), c, Map.of(), PoiKind.NODE));
            lat += 0.001;
        }
        return CategorizedPois.of(list);
    }

    @Test
    void testCountsPerSuperCategoryInDeclarationOrder() {
        // Given: food 가 가장 많지만 출력은 선언 순서
        CategorizedPois input = pois("cafe", "restaurant", "cafe", "bank", "shop_bakery", "pharmacy");

        // When
        List<ChartEntry> chart = aggregator.aggregate(input);

        // Then
        assertEquals(List.of(
                new ChartEntry("Healthcare", 1, "#0088FE"),
                new ChartEntry("Shopping", 1, "#FFBB28"),
                new ChartEntry("Food & Drink", 3, "#FF8042"),
                new ChartEntry("Financial", 1, "#FF1919")
        ), chart);
    }

    @Test
    void testZeroCountCategoriesAreOmitted() {
        List<ChartEntry> chart = aggregator.aggregate(pois("cafe", "bus_station", "place_of_worship"));

        assertTrue(chart.stream().noneMatch(e -> e.label().equals("Healthcare")));
        assertEquals(List.of("Food & Drink", "Transport", "Other"),
                chart.stream().map(ChartEntry::label).toList());
        assertTrue(chart.stream().allMatch(e -> e.count() > 0));
    }

    @Test
    void testAggregateIsIdempotent() {
        CategorizedPois input = pois("school", "cafe", "atm", "park", "toilets", "office_company");

        List<ChartEntry> first = aggregator.aggregate(input);
        List<ChartEntry> second = aggregator.aggregate(input);

        assertEquals(first, second);
    }

    @Test
    void testEmptyInputGivesEmptyChart() {
        assertTrue(aggregator.aggregate(new CategorizedPois()).isEmpty());
    }

    @Test
    void testTotalMatchesPoiCount() {
        CategorizedPois input = pois("cafe", "cafe", "bank", "leisure_park", "building_yes");

        int total = aggregator.aggregate(input).stream().mapToInt(ChartEntry::count).sum();

        assertEquals(input.totalCount(), total);
    }
}
