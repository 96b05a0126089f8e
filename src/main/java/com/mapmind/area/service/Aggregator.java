package com.mapmind.area.service;

import com.mapmind.area.dto.response.ChartEntry;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.SuperCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 상위 카테고리별 POI 수 → 파이 차트 데이터.
 * 0건 카테고리는 빼고, 순서는 SuperCategory 선언 순서 (개수 내림차순 아님).
 */
@Component
@RequiredArgsConstructor
public class Aggregator {

    private final CategoryClassifier classifier;

    public List<ChartEntry> aggregate(CategorizedPois pois) {
        Map<SuperCategory, Integer> counts = new EnumMap<>(SuperCategory.class);
        pois.asMap().forEach((rawCategory, list) -> {
            if (list.isEmpty()) return;
            counts.merge(classifier.classify(rawCategory), list.size(), Integer::sum);
        });

        List<ChartEntry> entries = new ArrayList<>();
        for (SuperCategory sc : SuperCategory.values()) {
            int count = counts.getOrDefault(sc, 0);
            if (count > 0) {
                entries.add(new ChartEntry(sc.displayName(), count, sc.color()));
            }
        }
        return entries;
    }
}
