package com.mapmind.area.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * raw category → POI 목록.
 * 키 순서 = 처음 등장한 순서, 목록 순서 = 추출 순서. 빈 카테고리는 존재하지 않는다.
 */
public final class CategorizedPois {

    private final Map<String, List<RawPoi>> byCategory = new LinkedHashMap<>();

    public static CategorizedPois of(List<RawPoi> pois) {
        CategorizedPois out = new CategorizedPois();
        pois.forEach(out::add);
        return out;
    }

    public void add(RawPoi poi) {
        byCategory.computeIfAbsent(poi.category(), k -> new ArrayList<>()).add(poi);
    }

    @JsonValue
    public Map<String, List<RawPoi>> asMap() {
        Map<String, List<RawPoi>> view = new LinkedHashMap<>();
        byCategory.forEach((k, v) -> view.put(k, Collections.unmodifiableList(v)));
        return Collections.unmodifiableMap(view);
    }

    public List<RawPoi> get(String category) {
        List<RawPoi> pois = byCategory.get(category);
        return (pois == null) ? List.of() : Collections.unmodifiableList(pois);
    }

    public int totalCount() {
        return byCategory.values().stream().mapToInt(List::size).sum();
    }

    public int categoryCount() {
        return byCategory.size();
    }

    public boolean isEmpty() {
        return byCategory.isEmpty();
    }
}
