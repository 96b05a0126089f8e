package com.mapmind.area.service.geometry;

import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.SuperCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 두 가지 색 지정 함수. 팔레트도 순서도 서로 달라서 합치지 않는다.
 */
public final class FeatureColors {
    private FeatureColors() {}

    public static final List<String> RAW_CATEGORY_PALETTE = List.of(
            "#0088FE", "#00C49F", "#FFBB28", "#FF8042", "#AF19FF", "#FF1919"
    );

    /**
     * raw category 등장 순서대로 팔레트를 돌려가며 배정.
     * 같은 입력이면 항상 같은 결과지만, 요청마다 카테고리 구성이 다르면 색도 달라진다.
     */
    public static Map<String, String> byRawCategory(CategorizedPois pois) {
        Map<String, String> colors = new LinkedHashMap<>();
        int i = 0;
        for (String category : pois.asMap().keySet()) {
            colors.put(category, RAW_CATEGORY_PALETTE.get(i % RAW_CATEGORY_PALETTE.size()));
            i++;
        }
        return colors;
    }

    /** 상위 카테고리 고정색. 요청과 무관하게 항상 같다 */
    public static String bySuperCategory(SuperCategory superCategory) {
        return superCategory.color();
    }
}
