package com.mapmind.area.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 차트/지도에서 공통으로 쓰는 상위 카테고리.
 * 선언 순서가 곧 분류 우선순위이자 차트 출력 순서다. 순서 바꾸지 말 것.
 */
public enum SuperCategory {
    HEALTHCARE("healthcare", "Healthcare", "#0088FE"),
    EDUCATION("education", "Education", "#00C49F"),
    SHOPPING("shopping", "Shopping", "#FFBB28"),
    FOOD_DRINK("food_drink", "Food & Drink", "#FF8042"),
    TRANSPORT("transport", "Transport", "#AF19FF"),
    FINANCIAL("financial", "Financial", "#FF1919"),
    LEISURE("leisure", "Leisure", "#17BECF"),
    OFFICE("office", "Office", "#9467BD"),
    COMMUNITY("community", "Community", "#D62728"),
    OTHER("other", "Other", "#7F7F7F");

    private final String key;
    private final String displayName;
    private final String color;

    SuperCategory(String key, String displayName, String color) {
        this.key = key;
        this.displayName = displayName;
        this.color = color;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public String color() {
        return color;
    }
}
