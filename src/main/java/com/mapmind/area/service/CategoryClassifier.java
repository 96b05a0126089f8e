package com.mapmind.area.service;

import com.mapmind.area.model.SuperCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * raw category → 상위 카테고리.
 *
 * 규칙 테이블을 위에서부터 평가하고 첫 번째 매칭이 이긴다 (부분 문자열, 대소문자 무시).
 * 두 카테고리 패턴에 동시에 걸리면 항상 먼저 선언된 쪽이다. OTHER 는 패턴이 없고 기본값.
 */
@Component
public class CategoryClassifier {

    public record ClassificationRule(SuperCategory target, List<String> keywords) {

        public ClassificationRule {
            keywords = List.copyOf(keywords);
        }

        boolean matches(String lowerRawCategory) {
            for (String keyword : keywords) {
                if (lowerRawCategory.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }
    }

    // SuperCategory 선언 순서와 동일해야 한다
    private static final List<ClassificationRule> RULES = List.of(
            new ClassificationRule(SuperCategory.HEALTHCARE,
                    List.of("hospital", "healthcare", "doctors", "pharmacy", "blood_bank", "optometrist", "alternative")),
            new ClassificationRule(SuperCategory.EDUCATION,
                    List.of("school", "college", "university", "kindergarten", "training", "language_school", "education")),
            new ClassificationRule(SuperCategory.SHOPPING,
                    List.of("shop", "supermarket", "mall", "market", "bakery", "convenience")),
            new ClassificationRule(SuperCategory.FOOD_DRINK,
                    List.of("restaurant", "cafe", "pub", "bar", "fast_food", "food_court", "ice_cream")),
            new ClassificationRule(SuperCategory.TRANSPORT,
                    List.of("bus", "train", "station", "taxi", "parking", "transport")),
            new ClassificationRule(SuperCategory.FINANCIAL,
                    List.of("bank", "atm", "money", "financial", "insurance")),
            new ClassificationRule(SuperCategory.LEISURE,
                    List.of("leisure", "park", "garden", "playground", "swimming", "sports", "pitch", "track")),
            new ClassificationRule(SuperCategory.OFFICE,
                    List.of("office", "administrative", "government", "estate_agent", "tax", "telecommunication")),
            new ClassificationRule(SuperCategory.COMMUNITY,
                    List.of("community", "social", "public", "toilets", "drinking_water", "bench", "library")),
            new ClassificationRule(SuperCategory.OTHER, List.of())
    );

    public SuperCategory classify(String rawCategory) {
        if (rawCategory == null || rawCategory.isEmpty()) {
            return SuperCategory.OTHER;
        }
        String lower = rawCategory.toLowerCase(Locale.ROOT);
        for (ClassificationRule rule : RULES) {
            if (rule.matches(lower)) {
                return rule.target();
            }
        }
        return SuperCategory.OTHER;
    }

    public List<ClassificationRule> rules() {
        return RULES;
    }
}
