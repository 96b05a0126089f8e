package com.mapmind.area.service.geometry;

import com.mapmind.area.model.BoundingBox;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.RawPoi;
import com.mapmind.area.model.SuperCategory;
import com.mapmind.area.model.geojson.Feature;
import com.mapmind.area.model.geojson.FeatureCollection;
import com.mapmind.area.model.geojson.Geometry;
import com.mapmind.area.service.CategoryClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 외부 호출 없이 항상 같은 GeoJSON 을 만드는 경로.
 * 생성형 보강이 꺼져 있거나 실패했을 때 이 결과가 그대로 나간다.
 */
@Component
@RequiredArgsConstructor
public class DeterministicGeometryBuilder {

    public static final String BOUNDARY_COLOR = "#0070f3";
    public static final double BOUNDARY_FILL_OPACITY = 0.2;
    public static final int BOUNDARY_STROKE_WIDTH = 2;

    private final CategoryClassifier classifier;

    /** 경계 폴리곤 1개 + POI 포인트 전부 */
    public FeatureCollection build(String area, String city, CategorizedPois pois,
                                   BoundingBox bbox, ColorMode colorMode) {
        List<Feature> features = new ArrayList<>(pois.totalCount() + 1);
        features.add(boundary(area, city, bbox));
        features.addAll(poiFeatures(pois, colorMode));
        return FeatureCollection.of(features);
    }

    /** 분석 응답용: 경계 없이 POI 포인트만 (상위 카테고리 색) */
    public FeatureCollection poisOnly(CategorizedPois pois) {
        return FeatureCollection.of(poiFeatures(pois, ColorMode.SUPER_CATEGORY));
    }

    public Feature boundary(String area, String city, BoundingBox bbox) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("type", Feature.KIND_BOUNDARY);
        props.put("name", area + ", " + city);
        props.put("fillColor", BOUNDARY_COLOR);
        props.put("fillOpacity", BOUNDARY_FILL_OPACITY);
        props.put("strokeColor", BOUNDARY_COLOR);
        props.put("strokeWidth", BOUNDARY_STROKE_WIDTH);
        return Feature.of(Geometry.polygon(bbox.ring()), props);
    }

    List<Feature> poiFeatures(CategorizedPois pois, ColorMode colorMode) {
        Map<String, String> rawColors = (colorMode == ColorMode.RAW_CATEGORY)
                ? FeatureColors.byRawCategory(pois)
                : Map.of();

        List<Feature> features = new ArrayList<>(pois.totalCount());
        pois.asMap().forEach((category, list) -> {
            for (RawPoi poi : list) {
                Map<String, Object> props = new LinkedHashMap<>();
                props.put("type", Feature.KIND_POI);
                if (colorMode == ColorMode.SUPER_CATEGORY) {
                    SuperCategory sc = classifier.classify(category);
                    props.put("super_category", sc.key());
                    props.put("display_name", sc.displayName());
                    props.put("category", category);
                    props.put("name", poi.nameOr(category));
                    props.put("color", FeatureColors.bySuperCategory(sc));
                } else {
                    props.put("category", category);
                    props.put("name", poi.nameOr(category));
                    props.put("color", rawColors.get(category));
                }
                features.add(Feature.of(Geometry.point(poi.lon(), poi.lat()), props));
            }
        });
        return features;
    }
}
