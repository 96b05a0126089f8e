package com.mapmind.area.model;

public record ResolvedArea(
        Coordinate coordinate,
        BoundingBox boundingBox,
        String displayName
) {}
