package com.mapmind.area.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxTest {

    @Test
    void testAroundBuildsFixedSquare() {
        // Given
        Coordinate center = new Coordinate(12.97, 77.59);

        // When
        BoundingBox bbox = BoundingBox.around(center, 0.009);

        // Then
        assertEquals(77.581, bbox.west(), 1e-9);
        assertEquals(12.961, bbox.south(), 1e-9);
        assertEquals(77.599, bbox.east(), 1e-9);
        assertEquals(12.979, bbox.north(), 1e-9);
    }

    @Test
    void testRingIsClosedSwNwNeSe() {
        BoundingBox bbox = new BoundingBox(1.0, 2.0, 3.0, 4.0);

        List<List<Double>> ring = bbox.ring();

        assertEquals(5, ring.size());
        assertEquals(List.of(1.0, 2.0), ring.get(0));
        assertEquals(List.of(1.0, 4.0), ring.get(1));
        assertEquals(List.of(3.0, 4.0), ring.get(2));
        assertEquals(List.of(3.0, 2.0), ring.get(3));
        assertEquals(ring.get(0), ring.get(4));
    }

    @Test
    void testRejectsInvertedEdges() {
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(3.0, 2.0, 1.0, 4.0));
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(1.0, 4.0, 3.0, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(1.0, 2.0, 1.0, 4.0));
    }

    @Test
    void testSerializesAsWestSouthEastNorthArray() throws Exception {
        String json = new ObjectMapper().writeValueAsString(new BoundingBox(1.5, 2.5, 3.5, 4.5));

        assertEquals("[1.5,2.5,3.5,4.5]", json);
    }

    @Test
    void testCoordinateRangeIsEnforced() {
        assertThrows(IllegalArgumentException.class, () -> new Coordinate(91.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new Coordinate(0.0, -180.5));
        assertDoesNotThrow(() -> new Coordinate(-90.0, 180.0));
    }
}
