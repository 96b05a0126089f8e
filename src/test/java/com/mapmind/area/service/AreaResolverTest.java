package com.mapmind.area.service;

import com.mapmind.area.config.AnalysisProperties;
import com.mapmind.area.config.GeocoderProperties;
import com.mapmind.area.exception.GeocodeException;
import com.mapmind.area.model.BoundingBox;
import com.mapmind.area.model.Coordinate;
import com.mapmind.area.model.ResolvedArea;
import com.mapmind.area.support.StubWebClients;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AreaResolverTest {

    private GeocoderProperties geocoderProps;
    private AnalysisProperties analysisProps;

    @BeforeEach
    void setUp() {
        geocoderProps = new GeocoderProperties();
        geocoderProps.setTimeout(Duration.ofSeconds(2));
        analysisProps = new AnalysisProperties();
    }

    private AreaResolver resolver(String body, StubWebClients.Recorder recorder) {
        return new AreaResolver(StubWebClients.json(HttpStatus.OK, body, recorder), geocoderProps, analysisProps);
    }

    @Test
    void testReordersReportedExtentToWestSouthEastNorth() {
        // Given: Nominatim boundingbox = [south, north, west, east]
        String body = """
                [{"lat":"12.9352","lon":"77.6245","display_name":"Koramangala, Bengaluru, India",
                  "boundingbox":["12.9152","12.9552","77.6045","77.6445"]}]
                """;
        StubWebClients.Recorder recorder = new StubWebClients.Recorder();

        // When
        ResolvedArea area = resolver(body, recorder).resolve("Koramangala", "Bengaluru").block();

        // Then
        assertNotNull(area);
        assertEquals(12.9352, area.coordinate().lat(), 1e-9);
        assertEquals(77.6245, area.coordinate().lon(), 1e-9);
        assertEquals("Koramangala, Bengaluru, India", area.displayName());
        assertEquals(new BoundingBox(77.6045, 12.9152, 77.6445, 12.9552), area.boundingBox());

        String uri = recorder.last().url().toString();
        assertTrue(uri.startsWith("http://upstream.test/search?"), uri);
        assertTrue(uri.contains("format=json"), uri);
        assertTrue(uri.contains("limit=1"), uri);
        assertTrue(uri.contains("Koramangala"), uri);
    }

    @Test
    void testSynthesizesSquareWhenNoExtentReported() {
        String body = "[{\"lat\":\"12.97\",\"lon\":\"77.59\",\"display_name\":\"Bengaluru\"}]";

        ResolvedArea area = resolver(body, null).resolve("Center", "Bengaluru").block();

        assertNotNull(area);
        BoundingBox bbox = area.boundingBox();
        assertEquals(77.59 - 0.009, bbox.west(), 1e-9);
        assertEquals(12.97 - 0.009, bbox.south(), 1e-9);
        assertEquals(77.59 + 0.009, bbox.east(), 1e-9);
        assertEquals(12.97 + 0.009, bbox.north(), 1e-9);
    }

    @Test
    void testNoMatchIsGeocodeError() {
        AreaResolver resolver = resolver("[]", null);

        GeocodeException e = assertThrows(GeocodeException.class,
                () -> resolver.resolve("Nowhere", "Atlantis").block());
        assertTrue(e.getMessage().contains("Could not geocode"));
        assertEquals("geocode", e.getStage());
    }

    @Test
    void testUpstreamFailureIsGeocodeError() {
        AreaResolver resolver = new AreaResolver(
                StubWebClients.json(HttpStatus.SERVICE_UNAVAILABLE, "{}"), geocoderProps, analysisProps);

        GeocodeException e = assertThrows(GeocodeException.class,
                () -> resolver.resolve("Indiranagar", "Bengaluru").block());
        assertTrue(e.getMessage().startsWith("Geocoding failed"));
    }

    @Test
    void testTimeoutIsGeocodeError() {
        geocoderProps.setTimeout(Duration.ofMillis(50));
        AreaResolver resolver = new AreaResolver(StubWebClients.hanging(), geocoderProps, analysisProps);

        assertThrows(GeocodeException.class, () -> resolver.resolve("Indiranagar", "Bengaluru").block());
    }

    @Test
    void testMalformedExtentFallsBackToSquare() {
        Coordinate center = new Coordinate(10.0, 20.0);

        BoundingBox fromGarbage = AreaResolver.toBoundingBox(List.of("a", "b", "c", "d"), center, 0.009);
        BoundingBox fromShort = AreaResolver.toBoundingBox(List.of("1", "2"), center, 0.009);
        BoundingBox fromDegenerate = AreaResolver.toBoundingBox(List.of("10", "10", "20", "20"), center, 0.009);

        BoundingBox expected = BoundingBox.around(center, 0.009);
        assertEquals(expected, fromGarbage);
        assertEquals(expected, fromShort);
        assertEquals(expected, fromDegenerate);
    }
}
