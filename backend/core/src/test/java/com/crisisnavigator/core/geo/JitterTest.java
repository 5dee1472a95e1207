package com.crisisnavigator.core.geo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitterTest {
    private static final double EPSILON = 1e-9;

    @Test
    void sameKeyAlwaysLandsOnSamePoint() {
        GeoPoint first = Jitter.apply(12.8628, 30.2176, "Cholera outbreak|Sudan");
        GeoPoint second = Jitter.apply(12.8628, 30.2176, "Cholera outbreak|Sudan");

        assertEquals(first, second);
    }

    @Test
    void differentKeysSpreadMarkers() {
        GeoPoint a = Jitter.apply(12.8628, 30.2176, "Cholera outbreak|Sudan");
        GeoPoint b = Jitter.apply(12.8628, 30.2176, "Flash floods|Sudan");

        assertNotEquals(a, b);
    }

    @Test
    void offsetsStayWithinQuarterDegreeBeforeLongitudeScaling() {
        double[] latitudes = {0.0, 12.8628, -33.9, 48.3794, 65.0, 80.0};
        for (double lat : latitudes) {
            double scale = Math.max(0.5, Math.cos(Math.toRadians(lat)));
            for (int i = 0; i < 500; i++) {
                String key = "event-" + i + "|" + lat;
                GeoPoint jittered = Jitter.apply(lat, 10.0, key);

                double dLat = jittered.latitude() - lat;
                double unscaledLon = (jittered.longitude() - 10.0) * scale;
                assertTrue(Math.abs(dLat) <= Jitter.MAX_OFFSET_DEGREES + EPSILON, key + " dLat=" + dLat);
                assertTrue(Math.abs(unscaledLon) <= Jitter.MAX_OFFSET_DEGREES + EPSILON, key + " dLon=" + unscaledLon);
            }
        }
    }

    @Test
    void emptyKeyHashesToZeroAndTakesLowestBucket() {
        GeoPoint jittered = Jitter.apply(0.0, 0.0, "");

        assertEquals(-0.25, jittered.latitude(), EPSILON);
        assertEquals(-0.25, jittered.longitude(), EPSILON);
    }

    @Test
    void longitudeScaleIsCappedAtHighLatitudes() {
        GeoPoint jittered = Jitter.apply(85.0, 0.0, "");

        assertEquals(84.75, jittered.latitude(), EPSILON);
        assertEquals(-0.5, jittered.longitude(), EPSILON);
    }

    @Test
    void minimumHashValueIsWidenedInsteadOfStayingNegative() {
        assertEquals(Integer.MIN_VALUE, "polygenelubricants".hashCode());
        assertEquals(2_147_483_648L, Jitter.identityHash("polygenelubricants"));

        GeoPoint jittered = Jitter.apply(0.0, 0.0, "polygenelubricants");
        assertTrue(Math.abs(jittered.latitude()) <= Jitter.MAX_OFFSET_DEGREES + EPSILON);
        assertTrue(Math.abs(jittered.longitude()) <= Jitter.MAX_OFFSET_DEGREES + EPSILON);
    }
}
