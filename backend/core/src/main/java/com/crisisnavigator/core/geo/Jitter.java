package com.crisisnavigator.core.geo;

/**
 * Deterministic marker offset keyed by event identity. The same key always lands on the same
 * point, so re-ingesting a logical event does not move it. Results are not wrapped into valid
 * latitude/longitude ranges.
 */
public final class Jitter {
    public static final double MAX_OFFSET_DEGREES = 0.25;

    private static final int BUCKETS = 2000;
    private static final double MIN_LONGITUDE_SCALE_COS = 0.5;

    private Jitter() {
    }

    public static GeoPoint apply(double latitude, double longitude, String identityKey) {
        long h = identityHash(identityKey);
        double latOffset = offset(h % BUCKETS);
        double lonOffset = offset((h / BUCKETS) % BUCKETS);
        double cos = Math.max(MIN_LONGITUDE_SCALE_COS, Math.cos(Math.toRadians(latitude)));
        return new GeoPoint(latitude + latOffset, longitude + lonOffset / cos);
    }

    // String.hashCode is the 32-bit h*31+c rolling hash; widen before abs so MIN_VALUE stays positive.
    static long identityHash(String identityKey) {
        return Math.abs((long) identityKey.hashCode());
    }

    private static double offset(long bucket) {
        return ((double) bucket / BUCKETS - 0.5) * (2 * MAX_OFFSET_DEGREES);
    }
}
