package com.crisisnavigator.core.geo;

public record GeoPoint(double latitude, double longitude) {
    public static boolean isUsable(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude);
    }
}
