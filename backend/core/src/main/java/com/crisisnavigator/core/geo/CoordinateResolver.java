package com.crisisnavigator.core.geo;

import java.util.Objects;
import java.util.Optional;

public class CoordinateResolver {
    private final CountryCentroids centroids;

    public CoordinateResolver(CountryCentroids centroids) {
        this.centroids = Objects.requireNonNull(centroids, "centroids is required");
    }

    /** Country-level lookup only; an unknown name yields empty, never (0,0). */
    public Optional<GeoPoint> resolve(String locationKey) {
        return centroids.lookup(locationKey);
    }

    public GeoPoint jitter(double latitude, double longitude, String identityKey) {
        return Jitter.apply(latitude, longitude, identityKey);
    }
}
