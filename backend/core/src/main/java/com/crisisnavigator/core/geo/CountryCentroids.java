package com.crisisnavigator.core.geo;

import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class CountryCentroids {
    public static final String DEFAULT_RESOURCE = "geo/country-centroids.json";

    private final Map<String, GeoPoint> byName;
    private final Map<String, GeoPoint> byNormalizedName;

    public CountryCentroids(Map<String, GeoPoint> centroids) {
        Map<String, GeoPoint> exact = new LinkedHashMap<>();
        Map<String, GeoPoint> normalized = new LinkedHashMap<>();
        centroids.forEach((name, point) -> {
            exact.put(name, point);
            normalized.putIfAbsent(normalize(name), point);
        });
        this.byName = Collections.unmodifiableMap(exact);
        this.byNormalizedName = Collections.unmodifiableMap(normalized);
    }

    public static CountryCentroids loadDefault() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static CountryCentroids fromClasspath(String resource) {
        try (InputStream in = CountryCentroids.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Country centroid table not found on classpath: " + resource);
            }
            List<CentroidEntry> entries = JsonUtils.objectMapper().readValue(in, new TypeReference<List<CentroidEntry>>() {
            });
            Map<String, GeoPoint> centroids = new LinkedHashMap<>();
            for (CentroidEntry entry : entries) {
                centroids.put(entry.name(), new GeoPoint(entry.lat(), entry.lon()));
            }
            return new CountryCentroids(centroids);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read country centroid table " + resource, e);
        }
    }

    public Optional<GeoPoint> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        GeoPoint exact = byName.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(byNormalizedName.get(normalize(name)));
    }

    public int size() {
        return byName.size();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private record CentroidEntry(String name, double lon, double lat) {
    }
}
