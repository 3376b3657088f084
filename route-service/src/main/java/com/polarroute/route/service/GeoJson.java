package com.polarroute.route.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Accessors for route FeatureCollections. Only the first feature is read.
 */
final class GeoJson {

    private GeoJson() {}

    @SuppressWarnings("unchecked")
    static Map<String, Object> firstFeature(Map<String, Object> collection) {
        Object features = collection == null ? null : collection.get("features");
        if (!(features instanceof List) || ((List<?>) features).isEmpty()
                || !(((List<?>) features).get(0) instanceof Map)) {
            throw new IllegalArgumentException("Route must be a FeatureCollection with at least one feature");
        }
        return (Map<String, Object>) ((List<?>) features).get(0);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> geometry(Map<String, Object> collection) {
        Object geometry = firstFeature(collection).get("geometry");
        if (!(geometry instanceof Map)) {
            throw new IllegalArgumentException("Route feature has no geometry");
        }
        return (Map<String, Object>) geometry;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> properties(Map<String, Object> collection) {
        Object properties = firstFeature(collection).get("properties");
        return properties instanceof Map ? (Map<String, Object>) properties : Map.of();
    }

    /** LineString coordinates as [lon, lat] pairs. */
    static List<List<Double>> coordinates(Map<String, Object> collection) {
        Object coordinates = geometry(collection).get("coordinates");
        if (!(coordinates instanceof List) || ((List<?>) coordinates).size() < 2) {
            throw new IllegalArgumentException("Route geometry needs at least two coordinates");
        }
        List<List<Double>> result = new ArrayList<>();
        for (Object point : (List<?>) coordinates) {
            if (!(point instanceof List) || ((List<?>) point).size() < 2) {
                throw new IllegalArgumentException("Malformed coordinate: " + point);
            }
            List<?> pair = (List<?>) point;
            result.add(List.of(((Number) pair.get(0)).doubleValue(), ((Number) pair.get(1)).doubleValue()));
        }
        return result;
    }

    /** Last element of a numeric per-point property such as traveltime or fuel. */
    static double lastValue(Map<String, Object> collection, String property) {
        Object values = properties(collection).get(property);
        if (!(values instanceof List) || ((List<?>) values).isEmpty()) {
            throw new IllegalArgumentException("Evaluated route has no '" + property + "' values");
        }
        List<?> list = (List<?>) values;
        return ((Number) list.get(list.size() - 1)).doubleValue();
    }
}
