package com.polarroute.route.service;

import com.polarroute.route.model.Waypoint;

import java.util.List;
import java.util.Map;

/**
 * Path optimisation over a vessel mesh. Geometries are GeoJSON FeatureCollections whose first
 * feature is a LineString in [lon, lat] order.
 */
public interface RoutePlanner {

    /** Version tag stored on every route this planner produces. */
    String version();

    Map<String, Object> computeUnsmoothed(Map<String, Object> mesh, List<Waypoint> waypoints);

    Map<String, Object> smooth(Map<String, Object> mesh, Map<String, Object> unsmoothed);

    /**
     * Recomputes cumulative per-point {@code traveltime} (days) and {@code fuel} (tonnes)
     * for an existing route on the given mesh.
     */
    Map<String, Object> evaluate(Map<String, Object> mesh, Map<String, Object> route);
}
